package io.github.sigwasm.core.assemble;

import io.github.sigwasm.core.analysis.Binding;
import io.github.sigwasm.core.analysis.ComponentAnalysis;
import io.github.sigwasm.core.analysis.ShowBinding;
import io.github.sigwasm.core.analysis.ThemeBinding;

import java.util.*;

/**
 * The DOM updates each signal triggers: its text and attribute bindings, then its show bindings,
 * then its theme binding.
 */
public final class DomUpdateTable {
    private final Map<Long, List<DomUpdate>> updates = new HashMap<>();
    private final List<String> attributeNames = new ArrayList<>();

    public DomUpdateTable(ComponentAnalysis analysis) {
        for (Binding binding : analysis.getBindings()) {
            if (binding.isText()) {
                add(new DomUpdate(DomUpdate.Kind.TEXT, binding.signalId, binding.elementKey, -1));
            } else {
                add(new DomUpdate(DomUpdate.Kind.ATTR, binding.signalId, binding.elementKey,
                        attributeIndex(binding.attribute)));
            }
        }
        for (ShowBinding show : analysis.getShowBindings()) {
            add(new DomUpdate(DomUpdate.Kind.VISIBLE, show.signalId, show.elementKey, -1));
        }
        for (ThemeBinding theme : analysis.getThemeBindings()) {
            add(new DomUpdate(DomUpdate.Kind.THEME, theme.signalId, 0, -1));
        }
    }

    private void add(DomUpdate update) {
        updates.computeIfAbsent(update.signalId, k -> new ArrayList<>()).add(update);
    }

    private int attributeIndex(String name) {
        int index = attributeNames.indexOf(name);
        if (index < 0) {
            index = attributeNames.size();
            attributeNames.add(name);
        }
        return index;
    }

    /**
     * Get the updates a signal triggers.
     *
     * @param signalId The signal.
     * @return The updates, in order.
     */
    public List<DomUpdate> updatesOf(long signalId) {
        List<DomUpdate> list = updates.get(signalId);
        return list == null ? Collections.emptyList() : Collections.unmodifiableList(list);
    }

    /**
     * Get the attribute table, which {@code update_attr} calls index into.
     *
     * @return The attribute names.
     */
    public List<String> getAttributeNames() {
        return Collections.unmodifiableList(attributeNames);
    }
}
