package io.github.sigwasm.core.analysis;

import org.jetbrains.annotations.Nullable;

import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * The result of analyzing a component: its signals, handlers and bindings,
 * and the identity maps tracing accessors back to signals.
 */
public final class ComponentAnalysis {
    private final List<AnalyzedSignal> signals;
    private final List<AnalyzedHandler> handlers;
    private final List<Binding> bindings;
    private final List<InputBinding> inputBindings;
    private final List<ShowBinding> showBindings;
    private final List<ThemeBinding> themeBindings;
    private final Object root;
    private final String html;
    private final Map<Object, Long> getterIds;
    private final Map<Object, Long> setterIds;

    ComponentAnalysis(
            List<AnalyzedSignal> signals,
            List<AnalyzedHandler> handlers,
            List<Binding> bindings,
            List<InputBinding> inputBindings,
            List<ShowBinding> showBindings,
            List<ThemeBinding> themeBindings,
            Object root,
            String html,
            Map<Object, Long> getterIds,
            Map<Object, Long> setterIds
    ) {
        this.signals = Collections.unmodifiableList(signals);
        this.handlers = Collections.unmodifiableList(handlers);
        this.bindings = Collections.unmodifiableList(bindings);
        this.inputBindings = Collections.unmodifiableList(inputBindings);
        this.showBindings = Collections.unmodifiableList(showBindings);
        this.themeBindings = Collections.unmodifiableList(themeBindings);
        this.root = root;
        this.html = html;
        this.getterIds = Collections.unmodifiableMap(getterIds);
        this.setterIds = Collections.unmodifiableMap(setterIds);
    }

    /**
     * Get the signals of the component, in creation order.
     *
     * @return The signals.
     */
    public List<AnalyzedSignal> getSignals() {
        return signals;
    }

    @Nullable
    public AnalyzedSignal getSignal(long id) {
        for (AnalyzedSignal signal : signals) {
            if (signal.id == id) return signal;
        }
        return null;
    }

    public List<AnalyzedHandler> getHandlers() {
        return handlers;
    }

    public List<Binding> getBindings() {
        return bindings;
    }

    public List<InputBinding> getInputBindings() {
        return inputBindings;
    }

    public List<ShowBinding> getShowBindings() {
        return showBindings;
    }

    public List<ThemeBinding> getThemeBindings() {
        return themeBindings;
    }

    /**
     * Get the output tree of the dry run.
     *
     * @return The tree.
     */
    public Object getRoot() {
        return root;
    }

    /**
     * Get the output rendered as HTML, with element keys in {@code data-hk} attributes.
     *
     * @return The HTML.
     */
    public String getHtml() {
        return html;
    }

    /**
     * Find the signal a getter belongs to, by identity.
     *
     * @param value Any value.
     * @return The signal id, or null if {@code value} is not a getter of this component's signals.
     */
    @Nullable
    public Long getterId(Object value) {
        return getterIds.get(value);
    }

    /**
     * Find the signal a setter belongs to, by identity.
     *
     * @param value Any value.
     * @return The signal id, or null if {@code value} is not a setter of this component's signals.
     */
    @Nullable
    public Long setterId(Object value) {
        return setterIds.get(value);
    }
}
