package io.github.sigwasm.core.analysis;

import io.github.sigwasm.core.dom.*;
import io.github.sigwasm.core.passes.IRPass;
import io.github.sigwasm.core.signal.AnalysisSession;
import io.github.sigwasm.core.signal.Signal;
import io.github.sigwasm.core.signal.SignalAccessor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Discovers the signals, handlers and bindings of a component by running it once.
 * <p>
 * The component is rendered in a fresh {@link AnalysisSession}, and its output is walked with the same
 * {@link TreeWalker} as {@link HtmlRenderer} uses, so element keys always agree with the rendered
 * {@code data-hk} attributes. Properties are interpreted as follows:
 * <ul>
 *     <li>{@code on_*} holding a function is a handler, except that {@code on_input} on an {@code input}
 *     holding a setter is an {@link InputBinding}. Both share one id counter, in walk order.</li>
 *     <li>{@code dark_mode} holding a getter is a {@link ThemeBinding}, at most one per signal.</li>
 *     <li>Any other property holding a getter is an attribute {@link Binding}.</li>
 * </ul>
 * A getter as a child is a text binding of the enclosing element, and a {@link Show} conditioned on a getter
 * is a {@link ShowBinding}. Anything else is ignored.
 */
public class ComponentAnalyzer implements IRPass<Component, ComponentAnalysis> {
    private static final Logger LOGGER = LoggerFactory.getLogger(ComponentAnalyzer.class);

    public static final ComponentAnalyzer INSTANCE = new ComponentAnalyzer();

    @Override
    public ComponentAnalysis run(Component component) {
        return analyze(component);
    }

    /**
     * Analyze a component.
     *
     * @param component The component.
     * @return The analysis.
     */
    public ComponentAnalysis analyze(Component component) {
        AnalysisSession session = new AnalysisSession();
        Walk walk = new Walk(session);
        Object root;
        String html;
        try {
            root = component.render(session);
            TreeWalker.walk(root, walk);
            html = HtmlRenderer.render(root);
        } finally {
            session.close();
        }

        List<AnalyzedSignal> signals = new ArrayList<>();
        Map<Object, Long> getterIds = new IdentityHashMap<>();
        Map<Object, Long> setterIds = new IdentityHashMap<>();
        for (Signal signal : session.listSignals()) {
            signals.add(AnalyzedSignal.of(signal));
            getterIds.put(signal.getter(), signal.getId());
            setterIds.put(signal.setter(), signal.getId());
        }

        LOGGER.debug("analyzed component: {} signals, {} handlers, {} bindings, {} input bindings, "
                        + "{} show bindings, {} theme bindings",
                signals.size(), walk.handlers.size(), walk.bindings.size(), walk.inputBindings.size(),
                walk.showBindings.size(), walk.themeBindings.size());

        return new ComponentAnalysis(
                signals,
                walk.handlers,
                walk.bindings,
                walk.inputBindings,
                walk.showBindings,
                new ArrayList<>(walk.themeBindings),
                root,
                html,
                getterIds,
                setterIds
        );
    }

    private static boolean isFunction(Object value) {
        return value instanceof Handler
                || value instanceof Runnable
                || value instanceof SignalAccessor;
    }

    private static class Walk implements TreeWalker.Visitor {
        final AnalysisSession session;
        final List<AnalyzedHandler> handlers = new ArrayList<>();
        final List<Binding> bindings = new ArrayList<>();
        final List<InputBinding> inputBindings = new ArrayList<>();
        final List<ShowBinding> showBindings = new ArrayList<>();
        final Set<ThemeBinding> themeBindings = new LinkedHashSet<>();
        int handlerCounter = 0;

        Walk(AnalysisSession session) {
            this.session = session;
        }

        @Override
        public void visitElement(Element element, int key) {
            boolean isInput = element.getTag().equals("input");
            Object type = element.getProp("type");
            String valueKind = type instanceof String ? (String) type : "text";

            for (Map.Entry<String, Object> prop : element.getProps().entrySet()) {
                String name = prop.getKey();
                Object value = prop.getValue();
                if (name.startsWith("on_")) {
                    if (!isFunction(value)) continue;
                    Signal setterOf = session.setterOf(value);
                    if (isInput && name.equals("on_input") && setterOf != null) {
                        inputBindings.add(new InputBinding(setterOf.getId(), key, ++handlerCounter, valueKind));
                    } else {
                        handlers.add(new AnalyzedHandler(++handlerCounter, name, key, value));
                    }
                } else if (name.equals("dark_mode")) {
                    Signal getterOf = session.getterOf(value);
                    if (getterOf != null) {
                        themeBindings.add(new ThemeBinding(getterOf.getId()));
                    }
                } else {
                    Signal getterOf = session.getterOf(value);
                    if (getterOf != null) {
                        bindings.add(new Binding(getterOf.getId(), key, name));
                    }
                }
            }
        }

        @Override
        public void visitShow(Show show, int key) {
            Signal getterOf = session.getterOf(show.getCondition());
            if (getterOf != null) {
                showBindings.add(new ShowBinding(getterOf.getId(), key, show.isInitialVisible()));
            }
        }

        @Override
        public void visitLeaf(Object value, int parentKey) {
            Signal getterOf = session.getterOf(value);
            if (getterOf == null) return;
            if (parentKey == 0) {
                LOGGER.debug("ignoring {} outside of any element", getterOf);
                return;
            }
            bindings.add(new Binding(getterOf.getId(), parentKey, null));
        }
    }
}
