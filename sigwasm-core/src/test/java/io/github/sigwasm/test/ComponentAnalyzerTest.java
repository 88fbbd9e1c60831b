package io.github.sigwasm.test;

import io.github.sigwasm.core.analysis.*;
import io.github.sigwasm.core.dom.Component;
import io.github.sigwasm.core.signal.BoolSignal;
import io.github.sigwasm.core.signal.IntSignal;
import io.github.sigwasm.core.signal.SignalType;
import io.github.sigwasm.core.signal.Signals;
import io.github.sigwasm.core.ops.SemanticExtractor;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import static io.github.sigwasm.core.dom.Html.*;
import static org.junit.jupiter.api.Assertions.*;

public class ComponentAnalyzerTest {
    static Object page(Signals signals) {
        IntSignal count = signals.intSignal(3);
        IntSignal.Getter value = count.getter();
        IntSignal.Setter setValue = count.setter();
        BoolSignal dark = signals.boolSignal(false);
        BoolSignal.Getter isDark = dark.getter();
        BoolSignal.Setter setDark = dark.setter();
        return div(
                darkMode(isDark),
                h1("Counter"),
                p(attr("data-count", value), "Count: ", value),
                button(onClick(() -> setValue.set(value.get() + 1)), "+"),
                input(attr("type", "number"), onInput(setValue)),
                show(isDark, span("dark")),
                fragment(
                        button(onClick(() -> setDark.set(!isDark.get())), "theme")
                )
        );
    }

    private static List<Integer> keysOf(String html) {
        List<Integer> keys = new ArrayList<>();
        Matcher m = Pattern.compile("data-hk=\"(\\d+)\"").matcher(html);
        while (m.find()) keys.add(Integer.parseInt(m.group(1)));
        return keys;
    }

    @Test
    void testSignals() {
        ComponentAnalysis analysis = ComponentAnalyzer.INSTANCE.run(ComponentAnalyzerTest::page);
        List<AnalyzedSignal> signals = analysis.getSignals();
        assertEquals(2, signals.size());
        assertEquals(1, signals.get(0).id);
        assertEquals(SignalType.I32, signals.get(0).type);
        assertEquals(3, signals.get(0).initialNumber().intValue());
        assertEquals(2, signals.get(1).id);
        assertEquals(SignalType.BOOL, signals.get(1).type);
        assertEquals(0, signals.get(1).initialNumber().intValue());
    }

    @Test
    void testKeysMatchHtml() {
        ComponentAnalysis analysis = ComponentAnalyzer.INSTANCE.run(ComponentAnalyzerTest::page);
        // div, h1, p, button, input, show, span, button
        assertEquals(Arrays.asList(1, 2, 3, 4, 5, 6, 7, 8), keysOf(analysis.getHtml()));

        assertEquals(Arrays.asList(
                new Binding(1, 3, "data-count"),
                new Binding(1, 3, null)
        ), analysis.getBindings());
        assertEquals(2, analysis.getHandlers().size());
        AnalyzedHandler increment = analysis.getHandlers().get(0);
        assertEquals(1, increment.id);
        assertEquals(4, increment.elementKey);
        assertEquals("click", increment.event());
        AnalyzedHandler theme = analysis.getHandlers().get(1);
        assertEquals(3, theme.id);
        assertEquals(8, theme.elementKey);

        assertEquals(Arrays.asList(new InputBinding(1, 5, 2, "number")), analysis.getInputBindings());
        assertEquals(Arrays.asList(new ShowBinding(2, 6, false)), analysis.getShowBindings());
        assertEquals(Arrays.asList(new ThemeBinding(2)), analysis.getThemeBindings());
    }

    @Test
    void testInitialValuesRendered() {
        String html = ComponentAnalyzer.INSTANCE.run(ComponentAnalyzerTest::page).getHtml();
        assertTrue(html.contains("Count: 3"), html);
        assertTrue(html.contains("style=\"display:none\""), html);
    }

    @Test
    void testSessionsAreIndependent() {
        Component component = ComponentAnalyzerTest::page;
        ComponentAnalysis first = ComponentAnalyzer.INSTANCE.run(component);
        ComponentAnalysis second = ComponentAnalyzer.INSTANCE.run(component);
        assertEquals(first.getSignals().size(), second.getSignals().size());
        assertEquals(1, second.getSignals().get(0).id);
        assertNotSame(first.getHandlers().get(0).closure, second.getHandlers().get(0).closure);
    }

    @Test
    void testIgnoresPlainValues() {
        ComponentAnalysis analysis = ComponentAnalyzer.INSTANCE.run(signals ->
                div(attr("class", "static"), "text", 42, ul(li("a"), li("b"))));
        assertTrue(analysis.getSignals().isEmpty());
        assertTrue(analysis.getBindings().isEmpty());
        assertTrue(analysis.getHandlers().isEmpty());
        assertEquals(Arrays.asList(1, 2, 3, 4), keysOf(analysis.getHtml()));
    }

    @Test
    void testStageSummariesStayOutOfTestOutput() {
        // op listings are logged at debug, which the test logging setup leaves off
        assertFalse(LoggerFactory.getLogger(SemanticExtractor.class).isDebugEnabled());
        assertTrue(LoggerFactory.getLogger(ComponentAnalyzer.class).isInfoEnabled());
    }
}
