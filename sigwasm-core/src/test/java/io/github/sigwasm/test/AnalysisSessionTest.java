package io.github.sigwasm.test;

import io.github.sigwasm.core.signal.*;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class AnalysisSessionTest {
    @Test
    void testIdsAndIdentity() {
        AnalysisSession session = new AnalysisSession();
        IntSignal count = session.intSignal(3);
        BoolSignal flag = session.boolSignal(true);
        DoubleSignal ratio = session.doubleSignal(0.5);

        assertEquals(1, count.getId());
        assertEquals(2, flag.getId());
        assertEquals(3, ratio.getId());
        assertEquals(SignalType.I32, count.getType());
        assertEquals(SignalType.BOOL, flag.getType());

        assertEquals(3, session.listSignals().size());
        assertSame(count, session.listSignals().get(0));
        assertSame(count.getter(), count.getter());

        assertEquals(Long.valueOf(1), session.identityOf(count.getter()));
        assertEquals(Long.valueOf(2), session.identityOf(flag.setter()));
        assertSame(ratio, session.getterOf(ratio.getter()));
        assertNull(session.getterOf(ratio.setter()));

        // an equivalent lambda is not the recorded accessor
        IntSignal.Getter lookalike = () -> 3;
        assertNull(session.identityOf(lookalike));
        assertNull(session.identityOf(3));
    }

    @Test
    void testSessionsAreSeparate() {
        AnalysisSession first = new AnalysisSession();
        AnalysisSession second = new AnalysisSession();
        IntSignal a = first.intSignal(0);
        IntSignal b = second.intSignal(0);
        assertEquals(1, a.getId());
        assertEquals(1, b.getId());
        assertNull(first.identityOf(b.getter()));
        assertNull(second.identityOf(a.setter()));
    }

    @Test
    void testClosed() {
        AnalysisSession session = new AnalysisSession();
        session.longSignal(1);
        session.close();
        assertTrue(session.isClosed());
        assertThrows(IllegalStateException.class, () -> session.intSignal(0));
        assertEquals(1, session.listSignals().size());
    }
}
