package org.prover.term;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;
import org.prover.TestSignature;

import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class DeBruijnTest {

    private final TestSignature s = new TestSignature();
    private final DeBruijn db = new DeBruijn(s.factory);

    @Test
    void shiftSkipsBoundIndices() {
        Term t = s.lam(s.app(s.g, s.db(0), s.db(1)));
        assertSame(s.lam(s.app(s.g, s.db(0), s.db(2))), db.shift(t, 1));
        assertSame(t, db.shift(t, 0));
    }

    @Test
    void closedTermsAreUntouched() {
        Term closed = s.lam(s.app(s.f, s.db(0)));
        assertSame(closed, db.shift(closed, 3));
        assertSame(closed, db.unshift(closed, 3));
    }

    @Test
    void unshiftIsTheInverseOfShift() {
        Term t = s.app(s.g, s.db(0), s.lam(s.app(s.f, s.db(1))));
        assertSame(t, db.unshift(db.shift(t, 2), 2));
    }

    @Test
    void unshiftRejectsCapture() {
        Term t = s.app(s.g, s.db(0), s.db(1));
        assertThrows(IllegalStateException.class, () -> db.unshift(t, 1));
    }

    @Test
    void containsLooksThroughBinders() {
        Term t = s.lam(s.app(s.g, s.db(0), s.db(2)));
        assertTrue(db.contains(t, 1));
        assertFalse(db.contains(t, 0));
        assertFalse(db.contains(t, 2));
    }

    @Test
    void evalReplacesEnvironmentEntries() {
        DBEnv env = DBEnv.empty().push(s.a);
        assertSame(s.app(s.g, s.a, s.db(0)), db.eval(env, s.app(s.g, s.db(0), s.db(1))));
        assertSame(s.lam(s.app(s.g, s.db(0), s.a)), db.eval(env, s.lam(s.app(s.g, s.db(0), s.db(1)))));
    }

    @Test
    void evalShiftsOpenReplacements() {
        DBEnv env = DBEnv.empty().push(s.db(0));
        assertSame(s.lam(s.app(s.g, s.db(0), s.db(1))), db.eval(env, s.lam(s.app(s.g, s.db(0), s.db(1)))));
    }

    @Test
    void environmentLookup() {
        DBEnv env = DBEnv.empty().push(s.a).push(s.b);
        assertEquals(2, env.size());
        assertSame(s.b, env.find(0));
        assertSame(s.a, env.find(1));
        assertNull(env.find(2));
        assertTrue(DBEnv.empty().isEmpty());
    }

    @Test
    @Timeout(value = 10, unit = TimeUnit.SECONDS)
    void sharedSubtermsAreVisitedOncePerDepth() {
        Term open = s.db(0);
        Term shifted = s.db(3);
        Term substituted = s.b;
        for (int k = 0; k < 30; k++) {
            open = s.app(s.g, open, open);
            shifted = s.app(s.g, shifted, shifted);
            substituted = s.app(s.g, substituted, substituted);
        }
        assertTrue(db.shift(open, 3) == shifted);
        assertTrue(db.unshift(shifted, 3) == open);
        assertTrue(db.contains(open, 0));
        assertFalse(db.contains(open, 1));
        assertTrue(db.eval(DBEnv.empty().push(s.b), open) == substituted);
    }
}
