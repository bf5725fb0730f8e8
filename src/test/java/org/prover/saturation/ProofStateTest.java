package org.prover.saturation;

import org.junit.jupiter.api.Test;
import org.prover.optionalfeatures.FifoSelection;
import org.prover.support.Clause;
import org.prover.support.ProofStep;
import org.prover.support.Trail;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ProofStateTest extends AbstractSaturationTest {

    private final ProofState state = new ProofState(new FifoSelection());

    @Test
    void clauseCannotBeActiveAndPassive() {
        Clause c = input("c", s.pos(s.app(s.p, s.a)));
        state.addPassive(c);
        assertThrows(IllegalStateException.class, () -> state.addActive(c));

        Clause d = input("d", s.pos(s.app(s.q, s.a)));
        state.addActive(d);
        assertThrows(IllegalStateException.class, () -> state.addPassive(d));
        assertTrue(state.activePassiveIntersection().isEmpty());
    }

    @Test
    void duplicateInsertionIsIgnored() {
        Clause c = input("c", s.pos(s.app(s.p, s.a)));
        assertTrue(state.addPassive(c));
        assertFalse(state.addPassive(c));
        assertEquals(1, state.getPassive().size());
    }

    @Test
    void nextPassiveFollowsSelectionOrder() {
        Clause c1 = input("c1", s.pos(s.app(s.p, s.a)));
        Clause c2 = input("c2", s.pos(s.app(s.p, s.b)));
        state.addPassive(c1);
        state.addPassive(c2);
        assertSame(c1, state.nextPassive());
        assertFalse(state.isPassive(c1));
        assertSame(c2, state.nextPassive());
        assertNull(state.nextPassive());
    }

    @Test
    void variantsAreTrackedAcrossActiveAndPassive() {
        Clause c = input("c", s.pos(s.app(s.r, s.x0, s.x1)));
        Clause renamed = input("renamed", s.pos(s.app(s.r, s.x2, s.x0)));
        assertFalse(state.hasVariant(renamed));
        state.addPassive(c);
        assertTrue(state.hasVariant(renamed));
        state.nextPassive();
        assertFalse(state.hasVariant(renamed));
        state.addActive(c);
        assertTrue(state.hasVariant(renamed));
        state.removeActive(c);
        assertFalse(state.hasVariant(renamed));
    }

    @Test
    void variantStaysKnownWhileATwinIsLive() {
        Clause first = input("first", s.pos(s.app(s.p, s.x0)));
        Clause twin = input("twin", s.pos(s.app(s.p, s.x1)));
        Clause other = input("other", s.pos(s.app(s.p, s.x2)));
        state.addPassive(first);
        state.addPassive(twin);
        state.removePassive(first);
        assertTrue(state.isPassive(twin));
        assertTrue(state.hasVariant(other));

        assertSame(twin, state.nextPassive());
        assertFalse(state.hasVariant(other));
    }

    @Test
    void trailExtensionReindexesTheVariant() {
        Clause c = input("c", s.pos(s.app(s.q, s.a)));
        Clause plain = input("plain", s.pos(s.app(s.q, s.a)));
        state.addActive(c);
        state.extendTrail(c, Trail.of(4));
        assertFalse(state.hasVariant(plain));

        Clause conditional = input("conditional", s.pos(s.app(s.q, s.a)));
        conditional.extendTrail(Trail.of(4));
        assertTrue(state.hasVariant(conditional));

        state.removeActive(c);
        assertFalse(state.hasVariant(conditional));
    }

    @Test
    void emptyClauseIsRemembered() {
        assertNull(state.someEmptyClause());
        Clause premise = input("p", s.pos(s.app(s.p, s.a)));
        Clause bottom = inferred("resolution", List.of(premise));
        state.addPassive(bottom);
        assertSame(bottom, state.someEmptyClause());
    }

    @Test
    void signalsReportMembershipChanges() {
        List<Clause> added = new ArrayList<>();
        List<Clause> removed = new ArrayList<>();
        state.getActive().onAddClause().on(added::add);
        state.getActive().onRemoveClause().on(removed::add);

        Clause c = input("c", s.pos(s.app(s.p, s.a)));
        state.addActive(c);
        state.addActive(c);
        state.removeActive(c);
        assertEquals(List.of(c), added);
        assertEquals(List.of(c), removed);
        assertEquals(1, state.getActive().onAddClause().listenerCount());
    }

    @Test
    void orphansAreInferenceDescendantsOnly() {
        Clause parent = input("parent", s.pos(s.app(s.p, s.x0)));
        Clause child = inferred("resolution", List.of(parent), s.pos(s.app(s.q, s.a)));
        Clause simplified = context.mkClause(List.of(s.pos(s.app(s.q, s.b))),
                ProofStep.mkSimplification("unit_simplify_reflect", List.of(parent)));
        state.addPassive(child);
        state.addPassive(simplified);

        assertEquals(1, state.removeOrphans(List.of(parent)));
        assertTrue(child.isRedundant());
        assertFalse(state.isPassive(child));
        assertTrue(state.isPassive(simplified));
        assertEquals(0, state.removeOrphans(List.of(parent)));
    }

    @Test
    void cleanPassiveDropsRedundantClauses() {
        Clause keep = input("keep", s.pos(s.app(s.p, s.a)));
        Clause drop = input("drop", s.pos(s.app(s.p, s.b)));
        state.addPassive(keep);
        state.addPassive(drop);
        drop.markRedundant();

        assertEquals(1, state.cleanPassive());
        assertTrue(state.isPassive(keep));
        assertFalse(state.isPassive(drop));
        assertEquals(1, state.getPassive().getSelection().size());
    }

    @Test
    void simplSetIsIndependent() {
        Clause c = input("c", s.pos(s.app(s.p, s.a)));
        state.addPassive(c);
        assertTrue(state.addSimpl(c));
        assertTrue(state.getSimpl().contains(c));
        assertTrue(state.removeSimpl(c));
        assertTrue(state.isPassive(c));
    }
}
