package org.prover.saturation;

import org.junit.jupiter.api.Test;
import org.prover.support.Clause;
import org.prover.support.ProofStep;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ProofGeneratorTest extends AbstractSaturationTest {

    @Test
    void proofOfHandBuiltRefutation() {
        Clause pa = input("pa", s.pos(s.app(s.p, s.a)));
        Clause npa = input("npa", s.neg(s.app(s.p, s.x0)));
        Clause bottom = context.mkClause(List.of(), ProofStep.mkInference("resolution", List.of(pa, npa), "X0 ↦ a"));

        ProofGenerator proof = ProofGenerator.of(SZSStatus.unsat(bottom));
        assertEquals(3, proof.size());
        assertEquals(List.of(pa, npa), proof.getLeaves());
        assertTrue(proof.isAcyclic());
        assertTrue(proof.isWellFounded());
        assertEquals(1, proof.depth());

        String text = proof.generateProof();
        String[] lines = text.split("\n");
        assertEquals(3, lines.length);
        assertTrue(lines[2].contains("inf resolution da " + pa.getId() + ", " + npa.getId()));
        assertTrue(lines[2].endsWith("(X0 ↦ a)"));
        assertTrue(lines[0].contains("assert test:pa"));
    }

    @Test
    void sharedPremisesAppearOnce() {
        Clause pa = input("pa", s.pos(s.app(s.p, s.a)));
        Clause qa = context.mkClause(List.of(s.pos(s.app(s.q, s.a))), ProofStep.mkInference("r", List.of(pa)));
        Clause ra = context.mkClause(List.of(s.pos(s.app(s.r, s.a, s.a))), ProofStep.mkInference("r", List.of(pa, qa)));
        Clause bottom = context.mkClause(List.of(), ProofStep.mkSimplification("s", List.of(ra, qa)));

        ProofGenerator proof = new ProofGenerator(bottom);
        assertEquals(4, proof.size());
        assertEquals(3, proof.depth());
        assertEquals(List.of(pa), proof.getLeaves());
    }

    @Test
    void leafRootHasDepthZero() {
        Clause pa = input("pa", s.pos(s.app(s.p, s.a)));
        ProofGenerator proof = new ProofGenerator(pa);
        assertEquals(0, proof.depth());
        assertEquals(1, proof.size());
    }

    @Test
    void statusWithoutRefutationHasNoProof() {
        assertThrows(IllegalStateException.class, () -> ProofGenerator.of(SZSStatus.sat()));
        Clause pa = input("pa", s.pos(s.app(s.p, s.a)));
        assertThrows(IllegalArgumentException.class, () -> SZSStatus.unsat(pa));
    }
}
