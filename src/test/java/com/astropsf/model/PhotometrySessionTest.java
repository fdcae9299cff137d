package com.astropsf.model;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.astropsf.exception.ConfigurationException;
import com.astropsf.exception.PreconditionException;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class PhotometrySessionTest {

    private PhotometrySession session;

    @BeforeEach
    void setUp() throws Exception {
        session = new PhotometrySession(5.0, 10.0);
    }

    @Test
    void manualStarsAppendInOrderAndFirstIsActive() throws Exception {
        session.addStar(new StarCandidate(10, 20, StarRole.TARGET));
        session.addStar(new StarCandidate(30, 40, StarRole.TARGET));

        assertEquals(2, session.stars(StarRole.TARGET).size());
        assertEquals(10.0, session.activeStar(StarRole.TARGET).x);
        assertTrue(session.stars(StarRole.COMPARISON).isEmpty());
    }

    @Test
    void replaceStarsDropsPreviousStarsOfThatRoleOnly() {
        session.addStar(new StarCandidate(1, 1, StarRole.TARGET));
        session.addStar(new StarCandidate(2, 2, StarRole.COMPARISON));

        session.replaceStars(StarRole.TARGET, List.of(new StarCandidate(5, 5, StarRole.TARGET), new StarCandidate(6, 6, StarRole.TARGET)));

        assertEquals(2, session.stars(StarRole.TARGET).size());
        assertEquals(5.0, session.stars(StarRole.TARGET).get(0).x);
        assertEquals(1, session.stars(StarRole.COMPARISON).size());
    }

    @Test
    void replaceStarsRejectsCandidatesOfTheOtherRole() {
        assertThrows(IllegalArgumentException.class,
                () -> session.replaceStars(StarRole.TARGET, List.of(new StarCandidate(5, 5, StarRole.COMPARISON))));
    }

    @Test
    void activeStarOfEmptyRoleIsAPrecondition() {
        PreconditionException e = assertThrows(PreconditionException.class, () -> session.activeStar(StarRole.COMPARISON));
        assertTrue(e.getMessage().contains("comparison"));
    }

    @Test
    void clearAffectsOneRole() {
        session.addStar(new StarCandidate(1, 1, StarRole.TARGET));
        session.addStar(new StarCandidate(2, 2, StarRole.COMPARISON));

        session.clear(StarRole.COMPARISON);

        assertEquals(1, session.stars(StarRole.TARGET).size());
        assertTrue(session.stars(StarRole.COMPARISON).isEmpty());
    }

    @Test
    void resetDropsStarsAndRestoresSeedFwhm() throws Exception {
        session.addStar(new StarCandidate(1, 1, StarRole.TARGET));
        session.setFwhm(4.2);

        session.reset();

        assertTrue(session.stars(StarRole.TARGET).isEmpty());
        assertEquals(5.0, session.getFwhm());
    }

    @Test
    void invalidFwhmIsRejectedAndPreviousValueKept() throws Exception {
        session.setFwhm(3.3);
        assertThrows(ConfigurationException.class, () -> session.setFwhm(0));
        assertThrows(ConfigurationException.class, () -> session.setFwhm(Double.NaN));
        assertEquals(3.3, session.getFwhm());
    }

    @Test
    void starListsAreSnapshots() {
        List<StarCandidate> before = session.stars(StarRole.TARGET);
        session.addStar(new StarCandidate(1, 1, StarRole.TARGET));
        assertTrue(before.isEmpty());
        assertThrows(UnsupportedOperationException.class,
                () -> session.stars(StarRole.TARGET).add(new StarCandidate(0, 0, StarRole.TARGET)));
    }
}
