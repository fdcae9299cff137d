package com.astropsf.service;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.astropsf.exception.PreconditionException;
import com.astropsf.model.Image;
import com.astropsf.model.PhotometryResult;
import com.astropsf.model.PsfGeometry;
import com.astropsf.model.StarCandidate;
import com.astropsf.model.StarRole;
import com.astropsf.testutil.SyntheticImages;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class PsfPhotometryServiceTest {

    private static final double SIGMA = 2.0;
    private static final PsfGeometry GEOMETRY = new PsfGeometry(2.3548 * SIGMA);

    private final PsfPhotometryService service = new PsfPhotometryService();
    private ExecutorService exec;

    @BeforeEach
    void setUp() {
        exec = Executors.newFixedThreadPool(3);
    }

    @AfterEach
    void tearDown() {
        exec.shutdownNow();
    }

    @Test
    void recoversFluxAndPosition() throws Exception {
        Image image = SyntheticImages.field(100, 100).sky(100).star(50.3, 49.6, 10000, SIGMA).build();

        PhotometryResult r = service.fit(image, GEOMETRY, new StarCandidate(50, 50, StarRole.TARGET), 0);

        assertTrue(r.success, r.message);
        assertNull(r.message);
        assertEquals(10000, r.flux, 100);
        assertEquals(50.3, r.x, 0.05);
        assertEquals(49.6, r.y, 0.05);
        assertEquals(100, r.localBackground, 0.1);
        assertEquals(50, r.initialX);
        assertEquals(50, r.initialY);
    }

    @Test
    void equalStarsGiveEqualFluxes() throws Exception {
        Image image = SyntheticImages.field(160, 100).sky(40).star(40, 50, 8000, SIGMA).star(120, 50, 8000, SIGMA).build();

        PhotometryResult a = service.fit(image, GEOMETRY, new StarCandidate(40.4, 50.2, StarRole.TARGET), 0);
        PhotometryResult b = service.fit(image, GEOMETRY, new StarCandidate(119.7, 49.8, StarRole.COMPARISON), 0);

        assertEquals(1.0, a.flux / b.flux, 1e-3);
    }

    @Test
    void fitAllKeepsInputOrderAndIsolatesFailures() throws Exception {
        Image image = SyntheticImages.field(200, 100).sky(10)
                .star(30, 50, 3000, SIGMA).star(100, 50, 6000, SIGMA).star(170, 50, 9000, SIGMA).build();
        List<StarCandidate> stars = Arrays.asList(
                new StarCandidate(170, 50, StarRole.COMPARISON),
                new StarCandidate(-40, -40, StarRole.COMPARISON),
                new StarCandidate(30, 50, StarRole.COMPARISON),
                new StarCandidate(100, 50, StarRole.COMPARISON));

        List<PhotometryResult> results = service.fitAll(image, GEOMETRY, stars, exec);

        assertEquals(4, results.size());
        for (int i = 0; i < results.size(); i++) assertEquals(i, results.get(i).index);
        assertEquals(9000, results.get(0).flux, 90);
        assertFalse(results.get(1).success);
        assertNotNull(results.get(1).message);
        assertTrue(Double.isNaN(results.get(1).flux));
        assertEquals(3000, results.get(2).flux, 30);
        assertEquals(6000, results.get(3).flux, 60);
    }

    @Test
    void sequentialAndPooledRunsAgree() throws Exception {
        Image image = SyntheticImages.field(120, 60).sky(25).noise(1.0, 3L)
                .star(30, 30, 5000, SIGMA).star(90, 30, 7000, SIGMA).build();
        List<StarCandidate> stars = Arrays.asList(
                new StarCandidate(30, 30, StarRole.TARGET), new StarCandidate(90, 30, StarRole.TARGET));

        List<PhotometryResult> sequential = service.fitAll(image, GEOMETRY, stars, null);
        List<PhotometryResult> pooled = service.fitAll(image, GEOMETRY, stars, exec);

        for (int i = 0; i < stars.size(); i++) {
            assertEquals(sequential.get(i).flux, pooled.get(i).flux, 1.0);
            assertEquals(sequential.get(i).x, pooled.get(i).x, 1e-3);
        }
    }

    @Test
    void starNearTheEdgeIsFittedOnTheClippedWindow() throws Exception {
        Image image = SyntheticImages.field(100, 100).sky(60).star(4, 50, 10000, SIGMA).build();

        PhotometryResult r = service.fit(image, GEOMETRY, new StarCandidate(4, 50, StarRole.TARGET), 0);

        assertTrue(r.success, r.message);
        assertEquals(10000, r.flux, 200);
        assertEquals(4, r.x, 0.05);
    }

    @Test
    void backgroundCanBeFittedAsAnOffset() throws Exception {
        Image image = SyntheticImages.field(100, 100).sky(250).star(50, 50, 12000, SIGMA).build();
        PsfPhotometryService withBackground = new PsfPhotometryService(new LocalBackgroundService(), true);

        PhotometryResult r = withBackground.fit(image, GEOMETRY, new StarCandidate(50.5, 50.5, StarRole.TARGET), 0);

        assertTrue(r.success, r.message);
        assertEquals(12000, r.flux, 120);
        assertEquals(250, r.localBackground, 0.5);
    }

    @Test
    void dipIsReportedAsFailedFit() throws Exception {
        Image image = SyntheticImages.field(100, 100).sky(500).star(50, 50, -5000, SIGMA).build();

        PhotometryResult r = service.fit(image, GEOMETRY, new StarCandidate(50, 50, StarRole.COMPARISON), 0);

        assertFalse(r.success);
        assertNotNull(r.message);
    }

    @Test
    void starOutsideTheImageIsAPrecondition() {
        Image image = SyntheticImages.field(50, 50).sky(1).build();
        assertThrows(PreconditionException.class,
                () -> service.fit(image, GEOMETRY, new StarCandidate(80, 10, StarRole.TARGET), 0));
    }

    @Test
    void apertureSumSubtractsBackground() {
        Image image = SyntheticImages.field(21, 21).sky(7).set(10, 10, 17).build();
        assertEquals(10.0, PsfPhotometryService.apertureSum(image, 10, 10, 3, 7), 1e-9);
    }

    @Test
    void crashingStarBecomesAFailedResultWithoutAnExecutor() throws Exception {
        Image image = SyntheticImages.field(140, 60).sky(20).star(30, 30, 4000, SIGMA).star(100, 30, 4000, SIGMA).build();
        LocalBackgroundService broken = new LocalBackgroundService() {
            @Override
            public double estimate(Image img, double x, double y, double inner, double outer) throws PreconditionException {
                if (x < 50) throw new IllegalStateException("background buffer corrupted");
                return super.estimate(img, x, y, inner, outer);
            }
        };
        PsfPhotometryService fitter = new PsfPhotometryService(broken, false);
        List<StarCandidate> stars = Arrays.asList(
                new StarCandidate(30, 30, StarRole.TARGET), new StarCandidate(100, 30, StarRole.TARGET));

        List<PhotometryResult> results = fitter.fitAll(image, GEOMETRY, stars, null);

        assertEquals(2, results.size());
        assertFalse(results.get(0).success);
        assertTrue(results.get(0).message.contains("background buffer corrupted"), results.get(0).message);
        assertTrue(results.get(1).success, results.get(1).message);
        assertEquals(4000, results.get(1).flux, 40);
    }
}
