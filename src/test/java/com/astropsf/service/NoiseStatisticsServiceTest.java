package com.astropsf.service;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.astropsf.exception.ConfigurationException;
import com.astropsf.model.NoiseStats;
import java.util.Arrays;
import java.util.Random;
import org.junit.jupiter.api.Test;

class NoiseStatisticsServiceTest {

    private final NoiseStatisticsService service = new NoiseStatisticsService();

    @Test
    void outlierIsClippedAway() throws Exception {
        double[] samples = new double[101];
        for (int i = 0; i < 100; i++) samples[i] = i % 2 == 0 ? 9.0 : 11.0;
        samples[100] = 1.0e6;

        NoiseStats stats = service.sigmaClippedStats(samples, 3.0);

        assertEquals(10.0, stats.mean, 1e-12);
        assertEquals(10.0, stats.median, 1e-12);
        assertEquals(1.0, stats.stddev, 1e-12);
        assertEquals(100, stats.sampleCount);
        assertFalse(stats.isDegenerate());
    }

    @Test
    void gaussianNoiseScaleIsRecovered() throws Exception {
        Random rnd = new Random(42);
        double[] samples = new double[20000];
        for (int i = 0; i < samples.length; i++) samples[i] = 500 + 7.0 * rnd.nextGaussian();

        NoiseStats stats = service.sigmaClippedStats(samples, 3.0);

        assertEquals(500.0, stats.median, 0.3);
        // clipping at 3 sigma trims the tails slightly
        assertEquals(7.0, stats.stddev, 0.35);
    }

    @Test
    void constantRegionIsDegenerate() throws Exception {
        double[] samples = new double[64];
        Arrays.fill(samples, 123.0);

        NoiseStats stats = service.sigmaClippedStats(samples, 3.0);

        assertEquals(123.0, stats.median);
        assertEquals(0.0, stats.stddev);
        assertTrue(stats.isDegenerate());
    }

    @Test
    void emptyAndSingleSampleAreDegenerate() throws Exception {
        assertTrue(service.sigmaClippedStats(new double[0], 3.0).isDegenerate());
        NoiseStats one = service.sigmaClippedStats(new double[] {4.0}, 3.0);
        assertTrue(one.isDegenerate());
        assertEquals(4.0, one.median);
    }

    @Test
    void inputIsNotModified() throws Exception {
        double[] samples = {5, 1, 4, 2, 3};
        service.sigmaClippedStats(samples, 3.0);
        assertEquals(5.0, samples[0]);
    }

    @Test
    void nonPositiveClipFactorIsRejected() {
        assertThrows(ConfigurationException.class, () -> service.sigmaClippedStats(new double[] {1, 2, 3}, 0.0));
        assertThrows(ConfigurationException.class, () -> service.sigmaClippedStats(new double[] {1, 2, 3}, -1.0));
    }

    @Test
    void medianHandlesEvenCounts() {
        assertEquals(2.5, NoiseStatisticsService.median(new double[] {4, 1, 3, 2}));
        assertEquals(3.0, NoiseStatisticsService.median(new double[] {5, 1, 3}));
    }

    @Test
    void saturatedSamplesDoNotOverflowTheScale() throws Exception {
        double[] samples = new double[102];
        for (int i = 0; i < 100; i++) samples[i] = i % 2 == 0 ? 9.0 : 11.0;
        samples[100] = Double.MAX_VALUE;
        samples[101] = -Double.MAX_VALUE;

        NoiseStats stats = service.sigmaClippedStats(samples, 3.0);

        assertEquals(10.0, stats.mean, 1e-12);
        assertEquals(10.0, stats.median, 1e-12);
        assertEquals(1.0, stats.stddev, 1e-12);
        assertEquals(100, stats.sampleCount);
    }

    @Test
    void medianOfTwoSaturatedSamplesStaysFinite() {
        assertEquals(Double.MAX_VALUE, NoiseStatisticsService.median(new double[] {Double.MAX_VALUE, Double.MAX_VALUE}));
    }

    @Test
    void nonFiniteScaleIsDegenerate() {
        assertTrue(new NoiseStats(5, 5, Double.POSITIVE_INFINITY, 10).isDegenerate());
        assertTrue(new NoiseStats(Double.NaN, 5, 1, 10).isDegenerate());
    }
}
