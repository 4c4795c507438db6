package com.conveyal.heatmap.density;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

public class KernelDensityModelTest {

    private static final double DELTA = 1e-12;

    @Test
    public void tophatIsStrictAtBandwidth () {
        KernelDensityModel model = KernelDensityModel.fit(TophatKernel.INSTANCE, 1, new double[] { 0 }, new double[] { 0 });
        assertEquals(Math.log(1 / Math.PI), model.logDensity(0.5, 0), DELTA);
        assertEquals(Math.log(1 / Math.PI), model.logDensity(0, 0), DELTA);
        assertEquals(Double.NEGATIVE_INFINITY, model.logDensity(1, 0));
        assertEquals(Double.NEGATIVE_INFINITY, model.logDensity(0.8, 0.8));
    }

    /** Density is the share of samples within the bandwidth, spread over the area of the disk. */
    @Test
    public void densityNormalizedByCountAndArea () {
        double[] x = { 0, 0.5, 3, 10 };
        double[] y = { 0, 0, 0, 0 };
        KernelDensityModel model = KernelDensityModel.fit(TophatKernel.INSTANCE, 2, x, y);
        assertEquals(4, model.totalWeight(), DELTA);
        double expected = 2.0 / 4 / (Math.PI * 4);
        assertEquals(expected, Math.exp(model.logDensity(0.2, 0)), DELTA);
        double[] scores = model.scoreSamples(new double[] { 9, 0.2, 9 }, new double[] { 0, 0, 0 }, 1, 3);
        assertEquals(2, scores.length);
        assertEquals(Math.log(expected), scores[0], DELTA);
        assertEquals(Math.log(1.0 / 4 / (Math.PI * 4)), scores[1], DELTA);
    }

    @Test
    public void weightsShareTheTotal () {
        double[] x = { 0, 5 };
        double[] y = { 0, 0 };
        KernelDensityModel model = KernelDensityModel.fitWeighted(TophatKernel.INSTANCE, 1, x, y, new double[] { 3, 1 });
        assertEquals(4, model.totalWeight(), DELTA);
        assertEquals(0.75 / Math.PI, Math.exp(model.logDensity(0, 0.1)), DELTA);
        assertEquals(0.25 / Math.PI, Math.exp(model.logDensity(5, 0.1)), DELTA);
    }

    @Test
    public void zeroTotalWeightHasNoDensity () {
        KernelDensityModel model = KernelDensityModel.fitWeighted(TophatKernel.INSTANCE, 1,
                new double[] { 0, 1 }, new double[] { 0, 1 }, new double[] { 0, 0 });
        assertArrayEquals(new double[] { Double.NEGATIVE_INFINITY },
                model.scoreSamples(new double[] { 0 }, new double[] { 0 }, 0, 1));
    }

    @Test
    public void invalidModelsRejected () {
        double[] one = { 0 };
        assertThrows(IllegalArgumentException.class,
                () -> KernelDensityModel.fit(TophatKernel.INSTANCE, 0, one, one));
        assertThrows(IllegalArgumentException.class,
                () -> KernelDensityModel.fitWeighted(TophatKernel.INSTANCE, 1, one, one, new double[] { -1 }));
        assertThrows(IllegalArgumentException.class,
                () -> KernelDensityModel.fit(TophatKernel.INSTANCE, 1, one, new double[] { 0, 1 }));
    }

    @Test
    public void tophatKernelInvariants () {
        TophatKernel kernel = TophatKernel.INSTANCE;
        kernel.checkInvariants(2.5);
        assertEquals(1, kernel.computeWeight(2.5, 2.4999), 0);
        assertEquals(0, kernel.computeWeight(2.5, 2.5), 0);
        assertEquals(Math.PI * 6.25, kernel.normalization(2.5), DELTA);
    }

}
