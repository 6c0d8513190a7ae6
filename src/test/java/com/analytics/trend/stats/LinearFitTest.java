package com.analytics.trend.stats;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("LinearFit")
class LinearFitTest {

    @Test
    @DisplayName("Perfect line is recovered with R² = 1 and no residual")
    void perfectLine() {
        double[] y = new double[20];
        for (int i = 0; i < y.length; i++) {
            y[i] = 3.0 + 2.0 * i;
        }

        LinearFit fit = LinearFit.ofIndex(y);

        assertEquals(2.0, fit.getSlope(), 1e-9);
        assertEquals(3.0, fit.getIntercept(), 1e-9);
        assertEquals(1.0, fit.getRSquared(), 1e-9);
        assertEquals(0.0, fit.getResidualStd(), 1e-9);
        assertEquals(43.0, fit.predict(20), 1e-9);
        assertFalse(fit.isDegenerate());
    }

    @Test
    @DisplayName("Constant series is a perfect horizontal fit")
    void constantSeries() {
        LinearFit fit = LinearFit.ofIndex(new double[]{4, 4, 4, 4, 4});

        assertEquals(0.0, fit.getSlope(), 1e-12);
        assertEquals(1.0, fit.getRSquared());
    }

    @Test
    @DisplayName("Zero variance in x is degenerate")
    void degenerate() {
        LinearFit fit = LinearFit.of(new double[]{1, 1, 1}, new double[]{1, 2, 3});
        assertTrue(fit.isDegenerate());
    }

    @Test
    @DisplayName("Mismatched lengths are rejected")
    void mismatchedLengths() {
        assertThrows(IllegalArgumentException.class,
                () -> LinearFit.of(new double[]{1, 2}, new double[]{1}));
    }
}
