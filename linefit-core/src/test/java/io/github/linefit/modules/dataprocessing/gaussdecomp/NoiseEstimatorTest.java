/*
 * Copyright (c) 2004-2025 The mzmine Development Team
 */

package io.github.linefit.modules.dataprocessing.gaussdecomp;

import io.github.linefit.datamodel.Spectrum;
import io.github.linefit.datamodel.SyntheticSpectra;
import io.github.linefit.util.MathUtils;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

class NoiseEstimatorTest {

  @Test
  void testRmsIsMeasuredOutsideTheLineWindow() {
    final double[] y = SyntheticSpectra.gaussians(200, 20, 100, 5);
    SyntheticSpectra.addAlternatingNoise(y, 0, 64, 1);
    SyntheticSpectra.addAlternatingNoise(y, 65, 135, 0.7);
    SyntheticSpectra.addAlternatingNoise(y, 136, 199, 1);
    final Spectrum spectrum = SyntheticSpectra.spectrum(y);

    final double[] baseline = new double[129];
    int k = 0;
    for (int i = 0; i < 200; i++) {
      if (i < 65 || i > 135) {
        baseline[k++] = y[i];
      }
    }
    final double rms = NoiseEstimator.computeRms(spectrum, 0, 7.1);
    Assertions.assertEquals(MathUtils.nanStd(baseline), rms, 1e-12);
    Assertions.assertEquals(1d, rms, 1e-3);
  }

  @Test
  void testLineDoesNotInflateTheRms() {
    final double[] y = SyntheticSpectra.gaussians(200, 50, 100, 5);
    SyntheticSpectra.addAlternatingNoise(y, 0, 199, 0.2);
    final double rms = NoiseEstimator.computeRms(SyntheticSpectra.spectrum(y), 0, 7.1);
    Assertions.assertTrue(rms >= 0);
    Assertions.assertEquals(0.2, rms, 1e-3);
  }

  @Test
  void testZeroFluxGivesNaN() {
    final Spectrum empty = SyntheticSpectra.spectrum(new double[200]);
    Assertions.assertTrue(Double.isNaN(NoiseEstimator.computeRms(empty, 0, 7)));
  }

  @Test
  void testNoBaselineGivesNaN() {
    final double[] y = SyntheticSpectra.gaussians(200, 5, 100, 5);
    Assertions.assertTrue(
        Double.isNaN(NoiseEstimator.computeRms(SyntheticSpectra.spectrum(y), 0, 1000)));
  }
}
