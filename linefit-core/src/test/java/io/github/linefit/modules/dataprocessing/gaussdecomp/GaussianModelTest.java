/*
 * Copyright (c) 2004-2025 The mzmine Development Team
 */

package io.github.linefit.modules.dataprocessing.gaussdecomp;

import io.github.linefit.datamodel.GaussianComponent;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

class GaussianModelTest {

  @Test
  void testPeakHeightIsAmplitude() {
    Assertions.assertEquals(7.5, GaussianModel.gaussian(42, 7.5, 42, 3), 1e-12);
    Assertions.assertEquals(7.5 * Math.exp(-0.5), GaussianModel.gaussian(45, 7.5, 42, 3), 1e-12);
  }

  @Test
  void testProfileIsSymmetric() {
    for (double d : new double[]{0.3, 1, 2.5, 10}) {
      Assertions.assertEquals(GaussianModel.gaussian(20 + d, 3, 20, 4),
          GaussianModel.gaussian(20 - d, 3, 20, 4), 1e-14);
    }
  }

  @Test
  void testCompositeIsSumOfComponents() {
    final double[] x = GaussianModel.channelAxis(60);
    final double[] sum = GaussianModel.evaluate(new double[]{4, 20, 3, 2, 35, 6}, x);
    final double[] first = GaussianModel.evaluate(new GaussianComponent(4, 20, 3), x);
    final double[] second = GaussianModel.evaluate(new GaussianComponent(2, 35, 6), x);
    for (int i = 0; i < x.length; i++) {
      Assertions.assertEquals(first[i] + second[i], sum[i], 1e-12);
    }
    Assertions.assertArrayEquals(new double[60], GaussianModel.evaluate(new double[0], x));
  }

  @Test
  void testJacobianMatchesFiniteDifferences() {
    final double[] x = GaussianModel.channelAxis(40);
    final double[] values = {5, 18.3, 4.2, 2, 25, 2.5};
    final double[][] jac = GaussianModel.jacobian(values, x);
    final double h = 1e-6;
    for (int p = 0; p < values.length; p++) {
      final double[] up = values.clone();
      final double[] down = values.clone();
      up[p] += h;
      down[p] -= h;
      final double[] fUp = GaussianModel.evaluate(up, x);
      final double[] fDown = GaussianModel.evaluate(down, x);
      for (int i = 0; i < x.length; i++) {
        Assertions.assertEquals((fUp[i] - fDown[i]) / (2 * h), jac[i][p], 1e-6,
            "parameter " + p + " at channel " + i);
      }
    }
  }

  @Test
  void testChannelAxis() {
    Assertions.assertArrayEquals(new double[]{0, 1, 2, 3}, GaussianModel.channelAxis(4));
  }
}
