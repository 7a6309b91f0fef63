/*
 * Copyright (c) 2004-2025 The mzmine Development Team
 */

package io.github.linefit.modules.dataprocessing.gaussdecomp;

import com.google.common.collect.Range;
import io.github.linefit.datamodel.ComponentBounds;
import io.github.linefit.datamodel.GaussianComponent;
import io.github.linefit.datamodel.GaussianParameterSet;
import io.github.linefit.datamodel.SyntheticSpectra;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

class BoundedSolverTest {

  private final BoundedSolver solver = new BoundedSolver();

  private static GaussianParameterSet single(GaussianComponent start, Range<Double> center) {
    final GaussianParameterSet params = new GaussianParameterSet();
    params.add(start, new ComponentBounds(Range.closed(0d, 30d), center, Range.closed(1d, 30d)));
    return params;
  }

  @Test
  void testRecoversSingleGaussian() {
    final double[] data = SyntheticSpectra.gaussians(200, 20, 100, 5);
    final GaussianParameterSet start = single(new GaussianComponent(15, 97, 7),
        Range.closed(80d, 120d));

    final FitResult fit = solver.minimize(data, start, 0.1, SolverMethod.LEASTSQ);

    Assertions.assertTrue(fit.isSuccess(), fit::toString);
    final GaussianComponent c = fit.getParameters().getComponent(0);
    Assertions.assertEquals(20, c.amplitude(), 1e-4);
    Assertions.assertEquals(100, c.center(), 1e-4);
    Assertions.assertEquals(5, c.sigma(), 1e-4);
    Assertions.assertEquals(197, fit.getDegreesOfFreedom());
    Assertions.assertTrue(fit.getReducedChiSquare() < 1e-6);
    Assertions.assertNotNull(fit.getStandardErrors());
    Assertions.assertEquals(3, fit.getStandardErrors().length);
    // input is left untouched
    Assertions.assertEquals(new GaussianComponent(15, 97, 7), start.getComponent(0));
  }

  @Test
  void testGaussNewtonFromCloseStart() {
    final double[] data = SyntheticSpectra.gaussians(200, 20, 100, 5);
    final FitResult fit = solver.minimize(data,
        single(new GaussianComponent(19, 99.5, 5.3), Range.closed(80d, 120d)), 0.1,
        SolverMethod.GAUSS_NEWTON);

    Assertions.assertTrue(fit.isSuccess(), fit::toString);
    Assertions.assertEquals(100, fit.getParameters().getComponent(0).center(), 1e-4);
  }

  @Test
  void testFitStaysWithinBounds() {
    final double[] data = SyntheticSpectra.gaussians(200, 20, 100, 5);
    final FitResult fit = solver.minimize(data,
        single(new GaussianComponent(15, 90, 7), Range.closed(80d, 95d)), 0.1,
        SolverMethod.LEASTSQ);

    Assertions.assertTrue(fit.isSuccess(), fit::toString);
    final GaussianParameterSet fitted = fit.getParameters();
    final double[] values = fitted.getValues();
    final double[] lower = fitted.getLowerBounds();
    final double[] upper = fitted.getUpperBounds();
    for (int i = 0; i < values.length; i++) {
      Assertions.assertTrue(values[i] >= lower[i] && values[i] <= upper[i],
          "parameter " + i + " = " + values[i]);
    }
    Assertions.assertTrue(fitted.getComponent(0).center() > 90);
  }

  @Test
  void testTwoOverlappingComponents() {
    final double[] data = SyntheticSpectra.gaussians(200, 10, 90, 4, 6, 105, 5);
    final GaussianParameterSet start = new GaussianParameterSet();
    final ComponentBounds bounds = new ComponentBounds(Range.closed(0d, 20d),
        Range.closed(0d, 199d), Range.closed(1d, 30d));
    start.add(new GaussianComponent(9, 88, 5), bounds);
    start.add(new GaussianComponent(5, 107, 5), bounds);

    final FitResult fit = solver.minimize(data, start, 0.05, SolverMethod.LEASTSQ);

    Assertions.assertTrue(fit.isSuccess(), fit::toString);
    Assertions.assertEquals(2, fit.getNumberOfComponents());
    Assertions.assertEquals(90, fit.getComponents().get(0).center(), 1e-3);
    Assertions.assertEquals(105, fit.getComponents().get(1).center(), 1e-3);
  }

  @Test
  void testNonFiniteDataFails() {
    final double[] data = SyntheticSpectra.gaussians(50, 5, 25, 3);
    data[10] = Double.NaN;
    final FitResult fit = solver.minimize(data,
        single(new GaussianComponent(5, 25, 3), Range.closed(0d, 49d)), 0.1,
        SolverMethod.LEASTSQ);

    Assertions.assertFalse(fit.isSuccess());
    Assertions.assertNotNull(fit.getMessage());
    Assertions.assertTrue(Double.isNaN(fit.getReducedChiSquare()));
    Assertions.assertEquals(0, fit.getNumberOfComponents());
    Assertions.assertThrows(IllegalStateException.class, fit::getParameters);
  }

  @Test
  void testNonPositiveNoiseFails() {
    final double[] data = SyntheticSpectra.gaussians(50, 5, 25, 3);
    final FitResult fit = solver.minimize(data,
        single(new GaussianComponent(5, 25, 3), Range.closed(0d, 49d)), 0d,
        SolverMethod.LEASTSQ);
    Assertions.assertFalse(fit.isSuccess());
  }

  @Test
  void testEmptyParameterSetIsRejected() {
    Assertions.assertThrows(IllegalArgumentException.class,
        () -> solver.minimize(new double[10], new GaussianParameterSet(), 1,
            SolverMethod.LEASTSQ));
  }
}
