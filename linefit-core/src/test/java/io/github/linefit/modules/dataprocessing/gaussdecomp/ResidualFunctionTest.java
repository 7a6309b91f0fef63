/*
 * Copyright (c) 2004-2025 The mzmine Development Team
 */

package io.github.linefit.modules.dataprocessing.gaussdecomp;

import com.google.common.collect.Range;
import io.github.linefit.datamodel.ComponentBounds;
import io.github.linefit.datamodel.GaussianComponent;
import io.github.linefit.datamodel.GaussianParameterSet;
import io.github.linefit.datamodel.SyntheticSpectra;
import org.apache.commons.math3.linear.ArrayRealVector;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.RealVector;
import org.apache.commons.math3.util.Pair;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class ResidualFunctionTest {

  private final double[] x = GaussianModel.channelAxis(80);
  private GaussianParameterSet params;
  private double[] data;
  private double[] errors;

  @BeforeEach
  void setUp() {
    params = new GaussianParameterSet();
    params.add(new GaussianComponent(6, 40, 5),
        new ComponentBounds(Range.closed(0d, 10d), Range.closed(0d, 79d), Range.closed(1d, 30d)));
    data = SyntheticSpectra.gaussians(80, 5, 42, 4);
    errors = new double[80];
    for (int i = 0; i < errors.length; i++) {
      errors[i] = 0.5 + i % 3;
    }
  }

  @Test
  void testWithoutDataReturnsModel() {
    Assertions.assertArrayEquals(GaussianModel.evaluate(params, x),
        ResidualFunction.residual(params, x), 0d);
  }

  @Test
  void testResidualIsModelMinusData() {
    final double[] model = GaussianModel.evaluate(params, x);
    final double[] res = ResidualFunction.residual(params, x, data);
    for (int i = 0; i < x.length; i++) {
      Assertions.assertEquals(model[i] - data[i], res[i], 1e-12);
    }
  }

  @Test
  void testWeightedResidualDividesByErrors() {
    final double[] res = ResidualFunction.residual(params, x, data);
    final double[] weighted = ResidualFunction.residual(params, x, data, errors);
    double chi2 = 0;
    for (int i = 0; i < x.length; i++) {
      Assertions.assertEquals(res[i] / errors[i], weighted[i], 1e-12);
      chi2 += weighted[i] * weighted[i];
    }
    Assertions.assertEquals(chi2, ResidualFunction.chiSquare(params.getValues(), x, data, errors),
        1e-9);
  }

  @Test
  void testPerfectModelHasZeroChiSquare() {
    final double[] exact = SyntheticSpectra.gaussians(80, 6, 40, 5);
    Assertions.assertEquals(0d, ResidualFunction.chiSquare(params.getValues(), x, exact, errors),
        1e-20);
  }

  @Test
  void testLengthMismatchIsRejected() {
    Assertions.assertThrows(IllegalArgumentException.class,
        () -> ResidualFunction.residual(params, x, new double[3]));
  }

  @Test
  void testModelFunctionProvidesValueAndJacobian() {
    final RealVector point = new ArrayRealVector(params.getValues());
    final Pair<RealVector, RealMatrix> result = ResidualFunction.modelFunction(x).value(point);
    Assertions.assertArrayEquals(GaussianModel.evaluate(params, x), result.getFirst().toArray(),
        1e-12);
    Assertions.assertEquals(80, result.getSecond().getRowDimension());
    Assertions.assertEquals(3, result.getSecond().getColumnDimension());
  }
}
