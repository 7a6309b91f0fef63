/*
 * Copyright (c) 2004-2025 The mzmine Development Team
 *
 * Permission is hereby granted, free of charge, to any person
 * obtaining a copy of this software and associated documentation
 * files (the "Software"), to deal in the Software without
 * restriction, including without limitation the rights to use,
 * copy, modify, merge, publish, distribute, sublicense, and/or sell
 * copies of the Software, and to permit persons to whom the
 * Software is furnished to do so, subject to the following
 * conditions:
 *
 * The above copyright notice and this permission notice shall be
 * included in all copies or substantial portions of the Software.
 *
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND,
 * EXPRESS OR IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES
 * OF MERCHANTABILITY, FITNESS FOR A PARTICULAR PURPOSE AND
 * NONINFRINGEMENT. IN NO EVENT SHALL THE AUTHORS OR COPYRIGHT
 * HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER LIABILITY,
 * WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING
 * FROM, OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR
 * OTHER DEALINGS IN THE SOFTWARE.
 */

package io.github.linefit.modules.dataprocessing.gaussdecomp;

import com.google.common.base.Preconditions;
import io.github.linefit.datamodel.GaussianParameterSet;
import org.apache.commons.math3.fitting.leastsquares.MultivariateJacobianFunction;
import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.ArrayRealVector;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.RealVector;
import org.apache.commons.math3.util.Pair;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Model, residual and noise-weighted residual of a Gaussian mixture.
 * <ul>
 *   <li>no data: the model</li>
 *   <li>data, no errors: model - data</li>
 *   <li>data and errors: (model - data) / errors</li>
 * </ul>
 * The weighted form is the objective of the solver. The plain residual tells where the model
 * underestimates the data most.
 */
public class ResidualFunction {

  private ResidualFunction() {
  }

  public static double[] residual(@NotNull GaussianParameterSet parameters, double[] x) {
    return residual(parameters, x, null, null);
  }

  public static double[] residual(@NotNull GaussianParameterSet parameters, double[] x,
      double @Nullable [] data) {
    return residual(parameters, x, data, null);
  }

  public static double[] residual(@NotNull GaussianParameterSet parameters, double[] x,
      double @Nullable [] data, double @Nullable [] errors) {
    return residual(parameters.getValues(), x, data, errors);
  }

  public static double[] residual(double[] values, double[] x, double @Nullable [] data,
      double @Nullable [] errors) {
    final double[] model = GaussianModel.evaluate(values, x);
    if (data == null) {
      return model;
    }
    Preconditions.checkArgument(data.length == x.length, "Data and x differ in length");
    final double[] res = new double[x.length];
    for (int i = 0; i < x.length; i++) {
      res[i] = model[i] - data[i];
    }
    if (errors == null) {
      return res;
    }
    Preconditions.checkArgument(errors.length == x.length, "Errors and x differ in length");
    for (int i = 0; i < x.length; i++) {
      res[i] /= errors[i];
    }
    return res;
  }

  /**
   * @return sum of squared noise-weighted residuals
   */
  public static double chiSquare(double[] values, double[] x, double[] data, double[] errors) {
    double chi2 = 0d;
    for (double r : residual(values, x, data, errors)) {
      chi2 += r * r;
    }
    return chi2;
  }

  /**
   * The composite model and its Jacobian over a fixed channel axis, as consumed by the
   * least-squares optimizers.
   */
  public static @NotNull MultivariateJacobianFunction modelFunction(double[] x) {
    final double[] axis = x.clone();
    return point -> {
      final double[] values = point.toArray();
      final RealVector value = new ArrayRealVector(GaussianModel.evaluate(values, axis), false);
      final RealMatrix jacobian = new Array2DRowRealMatrix(GaussianModel.jacobian(values, axis),
          false);
      return new Pair<>(value, jacobian);
    };
  }
}
