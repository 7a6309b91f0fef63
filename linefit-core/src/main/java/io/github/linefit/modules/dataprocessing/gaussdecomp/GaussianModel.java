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

import io.github.linefit.datamodel.GaussianComponent;
import io.github.linefit.datamodel.GaussianParameterSet;
import org.jetbrains.annotations.NotNull;

/**
 * Gaussian line profile and the composite model of a {@link GaussianParameterSet}. No
 * normalisation is applied, the amplitude is the peak height.
 */
public class GaussianModel {

  private GaussianModel() {
  }

  public static double gaussian(double x, double amplitude, double center, double sigma) {
    final double d = x - center;
    return amplitude * Math.exp(-(d * d) / (2d * sigma * sigma));
  }

  public static double[] gaussian(double[] x, double amplitude, double center, double sigma) {
    final double[] y = new double[x.length];
    for (int i = 0; i < x.length; i++) {
      y[i] = gaussian(x[i], amplitude, center, sigma);
    }
    return y;
  }

  /**
   * Sum of all components of the set, evaluated at x.
   */
  public static double[] evaluate(@NotNull GaussianParameterSet parameters, double[] x) {
    return evaluate(parameters.getValues(), x);
  }

  /**
   * @param values flat parameter vector {@code [A_0, mu_0, sigma_0, A_1, ...]}
   */
  public static double[] evaluate(double[] values, double[] x) {
    final double[] model = new double[x.length];
    for (int k = 0; k + 2 < values.length; k += GaussianParameterSet.PARAMETERS_PER_COMPONENT) {
      final double a = values[k];
      final double mu = values[k + 1];
      final double sigma = values[k + 2];
      for (int i = 0; i < x.length; i++) {
        model[i] += gaussian(x[i], a, mu, sigma);
      }
    }
    return model;
  }

  public static double[] evaluate(@NotNull GaussianComponent component, double[] x) {
    return gaussian(x, component.amplitude(), component.center(), component.sigma());
  }

  /**
   * Partial derivatives of the composite model with respect to every parameter.
   *
   * @return matrix [x.length][values.length]
   */
  public static double[][] jacobian(double[] values, double[] x) {
    final double[][] jac = new double[x.length][values.length];
    for (int k = 0; k + 2 < values.length; k += GaussianParameterSet.PARAMETERS_PER_COMPONENT) {
      final double a = values[k];
      final double mu = values[k + 1];
      final double sigma = values[k + 2];
      final double s2 = sigma * sigma;
      for (int i = 0; i < x.length; i++) {
        final double d = x[i] - mu;
        final double e = Math.exp(-(d * d) / (2d * s2));
        jac[i][k] = e;
        jac[i][k + 1] = a * e * d / s2;
        jac[i][k + 2] = a * e * d * d / (s2 * sigma);
      }
    }
    return jac;
  }

  /**
   * @return channel indices 0..n-1 as doubles
   */
  public static double[] channelAxis(int n) {
    final double[] x = new double[n];
    for (int i = 0; i < n; i++) {
      x[i] = i;
    }
    return x;
  }
}
