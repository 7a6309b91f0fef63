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
import java.util.Arrays;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.apache.commons.math3.exception.MathArithmeticException;
import org.apache.commons.math3.exception.MathIllegalArgumentException;
import org.apache.commons.math3.exception.MathIllegalStateException;
import org.apache.commons.math3.fitting.leastsquares.GaussNewtonOptimizer;
import org.apache.commons.math3.fitting.leastsquares.LeastSquaresBuilder;
import org.apache.commons.math3.fitting.leastsquares.LeastSquaresOptimizer;
import org.apache.commons.math3.fitting.leastsquares.LeastSquaresOptimizer.Optimum;
import org.apache.commons.math3.fitting.leastsquares.LeastSquaresProblem;
import org.apache.commons.math3.fitting.leastsquares.LevenbergMarquardtOptimizer;
import org.apache.commons.math3.fitting.leastsquares.ParameterValidator;
import org.apache.commons.math3.linear.DiagonalMatrix;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.RealVector;
import org.apache.commons.math3.optim.SimpleVectorValueChecker;
import org.jetbrains.annotations.NotNull;

/**
 * Bounded nonlinear least-squares fit of a Gaussian mixture. Minimises the noise-weighted residual
 * of {@link ResidualFunction}, starting from the current values of the parameter set and keeping
 * every parameter inside its box constraints.
 * <p>
 * Numerical failures of the optimizer never escape: they are logged and returned as a failed
 * {@link FitResult}.
 */
public class BoundedSolver {

  private static final Logger logger = Logger.getLogger(BoundedSolver.class.getName());

  /**
   * Evaluation budget per free parameter (plus one).
   */
  public static final int EVALUATIONS_PER_PARAMETER = 2000;
  private static final double COVARIANCE_SINGULARITY_THRESHOLD = 1e-14;
  private static final double RELATIVE_TOLERANCE = 1e-10;
  private static final double ABSOLUTE_TOLERANCE = 1e-12;

  /**
   * Fits with a constant per-channel uncertainty.
   *
   * @param data   intensity per channel
   * @param params start values and bounds, not modified
   * @param rms    noise level, used as uncertainty of every channel
   */
  public @NotNull FitResult minimize(double[] data, @NotNull GaussianParameterSet params,
      double rms, @NotNull SolverMethod method) {
    final double[] errors = new double[data.length];
    Arrays.fill(errors, rms);
    return minimize(data, params, errors, method);
  }

  public @NotNull FitResult minimize(double[] data, @NotNull GaussianParameterSet params,
      double[] errors, @NotNull SolverMethod method) {
    Objects.requireNonNull(params);
    Objects.requireNonNull(method);
    Preconditions.checkArgument(data.length == errors.length,
        "Data and errors differ in length (%s vs %s)", data.length, errors.length);
    Preconditions.checkArgument(!params.isEmpty(), "Nothing to fit, the parameter set is empty");

    for (int i = 0; i < data.length; i++) {
      if (!Double.isFinite(data[i]) || !Double.isFinite(errors[i]) || errors[i] <= 0d) {
        return fail(params, "Non-finite data or non-positive uncertainty at channel " + i, null);
      }
    }

    final double[] x = GaussianModel.channelAxis(data.length);
    final int nParams = params.getNumberOfParameters();
    final double[] weights = new double[errors.length];
    for (int i = 0; i < errors.length; i++) {
      weights[i] = 1d / (errors[i] * errors[i]);
    }
    final int maxEvaluations = EVALUATIONS_PER_PARAMETER * (nParams + 1);

    final LeastSquaresProblem problem = new LeastSquaresBuilder() //
        .model(ResidualFunction.modelFunction(x)) //
        .target(data) //
        .weight(new DiagonalMatrix(weights)) //
        .start(params.getValues()) //
        .parameterValidator(new BoxConstraintValidator(params)) //
        .checkerPair(new SimpleVectorValueChecker(RELATIVE_TOLERANCE, ABSOLUTE_TOLERANCE)) //
        .maxEvaluations(maxEvaluations) //
        .maxIterations(maxEvaluations) //
        .lazyEvaluation(false) //
        .build();

    final Optimum optimum;
    try {
      optimum = createOptimizer(method).optimize(problem);
    } catch (MathIllegalStateException | MathIllegalArgumentException
             | MathArithmeticException e) {
      return fail(params, e.getMessage(), e);
    }

    final GaussianParameterSet fitted = params.copy();
    fitted.setValues(optimum.getPoint().toArray());
    final double[] values = fitted.getValues();

    final double chi2 = ResidualFunction.chiSquare(values, x, data, errors);
    if (!Double.isFinite(chi2)) {
      return fail(params, "Non-finite chi-square " + chi2, null);
    }
    final int dof = Math.max(1, data.length - nParams);
    final double[] stdErrors = standardErrors(optimum, chi2 / dof);

    return FitResult.success(fitted, chi2, dof, stdErrors, optimum.getIterations(),
        optimum.getEvaluations());
  }

  protected @NotNull LeastSquaresOptimizer createOptimizer(@NotNull SolverMethod method) {
    return switch (method) {
      case LEASTSQ -> new LevenbergMarquardtOptimizer();
      case GAUSS_NEWTON -> new GaussNewtonOptimizer(GaussNewtonOptimizer.Decomposition.QR);
    };
  }

  /**
   * Standard errors from the covariance matrix, scaled by the reduced chi-square.
   *
   * @return null if the covariance is singular
   */
  private static double[] standardErrors(Optimum optimum, double reducedChiSquare) {
    try {
      final RealMatrix covariance = optimum.getCovariances(COVARIANCE_SINGULARITY_THRESHOLD);
      final double[] errors = new double[covariance.getRowDimension()];
      for (int i = 0; i < errors.length; i++) {
        errors[i] = Math.sqrt(Math.abs(covariance.getEntry(i, i)) * reducedChiSquare);
      }
      return errors;
    } catch (MathIllegalArgumentException e) {
      logger.fine(() -> "Covariance of the fit is singular, no uncertainties: " + e.getMessage());
      return null;
    }
  }

  private static @NotNull FitResult fail(GaussianParameterSet params, String reason,
      Throwable cause) {
    final String message = "Fit of " + params.size() + " Gaussian component(s) failed: " + reason;
    if (cause != null) {
      logger.log(Level.WARNING, message, cause);
    } else {
      logger.warning(message);
    }
    return FitResult.failure(message, cause);
  }

  /**
   * Clamps every parameter into its box constraint after each optimizer step.
   */
  private static class BoxConstraintValidator implements ParameterValidator {

    private final double[] lower;
    private final double[] upper;

    private BoxConstraintValidator(GaussianParameterSet params) {
      this.lower = params.getLowerBounds();
      this.upper = params.getUpperBounds();
    }

    @Override
    public RealVector validate(RealVector params) {
      for (int i = 0; i < lower.length; i++) {
        final double v = params.getEntry(i);
        if (v < lower[i]) {
          params.setEntry(i, lower[i]);
        } else if (v > upper[i]) {
          params.setEntry(i, upper[i]);
        }
      }
      return params;
    }
  }
}
