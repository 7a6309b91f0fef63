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
import java.util.List;
import java.util.Objects;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Outcome of one {@link BoundedSolver} run. Either successful, with fitted parameters and
 * goodness-of-fit statistics, or failed, with the reason. Immutable.
 */
public final class FitResult {

  private final boolean success;
  private final @Nullable GaussianParameterSet parameters;
  private final double chiSquare;
  private final int degreesOfFreedom;
  private final double @Nullable [] standardErrors;
  private final int iterations;
  private final int evaluations;
  private final @Nullable String message;
  private final @Nullable Throwable cause;

  private FitResult(boolean success, @Nullable GaussianParameterSet parameters, double chiSquare,
      int degreesOfFreedom, double @Nullable [] standardErrors, int iterations, int evaluations,
      @Nullable String message, @Nullable Throwable cause) {
    this.success = success;
    this.parameters = parameters == null ? null : parameters.copy();
    this.chiSquare = chiSquare;
    this.degreesOfFreedom = degreesOfFreedom;
    this.standardErrors = standardErrors == null ? null : standardErrors.clone();
    this.iterations = iterations;
    this.evaluations = evaluations;
    this.message = message;
    this.cause = cause;
  }

  public static @NotNull FitResult success(@NotNull GaussianParameterSet parameters,
      double chiSquare, int degreesOfFreedom, double @Nullable [] standardErrors, int iterations,
      int evaluations) {
    Objects.requireNonNull(parameters);
    return new FitResult(true, parameters, chiSquare, degreesOfFreedom, standardErrors,
        iterations, evaluations, null, null);
  }

  public static @NotNull FitResult failure(@NotNull String message, @Nullable Throwable cause) {
    return new FitResult(false, null, Double.NaN, 0, null, 0, 0, message, cause);
  }

  public boolean isSuccess() {
    return success;
  }

  /**
   * @return a copy of the fitted parameters
   * @throws IllegalStateException if the fit failed
   */
  public @NotNull GaussianParameterSet getParameters() {
    if (parameters == null) {
      throw new IllegalStateException("Fit failed, no parameters: " + message);
    }
    return parameters.copy();
  }

  public @NotNull List<GaussianComponent> getComponents() {
    return parameters == null ? List.of() : parameters.getComponents();
  }

  public int getNumberOfComponents() {
    return parameters == null ? 0 : parameters.size();
  }

  public double getChiSquare() {
    return chiSquare;
  }

  public int getDegreesOfFreedom() {
    return degreesOfFreedom;
  }

  /**
   * Chi-square divided by the degrees of freedom. NaN for a failed fit.
   */
  public double getReducedChiSquare() {
    return success ? chiSquare / degreesOfFreedom : Double.NaN;
  }

  /**
   * Standard errors in the flat parameter layout of {@link GaussianParameterSet}, or null if the
   * covariance could not be estimated.
   */
  public double @Nullable [] getStandardErrors() {
    return standardErrors == null ? null : standardErrors.clone();
  }

  public int getIterations() {
    return iterations;
  }

  public int getEvaluations() {
    return evaluations;
  }

  public @Nullable String getMessage() {
    return message;
  }

  public @Nullable Throwable getCause() {
    return cause;
  }

  @Override
  public String toString() {
    if (!success) {
      return "FitResult{failed: " + message + '}';
    }
    return "FitResult{components=" + getNumberOfComponents() + ", redChi2=" + String.format(
        "%.4f", getReducedChiSquare()) + ", " + parameters + '}';
  }
}
