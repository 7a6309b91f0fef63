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

import com.google.common.collect.Range;
import io.github.linefit.parameters.impl.SimpleParameterSet;
import io.github.linefit.parameters.parametertypes.ComboParameter;
import io.github.linefit.parameters.parametertypes.DoubleParameter;
import io.github.linefit.parameters.parametertypes.DoubleRangeParameter;
import io.github.linefit.parameters.parametertypes.IntegerParameter;
import java.text.DecimalFormat;

public class HierarchicalFitterParameters extends SimpleParameterSet {

  public static final IntegerParameter maxComponents = new IntegerParameter(
      "Maximum number of Gaussians", """
      Upper limit of Gaussian components in one decomposition.
      The refinement stops when this number is reached, even if the fit has not converged.
      """, 10, 1, 100);

  public static final DoubleRangeParameter sigmaRange = new DoubleRangeParameter(
      "Sigma range (channels)", """
      Allowed standard deviation of every Gaussian component, in channels.
      """, new DecimalFormat("0.###"), Range.closed(1d, 30d), Range.closed(1e-3, 1e6));

  public static final DoubleParameter velocityHalfWidth = new DoubleParameter(
      "Line window half width (km/s)", """
      The emission is expected within reference velocity +/- this half width.
      Channels outside the window measure the noise, channels inside bound the position of the
      first Gaussian.
      """, new DecimalFormat("0.###"), 7d, 0d, Double.MAX_VALUE);

  public static final DoubleParameter seedSigma = new DoubleParameter("Seed sigma (channels)",
      "Start width of the first Gaussian, seeded at the spectral peak.", new DecimalFormat("0.###"),
      10d, 0d, Double.MAX_VALUE);

  public static final ComboParameter<SolverMethod> solverMethod = new ComboParameter<>(
      "Minimization method", "Least-squares routine used for every fit.", SolverMethod.values(),
      SolverMethod.LEASTSQ);

  public static final DoubleParameter refinementThreshold = new DoubleParameter(
      "Refinement threshold", """
      Components are added only if the reduced chi-square of the single-component fit exceeds
      this value.
      """, new DecimalFormat("0.###"), 1.0, 0d, Double.MAX_VALUE);

  public static final DoubleParameter convergenceThreshold = new DoubleParameter(
      "Convergence threshold", """
      Components are added until the reduced chi-square of the latest fit drops to or below this
      value.
      """, new DecimalFormat("0.###"), 0.90, 0d, Double.MAX_VALUE);

  public static final DoubleParameter bestFitCeiling = new DoubleParameter("Best fit ceiling", """
      A refinement is kept as best fit only if its reduced chi-square improves on the best one so
      far and still lies above this value. Guards against fitting the noise.
      """, new DecimalFormat("0.###"), 0.98, 0d, Double.MAX_VALUE);

  public HierarchicalFitterParameters() {
    super(maxComponents, sigmaRange, velocityHalfWidth, seedSigma, solverMethod,
        refinementThreshold, convergenceThreshold, bestFitCeiling);
  }
}
