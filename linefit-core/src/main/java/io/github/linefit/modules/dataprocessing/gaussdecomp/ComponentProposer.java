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
import com.google.common.collect.Range;
import io.github.linefit.datamodel.ComponentBounds;
import io.github.linefit.datamodel.GaussianComponent;
import io.github.linefit.datamodel.GaussianParameterSet;
import io.github.linefit.util.MathUtils;
import java.util.Objects;
import java.util.logging.Logger;
import org.apache.commons.math3.random.RandomGenerator;
import org.jetbrains.annotations.NotNull;

/**
 * Grows a parameter set by one Gaussian placed at the largest under-fit of the current model.
 * <p>
 * The width of the new component is copied from an existing component drawn uniformly at random,
 * so the random generator decides the outcome of otherwise identical runs. Seed it for
 * reproducible fits.
 */
public class ComponentProposer {

  private static final Logger logger = Logger.getLogger(ComponentProposer.class.getName());

  private final @NotNull RandomGenerator random;

  public ComponentProposer(@NotNull RandomGenerator random) {
    this.random = Objects.requireNonNull(random);
  }

  /**
   * @param data        intensity per channel
   * @param params      current components, not modified
   * @param sigmaBounds width bounds of every component (channels)
   * @param rms         noise level, 3 rms is the lowest allowed amplitude
   * @return a new parameter set with the existing components (bounds rebuilt) and one new
   * component
   */
  public @NotNull GaussianParameterSet addGaussian(double[] data,
      @NotNull GaussianParameterSet params, @NotNull Range<Double> sigmaBounds, double rms) {
    Preconditions.checkArgument(!params.isEmpty(), "Need at least one component to propose from");
    Preconditions.checkArgument(data.length > 0, "Empty spectrum");

    final double[] x = GaussianModel.channelAxis(data.length);
    final double[] residual = ResidualFunction.residual(params, x, data);
    final double maxIntensity = data[MathUtils.argmax(data)];
    final Range<Double> amplitudeBounds = MathUtils.closedRange(3d * rms, maxIntensity);

    final GaussianParameterSet next = new GaussianParameterSet();
    for (int i = 0; i < params.size(); i++) {
      final ComponentBounds previous = params.getBounds(i);
      next.add(params.getComponent(i),
          previous.withAmplitude(amplitudeBounds).withSigma(sigmaBounds));
    }

    final int donor = random.nextInt(params.size());
    final int loc = MathUtils.argmin(residual);
    final GaussianComponent proposed = new GaussianComponent(data[loc], loc,
        params.getComponent(donor).sigma());
    final ComponentBounds proposedBounds = new ComponentBounds(amplitudeBounds,
        Range.closed(0d, (double) (data.length - 1)), sigmaBounds);
    next.add(proposed, proposedBounds);

    logger.fine(() -> "Proposed component " + next.size() + " at channel " + loc + " (A="
        + data[loc] + ", sigma from component " + (donor + 1) + ")");
    return next;
  }
}
