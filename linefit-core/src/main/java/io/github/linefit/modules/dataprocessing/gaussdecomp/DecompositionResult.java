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
import io.github.linefit.datamodel.GaussianComponent;
import java.util.List;
import java.util.Objects;
import org.jetbrains.annotations.NotNull;

/**
 * Final outcome of a {@link HierarchicalFitter} run.
 * <p>
 * {@link #state()} describes how the refinement loop ended, not the quality of the returned fit.
 * An ACCEPTED run may return an earlier best fit whose reduced chi-square is far above the
 * convergence threshold, while the converged fit is kept in {@link #latestFit()}.
 *
 * @param fit            the returned fit, see {@link #selection()}
 * @param latestFit      the last successful fit of the run, the seed fit if no refinement
 *                       succeeded
 * @param state          {@link FitState#ACCEPTED} or {@link FitState#EXHAUSTED}
 * @param selection      which fit was returned
 * @param rms            noise level used for bounds and weighting
 * @param lineWindow     channel window of the seed component position
 * @param attempts       number of refinement fits after the seed fit
 * @param failedAttempts number of refinement fits the solver failed on
 */
public record DecompositionResult(@NotNull FitResult fit, @NotNull FitResult latestFit,
                                  @NotNull FitState state, @NotNull FitSelection selection,
                                  double rms, @NotNull Range<Integer> lineWindow, int attempts,
                                  int failedAttempts) {

  public DecompositionResult {
    Objects.requireNonNull(fit);
    Objects.requireNonNull(latestFit);
    Objects.requireNonNull(state);
    Objects.requireNonNull(selection);
    Objects.requireNonNull(lineWindow);
  }

  public @NotNull List<GaussianComponent> components() {
    return fit.getComponents();
  }

  public int numberOfComponents() {
    return fit.getNumberOfComponents();
  }

  public double reducedChiSquare() {
    return fit.getReducedChiSquare();
  }

  /**
   * @return true if a refinement passed the best-so-far acceptance band
   */
  public boolean bestRecorded() {
    return selection == FitSelection.BEST;
  }

  /**
   * @return true if the run ended without convergence and without a recorded best fit
   */
  public boolean isUnconverged() {
    return state == FitState.EXHAUSTED && !bestRecorded();
  }
}
