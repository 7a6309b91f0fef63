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

import io.github.linefit.datamodel.Spectrum;
import io.github.linefit.util.MathUtils;
import org.jetbrains.annotations.NotNull;

/**
 * Noise level of a spectrum, measured on the baseline outside the line window.
 */
public class NoiseEstimator {

  private NoiseEstimator() {
  }

  /**
   * Standard deviation of the intensities of all channels whose velocity lies outside [center -
   * halfWidth, center + halfWidth].
   *
   * @param centerVelocity expected line velocity (km/s)
   * @param halfWidth      half width of the line window (km/s)
   * @return the rms, or NaN if the spectrum has zero total intensity or no channel outside the
   * window. Callers must check for NaN before deriving fit bounds from the result.
   */
  public static double computeRms(@NotNull Spectrum spectrum, double centerVelocity,
      double halfWidth) {
    if (spectrum.getTotalIntensity() == 0d) {
      return Double.NaN;
    }
    final int n = spectrum.getNumberOfChannels();
    final double[] baseline = new double[n];
    int k = 0;
    for (int i = 0; i < n; i++) {
      if (!spectrum.isInsideWindow(i, centerVelocity, halfWidth)) {
        baseline[k++] = spectrum.getIntensity(i);
      }
    }
    if (k == 0) {
      return Double.NaN;
    }
    final double[] used = new double[k];
    System.arraycopy(baseline, 0, used, 0, k);
    return MathUtils.nanStd(used);
  }
}
