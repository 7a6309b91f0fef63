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

package io.github.linefit.datamodel;

import com.google.common.base.Preconditions;
import com.google.common.collect.Range;
import io.github.linefit.util.MathUtils;
import io.github.linefit.util.SpectralUnits;
import java.util.Arrays;
import java.util.Optional;
import org.jetbrains.annotations.NotNull;

/**
 * A one-dimensional spectrum: intensity over an ordered sequence of frequency channels. The channel
 * index is the coordinate system of all fitted line positions and widths. Velocities follow the
 * optical convention relative to the rest frequency.
 * <p>
 * Samples with a non-finite intensity are dropped on construction, so every channel of a spectrum
 * holds a valid value.
 */
public final class Spectrum {

  private final double[] frequencies;
  private final double[] intensities;
  private final double[] velocities;
  private final double restFrequency;

  private Spectrum(double[] frequencies, double[] intensities, double restFrequency) {
    this.frequencies = frequencies;
    this.intensities = intensities;
    this.restFrequency = restFrequency;
    this.velocities = new double[frequencies.length];
    for (int i = 0; i < frequencies.length; i++) {
      velocities[i] = SpectralUnits.opticalVelocity(frequencies[i], restFrequency);
    }
  }

  /**
   * @param frequencies   channel frequencies in MHz, monotonic
   * @param intensities   intensity per channel, NaN for invalid samples
   * @param restFrequency rest frequency of the line in MHz
   */
  public static @NotNull Spectrum of(double[] frequencies, double[] intensities,
      double restFrequency) {
    Preconditions.checkArgument(frequencies.length == intensities.length,
        "Frequency and intensity arrays differ in length (%s vs %s)", frequencies.length,
        intensities.length);
    Preconditions.checkArgument(restFrequency > 0, "Rest frequency must be positive");

    int valid = 0;
    for (double v : intensities) {
      if (Double.isFinite(v)) {
        valid++;
      }
    }
    final double[] f = new double[valid];
    final double[] y = new double[valid];
    int k = 0;
    for (int i = 0; i < intensities.length; i++) {
      if (Double.isFinite(intensities[i])) {
        f[k] = frequencies[i];
        y[k] = intensities[i];
        k++;
      }
    }
    return new Spectrum(f, y, restFrequency);
  }

  public int getNumberOfChannels() {
    return intensities.length;
  }

  public double getFrequency(int channel) {
    return frequencies[channel];
  }

  public double getIntensity(int channel) {
    return intensities[channel];
  }

  public double getVelocity(int channel) {
    return velocities[channel];
  }

  public double getRestFrequency() {
    return restFrequency;
  }

  public double[] getFrequencies() {
    return frequencies.clone();
  }

  public double[] getIntensities() {
    return intensities.clone();
  }

  public double[] getVelocities() {
    return velocities.clone();
  }

  public double getTotalIntensity() {
    return MathUtils.nanSum(intensities);
  }

  /**
   * Mean absolute spacing of neighbouring channels in MHz, 0 for fewer than two channels.
   */
  public double getMeanChannelWidth() {
    if (frequencies.length < 2) {
      return 0d;
    }
    return Math.abs(frequencies[frequencies.length - 1] - frequencies[0]) / (frequencies.length
        - 1);
  }

  public boolean isInsideWindow(int channel, double centerVelocity, double halfWidth) {
    final double v = velocities[channel];
    return v >= centerVelocity - halfWidth && v <= centerVelocity + halfWidth;
  }

  /**
   * Channels that carry the expected emission.
   *
   * @return first and last channel whose velocity lies in [center - halfWidth, center +
   * halfWidth], or empty if no channel does
   */
  public Optional<Range<Integer>> channelWindow(double centerVelocity, double halfWidth) {
    int first = -1;
    int last = -1;
    for (int i = 0; i < velocities.length; i++) {
      if (isInsideWindow(i, centerVelocity, halfWidth)) {
        if (first < 0) {
          first = i;
        }
        last = i;
      }
    }
    return first < 0 ? Optional.empty() : Optional.of(Range.closed(first, last));
  }

  @Override
  public String toString() {
    return "Spectrum{channels=" + intensities.length + ", restFrequency=" + restFrequency + '}';
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof Spectrum that)) {
      return false;
    }
    return Double.compare(restFrequency, that.restFrequency) == 0 && Arrays.equals(frequencies,
        that.frequencies) && Arrays.equals(intensities, that.intensities);
  }

  @Override
  public int hashCode() {
    int result = Arrays.hashCode(frequencies);
    result = 31 * result + Arrays.hashCode(intensities);
    result = 31 * result + Double.hashCode(restFrequency);
    return result;
  }
}
