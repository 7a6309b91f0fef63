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

package io.github.linefit.util;

/**
 * Conversions between frequency, optical velocity and line widths. Frequencies are in MHz,
 * velocities in km/s unless a method name says otherwise.
 */
public class SpectralUnits {

  public static final double SPEED_OF_LIGHT_KM_S = 299_792.458;
  /**
   * FWHM / sigma of a Gaussian, rounded the way the published line tables do.
   */
  public static final double FWHM_PER_SIGMA = 2.354;
  /**
   * Rest frequency of the 6.7 GHz methanol maser line.
   */
  public static final double METHANOL_6_7GHZ_MHZ = 6668.5192;

  private SpectralUnits() {
  }

  /**
   * Optical convention: v = c (f_rest / f - 1).
   */
  public static double opticalVelocity(double frequency, double restFrequency) {
    return SPEED_OF_LIGHT_KM_S * (restFrequency / frequency - 1d);
  }

  /**
   * Inverse of {@link #opticalVelocity(double, double)}.
   */
  public static double frequencyOfOpticalVelocity(double velocity, double restFrequency) {
    return restFrequency / (1d + velocity / SPEED_OF_LIGHT_KM_S);
  }

  public static double fwhmChannels(double sigmaChannels) {
    return FWHM_PER_SIGMA * sigmaChannels;
  }

  /**
   * @param channelWidthKHz width of one channel in kHz
   * @return FWHM in kHz
   */
  public static double fwhmFrequencyKHz(double sigmaChannels, double channelWidthKHz) {
    return fwhmChannels(sigmaChannels) * channelWidthKHz;
  }

  /**
   * kHz times mm gives m/s.
   *
   * @return FWHM in m/s
   */
  public static double fwhmVelocityMS(double sigmaChannels, double channelWidthKHz,
      double restFrequency) {
    return fwhmFrequencyKHz(sigmaChannels, channelWidthKHz) * restWavelengthMm(restFrequency);
  }

  public static double restWavelengthMm(double restFrequency) {
    // c [m/s] / f [Hz] in mm
    return SPEED_OF_LIGHT_KM_S * 1e3 / (restFrequency * 1e6) * 1e3;
  }
}
