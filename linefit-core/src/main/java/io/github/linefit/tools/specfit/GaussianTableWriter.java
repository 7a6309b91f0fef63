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

package io.github.linefit.tools.specfit;

import io.github.linefit.datamodel.GaussianComponent;
import io.github.linefit.datamodel.Spectrum;
import io.github.linefit.modules.dataprocessing.gaussdecomp.DecompositionResult;
import io.github.linefit.util.SpectralUnits;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import org.jetbrains.annotations.NotNull;

/**
 * Writes the fitted Gaussians as a fixed-width text table. Positions and widths are converted from
 * channels to frequency and velocity: the centre is read off the nearest channel, the FWHM is
 * {@code 2.354 sigma} times the channel width (kHz), and times the rest wavelength for m/s.
 */
public class GaussianTableWriter {

  private final double channelWidthKHz;
  private final String intensityUnit;

  /**
   * @param channelWidthKHz spectral resolution of one channel in kHz
   * @param intensityUnit   label of the amplitude column
   */
  public GaussianTableWriter(double channelWidthKHz, @NotNull String intensityUnit) {
    this.channelWidthKHz = channelWidthKHz;
    this.intensityUnit = intensityUnit;
  }

  public @NotNull String format(@NotNull Spectrum spectrum, @NotNull DecompositionResult result) {
    final StringBuilder b = new StringBuilder();
    b.append(String.format(Locale.US, "# reduced chi2 = %.4f, rms = %.4g, state = %s%n",
        result.reducedChiSquare(), result.rms(), result.state()));
    b.append(
        "# Gaussian      A        mu         sig       nu0       FWHM       v0        FWHM\n");
    b.append(String.format(Locale.US,
        "#          %6s                           [MHz]      [kHz]    [km/s]      [m/s]%n",
        "[" + intensityUnit + "]"));

    final List<GaussianComponent> components = result.components();
    for (int k = 0; k < components.size(); k++) {
      final GaussianComponent c = components.get(k);
      final int channel = nearestChannel(spectrum, c.center());
      final double fwhmKHz = SpectralUnits.fwhmFrequencyKHz(c.sigma(), channelWidthKHz);
      final double fwhmMS = SpectralUnits.fwhmVelocityMS(c.sigma(), channelWidthKHz,
          spectrum.getRestFrequency());
      b.append(String.format(Locale.US,
          "     %2d      %6.3f   %9.4f   %6.3f   %9.4f   %6.3f   % 7.4f   %7.2f%n", k + 1,
          c.amplitude(), c.center(), c.sigma(), spectrum.getFrequency(channel), fwhmKHz,
          spectrum.getVelocity(channel), fwhmMS));
    }
    return b.toString();
  }

  public void write(@NotNull Path file, @NotNull Spectrum spectrum,
      @NotNull DecompositionResult result) throws IOException {
    final Path parent = file.toAbsolutePath().getParent();
    if (parent != null) {
      Files.createDirectories(parent);
    }
    Files.writeString(file, format(spectrum, result));
  }

  private static int nearestChannel(Spectrum spectrum, double center) {
    final int channel = (int) Math.round(center);
    return Math.max(0, Math.min(spectrum.getNumberOfChannels() - 1, channel));
  }
}
