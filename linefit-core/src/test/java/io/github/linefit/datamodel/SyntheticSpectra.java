/*
 * Copyright (c) 2004-2025 The mzmine Development Team
 */

package io.github.linefit.datamodel;

import io.github.linefit.util.SpectralUnits;

/**
 * Noise-free and deterministic-noise test spectra on a channel axis.
 */
public class SyntheticSpectra {

  /**
   * Channel spacing of {@link #spectrum(double[])} in km/s.
   */
  public static final double VELOCITY_STEP = 0.2;

  private SyntheticSpectra() {
  }

  /**
   * @param components flat {@code [A, mu, sigma, ...]} with mu and sigma in channels
   */
  public static double[] gaussians(int n, double... components) {
    final double[] y = new double[n];
    for (int k = 0; k + 2 < components.length; k += 3) {
      for (int i = 0; i < n; i++) {
        final double d = i - components[k + 1];
        y[i] += components[k] * Math.exp(-d * d / (2d * components[k + 2] * components[k + 2]));
      }
    }
    return y;
  }

  /**
   * Channel i has the velocity (i - n/2) * {@link #VELOCITY_STEP} km/s around the methanol rest
   * frequency.
   */
  public static double[] frequencies(int n) {
    final double[] f = new double[n];
    for (int i = 0; i < n; i++) {
      f[i] = SpectralUnits.frequencyOfOpticalVelocity((i - n / 2) * VELOCITY_STEP,
          SpectralUnits.METHANOL_6_7GHZ_MHZ);
    }
    return f;
  }

  public static Spectrum spectrum(double[] intensities) {
    return Spectrum.of(frequencies(intensities.length), intensities,
        SpectralUnits.METHANOL_6_7GHZ_MHZ);
  }

  /**
   * Adds +amplitude on even and -amplitude on odd channels of [from, to].
   */
  public static void addAlternatingNoise(double[] y, int from, int to, double amplitude) {
    for (int i = from; i <= to; i++) {
      y[i] += i % 2 == 0 ? amplitude : -amplitude;
    }
  }
}
