/*
 * Copyright (c) 2004-2025 The mzmine Development Team
 */

package io.github.linefit.datamodel;

import com.google.common.collect.Range;
import io.github.linefit.util.SpectralUnits;
import java.util.Optional;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

class SpectrumTest {

  @Test
  void testNonFiniteSamplesAreDropped() {
    final Spectrum spectrum = Spectrum.of(new double[]{6668.0, 6668.1, 6668.2, 6668.3},
        new double[]{1, Double.NaN, 3, Double.POSITIVE_INFINITY}, 6668.5);
    Assertions.assertEquals(2, spectrum.getNumberOfChannels());
    Assertions.assertArrayEquals(new double[]{6668.0, 6668.2}, spectrum.getFrequencies());
    Assertions.assertArrayEquals(new double[]{1, 3}, spectrum.getIntensities());
    Assertions.assertEquals(4d, spectrum.getTotalIntensity(), 1e-12);
  }

  @Test
  void testVelocitiesFollowOpticalConvention() {
    final Spectrum spectrum = SyntheticSpectra.spectrum(new double[200]);
    Assertions.assertEquals(0d, spectrum.getVelocity(100), 1e-9);
    Assertions.assertEquals(-20d, spectrum.getVelocity(0), 1e-9);
    Assertions.assertEquals(SpectralUnits.opticalVelocity(spectrum.getFrequency(17),
        SpectralUnits.METHANOL_6_7GHZ_MHZ), spectrum.getVelocity(17), 1e-12);
  }

  @Test
  void testChannelWindow() {
    final Spectrum spectrum = SyntheticSpectra.spectrum(new double[200]);
    Assertions.assertEquals(Optional.of(Range.closed(65, 135)), spectrum.channelWindow(0, 7.1));
    Assertions.assertTrue(spectrum.isInsideWindow(65, 0, 7.1));
    Assertions.assertFalse(spectrum.isInsideWindow(64, 0, 7.1));
    Assertions.assertEquals(Optional.empty(), spectrum.channelWindow(500, 7));
  }

  @Test
  void testMeanChannelWidth() {
    final Spectrum spectrum = Spectrum.of(new double[]{1.0, 1.5, 2.0}, new double[]{0, 1, 0}, 2);
    Assertions.assertEquals(0.5, spectrum.getMeanChannelWidth(), 1e-12);
    Assertions.assertEquals(0d,
        Spectrum.of(new double[]{1.0}, new double[]{1}, 2).getMeanChannelWidth());
  }

  @Test
  void testArraysAreCopies() {
    final Spectrum spectrum = Spectrum.of(new double[]{1.0, 2.0}, new double[]{5, 6}, 2);
    spectrum.getIntensities()[0] = -1;
    Assertions.assertEquals(5d, spectrum.getIntensity(0));
  }

  @Test
  void testLengthMismatchIsRejected() {
    Assertions.assertThrows(IllegalArgumentException.class,
        () -> Spectrum.of(new double[]{1, 2}, new double[]{1}, 2));
  }
}
