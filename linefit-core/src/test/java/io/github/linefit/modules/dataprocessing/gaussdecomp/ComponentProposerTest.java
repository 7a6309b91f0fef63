/*
 * Copyright (c) 2004-2025 The mzmine Development Team
 */

package io.github.linefit.modules.dataprocessing.gaussdecomp;

import com.google.common.collect.Range;
import io.github.linefit.datamodel.ComponentBounds;
import io.github.linefit.datamodel.GaussianComponent;
import io.github.linefit.datamodel.GaussianParameterSet;
import io.github.linefit.datamodel.SyntheticSpectra;
import org.apache.commons.math3.random.Well19937c;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

class ComponentProposerTest {

  private static final Range<Double> SIGMA = Range.closed(1d, 30d);
  private static final double RMS = 0.05;

  private final double[] data = SyntheticSpectra.gaussians(200, 10, 70, 4, 6, 120, 6);

  private static GaussianParameterSet seed() {
    final GaussianParameterSet params = new GaussianParameterSet();
    params.add(new GaussianComponent(10, 70, 4),
        new ComponentBounds(Range.closed(0.15, 10d), Range.closed(50d, 90d), SIGMA));
    return params;
  }

  @Test
  void testNewComponentSitsAtTheLargestUnderFit() {
    final GaussianParameterSet params = seed();
    final GaussianParameterSet next = new ComponentProposer(new Well19937c(1)).addGaussian(data,
        params, SIGMA, RMS);

    Assertions.assertEquals(2, next.size());
    final GaussianComponent added = next.getComponent(1);
    Assertions.assertEquals(120, added.center());
    Assertions.assertEquals(data[120], added.amplitude(), 1e-12);
    // only one donor to copy the width from
    Assertions.assertEquals(4, added.sigma());
    Assertions.assertEquals(Range.closed(0d, 199d), next.getBounds(1).center());
  }

  @Test
  void testBoundsAreRebuilt() {
    final GaussianParameterSet next = new ComponentProposer(new Well19937c(1)).addGaussian(data,
        seed(), Range.closed(2d, 12d), RMS);

    final double max = data[70];
    for (int i = 0; i < next.size(); i++) {
      Assertions.assertEquals(Range.closed(3 * RMS, max), next.getBounds(i).amplitude());
      Assertions.assertEquals(Range.closed(2d, 12d), next.getBounds(i).sigma());
    }
    // the seed keeps its line window
    Assertions.assertEquals(Range.closed(50d, 90d), next.getBounds(0).center());
    Assertions.assertEquals(new GaussianComponent(10, 70, 4), next.getComponent(0));
  }

  @Test
  void testInputIsNotModified() {
    final GaussianParameterSet params = seed();
    new ComponentProposer(new Well19937c(1)).addGaussian(data, params, SIGMA, RMS);
    Assertions.assertEquals(1, params.size());
  }

  @Test
  void testWidthIsCopiedFromAnExistingComponent() {
    final GaussianParameterSet params = seed();
    params.add(new GaussianComponent(6, 120, 6),
        new ComponentBounds(Range.closed(0.15, 10d), Range.closed(0d, 199d), SIGMA));
    final double[] threePeaks = SyntheticSpectra.gaussians(200, 10, 70, 4, 6, 120, 6, 3, 170,
        2);
    final ComponentProposer proposer = new ComponentProposer(new Well19937c(5));
    for (int run = 0; run < 20; run++) {
      final GaussianComponent added = proposer.addGaussian(threePeaks, params, SIGMA, RMS)
          .getComponent(2);
      Assertions.assertEquals(170, added.center());
      Assertions.assertTrue(added.sigma() == 4 || added.sigma() == 6, "sigma " + added.sigma());
    }
  }

  @Test
  void testSameSeedSameProposal() {
    final GaussianParameterSet params = seed();
    params.add(new GaussianComponent(6, 120, 6),
        new ComponentBounds(Range.closed(0.15, 10d), Range.closed(0d, 199d), SIGMA));
    final double[] threePeaks = SyntheticSpectra.gaussians(200, 10, 70, 4, 6, 120, 6, 3, 170,
        2);
    final GaussianComponent a = new ComponentProposer(new Well19937c(9)).addGaussian(threePeaks,
        params, SIGMA, RMS).getComponent(2);
    final GaussianComponent b = new ComponentProposer(new Well19937c(9)).addGaussian(threePeaks,
        params, SIGMA, RMS).getComponent(2);
    Assertions.assertEquals(a, b);
  }

  @Test
  void testEmptySetIsRejected() {
    Assertions.assertThrows(IllegalArgumentException.class,
        () -> new ComponentProposer(new Well19937c(1)).addGaussian(data,
            new GaussianParameterSet(), SIGMA, RMS));
  }
}
