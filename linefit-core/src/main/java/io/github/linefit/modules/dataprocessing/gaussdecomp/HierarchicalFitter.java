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
import io.github.linefit.datamodel.Spectrum;
import io.github.linefit.parameters.ParameterSet;
import io.github.linefit.util.MathUtils;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Logger;
import org.apache.commons.math3.random.RandomGenerator;
import org.apache.commons.math3.random.Well19937c;
import org.jetbrains.annotations.NotNull;

/**
 * Greedy hierarchical Gaussian decomposition of a spectrum.
 * <p>
 * One component is seeded at the spectral peak and fitted. If the reduced chi-square of that fit
 * exceeds the refinement threshold, components are added one at a time at the largest under-fit
 * of the latest model and the enlarged set is refitted, until the reduced chi-square drops to the
 * convergence threshold or the component cap is reached. A refinement becomes the best fit only
 * if its reduced chi-square improves on the best so far and still lies above the best-fit
 * ceiling. The best fit is returned. Without one, the latest fit is returned if it converged and
 * the seed fit otherwise.
 * <p>
 * Not thread safe: the proposer consumes a shared random generator. Use one fitter per thread.
 */
public class HierarchicalFitter {

  private static final Logger logger = Logger.getLogger(HierarchicalFitter.class.getName());

  private final int maxComponents;
  private final Range<Double> sigmaRange;
  private final double velocityHalfWidth;
  private final double seedSigma;
  private final SolverMethod method;
  private final double refinementThreshold;
  private final double convergenceThreshold;
  private final double bestFitCeiling;

  private final BoundedSolver solver;
  private final ComponentProposer proposer;

  /**
   * Fitter with an unseeded random source. Results of two runs may differ.
   */
  public HierarchicalFitter(@NotNull ParameterSet parameters) {
    this(parameters, new Well19937c());
  }

  public HierarchicalFitter(@NotNull ParameterSet parameters, @NotNull RandomGenerator random) {
    this(parameters, new BoundedSolver(), new ComponentProposer(random));
  }

  public HierarchicalFitter(@NotNull ParameterSet parameters, @NotNull BoundedSolver solver,
      @NotNull ComponentProposer proposer) {
    final List<String> errors = new ArrayList<>();
    if (!parameters.checkParameterValues(errors)) {
      throw new IllegalArgumentException("Invalid fitter parameters: " + String.join("; ", errors));
    }
    this.maxComponents = parameters.getValue(HierarchicalFitterParameters.maxComponents);
    this.sigmaRange = parameters.getValue(HierarchicalFitterParameters.sigmaRange);
    this.velocityHalfWidth = parameters.getValue(HierarchicalFitterParameters.velocityHalfWidth);
    this.seedSigma = parameters.getValue(HierarchicalFitterParameters.seedSigma);
    this.method = parameters.getValue(HierarchicalFitterParameters.solverMethod);
    this.refinementThreshold = parameters.getValue(
        HierarchicalFitterParameters.refinementThreshold);
    this.convergenceThreshold = parameters.getValue(
        HierarchicalFitterParameters.convergenceThreshold);
    this.bestFitCeiling = parameters.getValue(HierarchicalFitterParameters.bestFitCeiling);
    this.solver = Objects.requireNonNull(solver);
    this.proposer = Objects.requireNonNull(proposer);
  }

  /**
   * Measures the noise outside the line window and decomposes the spectrum.
   *
   * @param referenceVelocity expected line velocity (km/s), center of the line window
   * @throws DegenerateSpectrumException if the noise level is undefined, before any fit
   * @throws SeedFitFailedException      if the single-component fit fails
   * @throws SpectrumFitException        if no channel lies inside the line window
   */
  public @NotNull DecompositionResult decompose(@NotNull Spectrum spectrum,
      double referenceVelocity) throws SpectrumFitException {
    final double rms = NoiseEstimator.computeRms(spectrum, referenceVelocity, velocityHalfWidth);
    checkRms(rms);
    final Range<Integer> window = spectrum.channelWindow(referenceVelocity, velocityHalfWidth)
        .orElseThrow(() -> new SpectrumFitException(String.format(Locale.US,
            "No channel of %s lies within %.3f +/- %.3f km/s", spectrum, referenceVelocity,
            velocityHalfWidth)));
    return decompose(spectrum.getIntensities(), window, rms);
  }

  /**
   * Decomposes intensities on a channel axis with a known noise level.
   *
   * @param intensities intensity per channel, all finite
   * @param lineWindow  channels the first component's position is bounded to
   * @param rms         noise level
   */
  public @NotNull DecompositionResult decompose(double[] intensities,
      @NotNull Range<Integer> lineWindow, double rms) throws SpectrumFitException {
    checkRms(rms);
    Preconditions.checkArgument(intensities.length > 0, "Empty spectrum");
    Preconditions.checkArgument(lineWindow.hasLowerBound() && lineWindow.hasUpperBound(),
        "Line window must be bounded");

    // SEEDED
    final int peak = MathUtils.argmax(intensities);
    final double maxIntensity = intensities[peak];
    final ComponentBounds seedBounds = new ComponentBounds(
        MathUtils.closedRange(3d * rms, maxIntensity),
        Range.closed(lineWindow.lowerEndpoint().doubleValue(),
            lineWindow.upperEndpoint().doubleValue()), sigmaRange);
    final GaussianParameterSet seed = new GaussianParameterSet();
    seed.add(new GaussianComponent(maxIntensity, peak, seedSigma), seedBounds);

    final FitResult seedFit = solver.minimize(intensities, seed, rms, method);
    if (!seedFit.isSuccess()) {
      throw new SeedFitFailedException(seedFit);
    }
    logger.fine(() -> "Seed fit: " + seedFit);

    if (!(seedFit.getReducedChiSquare() > refinementThreshold)) {
      return finish(
          new DecompositionResult(seedFit, seedFit, FitState.ACCEPTED, FitSelection.SEED, rms,
              lineWindow, 0, 0));
    }

    // FITTING
    Optional<FitResult> best = Optional.empty();
    double bestRedChi = seedFit.getReducedChiSquare();
    FitResult latest = seedFit;
    GaussianParameterSet current = seedFit.getParameters();
    double redChi = Double.POSITIVE_INFINITY;
    int attempts = 0;
    int failed = 0;

    while (redChi > convergenceThreshold && current.size() < maxComponents) {
      final GaussianParameterSet proposal = proposer.addGaussian(intensities, current, sigmaRange,
          rms);
      final FitResult fit = solver.minimize(intensities, proposal, rms, method);
      attempts++;
      if (!fit.isSuccess()) {
        failed++;
        logger.fine(() -> "Refinement with " + proposal.size()
            + " components failed, falling back to the previous fits");
        break;
      }
      latest = fit;
      redChi = fit.getReducedChiSquare();
      if (redChi < bestRedChi && redChi > bestFitCeiling) {
        bestRedChi = redChi;
        best = Optional.of(fit);
      }
      logger.fine(() -> "Refinement fit: " + fit);
      current = fit.getParameters();
    }

    final boolean converged = failed == 0 && redChi <= convergenceThreshold;
    final FitState state = converged ? FitState.ACCEPTED : FitState.EXHAUSTED;
    // refinements that neither improved within the band nor converged never replace the seed
    final FitSelection selection;
    final FitResult selected;
    if (best.isPresent()) {
      selection = FitSelection.BEST;
      selected = best.get();
    } else if (converged) {
      selection = FitSelection.LATEST;
      selected = latest;
    } else {
      selection = FitSelection.SEED;
      selected = seedFit;
    }
    return finish(
        new DecompositionResult(selected, latest, state, selection, rms, lineWindow, attempts,
            failed));
  }

  private static void checkRms(double rms) throws DegenerateSpectrumException {
    if (!Double.isFinite(rms) || rms <= 0d) {
      throw new DegenerateSpectrumException(
          "Noise level is undefined (rms=" + rms + "), the spectrum is empty or has zero flux",
          rms);
    }
  }

  private static DecompositionResult finish(DecompositionResult result) {
    logger.info(() -> String.format(Locale.US,
        "Decomposition %s with %d Gaussian(s) (%s fit), reduced chi2=%.3f, rms=%.4g, %d refinement(s)",
        result.state(), result.numberOfComponents(), result.selection(), result.reducedChiSquare(),
        result.rms(), result.attempts()));
    return result;
  }
}
