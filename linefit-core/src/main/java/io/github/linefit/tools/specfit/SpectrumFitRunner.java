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

import com.google.common.collect.Range;
import io.github.linefit.datamodel.Spectrum;
import io.github.linefit.modules.dataprocessing.gaussdecomp.DecompositionResult;
import io.github.linefit.modules.dataprocessing.gaussdecomp.DegenerateSpectrumException;
import io.github.linefit.modules.dataprocessing.gaussdecomp.HierarchicalFitter;
import io.github.linefit.modules.dataprocessing.gaussdecomp.HierarchicalFitterParameters;
import io.github.linefit.modules.dataprocessing.gaussdecomp.SolverMethod;
import io.github.linefit.modules.dataprocessing.gaussdecomp.SpectrumFitException;
import io.github.linefit.parameters.ParameterSet;
import io.github.linefit.util.CSVParsingUtils;
import io.github.linefit.util.ExitCode;
import io.github.linefit.util.SpectralUnits;
import java.io.BufferedReader;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.apache.commons.math3.random.RandomGenerator;
import org.apache.commons.math3.random.Well19937c;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Standalone runner that decomposes one averaged spectrum into Gaussians and writes the parameter
 * table. The spectrum file holds comma separated rows of frequency (Hz) and intensity; trailing
 * "nan" samples are dropped.
 * <p>
 * Usage:
 * <pre>
 *   SpectrumFitRunner spectrumFile referenceVelocity
 *     -DoutFile=... -DrestFrequency=6668.5192 -DchannelWidth=1.0 -Dseed=42
 *     -DmaxComponents=10 -DsigmaMin=1 -DsigmaMax=30 -DhalfWidth=7 -DseedSigma=10 -Dmethod=leastsq
 * </pre>
 * Frequencies in MHz, channel width in kHz, velocities in km/s.
 */
public class SpectrumFitRunner {

  private static final Logger logger = Logger.getLogger(SpectrumFitRunner.class.getName());

  public static void main(String[] args) throws Exception {
    final String fileArg = (args != null && args.length > 0 && args[0] != null && !args[0].isBlank())
        ? args[0] : System.getProperty("spectrum", "");
    final String velocityArg = (args != null && args.length > 1 && args[1] != null
        && !args[1].isBlank()) ? args[1] : System.getProperty("vlsr", "");
    if (fileArg.isBlank() || velocityArg.isBlank()) {
      System.err.println(
          "Please provide the spectrum file and the reference velocity (km/s) as CLI args or via -Dspectrum and -Dvlsr.");
      System.exit(2);
      return;
    }
    final Path spectrumFile = Paths.get(fileArg).toAbsolutePath().normalize();
    final double referenceVelocity = Double.parseDouble(velocityArg);
    final Path outFile = Paths.get(
        System.getProperty("outFile", stripExtension(spectrumFile) + "_gaussians"));
    final double restFrequency = Double.parseDouble(
        System.getProperty("restFrequency", String.valueOf(SpectralUnits.METHANOL_6_7GHZ_MHZ)));
    final String channelWidthStr = System.getProperty("channelWidth", "").trim();
    final Double channelWidth = channelWidthStr.isEmpty() ? null
        : Double.parseDouble(channelWidthStr);
    final String seedStr = System.getProperty("seed", "").trim();
    final RandomGenerator random = seedStr.isEmpty() ? new Well19937c()
        : new Well19937c(Long.parseLong(seedStr));

    final ExitCode code = run(spectrumFile, referenceVelocity, outFile, restFrequency,
        channelWidth, parametersFromSystemProperties(), random);
    if (code != ExitCode.OK) {
      System.exit(1);
    }
  }

  /**
   * Reads, decomposes and writes one spectrum. Fit failures are reported, never thrown.
   *
   * @param channelWidthKHz channel width for the FWHM conversion, null to use the mean channel
   *                        spacing of the file
   */
  public static @NotNull ExitCode run(@NotNull Path spectrumFile, double referenceVelocity,
      @NotNull Path outFile, double restFrequency, @Nullable Double channelWidthKHz,
      @NotNull ParameterSet parameters, @NotNull RandomGenerator random) {
    final Spectrum spectrum;
    try {
      spectrum = readSpectrum(spectrumFile, restFrequency);
    } catch (IOException e) {
      logger.log(Level.WARNING, "Cannot read spectrum " + spectrumFile, e);
      return ExitCode.ERROR;
    }
    if (spectrum.getNumberOfChannels() == 0) {
      logger.warning("No valid samples in " + spectrumFile);
      return ExitCode.ERROR;
    }

    final DecompositionResult result;
    try {
      result = new HierarchicalFitter(parameters, random).decompose(spectrum, referenceVelocity);
    } catch (DegenerateSpectrumException e) {
      logger.warning("Skipping " + spectrumFile.getFileName() + ": " + e.getMessage());
      return ExitCode.ERROR;
    } catch (SpectrumFitException e) {
      logger.log(Level.WARNING, "Cannot fit " + spectrumFile.getFileName(), e);
      return ExitCode.ERROR;
    }

    System.out.printf(Locale.US, "%s: rms=%.4g, the best fit (reduced chi2=%4.2f) predicts %d gaussians.%n",
        spectrumFile.getFileName(), result.rms(), result.reducedChiSquare(),
        result.numberOfComponents());

    final double widthKHz = channelWidthKHz != null ? channelWidthKHz
        : spectrum.getMeanChannelWidth() * 1e3;
    try {
      new GaussianTableWriter(widthKHz, "K").write(outFile, spectrum, result);
    } catch (IOException e) {
      logger.log(Level.WARNING, "Cannot write " + outFile, e);
      return ExitCode.ERROR;
    }
    return ExitCode.OK;
  }

  public static @NotNull ParameterSet parametersFromSystemProperties() {
    final HierarchicalFitterParameters params = new HierarchicalFitterParameters();
    params.setParameter(HierarchicalFitterParameters.maxComponents,
        Integer.parseInt(System.getProperty("maxComponents", "10")));
    params.setParameter(HierarchicalFitterParameters.sigmaRange,
        Range.closed(Double.parseDouble(System.getProperty("sigmaMin", "1")),
            Double.parseDouble(System.getProperty("sigmaMax", "30"))));
    params.setParameter(HierarchicalFitterParameters.velocityHalfWidth,
        Double.parseDouble(System.getProperty("halfWidth", "7")));
    params.setParameter(HierarchicalFitterParameters.seedSigma,
        Double.parseDouble(System.getProperty("seedSigma", "10")));
    params.setParameter(HierarchicalFitterParameters.solverMethod,
        SolverMethod.fromIdentifier(System.getProperty("method", "leastsq")));
    return params;
  }

  /**
   * @param restFrequency rest frequency in MHz
   */
  static @NotNull Spectrum readSpectrum(@NotNull Path file, double restFrequency)
      throws IOException {
    final char sep = CSVParsingUtils.autoDetermineSeparatorDefaultFallback(file.toFile());
    final List<String[]> rows;
    try (BufferedReader br = Files.newBufferedReader(file)) {
      rows = CSVParsingUtils.readData(br, String.valueOf(sep));
    }
    final List<double[]> values = new ArrayList<>(rows.size());
    for (String[] row : rows) {
      if (row.length < 2) {
        continue;
      }
      final Double frequency = CSVParsingUtils.parseDoubleOrNull(row[0]);
      final Double intensity = CSVParsingUtils.parseDoubleOrNull(row[1]);
      // header or broken line
      if (frequency == null || intensity == null || !Double.isFinite(frequency)) {
        continue;
      }
      values.add(new double[]{frequency / 1e6, intensity});
    }
    final double[] frequencies = new double[values.size()];
    final double[] intensities = new double[values.size()];
    for (int i = 0; i < values.size(); i++) {
      frequencies[i] = values.get(i)[0];
      intensities[i] = values.get(i)[1];
    }
    return Spectrum.of(frequencies, intensities, restFrequency);
  }

  private static String stripExtension(Path file) {
    final String s = file.toString();
    final int dot = s.lastIndexOf('.');
    final int slash = s.lastIndexOf(file.getFileSystem().getSeparator());
    return dot > slash ? s.substring(0, dot) : s;
  }
}
