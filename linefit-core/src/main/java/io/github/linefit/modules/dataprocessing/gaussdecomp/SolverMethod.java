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

import java.util.Arrays;
import java.util.Locale;
import org.jetbrains.annotations.NotNull;

/**
 * Least-squares routines available to the {@link BoundedSolver}.
 */
public enum SolverMethod {
  LEASTSQ("leastsq", "Levenberg-Marquardt"), //
  GAUSS_NEWTON("gauss_newton", "Gauss-Newton (QR)");

  private final String identifier;
  private final String label;

  SolverMethod(String identifier, String label) {
    this.identifier = identifier;
    this.label = label;
  }

  public @NotNull String getIdentifier() {
    return identifier;
  }

  /**
   * @throws IllegalArgumentException for an unknown identifier
   */
  public static @NotNull SolverMethod fromIdentifier(@NotNull String identifier) {
    final String id = identifier.trim().toLowerCase(Locale.ROOT);
    return Arrays.stream(values()).filter(m -> m.identifier.equals(id)).findFirst().orElseThrow(
        () -> new IllegalArgumentException(
            "Unknown solver method '" + identifier + "', expected one of " + Arrays.toString(
                Arrays.stream(values()).map(SolverMethod::getIdentifier).toArray())));
  }

  @Override
  public String toString() {
    return label;
  }
}
