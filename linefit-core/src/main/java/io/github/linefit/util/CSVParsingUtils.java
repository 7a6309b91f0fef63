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

import java.io.BufferedReader;
import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

public class CSVParsingUtils {

  private static final char[] SEPARATORS = {',', '\t', ';'};

  private CSVParsingUtils() {
  }

  /**
   * Reads all non-blank lines that do not start with {@code #} and splits them at the separator.
   * Cells are trimmed.
   */
  public static @NotNull List<String[]> readData(@NotNull BufferedReader reader,
      @NotNull String separator) throws IOException {
    final Pattern split = Pattern.compile(Pattern.quote(separator));
    final List<String[]> rows = new ArrayList<>();
    String line;
    while ((line = reader.readLine()) != null) {
      final String trimmed = line.trim();
      if (trimmed.isEmpty() || trimmed.startsWith("#")) {
        continue;
      }
      final String[] cells = split.split(trimmed, -1);
      for (int i = 0; i < cells.length; i++) {
        cells[i] = cells[i].trim();
      }
      rows.add(cells);
    }
    return rows;
  }

  /**
   * Picks the separator that occurs in the first data line. Falls back to a comma.
   */
  public static char autoDetermineSeparatorDefaultFallback(@NotNull File file) throws IOException {
    try (BufferedReader br = Files.newBufferedReader(file.toPath())) {
      String line;
      while ((line = br.readLine()) != null) {
        final String trimmed = line.trim();
        if (trimmed.isEmpty() || trimmed.startsWith("#")) {
          continue;
        }
        for (char sep : SEPARATORS) {
          if (trimmed.indexOf(sep) >= 0) {
            return sep;
          }
        }
        break;
      }
    }
    return ',';
  }

  /**
   * Lenient number parsing. Accepts "nan", "inf" and "-inf" in any case, as written by numpy.
   *
   * @return the parsed value or null if the cell is not a number
   */
  public static @Nullable Double parseDoubleOrNull(@Nullable String cell) {
    if (cell == null || cell.isBlank()) {
      return null;
    }
    final String s = cell.trim().toLowerCase(Locale.ROOT);
    switch (s) {
      case "nan":
        return Double.NaN;
      case "inf":
      case "+inf":
      case "infinity":
        return Double.POSITIVE_INFINITY;
      case "-inf":
      case "-infinity":
        return Double.NEGATIVE_INFINITY;
      default:
        try {
          return Double.parseDouble(s);
        } catch (NumberFormatException e) {
          return null;
        }
    }
  }
}
