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

import com.google.common.collect.Range;
import org.apache.commons.math3.stat.descriptive.moment.StandardDeviation;
import org.jetbrains.annotations.NotNull;

public class MathUtils {

  private MathUtils() {
  }

  /**
   * @return index of the first maximum, -1 for an empty array. NaN values are skipped.
   */
  public static int argmax(double[] values) {
    int idx = -1;
    double max = Double.NEGATIVE_INFINITY;
    for (int i = 0; i < values.length; i++) {
      if (values[i] > max || (idx < 0 && !Double.isNaN(values[i]))) {
        max = values[i];
        idx = i;
      }
    }
    return idx;
  }

  /**
   * @return index of the first minimum, -1 for an empty array. NaN values are skipped.
   */
  public static int argmin(double[] values) {
    int idx = -1;
    double min = Double.POSITIVE_INFINITY;
    for (int i = 0; i < values.length; i++) {
      if (values[i] < min || (idx < 0 && !Double.isNaN(values[i]))) {
        min = values[i];
        idx = i;
      }
    }
    return idx;
  }

  /**
   * Sum of all finite values.
   */
  public static double nanSum(double[] values) {
    double sum = 0d;
    for (double v : values) {
      if (Double.isFinite(v)) {
        sum += v;
      }
    }
    return sum;
  }

  /**
   * Population standard deviation (no bias correction) of all finite values.
   *
   * @return NaN if there is no finite value
   */
  public static double nanStd(double[] values) {
    final StandardDeviation std = new StandardDeviation(false);
    for (double v : values) {
      if (Double.isFinite(v)) {
        std.increment(v);
      }
    }
    return std.getN() == 0 ? Double.NaN : std.getResult();
  }

  /**
   * Closed range over two bounds given in any order.
   */
  public static @NotNull Range<Double> closedRange(double a, double b) {
    return Range.closed(Math.min(a, b), Math.max(a, b));
  }

  public static double clamp(double value, @NotNull Range<Double> range) {
    return Math.max(range.lowerEndpoint(), Math.min(range.upperEndpoint(), value));
  }
}
