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

package io.github.linefit.parameters.parametertypes;

import com.google.common.collect.Range;
import java.text.NumberFormat;
import java.util.Collection;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Closed range of doubles, optionally restricted to a range of allowed values.
 */
public class DoubleRangeParameter extends AbstractParameter<Range<Double>> {

  private final NumberFormat format;
  private final @Nullable Range<Double> allowedValues;

  public DoubleRangeParameter(@NotNull String name, @NotNull String description,
      @NotNull NumberFormat format, @Nullable Range<Double> defaultValue) {
    this(name, description, format, defaultValue, null);
  }

  public DoubleRangeParameter(@NotNull String name, @NotNull String description,
      @NotNull NumberFormat format, @Nullable Range<Double> defaultValue,
      @Nullable Range<Double> allowedValues) {
    super(name, description, defaultValue);
    this.format = format;
    this.allowedValues = allowedValues;
  }

  public NumberFormat getFormat() {
    return format;
  }

  @Override
  public boolean checkValue(@NotNull Collection<String> errorMessages) {
    if (!super.checkValue(errorMessages)) {
      return false;
    }
    if (!value.hasLowerBound() || !value.hasUpperBound()) {
      errorMessages.add(getName() + " must have a lower and an upper bound");
      return false;
    }
    if (allowedValues != null && !allowedValues.encloses(value)) {
      errorMessages.add(getName() + " must lie within " + format.format(
          allowedValues.lowerEndpoint()) + " - " + format.format(allowedValues.upperEndpoint()));
      return false;
    }
    return true;
  }

  @Override
  public @NotNull DoubleRangeParameter cloneParameter() {
    return new DoubleRangeParameter(getName(), getDescription(), format, value, allowedValues);
  }
}
