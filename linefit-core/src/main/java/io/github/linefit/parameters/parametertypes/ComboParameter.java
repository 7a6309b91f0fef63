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

import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Selection of one value out of a fixed list of choices.
 */
public class ComboParameter<ValueType> extends AbstractParameter<ValueType> {

  private final List<ValueType> choices;

  public ComboParameter(@NotNull String name, @NotNull String description,
      @NotNull ValueType[] choices, @Nullable ValueType defaultValue) {
    this(name, description, Arrays.asList(choices), defaultValue);
  }

  public ComboParameter(@NotNull String name, @NotNull String description,
      @NotNull List<ValueType> choices, @Nullable ValueType defaultValue) {
    super(name, description, defaultValue);
    this.choices = List.copyOf(choices);
  }

  public @NotNull List<ValueType> getChoices() {
    return choices;
  }

  @Override
  public boolean checkValue(@NotNull Collection<String> errorMessages) {
    if (!super.checkValue(errorMessages)) {
      return false;
    }
    if (!choices.contains(value)) {
      errorMessages.add(getName() + ": " + value + " is not one of " + choices);
      return false;
    }
    return true;
  }

  @Override
  public @NotNull ComboParameter<ValueType> cloneParameter() {
    return new ComboParameter<>(getName(), getDescription(), choices, value);
  }
}
