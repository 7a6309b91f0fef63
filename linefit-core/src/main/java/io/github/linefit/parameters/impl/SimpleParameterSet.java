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

package io.github.linefit.parameters.impl;

import io.github.linefit.parameters.Parameter;
import io.github.linefit.parameters.ParameterSet;
import java.lang.reflect.InvocationTargetException;
import java.util.Arrays;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.stream.Collectors;
import org.jetbrains.annotations.NotNull;

/**
 * Parameter set backed by clones of the declared parameters, looked up by name.
 */
public class SimpleParameterSet implements ParameterSet {

  private final Map<String, Parameter<?>> parameters = new LinkedHashMap<>();

  public SimpleParameterSet(@NotNull Parameter<?>... declared) {
    for (Parameter<?> p : declared) {
      if (parameters.put(p.getName(), p.cloneParameter()) != null) {
        throw new IllegalArgumentException("Duplicate parameter name: " + p.getName());
      }
    }
  }

  @Override
  public @NotNull Parameter<?>[] getParameters() {
    return parameters.values().toArray(new Parameter<?>[0]);
  }

  @Override
  @SuppressWarnings("unchecked")
  public @NotNull <T extends Parameter<?>> T getParameter(@NotNull T parameter) {
    final Parameter<?> p = parameters.get(parameter.getName());
    if (p == null) {
      throw new IllegalArgumentException(
          "Parameter " + parameter.getName() + " is not part of " + getClass().getSimpleName());
    }
    return (T) p;
  }

  @Override
  public boolean checkParameterValues(@NotNull Collection<String> errorMessages) {
    boolean allValid = true;
    for (Parameter<?> p : parameters.values()) {
      allValid &= p.checkValue(errorMessages);
    }
    return allValid;
  }

  /**
   * Creates a new instance of the concrete class and copies all values. Subclasses need a public
   * no-arg constructor.
   */
  @Override
  @SuppressWarnings({"unchecked", "rawtypes"})
  public @NotNull ParameterSet cloneParameterSet() {
    final SimpleParameterSet clone;
    try {
      clone = getClass().getDeclaredConstructor().newInstance();
    } catch (InstantiationException | IllegalAccessException | InvocationTargetException
             | NoSuchMethodException e) {
      throw new IllegalStateException("Cannot clone " + getClass().getName(), e);
    }
    for (Parameter<?> p : parameters.values()) {
      ((Parameter) clone.getParameter(p)).setValue(p.getValue());
    }
    return clone;
  }

  @Override
  public String toString() {
    return Arrays.stream(getParameters()).map(p -> p.getName() + ": " + p.getValue())
        .collect(Collectors.joining("\n"));
  }
}
