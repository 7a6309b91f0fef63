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

package io.github.linefit.datamodel;

import com.google.common.base.Preconditions;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.jetbrains.annotations.NotNull;

/**
 * Ordered set of Gaussian components and their bounds. Components are appended one at a time and
 * refined in place by the solver; they are never removed. The flat parameter layout used by the
 * solver is {@code [A_0, mu_0, sigma_0, A_1, mu_1, sigma_1, ...]}.
 */
public class GaussianParameterSet {

  public static final int PARAMETERS_PER_COMPONENT = 3;

  private final List<GaussianComponent> components = new ArrayList<>();
  private final List<ComponentBounds> bounds = new ArrayList<>();

  public GaussianParameterSet() {
  }

  /**
   * Appends a component. Its values are clamped into the bounds.
   *
   * @return the index of the new component
   */
  public int add(@NotNull GaussianComponent component, @NotNull ComponentBounds componentBounds) {
    Objects.requireNonNull(component);
    Objects.requireNonNull(componentBounds);
    components.add(componentBounds.clamp(component));
    bounds.add(componentBounds);
    return components.size() - 1;
  }

  public int size() {
    return components.size();
  }

  public boolean isEmpty() {
    return components.isEmpty();
  }

  public int getNumberOfParameters() {
    return components.size() * PARAMETERS_PER_COMPONENT;
  }

  public @NotNull GaussianComponent getComponent(int index) {
    return components.get(index);
  }

  public @NotNull ComponentBounds getBounds(int index) {
    return bounds.get(index);
  }

  public void setComponent(int index, @NotNull GaussianComponent component) {
    components.set(index, bounds.get(index).clamp(Objects.requireNonNull(component)));
  }

  public @NotNull List<GaussianComponent> getComponents() {
    return List.copyOf(components);
  }

  /**
   * @return flat parameter vector
   */
  public double[] getValues() {
    final double[] values = new double[getNumberOfParameters()];
    for (int i = 0; i < components.size(); i++) {
      final GaussianComponent c = components.get(i);
      values[i * PARAMETERS_PER_COMPONENT] = c.amplitude();
      values[i * PARAMETERS_PER_COMPONENT + 1] = c.center();
      values[i * PARAMETERS_PER_COMPONENT + 2] = c.sigma();
    }
    return values;
  }

  /**
   * Updates all components from a flat parameter vector. Values are clamped into the bounds.
   */
  public void setValues(double[] values) {
    Preconditions.checkArgument(values.length == getNumberOfParameters(),
        "Expected %s parameters but got %s", getNumberOfParameters(), values.length);
    for (int i = 0; i < components.size(); i++) {
      setComponent(i, new GaussianComponent(values[i * PARAMETERS_PER_COMPONENT],
          values[i * PARAMETERS_PER_COMPONENT + 1], values[i * PARAMETERS_PER_COMPONENT + 2]));
    }
  }

  public double[] getLowerBounds() {
    final double[] lower = new double[getNumberOfParameters()];
    for (int i = 0; i < bounds.size(); i++) {
      final ComponentBounds b = bounds.get(i);
      lower[i * PARAMETERS_PER_COMPONENT] = b.amplitude().lowerEndpoint();
      lower[i * PARAMETERS_PER_COMPONENT + 1] = b.center().lowerEndpoint();
      lower[i * PARAMETERS_PER_COMPONENT + 2] = b.sigma().lowerEndpoint();
    }
    return lower;
  }

  public double[] getUpperBounds() {
    final double[] upper = new double[getNumberOfParameters()];
    for (int i = 0; i < bounds.size(); i++) {
      final ComponentBounds b = bounds.get(i);
      upper[i * PARAMETERS_PER_COMPONENT] = b.amplitude().upperEndpoint();
      upper[i * PARAMETERS_PER_COMPONENT + 1] = b.center().upperEndpoint();
      upper[i * PARAMETERS_PER_COMPONENT + 2] = b.sigma().upperEndpoint();
    }
    return upper;
  }

  public @NotNull GaussianParameterSet copy() {
    final GaussianParameterSet copy = new GaussianParameterSet();
    copy.components.addAll(components);
    copy.bounds.addAll(bounds);
    return copy;
  }

  @Override
  public String toString() {
    final StringBuilder b = new StringBuilder("GaussianParameterSet[");
    for (int i = 0; i < components.size(); i++) {
      final GaussianComponent c = components.get(i);
      if (i > 0) {
        b.append(", ");
      }
      b.append(String.format("g%d(A=%.4g, mu=%.4g, sigma=%.4g)", i + 1, c.amplitude(),
          c.center(), c.sigma()));
    }
    return b.append(']').toString();
  }
}
