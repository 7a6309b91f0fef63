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

import com.google.common.collect.Range;
import io.github.linefit.util.MathUtils;
import java.util.Objects;
import org.jetbrains.annotations.NotNull;

/**
 * Box constraints for the three parameters of a {@link GaussianComponent}.
 */
public record ComponentBounds(@NotNull Range<Double> amplitude, @NotNull Range<Double> center,
                              @NotNull Range<Double> sigma) {

  public ComponentBounds {
    Objects.requireNonNull(amplitude);
    Objects.requireNonNull(center);
    Objects.requireNonNull(sigma);
  }

  /**
   * @return the component with every parameter moved into its bounds
   */
  public @NotNull GaussianComponent clamp(@NotNull GaussianComponent component) {
    return component.withValues(MathUtils.clamp(component.amplitude(), amplitude),
        MathUtils.clamp(component.center(), center), MathUtils.clamp(component.sigma(), sigma));
  }

  public boolean contains(@NotNull GaussianComponent component) {
    return amplitude.contains(component.amplitude()) && center.contains(component.center())
        && sigma.contains(component.sigma());
  }

  public ComponentBounds withAmplitude(@NotNull Range<Double> amplitude) {
    return new ComponentBounds(amplitude, center, sigma);
  }

  public ComponentBounds withSigma(@NotNull Range<Double> sigma) {
    return new ComponentBounds(amplitude, center, sigma);
  }
}
