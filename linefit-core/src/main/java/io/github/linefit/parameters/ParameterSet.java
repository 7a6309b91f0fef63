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

package io.github.linefit.parameters;

import java.util.Collection;
import org.jetbrains.annotations.NotNull;

public interface ParameterSet {

  @NotNull Parameter<?>[] getParameters();

  /**
   * @param parameter the static declaration of the parameter
   * @return this set's instance of the parameter
   * @throws IllegalArgumentException if this set does not declare the parameter
   */
  @NotNull <T extends Parameter<?>> T getParameter(@NotNull T parameter);

  default <V, T extends Parameter<V>> V getValue(@NotNull T parameter) {
    return getParameter(parameter).getValue();
  }

  default <V, T extends Parameter<V>> void setParameter(@NotNull T parameter, V value) {
    getParameter(parameter).setValue(value);
  }

  boolean checkParameterValues(@NotNull Collection<String> errorMessages);

  @NotNull ParameterSet cloneParameterSet();
}
