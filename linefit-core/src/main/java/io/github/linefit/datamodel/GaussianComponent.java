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

/**
 * One Gaussian line component. Center and width are in channel units, the amplitude is in the
 * unit of the spectrum intensity.
 *
 * @param amplitude peak height A
 * @param center    position mu (channel index, fractional)
 * @param sigma     standard deviation (channels)
 */
public record GaussianComponent(double amplitude, double center, double sigma) {

  /**
   * @return A * exp(-(x - mu)^2 / (2 sigma^2))
   */
  public double valueAt(double x) {
    final double d = x - center;
    return amplitude * Math.exp(-(d * d) / (2d * sigma * sigma));
  }

  public GaussianComponent withValues(double amplitude, double center, double sigma) {
    return new GaussianComponent(amplitude, center, sigma);
  }
}
