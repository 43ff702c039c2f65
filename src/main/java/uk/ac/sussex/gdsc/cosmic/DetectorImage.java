/*-
 * #%L
 * Genome Damage and Stability Centre Cosmic Ray Analysis
 *
 * Software for detector cosmic ray labelling and statistics
 * %%
 * Copyright (C) 2011 - 2022 Alex Herbert
 * %%
 * This program is free software: you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as
 * published by the Free Software Foundation, either version 3 of the
 * License, or (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Public License for more details.
 *
 * You should have received a copy of the GNU General Public
 * License along with this program.  If not, see
 * <http://www.gnu.org/licenses/gpl-3.0.html>.
 * #L%
 */

package uk.ac.sussex.gdsc.cosmic;

import ij.process.ImageProcessor;
import org.apache.commons.lang3.Validate;

/**
 * A read-only view of a detector exposure: the science intensity, the data-quality flags and the
 * integration time.
 *
 * <p>Pixels are stored in row-major order: index {@code i = row * width + column}.
 */
public final class DetectorImage {
  private final String name;
  private final int width;
  private final int height;
  private final float[] sci;
  private final int[] dq;
  private final double integrationTime;

  /**
   * Create a new instance. The arrays are copied.
   *
   * @param name the name used in diagnostics (can be null)
   * @param width the width
   * @param height the height
   * @param sci the science intensity
   * @param dq the data-quality flags
   * @param integrationTime the integration time (seconds)
   * @throws IllegalArgumentException if an array does not match the dimensions or the integration
   *         time is negative or not finite
   */
  public DetectorImage(String name, int width, int height, float[] sci, int[] dq,
      double integrationTime) {
    Validate.isTrue(width >= 0 && height >= 0, "Invalid dimensions: %dx%d", width, height);
    final long size = (long) width * height;
    Validate.notNull(sci, "SCI array is null");
    Validate.notNull(dq, "DQ array is null");
    Validate.isTrue(sci.length == size, "SCI size %d does not match dimensions %dx%d",
        sci.length, width, height);
    Validate.isTrue(dq.length == size, "DQ size %d does not match dimensions %dx%d", dq.length,
        width, height);
    Validate.isTrue(integrationTime >= 0 && Double.isFinite(integrationTime),
        "Invalid integration time: %s", integrationTime);
    this.name = name == null ? "" : name;
    this.width = width;
    this.height = height;
    this.sci = sci.clone();
    this.dq = dq.clone();
    this.integrationTime = integrationTime;
  }

  /**
   * Create a new instance from image processors.
   *
   * <p>The science values are read as floats. The data-quality flags are read using the integer
   * value of each pixel; a {@link ij.process.FloatProcessor} must contain integer flag values.
   *
   * @param name the name used in diagnostics (can be null)
   * @param sci the science intensity
   * @param dq the data-quality flags
   * @param integrationTime the integration time (seconds)
   * @return the detector image
   * @throws IllegalArgumentException if the processors have different dimensions
   */
  public static DetectorImage fromProcessors(String name, ImageProcessor sci, ImageProcessor dq,
      double integrationTime) {
    Validate.isTrue(sci.getWidth() == dq.getWidth() && sci.getHeight() == dq.getHeight(),
        "SCI %dx%d and DQ %dx%d dimensions do not match", sci.getWidth(), sci.getHeight(),
        dq.getWidth(), dq.getHeight());
    final int size = sci.getPixelCount();
    final float[] sciPixels = new float[size];
    final int[] dqPixels = new int[size];
    for (int i = 0; i < size; i++) {
      sciPixels[i] = sci.getf(i);
      dqPixels[i] = (int) dq.getf(i);
    }
    return new DetectorImage(name, sci.getWidth(), sci.getHeight(), sciPixels, dqPixels,
        integrationTime);
  }

  /**
   * Gets the name.
   *
   * @return the name
   */
  public String getName() {
    return name;
  }

  /**
   * Gets the width.
   *
   * @return the width
   */
  public int getWidth() {
    return width;
  }

  /**
   * Gets the height.
   *
   * @return the height
   */
  public int getHeight() {
    return height;
  }

  /**
   * Gets the number of pixels.
   *
   * @return the size
   */
  public int getSize() {
    return sci.length;
  }

  /**
   * Gets the science value.
   *
   * @param index the index
   * @return the value
   */
  public float getSci(int index) {
    return sci[index];
  }

  /**
   * Gets the data-quality flags.
   *
   * @param index the index
   * @return the flags
   */
  public int getDq(int index) {
    return dq[index];
  }

  /**
   * Get a copy of the science values.
   *
   * @return the science values
   */
  public float[] getSci() {
    return sci.clone();
  }

  /**
   * Get a copy of the data-quality flags.
   *
   * @return the flags
   */
  public int[] getDq() {
    return dq.clone();
  }

  /**
   * Gets the integration time.
   *
   * @return the integration time (seconds)
   */
  public double getIntegrationTime() {
    return integrationTime;
  }
}
