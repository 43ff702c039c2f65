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

package uk.ac.sussex.gdsc.cosmic.label;

import ij.process.ByteProcessor;
import ij.process.FloatProcessor;
import ij.process.ImageProcessor;
import ij.process.ShortProcessor;
import it.unimi.dsi.fastutil.ints.Int2IntMap;
import it.unimi.dsi.fastutil.ints.Int2IntOpenHashMap;
import java.util.Arrays;
import org.apache.commons.lang3.Validate;

/**
 * An immutable map of object labels. Each pixel holds the id of the object it belongs to; zero is
 * the background.
 *
 * <p>Pixels are stored in row-major order: index {@code i = row * width + column}.
 */
public final class LabelMap {
  private final int width;
  private final int height;
  private final int[] labels;
  private final int maxLabel;

  /**
   * Create a new instance. The labels are not copied.
   *
   * @param width the width
   * @param height the height
   * @param labels the labels
   * @param maxLabel the maximum label
   */
  LabelMap(int width, int height, int[] labels, int maxLabel) {
    this.width = width;
    this.height = height;
    this.labels = labels;
    this.maxLabel = maxLabel;
  }

  /**
   * Create a label map from existing labels. Labels must be non-negative.
   *
   * @param width the width
   * @param height the height
   * @param labels the labels (copied)
   * @return the label map
   * @throws IllegalArgumentException if the dimensions do not match or a label is negative
   */
  public static LabelMap of(int width, int height, int[] labels) {
    Validate.isTrue(width >= 0 && height >= 0, "Invalid dimensions: %dx%d", width, height);
    Validate.isTrue(labels.length == (long) width * height,
        "Label size %d does not match dimensions %dx%d", labels.length, width, height);
    int max = 0;
    for (final int label : labels) {
      Validate.isTrue(label >= 0, "Negative label: %d", label);
      if (max < label) {
        max = label;
      }
    }
    return new LabelMap(width, height, labels.clone(), max);
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
   * Gets the maximum label. If the labels are contiguous this is the number of objects.
   *
   * @return the max label
   */
  public int getMaxLabel() {
    return maxLabel;
  }

  /**
   * Gets the label at the index.
   *
   * @param index the index
   * @return the label
   */
  public int get(int index) {
    return labels[index];
  }

  /**
   * Gets the label at the position.
   *
   * @param row the row
   * @param column the column
   * @return the label
   */
  public int get(int row, int column) {
    return labels[row * width + column];
  }

  /**
   * Get a copy of the labels.
   *
   * @return the labels
   */
  public int[] getLabels() {
    return labels.clone();
  }

  /**
   * Count the pixels assigned to each label. The result is indexed by label; index 0 holds the
   * background count.
   *
   * <p>This is a dense histogram for contiguous labels. Use {@link #getLabelSizes()} for labels
   * that may be sparse.
   *
   * @return the counts
   * @throws IllegalArgumentException if the max label exceeds the number of pixels
   */
  public int[] getLabelCounts() {
    Validate.isTrue(maxLabel <= labels.length,
        "Max label %d exceeds the number of pixels %d; use the label sizes", maxLabel,
        labels.length);
    final int[] counts = new int[maxLabel + 1];
    for (final int label : labels) {
      counts[label]++;
    }
    return counts;
  }

  /**
   * Count the pixels assigned to each label present in the map, including the background label 0
   * if present. Labels with no pixels are absent.
   *
   * @return the sizes (label to count)
   */
  public Int2IntMap getLabelSizes() {
    final Int2IntOpenHashMap sizes = new Int2IntOpenHashMap();
    for (final int label : labels) {
      sizes.addTo(label, 1);
    }
    return sizes;
  }

  /**
   * Check the labels are contiguous from 1 to the max label.
   *
   * @return true if contiguous
   */
  public boolean isContiguous() {
    if (maxLabel > labels.length) {
      return false;
    }
    final int[] counts = getLabelCounts();
    for (int i = 1; i < counts.length; i++) {
      if (counts[i] == 0) {
        return false;
      }
    }
    return true;
  }

  /**
   * Create a foreground mask of the labelled pixels.
   *
   * @return the mask
   */
  public boolean[] toMask() {
    final boolean[] mask = new boolean[labels.length];
    for (int i = 0; i < mask.length; i++) {
      mask[i] = labels[i] != 0;
    }
    return mask;
  }

  /**
   * Convert the labels to an image processor. The smallest integer processor that can hold the
   * max label is used; a float processor is used above 65535 objects.
   *
   * @return the image processor
   */
  public ImageProcessor toProcessor() {
    if (maxLabel <= 255) {
      final byte[] pixels = new byte[labels.length];
      for (int i = 0; i < pixels.length; i++) {
        pixels[i] = (byte) labels[i];
      }
      return new ByteProcessor(width, height, pixels);
    }
    if (maxLabel <= 65535) {
      final short[] pixels = new short[labels.length];
      for (int i = 0; i < pixels.length; i++) {
        pixels[i] = (short) labels[i];
      }
      return new ShortProcessor(width, height, pixels, null);
    }
    return toFloatProcessor();
  }

  /**
   * Convert the labels to a float processor.
   *
   * @return the float processor
   */
  public FloatProcessor toFloatProcessor() {
    final float[] pixels = new float[labels.length];
    for (int i = 0; i < pixels.length; i++) {
      pixels[i] = labels[i];
    }
    return new FloatProcessor(width, height, pixels, null);
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (!(obj instanceof LabelMap)) {
      return false;
    }
    final LabelMap other = (LabelMap) obj;
    return width == other.width && height == other.height && Arrays.equals(labels, other.labels);
  }

  @Override
  public int hashCode() {
    return 31 * (31 * width + height) + Arrays.hashCode(labels);
  }
}
