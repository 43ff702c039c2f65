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

import it.unimi.dsi.fastutil.ints.Int2IntMap;
import it.unimi.dsi.fastutil.ints.Int2IntMaps;
import it.unimi.dsi.fastutil.ints.IntOpenHashSet;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.apache.commons.lang3.Validate;

/**
 * Remove objects from a label map using their pixel count.
 *
 * <p>An object is kept if its count {@code c} satisfies {@code lower < c < upper}. The largest
 * label (including the background label 0) is assumed to be the background and is always
 * removed. This protects against an inverted or saturated mask where a single dominant region is
 * labelled as an object. It is a heuristic: an image with no background majority will lose its
 * largest object.
 */
public class SizeFilter {
  private final int lower;
  private final int upper;
  private final Logger logger;

  /**
   * Create a new instance.
   *
   * @param lower the exclusive lower bound on the object size
   * @param upper the exclusive upper bound on the object size
   * @param logger the logger (can be null)
   * @throws IllegalArgumentException if a bound is negative or {@code lower >= upper}
   */
  public SizeFilter(int lower, int upper, Logger logger) {
    Validate.isTrue(lower >= 0, "Lower threshold is negative: %d", lower);
    Validate.isTrue(upper >= 0, "Upper threshold is negative: %d", upper);
    Validate.isTrue(lower < upper, "Lower threshold %d is not below upper threshold %d", lower,
        upper);
    this.lower = lower;
    this.upper = upper;
    this.logger = logger == null ? Logger.getLogger(SizeFilter.class.getName()) : logger;
  }

  /**
   * Gets the lower bound.
   *
   * @return the lower bound
   */
  public int getLower() {
    return lower;
  }

  /**
   * Gets the upper bound.
   *
   * @return the upper bound
   */
  public int getUpper() {
    return upper;
  }

  /**
   * Find the label with the largest count. Ties are resolved using the lowest label.
   *
   * @param sizes the sizes (label to count)
   * @return the largest label (or -1 if the sizes are empty)
   */
  static int findLargestLabel(Int2IntMap sizes) {
    int largest = -1;
    int max = -1;
    for (final Int2IntMap.Entry entry : Int2IntMaps.fastIterable(sizes)) {
      final int label = entry.getIntKey();
      final int count = entry.getIntValue();
      if (max < count || (max == count && label < largest)) {
        max = count;
        largest = label;
      }
    }
    return largest;
  }

  /**
   * Filter the objects. Returns the mask of pixels belonging to the retained objects.
   *
   * <p>The labels need not be contiguous.
   *
   * @param labels the labels
   * @return the filtered mask
   */
  public boolean[] filter(LabelMap labels) {
    final Int2IntMap sizes = labels.getLabelSizes();
    final int largest = findLargestLabel(sizes);
    if (largest > 0) {
      logger.log(Level.FINE, () -> String.format(
          "Largest object %d (%d pixels) exceeds the background and is removed", largest,
          sizes.get(largest)));
    }

    final IntOpenHashSet keep = new IntOpenHashSet();
    for (final Int2IntMap.Entry entry : Int2IntMaps.fastIterable(sizes)) {
      final int label = entry.getIntKey();
      final int count = entry.getIntValue();
      if (label != 0 && label != largest && lower < count && count < upper) {
        keep.add(label);
      }
    }
    final int objects = sizes.size() - (sizes.containsKey(0) ? 1 : 0);
    logger.log(Level.FINE, () -> String.format("Retained %d / %d objects with size in (%d, %d)",
        keep.size(), objects, lower, upper));

    final int size = labels.getWidth() * labels.getHeight();
    final boolean[] mask = new boolean[size];
    for (int i = 0; i < size; i++) {
      mask[i] = keep.contains(labels.get(i));
    }
    return mask;
  }
}
