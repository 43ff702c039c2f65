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

import java.util.Arrays;
import org.apache.commons.lang3.Validate;

/**
 * Find objects defined by connected foreground pixels of a binary mask.
 *
 * <p>Objects are numbered from 1 in the order they are discovered by a raster scan of the mask.
 * Each object is expanded using a breadth-first search of the neighbours defined by the
 * {@link ConnectivityStructure}.
 */
public class ObjectLabeller {
  private final ConnectivityStructure structure;

  /**
   * Create a new instance using 8-connectivity.
   */
  public ObjectLabeller() {
    this(ConnectivityStructure.EIGHT);
  }

  /**
   * Create a new instance.
   *
   * @param structure the connectivity structure
   */
  public ObjectLabeller(ConnectivityStructure structure) {
    this.structure = Validate.notNull(structure, "Structure is null");
  }

  /**
   * Gets the connectivity structure.
   *
   * @return the structure
   */
  public ConnectivityStructure getStructure() {
    return structure;
  }

  /**
   * Label the connected objects in the mask.
   *
   * @param mask the mask (row-major)
   * @param width the width
   * @param height the height
   * @return the label map
   * @throws IllegalArgumentException if the mask size does not match the dimensions
   */
  public LabelMap label(boolean[] mask, int width, int height) {
    Validate.isTrue(width >= 0 && height >= 0, "Invalid dimensions: %dx%d", width, height);
    Validate.isTrue(mask.length == (long) width * height,
        "Mask size %d does not match dimensions %dx%d", mask.length, width, height);

    final int[] objectMask = new int[mask.length];
    int maxObject = 0;

    final int neighbours = structure.getNeighbourCount();
    final int[] offset = new int[neighbours];
    for (int d = 0; d < neighbours; d++) {
      offset[d] = width * structure.getOffsetY(d) + structure.getOffsetX(d);
    }
    final int xlimit = width - 1;
    final int ylimit = height - 1;

    int[] pointList = new int[100];

    for (int i = 0; i < mask.length; i++) {
      // Look for foreground pixels that are not already in an object
      if (!mask[i] || objectMask[i] != 0) {
        continue;
      }
      final int id = ++maxObject;
      objectMask[i] = id;
      int listI = 0;
      int listLen = 1;
      pointList[0] = i;

      do {
        final int index1 = pointList[listI];
        final int x1 = index1 % width;
        final int y1 = index1 / width;

        final boolean isInner = (y1 != 0 && y1 != ylimit) && (x1 != 0 && x1 != xlimit);

        for (int d = 0; d < neighbours; d++) {
          if (!isInner) {
            final int x2 = x1 + structure.getOffsetX(d);
            final int y2 = y1 + structure.getOffsetY(d);
            if (x2 < 0 || x2 > xlimit || y2 < 0 || y2 > ylimit) {
              continue;
            }
          }
          final int index2 = index1 + offset[d];
          if (mask[index2] && objectMask[index2] == 0) {
            objectMask[index2] = id;
            pointList[listLen++] = index2;
            if (pointList.length == listLen) {
              pointList = Arrays.copyOf(pointList, (int) (listLen * 1.5));
            }
          }
        }

        listI++;
      } while (listI < listLen);
    }

    return new LabelMap(width, height, objectMask, maxObject);
  }
}
