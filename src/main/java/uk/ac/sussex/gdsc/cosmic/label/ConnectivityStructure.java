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
 * Define the adjacency rule used to connect foreground pixels into objects.
 *
 * <p>The structure is a 3x3 boolean kernel centred on a pixel. A neighbour is connected if the
 * kernel is set at its relative position. The kernel must be point-symmetric about the centre so
 * that connectivity is symmetric, and the centre must be set.
 */
public final class ConnectivityStructure {
  /** The kernel size. */
  private static final int SIZE = 3;

  //@formatter:off
  // Neighbour order matches the direction tables used to scan the image:
  //                                    //4N                //8N
  private static final int[] DIR_X = {  0, 1, 0,-1,        1, 1,-1,-1 };
  private static final int[] DIR_Y = { -1, 0, 1, 0,       -1, 1, 1,-1 };
  //@formatter:on

  /** The 4-connected structure (edge neighbours only). */
  public static final ConnectivityStructure FOUR = new ConnectivityStructure(new boolean[][] {
    //@formatter:off
      {false, true, false},
      {true,  true, true},
      {false, true, false},
    //@formatter:on
  });

  /** The 8-connected structure (edge and corner neighbours). */
  public static final ConnectivityStructure EIGHT = new ConnectivityStructure(new boolean[][] {
    //@formatter:off
      {true, true, true},
      {true, true, true},
      {true, true, true},
    //@formatter:on
  });

  /** The kernel, indexed [row][column]. */
  private final boolean[][] kernel;

  /** The x offsets of the connected neighbours. */
  private final int[] dx;

  /** The y offsets of the connected neighbours. */
  private final int[] dy;

  private ConnectivityStructure(boolean[][] kernel) {
    this.kernel = kernel;
    int count = 0;
    final int[] x = new int[DIR_X.length];
    final int[] y = new int[DIR_X.length];
    for (int d = 0; d < DIR_X.length; d++) {
      if (kernel[DIR_Y[d] + 1][DIR_X[d] + 1]) {
        x[count] = DIR_X[d];
        y[count] = DIR_Y[d];
        count++;
      }
    }
    dx = Arrays.copyOf(x, count);
    dy = Arrays.copyOf(y, count);
  }

  /**
   * Create a structure from a 3x3 kernel.
   *
   * @param kernel the kernel, indexed [row][column]
   * @return the structure
   * @throws IllegalArgumentException if the kernel is not 3x3, is not symmetric or has no centre
   */
  public static ConnectivityStructure of(boolean[][] kernel) {
    Validate.notNull(kernel, "Structure kernel is null");
    Validate.isTrue(kernel.length == SIZE, "Structure must have %d rows: %d", SIZE,
        kernel.length);
    final boolean[][] copy = new boolean[SIZE][];
    for (int i = 0; i < SIZE; i++) {
      Validate.isTrue(kernel[i] != null && kernel[i].length == SIZE,
          "Structure row %d must have %d columns", i, SIZE);
      copy[i] = kernel[i].clone();
    }
    Validate.isTrue(copy[1][1], "Structure centre must be set");
    for (int r = 0; r < SIZE; r++) {
      for (int c = 0; c < SIZE; c++) {
        Validate.isTrue(copy[r][c] == copy[SIZE - 1 - r][SIZE - 1 - c],
            "Structure must be symmetric about the centre: [%d][%d]", r, c);
      }
    }
    if (Arrays.deepEquals(copy, EIGHT.kernel)) {
      return EIGHT;
    }
    if (Arrays.deepEquals(copy, FOUR.kernel)) {
      return FOUR;
    }
    return new ConnectivityStructure(copy);
  }

  /**
   * Get the structure for the given neighbourhood size.
   *
   * @param neighbours the number of neighbours (4 or 8)
   * @return the structure
   * @throws IllegalArgumentException if the neighbourhood is not 4 or 8
   */
  public static ConnectivityStructure forNeighbours(int neighbours) {
    if (neighbours == 4) {
      return FOUR;
    }
    if (neighbours == 8) {
      return EIGHT;
    }
    throw new IllegalArgumentException("Unsupported connectivity: " + neighbours);
  }

  /**
   * Gets the number of connected neighbours.
   *
   * @return the neighbour count
   */
  public int getNeighbourCount() {
    return dx.length;
  }

  /**
   * Gets the x (column) offset of the neighbour.
   *
   * @param index the neighbour index
   * @return the x offset
   */
  public int getOffsetX(int index) {
    return dx[index];
  }

  /**
   * Gets the y (row) offset of the neighbour.
   *
   * @param index the neighbour index
   * @return the y offset
   */
  public int getOffsetY(int index) {
    return dy[index];
  }

  /**
   * Checks if the relative position is connected.
   *
   * @param row the row offset in [-1, 1]
   * @param column the column offset in [-1, 1]
   * @return true if connected
   */
  public boolean isConnected(int row, int column) {
    return kernel[row + 1][column + 1];
  }

  /**
   * Get a copy of the kernel.
   *
   * @return the kernel
   */
  public boolean[][] getKernel() {
    final boolean[][] copy = new boolean[SIZE][];
    for (int i = 0; i < SIZE; i++) {
      copy[i] = kernel[i].clone();
    }
    return copy;
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (!(obj instanceof ConnectivityStructure)) {
      return false;
    }
    return Arrays.deepEquals(kernel, ((ConnectivityStructure) obj).kernel);
  }

  @Override
  public int hashCode() {
    return Arrays.deepHashCode(kernel);
  }

  @Override
  public String toString() {
    return "ConnectivityStructure[" + getNeighbourCount() + "]";
  }
}
