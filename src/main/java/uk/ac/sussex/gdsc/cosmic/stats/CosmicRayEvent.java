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

package uk.ac.sussex.gdsc.cosmic.stats;

/**
 * The statistics of a single labelled cosmic ray.
 *
 * <p>Coordinates use (row, column) order. Values that are undefined for the object (for example
 * the centroid of an object with zero energy) are {@code NaN}.
 */
public final class CosmicRayEvent {
  private final int id;
  private final int[] rows;
  private final int[] columns;
  private final double energyDeposited;
  private final double centroidRow;
  private final double centroidColumn;
  private final double ixx;
  private final double iyy;
  private final double ixy;
  private final double sizeInSigma;
  private final double shape;

  /**
   * Create a new instance. The coordinate arrays are not copied.
   *
   * <p>The pixels must be non-empty and in raster order (ascending row, then ascending column).
   * The row bounds of the bounding box and {@link #getPixelCoordinates()} rely on this order.
   */
  CosmicRayEvent(int id, int[] rows, int[] columns, double energyDeposited, double centroidRow,
      double centroidColumn, double ixx, double iyy, double ixy, double sizeInSigma,
      double shape) {
    this.id = id;
    this.rows = rows;
    this.columns = columns;
    this.energyDeposited = energyDeposited;
    this.centroidRow = centroidRow;
    this.centroidColumn = centroidColumn;
    this.ixx = ixx;
    this.iyy = iyy;
    this.ixy = ixy;
    this.sizeInSigma = sizeInSigma;
    this.shape = shape;
  }

  /**
   * Gets the label id.
   *
   * @return the id
   */
  public int getId() {
    return id;
  }

  /**
   * Gets the size in pixels.
   *
   * @return the size
   */
  public int getSizeInPixels() {
    return rows.length;
  }

  /**
   * Gets the row of the pixel.
   *
   * @param index the pixel index
   * @return the row
   */
  public int getRow(int index) {
    return rows[index];
  }

  /**
   * Gets the column of the pixel.
   *
   * @param index the pixel index
   * @return the column
   */
  public int getColumn(int index) {
    return columns[index];
  }

  /**
   * Get the pixel coordinates in raster order.
   *
   * @return the coordinates [pixel][row, column]
   */
  public int[][] getPixelCoordinates() {
    final int[][] coords = new int[rows.length][];
    for (int i = 0; i < coords.length; i++) {
      coords[i] = new int[] {rows[i], columns[i]};
    }
    return coords;
  }

  /**
   * Gets the total energy deposited (the zeroth moment).
   *
   * @return the energy
   */
  public double getEnergyDeposited() {
    return energyDeposited;
  }

  /**
   * Checks if the centroid is defined. This is false when the energy is zero.
   *
   * @return true if defined
   */
  public boolean isCentroidDefined() {
    return !Double.isNaN(centroidRow);
  }

  /**
   * Gets the row of the intensity-weighted centroid.
   *
   * @return the centroid row
   */
  public double getCentroidRow() {
    return centroidRow;
  }

  /**
   * Gets the column of the intensity-weighted centroid.
   *
   * @return the centroid column
   */
  public double getCentroidColumn() {
    return centroidColumn;
  }

  /**
   * Gets the second moment along the rows.
   *
   * @return Ixx
   */
  public double getIxx() {
    return ixx;
  }

  /**
   * Gets the second moment along the columns.
   *
   * @return Iyy
   */
  public double getIyy() {
    return iyy;
  }

  /**
   * Gets the cross moment.
   *
   * @return Ixy
   */
  public double getIxy() {
    return ixy;
  }

  /**
   * Gets the RMS spread of the energy distribution.
   *
   * @return the size in sigma
   */
  public double getSizeInSigma() {
    return sizeInSigma;
  }

  /**
   * Checks if the shape is defined. This is false when the second moments sum to zero, e.g. for a
   * single pixel object.
   *
   * @return true if defined
   */
  public boolean isShapeDefined() {
    return !Double.isNaN(shape);
  }

  /**
   * Gets the shape of the energy distribution. This is 0 for a circularly symmetric distribution
   * and approaches 1 for an elongated one.
   *
   * @return the shape
   */
  public double getShape() {
    return shape;
  }

  /**
   * Gets the minimum row of the bounding box.
   *
   * @return the min row
   */
  public int getMinRow() {
    // Pixels are in raster order
    return rows[0];
  }

  /**
   * Gets the maximum row of the bounding box (inclusive).
   *
   * @return the max row
   */
  public int getMaxRow() {
    return rows[rows.length - 1];
  }

  /**
   * Gets the minimum column of the bounding box.
   *
   * @return the min column
   */
  public int getMinColumn() {
    int min = columns[0];
    for (final int c : columns) {
      min = Math.min(min, c);
    }
    return min;
  }

  /**
   * Gets the maximum column of the bounding box (inclusive).
   *
   * @return the max column
   */
  public int getMaxColumn() {
    int max = columns[0];
    for (final int c : columns) {
      max = Math.max(max, c);
    }
    return max;
  }

  @Override
  public String toString() {
    return String.format(
        "CosmicRayEvent[id=%d, pixels=%d, energy=%s, centroid=(%s, %s), sigma=%s, shape=%s]", id,
        rows.length, energyDeposited, centroidRow, centroidColumn, sizeInSigma, shape);
  }
}
