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

/**
 * The detector family of an exposure.
 */
public enum DetectorFamily {
  /** Charge-coupled device. */
  CCD("CCD"),
  /** Infrared array. Labelling is not supported. */
  IR("IR");

  private final String description;

  DetectorFamily(String description) {
    this.description = description;
  }

  /**
   * Gets the description.
   *
   * @return the description
   */
  public String getDescription() {
    return description;
  }

  /**
   * Gets the family from the description, ignoring case.
   *
   * @param description the description
   * @return the family
   * @throws IllegalArgumentException if the description is not recognised
   */
  public static DetectorFamily fromDescription(String description) {
    for (final DetectorFamily family : values()) {
      if (family.description.equalsIgnoreCase(description.trim())) {
        return family;
      }
    }
    throw new IllegalArgumentException("Unknown detector family: " + description);
  }

  @Override
  public String toString() {
    return description;
  }
}
