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

/**
 * Separate overlapping objects in a size-filtered label map before the final labelling pass.
 */
@FunctionalInterface
public interface Deblender {
  /** A deblender that returns the input mask unchanged. */
  Deblender NONE = (labels, mask) -> mask;

  /**
   * Deblend the objects. The returned mask is labelled again to produce the final objects so
   * overlapping objects must be separated by at least one background pixel.
   *
   * @param labels the size-filtered labels
   * @param mask the size-filtered foreground mask
   * @return the deblended foreground mask
   */
  boolean[] deblend(LabelMap labels, boolean[] mask);
}
