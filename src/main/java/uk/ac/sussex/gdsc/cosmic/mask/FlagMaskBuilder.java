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

package uk.ac.sussex.gdsc.cosmic.mask;

import java.util.logging.Level;
import java.util.logging.Logger;
import uk.ac.sussex.gdsc.cosmic.DetectorImage;

/**
 * Build a binary foreground mask from a detector image.
 *
 * <p>The mask is built from the data-quality flags using a bitwise test, or from the science
 * intensity using a threshold above the sigma-clipped background.
 */
public class FlagMaskBuilder {
  private final Logger logger;

  /**
   * Create a new instance.
   *
   * @param logger the logger (can be null)
   */
  public FlagMaskBuilder(Logger logger) {
    this.logger = logger == null ? Logger.getLogger(FlagMaskBuilder.class.getName()) : logger;
  }

  /**
   * Build the mask from the data-quality flags. A pixel is foreground if it has the target flag
   * and, when excluding bad pixels, does not have the bad pixel flag.
   *
   * @param image the image
   * @param flag the target flag
   * @param badPixelFlag the bad pixel flag
   * @param excludeBadPixels set to true to exclude pixels with the bad pixel flag
   * @return the mask
   */
  public boolean[] fromDq(DetectorImage image, int flag, int badPixelFlag,
      boolean excludeBadPixels) {
    final int exclude = excludeBadPixels ? badPixelFlag : 0;
    final boolean[] mask = new boolean[image.getSize()];
    int count = 0;
    for (int i = 0; i < mask.length; i++) {
      final int dq = image.getDq(i);
      if ((dq & flag) != 0 && (dq & exclude) == 0) {
        mask[i] = true;
        count++;
      }
    }
    final int foreground = count;
    logger.log(Level.FINE, () -> String.format("%s: %d pixels with DQ flag %d (excluding %d)",
        image.getName(), foreground, flag, exclude));
    return mask;
  }

  /**
   * Build the mask from the science intensity. A pixel is foreground if it is above
   * {@code |median| + sigma * std} of the sigma-clipped intensity.
   *
   * <p>Degenerate statistics are reported to the logger. If there are no finite intensity values
   * the mask is empty.
   *
   * @param image the image
   * @param sigma the clipping limit in units of the standard deviation
   * @param maxIterations the maximum number of clipping iterations
   * @return the mask
   */
  public boolean[] fromSci(DetectorImage image, double sigma, int maxIterations) {
    final boolean[] mask = new boolean[image.getSize()];
    final SigmaClippedStatistics stats =
        SigmaClippedStatistics.compute(image.getSci(), sigma, maxIterations);
    if (stats.getCount() == 0) {
      logger.warning(() -> image.getName() + ": No finite SCI values; the mask is empty");
      return mask;
    }
    if (stats.getStandardDeviation() == 0) {
      logger.warning(() -> image.getName() + ": Zero variance in the sigma-clipped SCI values");
    }
    final double threshold = Math.abs(stats.getMedian()) + sigma * stats.getStandardDeviation();
    int count = 0;
    for (int i = 0; i < mask.length; i++) {
      if (image.getSci(i) > threshold) {
        mask[i] = true;
        count++;
      }
    }
    final int foreground = count;
    logger.log(Level.FINE, () -> String.format("%s: %d pixels above threshold %s (%s)",
        image.getName(), foreground, threshold, stats));
    return mask;
  }
}
