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

import java.util.concurrent.ExecutorService;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.apache.commons.lang3.Validate;
import uk.ac.sussex.gdsc.cosmic.label.Deblender;
import uk.ac.sussex.gdsc.cosmic.label.LabelMap;
import uk.ac.sussex.gdsc.cosmic.label.ObjectLabeller;
import uk.ac.sussex.gdsc.cosmic.label.SizeFilter;
import uk.ac.sussex.gdsc.cosmic.mask.FlagMaskBuilder;
import uk.ac.sussex.gdsc.cosmic.stats.CosmicRayResults;
import uk.ac.sussex.gdsc.cosmic.stats.MomentStatistics;

/**
 * Label the cosmic rays in a detector exposure and compute their statistics.
 *
 * <p>The pipeline is:
 *
 * <ol>
 *
 * <li>Build a foreground mask from the data-quality flags or the science intensity.
 *
 * <li>Label the connected objects in the mask.
 *
 * <li>Remove objects outside the size limits, and the largest object which is assumed to be the
 * background.
 *
 * <li>Label the filtered mask to create contiguous ids.
 *
 * <li>Compute the moment statistics of each object.
 *
 * </ol>
 *
 * <p>Each stage returns a new value; the labeller holds no per-image state and can be reused.
 */
public class CosmicRayLabeller {
  private final CosmicRayOptions options;
  private final Logger logger;
  private Deblender deblender = Deblender.NONE;
  private ExecutorService executor;
  private int blocks = 1;

  /**
   * Create a new instance.
   *
   * @param options the options
   * @param logger the logger (can be null)
   * @throws UnsupportedOperationException if the detector family is not supported
   */
  public CosmicRayLabeller(CosmicRayOptions options, Logger logger) {
    this.options = Validate.notNull(options, "Options are null");
    this.logger = logger == null ? Logger.getLogger(CosmicRayLabeller.class.getName()) : logger;
    if (options.getDetector() != DetectorFamily.CCD) {
      throw new UnsupportedOperationException(
          "Labelling is not supported for detector: " + options.getDetector());
    }
  }

  /**
   * Gets the options.
   *
   * @return the options
   */
  public CosmicRayOptions getOptions() {
    return options;
  }

  /**
   * Set the deblender applied to the size-filtered objects when deblending is enabled.
   *
   * @param deblender the deblender
   */
  public void setDeblender(Deblender deblender) {
    this.deblender = Validate.notNull(deblender, "Deblender is null");
  }

  /**
   * Set the executor service used to compute the object statistics in parallel.
   *
   * @param executor the executor (null to compute on the calling thread)
   * @param blocks the number of blocks of objects to submit
   */
  public void setExecutor(ExecutorService executor, int blocks) {
    Validate.isTrue(blocks > 0, "Blocks must be strictly positive: %d", blocks);
    this.executor = executor;
    this.blocks = blocks;
  }

  /**
   * Build the foreground mask.
   *
   * @param image the image
   * @return the mask
   */
  public boolean[] createMask(DetectorImage image) {
    final FlagMaskBuilder builder = new FlagMaskBuilder(logger);
    if (options.isUseDq()) {
      return builder.fromDq(image, options.getDqFlag(), options.getBadPixelFlag(),
          options.isDoBitwiseComp());
    }
    return builder.fromSci(image, options.getClipSigma(), options.getClipIterations());
  }

  /**
   * Label the objects in the mask using the two-pass size-filter protocol. The returned labels
   * are contiguous.
   *
   * @param mask the mask
   * @param width the width
   * @param height the height
   * @return the labels
   */
  public LabelMap label(boolean[] mask, int width, int height) {
    final ObjectLabeller labeller = new ObjectLabeller(options.getStructure());
    final LabelMap initial = labeller.label(mask, width, height);
    logger.log(Level.FINE, () -> "Initial objects: " + initial.getMaxLabel());

    final SizeFilter filter =
        new SizeFilter(options.getThresholdL(), options.getThresholdU(), logger);
    boolean[] filtered = filter.filter(initial);

    if (options.isDeblend()) {
      if (deblender == Deblender.NONE) {
        logger.warning("Deblending is not available; objects are not separated");
      } else {
        final LabelMap current = labeller.label(filtered, width, height);
        filtered = deblender.deblend(current, filtered);
      }
    }

    return labeller.label(filtered, width, height);
  }

  /**
   * Label the cosmic rays and compute their statistics.
   *
   * @param image the image
   * @return the results
   */
  public CosmicRayResults run(DetectorImage image) {
    final boolean[] mask = createMask(image);
    final LabelMap labels = label(mask, image.getWidth(), image.getHeight());
    final MomentStatistics statistics = new MomentStatistics(logger);
    statistics.setExecutor(executor, blocks);
    return statistics.compute(labels, image);
  }
}
