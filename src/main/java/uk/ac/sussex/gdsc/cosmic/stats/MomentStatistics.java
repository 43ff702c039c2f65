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

import com.google.common.base.Throwables;
import it.unimi.dsi.fastutil.ints.Int2ObjectOpenHashMap;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.apache.commons.lang3.Validate;
import org.apache.commons.lang3.concurrent.ConcurrentRuntimeException;
import uk.ac.sussex.gdsc.cosmic.DetectorImage;
import uk.ac.sussex.gdsc.cosmic.label.LabelMap;

/**
 * Compute the intensity moments of each labelled object.
 *
 * <p>For each object the zeroth moment (energy), first moment (centroid) and the intensity
 * normalised second moment tensor are computed. The size and shape are derived from the tensor:
 *
 * <pre>
 * sigma = sqrt((Ixx + Iyy) / 2)
 * shape = sqrt(((Ixx - Iyy)^2 + 4 Ixy^2) / (Ixx + Iyy)^2)
 * </pre>
 *
 * <p>Objects are independent and can be computed in parallel using an executor service.
 */
public class MomentStatistics {
  private final Logger logger;
  private ExecutorService executor;
  private int blocks = 1;

  /**
   * Create a new instance.
   *
   * @param logger the logger (can be null)
   */
  public MomentStatistics(Logger logger) {
    this.logger = logger == null ? Logger.getLogger(MomentStatistics.class.getName()) : logger;
  }

  /**
   * Set the executor service used to compute objects in parallel. The objects are split into the
   * given number of blocks and each block is submitted as a task.
   *
   * @param executor the executor (null to compute on the calling thread)
   * @param blocks the number of blocks
   */
  public void setExecutor(ExecutorService executor, int blocks) {
    Validate.isTrue(blocks > 0, "Blocks must be strictly positive: %d", blocks);
    this.executor = executor;
    this.blocks = blocks;
  }

  /**
   * Compute the statistics of each labelled object. Events are created for each label id present
   * in the map, in ascending id order. The labels need not be contiguous.
   *
   * @param labels the labels
   * @param image the image
   * @return the results
   * @throws IllegalArgumentException if the label map and image dimensions do not match
   * @throws ConcurrentRuntimeException if interrupted while waiting for parallel computation, or
   *         a parallel task fails with a checked exception
   */
  public CosmicRayResults compute(LabelMap labels, DetectorImage image) {
    Validate.isTrue(
        labels.getWidth() == image.getWidth() && labels.getHeight() == image.getHeight(),
        "Label %dx%d and image %dx%d dimensions do not match", labels.getWidth(),
        labels.getHeight(), image.getWidth(), image.getHeight());

    final Int2ObjectOpenHashMap<IntArrayList> objects = collectPixels(labels);
    final int[] ids = objects.keySet().toIntArray();
    Arrays.sort(ids);
    final int size = ids.length;
    final IntArrayList[] pixels = new IntArrayList[size];
    for (int i = 0; i < size; i++) {
      pixels[i] = objects.get(ids[i]);
    }

    logger.info(() -> String.format("Computing statistics%n name: %s%n number of cosmic rays: %d",
        image.getName(), size));

    final double incidentRate = computeIncidentRate(size, image);

    final CosmicRayEvent[] events = new CosmicRayEvent[size];
    final int width = labels.getWidth();
    if (executor == null || blocks == 1 || size < 2) {
      for (int i = 0; i < size; i++) {
        events[i] = computeEvent(ids[i], pixels[i], width, image);
      }
    } else {
      final int blockSize = (size + blocks - 1) / blocks;
      final List<Future<?>> futures = new ArrayList<>(blocks);
      for (int from = 0; from < size; from += blockSize) {
        final int start = from;
        final int end = Math.min(size, from + blockSize);
        futures.add(executor.submit(() -> {
          for (int i = start; i < end; i++) {
            events[i] = computeEvent(ids[i], pixels[i], width, image);
          }
        }));
      }
      waitForCompletion(futures);
    }

    return new CosmicRayResults(image.getName(), image.getIntegrationTime(), incidentRate, labels,
        events);
  }

  /**
   * Wait for the futures to complete. Task failures are rethrown unchecked.
   *
   * @param futures the futures
   * @throws ConcurrentRuntimeException if interrupted or a task fails with a checked exception
   */
  private static void waitForCompletion(List<Future<?>> futures) {
    for (final Future<?> future : futures) {
      try {
        future.get();
      } catch (final InterruptedException ex) {
        // Restore interrupted state...
        Thread.currentThread().interrupt();
        throw new ConcurrentRuntimeException(ex);
      } catch (final ExecutionException ex) {
        Throwables.throwIfUnchecked(ex.getCause());
        throw new ConcurrentRuntimeException(ex.getCause());
      }
    }
  }

  /**
   * Collect the pixel indices of each non-zero label. Indices are added in raster order.
   *
   * @param labels the labels
   * @return the pixel indices, keyed by label
   */
  private static Int2ObjectOpenHashMap<IntArrayList> collectPixels(LabelMap labels) {
    final Int2ObjectOpenHashMap<IntArrayList> pixels = new Int2ObjectOpenHashMap<>();
    final int length = labels.getWidth() * labels.getHeight();
    for (int i = 0; i < length; i++) {
      final int id = labels.get(i);
      if (id != 0) {
        IntArrayList list = pixels.get(id);
        if (list == null) {
          list = new IntArrayList();
          pixels.put(id, list);
        }
        list.add(i);
      }
    }
    return pixels;
  }

  /**
   * Compute the number of events per second.
   *
   * @param size the number of events
   * @param image the image
   * @return the incident rate (NaN if the integration time is zero)
   */
  private double computeIncidentRate(int size, DetectorImage image) {
    final double time = image.getIntegrationTime();
    if (time == 0) {
      logger.warning(() -> image.getName()
          + " has an undefined integration time. Setting cosmic ray rate to NaN");
      return Double.NaN;
    }
    return size / time;
  }

  /**
   * Compute the moments of a single object.
   *
   * @param id the label id
   * @param indices the pixel indices
   * @param width the image width
   * @param image the image
   * @return the event
   */
  private CosmicRayEvent computeEvent(int id, IntArrayList indices, int width,
      DetectorImage image) {
    final int n = indices.size();
    final int[] rows = new int[n];
    final int[] columns = new int[n];
    final double[] values = new double[n];

    // Zeroth and first moments
    double energy = 0;
    double sumRow = 0;
    double sumColumn = 0;
    for (int i = 0; i < n; i++) {
      final int index = indices.getInt(i);
      rows[i] = index / width;
      columns[i] = index % width;
      values[i] = image.getSci(index);
      energy += values[i];
      sumRow += values[i] * rows[i];
      sumColumn += values[i] * columns[i];
    }

    if (energy == 0) {
      logger.warning(() -> String.format(
          "%s: Cosmic ray %d has zero energy; the centroid and moments are undefined",
          image.getName(), id));
      return new CosmicRayEvent(id, rows, columns, energy, Double.NaN, Double.NaN, Double.NaN,
          Double.NaN, Double.NaN, Double.NaN, Double.NaN);
    }

    final double cr = sumRow / energy;
    final double cc = sumColumn / energy;

    // Second moments
    double ixx = 0;
    double iyy = 0;
    double ixy = 0;
    for (int i = 0; i < n; i++) {
      final double w = values[i] / energy;
      final double dr = rows[i] - cr;
      final double dc = columns[i] - cc;
      ixx += w * dr * dr;
      iyy += w * dc * dc;
      ixy += w * dr * dc;
    }

    if (ixx < 0 || iyy < 0) {
      final double totalEnergy = energy;
      logger.warning(() -> String.format(
          "%s: Cosmic ray %d has a negative second moment (energy %s); the size and shape are "
              + "undefined",
          image.getName(), id, totalEnergy));
      return new CosmicRayEvent(id, rows, columns, energy, cr, cc, ixx, iyy, ixy, Double.NaN,
          Double.NaN);
    }

    final double sum = ixx + iyy;
    final double sizeInSigma = Math.sqrt(sum / 2);
    final double shape;
    if (sum == 0) {
      logger.log(Level.FINE, () -> String.format(
          "%s: Cosmic ray %d has zero second moment; the shape is undefined", image.getName(),
          id));
      shape = Double.NaN;
    } else {
      final double diff = ixx - iyy;
      shape = Math.sqrt((diff * diff + 4 * ixy * ixy) / (sum * sum));
    }

    return new CosmicRayEvent(id, rows, columns, energy, cr, cc, ixx, iyy, ixy, sizeInSigma,
        shape);
  }
}
