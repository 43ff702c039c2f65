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

import java.util.Arrays;
import org.apache.commons.lang3.Validate;
import org.apache.commons.math3.stat.descriptive.moment.Mean;
import org.apache.commons.math3.stat.descriptive.moment.StandardDeviation;
import org.apache.commons.math3.stat.descriptive.rank.Median;

/**
 * Robust location and scale of data computed by iterative sigma clipping.
 *
 * <p>At each iteration values outside {@code median +/- sigma * std} are rejected, where the
 * standard deviation is the population standard deviation of the retained values. Iteration stops
 * when no values are rejected or the iteration limit is reached. Non-finite values are ignored.
 */
public final class SigmaClippedStatistics {
  /** The default clipping limit in units of the standard deviation. */
  public static final double DEFAULT_SIGMA = 3;
  /** The default maximum number of clipping iterations. */
  public static final int DEFAULT_MAX_ITERATIONS = 5;

  private final double mean;
  private final double median;
  private final double standardDeviation;
  private final int count;
  private final int iterations;

  private SigmaClippedStatistics(double mean, double median, double standardDeviation, int count,
      int iterations) {
    this.mean = mean;
    this.median = median;
    this.standardDeviation = standardDeviation;
    this.count = count;
    this.iterations = iterations;
  }

  /**
   * Compute the statistics using the default sigma and iteration limit.
   *
   * @param data the data
   * @return the statistics
   */
  public static SigmaClippedStatistics compute(float[] data) {
    return compute(data, DEFAULT_SIGMA, DEFAULT_MAX_ITERATIONS);
  }

  /**
   * Compute the statistics.
   *
   * @param data the data
   * @param sigma the clipping limit in units of the standard deviation
   * @param maxIterations the maximum number of clipping iterations
   * @return the statistics
   * @throws IllegalArgumentException if sigma or the iteration limit are not strictly positive
   */
  public static SigmaClippedStatistics compute(float[] data, double sigma, int maxIterations) {
    Validate.isTrue(sigma > 0, "Sigma must be strictly positive: %s", sigma);
    Validate.isTrue(maxIterations > 0, "Iterations must be strictly positive: %d",
        maxIterations);

    double[] values = new double[data.length];
    int size = 0;
    for (final float value : data) {
      if (Float.isFinite(value)) {
        values[size++] = value;
      }
    }
    if (size == 0) {
      return new SigmaClippedStatistics(Double.NaN, Double.NaN, Double.NaN, 0, 0);
    }
    values = Arrays.copyOf(values, size);

    final Median medianStatistic = new Median();
    final StandardDeviation sd = new StandardDeviation(false);

    int iteration = 0;
    while (iteration < maxIterations) {
      iteration++;
      final double centre = medianStatistic.evaluate(values);
      final double std = sd.evaluate(values);
      final double lower = centre - sigma * std;
      final double upper = centre + sigma * std;
      int retained = 0;
      for (int i = 0; i < size; i++) {
        final double value = values[i];
        if (value >= lower && value <= upper) {
          values[retained++] = value;
        }
      }
      if (retained == size) {
        break;
      }
      size = retained;
      values = Arrays.copyOf(values, size);
      if (size == 0) {
        break;
      }
    }

    if (size == 0) {
      return new SigmaClippedStatistics(Double.NaN, Double.NaN, Double.NaN, 0, iteration);
    }
    return new SigmaClippedStatistics(new Mean().evaluate(values),
        medianStatistic.evaluate(values), sd.evaluate(values), size, iteration);
  }

  /**
   * Gets the mean of the retained values.
   *
   * @return the mean
   */
  public double getMean() {
    return mean;
  }

  /**
   * Gets the median of the retained values.
   *
   * @return the median
   */
  public double getMedian() {
    return median;
  }

  /**
   * Gets the population standard deviation of the retained values.
   *
   * @return the standard deviation
   */
  public double getStandardDeviation() {
    return standardDeviation;
  }

  /**
   * Gets the number of retained values.
   *
   * @return the count
   */
  public int getCount() {
    return count;
  }

  /**
   * Gets the number of clipping iterations performed.
   *
   * @return the iterations
   */
  public int getIterations() {
    return iterations;
  }

  @Override
  public String toString() {
    return String.format("mean=%s, median=%s, std=%s, n=%d", mean, median, standardDeviation,
        count);
  }
}
