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

import java.util.Properties;
import org.apache.commons.lang3.Validate;
import uk.ac.sussex.gdsc.cosmic.label.ConnectivityStructure;
import uk.ac.sussex.gdsc.cosmic.mask.SigmaClippedStatistics;

/**
 * Provides the options for the {@link CosmicRayLabeller}.
 *
 * <p>Instances are immutable and validated on construction. Use the {@link Builder} to create
 * options.
 */
public final class CosmicRayOptions {
  /** The default data-quality flag marking a cosmic ray. */
  public static final int DEFAULT_DQ_FLAG = 8192;
  /** The default data-quality flag marking a bad detector pixel. */
  public static final int DEFAULT_BAD_PIXEL_FLAG = 4;
  /** The default exclusive lower bound on the object size. */
  public static final int DEFAULT_THRESHOLD_L = 2;
  /** The default exclusive upper bound on the object size. */
  public static final int DEFAULT_THRESHOLD_U = 1000;

  /** Property key for {@link #isUseDq()}. */
  public static final String KEY_USE_DQ = "use_dq";
  /** Property key for {@link #getDqFlag()}. */
  public static final String KEY_DQ_FLAG = "dq_flag";
  /** Property key for {@link #getBadPixelFlag()}. */
  public static final String KEY_BAD_PIXEL_FLAG = "bad_pixel_flag";
  /** Property key for {@link #isDoBitwiseComp()}. */
  public static final String KEY_DO_BITWISE_COMP = "do_bitwise_comp";
  /** Property key for {@link #getThresholdL()}. */
  public static final String KEY_THRESHOLD_L = "threshold_l";
  /** Property key for {@link #getThresholdU()}. */
  public static final String KEY_THRESHOLD_U = "threshold_u";
  /** Property key for {@link #getStructure()}. Value is the neighbour count (4 or 8). */
  public static final String KEY_STRUCTURE = "structure";
  /** Property key for {@link #isDeblend()}. */
  public static final String KEY_DEBLEND = "deblend";
  /** Property key for {@link #getDetector()}. */
  public static final String KEY_DETECTOR = "detector";
  /** Property key for {@link #getClipSigma()}. */
  public static final String KEY_CLIP_SIGMA = "clip_sigma";
  /** Property key for {@link #getClipIterations()}. */
  public static final String KEY_CLIP_ITERATIONS = "clip_iterations";

  private static final CosmicRayOptions DEFAULT = new Builder().build();

  private final boolean useDq;
  private final int dqFlag;
  private final int badPixelFlag;
  private final boolean doBitwiseComp;
  private final int thresholdL;
  private final int thresholdU;
  private final ConnectivityStructure structure;
  private final boolean deblend;
  private final DetectorFamily detector;
  private final double clipSigma;
  private final int clipIterations;

  /**
   * Builder for the options.
   */
  public static final class Builder {
    private boolean useDq = true;
    private int dqFlag = DEFAULT_DQ_FLAG;
    private int badPixelFlag = DEFAULT_BAD_PIXEL_FLAG;
    private boolean doBitwiseComp = true;
    private int thresholdL = DEFAULT_THRESHOLD_L;
    private int thresholdU = DEFAULT_THRESHOLD_U;
    private ConnectivityStructure structure = ConnectivityStructure.EIGHT;
    private boolean deblend;
    private DetectorFamily detector = DetectorFamily.CCD;
    private double clipSigma = SigmaClippedStatistics.DEFAULT_SIGMA;
    private int clipIterations = SigmaClippedStatistics.DEFAULT_MAX_ITERATIONS;

    /**
     * Create a builder with the default options.
     */
    public Builder() {
      // Defaults are set on the fields
    }

    private Builder(CosmicRayOptions source) {
      useDq = source.useDq;
      dqFlag = source.dqFlag;
      badPixelFlag = source.badPixelFlag;
      doBitwiseComp = source.doBitwiseComp;
      thresholdL = source.thresholdL;
      thresholdU = source.thresholdU;
      structure = source.structure;
      deblend = source.deblend;
      detector = source.detector;
      clipSigma = source.clipSigma;
      clipIterations = source.clipIterations;
    }

    /**
     * Set if the mask is built from the data-quality flags. Otherwise the mask is built by
     * thresholding the science intensity.
     *
     * @param useDq the use DQ flag
     * @return this builder
     */
    public Builder setUseDq(boolean useDq) {
      this.useDq = useDq;
      return this;
    }

    /**
     * Set the data-quality flag that marks a cosmic ray.
     *
     * @param dqFlag the flag
     * @return this builder
     */
    public Builder setDqFlag(int dqFlag) {
      this.dqFlag = dqFlag;
      return this;
    }

    /**
     * Set the data-quality flag that marks a bad detector pixel.
     *
     * @param badPixelFlag the flag
     * @return this builder
     */
    public Builder setBadPixelFlag(int badPixelFlag) {
      this.badPixelFlag = badPixelFlag;
      return this;
    }

    /**
     * Set if pixels also flagged as bad are excluded from the mask.
     *
     * @param doBitwiseComp the exclusion flag
     * @return this builder
     */
    public Builder setDoBitwiseComp(boolean doBitwiseComp) {
      this.doBitwiseComp = doBitwiseComp;
      return this;
    }

    /**
     * Set the exclusive lower bound on the object size.
     *
     * @param thresholdL the lower bound
     * @return this builder
     */
    public Builder setThresholdL(int thresholdL) {
      this.thresholdL = thresholdL;
      return this;
    }

    /**
     * Set the exclusive upper bound on the object size.
     *
     * @param thresholdU the upper bound
     * @return this builder
     */
    public Builder setThresholdU(int thresholdU) {
      this.thresholdU = thresholdU;
      return this;
    }

    /**
     * Set the connectivity structure.
     *
     * @param structure the structure
     * @return this builder
     */
    public Builder setStructure(ConnectivityStructure structure) {
      this.structure = structure;
      return this;
    }

    /**
     * Set if overlapping objects are deblended. Deblending is not available and this has no
     * effect on the labels.
     *
     * @param deblend the deblend flag
     * @return this builder
     */
    public Builder setDeblend(boolean deblend) {
      this.deblend = deblend;
      return this;
    }

    /**
     * Set the detector family.
     *
     * @param detector the detector
     * @return this builder
     */
    public Builder setDetector(DetectorFamily detector) {
      this.detector = detector;
      return this;
    }

    /**
     * Set the sigma-clipping limit used to threshold the science intensity.
     *
     * @param clipSigma the clipping limit
     * @return this builder
     */
    public Builder setClipSigma(double clipSigma) {
      this.clipSigma = clipSigma;
      return this;
    }

    /**
     * Set the maximum number of sigma-clipping iterations.
     *
     * @param clipIterations the iterations
     * @return this builder
     */
    public Builder setClipIterations(int clipIterations) {
      this.clipIterations = clipIterations;
      return this;
    }

    /**
     * Build the options.
     *
     * @return the options
     * @throws IllegalArgumentException if the options are invalid
     */
    public CosmicRayOptions build() {
      return new CosmicRayOptions(this);
    }
  }

  private CosmicRayOptions(Builder builder) {
    Validate.isTrue(builder.thresholdL >= 0, "Lower threshold is negative: %d",
        builder.thresholdL);
    Validate.isTrue(builder.thresholdU >= 0, "Upper threshold is negative: %d",
        builder.thresholdU);
    Validate.isTrue(builder.thresholdL < builder.thresholdU,
        "Lower threshold %d is not below upper threshold %d", builder.thresholdL,
        builder.thresholdU);
    Validate.notNull(builder.structure, "Structure is null");
    Validate.notNull(builder.detector, "Detector is null");
    Validate.isTrue(builder.clipSigma > 0 && Double.isFinite(builder.clipSigma),
        "Clip sigma must be strictly positive: %s", builder.clipSigma);
    Validate.isTrue(builder.clipIterations > 0, "Clip iterations must be strictly positive: %d",
        builder.clipIterations);
    useDq = builder.useDq;
    dqFlag = builder.dqFlag;
    badPixelFlag = builder.badPixelFlag;
    doBitwiseComp = builder.doBitwiseComp;
    thresholdL = builder.thresholdL;
    thresholdU = builder.thresholdU;
    structure = builder.structure;
    deblend = builder.deblend;
    detector = builder.detector;
    clipSigma = builder.clipSigma;
    clipIterations = builder.clipIterations;
  }

  /**
   * Get the default options.
   *
   * @return the default options
   */
  public static CosmicRayOptions defaults() {
    return DEFAULT;
  }

  /**
   * Create a builder initialised with the default options.
   *
   * @return the builder
   */
  public static Builder builder() {
    return new Builder();
  }

  /**
   * Create a builder initialised with these options.
   *
   * @return the builder
   */
  public Builder toBuilder() {
    return new Builder(this);
  }

  /**
   * Create options from properties. Missing keys use the default value.
   *
   * @param properties the properties
   * @return the options
   * @throws IllegalArgumentException if a property cannot be parsed or the options are invalid
   */
  public static CosmicRayOptions fromProperties(Properties properties) {
    final Builder builder = new Builder();
    builder.setUseDq(getBoolean(properties, KEY_USE_DQ, builder.useDq));
    builder.setDqFlag(getInt(properties, KEY_DQ_FLAG, builder.dqFlag));
    builder.setBadPixelFlag(getInt(properties, KEY_BAD_PIXEL_FLAG, builder.badPixelFlag));
    builder.setDoBitwiseComp(getBoolean(properties, KEY_DO_BITWISE_COMP, builder.doBitwiseComp));
    builder.setThresholdL(getInt(properties, KEY_THRESHOLD_L, builder.thresholdL));
    builder.setThresholdU(getInt(properties, KEY_THRESHOLD_U, builder.thresholdU));
    builder.setStructure(ConnectivityStructure.forNeighbours(
        getInt(properties, KEY_STRUCTURE, builder.structure.getNeighbourCount())));
    builder.setDeblend(getBoolean(properties, KEY_DEBLEND, builder.deblend));
    final String detector = properties.getProperty(KEY_DETECTOR);
    if (detector != null) {
      builder.setDetector(DetectorFamily.fromDescription(detector));
    }
    builder.setClipSigma(getDouble(properties, KEY_CLIP_SIGMA, builder.clipSigma));
    builder.setClipIterations(getInt(properties, KEY_CLIP_ITERATIONS, builder.clipIterations));
    return builder.build();
  }

  private static boolean getBoolean(Properties properties, String key, boolean defaultValue) {
    final String value = properties.getProperty(key);
    if (value == null) {
      return defaultValue;
    }
    final String trimmed = value.trim();
    if ("true".equalsIgnoreCase(trimmed)) {
      return true;
    }
    if ("false".equalsIgnoreCase(trimmed)) {
      return false;
    }
    throw new IllegalArgumentException("Invalid boolean for " + key + ": " + value);
  }

  private static int getInt(Properties properties, String key, int defaultValue) {
    final String value = properties.getProperty(key);
    if (value == null) {
      return defaultValue;
    }
    try {
      return Integer.decode(value.trim());
    } catch (final NumberFormatException ex) {
      throw new IllegalArgumentException("Invalid integer for " + key + ": " + value, ex);
    }
  }

  private static double getDouble(Properties properties, String key, double defaultValue) {
    final String value = properties.getProperty(key);
    if (value == null) {
      return defaultValue;
    }
    try {
      return Double.parseDouble(value.trim());
    } catch (final NumberFormatException ex) {
      throw new IllegalArgumentException("Invalid number for " + key + ": " + value, ex);
    }
  }

  /**
   * Checks if the mask is built from the data-quality flags.
   *
   * @return true if using the DQ flags
   */
  public boolean isUseDq() {
    return useDq;
  }

  /**
   * Gets the data-quality flag that marks a cosmic ray.
   *
   * @return the flag
   */
  public int getDqFlag() {
    return dqFlag;
  }

  /**
   * Gets the data-quality flag that marks a bad detector pixel.
   *
   * @return the flag
   */
  public int getBadPixelFlag() {
    return badPixelFlag;
  }

  /**
   * Checks if pixels also flagged as bad are excluded from the mask.
   *
   * @return true if excluding bad pixels
   */
  public boolean isDoBitwiseComp() {
    return doBitwiseComp;
  }

  /**
   * Gets the exclusive lower bound on the object size.
   *
   * @return the lower bound
   */
  public int getThresholdL() {
    return thresholdL;
  }

  /**
   * Gets the exclusive upper bound on the object size.
   *
   * @return the upper bound
   */
  public int getThresholdU() {
    return thresholdU;
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
   * Checks if deblending was requested.
   *
   * @return true if deblending
   */
  public boolean isDeblend() {
    return deblend;
  }

  /**
   * Gets the detector family.
   *
   * @return the detector
   */
  public DetectorFamily getDetector() {
    return detector;
  }

  /**
   * Gets the sigma-clipping limit.
   *
   * @return the clip sigma
   */
  public double getClipSigma() {
    return clipSigma;
  }

  /**
   * Gets the maximum number of sigma-clipping iterations.
   *
   * @return the clip iterations
   */
  public int getClipIterations() {
    return clipIterations;
  }
}
