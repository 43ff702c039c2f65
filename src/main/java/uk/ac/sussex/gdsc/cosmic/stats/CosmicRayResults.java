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

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import uk.ac.sussex.gdsc.cosmic.label.LabelMap;

/**
 * Contains the cosmic ray statistics of a single exposure.
 */
public final class CosmicRayResults {
  private final String name;
  private final double integrationTime;
  private final double incidentRate;
  private final LabelMap labelMap;
  private final List<CosmicRayEvent> events;

  /**
   * Create a new instance.
   *
   * @param name the image name
   * @param integrationTime the integration time
   * @param incidentRate the incident rate
   * @param labelMap the label map
   * @param events the events (ordered by id)
   */
  CosmicRayResults(String name, double integrationTime, double incidentRate, LabelMap labelMap,
      CosmicRayEvent[] events) {
    this.name = name;
    this.integrationTime = integrationTime;
    this.incidentRate = incidentRate;
    this.labelMap = labelMap;
    this.events = Collections.unmodifiableList(Arrays.asList(events));
  }

  /**
   * Gets the image name.
   *
   * @return the name
   */
  public String getName() {
    return name;
  }

  /**
   * Gets the integration time.
   *
   * @return the integration time (seconds)
   */
  public double getIntegrationTime() {
    return integrationTime;
  }

  /**
   * Gets the number of cosmic rays per second. This is NaN if the integration time is zero.
   *
   * @return the incident rate
   */
  public double getIncidentRate() {
    return incidentRate;
  }

  /**
   * Gets the label map.
   *
   * @return the label map
   */
  public LabelMap getLabelMap() {
    return labelMap;
  }

  /**
   * Gets the number of cosmic rays.
   *
   * @return the size
   */
  public int size() {
    return events.size();
  }

  /**
   * Gets the events ordered by label id. The list is unmodifiable.
   *
   * @return the events
   */
  public List<CosmicRayEvent> getEvents() {
    return events;
  }

  /**
   * Gets the event.
   *
   * @param index the index
   * @return the event
   */
  public CosmicRayEvent get(int index) {
    return events.get(index);
  }

  /**
   * Get the label ids.
   *
   * @return the ids
   */
  public int[] getLabelIds() {
    return events.stream().mapToInt(CosmicRayEvent::getId).toArray();
  }

  /**
   * Get the energy deposited by each cosmic ray.
   *
   * @return the energies
   */
  public double[] getEnergyDeposited() {
    return events.stream().mapToDouble(CosmicRayEvent::getEnergyDeposited).toArray();
  }

  /**
   * Get the size in pixels of each cosmic ray.
   *
   * @return the sizes
   */
  public int[] getSizeInPixels() {
    return events.stream().mapToInt(CosmicRayEvent::getSizeInPixels).toArray();
  }

  /**
   * Get the size in sigma of each cosmic ray.
   *
   * @return the sizes
   */
  public double[] getSizeInSigma() {
    return events.stream().mapToDouble(CosmicRayEvent::getSizeInSigma).toArray();
  }

  /**
   * Get the shape of each cosmic ray.
   *
   * @return the shapes
   */
  public double[] getShapes() {
    return events.stream().mapToDouble(CosmicRayEvent::getShape).toArray();
  }

  /**
   * Get the centroid of each cosmic ray.
   *
   * @return the centroids [event][row, column]
   */
  public double[][] getCentroids() {
    return events.stream()
        .map(e -> new double[] {e.getCentroidRow(), e.getCentroidColumn()})
        .toArray(double[][]::new);
  }

  /**
   * Get the coordinates of all pixels affected by cosmic rays, ordered by label id then in raster
   * order.
   *
   * @return the coordinates [pixel][row, column]
   */
  public int[][] getAffectedPixels() {
    final int total = events.stream().mapToInt(CosmicRayEvent::getSizeInPixels).sum();
    final int[][] coords = new int[total][];
    int count = 0;
    for (final CosmicRayEvent event : events) {
      for (int i = 0; i < event.getSizeInPixels(); i++) {
        coords[count++] = new int[] {event.getRow(i), event.getColumn(i)};
      }
    }
    return coords;
  }
}
