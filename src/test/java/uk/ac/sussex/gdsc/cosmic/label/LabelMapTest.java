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

import ij.process.ByteProcessor;
import ij.process.FloatProcessor;
import ij.process.ImageProcessor;
import ij.process.ShortProcessor;
import it.unimi.dsi.fastutil.ints.Int2IntMap;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

@SuppressWarnings({"javadoc"})
class LabelMapTest {
  @Test
  void checkOf() {
    final int[] labels = {0, 1, 2, 2, 0, 4};
    final LabelMap map = LabelMap.of(3, 2, labels);
    Assertions.assertEquals(3, map.getWidth());
    Assertions.assertEquals(2, map.getHeight());
    Assertions.assertEquals(4, map.getMaxLabel());
    Assertions.assertEquals(2, map.get(1, 0));
    Assertions.assertEquals(4, map.get(5));
    Assertions.assertArrayEquals(new int[] {2, 1, 2, 0, 1}, map.getLabelCounts());
    Assertions.assertFalse(map.isContiguous());
    Assertions.assertArrayEquals(new boolean[] {false, true, true, true, false, true},
        map.toMask());

    // Defensive copies
    labels[0] = 3;
    Assertions.assertEquals(0, map.get(0));
    map.getLabels()[0] = 3;
    Assertions.assertEquals(0, map.get(0));
  }

  @Test
  void checkOfRejectsInvalidInput() {
    Assertions.assertThrows(IllegalArgumentException.class,
        () -> LabelMap.of(2, 2, new int[3]));
    Assertions.assertThrows(IllegalArgumentException.class,
        () -> LabelMap.of(1, 2, new int[] {0, -1}));
    Assertions.assertThrows(IllegalArgumentException.class,
        () -> LabelMap.of(-1, 0, new int[0]));
  }

  @Test
  void checkContiguous() {
    Assertions.assertTrue(LabelMap.of(2, 2, new int[] {0, 1, 2, 2}).isContiguous());
    Assertions.assertTrue(LabelMap.of(2, 2, new int[4]).isContiguous());
  }

  @Test
  void checkSparseLabels() {
    final LabelMap map = LabelMap.of(2, 2, new int[] {0, 7, 0, 1_000_000});
    Assertions.assertEquals(1_000_000, map.getMaxLabel());
    final Int2IntMap sizes = map.getLabelSizes();
    Assertions.assertEquals(3, sizes.size());
    Assertions.assertEquals(2, sizes.get(0));
    Assertions.assertEquals(1, sizes.get(7));
    Assertions.assertEquals(1, sizes.get(1_000_000));
    Assertions.assertFalse(map.isContiguous());
    Assertions.assertThrows(IllegalArgumentException.class, map::getLabelCounts);

    final Int2IntMap sizes2 = LabelMap.of(1, 2, new int[] {0, Integer.MAX_VALUE}).getLabelSizes();
    Assertions.assertEquals(1, sizes2.get(Integer.MAX_VALUE));
  }

  @Test
  void checkEquals() {
    final LabelMap map = LabelMap.of(2, 2, new int[] {0, 1, 2, 2});
    Assertions.assertEquals(map, LabelMap.of(2, 2, new int[] {0, 1, 2, 2}));
    Assertions.assertEquals(map.hashCode(), LabelMap.of(2, 2, new int[] {0, 1, 2, 2}).hashCode());
    Assertions.assertNotEquals(map, LabelMap.of(4, 1, new int[] {0, 1, 2, 2}));
    Assertions.assertNotEquals(map, LabelMap.of(2, 2, new int[] {0, 1, 1, 2}));
  }

  @Test
  void checkToProcessor() {
    final int maxx = 4;
    final int maxy = 3;
    final int[] labels = {
    //@formatter:off
        0, 0, 1, 2,
        0, 3, 0, 0,
        0, 3, 4, 4,
    };
    //@formatter:on
    final ImageProcessor ip = LabelMap.of(maxx, maxy, labels).toProcessor();
    Assertions.assertTrue(ip instanceof ByteProcessor);
    final byte[] m1 = {
    //@formatter:off
        0, 0, 1, 2,
        0, 3, 0, 0,
        0, 3, 4, 4,
    };
    //@formatter:on
    Assertions.assertArrayEquals(m1, (byte[]) ip.getPixels());
    final FloatProcessor fp = LabelMap.of(maxx, maxy, labels).toFloatProcessor();
    Assertions.assertEquals(4f, fp.getf(3, 2));
  }

  @Test
  void checkToProcessorWithOver255Objects() {
    final int maxx = 16;
    final int maxy = 17;
    final int[] labels = new int[maxx * maxy];
    for (int i = 0; i < labels.length; i++) {
      labels[i] = i;
    }
    final ImageProcessor ip = LabelMap.of(maxx, maxy, labels).toProcessor();
    Assertions.assertTrue(ip instanceof ShortProcessor);
    final short[] m1 = new short[labels.length];
    for (int i = 0; i < labels.length; i++) {
      m1[i] = (short) i;
    }
    Assertions.assertArrayEquals(m1, (short[]) ip.getPixels());
  }

  @Test
  void checkToProcessorWithOver65535Objects() {
    final int maxx = 16;
    final int maxy = 16 * 259;
    final int[] labels = new int[maxx * maxy];
    for (int i = 0; i < labels.length; i++) {
      labels[i] = i;
    }
    final ImageProcessor ip = LabelMap.of(maxx, maxy, labels).toProcessor();
    Assertions.assertTrue(ip instanceof FloatProcessor);
    final float[] m1 = new float[labels.length];
    for (int i = 0; i < labels.length; i++) {
      m1[i] = i;
    }
    Assertions.assertArrayEquals(m1, (float[]) ip.getPixels());
  }
}
