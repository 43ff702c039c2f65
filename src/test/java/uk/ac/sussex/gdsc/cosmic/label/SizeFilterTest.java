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

import it.unimi.dsi.fastutil.ints.Int2IntMap;
import it.unimi.dsi.fastutil.ints.Int2IntOpenHashMap;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

@SuppressWarnings({"javadoc"})
class SizeFilterTest {
  @Test
  void checkInvalidThresholds() {
    Assertions.assertThrows(IllegalArgumentException.class, () -> new SizeFilter(-1, 10, null));
    Assertions.assertThrows(IllegalArgumentException.class, () -> new SizeFilter(0, -1, null));
    Assertions.assertThrows(IllegalArgumentException.class, () -> new SizeFilter(10, 10, null));
    Assertions.assertThrows(IllegalArgumentException.class, () -> new SizeFilter(11, 10, null));
    final SizeFilter filter = new SizeFilter(0, 1, null);
    Assertions.assertEquals(0, filter.getLower());
    Assertions.assertEquals(1, filter.getUpper());
  }

  private static Int2IntMap sizes(int... counts) {
    final Int2IntOpenHashMap sizes = new Int2IntOpenHashMap();
    for (int i = 0; i < counts.length; i++) {
      sizes.put(i, counts[i]);
    }
    return sizes;
  }

  @Test
  void checkFindLargestLabel() {
    Assertions.assertEquals(-1, SizeFilter.findLargestLabel(sizes()));
    Assertions.assertEquals(0, SizeFilter.findLargestLabel(sizes(5, 1, 2)));
    Assertions.assertEquals(2, SizeFilter.findLargestLabel(sizes(5, 1, 7, 7)));
    // Ties use the lowest label
    Assertions.assertEquals(0, SizeFilter.findLargestLabel(sizes(3, 3)));
    final Int2IntMap sparse = sizes(1);
    sparse.put(1_000_000, 4);
    sparse.put(7, 4);
    Assertions.assertEquals(7, SizeFilter.findLargestLabel(sparse));
  }

  @Test
  void checkFilterBySize() {
    final LabelMap map = LabelMap.of(4, 3, new int[] {
    //@formatter:off
        0, 0, 1, 2,
        0, 3, 0, 0,
        0, 3, 4, 4,
    });
    //@formatter:on
    final boolean[] expected = {
    //@formatter:off
        false, false, false, false,
        false, true,  false, false,
        false, true,  true,  true,
    };
    //@formatter:on
    Assertions.assertArrayEquals(expected, new SizeFilter(1, 3, null).filter(map));

    // Bounds are exclusive
    Assertions.assertArrayEquals(new boolean[12], new SizeFilter(2, 3, null).filter(map));
    Assertions.assertArrayEquals(new boolean[12], new SizeFilter(0, 1, null).filter(map));
  }

  @Test
  void checkLargestObjectIsRemoved() {
    final LabelMap map = LabelMap.of(4, 3, new int[] {
    //@formatter:off
        1, 1, 1, 1,
        1, 1, 0, 2,
        1, 1, 0, 2,
    });
    //@formatter:on
    final boolean[] expected = {
    //@formatter:off
        false, false, false, false,
        false, false, false, true,
        false, false, false, true,
    };
    //@formatter:on
    // Object 1 satisfies the size bounds but is the dominant region
    Assertions.assertArrayEquals(expected, new SizeFilter(0, 100, null).filter(map));
  }

  @Test
  void checkFilterWithSparseLabels() {
    final LabelMap map = LabelMap.of(4, 2, new int[] {
    //@formatter:off
        0, 7, 0, 1_000_000,
        0, 7, 0, 1_000_000,
    });
    //@formatter:on
    final boolean[] expected = {
    //@formatter:off
        false, true, false, true,
        false, true, false, true,
    };
    //@formatter:on
    Assertions.assertArrayEquals(expected, new SizeFilter(0, 10, null).filter(map));
    Assertions.assertArrayEquals(new boolean[8], new SizeFilter(2, 10, null).filter(map));
  }

  @Test
  void checkEmptyLabels() {
    final LabelMap map = LabelMap.of(2, 2, new int[4]);
    Assertions.assertArrayEquals(new boolean[4], new SizeFilter(0, 10, null).filter(map));
  }
}
