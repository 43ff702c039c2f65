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

import java.util.Arrays;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

@SuppressWarnings({"javadoc"})
class ObjectLabellerTest {
  private static boolean[] toMask(int[] image) {
    final boolean[] mask = new boolean[image.length];
    for (int i = 0; i < mask.length; i++) {
      mask[i] = image[i] != 0;
    }
    return mask;
  }

  @Test
  void checkDefaultStructure() {
    Assertions.assertSame(ConnectivityStructure.EIGHT, new ObjectLabeller().getStructure());
    Assertions.assertSame(ConnectivityStructure.FOUR,
        new ObjectLabeller(ConnectivityStructure.FOUR).getStructure());
    Assertions.assertThrows(NullPointerException.class, () -> new ObjectLabeller(null));
  }

  @Test
  void checkDimensions() {
    final LabelMap map = new ObjectLabeller().label(new boolean[6], 2, 3);
    Assertions.assertEquals(2, map.getWidth());
    Assertions.assertEquals(3, map.getHeight());
    Assertions.assertEquals(0, map.getMaxLabel());
    Assertions.assertThrows(IllegalArgumentException.class,
        () -> new ObjectLabeller().label(new boolean[5], 2, 3));
  }

  @Test
  void checkNoImage() {
    final LabelMap map = new ObjectLabeller().label(new boolean[0], 0, 0);
    Assertions.assertEquals(0, map.getMaxLabel());
    Assertions.assertArrayEquals(new int[0], map.getLabels());
  }

  @Test
  void checkGetObjects() {
    final int maxx = 4;
    final int maxy = 4;
    final int[] image = {
    //@formatter:off
        1, 0, 0, 1,
        0, 1, 0, 1,
        0, 0, 0, 0,
        1, 1, 0, 1,
    };
    //@formatter:on
    // 4n connected
    LabelMap map = new ObjectLabeller(ConnectivityStructure.FOUR).label(toMask(image), maxx, maxy);
    Assertions.assertEquals(5, map.getMaxLabel());
    final int[] m1 = {
    //@formatter:off
        1, 0, 0, 2,
        0, 3, 0, 2,
        0, 0, 0, 0,
        4, 4, 0, 5,
    };
    //@formatter:on
    Assertions.assertArrayEquals(m1, map.getLabels());

    // 8n connected
    map = new ObjectLabeller(ConnectivityStructure.EIGHT).label(toMask(image), maxx, maxy);
    Assertions.assertEquals(4, map.getMaxLabel());
    final int[] m2 = {
    //@formatter:off
        1, 0, 0, 2,
        0, 1, 0, 2,
        0, 0, 0, 0,
        3, 3, 0, 4,
    };
    //@formatter:on
    Assertions.assertArrayEquals(m2, map.getLabels());
  }

  @Test
  void checkCustomStructure() {
    final int maxx = 3;
    final int maxy = 3;
    final int[] image = {
    //@formatter:off
        1, 1, 1,
        1, 0, 1,
        1, 1, 0,
    };
    //@formatter:on
    // Horizontal connections only
    final ConnectivityStructure rows = ConnectivityStructure.of(new boolean[][] {
        {false, false, false},
        {true, true, true},
        {false, false, false},
    });
    final LabelMap map = new ObjectLabeller(rows).label(toMask(image), maxx, maxy);
    final int[] m1 = {
    //@formatter:off
        1, 1, 1,
        2, 0, 3,
        4, 4, 0,
    };
    //@formatter:on
    Assertions.assertArrayEquals(m1, map.getLabels());
  }

  @Test
  void testManySmallObjects() {
    final int maxx = 35;
    final int maxy = 34;
    // 1010101 ...
    // 0101010 ...
    // ...
    final boolean[] mask = new boolean[maxx * maxy];
    int object = 0;
    final int[] m1 = new int[mask.length];
    for (int i = 0; i < m1.length; i += 2) {
      mask[i] = true;
      m1[i] = ++object;
    }
    final LabelMap map = new ObjectLabeller(ConnectivityStructure.FOUR).label(mask, maxx, maxy);
    Assertions.assertEquals(object, map.getMaxLabel());
    Assertions.assertArrayEquals(m1, map.getLabels());

    // The diagonals join into a single object
    final LabelMap map2 = new ObjectLabeller(ConnectivityStructure.EIGHT).label(mask, maxx, maxy);
    Assertions.assertEquals(1, map2.getMaxLabel());
  }

  @Test
  void testSingleLargeObject() {
    // Big enough to require expansion of the search list
    final int maxx = 35;
    final int maxy = 34;
    final boolean[] mask = new boolean[maxx * maxy];
    Arrays.fill(mask, true);
    final LabelMap map = new ObjectLabeller().label(mask, maxx, maxy);
    Assertions.assertEquals(1, map.getMaxLabel());
    final int[] expected = new int[mask.length];
    Arrays.fill(expected, 1);
    Assertions.assertArrayEquals(expected, map.getLabels());
  }

  @Test
  void testObjectsTouchingTheEdges() {
    final int maxx = 3;
    final int maxy = 3;
    final int[] image = {
    //@formatter:off
        1, 0, 1,
        0, 0, 0,
        1, 0, 1,
    };
    //@formatter:on
    final LabelMap map = new ObjectLabeller().label(toMask(image), maxx, maxy);
    final int[] m1 = {
    //@formatter:off
        1, 0, 2,
        0, 0, 0,
        3, 0, 4,
    };
    //@formatter:on
    Assertions.assertArrayEquals(m1, map.getLabels());
  }

  @Test
  void testSingleRowAndColumn() {
    final boolean[] mask = {true, true, false, true};
    Assertions.assertArrayEquals(new int[] {1, 1, 0, 2},
        new ObjectLabeller().label(mask, 4, 1).getLabels());
    Assertions.assertArrayEquals(new int[] {1, 1, 0, 2},
        new ObjectLabeller().label(mask, 1, 4).getLabels());
  }
}
