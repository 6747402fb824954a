/*
 * MIT License
 *
 * Copyright (c) 2025 tinemuz
 *
 * Permission is hereby granted, free of charge, to any person obtaining a copy
 * of this software and associated documentation files (the "Software"), to deal
 * in the Software without restriction, including without limitation the rights
 * to use, copy, modify, merge, publish, distribute, sublicense, and/or sell
 * copies of the Software, and to permit persons to whom the Software is
 * furnished to do so, subject to the following conditions:
 *
 * The above copyright notice and this permission notice shall be included in all
 * copies or substantial portions of the Software.
 *
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR
 * IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY,
 * FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE
 * AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER
 * LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING FROM,
 * OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN THE
 * SOFTWARE.
 */
package com.github.tinemuz.moon;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class LeapSecondTableTest {

    private final LeapSecondTable table =
            new LeapSecondTable(new double[] {10.0, 20.0, 30.0}, new double[] {1.0, 2.0, 3.0});

    @Test
    @DisplayName("Offset is zero before the first entry")
    void beforeFirstEntry() {
        assertEquals(0.0, table.offsetAt(9.999));
    }

    @Test
    @DisplayName("Offset steps at each entry and holds until the next")
    void steps() {
        assertEquals(1.0, table.offsetAt(10.0));
        assertEquals(1.0, table.offsetAt(19.999));
        assertEquals(2.0, table.offsetAt(20.0));
        assertEquals(3.0, table.offsetAt(30.0));
        assertEquals(3.0, table.offsetAt(1e9));
    }

    @Test
    void rejectsInvalidTables() {
        assertThrows(IllegalArgumentException.class, () -> new LeapSecondTable(new double[0], new double[0]));
        assertThrows(IllegalArgumentException.class,
                () -> new LeapSecondTable(new double[] {1.0, 1.0}, new double[] {1.0, 2.0}));
        assertThrows(IllegalArgumentException.class,
                () -> new LeapSecondTable(new double[] {1.0, 2.0}, new double[] {2.0, 1.0}));
    }

    @Test
    @DisplayName("Bundled table runs from 1972 to 2017")
    void bundledTable() {
        LeapSecondTable bundled = LeapSecondTable.fromResource(TimeSystemConverter.LEAP_SECONDS_RESOURCE);
        assertEquals(28, bundled.size());
        assertEquals(37.0, bundled.offsetAt(TimeSystemConverter.julianDay(2030, 1, 1.0)));
    }
}
