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
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class DeltaTTableTest {

    private static final double TOLERANCE = 1e-9; // s

    private static DeltaTTable table(double[] jd, double[] dt) {
        return new DeltaTTable(jd, dt);
    }

    @Nested
    @DisplayName("Lookup")
    class LookupTests {

        private final DeltaTTable table = table(new double[] {100.0, 200.0, 300.0}, new double[] {10.0, 20.0, 40.0});

        @Test
        @DisplayName("Exact samples are returned unchanged")
        void exactSamples() {
            assertEquals(10.0, table.valueAt(100.0), TOLERANCE);
            assertEquals(20.0, table.valueAt(200.0), TOLERANCE);
            assertEquals(40.0, table.valueAt(300.0), TOLERANCE);
        }

        @Test
        @DisplayName("Between samples the value is linear")
        void interpolates() {
            assertEquals(15.0, table.valueAt(150.0), TOLERANCE);
            assertEquals(35.0, table.valueAt(275.0), TOLERANCE);
            assertFalse(table.isExtrapolated(250.0));
        }

        @Test
        @DisplayName("Outside the range the boundary slope is extended")
        void extrapolates() {
            assertEquals(0.0, table.valueAt(0.0), TOLERANCE);
            assertEquals(60.0, table.valueAt(400.0), TOLERANCE);
            assertTrue(table.isExtrapolated(50.0));
            assertTrue(table.isExtrapolated(301.0));
            // second query in the same direction is only logged once; the value is unaffected
            assertEquals(80.0, table.valueAt(500.0), TOLERANCE);
        }

        @Test
        void accessors() {
            assertEquals(3, table.size());
            assertEquals(100.0, table.firstJulianDay());
            assertEquals(300.0, table.lastJulianDay());
            assertEquals(200.0, table.julianDayAt(1));
            assertEquals(20.0, table.sampleAt(1));
        }
    }

    @Nested
    @DisplayName("Merge")
    class MergeTests {

        @Test
        @DisplayName("Predictions at or before the last measurement are dropped")
        void dropsOverlap() {
            DeltaTTable measured = table(new double[] {1.0, 2.0, 3.0}, new double[] {1.0, 2.0, 3.0});
            DeltaTTable predicted = table(new double[] {2.0, 3.0, 4.0, 5.0}, new double[] {9.0, 9.0, 4.0, 5.0});
            DeltaTTable merged = DeltaTTable.merge(measured, predicted);

            assertEquals(5, merged.size());
            assertEquals(3.0, merged.valueAt(3.0), TOLERANCE);
            assertEquals(4.0, merged.julianDayAt(3));
            assertEquals(4.5, merged.valueAt(4.5), TOLERANCE);
        }

        @Test
        @DisplayName("Bundled tables: measured through 2024-01-01, then predictions from 2024-07-01")
        void bundledTables() {
            DeltaTTable merged = TimeSystemConverter.deltaTTable();
            double handover = TimeSystemConverter.julianDay(2024, 1, 1.0);
            int index = -1;
            for (int i = 0; i < merged.size(); i++) {
                if (merged.julianDayAt(i) == handover) index = i;
            }
            assertTrue(index > 0, "2024-01-01 sample missing");
            assertEquals(69.18, merged.sampleAt(index), TOLERANCE);
            assertEquals(TimeSystemConverter.julianDay(2024, 7, 1.0), merged.julianDayAt(index + 1));
            assertEquals(69.17, merged.sampleAt(index + 1), TOLERANCE);
        }

        @Test
        @DisplayName("Bundled tables have no jumps between neighbouring samples")
        void bundledTablesSmooth() {
            DeltaTTable merged = TimeSystemConverter.deltaTTable();
            for (int i = 1; i < merged.size(); i++) {
                double jump = Math.abs(merged.sampleAt(i) - merged.sampleAt(i - 1));
                assertTrue(jump <= 2.0, "ΔT jumps by " + jump + " s at JD " + merged.julianDayAt(i));
            }
        }
    }

    @Nested
    @DisplayName("Validation")
    class ValidationTests {

        @Test
        void rejectsNonIncreasingInstants() {
            assertThrows(IllegalArgumentException.class,
                    () -> table(new double[] {1.0, 1.0}, new double[] {0.0, 0.0}));
            assertThrows(IllegalArgumentException.class,
                    () -> table(new double[] {2.0, 1.0}, new double[] {0.0, 0.0}));
        }

        @Test
        void rejectsTooFewSamples() {
            assertThrows(IllegalArgumentException.class, () -> table(new double[] {1.0}, new double[] {0.0}));
        }

        @Test
        void rejectsMismatchedColumns() {
            assertThrows(IllegalArgumentException.class,
                    () -> table(new double[] {1.0, 2.0}, new double[] {0.0}));
        }

        @Test
        @DisplayName("Missing resource fails with IllegalStateException")
        void missingResource() {
            assertThrows(IllegalStateException.class, () -> DeltaTTable.fromResource("no-such-table.txt"));
        }

        @Test
        @DisplayName("upperBound finds the first entry not below the key")
        void upperBound() {
            double[] arr = {1.0, 2.0, 3.0};
            assertEquals(0, DeltaTTable.upperBound(arr, 0.5));
            assertEquals(1, DeltaTTable.upperBound(arr, 2.0));
            assertEquals(2, DeltaTTable.upperBound(arr, 2.5));
            assertEquals(2, DeltaTTable.upperBound(arr, 9.0));
        }
    }
}
