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

import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Cumulative TAI − UTC offsets and the UTC instants from which they apply.
 *
 * <p>The offset is a step function: a query returns the value of the latest entry at or before the instant, and 0
 * before the first entry. Offsets never decrease.</p>
 */
public final class LeapSecondTable {
    private static final Logger log = LoggerFactory.getLogger(LeapSecondTable.class);

    private final double[] julianDays;
    private final double[] offsets;

    /**
     * @param julianDays UTC Julian Days at which each offset takes effect, strictly increasing
     * @param offsets    cumulative TAI − UTC in seconds, non-decreasing
     */
    public LeapSecondTable(double[] julianDays, double[] offsets) {
        if (julianDays.length != offsets.length || julianDays.length == 0) {
            throw new IllegalArgumentException("Leap second table needs matching, non-empty columns");
        }
        for (int i = 1; i < julianDays.length; i++) {
            if (!(julianDays[i] > julianDays[i - 1])) {
                throw new IllegalArgumentException("Leap second instants not increasing at index " + i);
            }
            if (offsets[i] < offsets[i - 1]) {
                throw new IllegalArgumentException("Leap second offset decreases at index " + i);
            }
        }
        this.julianDays = julianDays.clone();
        this.offsets = offsets.clone();
    }

    static LeapSecondTable fromResource(String resourceName) {
        List<double[]> rows = TableResources.readDatedRows(resourceName);
        double[] jd = new double[rows.size()];
        double[] sec = new double[rows.size()];
        for (int i = 0; i < rows.size(); i++) {
            jd[i] = rows.get(i)[0];
            sec[i] = rows.get(i)[1];
        }
        try {
            return new LeapSecondTable(jd, sec);
        } catch (IllegalArgumentException e) {
            log.error("Invalid leap second table {}", resourceName, e);
            throw new IllegalStateException("Invalid leap second table " + resourceName, e);
        }
    }

    /**
     * TAI − UTC in effect at the given UTC instant.
     *
     * @param julianDay UTC Julian Day
     * @return cumulative leap seconds, 0 before the first entry
     */
    public double offsetAt(double julianDay) {
        if (julianDay < julianDays[0]) return 0.0;
        int hi = DeltaTTable.upperBound(julianDays, julianDay);
        // upperBound gives the first entry >= jd; step back unless it is an exact hit
        int idx = julianDays[hi] <= julianDay ? hi : hi - 1;
        return offsets[idx];
    }

    public int size() {
        return julianDays.length;
    }
}
