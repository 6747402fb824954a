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
 * Tabulated ΔT = TT − UT1 in seconds, sampled at increasing UTC Julian Days.
 *
 * <p>The table is immutable once built. Inside the sampled range values are interpolated linearly between the
 * two bracketing samples; outside it the slope of the nearest two samples is extended. Extrapolated values are
 * less reliable, which is logged once per direction and can be queried with {@link #isExtrapolated}.</p>
 *
 * <p>A complete table is normally built with {@link #merge}: measured values first, then the predicted series with
 * every prediction at or before the last measurement dropped.</p>
 */
public final class DeltaTTable {
    private static final Logger log = LoggerFactory.getLogger(DeltaTTable.class);

    private final double[] julianDays;
    private final double[] values;
    private volatile boolean warnedBefore = false;
    private volatile boolean warnedAfter = false;

    /**
     * @param julianDays sample instants, strictly increasing, at least two
     * @param values     ΔT in seconds at each instant
     */
    public DeltaTTable(double[] julianDays, double[] values) {
        if (julianDays.length != values.length) {
            throw new IllegalArgumentException(
                    "Sample count mismatch: " + julianDays.length + " instants, " + values.length + " values");
        }
        if (julianDays.length < 2) {
            throw new IllegalArgumentException("A ΔT table needs at least two samples");
        }
        for (int i = 1; i < julianDays.length; i++) {
            if (!(julianDays[i] > julianDays[i - 1])) {
                throw new IllegalArgumentException("ΔT samples not strictly increasing at index " + i
                        + " (JD " + julianDays[i - 1] + " then " + julianDays[i] + ")");
            }
        }
        this.julianDays = julianDays.clone();
        this.values = values.clone();
    }

    /**
     * Appends the predicted series to the measured one. Predicted samples at or before the last measured instant
     * are dropped, so the measured values always win where both exist.
     */
    public static DeltaTTable merge(DeltaTTable measured, DeltaTTable predicted) {
        double lastMeasured = measured.lastJulianDay();
        int skip = 0;
        while (skip < predicted.julianDays.length && predicted.julianDays[skip] <= lastMeasured) skip++;

        int kept = predicted.julianDays.length - skip;
        int n = measured.julianDays.length;
        double[] jd = new double[n + kept];
        double[] dt = new double[n + kept];
        System.arraycopy(measured.julianDays, 0, jd, 0, n);
        System.arraycopy(measured.values, 0, dt, 0, n);
        System.arraycopy(predicted.julianDays, skip, jd, n, kept);
        System.arraycopy(predicted.values, skip, dt, n, kept);
        if (skip > 0) {
            log.debug("Dropped {} predicted ΔT samples overlapping the measured range", skip);
        }
        return new DeltaTTable(jd, dt);
    }

    /** Builds a table from a dated classpath resource, see {@link TableResources}. */
    static DeltaTTable fromResource(String resourceName) {
        List<double[]> rows = TableResources.readDatedRows(resourceName);
        double[] jd = new double[rows.size()];
        double[] dt = new double[rows.size()];
        for (int i = 0; i < rows.size(); i++) {
            jd[i] = rows.get(i)[0];
            dt[i] = rows.get(i)[1];
        }
        try {
            return new DeltaTTable(jd, dt);
        } catch (IllegalArgumentException e) {
            log.error("Invalid ΔT table {}", resourceName, e);
            throw new IllegalStateException("Invalid ΔT table " + resourceName, e);
        }
    }

    /**
     * ΔT at the given instant.
     *
     * @param julianDay UTC Julian Day
     * @return TT − UT1 in seconds
     */
    public double valueAt(double julianDay) {
        int last = julianDays.length - 1;
        if (julianDay < julianDays[0]) {
            warnOnce(true, julianDay);
            return line(0, 1, julianDay);
        }
        if (julianDay > julianDays[last]) {
            warnOnce(false, julianDay);
            return line(last - 1, last, julianDay);
        }
        int hi = upperBound(julianDays, julianDay);
        if (julianDays[hi] == julianDay) return values[hi];
        return line(hi - 1, hi, julianDay);
    }

    /** Whether {@link #valueAt} extrapolates for this instant. */
    public boolean isExtrapolated(double julianDay) {
        return julianDay < julianDays[0] || julianDay > julianDays[julianDays.length - 1];
    }

    public double firstJulianDay() {
        return julianDays[0];
    }

    public double lastJulianDay() {
        return julianDays[julianDays.length - 1];
    }

    public int size() {
        return julianDays.length;
    }

    /** Sample instant at the given index, for inspection of the merged table. */
    public double julianDayAt(int index) {
        return julianDays[index];
    }

    /** Sample value at the given index. */
    public double sampleAt(int index) {
        return values[index];
    }

    private double line(int i, int j, double julianDay) {
        double slope = (values[j] - values[i]) / (julianDays[j] - julianDays[i]);
        return values[i] + slope * (julianDay - julianDays[i]);
    }

    private void warnOnce(boolean before, double julianDay) {
        if (before ? warnedBefore : warnedAfter) return;
        synchronized (this) {
            if (before && !warnedBefore) {
                warnedBefore = true;
                log.warn("JD {} is before the first ΔT sample (JD {}); extrapolating with the earliest slope",
                        julianDay, julianDays[0]);
            } else if (!before && !warnedAfter) {
                warnedAfter = true;
                log.warn("JD {} is after the last ΔT sample (JD {}); extrapolating with the latest slope. "
                        + "Consider updating the predicted ΔT table", julianDay, lastJulianDay());
            }
        }
    }

    /**
     * Find the first index in a sorted array where arr[index] >= x.
     * If x is larger than all entries, returns the last index.
     */
    static int upperBound(double[] arr, double x) {
        int lo = 0;
        int hi = arr.length - 1;
        while (lo < hi) {
            int mid = (lo + hi) >>> 1;
            if (arr[mid] < x) lo = mid + 1;
            else hi = mid;
        }
        return lo;
    }
}
