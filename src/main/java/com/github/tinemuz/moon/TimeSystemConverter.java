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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Calendar dates, Julian Days and the UTC, TT and UT1 time scales.
 *
 * <p>Julian Days follow Meeus, <i>Astronomical Algorithms</i>, chapter 7: dates before 1582-10-15 are read in the
 * Julian calendar, later dates in the Gregorian calendar. Years use astronomical numbering.</p>
 *
 * <p>The time scales are related by
 * <pre>
 *   TT  = UTC + (TAI − UTC) + 32.184 s
 *   TT  = UT1 + ΔT
 *   UT1 = UTC − (ΔT − (TAI − UTC) − 32.184 s)
 * </pre>
 * where TAI − UTC comes from the leap second table and ΔT from the merged measured and predicted ΔT tables. Both
 * tables are read from the classpath resources {@value #LEAP_SECONDS_RESOURCE}, {@value #DELTA_T_MEASURED_RESOURCE}
 * and {@value #DELTA_T_PREDICTED_RESOURCE} on first use. Call {@link #preload()} once at startup to pay that cost
 * early.</p>
 */
public final class TimeSystemConverter {
    private static final Logger log = LoggerFactory.getLogger(TimeSystemConverter.class);

    public static final String LEAP_SECONDS_RESOURCE = "leap-seconds.txt";
    public static final String DELTA_T_MEASURED_RESOURCE = "deltat-measured.txt";
    public static final String DELTA_T_PREDICTED_RESOURCE = "deltat-predicted.txt";

    /** Julian Day of the epoch J2000.0 (2000-01-01 12:00 TT). */
    public static final double J2000 = 2451545.0;
    public static final double DAYS_PER_CENTURY = 36525.0;
    public static final double SECONDS_PER_DAY = 86400.0;
    public static final double MILLIS_PER_DAY = 86_400_000.0;
    /** TT − TAI in seconds. */
    public static final double TT_MINUS_TAI = 32.184;

    // first Gregorian day, and the first Julian calendar day dropped by the reform
    private static final double GREGORIAN_START_DAY = 15.0;
    private static final double REFORM_GAP_START_DAY = 5.0;
    private static final int MIN_YEAR = -4712;

    private static volatile boolean loaded = false;
    private static LeapSecondTable leapSeconds;
    private static DeltaTTable deltaT;

    private TimeSystemConverter() {}

    /**
     * Julian Day of a calendar date.
     *
     * @param year  astronomical year, not before -4712
     * @param month month, 1 to 12
     * @param day   day of month with the time of day as fraction, in [1, daysInMonth + 1)
     * @return Julian Day
     * @throws InvalidDateException if any field is out of range or the date falls in the 1582 reform gap
     */
    public static double julianDay(int year, int month, double day) {
        if (year < MIN_YEAR) {
            throw new InvalidDateException("Year must not be before " + MIN_YEAR + ": " + year);
        }
        if (month < 1 || month > 12) {
            throw new InvalidDateException("Month must be in [1, 12]: " + month);
        }
        boolean julian = isJulianCalendar(year, month, day);
        int days = daysInMonth(year, month, julian);
        if (!(day >= 1.0 && day < days + 1.0)) {
            throw new InvalidDateException(
                    "Day must be in [1, " + (days + 1) + ") for " + year + "-" + month + ": " + day);
        }
        if (year == 1582 && month == 10 && day >= REFORM_GAP_START_DAY && day < GREGORIAN_START_DAY) {
            throw new InvalidDateException("1582-10-05 to 1582-10-14 do not exist (Gregorian reform): " + day);
        }

        int y = year;
        int m = month;
        if (m <= 2) {
            y -= 1;
            m += 12;
        }
        double b = 0.0;
        if (!julian) {
            double a = Math.floor(y / 100.0);
            b = 2.0 - a + Math.floor(a / 4.0);
        }
        return Math.floor(365.25 * (y + 4716)) + Math.floor(30.6001 * (m + 1)) + day + b - 1524.5;
    }

    /**
     * Julian Day of a calendar date and time of day.
     *
     * @throws InvalidDateException if the time fields are out of range, see also {@link #julianDay(int, int, double)}
     */
    public static double julianDay(int year, int month, int day, int hour, int minute, double second) {
        if (hour < 0 || hour > 23) {
            throw new InvalidDateException("Hour must be in [0, 23]: " + hour);
        }
        if (minute < 0 || minute > 59) {
            throw new InvalidDateException("Minute must be in [0, 59]: " + minute);
        }
        if (!(second >= 0.0 && second < 60.0)) {
            throw new InvalidDateException("Second must be in [0, 60): " + second);
        }
        double fraction = (hour * 3600.0 + minute * 60.0 + second) / SECONDS_PER_DAY;
        return julianDay(year, month, day + fraction);
    }

    /**
     * Calendar date of a Julian Day (Meeus chapter 7). The time of day is rounded to the millisecond, so that
     * 23:59:59.9996 becomes 0h of the next day.
     *
     * @param julianDay Julian Day, not negative
     * @throws InvalidDateException for negative or non-finite input
     */
    public static CalendarDate toCalendarDate(double julianDay) {
        if (!Double.isFinite(julianDay) || julianDay < 0.0) {
            throw new InvalidDateException("Julian Day must be finite and non-negative: " + julianDay);
        }
        double z0 = julianDay + 0.5;
        double z = Math.floor(z0);
        double f = Math.round((z0 - z) * MILLIS_PER_DAY) / MILLIS_PER_DAY;
        if (f >= 1.0) {
            z += 1.0;
            f = 0.0;
        }
        double a = z;
        if (z >= 2299161.0) {
            double alpha = Math.floor((z - 1867216.25) / 36524.25);
            a = z + 1.0 + alpha - Math.floor(alpha / 4.0);
        }
        double b = a + 1524.0;
        double c = Math.floor((b - 122.1) / 365.25);
        double d = Math.floor(365.25 * c);
        double e = Math.floor((b - d) / 30.6001);

        double day = b - d - Math.floor(30.6001 * e) + f;
        int month = (int) (e < 14.0 ? e - 1.0 : e - 13.0);
        int year = (int) (month > 2 ? c - 4716.0 : c - 4715.0);
        return new CalendarDate(year, month, day);
    }

    /** Julian centuries of 36525 days since J2000.0. */
    public static double julianCenturies(double julianDay) {
        return (julianDay - J2000) / DAYS_PER_CENTURY;
    }

    /**
     * Year with the elapsed part of the year as fraction, e.g. 2003-08-28 is 2003.6548.
     */
    public static double fractionalYear(int year, int month, double day) {
        double start = julianDay(year, 1, 1.0);
        double end = julianDay(year + 1, 1, 1.0);
        return year + (julianDay(year, month, day) - start) / (end - start);
    }

    /**
     * Cumulative leap seconds (TAI − UTC) in effect at a UTC instant, 0 before 1972.
     */
    public static double leapSeconds(double julianDayUtc) {
        ensureLoaded();
        return leapSeconds.offsetAt(julianDayUtc);
    }

    /**
     * ΔT = TT − UT1 in seconds. Extrapolates with the boundary slope outside the tabulated range.
     */
    public static double deltaT(double julianDay) {
        ensureLoaded();
        return deltaT.valueAt(julianDay);
    }

    /** The merged ΔT table used by {@link #deltaT}. */
    public static DeltaTTable deltaTTable() {
        ensureLoaded();
        return deltaT;
    }

    public static double utcToTt(double julianDayUtc) {
        return julianDayUtc + (leapSeconds(julianDayUtc) + TT_MINUS_TAI) / SECONDS_PER_DAY;
    }

    public static double utcToUt1(double julianDayUtc) {
        double correction = deltaT(julianDayUtc) - leapSeconds(julianDayUtc) - TT_MINUS_TAI;
        return julianDayUtc - correction / SECONDS_PER_DAY;
    }

    /** Universal time to TT, adding ΔT evaluated at the given instant. */
    public static double utToTt(double julianDayUt) {
        return julianDayUt + deltaT(julianDayUt) / SECONDS_PER_DAY;
    }

    /** TT to universal time, with ΔT looked up at the TT instant. */
    public static double ttToUt(double julianDayTt) {
        return julianDayTt - deltaT(julianDayTt) / SECONDS_PER_DAY;
    }

    /**
     * Loads the leap second and ΔT tables now rather than on first use.
     */
    public static void preload() {
        ensureLoaded();
    }

    private static void ensureLoaded() {
        if (loaded) return; // tables are immutable once published
        loadTables();
    }

    private static synchronized void loadTables() {
        if (loaded) return;
        leapSeconds = LeapSecondTable.fromResource(LEAP_SECONDS_RESOURCE);
        DeltaTTable measured = DeltaTTable.fromResource(DELTA_T_MEASURED_RESOURCE);
        DeltaTTable predicted = DeltaTTable.fromResource(DELTA_T_PREDICTED_RESOURCE);
        deltaT = DeltaTTable.merge(measured, predicted);
        loaded = true;
        log.debug("Loaded {} leap second entries and {} ΔT samples", leapSeconds.size(), deltaT.size());
    }

    static boolean isJulianCalendar(int year, int month, double day) {
        return year < 1582 || (year == 1582 && (month < 10 || (month == 10 && day < REFORM_GAP_START_DAY)));
    }

    static int daysInMonth(int year, int month, boolean julian) {
        switch (month) {
            case 2:
                return isLeapYear(year, julian) ? 29 : 28;
            case 4:
            case 6:
            case 9:
            case 11:
                return 30;
            default:
                return 31;
        }
    }

    private static boolean isLeapYear(int year, boolean julian) {
        if (julian) return Math.floorMod(year, 4) == 0;
        return (Math.floorMod(year, 4) == 0 && Math.floorMod(year, 100) != 0) || Math.floorMod(year, 400) == 0;
    }
}
