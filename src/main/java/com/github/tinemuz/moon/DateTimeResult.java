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

import java.util.Locale;

/**
 * Calendar time of an event such as moonrise. When {@link #valid} is false the event does not happen in the
 * queried interval; its calendar fields are zero and {@link #julianDay} is NaN.
 */
public final class DateTimeResult {

    private static final DateTimeResult INVALID = new DateTimeResult(false, Double.NaN, 0, 0, 0, 0, 0, 0.0, 0.0);

    public final boolean valid;
    public final int year;
    public final int month;
    public final int day;
    public final int hour;
    public final int minute;
    public final double second;
    /** Julian Day of the event in the time scale of the fields, NaN when invalid. */
    public final double julianDay;
    /** Offset from UTC in hours that the calendar fields include; 0 for UTC. */
    public final double utcOffsetHours;

    private DateTimeResult(boolean valid, double julianDay, int year, int month, int day, int hour, int minute,
                           double second, double utcOffsetHours) {
        this.valid = valid;
        this.julianDay = julianDay;
        this.year = year;
        this.month = month;
        this.day = day;
        this.hour = hour;
        this.minute = minute;
        this.second = second;
        this.utcOffsetHours = utcOffsetHours;
    }

    /** A result for an event that does not occur. */
    public static DateTimeResult invalid() {
        return INVALID;
    }

    /**
     * @param julianDayUtc event time as UTC Julian Day
     */
    public static DateTimeResult fromJulianDay(double julianDayUtc) {
        return of(julianDayUtc, 0.0);
    }

    /**
     * The same instant expressed in a civil time zone, for display. Invalid results stay invalid.
     *
     * @param offsetHours local time minus UTC, e.g. +1 for CET
     */
    public DateTimeResult withUtcOffset(double offsetHours) {
        if (!valid) return this;
        double utc = julianDay - utcOffsetHours / 24.0;
        return of(utc + offsetHours / 24.0, offsetHours);
    }

    private static DateTimeResult of(double julianDay, double offsetHours) {
        CalendarDate date = TimeSystemConverter.toCalendarDate(julianDay);
        return new DateTimeResult(true, julianDay, date.year(), date.month(), date.dayOfMonth(),
                date.hour(), date.minute(), date.second(), offsetHours);
    }

    @Override
    public String toString() {
        if (!valid) return "invalid";
        return String.format(Locale.ROOT, "%04d-%02d-%02d %02d:%02d:%06.3f", year, month, day, hour, minute, second);
    }
}
