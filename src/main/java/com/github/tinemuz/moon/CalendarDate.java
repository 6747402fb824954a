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

/**
 * A calendar date with a fractional day of month, as produced by {@link TimeSystemConverter#toCalendarDate}.
 * Dates before 1582-10-15 are in the Julian calendar, later ones in the Gregorian calendar. Years use
 * astronomical numbering (year 0 is 1 BC).
 *
 * @param year  astronomical year
 * @param month month, 1 to 12
 * @param day   day of month including the fraction of the day, e.g. 4.81
 */
public record CalendarDate(int year, int month, double day) {

    private static final long MILLIS_PER_HOUR = 3_600_000L;
    private static final long MILLIS_PER_MINUTE = 60_000L;

    public int dayOfMonth() {
        return (int) Math.floor(day);
    }

    /** Hour of the day, from the time of day rounded to the millisecond. */
    public int hour() {
        return (int) (millisOfDay() / MILLIS_PER_HOUR);
    }

    public int minute() {
        return (int) (millisOfDay() % MILLIS_PER_HOUR / MILLIS_PER_MINUTE);
    }

    /** Seconds within the minute, to the millisecond. */
    public double second() {
        return millisOfDay() % MILLIS_PER_MINUTE / 1000.0;
    }

    // capped at 23:59:59.999; toCalendarDate already carries a rounded midnight into the next day
    private long millisOfDay() {
        long millis = Math.round((day - Math.floor(day)) * TimeSystemConverter.MILLIS_PER_DAY);
        return Math.min(millis, (long) TimeSystemConverter.MILLIS_PER_DAY - 1L);
    }
}
