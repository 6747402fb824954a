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
 * Sexagesimal formatting of angles.
 *
 * <p>Degrees are rendered as {@code 13° 46' 10.766"}, hours as {@code 16h 6m 46.994s}. The seconds field is
 * rounded to the requested number of digits and a rounded value of 60 carries into the minutes and from there
 * into the degrees or hours, so a formatted string never shows 60 seconds or 60 minutes.
 */
public final class AngleFormatter {

    private static final int MAX_PRECISION = 9;

    private AngleFormatter() {
        // static
    }

    /**
     * Formats decimal degrees as degrees, arc minutes and arc seconds.
     *
     * @param degrees   angle in decimal degrees, sign preserved
     * @param precision number of decimals of the seconds field (0 to 9)
     * @return formatted angle, e.g. {@code -5° 42' 47.78"}
     */
    public static String toDms(double degrees, int precision) {
        return toDms(degrees, precision, 0);
    }

    /**
     * Formats decimal degrees as degrees, arc minutes and arc seconds.
     *
     * @param degrees   angle in decimal degrees, sign preserved
     * @param precision number of decimals of the seconds field (0 to 9)
     * @param padWidth  zero-padding width of the minutes field and of the integer part of the seconds field,
     *                  0 for no padding
     * @return formatted angle
     */
    public static String toDms(double degrees, int precision, int padWidth) {
        Sexagesimal s = split(degrees, precision);
        return String.format(Locale.ROOT, "%s%d° %s' %s\"",
                s.sign(), s.whole(), pad(s.minutes(), padWidth), seconds(s.seconds(), precision, padWidth));
    }

    /**
     * Formats an angle given in decimal degrees as hours, minutes and seconds of time (15° per hour).
     *
     * @param degrees   angle in decimal degrees, typically a right ascension or hour angle
     * @param precision number of decimals of the seconds field (0 to 9)
     * @return formatted time angle, e.g. {@code 16h 6m 46.994s}
     */
    public static String toHms(double degrees, int precision) {
        return toHms(degrees, precision, 0);
    }

    public static String toHms(double degrees, int precision, int padWidth) {
        Sexagesimal s = split(degrees / 15.0, precision);
        return String.format(Locale.ROOT, "%s%dh %sm %ss",
                s.sign(), s.whole(), pad(s.minutes(), padWidth), seconds(s.seconds(), precision, padWidth));
    }

    /**
     * Converts degrees, arc minutes and arc seconds to decimal degrees. The result is negative if any component
     * is negative, so {@code fromDms(0, -30, 0)} is -0.5.
     */
    public static double fromDms(double degrees, double minutes, double seconds) {
        double sign = (degrees < 0 || minutes < 0 || seconds < 0) ? -1.0 : 1.0;
        return sign * (Math.abs(degrees) + Math.abs(minutes) / 60.0 + Math.abs(seconds) / 3600.0);
    }

    /** Converts hours, minutes and seconds of time to decimal degrees. */
    public static double fromHms(double hours, double minutes, double seconds) {
        return 15.0 * fromDms(hours, minutes, seconds);
    }

    private static Sexagesimal split(double value, int precision) {
        if (!Double.isFinite(value)) {
            throw new IllegalArgumentException("Cannot format non-finite angle: " + value);
        }
        if (precision < 0 || precision > MAX_PRECISION) {
            throw new IllegalArgumentException("Precision must be in [0, " + MAX_PRECISION + "]: " + precision);
        }

        double abs = Math.abs(value);
        long whole = (long) Math.floor(abs);
        double minutesExact = (abs - whole) * 60.0;
        int minutes = (int) Math.floor(minutesExact);
        double scale = Math.pow(10.0, precision);
        double seconds = Math.round((minutesExact - minutes) * 60.0 * scale) / scale;

        if (seconds >= 60.0) {
            seconds -= 60.0;
            minutes++;
        }
        if (minutes >= 60) {
            minutes -= 60;
            whole++;
        }

        boolean zero = whole == 0 && minutes == 0 && seconds == 0.0;
        return new Sexagesimal(value < 0 && !zero ? "-" : "", whole, minutes, seconds);
    }

    private static String pad(int minutes, int padWidth) {
        return padWidth > 0 ? String.format(Locale.ROOT, "%0" + padWidth + "d", minutes) : Integer.toString(minutes);
    }

    private static String seconds(double seconds, int precision, int padWidth) {
        int width = padWidth > 0 ? padWidth + (precision > 0 ? precision + 1 : 0) : 0;
        String pattern = width > 0 ? "%0" + width + "." + precision + "f" : "%." + precision + "f";
        return String.format(Locale.ROOT, pattern, seconds);
    }

    private record Sexagesimal(String sign, long whole, int minutes, double seconds) {
    }
}
