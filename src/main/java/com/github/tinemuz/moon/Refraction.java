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
 * Atmospheric refraction near and above the horizon (Meeus chapter 16).
 *
 * <p>Both formulas are scaled for pressure and temperature by (P/1010)·(283/(273 + T)). Below
 * {@value #CUTOFF_ALTITUDE}° the formulas break down and refraction is taken as zero.</p>
 */
public final class Refraction {

    /** Altitude in degrees below which no refraction is applied. */
    public static final double CUTOFF_ALTITUDE = -1.9006387;

    private Refraction() {}

    /**
     * Refraction to add to a true (airless) altitude to get the apparent altitude, Sæmundsson's formula (16.4)
     * with the offset that makes it vanish at the zenith.
     *
     * @param trueAltitude altitude in degrees
     * @param pressure     atmospheric pressure in millibar
     * @param temperature  air temperature in °C
     * @return correction in degrees, never negative
     */
    public static double fromTrueAltitude(double trueAltitude, double pressure, double temperature) {
        if (trueAltitude < CUTOFF_ALTITUDE) return 0.0;
        double h = trueAltitude;
        double arcMinutes = 1.02 / Angles.tan(h + 10.3 / (h + 5.11)) + 0.0019279;
        return Math.max(0.0, arcMinutes * atmosphere(pressure, temperature) / 60.0);
    }

    /**
     * Refraction to subtract from an apparent altitude to get the true altitude, Bennett's formula (16.3).
     * At the horizon under standard conditions this is close to the conventional 34'.
     *
     * @param apparentAltitude altitude in degrees
     * @param pressure         atmospheric pressure in millibar
     * @param temperature      air temperature in °C
     * @return correction in degrees, never negative
     */
    public static double fromApparentAltitude(double apparentAltitude, double pressure, double temperature) {
        if (apparentAltitude < CUTOFF_ALTITUDE) return 0.0;
        double h0 = apparentAltitude;
        double arcMinutes = 1.0 / Angles.tan(h0 + 7.31 / (h0 + 4.4));
        return Math.max(0.0, arcMinutes * atmosphere(pressure, temperature) / 60.0);
    }

    private static double atmosphere(double pressure, double temperature) {
        return pressure / 1010.0 * 283.0 / (273.0 + temperature);
    }
}
