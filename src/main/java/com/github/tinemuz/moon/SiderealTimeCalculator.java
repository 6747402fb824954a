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
 * Greenwich and local sidereal time, and hour angles.
 *
 * <p>Longitudes are west-positive (Meeus convention): Munich is -11.6°, Palomar +116.86°. Local sidereal time is
 * based on apparent Greenwich sidereal time, which includes the nutation in right ascension.</p>
 */
public final class SiderealTimeCalculator {

    private SiderealTimeCalculator() {}

    /**
     * Mean sidereal time at Greenwich (Meeus 12.4).
     *
     * @param julianDayUt Julian Day in universal time
     * @return degrees in [0, 360)
     */
    public static double meanSiderealTime(double julianDayUt) {
        double t = TimeSystemConverter.julianCenturies(julianDayUt);
        double theta = 280.46061837
                + 360.98564736629 * (julianDayUt - TimeSystemConverter.J2000)
                + 0.000387933 * t * t
                - t * t * t / 38710000.0;
        return Angles.normalize360(theta);
    }

    /**
     * Apparent sidereal time at Greenwich: mean sidereal time plus Δψ·cos ε.
     *
     * @param julianDayUt Julian Day in universal time
     * @return degrees in [0, 360)
     */
    public static double apparentSiderealTime(double julianDayUt) {
        double correction = Nutation.inLongitude(julianDayUt) / 3600.0 * Angles.cos(Nutation.trueObliquity(julianDayUt));
        return Angles.normalize360(meanSiderealTime(julianDayUt) + correction);
    }

    /**
     * Apparent local sidereal time.
     *
     * @param julianDayUt      Julian Day in universal time
     * @param longitudeWest    observer longitude in degrees, west-positive
     * @return degrees in [0, 360)
     */
    public static double localSiderealTime(double julianDayUt, double longitudeWest) {
        return Angles.normalize360(apparentSiderealTime(julianDayUt) - longitudeWest);
    }

    /**
     * Local hour angle H = θ − α, measured westward from the meridian.
     *
     * @return degrees in [0, 360)
     */
    public static double hourAngle(double localSiderealTime, double rightAscension) {
        return Angles.normalize360(localSiderealTime - rightAscension);
    }
}
