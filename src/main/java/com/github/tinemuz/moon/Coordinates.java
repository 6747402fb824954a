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
 * Transformations between ecliptic, equatorial and horizontal coordinates, and the topocentric correction for
 * parallax (Meeus chapters 11, 13 and 40). All angles in degrees.
 */
public final class Coordinates {

    /** Earth's equatorial radius in km (IAU 1976). */
    public static final double EARTH_RADIUS_KM = 6378.14;
    /** Polar over equatorial radius b/a. */
    public static final double EARTH_AXIS_RATIO = 0.99664719;

    private static final double EARTH_RADIUS_M = EARTH_RADIUS_KM * 1000.0;

    private Coordinates() {}

    /** Right ascension in [0, 360) and declination in [-90, 90]. */
    public record Equatorial(double rightAscension, double declination) {}

    /** Azimuth in [0, 360), measured from North through East, and altitude in [-90, 90]. */
    public record Horizontal(double azimuth, double altitude) {}

    /**
     * Ecliptic to equatorial (Meeus 13.3, 13.4).
     *
     * @param longitude ecliptic longitude λ
     * @param latitude  ecliptic latitude β
     * @param obliquity obliquity of the ecliptic ε
     */
    public static Equatorial eclipticToEquatorial(double longitude, double latitude, double obliquity) {
        double sinL = Angles.sin(longitude);
        double sinE = Angles.sin(obliquity);
        double cosE = Angles.cos(obliquity);
        double ra = Angles.atan2(sinL * cosE - Angles.tan(latitude) * sinE, Angles.cos(longitude));
        double dec = Angles.asin(Angles.sin(latitude) * cosE + Angles.cos(latitude) * sinE * sinL);
        return new Equatorial(Angles.normalize360(ra), dec);
    }

    /**
     * Equatorial to horizontal (Meeus 13.5, 13.6). Meeus counts azimuth from the South; the result here is
     * turned by 180° to count from the North.
     *
     * @param hourAngle   local hour angle H
     * @param declination declination δ
     * @param latitude    observer latitude φ
     */
    public static Horizontal equatorialToHorizontal(double hourAngle, double declination, double latitude) {
        double sinH = Angles.sin(hourAngle);
        double cosH = Angles.cos(hourAngle);
        double sinD = Angles.sin(declination);
        double cosD = Angles.cos(declination);
        double sinP = Angles.sin(latitude);
        double cosP = Angles.cos(latitude);
        double fromSouth = Angles.atan2(sinH * cosD, cosH * sinP * cosD - sinD * cosP);
        double altitude = Angles.asin(sinP * sinD + cosP * cosD * cosH);
        return new Horizontal(Angles.normalize360(fromSouth + 180.0), altitude);
    }

    /**
     * ρ·sin φ' for an observer: the observer's distance from the Earth's axis plane, in Earth radii (Meeus 11).
     *
     * @param latitude    geodetic latitude φ
     * @param heightMeter height above sea level in metres
     */
    public static double rhoSinPhiPrime(double latitude, double heightMeter) {
        double u = Math.atan(EARTH_AXIS_RATIO * Angles.tan(latitude));
        return EARTH_AXIS_RATIO * Math.sin(u) + heightMeter / EARTH_RADIUS_M * Angles.sin(latitude);
    }

    /**
     * ρ·cos φ' for an observer, in Earth radii (Meeus 11).
     */
    public static double rhoCosPhiPrime(double latitude, double heightMeter) {
        double u = Math.atan(EARTH_AXIS_RATIO * Angles.tan(latitude));
        return Math.cos(u) + heightMeter / EARTH_RADIUS_M * Angles.cos(latitude);
    }

    /**
     * Corrects geocentric equatorial coordinates for the observer's displacement from the Earth's centre
     * (Meeus 40.2, 40.3).
     *
     * @param geocentric     geocentric right ascension and declination
     * @param hourAngle      geocentric hour angle H
     * @param sinParallax    sine of the equatorial horizontal parallax, Earth radius over distance
     * @param rhoSinPhiPrime observer term from {@link #rhoSinPhiPrime}
     * @param rhoCosPhiPrime observer term from {@link #rhoCosPhiPrime}
     * @return topocentric right ascension and declination
     */
    public static Equatorial topocentric(Equatorial geocentric, double hourAngle, double sinParallax,
                                         double rhoSinPhiPrime, double rhoCosPhiPrime) {
        double cosD = Angles.cos(geocentric.declination());
        double sinD = Angles.sin(geocentric.declination());
        double denominator = cosD - rhoCosPhiPrime * sinParallax * Angles.cos(hourAngle);
        double deltaRa = Angles.atan2(-rhoCosPhiPrime * sinParallax * Angles.sin(hourAngle), denominator);
        double dec = Angles.atan2((sinD - rhoSinPhiPrime * sinParallax) * Angles.cos(deltaRa), denominator);
        return new Equatorial(Angles.normalize360(geocentric.rightAscension() + deltaRa), dec);
    }
}
