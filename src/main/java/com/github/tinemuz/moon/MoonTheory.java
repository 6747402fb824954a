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
 * Geocentric position of the Moon from the truncated ELP-2000/82 series of Meeus, <i>Astronomical Algorithms</i>,
 * chapter 47: about 10" in longitude and 4" in latitude.
 *
 * <p>The fundamental arguments are exposed for a time T in Julian centuries since J2000.0 (TT); angles are in
 * degrees reduced to [0, 360).</p>
 */
public final class MoonTheory {

    /** Ratio of the Moon's radius to the Earth's equatorial radius. */
    public static final double RADIUS_RATIO = 0.272481;

    private static final double MEAN_DISTANCE_KM = 385000.56;

    // D, M, M', F multiples, then the sine coefficient of Σl (1e-6 deg) and cosine coefficient of Σr (1e-3 km)
    private static final int[][] LONGITUDE_DISTANCE = {
        {0, 0, 1, 0, 6288774, -20905355}, {2, 0, -1, 0, 1274027, -3699111},
        {2, 0, 0, 0, 658314, -2955968}, {0, 0, 2, 0, 213618, -569925},
        {0, 1, 0, 0, -185116, 48888}, {0, 0, 0, 2, -114332, -3149},
        {2, 0, -2, 0, 58793, 246158}, {2, -1, -1, 0, 57066, -152138},
        {2, 0, 1, 0, 53322, -170733}, {2, -1, 0, 0, 45758, -204586},
        {0, 1, -1, 0, -40923, -129620}, {1, 0, 0, 0, -34720, 108743},
        {0, 1, 1, 0, -30383, 104755}, {2, 0, 0, -2, 15327, 10321},
        {0, 0, 1, 2, -12528, 0}, {0, 0, 1, -2, 10980, 79661},
        {4, 0, -1, 0, 10675, -34782}, {0, 0, 3, 0, 10034, -23210},
        {4, 0, -2, 0, 8548, -21636}, {2, 1, -1, 0, -7888, 24208},
        {2, 1, 0, 0, -6766, 30824}, {1, 0, -1, 0, -5163, -8379},
        {1, 1, 0, 0, 4987, -16675}, {2, -1, 1, 0, 4036, -12831},
        {2, 0, 2, 0, 3994, -10445}, {4, 0, 0, 0, 3861, -11650},
        {2, 0, -3, 0, 3665, 14403}, {0, 1, -2, 0, -2689, -7003},
        {2, 0, -1, 2, -2602, 0}, {2, -1, -2, 0, 2390, 10056},
        {1, 0, 1, 0, -2348, 6322}, {2, -2, 0, 0, 2236, -9884},
        {0, 1, 2, 0, -2120, 5751}, {0, 2, 0, 0, -2069, 0},
        {2, -2, -1, 0, 2048, -4950}, {2, 0, 1, -2, -1773, 4130},
        {2, 0, 0, 2, -1595, 0}, {4, -1, -1, 0, 1215, -3958},
        {0, 0, 2, 2, -1110, 0}, {3, 0, -1, 0, -892, 3258},
        {2, 1, 1, 0, -810, 2616}, {4, -1, -2, 0, 759, -1897},
        {0, 2, -1, 0, -713, -2117}, {2, 2, -1, 0, -700, 2354},
        {2, 1, -2, 0, 691, 0}, {2, -1, 0, -2, 596, 0},
        {4, 0, 1, 0, 549, -1423}, {0, 0, 4, 0, 537, -1117},
        {4, -1, 0, 0, 520, -1571}, {1, 0, -2, 0, -487, -1739},
        {2, 1, 0, -2, -399, 0}, {0, 0, 2, -2, -381, -4421},
        {1, 1, 1, 0, 351, 0}, {3, 0, -2, 0, -340, 0},
        {4, 0, -3, 0, 330, 0}, {2, -1, 2, 0, 327, 0},
        {0, 2, 1, 0, -323, 1165}, {1, 1, -1, 0, 299, 0},
        {2, 0, 3, 0, 294, 0}, {2, 0, -1, -2, 0, 8752},
    };

    // D, M, M', F multiples and the sine coefficient of Σb (1e-6 deg)
    private static final int[][] LATITUDE = {
        {0, 0, 0, 1, 5128122}, {0, 0, 1, 1, 280602}, {0, 0, 1, -1, 277693},
        {2, 0, 0, -1, 173237}, {2, 0, -1, 1, 55413}, {2, 0, -1, -1, 46271},
        {2, 0, 0, 1, 32573}, {0, 0, 2, 1, 17198}, {2, 0, 1, -1, 9266},
        {0, 0, 2, -1, 8822}, {2, -1, 0, -1, 8216}, {2, 0, -2, -1, 4324},
        {2, 0, 1, 1, 4200}, {2, 1, 0, -1, -3359}, {2, -1, -1, 1, 2463},
        {2, -1, 0, 1, 2211}, {2, -1, -1, -1, 2065}, {0, 1, -1, -1, -1870},
        {4, 0, -1, -1, 1828}, {0, 1, 0, 1, -1794}, {0, 0, 0, 3, -1749},
        {0, 1, -1, 1, -1565}, {1, 0, 0, 1, -1491}, {0, 1, 1, 1, -1475},
        {0, 1, 1, -1, -1410}, {0, 1, 0, -1, -1344}, {1, 0, 0, -1, -1335},
        {0, 0, 3, 1, 1107}, {4, 0, 0, -1, 1021}, {4, 0, -1, 1, 833},
        {0, 0, 1, -3, 777}, {4, 0, -2, 1, 671}, {2, 0, 0, -3, 607},
        {2, 0, 2, -1, 596}, {2, -1, 1, -1, 491}, {2, 0, -2, 1, -451},
        {0, 0, 3, -1, 439}, {2, 0, 2, 1, 422}, {2, 0, -3, -1, 421},
        {2, 1, -1, 1, -366}, {2, 1, 0, 1, -351}, {4, 0, 0, 1, 331},
        {2, -1, 1, 1, 315}, {2, -2, 0, -1, 302}, {0, 0, 1, 3, -283},
        {2, 1, 1, -1, -229}, {1, 1, 0, -1, 223}, {1, 1, 0, 1, 223},
        {0, 1, -2, -1, -220}, {2, 1, -1, -1, -220}, {1, 0, 1, 1, -185},
        {2, -1, -2, -1, 181}, {0, 1, 2, 1, -177}, {4, 0, -2, -1, 176},
        {4, -1, -1, -1, 166}, {1, 0, 1, -1, -164}, {4, 0, 1, -1, 132},
        {1, 0, -1, -1, -119}, {4, -1, 0, -1, 115}, {2, -2, 0, 1, 107},
    };

    private MoonTheory() {}

    /**
     * Apparent geocentric ecliptic coordinates of the Moon.
     *
     * @param longitude apparent longitude λ in degrees [0, 360), referred to the true equinox of date
     * @param latitude  latitude β in degrees
     * @param distance  centre to centre distance Earth to Moon in km
     */
    public record Position(double longitude, double latitude, double distance) {}

    /** Mean longitude L', referred to the mean equinox of date (47.1). */
    public static double meanLongitude(double t) {
        return Angles.normalize360(218.3164477 + 481267.88123421 * t - 0.0015786 * t * t
                + t * t * t / 538841.0 - t * t * t * t / 65194000.0);
    }

    /** Mean elongation D (47.2). */
    public static double meanElongation(double t) {
        return Angles.normalize360(297.8501921 + 445267.1114034 * t - 0.0018819 * t * t
                + t * t * t / 545868.0 - t * t * t * t / 113065000.0);
    }

    /** Sun's mean anomaly M (47.3). */
    public static double sunMeanAnomaly(double t) {
        return Angles.normalize360(357.5291092 + 35999.0502909 * t - 0.0001536 * t * t
                + t * t * t / 24490000.0);
    }

    /** Moon's mean anomaly M' (47.4). */
    public static double meanAnomaly(double t) {
        return Angles.normalize360(134.9633964 + 477198.8675055 * t + 0.0087414 * t * t
                + t * t * t / 69699.0 - t * t * t * t / 14712000.0);
    }

    /** Argument of latitude F (47.5). */
    public static double argumentOfLatitude(double t) {
        return Angles.normalize360(93.2720950 + 483202.0175233 * t - 0.0036539 * t * t
                - t * t * t / 3526000.0 + t * t * t * t / 863310000.0);
    }

    /** Eccentricity factor E of the Earth's orbit (47.6). */
    public static double eccentricityFactor(double t) {
        return 1.0 - 0.002516 * t - 0.0000074 * t * t;
    }

    /**
     * Apparent geocentric position. Nutation in longitude is included, so the longitude is referred to the true
     * equinox of date.
     *
     * @param julianDayTt Julian Day in terrestrial time
     */
    public static Position position(double julianDayTt) {
        double t = TimeSystemConverter.julianCenturies(julianDayTt);
        double lp = meanLongitude(t);
        double d = meanElongation(t);
        double m = sunMeanAnomaly(t);
        double mp = meanAnomaly(t);
        double f = argumentOfLatitude(t);
        double e = eccentricityFactor(t);
        double a1 = Angles.normalize360(119.75 + 131.849 * t);
        double a2 = Angles.normalize360(53.09 + 479264.290 * t);
        double a3 = Angles.normalize360(313.45 + 481266.484 * t);

        double sumL = 0.0;
        double sumR = 0.0;
        for (int[] term : LONGITUDE_DISTANCE) {
            double arg = term[0] * d + term[1] * m + term[2] * mp + term[3] * f;
            double scale = eccentricityScale(term[1], e);
            sumL += term[4] * scale * Angles.sin(arg);
            sumR += term[5] * scale * Angles.cos(arg);
        }
        double sumB = 0.0;
        for (int[] term : LATITUDE) {
            double arg = term[0] * d + term[1] * m + term[2] * mp + term[3] * f;
            sumB += term[4] * eccentricityScale(term[1], e) * Angles.sin(arg);
        }

        // Venus, Jupiter and the flattening of the Earth
        sumL += 3958.0 * Angles.sin(a1) + 1962.0 * Angles.sin(lp - f) + 318.0 * Angles.sin(a2);
        sumB += -2235.0 * Angles.sin(lp) + 382.0 * Angles.sin(a3) + 175.0 * Angles.sin(a1 - f)
                + 175.0 * Angles.sin(a1 + f) + 127.0 * Angles.sin(lp - mp) - 115.0 * Angles.sin(lp + mp);

        double longitude = lp + sumL / 1.0e6 + Nutation.inLongitude(julianDayTt) / 3600.0;
        return new Position(Angles.normalize360(longitude), sumB / 1.0e6, MEAN_DISTANCE_KM + sumR / 1000.0);
    }

    /**
     * Equatorial horizontal parallax π = asin(a / Δ).
     *
     * @param distanceKm Earth to Moon distance in km
     * @return parallax in degrees
     */
    public static double horizontalParallax(double distanceKm) {
        return Angles.asin(Coordinates.EARTH_RADIUS_KM / distanceKm);
    }

    /**
     * Geocentric semidiameter s with sin s = k·sin π (Meeus chapter 55).
     *
     * @param distanceKm Earth to Moon distance in km
     * @return semidiameter in degrees
     */
    public static double geocentricSemidiameter(double distanceKm) {
        return Angles.asin(RADIUS_RATIO * Coordinates.EARTH_RADIUS_KM / distanceKm);
    }

    /**
     * Semidiameter as seen by the observer (Meeus 55), larger than the geocentric value when the Moon is high.
     *
     * @param distanceKm     Earth to Moon distance in km
     * @param hourAngle      geocentric hour angle in degrees
     * @param declination    geocentric declination in degrees
     * @param rhoSinPhiPrime observer term, see {@link Coordinates#rhoSinPhiPrime}
     * @param rhoCosPhiPrime observer term, see {@link Coordinates#rhoCosPhiPrime}
     * @return semidiameter in degrees
     */
    public static double topocentricSemidiameter(double distanceKm, double hourAngle, double declination,
                                                 double rhoSinPhiPrime, double rhoCosPhiPrime) {
        double sinPi = Coordinates.EARTH_RADIUS_KM / distanceKm;
        double a = Angles.cos(declination) * Angles.sin(hourAngle);
        double b = Angles.cos(declination) * Angles.cos(hourAngle) - rhoCosPhiPrime * sinPi;
        double c = Angles.sin(declination) - rhoSinPhiPrime * sinPi;
        double q = Math.sqrt(a * a + b * b + c * c);
        return Angles.asin(Angles.sin(geocentricSemidiameter(distanceKm)) / q);
    }

    // terms with M are multiplied by E, terms with 2M by E²
    private static double eccentricityScale(int sunAnomalyMultiple, double e) {
        switch (Math.abs(sunAnomalyMultiple)) {
            case 1:
                return e;
            case 2:
                return e * e;
            default:
                return 1.0;
        }
    }
}
