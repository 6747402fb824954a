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
 * Nutation in longitude and obliquity and the obliquity of the ecliptic.
 *
 * <p>Nutation is the 63-term series of Meeus, <i>Astronomical Algorithms</i>, chapter 22 (IAU 1980 theory truncated
 * at 0.0003"). The mean obliquity uses the polynomial of Laskar, valid to 0.01" over 1000 years around J2000.
 * All inputs are TT Julian Days, close enough to UT for the accuracy of the series.</p>
 */
public final class Nutation {

    // multiples of D, M, M', F and Ω per term
    private static final int[][] ARGUMENTS = {
        {0, 0, 0, 0, 1}, {-2, 0, 0, 2, 2}, {0, 0, 0, 2, 2}, {0, 0, 0, 0, 2},
        {0, 1, 0, 0, 0}, {0, 0, 1, 0, 0}, {-2, 1, 0, 2, 2}, {0, 0, 0, 2, 1},
        {0, 0, 1, 2, 2}, {-2, -1, 0, 2, 2}, {-2, 0, 1, 0, 0}, {-2, 0, 0, 2, 1},
        {0, 0, -1, 2, 2}, {2, 0, 0, 0, 0}, {0, 0, 1, 0, 1}, {2, 0, -1, 2, 2},
        {0, 0, -1, 0, 1}, {0, 0, 1, 2, 1}, {-2, 0, 2, 0, 0}, {0, 0, -2, 2, 1},
        {2, 0, 0, 2, 2}, {0, 0, 2, 2, 2}, {0, 0, 2, 0, 0}, {-2, 0, 1, 2, 2},
        {0, 0, 0, 2, 0}, {-2, 0, 0, 2, 0}, {0, 0, -1, 2, 1}, {0, 2, 0, 0, 0},
        {2, 0, -1, 0, 1}, {-2, 2, 0, 2, 2}, {0, 1, 0, 0, 1}, {-2, 0, 1, 0, 1},
        {0, -1, 0, 0, 1}, {0, 0, 2, -2, 0}, {2, 0, -1, 2, 1}, {2, 0, 1, 2, 2},
        {0, 1, 0, 2, 2}, {-2, 1, 1, 0, 0}, {0, -1, 0, 2, 2}, {2, 0, 0, 2, 1},
        {2, 0, 1, 0, 0}, {-2, 0, 2, 2, 2}, {-2, 0, 1, 2, 1}, {2, 0, -2, 0, 1},
        {2, 0, 0, 0, 1}, {0, -1, 1, 0, 0}, {-2, -1, 0, 2, 1}, {-2, 0, 0, 0, 1},
        {0, 0, 2, 2, 1}, {2, 0, 2, 0, 1}, {2, 1, 0, 2, 1}, {0, 0, 1, -2, 0},
        {-1, 0, 1, 0, 0}, {-2, 1, 0, 0, 0}, {1, 0, 0, 0, 0}, {0, 0, 1, 2, 0},
        {0, 0, -2, 2, 2}, {-1, -1, 1, 0, 0}, {0, 1, 1, 0, 0}, {0, -1, 1, 2, 2},
        {2, -1, -1, 2, 2}, {0, 0, 3, 2, 2}, {2, -1, 0, 2, 2},
    };

    // Δψ = (c0 + c1·T)·sin(arg), Δε = (c2 + c3·T)·cos(arg), in units of 0.0001"
    private static final double[][] COEFFICIENTS = {
        {-171996.0, -174.2, 92025.0, 8.9}, {-13187.0, -1.6, 5736.0, -3.1}, {-2274.0, -0.2, 977.0, -0.5},
        {2062.0, 0.2, -895.0, 0.5}, {1426.0, -3.4, 54.0, -0.1}, {712.0, 0.1, -7.0, 0.0},
        {-517.0, 1.2, 224.0, -0.6}, {-386.0, -0.4, 200.0, 0.0}, {-301.0, 0.0, 129.0, -0.1},
        {217.0, -0.5, -95.0, 0.3}, {-158.0, 0.0, 0.0, 0.0}, {129.0, 0.1, -70.0, 0.0},
        {123.0, 0.0, -53.0, 0.0}, {63.0, 0.0, 0.0, 0.0}, {63.0, 0.1, -33.0, 0.0},
        {-59.0, 0.0, 26.0, 0.0}, {-58.0, -0.1, 32.0, 0.0}, {-51.0, 0.0, 27.0, 0.0},
        {48.0, 0.0, 0.0, 0.0}, {46.0, 0.0, -24.0, 0.0}, {-38.0, 0.0, 16.0, 0.0},
        {-31.0, 0.0, 13.0, 0.0}, {29.0, 0.0, 0.0, 0.0}, {29.0, 0.0, -12.0, 0.0},
        {26.0, 0.0, 0.0, 0.0}, {-22.0, 0.0, 0.0, 0.0}, {21.0, 0.0, -10.0, 0.0},
        {17.0, -0.1, 0.0, 0.0}, {16.0, 0.0, -8.0, 0.0}, {-16.0, 0.1, 7.0, 0.0},
        {-15.0, 0.0, 9.0, 0.0}, {-13.0, 0.0, 7.0, 0.0}, {-12.0, 0.0, 6.0, 0.0},
        {11.0, 0.0, 0.0, 0.0}, {-10.0, 0.0, 5.0, 0.0}, {-8.0, 0.0, 3.0, 0.0},
        {7.0, 0.0, -3.0, 0.0}, {-7.0, 0.0, 0.0, 0.0}, {-7.0, 0.0, 3.0, 0.0},
        {-7.0, 0.0, 3.0, 0.0}, {6.0, 0.0, 0.0, 0.0}, {6.0, 0.0, -3.0, 0.0},
        {6.0, 0.0, -3.0, 0.0}, {-6.0, 0.0, 3.0, 0.0}, {-6.0, 0.0, 3.0, 0.0},
        {5.0, 0.0, 0.0, 0.0}, {-5.0, 0.0, 3.0, 0.0}, {-5.0, 0.0, 3.0, 0.0},
        {-5.0, 0.0, 3.0, 0.0}, {4.0, 0.0, 0.0, 0.0}, {4.0, 0.0, 0.0, 0.0},
        {4.0, 0.0, 0.0, 0.0}, {-4.0, 0.0, 0.0, 0.0}, {-4.0, 0.0, 0.0, 0.0},
        {-4.0, 0.0, 0.0, 0.0}, {3.0, 0.0, 0.0, 0.0}, {-3.0, 0.0, 0.0, 0.0},
        {-3.0, 0.0, 0.0, 0.0}, {-3.0, 0.0, 0.0, 0.0}, {-3.0, 0.0, 0.0, 0.0},
        {-3.0, 0.0, 0.0, 0.0}, {-3.0, 0.0, 0.0, 0.0}, {-3.0, 0.0, 0.0, 0.0},
    };

    // 23° 26' 21.448"
    private static final double MEAN_OBLIQUITY_J2000_ARCSEC = 84381.448;

    private Nutation() {}

    /** Nutation in longitude Δψ in arc seconds. */
    public static double inLongitude(double julianDay) {
        return series(julianDay, true);
    }

    /** Nutation in obliquity Δε in arc seconds. */
    public static double inObliquity(double julianDay) {
        return series(julianDay, false);
    }

    /** Mean obliquity of the ecliptic ε0 in degrees (Meeus 22.3). */
    public static double meanObliquity(double julianDay) {
        double u = TimeSystemConverter.julianCenturies(julianDay) / 100.0;
        double poly = -4680.93 + u * (-1.55 + u * (1999.25 + u * (-51.38 + u * (-249.67
                + u * (-39.05 + u * (7.12 + u * (27.87 + u * (5.79 + u * 2.45))))))));
        return (MEAN_OBLIQUITY_J2000_ARCSEC + u * poly) / 3600.0;
    }

    /** True obliquity ε = ε0 + Δε in degrees. */
    public static double trueObliquity(double julianDay) {
        return meanObliquity(julianDay) + inObliquity(julianDay) / 3600.0;
    }

    private static double series(double julianDay, boolean longitude) {
        double t = TimeSystemConverter.julianCenturies(julianDay);
        double t2 = t * t;
        double t3 = t2 * t;
        double d = Angles.normalize360(297.85036 + 445267.111480 * t - 0.0019142 * t2 + t3 / 189474.0);
        double m = Angles.normalize360(357.52772 + 35999.050340 * t - 0.0001603 * t2 - t3 / 300000.0);
        double mp = Angles.normalize360(134.96298 + 477198.867398 * t + 0.0086972 * t2 + t3 / 56250.0);
        double f = Angles.normalize360(93.27191 + 483202.017538 * t - 0.0036825 * t2 + t3 / 327270.0);
        double omega = Angles.normalize360(125.04452 - 1934.136261 * t + 0.0020708 * t2 + t3 / 450000.0);

        double sum = 0.0;
        for (int i = 0; i < ARGUMENTS.length; i++) {
            int[] a = ARGUMENTS[i];
            double[] c = COEFFICIENTS[i];
            double arg = Math.toRadians(a[0] * d + a[1] * m + a[2] * mp + a[3] * f + a[4] * omega);
            if (longitude) {
                sum += (c[0] + c[1] * t) * Math.sin(arg);
            } else {
                sum += (c[2] + c[3] * t) * Math.cos(arg);
            }
        }
        return sum * 0.0001;
    }
}
