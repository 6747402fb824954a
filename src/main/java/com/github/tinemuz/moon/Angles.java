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
 * Angle normalisation and degree-based trigonometry shared by the calculators.
 */
final class Angles {

    private Angles() {
    }

    /** Reduces an angle to [0, 360). */
    static double normalize360(double degrees) {
        double r = degrees % 360.0;
        if (r < 0.0) {
            r += 360.0;
        }
        return r >= 360.0 ? 0.0 : r;
    }

    /** Reduces an angle to (-180, 180]. */
    static double normalize180(double degrees) {
        double r = normalize360(degrees);
        return r > 180.0 ? r - 360.0 : r;
    }

    static double sin(double degrees) {
        return Math.sin(Math.toRadians(degrees));
    }

    static double cos(double degrees) {
        return Math.cos(Math.toRadians(degrees));
    }

    static double tan(double degrees) {
        return Math.tan(Math.toRadians(degrees));
    }

    static double asin(double value) {
        return Math.toDegrees(Math.asin(clamp(value)));
    }

    static double atan2(double y, double x) {
        return Math.toDegrees(Math.atan2(y, x));
    }

    /** Keeps an argument of asin/acos inside [-1, 1] against rounding. */
    static double clamp(double value) {
        return Math.max(-1.0, Math.min(1.0, value));
    }
}
