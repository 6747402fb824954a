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
 * Interpolation from three equally spaced tabular values (Meeus chapter 3).
 */
public final class Interpolation {

    private Interpolation() {}

    /**
     * Value at interpolating factor n, where n = -1, 0 and 1 give y1, y2 and y3 (Meeus 3.3).
     *
     * @param n interpolating factor, normally in [-1, 1]
     */
    public static double quadratic(double y1, double y2, double y3, double n) {
        double a = y2 - y1;
        double b = y3 - y2;
        double c = b - a;
        return y2 + n / 2.0 * (a + b + n * c);
    }

    /**
     * Makes three angles in degrees continuous so that they can be interpolated across the 0/360 wrap, e.g.
     * 359, 1, 3 becomes 359, 361, 363.
     */
    static double[] unwrap(double a1, double a2, double a3) {
        double u2 = a1 + Angles.normalize180(a2 - a1);
        double u3 = u2 + Angles.normalize180(a3 - a2);
        return new double[] {a1, u2, u3};
    }
}
