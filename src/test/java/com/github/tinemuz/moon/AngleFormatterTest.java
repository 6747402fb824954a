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

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class AngleFormatterTest {

    @Nested
    @DisplayName("Degrees")
    class DegreeTests {

        @Test
        @DisplayName("Declination is formatted with three decimals")
        void formatsDeclination() {
            assertEquals("13° 46' 10.766\"", AngleFormatter.toDms(13.769657226951539, 3));
        }

        @Test
        @DisplayName("Whole seconds without decimals")
        void zeroPrecision() {
            assertEquals("10° 30' 0\"", AngleFormatter.toDms(10.5, 0));
        }

        @Test
        @DisplayName("Negative angle below one degree keeps its sign")
        void negativeBelowOneDegree() {
            assertEquals("-0° 30' 0.0\"", AngleFormatter.toDms(-0.5, 1));
        }

        @Test
        @DisplayName("Value that rounds to zero has no minus sign")
        void negativeZero() {
            assertEquals("0° 0' 0.00\"", AngleFormatter.toDms(-1e-12, 2));
        }

        @Test
        @DisplayName("Rounded 60 seconds carry into minutes and degrees")
        void carry() {
            assertEquals("60° 0' 0.00\"", AngleFormatter.toDms(59.999999999, 2));
            assertEquals("59° 59' 59.64\"", AngleFormatter.toDms(59.9999, 2));
        }

        @Test
        @DisplayName("Padding applies to minutes and whole seconds")
        void padding() {
            assertEquals("5° 03' 07.25\"", AngleFormatter.toDms(AngleFormatter.fromDms(5, 3, 7.25), 2, 2));
        }
    }

    @Nested
    @DisplayName("Hours")
    class HourTests {

        @Test
        @DisplayName("Right ascension in hours, minutes and seconds")
        void formatsRightAscension() {
            assertEquals("16h 6m 46.994s", AngleFormatter.toHms(AngleFormatter.fromHms(16, 6, 46.994), 3));
            assertEquals("16h 6m 46.994s", AngleFormatter.toHms(241.6958092513155, 3));
        }

        @Test
        @DisplayName("Full circle rounds up to 24h")
        void fullCircle() {
            assertEquals("24h 0m 0.0s", AngleFormatter.toHms(359.9999999999, 1));
        }

        @Test
        @DisplayName("fromHms is 15 times fromDms")
        void hoursToDegrees() {
            assertEquals(116.3289425, AngleFormatter.fromHms(7, 45, 18.946), 1e-6);
            assertEquals(-0.5, AngleFormatter.fromDms(0, -30, 0), 1e-12);
        }
    }

    @Nested
    @DisplayName("Invalid input")
    class InvalidInputTests {

        @Test
        void rejectsNonFinite() {
            assertThrows(IllegalArgumentException.class, () -> AngleFormatter.toDms(Double.NaN, 2));
            assertThrows(IllegalArgumentException.class, () -> AngleFormatter.toHms(Double.POSITIVE_INFINITY, 2));
        }

        @Test
        void rejectsPrecisionOutOfRange() {
            assertThrows(IllegalArgumentException.class, () -> AngleFormatter.toDms(1.0, -1));
            assertThrows(IllegalArgumentException.class, () -> AngleFormatter.toDms(1.0, 10));
        }
    }
}
