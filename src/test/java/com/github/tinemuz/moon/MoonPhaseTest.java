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
import org.junit.jupiter.api.Test;

class MoonPhaseTest {

    @Test
    @DisplayName("Each phase is centred on a multiple of 45°")
    void centres() {
        MoonPhase[] phases = MoonPhase.values();
        for (int i = 0; i < phases.length; i++) {
            assertEquals(phases[i], MoonPhase.fromPhaseAngle(i * 45.0));
        }
    }

    @Test
    @DisplayName("A boundary belongs to the later phase")
    void boundaries() {
        assertEquals(MoonPhase.WAXING_CRESCENT, MoonPhase.fromPhaseAngle(22.5));
        assertEquals(MoonPhase.NEW_MOON, MoonPhase.fromPhaseAngle(22.4999));
        assertEquals(MoonPhase.NEW_MOON, MoonPhase.fromPhaseAngle(337.5));
        assertEquals(MoonPhase.WANING_CRESCENT, MoonPhase.fromPhaseAngle(337.4999));
        assertEquals(MoonPhase.FULL_MOON, MoonPhase.fromPhaseAngle(157.5));
    }

    @Test
    @DisplayName("Angles outside [0, 360) are wrapped")
    void wrapping() {
        assertEquals(MoonPhase.NEW_MOON, MoonPhase.fromPhaseAngle(-10.0));
        assertEquals(MoonPhase.FIRST_QUARTER, MoonPhase.fromPhaseAngle(450.0));
    }

    @Test
    void fromAge() {
        assertEquals(MoonPhase.NEW_MOON, MoonPhase.fromAge(0.0));
        assertEquals(MoonPhase.FULL_MOON, MoonPhase.fromAge(MoonPhase.SYNODIC_MONTH_DAYS / 2.0));
        assertEquals(MoonPhase.LAST_QUARTER, MoonPhase.fromAge(22.0));
        assertEquals(MoonPhase.WANING_CRESCENT, MoonPhase.fromAge(24.37));
    }

    @Test
    void labels() {
        assertEquals("Waxing Gibbous", MoonPhase.WAXING_GIBBOUS.label());
        assertEquals("Full Moon", MoonPhase.FULL_MOON.toString());
    }
}
