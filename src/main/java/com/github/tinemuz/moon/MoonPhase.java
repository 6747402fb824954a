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
 * The eight named phases of the Moon. Each covers 45° of the synodic cycle centred on a multiple of 45°, so New
 * Moon spans [337.5°, 22.5°). A phase angle on a boundary belongs to the later phase.
 */
public enum MoonPhase {
    NEW_MOON("New Moon"),
    WAXING_CRESCENT("Waxing Crescent"),
    FIRST_QUARTER("First Quarter"),
    WAXING_GIBBOUS("Waxing Gibbous"),
    FULL_MOON("Full Moon"),
    WANING_GIBBOUS("Waning Gibbous"),
    LAST_QUARTER("Last Quarter"),
    WANING_CRESCENT("Waning Crescent");

    /** Mean length of the synodic month in days. */
    public static final double SYNODIC_MONTH_DAYS = 29.530588853;

    private static final double SECTION = 360.0 / 8;

    private final String label;

    MoonPhase(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    /**
     * @param phaseAngle Moon minus Sun apparent longitude in degrees, any value
     */
    public static MoonPhase fromPhaseAngle(double phaseAngle) {
        int index = (int) Math.floor(Angles.normalize360(phaseAngle + SECTION / 2) / SECTION);
        return values()[index % 8];
    }

    /**
     * @param ageDays days since new moon, wrapped into one synodic month
     */
    public static MoonPhase fromAge(double ageDays) {
        return fromPhaseAngle(ageDays / SYNODIC_MONTH_DAYS * 360.0);
    }

    @Override
    public String toString() {
        return label;
    }
}
