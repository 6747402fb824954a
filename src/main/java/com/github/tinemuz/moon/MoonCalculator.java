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

import java.util.Objects;

/**
 * Single entry point for callers that hold a UTC instant: converts it to TT and UT1, computes the Moon's position
 * and phase, and solves rise, transit and set for the UTC date containing the instant.
 *
 * <p>Stateless and safe to call from any thread. A periodic display simply calls {@link #compute} once per tick.</p>
 */
public final class MoonCalculator {

    private MoonCalculator() {}

    /**
     * @param input instant, observer and display offset
     * @return position, phase and the day's events; event times are UTC, see {@link MoonOutput#localRise()}
     * @throws InvalidDateException     if the Julian Day is not finite or negative
     * @throws InvalidObserverException if the observer fields are out of range
     */
    public static MoonOutput compute(MoonInput input) {
        Objects.requireNonNull(input, "input");
        Observer observer = input.observer();
        double jdUtc = input.julianDay;
        if (!Double.isFinite(jdUtc) || jdUtc < 0.0) {
            throw new InvalidDateException("Julian Day must be finite and non-negative: " + jdUtc);
        }
        if (!Double.isFinite(input.utcOffsetHours) || Math.abs(input.utcOffsetHours) > 14.0) {
            throw new InvalidDateException("UTC offset must be within ±14 h: " + input.utcOffsetHours);
        }

        double jdTt = TimeSystemConverter.utcToTt(jdUtc);
        double jdUt1 = TimeSystemConverter.utcToUt1(jdUtc);
        MoonOutput position = MoonEphemeris.compute(jdTt, jdUt1, observer);

        double midnight = Math.floor(jdUtc - 0.5) + 0.5;
        RiseTransitSet events = RiseTransitSetSolver.solve(midnight, observer);
        return position.withEvents(events, input.utcOffsetHours);
    }
}
