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

class RiseTransitSetSolverTest {

    private static final double EVENT_TOLERANCE = 0.001; // days, about 1.5 minutes

    // 11.6° east of Greenwich
    private static final Observer MUNICH = Observer.westPositive(-11.6, 48.1, 0.0).withAtmosphere(1013.0, 10.0);
    private static final Observer LONDON = Observer.westPositive(
            AngleFormatter.fromDms(0, 6, 3.2), AngleFormatter.fromDms(51, 31, 54.8), 0.0)
            .withAtmosphere(1013.0, 10.0);

    @Nested
    @DisplayName("Reference events")
    class ReferenceTests {

        private final RiseTransitSet munich = RiseTransitSetSolver.solve(2000, 3, 23, MUNICH);

        @Test
        @DisplayName("Moonrise in Munich on 2000-03-23")
        void rise() {
            assertTrue(munich.rise.valid);
            assertEquals(TimeSystemConverter.julianDay(2000, 3, 23, 21, 12, 13), munich.rise.julianDay,
                    EVENT_TOLERANCE);
        }

        @Test
        @DisplayName("Moon transit in Munich on 2000-03-23")
        void transit() {
            assertTrue(munich.transit.valid);
            assertEquals(TimeSystemConverter.julianDay(2000, 3, 23, 1, 38, 1), munich.transit.julianDay,
                    EVENT_TOLERANCE);
        }

        @Test
        @DisplayName("Moonset in Munich on 2000-03-23")
        void set() {
            assertTrue(munich.set.valid);
            assertEquals(TimeSystemConverter.julianDay(2000, 3, 23, 7, 1, 3), munich.set.julianDay,
                    EVENT_TOLERANCE);
        }

        @Test
        void convergesAndIsNotCircumpolar() {
            assertTrue(munich.converged);
            assertEquals(CircumpolarState.NONE, munich.circumpolarState);
            assertEquals(2000, munich.rise.year);
            assertEquals(3, munich.rise.month);
            assertEquals(23, munich.rise.day);
            assertEquals(21, munich.rise.hour);
        }

        @Test
        @DisplayName("Moon does not rise in London on 2000-03-25")
        void noRise() {
            RiseTransitSet events = RiseTransitSetSolver.solve(2000, 3, 25, LONDON);
            assertFalse(events.rise.valid);
            assertTrue(events.set.valid);
            assertTrue(events.transit.valid);
            assertEquals(CircumpolarState.NONE, events.circumpolarState);
        }

        @Test
        @DisplayName("Moon does not transit in Munich on 2024-01-26")
        void noTransit() {
            RiseTransitSet before = RiseTransitSetSolver.solve(2024, 1, 25, MUNICH);
            RiseTransitSet events = RiseTransitSetSolver.solve(2024, 1, 26, MUNICH);
            RiseTransitSet after = RiseTransitSetSolver.solve(2024, 1, 27, MUNICH);
            assertFalse(events.transit.valid);
            assertTrue(events.rise.valid);
            assertTrue(events.set.valid);
            assertTrue(events.converged);
            assertEquals(23, before.transit.hour);
            assertEquals(0, after.transit.hour);
        }

        @Test
        @DisplayName("Moon does not set in London on 2000-04-09")
        void noSet() {
            RiseTransitSet events = RiseTransitSetSolver.solve(2000, 4, 9, LONDON);
            assertTrue(events.rise.valid);
            assertFalse(events.set.valid);
            assertEquals(CircumpolarState.NONE, events.circumpolarState);
        }
    }

    @Nested
    @DisplayName("Properties over a month")
    class PropertyTests {

        @Test
        @DisplayName("Valid events fall inside their day and at most one is missing")
        void eventsInsideDay() {
            double start = TimeSystemConverter.julianDay(2024, 1, 1.0);
            for (int k = 0; k < 30; k++) {
                RiseTransitSet events = RiseTransitSetSolver.solve(start + k, MUNICH);
                int missing = 0;
                for (DateTimeResult e : new DateTimeResult[] {events.rise, events.transit, events.set}) {
                    if (!e.valid) {
                        missing++;
                        assertTrue(Double.isNaN(e.julianDay));
                        continue;
                    }
                    assertTrue(e.julianDay >= start + k && e.julianDay < start + k + 1.0,
                            "event outside day " + k + ": " + events);
                }
                assertTrue(missing <= 1, "day " + k + ": " + events);
                assertEquals(CircumpolarState.NONE, events.circumpolarState);
            }
        }

        @Test
        @DisplayName("At transit the Moon is on the meridian")
        void transitOnMeridian() {
            double start = TimeSystemConverter.julianDay(2024, 1, 1.0);
            for (int k = 0; k < 30; k += 3) {
                RiseTransitSet events = RiseTransitSetSolver.solve(start + k, MUNICH);
                if (!events.transit.valid) continue;
                double utc = events.transit.julianDay;
                MoonOutput at = MoonEphemeris.compute(
                        TimeSystemConverter.utcToTt(utc), TimeSystemConverter.utcToUt1(utc), MUNICH);
                assertEquals(0.0, Angles.normalize180(at.hourAngle), 0.01, "day " + k);
            }
        }

        @Test
        @DisplayName("Near the pole the Moon stays up or down for days")
        void circumpolar() {
            Observer arctic = Observer.westPositive(-10.0, 85.0, 0.0);
            double start = TimeSystemConverter.julianDay(2024, 1, 1.0);
            int up = 0;
            int down = 0;
            for (int k = 0; k < 30; k++) {
                RiseTransitSet events = RiseTransitSetSolver.solve(start + k, arctic);
                if (events.circumpolarState == CircumpolarState.NONE) continue;
                if (events.circumpolarState == CircumpolarState.ALWAYS_UP) up++;
                else down++;
                assertFalse(events.rise.valid, "rise on circumpolar day " + k);
                assertFalse(events.set.valid, "set on circumpolar day " + k);
            }
            assertTrue(up > 0, "never always up");
            assertTrue(down > 0, "never always down");
        }
    }

    @Nested
    @DisplayName("High latitudes")
    class HighLatitudeTests {

        private static final double LONGITUDE = -10.0;
        private static final int SCAN_STEPS = 720; // every 2 minutes
        private static final double SCAN_TOLERANCE = 3.0 / 1440.0; // days
        private static final double[] LATITUDES = {65.0, 68.0, 72.0};

        @Test
        @DisplayName("Short pass above the horizon at 72°N on 2024-03-01")
        void shortPass() {
            Observer observer = Observer.westPositive(LONGITUDE, 72.0, 0.0);
            RiseTransitSet events = RiseTransitSetSolver.solve(2024, 3, 1, observer);
            assertEquals(CircumpolarState.NONE, events.circumpolarState);
            assertTrue(events.rise.valid, events.toString());
            assertTrue(events.set.valid, events.toString());
            assertEquals(TimeSystemConverter.julianDay(2024, 3, 1, 2, 26, 37), events.rise.julianDay, EVENT_TOLERANCE);
            assertEquals(TimeSystemConverter.julianDay(2024, 3, 1, 3, 47, 59), events.set.julianDay, EVENT_TOLERANCE);
        }

        @Test
        @DisplayName("Short dip below the horizon at 68°N on 2024-02-16")
        void shortDip() {
            Observer observer = Observer.westPositive(LONGITUDE, 68.0, 0.0);
            RiseTransitSet events = RiseTransitSetSolver.solve(2024, 2, 16, observer);
            assertEquals(CircumpolarState.NONE, events.circumpolarState);
            assertEquals(TimeSystemConverter.julianDay(2024, 2, 16, 3, 23, 3), events.set.julianDay, EVENT_TOLERANCE);
            assertEquals(TimeSystemConverter.julianDay(2024, 2, 16, 6, 1, 35), events.rise.julianDay, EVENT_TOLERANCE);
        }

        @Test
        @DisplayName("Events and circumpolar days agree with an altitude scan over 2024")
        void agreesWithScan() {
            Observer[] observers = new Observer[LATITUDES.length];
            for (int i = 0; i < observers.length; i++) {
                observers[i] = Observer.westPositive(LONGITUDE, LATITUDES[i], 0.0);
            }
            double first = TimeSystemConverter.julianDay(2024, 1, 1.0);
            for (int k = 0; k < 366; k++) {
                double day = first + k;
                double[][] heights = scan(day, observers);
                for (int i = 0; i < observers.length; i++) {
                    String where = LATITUDES[i] + "°N, day " + k;
                    RiseTransitSet events = RiseTransitSetSolver.solve(day, observers[i]);
                    assertConsistent(day, observers[i], heights[i], events, where);
                }
            }
        }

        // altitude above the threshold every 2 minutes, with the same time scales as the solver
        private double[][] scan(double day, Observer[] observers) {
            double start = TimeSystemConverter.utcToUt1(day);
            double deltaT = TimeSystemConverter.deltaT(day + 0.5) / TimeSystemConverter.SECONDS_PER_DAY;
            double[][] heights = new double[observers.length][SCAN_STEPS + 1];
            for (int step = 0; step <= SCAN_STEPS; step++) {
                double m = step / (double) SCAN_STEPS;
                MoonEphemeris.Geocentric moon = MoonEphemeris.geocentric(start + m + deltaT);
                double lst = SiderealTimeCalculator.localSiderealTime(start + m, LONGITUDE);
                double hourAngle = SiderealTimeCalculator.hourAngle(lst, moon.equatorial().rightAscension());
                for (int i = 0; i < observers.length; i++) {
                    double altitude = Coordinates.equatorialToHorizontal(
                            hourAngle, moon.equatorial().declination(), observers[i].latitude).altitude();
                    heights[i][step] =
                            altitude - RiseTransitSetSolver.horizonThreshold(moon.distance(), observers[i]);
                }
            }
            return heights;
        }

        private double heightAt(double utc, double day, Observer observer) {
            double start = TimeSystemConverter.utcToUt1(day);
            double m = utc - day;
            double deltaT = TimeSystemConverter.deltaT(day + 0.5) / TimeSystemConverter.SECONDS_PER_DAY;
            MoonEphemeris.Geocentric moon = MoonEphemeris.geocentric(start + m + deltaT);
            double lst = SiderealTimeCalculator.localSiderealTime(start + m, observer.longitude);
            double hourAngle = SiderealTimeCalculator.hourAngle(lst, moon.equatorial().rightAscension());
            return Coordinates.equatorialToHorizontal(hourAngle, moon.equatorial().declination(), observer.latitude)
                    .altitude() - RiseTransitSetSolver.horizonThreshold(moon.distance(), observer);
        }

        private void assertConsistent(double day, Observer observer, double[] heights, RiseTransitSet events,
                                      String where) {
            boolean scannedRise = false;
            boolean scannedSet = false;
            boolean riseMatched = false;
            boolean setMatched = false;
            double max = heights[0];
            double min = heights[0];
            for (int step = 1; step < heights.length; step++) {
                max = Math.max(max, heights[step]);
                min = Math.min(min, heights[step]);
                boolean wasUp = heights[step - 1] >= 0.0;
                boolean isUp = heights[step] >= 0.0;
                if (wasUp == isUp) continue;
                double m = step / (double) SCAN_STEPS;
                DateTimeResult event = isUp ? events.rise : events.set;
                boolean matched = event.valid && Math.abs(event.julianDay - day - m) <= SCAN_TOLERANCE;
                if (isUp) {
                    scannedRise = true;
                    riseMatched |= matched;
                } else {
                    scannedSet = true;
                    setMatched |= matched;
                }
            }
            String message = where + ": " + events;
            if (scannedRise) assertTrue(riseMatched, "rise missed, " + message);
            if (scannedSet) assertTrue(setMatched, "set missed, " + message);
            // a crossing between two scan samples is only possible for a grazing pass
            if (events.rise.valid && !scannedRise) {
                assertEquals(0.0, heightAt(events.rise.julianDay, day, observer), 0.01, message);
            }
            if (events.set.valid && !scannedSet) {
                assertEquals(0.0, heightAt(events.set.julianDay, day, observer), 0.01, message);
            }
            switch (events.circumpolarState) {
                case ALWAYS_UP:
                    assertTrue(min >= 0.0, "below the horizon on an always-up day, " + message);
                    break;
                case ALWAYS_DOWN:
                    assertTrue(max < 0.0, "above the horizon on an always-down day, " + message);
                    break;
                default:
                    assertTrue(events.rise.valid || events.set.valid, message);
            }
            if (events.circumpolarState != CircumpolarState.NONE) {
                assertFalse(events.rise.valid, message);
                assertFalse(events.set.valid, message);
            }
        }
    }

    @Nested
    @DisplayName("Horizon threshold")
    class ThresholdTests {

        @Test
        @DisplayName("Parallax minus semidiameter minus refraction at mean distance")
        void meanDistance() {
            Observer observer = Observer.westPositive(0.0, 0.0, 0.0);
            assertEquals(0.1171, RiseTransitSetSolver.horizonThreshold(384400.0, observer), 1e-3);
        }

        @Test
        @DisplayName("Closer Moon has a higher threshold")
        void perigeeAboveApogee() {
            Observer observer = Observer.westPositive(0.0, 0.0, 0.0);
            assertTrue(RiseTransitSetSolver.horizonThreshold(356500.0, observer)
                    > RiseTransitSetSolver.horizonThreshold(406700.0, observer));
        }
    }

    @Test
    void rejectsInvalidInput() {
        assertThrows(InvalidDateException.class, () -> RiseTransitSetSolver.solve(Double.NaN, MUNICH));
        assertThrows(InvalidDateException.class, () -> RiseTransitSetSolver.solve(2023, 2, 30, MUNICH));
        assertThrows(NullPointerException.class, () -> RiseTransitSetSolver.solve(2451544.5, null));
    }
}
