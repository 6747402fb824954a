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

import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.function.DoubleUnaryOperator;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Moonrise, upper transit and moonset for one UTC calendar day (after Meeus chapter 15).
 *
 * <p>The transit, as a fraction m of the day, is estimated from the Moon's right ascension at 0h, improved twice
 * on positions interpolated between 0h, 12h and 24h and then iterated on full ephemeris positions until the step
 * drops below {@link #TOLERANCE_SECONDS} or {@link #MAX_ITERATIONS} is reached.</p>
 *
 * <p>Rise and set are searched on the Moon's altitude above the horizon threshold. It is sampled every half hour
 * from just before to just after the day, and each local maximum or minimum between samples is located by a
 * golden section search, so that the altitude is monotonic between neighbouring points. Every sign change is
 * then refined with the Meeus hour angle correction; if a step leaves the bracket or the Moon does not reach the
 * threshold at the current declination, the bracket is bisected instead. A day without a sign change is
 * {@link CircumpolarState#ALWAYS_UP} or {@link CircumpolarState#ALWAYS_DOWN}. If the Moon rises or sets twice on
 * one day, the first of each is reported.</p>
 *
 * <p>The horizon threshold is the geocentric altitude of the Moon's centre when its upper limb touches the
 * apparent horizon: h0 = π − s − R, with π the horizontal parallax, s the semidiameter and R the refraction at
 * the horizon for the observer's atmosphere.</p>
 *
 * <p>An event is valid only if it falls in [0h, 24h) of the day. The Moon transits every 24h 50m on average,
 * so about once a month a day has no rise, no set or no transit.</p>
 */
public final class RiseTransitSetSolver {
    private static final Logger log = LoggerFactory.getLogger(RiseTransitSetSolver.class);

    /** Upper bound on full ephemeris refinements per event. */
    public static final int MAX_ITERATIONS = 5;
    /** Refinement stops once a correction is below this many seconds. */
    public static final double TOLERANCE_SECONDS = 0.5;

    private static final int INTERPOLATED_PASSES = 2;
    // sidereal degrees per solar day
    private static final double SIDEREAL_RATE = 360.98564736629;
    private static final int SAMPLES_PER_DAY = 48;
    private static final int EXTREMUM_ITERATIONS = 25;
    private static final double GOLDEN = (Math.sqrt(5.0) - 1.0) / 2.0;

    private RiseTransitSetSolver() {}

    private enum Event {
        RISE, TRANSIT, SET
    }

    // position source for a fraction of the day
    private interface Ephemeris {
        MoonEphemeris.Geocentric at(double dayFraction);
    }

    private record Estimate(double m, boolean converged) {}

    /**
     * Events on a UTC calendar date.
     *
     * @throws InvalidDateException if the date is invalid
     */
    public static RiseTransitSet solve(int year, int month, int day, Observer observer) {
        return solve(TimeSystemConverter.julianDay(year, month, day), observer);
    }

    /**
     * Events in the 24 hours starting at the given instant, normally 0h UTC of a date.
     *
     * @param startJulianDayUtc UTC Julian Day at which the day starts
     * @param observer          where the Moon is observed from
     * @return events with UTC times
     */
    public static RiseTransitSet solve(double startJulianDayUtc, Observer observer) {
        Objects.requireNonNull(observer, "observer");
        if (!Double.isFinite(startJulianDayUtc)) {
            throw new InvalidDateException("Julian Day must be finite: " + startJulianDayUtc);
        }
        // UT1 and ΔT are taken as constant over the day
        double start = TimeSystemConverter.utcToUt1(startJulianDayUtc);
        double utcMinusUt1 = startJulianDayUtc - start;
        double deltaT = TimeSystemConverter.deltaT(startJulianDayUtc + 0.5) / TimeSystemConverter.SECONDS_PER_DAY;

        Ephemeris exact = m -> MoonEphemeris.geocentric(start + m + deltaT);
        MoonEphemeris.Geocentric[] samples = {exact.at(0.0), exact.at(0.5), exact.at(1.0)};
        Ephemeris interpolated = interpolator(samples);

        // STEP 1: transit
        double theta0 = SiderealTimeCalculator.apparentSiderealTime(start);
        double m0 = fraction((samples[0].equatorial().rightAscension() + observer.longitude - theta0) / 360.0);
        Estimate transit = search(m0, start, observer, interpolated, exact);

        // STEP 2: rise and set at the sign changes of the altitude above the threshold
        DoubleUnaryOperator height = m -> {
            MoonEphemeris.Geocentric at = exact.at(m);
            return altitude(at, observer, m, start) - threshold(at, observer);
        };
        double rise = Double.NaN;
        double set = Double.NaN;
        int crossings = 0;
        Map.Entry<Double, Double> previous = null;
        for (Map.Entry<Double, Double> point : profile(height).entrySet()) {
            if (previous != null && isUp(previous.getValue()) != isUp(point.getValue())) {
                double m = crossing(previous.getKey(), previous.getValue(), point.getKey(), point.getValue(),
                        height, start, observer, exact);
                if (m >= 0.0 && m < 1.0) {
                    crossings++;
                    if (isUp(point.getValue())) {
                        if (Double.isNaN(rise)) rise = m;
                    } else if (Double.isNaN(set)) {
                        set = m;
                    }
                }
            }
            previous = point;
        }

        // STEP 3: classify the day
        CircumpolarState state = CircumpolarState.NONE;
        if (crossings == 0) {
            state = isUp(height.applyAsDouble(0.5)) ? CircumpolarState.ALWAYS_UP : CircumpolarState.ALWAYS_DOWN;
            log.debug("Moon is {} on day starting JD {} for {}", state, startJulianDayUtc, observer);
        } else if (crossings > 2) {
            log.debug("Moon crosses the horizon {} times on day starting JD {} for {}",
                    crossings, startJulianDayUtc, observer);
        }
        if (!transit.converged()) {
            log.debug("Transit search did not converge within {} iterations on day starting JD {} for {}",
                    MAX_ITERATIONS, startJulianDayUtc, observer);
        }

        return new RiseTransitSet(
                toResult(rise, start, utcMinusUt1),
                toResult(transit.m(), start, utcMinusUt1),
                toResult(set, start, utcMinusUt1),
                state,
                transit.converged());
    }

    /**
     * Geocentric altitude of the Moon's centre at which its upper limb is on the apparent horizon.
     *
     * @param distanceKm Earth to Moon distance
     * @return degrees, about +0.08 at apogee to +0.17 at perigee
     */
    public static double horizonThreshold(double distanceKm, Observer observer) {
        double refraction = Refraction.fromApparentAltitude(0.0, observer.pressure, observer.temperature);
        return MoonTheory.horizontalParallax(distanceKm) - MoonTheory.geocentricSemidiameter(distanceKm)
                - refraction;
    }

    private static Estimate search(double initial, double start, Observer observer,
                                   Ephemeris interpolated, Ephemeris exact) {
        Estimate first = refine(initial, start, observer, interpolated, exact);
        if (inDay(first.m())) return first;
        // converged on the neighbouring day's transit; try once from the other side
        double retry = first.m() >= 1.0 ? first.m() - 1.0 : first.m() + 1.0;
        Estimate second = refine(retry, start, observer, interpolated, exact);
        return inDay(second.m()) ? second : first;
    }

    private static Estimate refine(double initial, double start, Observer observer,
                                   Ephemeris interpolated, Ephemeris exact) {
        double m = initial;
        for (int i = 0; i < INTERPOLATED_PASSES; i++) {
            m += correction(Event.TRANSIT, m, start, observer, interpolated.at(m));
        }
        for (int i = 0; i < MAX_ITERATIONS; i++) {
            double step = correction(Event.TRANSIT, m, start, observer, exact.at(m));
            m += step;
            if (Math.abs(step) * TimeSystemConverter.SECONDS_PER_DAY < TOLERANCE_SECONDS) {
                return new Estimate(m, true);
            }
        }
        return new Estimate(m, false);
    }

    /**
     * Altitude above the threshold sampled every half hour from one sample before the day to one after it, with
     * the extrema between samples added.
     */
    private static TreeMap<Double, Double> profile(DoubleUnaryOperator height) {
        double[] m = new double[SAMPLES_PER_DAY + 3];
        double[] h = new double[m.length];
        TreeMap<Double, Double> profile = new TreeMap<>();
        for (int i = 0; i < m.length; i++) {
            m[i] = (i - 1) / (double) SAMPLES_PER_DAY;
            h[i] = height.applyAsDouble(m[i]);
            profile.put(m[i], h[i]);
        }
        for (int i = 1; i < m.length - 1; i++) {
            if ((h[i] - h[i - 1]) * (h[i + 1] - h[i]) <= 0.0) {
                double e = extremum(height, m[i - 1], m[i + 1], h[i] > h[i - 1]);
                profile.put(e, height.applyAsDouble(e));
            }
        }
        return profile;
    }

    // golden section search for the maximum (or minimum) in [a, b]
    private static double extremum(DoubleUnaryOperator height, double a, double b, boolean maximum) {
        double sign = maximum ? 1.0 : -1.0;
        double lo = a;
        double hi = b;
        double c = hi - GOLDEN * (hi - lo);
        double d = lo + GOLDEN * (hi - lo);
        double hc = sign * height.applyAsDouble(c);
        double hd = sign * height.applyAsDouble(d);
        for (int i = 0; i < EXTREMUM_ITERATIONS; i++) {
            if (hc > hd) {
                hi = d;
                d = c;
                hd = hc;
                c = hi - GOLDEN * (hi - lo);
                hc = sign * height.applyAsDouble(c);
            } else {
                lo = c;
                c = d;
                hc = hd;
                d = lo + GOLDEN * (hi - lo);
                hd = sign * height.applyAsDouble(d);
            }
        }
        return (lo + hi) / 2.0;
    }

    /**
     * The crossing of the threshold in [a, b], where the altitude is monotonic and changes sign.
     */
    private static double crossing(double a, double ha, double b, double hb, DoubleUnaryOperator height,
                                   double start, Observer observer, Ephemeris exact) {
        Event event = isUp(hb) ? Event.RISE : Event.SET;
        double m = a + (b - a) * ha / (ha - hb);
        for (int i = 0; i < MAX_ITERATIONS; i++) {
            double step = correction(event, m, start, observer, exact.at(m));
            if (Double.isNaN(step) || m + step < a || m + step > b) break;
            m += step;
            if (Math.abs(step) * TimeSystemConverter.SECONDS_PER_DAY < TOLERANCE_SECONDS) return m;
        }
        // near a grazing pass the hour angle steps overshoot; bisect the bracket
        double lo = a;
        double hi = b;
        boolean loUp = isUp(ha);
        while ((hi - lo) * TimeSystemConverter.SECONDS_PER_DAY > TOLERANCE_SECONDS) {
            double mid = (lo + hi) / 2.0;
            if (isUp(height.applyAsDouble(mid)) == loUp) {
                lo = mid;
            } else {
                hi = mid;
            }
        }
        return (lo + hi) / 2.0;
    }

    /**
     * Correction to m in days, or NaN if the Moon does not reach the horizon threshold at this declination.
     */
    private static double correction(Event event, double m, double start, Observer observer,
                                     MoonEphemeris.Geocentric at) {
        double lst = SiderealTimeCalculator.localSiderealTime(start + m, observer.longitude);
        double hourAngle = Angles.normalize180(lst - at.equatorial().rightAscension());
        double target = 0.0;
        if (event != Event.TRANSIT) {
            double dec = at.equatorial().declination();
            double cosH0 = (Angles.sin(threshold(at, observer)) - Angles.sin(observer.latitude) * Angles.sin(dec))
                    / (Angles.cos(observer.latitude) * Angles.cos(dec));
            if (Math.abs(cosH0) > 1.0) return Double.NaN;
            double h0 = Math.toDegrees(Math.acos(cosH0));
            target = event == Event.RISE ? -h0 : h0;
        }
        return -Angles.normalize180(hourAngle - target) / SIDEREAL_RATE;
    }

    private static double threshold(MoonEphemeris.Geocentric at, Observer observer) {
        return horizonThreshold(at.distance(), observer);
    }

    private static double altitude(MoonEphemeris.Geocentric at, Observer observer, double m, double start) {
        double lst = SiderealTimeCalculator.localSiderealTime(start + m, observer.longitude);
        double hourAngle = SiderealTimeCalculator.hourAngle(lst, at.equatorial().rightAscension());
        return Coordinates.equatorialToHorizontal(hourAngle, at.equatorial().declination(), observer.latitude)
                .altitude();
    }

    private static boolean isUp(double heightAboveThreshold) {
        return heightAboveThreshold >= 0.0;
    }

    private static Ephemeris interpolator(MoonEphemeris.Geocentric[] s) {
        double[] ra = Interpolation.unwrap(s[0].equatorial().rightAscension(),
                s[1].equatorial().rightAscension(), s[2].equatorial().rightAscension());
        return m -> {
            double n = 2.0 * m - 1.0;
            double alpha = Interpolation.quadratic(ra[0], ra[1], ra[2], n);
            double delta = Interpolation.quadratic(s[0].equatorial().declination(),
                    s[1].equatorial().declination(), s[2].equatorial().declination(), n);
            double distance = Interpolation.quadratic(s[0].distance(), s[1].distance(), s[2].distance(), n);
            return new MoonEphemeris.Geocentric(
                    new Coordinates.Equatorial(Angles.normalize360(alpha), delta), distance);
        };
    }

    private static boolean inDay(double m) {
        return m >= 0.0 && m < 1.0;
    }

    private static DateTimeResult toResult(double m, double start, double utcMinusUt1) {
        if (!inDay(m)) return DateTimeResult.invalid();
        return DateTimeResult.fromJulianDay(start + m + utcMinusUt1);
    }

    private static double fraction(double m) {
        return m - Math.floor(m);
    }
}
