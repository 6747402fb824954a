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
 * Position and phase of the Moon for an observer.
 *
 * <p>The pipeline is: geocentric ecliptic position ({@link MoonTheory}) and Sun ({@link SunPosition}), phase from
 * their elongation, rotation to equatorial coordinates with the true obliquity, topocentric correction for
 * parallax, horizontal coordinates from the apparent local sidereal time, and finally refraction of the altitude.</p>
 *
 * <p>The series run on terrestrial time while sidereal time needs universal time. {@link #compute(double, Observer)}
 * uses one Julian Day for both, which is off by ΔT (about a minute) in the hour angle. Use
 * {@link #compute(double, double, Observer)} or {@link MoonCalculator} when that matters.</p>
 */
public final class MoonEphemeris {

    private MoonEphemeris() {}

    /**
     * Geocentric apparent coordinates of the Moon as needed by the event search.
     *
     * @param equatorial right ascension and declination
     * @param distance   km
     */
    record Geocentric(Coordinates.Equatorial equatorial, double distance) {}

    /**
     * @param julianDay instant used both as TT and as UT
     * @param observer  where the Moon is observed from
     */
    public static MoonOutput compute(double julianDay, Observer observer) {
        return compute(julianDay, julianDay, observer);
    }

    /**
     * @param julianDayTt instant in terrestrial time, for the series
     * @param julianDayUt the same instant in universal time (UT1), for sidereal time
     * @param observer    where the Moon is observed from
     * @throws InvalidDateException if a Julian Day is not finite
     */
    public static MoonOutput compute(double julianDayTt, double julianDayUt, Observer observer) {
        Objects.requireNonNull(observer, "observer");
        requireFinite(julianDayTt);
        requireFinite(julianDayUt);

        MoonTheory.Position moon = MoonTheory.position(julianDayTt);
        SunPosition sun = SunPosition.compute(julianDayTt);
        double obliquity = Nutation.trueObliquity(julianDayTt);
        Coordinates.Equatorial geo =
                Coordinates.eclipticToEquatorial(moon.longitude(), moon.latitude(), obliquity);

        // STEP 1: phase
        double phaseAngle = Angles.normalize360(moon.longitude() - sun.longitude);
        double i = illuminationAngle(sun, geo, moon.distance());
        double fraction = (1.0 + Angles.cos(i)) / 2.0;
        double age = phaseAngle / 360.0 * MoonPhase.SYNODIC_MONTH_DAYS;

        // STEP 2: topocentric equatorial coordinates
        double lst = SiderealTimeCalculator.localSiderealTime(julianDayUt, observer.longitude);
        double geoHourAngle = SiderealTimeCalculator.hourAngle(lst, geo.rightAscension());
        double sinParallax = Coordinates.EARTH_RADIUS_KM / moon.distance();
        Coordinates.Equatorial topo = Coordinates.topocentric(
                geo, geoHourAngle, sinParallax, observer.rhoSinPhiPrime(), observer.rhoCosPhiPrime());

        // STEP 3: horizontal coordinates and refraction
        double hourAngle = SiderealTimeCalculator.hourAngle(lst, topo.rightAscension());
        Coordinates.Horizontal horizontal =
                Coordinates.equatorialToHorizontal(hourAngle, topo.declination(), observer.latitude);
        double altitude = horizontal.altitude()
                + Refraction.fromTrueAltitude(horizontal.altitude(), observer.pressure, observer.temperature);

        return new MoonOutput(phaseAngle, i, age, fraction, MoonPhase.fromPhaseAngle(phaseAngle),
                moon.longitude(), moon.latitude(), moon.distance(), hourAngle, topo.rightAscension(),
                topo.declination(), horizontal.azimuth(), altitude, null, 0.0);
    }

    /**
     * Illuminated fraction of the Moon's disk at an instant (Meeus 48.1 to 48.3).
     *
     * @param julianDayTt instant in terrestrial time
     * @return fraction in [0, 1]
     */
    public static double illuminatedFraction(double julianDayTt) {
        MoonTheory.Position moon = MoonTheory.position(julianDayTt);
        SunPosition sun = SunPosition.compute(julianDayTt);
        Coordinates.Equatorial geo = Coordinates.eclipticToEquatorial(
                moon.longitude(), moon.latitude(), Nutation.trueObliquity(julianDayTt));
        return (1.0 + Angles.cos(illuminationAngle(sun, geo, moon.distance()))) / 2.0;
    }

    /**
     * Moon minus Sun apparent longitude in degrees [0, 360).
     */
    public static double phaseAngle(double julianDayTt) {
        return Angles.normalize360(MoonTheory.position(julianDayTt).longitude()
                - SunPosition.compute(julianDayTt).longitude);
    }

    /** Days since the last new moon, derived from {@link #phaseAngle}. */
    public static double phaseAge(double julianDayTt) {
        return phaseAngle(julianDayTt) / 360.0 * MoonPhase.SYNODIC_MONTH_DAYS;
    }

    public static MoonPhase phase(double julianDayTt) {
        return MoonPhase.fromPhaseAngle(phaseAngle(julianDayTt));
    }

    static Geocentric geocentric(double julianDayTt) {
        MoonTheory.Position moon = MoonTheory.position(julianDayTt);
        Coordinates.Equatorial eq = Coordinates.eclipticToEquatorial(
                moon.longitude(), moon.latitude(), Nutation.trueObliquity(julianDayTt));
        return new Geocentric(eq, moon.distance());
    }

    /**
     * Phase angle i of Meeus 48.3 from the geocentric elongation ψ of the Moon from the Sun (48.2).
     */
    static double illuminationAngle(SunPosition sun, Coordinates.Equatorial moon, double moonDistanceKm) {
        double cosPsi = Angles.sin(sun.declination) * Angles.sin(moon.declination())
                + Angles.cos(sun.declination) * Angles.cos(moon.declination())
                * Angles.cos(sun.rightAscension - moon.rightAscension());
        double psi = Math.acos(Angles.clamp(cosPsi));
        double sunKm = sun.distanceAu * SunPosition.AU_KM;
        return Math.toDegrees(Math.atan2(sunKm * Math.sin(psi), moonDistanceKm - sunKm * Math.cos(psi)));
    }

    private static void requireFinite(double julianDay) {
        if (!Double.isFinite(julianDay)) {
            throw new InvalidDateException("Julian Day must be finite: " + julianDay);
        }
    }
}
