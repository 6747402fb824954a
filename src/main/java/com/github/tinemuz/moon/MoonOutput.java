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
 * Everything computed for the Moon at one instant and place. All angles are degrees.
 *
 * <p>Fields are declared in a fixed order that callers reading the object field by field may rely on. The rise,
 * transit and set fields are {@code null} unless the events were requested, see {@link MoonCalculator}.</p>
 */
public final class MoonOutput {

    /** Apparent longitude of the Moon minus that of the Sun, [0, 360); 0 at new moon, 180 at full moon. */
    public final double phaseAngle;

    /** Sun-Moon-Earth angle i, [0, 180]; 0 at full moon. */
    public final double illuminationAngle;

    /** Days since new moon, [0, synodic month). */
    public final double phaseAge;

    /** Illuminated fraction of the disk (1 + cos i) / 2, [0, 1]. */
    public final double illuminatedFraction;

    /** Display name of {@link #phase}, e.g. "Full Moon". */
    public final String phaseName;

    public final MoonPhase phase;

    /** Apparent geocentric ecliptic longitude. */
    public final double geocentricLongitude;

    /** Geocentric ecliptic latitude. */
    public final double geocentricLatitude;

    /** Distance between the centres of Earth and Moon in km. */
    public final double distanceFromEarth;

    /** Topocentric hour angle, [0, 360), west of the meridian. */
    public final double hourAngle;

    /** Topocentric right ascension, [0, 360). */
    public final double rightAscension;

    /** Topocentric declination. */
    public final double declination;

    /** Azimuth from North through East, [0, 360). */
    public final double azimuth;

    /** Topocentric altitude including refraction. */
    public final double altitude;

    public final DateTimeResult rise;
    public final DateTimeResult transit;
    public final DateTimeResult set;
    public final CircumpolarState circumpolarState;

    /** Civil offset to apply to the UTC event times for display. */
    public final double utcOffsetHours;

    MoonOutput(double phaseAngle, double illuminationAngle, double phaseAge, double illuminatedFraction,
               MoonPhase phase, double geocentricLongitude, double geocentricLatitude, double distanceFromEarth,
               double hourAngle, double rightAscension, double declination, double azimuth, double altitude,
               RiseTransitSet events, double utcOffsetHours) {
        this.phaseAngle = phaseAngle;
        this.illuminationAngle = illuminationAngle;
        this.phaseAge = phaseAge;
        this.illuminatedFraction = illuminatedFraction;
        this.phaseName = phase.label();
        this.phase = phase;
        this.geocentricLongitude = geocentricLongitude;
        this.geocentricLatitude = geocentricLatitude;
        this.distanceFromEarth = distanceFromEarth;
        this.hourAngle = hourAngle;
        this.rightAscension = rightAscension;
        this.declination = declination;
        this.azimuth = azimuth;
        this.altitude = altitude;
        this.rise = events == null ? null : events.rise;
        this.transit = events == null ? null : events.transit;
        this.set = events == null ? null : events.set;
        this.circumpolarState = events == null ? null : events.circumpolarState;
        this.utcOffsetHours = utcOffsetHours;
    }

    /** Copy of this output with rise, transit and set attached. */
    MoonOutput withEvents(RiseTransitSet events, double utcOffsetHours) {
        return new MoonOutput(phaseAngle, illuminationAngle, phaseAge, illuminatedFraction, phase,
                geocentricLongitude, geocentricLatitude, distanceFromEarth, hourAngle, rightAscension, declination,
                azimuth, altitude, events, utcOffsetHours);
    }

    /** Rise time in the civil zone given by {@link #utcOffsetHours}, or null if events were not computed. */
    public DateTimeResult localRise() {
        return rise == null ? null : rise.withUtcOffset(utcOffsetHours);
    }

    public DateTimeResult localTransit() {
        return transit == null ? null : transit.withUtcOffset(utcOffsetHours);
    }

    public DateTimeResult localSet() {
        return set == null ? null : set.withUtcOffset(utcOffsetHours);
    }
}
