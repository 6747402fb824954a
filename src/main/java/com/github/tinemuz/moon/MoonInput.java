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
 * Input of {@link MoonCalculator#compute(MoonInput)}. Field order is fixed.
 */
public final class MoonInput {

    /** Instant as UTC Julian Day. */
    public final double julianDay;
    /** Degrees, west-positive. */
    public final double longitudeObserver;
    /** Degrees, north-positive. */
    public final double latitudeObserver;
    /** Metres above sea level. */
    public final double heightAboveSeaObserver;
    /** Millibar. */
    public final double pressure;
    /** °C. */
    public final double temperature;
    /** Local civil time minus UTC in hours, used only for presenting event times. */
    public final double utcOffsetHours;

    public MoonInput(double julianDay, double longitudeObserver, double latitudeObserver,
                     double heightAboveSeaObserver, double pressure, double temperature, double utcOffsetHours) {
        this.julianDay = julianDay;
        this.longitudeObserver = longitudeObserver;
        this.latitudeObserver = latitudeObserver;
        this.heightAboveSeaObserver = heightAboveSeaObserver;
        this.pressure = pressure;
        this.temperature = temperature;
        this.utcOffsetHours = utcOffsetHours;
    }

    /**
     * Input for a UTC calendar time.
     *
     * @throws InvalidDateException if the calendar fields are invalid
     */
    public static MoonInput fromCalendar(int year, int month, int day, int hour, int minute, double second,
                                         Observer observer, double utcOffsetHours) {
        double jd = TimeSystemConverter.julianDay(year, month, day, hour, minute, second);
        return new MoonInput(jd, observer.longitude, observer.latitude, observer.height, observer.pressure,
                observer.temperature, utcOffsetHours);
    }

    /**
     * @throws InvalidObserverException if the observer fields are out of range
     */
    public Observer observer() {
        return Observer.westPositive(longitudeObserver, latitudeObserver, heightAboveSeaObserver)
                .withAtmosphere(pressure, temperature);
    }
}
