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
 * Where and under which sky an observation is made. Immutable.
 *
 * <p>The engine works with west-positive longitudes as in Meeus. Use {@link #eastPositive} for the common
 * geographic convention; it flips the sign once at construction.</p>
 */
public final class Observer {

    /** Standard pressure for refraction, millibar. */
    public static final double DEFAULT_PRESSURE = 1010.0;
    /** Standard temperature for refraction, °C. */
    public static final double DEFAULT_TEMPERATURE = 10.0;

    /** Longitude in degrees, west-positive, [-180, 180]. */
    public final double longitude;
    /** Geodetic latitude in degrees, north-positive, [-90, 90]. */
    public final double latitude;
    /** Height above sea level in metres. */
    public final double height;
    /** Atmospheric pressure in millibar. */
    public final double pressure;
    /** Air temperature in °C. */
    public final double temperature;

    private Observer(double longitude, double latitude, double height, double pressure, double temperature) {
        if (!(latitude >= -90.0 && latitude <= 90.0)) {
            throw new InvalidObserverException("Latitude must be in [-90, 90]: " + latitude);
        }
        if (!(longitude >= -180.0 && longitude <= 180.0)) {
            throw new InvalidObserverException("Longitude must be in [-180, 180]: " + longitude);
        }
        if (!Double.isFinite(height)) {
            throw new InvalidObserverException("Height must be finite: " + height);
        }
        if (!(pressure > 0.0) || !Double.isFinite(pressure)) {
            throw new InvalidObserverException("Pressure must be positive: " + pressure);
        }
        if (!(temperature > -273.15) || !Double.isFinite(temperature)) {
            throw new InvalidObserverException("Temperature must be above absolute zero: " + temperature);
        }
        this.longitude = longitude;
        this.latitude = latitude;
        this.height = height;
        this.pressure = pressure;
        this.temperature = temperature;
    }

    /**
     * @param longitudeWest degrees, positive west of Greenwich
     * @param latitude      degrees, positive north
     * @param heightMeter   metres above sea level
     * @throws InvalidObserverException if a coordinate is out of range
     */
    public static Observer westPositive(double longitudeWest, double latitude, double heightMeter) {
        return new Observer(longitudeWest, latitude, heightMeter, DEFAULT_PRESSURE, DEFAULT_TEMPERATURE);
    }

    /**
     * @param longitudeEast degrees, positive east of Greenwich
     * @param latitude      degrees, positive north
     * @param heightMeter   metres above sea level
     * @throws InvalidObserverException if a coordinate is out of range
     */
    public static Observer eastPositive(double longitudeEast, double latitude, double heightMeter) {
        return westPositive(-longitudeEast, latitude, heightMeter);
    }

    /**
     * Copy of this observer with the given atmosphere.
     *
     * @throws InvalidObserverException for non-positive pressure or a temperature below absolute zero
     */
    public Observer withAtmosphere(double pressureMbar, double temperatureCelsius) {
        return new Observer(longitude, latitude, height, pressureMbar, temperatureCelsius);
    }

    public double rhoSinPhiPrime() {
        return Coordinates.rhoSinPhiPrime(latitude, height);
    }

    public double rhoCosPhiPrime() {
        return Coordinates.rhoCosPhiPrime(latitude, height);
    }

    @Override
    public String toString() {
        return "Observer{lonW=" + longitude + ", lat=" + latitude + ", h=" + height + "m, P=" + pressure
                + "mbar, T=" + temperature + "°C}";
    }
}
