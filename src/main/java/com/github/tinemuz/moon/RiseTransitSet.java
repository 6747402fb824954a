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
 * Moonrise, upper transit and moonset for one UTC day. Times are UTC; use
 * {@link DateTimeResult#withUtcOffset(double)} for local display.
 */
public final class RiseTransitSet {

    /** First moonrise of the day; invalid if the Moon does not rise. */
    public final DateTimeResult rise;
    /**
     * Upper transit. The transit is always searched, but since the Moon culminates every 24h 50m on average, about
     * one day per lunar month has no transit and this is then invalid.
     */
    public final DateTimeResult transit;
    /** First moonset of the day; invalid if the Moon does not set. */
    public final DateTimeResult set;
    /** {@link CircumpolarState#NONE} whenever the Moon rises or sets during the day. */
    public final CircumpolarState circumpolarState;
    /**
     * False if the transit search hit the iteration cap; the transit time is then the last estimate and may be
     * off by more than a second.
     */
    public final boolean converged;

    RiseTransitSet(DateTimeResult rise, DateTimeResult transit, DateTimeResult set,
                   CircumpolarState circumpolarState, boolean converged) {
        this.rise = rise;
        this.transit = transit;
        this.set = set;
        this.circumpolarState = circumpolarState;
        this.converged = converged;
    }

    @Override
    public String toString() {
        return "RiseTransitSet{rise=" + rise + ", transit=" + transit + ", set=" + set
                + ", state=" + circumpolarState + (converged ? "" : ", not converged") + "}";
    }
}
