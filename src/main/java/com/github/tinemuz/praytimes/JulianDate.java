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
package com.github.tinemuz.praytimes;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;

/**
 * Conversion from calendar instants to the fractional Julian day used as the
 * calculation epoch.
 *
 * <p>The returned value is shifted by {@code longitude / 360} days so that the
 * day fractions added by the solvers approximate local solar time at the
 * observer rather than at Greenwich.</p>
 */
public final class JulianDate {
    /** Julian day of 1970-01-01T00:00:00Z. */
    public static final double J1970 = 2440587.5;
    /** Julian day of the J2000.0 epoch (2000-01-01T12:00:00 TT). */
    public static final double J2000 = 2451545.0;
    private static final double MS_PER_DAY = 86_400_000.0;

    private JulianDate() {}

    /**
     * Julian day for a UTC instant, corrected for the observer's longitude.
     *
     * @param epochMillis    UTC time as epoch milliseconds
     * @param longitudeDeg   geographic longitude (degrees, east positive)
     * @return fractional Julian day
     */
    public static double fromEpochMillis(long epochMillis, double longitudeDeg) {
        double jd = J1970 + epochMillis / MS_PER_DAY;
        return jd - longitudeDeg / 360.0;
    }

    public static double fromInstant(Instant instant, double longitudeDeg) {
        return fromEpochMillis(instant.toEpochMilli(), longitudeDeg);
    }

    /**
     * Julian day at 00:00 UTC of a Gregorian calendar date, corrected for the
     * observer's longitude.
     */
    public static double fromCalendarDate(LocalDate date, double longitudeDeg) {
        return fromInstant(date.atStartOfDay(ZoneOffset.UTC).toInstant(), longitudeDeg);
    }
}
