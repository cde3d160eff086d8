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

/**
 * Low-order solar position model.
 *
 * <p>Evaluates the sun's declination and the equation of time for a Julian
 * day using the mean anomaly / mean longitude approximation (accurate to
 * roughly a minute of time between 1950 and 2050). Instances are immutable
 * results of {@link #compute(double)}.</p>
 */
public final class SunPosition {

    /** Solar declination in degrees, north positive. */
    public final double declinationDeg;

    /** Equation of time in hours (apparent minus mean solar time). */
    public final double equationOfTimeHours;

    private SunPosition(double declinationDeg, double equationOfTimeHours) {
        this.declinationDeg = declinationDeg;
        this.equationOfTimeHours = equationOfTimeHours;
    }

    /**
     * Evaluate the solar position for a fractional Julian day.
     *
     * @param julianDate fractional Julian day
     * @return declination and equation of time; finite for finite input
     */
    public static SunPosition compute(double julianDate) {
        double d = julianDate - JulianDate.J2000;

        double meanAnomaly = DegreeMath.normalizeAngle(357.529 + 0.98560028 * d);
        double meanLongitude = DegreeMath.normalizeAngle(280.459 + 0.98564736 * d);
        double eclipticLongitude = DegreeMath.normalizeAngle(
                meanLongitude
                        + 1.915 * DegreeMath.sin(meanAnomaly)
                        + 0.020 * DegreeMath.sin(2 * meanAnomaly));

        double obliquity = 23.439 - 0.00000036 * d;
        double declination =
                DegreeMath.asin(DegreeMath.sin(obliquity) * DegreeMath.sin(eclipticLongitude));

        double rightAscension = DegreeMath.normalizeHour(
                DegreeMath.atan2(
                        DegreeMath.cos(obliquity) * DegreeMath.sin(eclipticLongitude),
                        DegreeMath.cos(eclipticLongitude))
                        / 15.0);
        double equationOfTime = meanLongitude / 15.0 - rightAscension;
        // Mean longitude and right ascension wrap independently near the March equinox
        equationOfTime = DegreeMath.normalizeHour(equationOfTime + 12.0) - 12.0;

        return new SunPosition(declination, equationOfTime);
    }

    @Override
    public String toString() {
        return String.format("SunPosition[declination=%.4f°, eot=%.4fh]",
                declinationDeg, equationOfTimeHours);
    }
}
