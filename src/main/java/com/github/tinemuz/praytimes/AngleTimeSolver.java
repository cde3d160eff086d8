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
 * Finds the hour of day at which the sun crosses a given altitude.
 *
 * <p>Angles are measured as depression below the horizon for the afternoon
 * branch; values above 90 select the morning branch (the solver then works
 * with {@code 180 - depression}). Times are local mean solar hours relative
 * to the Julian day passed in, before any timezone correction.</p>
 */
public final class AngleTimeSolver {

    private AngleTimeSolver() {}

    /**
     * Solar noon for the given day.
     *
     * @param julianDate  longitude-corrected Julian day
     * @param dayFraction approximate local hour / 24 used to sample the sun
     * @return hour of solar transit in [0, 24)
     */
    public static double midday(double julianDate, double dayFraction) {
        double eot = SunPosition.compute(julianDate + dayFraction).equationOfTimeHours;
        return DegreeMath.normalizeHour(12.0 - eot);
    }

    /**
     * Hour at which the sun reaches the given angle.
     *
     * @param angleDeg    target angle in degrees; above 90 means before noon
     * @param julianDate  longitude-corrected Julian day
     * @param dayFraction approximate local hour / 24 used to sample the sun
     * @param latitudeDeg observer latitude (degrees, north positive)
     * @return hour of day, or {@code NaN} if the sun never reaches the angle
     */
    public static double solve(
            double angleDeg, double julianDate, double dayFraction, double latitudeDeg) {
        SunPosition sun = SunPosition.compute(julianDate + dayFraction);
        double decl = sun.declinationDeg;
        double noon = DegreeMath.normalizeHour(12.0 - sun.equationOfTimeHours);

        double cosHourAngle =
                (-DegreeMath.sin(angleDeg) - DegreeMath.sin(decl) * DegreeMath.sin(latitudeDeg))
                        / (DegreeMath.cos(decl) * DegreeMath.cos(latitudeDeg));
        // Outside [-1, 1] the sun stays above or below the angle all day; acos yields NaN
        double hourAngle = DegreeMath.acos(cosHourAngle) / 15.0;

        return angleDeg > 90 ? noon - hourAngle : noon + hourAngle;
    }
}
