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

/** Asr time from the shadow-length criterion. */
public final class AsrTimeSolver {

    private AsrTimeSolver() {}

    /**
     * Hour at which an object's shadow exceeds its noon shadow by
     * {@code step} object lengths.
     *
     * @param step        shadow factor, 1 for standard and 2 for Hanafi
     * @param julianDate  longitude-corrected Julian day
     * @param dayFraction approximate local hour / 24 used to sample the sun
     * @param latitudeDeg observer latitude (degrees, north positive)
     * @return hour of day, or {@code NaN} if the angle is never reached
     */
    public static double solve(
            double step, double julianDate, double dayFraction, double latitudeDeg) {
        double decl = SunPosition.compute(julianDate + dayFraction).declinationDeg;
        double angle = -DegreeMath.acot(step + DegreeMath.tan(Math.abs(latitudeDeg - decl)));
        return AngleTimeSolver.solve(angle, julianDate, dayFraction, latitudeDeg);
    }

    public static double solve(
            AsrJuristicMethod juristic, double julianDate, double dayFraction, double latitudeDeg) {
        return solve(juristic.shadowStep(), julianDate, dayFraction, latitudeDeg);
    }
}
