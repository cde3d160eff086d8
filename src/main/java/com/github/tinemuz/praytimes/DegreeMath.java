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
 * Degree-based trigonometry and range reduction shared by the solar model and
 * the solvers. Every angle argument and result is in degrees.
 */
final class DegreeMath {

    private DegreeMath() {}

    /** Reduce an angle into [0, 360). NaN stays NaN. */
    static double normalizeAngle(double degrees) {
        return reduce(degrees, 360.0);
    }

    /** Reduce an hour value into [0, 24). NaN stays NaN. */
    static double normalizeHour(double hours) {
        return reduce(hours, 24.0);
    }

    static double sin(double degrees) {
        return Math.sin(Math.toRadians(degrees));
    }

    static double cos(double degrees) {
        return Math.cos(Math.toRadians(degrees));
    }

    static double tan(double degrees) {
        return Math.tan(Math.toRadians(degrees));
    }

    static double asin(double x) {
        return Math.toDegrees(Math.asin(x));
    }

    /** Degree arccos; arguments outside [-1, 1] give NaN. */
    static double acos(double x) {
        return Math.toDegrees(Math.acos(x));
    }

    static double atan2(double y, double x) {
        return Math.toDegrees(Math.atan2(y, x));
    }

    static double acot(double x) {
        return Math.toDegrees(Math.atan2(1.0, x));
    }

    private static double reduce(double value, double range) {
        double r = value - range * Math.floor(value / range);
        // floor() can leave a tiny negative or a full range for values near a boundary
        if (r < 0) r += range;
        if (r >= range) r -= range;
        return r;
    }
}
