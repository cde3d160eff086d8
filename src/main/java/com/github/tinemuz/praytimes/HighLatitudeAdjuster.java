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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Bounds Fajr, Maghrib and Isha to a portion of the night.
 *
 * <p>Near the poles in summer the twilight angles are reached very late or
 * never, which leaves Fajr and Isha undefined or squeezed against midnight.
 * Each of the three times is replaced when it is undefined or lies further
 * from its reference event (sunrise for Fajr, sunset for the others) than
 * the allowed share of the night. The three corrections are independent of
 * each other.</p>
 */
final class HighLatitudeAdjuster {
    private static final Logger log = LoggerFactory.getLogger(HighLatitudeAdjuster.class);
    // Angles assumed for minutes-based Isha and Maghrib
    private static final double DEFAULT_ISHA_ANGLE = 18.0;
    private static final double DEFAULT_MAGHRIB_ANGLE = 4.0;

    private HighLatitudeAdjuster() {}

    static void adjust(DayTimes t, MethodParameters params, HighLatitudeMethod method) {
        // Sunset to next sunrise; NaN during polar day or night, nothing can be repaired then
        double nightTime = span(t.sunset, t.sunrise);

        double fajrLimit = method.nightPortion(params.fajrAngle()) * nightTime;
        if (Double.isNaN(t.fajr) || span(t.fajr, t.sunrise) > fajrLimit) {
            double adjusted = t.sunrise - fajrLimit;
            log.debug("Fajr {} replaced by {} ({})", t.fajr, adjusted, method);
            t.fajr = adjusted;
        }

        double ishaAngle = params.ishaByMinutes() ? DEFAULT_ISHA_ANGLE : params.ishaValue();
        double ishaLimit = method.nightPortion(ishaAngle) * nightTime;
        if (Double.isNaN(t.isha) || span(t.sunset, t.isha) > ishaLimit) {
            double adjusted = t.sunset + ishaLimit;
            log.debug("Isha {} replaced by {} ({})", t.isha, adjusted, method);
            t.isha = adjusted;
        }

        double maghribAngle = params.maghribByMinutes() ? DEFAULT_MAGHRIB_ANGLE : params.maghribValue();
        double maghribLimit = method.nightPortion(maghribAngle) * nightTime;
        if (Double.isNaN(t.maghrib) || span(t.sunset, t.maghrib) > maghribLimit) {
            double adjusted = t.sunset + maghribLimit;
            log.debug("Maghrib {} replaced by {} ({})", t.maghrib, adjusted, method);
            t.maghrib = adjusted;
        }
    }

    /** Hours from {@code from} forward to {@code to}, wrapping past midnight. */
    static double span(double from, double to) {
        return DegreeMath.normalizeHour(to - from);
    }
}
