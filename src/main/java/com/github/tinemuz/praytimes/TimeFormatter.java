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

import java.util.Locale;
import java.util.Objects;

/**
 * Renders fractional hours as clock strings rounded to the nearest minute.
 *
 * <p>Undefined times ({@code NaN}) render as an empty string for the clock
 * styles and as {@code "NaN"} for {@link TimeFormat#FLOAT}.</p>
 */
public final class TimeFormatter {
    private static final double HALF_MINUTE_HOURS = 0.5 / 60.0;

    private TimeFormatter() {}

    public static String format(double hours, TimeFormat style) {
        Objects.requireNonNull(style, "style");
        if (style == TimeFormat.FLOAT) {
            return Double.toString(hours);
        }
        if (Double.isNaN(hours)) {
            return "";
        }

        double time = DegreeMath.normalizeHour(hours + HALF_MINUTE_HOURS);
        int h = (int) Math.floor(time);
        int m = (int) Math.floor((time - h) * 60.0);

        switch (style) {
            case HOUR_24:
                return String.format(Locale.ROOT, "%02d:%02d", h, m);
            case HOUR_12:
            case HOUR_12_NO_SUFFIX:
                return String.format(Locale.ROOT, "%d:%02d", (h + 11) % 12 + 1, m);
            default:
                throw new IllegalStateException("Unhandled time format " + style);
        }
    }
}
