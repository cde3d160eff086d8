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
 * Rule bounding Fajr, Maghrib and Isha to a share of the night at latitudes
 * where twilight angles are reached late, early, or not at all.
 */
public enum HighLatitudeMethod {
    /** No adjustment; unsolvable times stay undefined. */
    NONE {
        @Override
        double nightPortion(double angleDeg) {
            return 0.0;
        }
    },
    /** Twilight limited to half of the night. */
    MIDNIGHT {
        @Override
        double nightPortion(double angleDeg) {
            return 0.5;
        }
    },
    /** Twilight limited to a seventh of the night. */
    ONE_SEVENTH {
        @Override
        double nightPortion(double angleDeg) {
            return 1.0 / 7.0;
        }
    },
    /** Twilight limited to angle/60 of the night. */
    ANGLE_BASED {
        @Override
        double nightPortion(double angleDeg) {
            return angleDeg / 60.0;
        }
    };

    /** Fraction of the night allowed for a twilight defined by {@code angleDeg}. */
    abstract double nightPortion(double angleDeg);
}
