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
 * Working set of the seven internal event times for one computation, in
 * hours. {@link #sunset} is internal only and is dropped from the result.
 * Not shared between computations.
 */
final class DayTimes {
    double fajr;
    double sunrise;
    double dhuhr;
    double asr;
    double sunset;
    double maghrib;
    double isha;

    void shift(double hours) {
        fajr += hours;
        sunrise += hours;
        dhuhr += hours;
        asr += hours;
        sunset += hours;
        maghrib += hours;
        isha += hours;
    }

    void tune(TuningOffsets offsets) {
        fajr += offsets.fajr() / 60.0;
        sunrise += offsets.sunrise() / 60.0;
        dhuhr += offsets.dhuhr() / 60.0;
        asr += offsets.asr() / 60.0;
        sunset += offsets.sunset() / 60.0;
        maghrib += offsets.maghrib() / 60.0;
        isha += offsets.isha() / 60.0;
    }

    @Override
    public String toString() {
        return String.format(
                "fajr=%.4f sunrise=%.4f dhuhr=%.4f asr=%.4f sunset=%.4f maghrib=%.4f isha=%.4f",
                fajr, sunrise, dhuhr, asr, sunset, maghrib, isha);
    }
}
