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

import java.util.Arrays;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Per-event minute offsets added after all other corrections.
 *
 * <p>There are seven slots: the six reported times plus the internal sunset
 * slot. Tuning runs after Maghrib and Isha are derived, so the sunset slot
 * never shows in the output.</p>
 */
public final class TuningOffsets {
    private static final Logger log = LoggerFactory.getLogger(TuningOffsets.class);
    private static final int SLOTS = 7;
    private static final TuningOffsets NONE = new TuningOffsets(new double[SLOTS]);

    private final double[] minutes;

    private TuningOffsets(double[] minutes) {
        this.minutes = minutes;
    }

    public static TuningOffsets none() {
        return NONE;
    }

    public static TuningOffsets of(
            double fajr, double sunrise, double dhuhr, double asr,
            double sunset, double maghrib, double isha) {
        return new TuningOffsets(new double[] {fajr, sunrise, dhuhr, asr, sunset, maghrib, isha});
    }

    /**
     * @param minutes offsets in slot order fajr, sunrise, dhuhr, asr, sunset, maghrib, isha
     * @throws IllegalArgumentException if the array does not have exactly seven entries
     */
    public static TuningOffsets fromArray(double[] minutes) {
        Objects.requireNonNull(minutes, "minutes");
        if (minutes.length != SLOTS) {
            log.error("Tuning array has {} entries, expected {}", minutes.length, SLOTS);
            throw new IllegalArgumentException(
                    "Tuning offsets need exactly " + SLOTS + " entries, got " + minutes.length);
        }
        return new TuningOffsets(minutes.clone());
    }

    /** Copy of these offsets with the given prayer's slot replaced. */
    public TuningOffsets withPrayer(Prayer prayer, double offsetMinutes) {
        double[] copy = minutes.clone();
        copy[slotOf(prayer)] = offsetMinutes;
        return new TuningOffsets(copy);
    }

    public double fajr() {
        return minutes[0];
    }

    public double sunrise() {
        return minutes[1];
    }

    public double dhuhr() {
        return minutes[2];
    }

    public double asr() {
        return minutes[3];
    }

    public double sunset() {
        return minutes[4];
    }

    public double maghrib() {
        return minutes[5];
    }

    public double isha() {
        return minutes[6];
    }

    public double[] toArray() {
        return minutes.clone();
    }

    private static int slotOf(Prayer prayer) {
        switch (prayer) {
            case FAJR: return 0;
            case SUNRISE: return 1;
            case DHUHR: return 2;
            case ASR: return 3;
            case MAGHRIB: return 5;
            case ISHA: return 6;
            default: throw new IllegalArgumentException("No tuning slot for " + prayer);
        }
    }

    @Override
    public boolean equals(Object o) {
        return this == o || (o instanceof TuningOffsets && Arrays.equals(minutes, ((TuningOffsets) o).minutes));
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(minutes);
    }

    @Override
    public String toString() {
        return "TuningOffsets" + Arrays.toString(minutes);
    }
}
