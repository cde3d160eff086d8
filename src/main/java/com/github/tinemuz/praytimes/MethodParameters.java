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
 * Resolved parameters of a calculation convention.
 *
 * <p>Immutable. Overrides never modify an instance; they return a new one
 * tagged {@link CalculationMethod#CUSTOM}. In an override array the value
 * {@link #KEEP} leaves the corresponding slot as it is.</p>
 */
public final class MethodParameters {
    private static final Logger log = LoggerFactory.getLogger(MethodParameters.class);

    /** Override sentinel meaning "keep the current value". */
    public static final double KEEP = -1;
    /** Number of parameter slots. */
    public static final int SLOTS = 5;

    static final int MODE_ANGLE = 0;
    static final int MODE_MINUTES = 1;

    private static final int FAJR_ANGLE = 0;
    private static final int MAGHRIB_MODE = 1;
    private static final int MAGHRIB_VALUE = 2;
    private static final int ISHA_MODE = 3;
    private static final int ISHA_VALUE = 4;

    private final CalculationMethod method;
    private final double[] values;

    private MethodParameters(CalculationMethod method, double[] values) {
        this.method = method;
        this.values = values;
    }

    static MethodParameters of(CalculationMethod method, double[] values) {
        return new MethodParameters(method, values.clone());
    }

    /**
     * Apply a five-slot override on top of these parameters.
     *
     * @param overrides {@code [fajrAngle, maghribMode, maghribValue, ishaMode, ishaValue]},
     *                  {@link #KEEP} for slots that should not change
     * @return new parameters tagged {@link CalculationMethod#CUSTOM}
     * @throws IllegalArgumentException if the array does not have exactly five entries
     */
    public MethodParameters withOverrides(double... overrides) {
        Objects.requireNonNull(overrides, "overrides");
        if (overrides.length != SLOTS) {
            log.error("Custom parameter array has {} entries, expected {}", overrides.length, SLOTS);
            throw new IllegalArgumentException(
                    "Custom parameters need exactly " + SLOTS + " entries, got " + overrides.length);
        }
        double[] merged = new double[SLOTS];
        for (int i = 0; i < SLOTS; i++) {
            merged[i] = overrides[i] == KEEP ? values[i] : overrides[i];
        }
        return new MethodParameters(CalculationMethod.CUSTOM, merged);
    }

    public MethodParameters withFajrAngle(double angle) {
        return withOverrides(angle, KEEP, KEEP, KEEP, KEEP);
    }

    public MethodParameters withMaghribAngle(double angle) {
        return withOverrides(KEEP, MODE_ANGLE, angle, KEEP, KEEP);
    }

    public MethodParameters withMaghribMinutes(double minutes) {
        return withOverrides(KEEP, MODE_MINUTES, minutes, KEEP, KEEP);
    }

    public MethodParameters withIshaAngle(double angle) {
        return withOverrides(KEEP, KEEP, KEEP, MODE_ANGLE, angle);
    }

    public MethodParameters withIshaMinutes(double minutes) {
        return withOverrides(KEEP, KEEP, KEEP, MODE_MINUTES, minutes);
    }

    public CalculationMethod method() {
        return method;
    }

    public double fajrAngle() {
        return values[FAJR_ANGLE];
    }

    /** True when Maghrib is a fixed offset after sunset rather than an angle. */
    public boolean maghribByMinutes() {
        return values[MAGHRIB_MODE] == MODE_MINUTES;
    }

    public double maghribValue() {
        return values[MAGHRIB_VALUE];
    }

    /** True when Isha is a number of minutes after Maghrib rather than an angle. */
    public boolean ishaByMinutes() {
        return values[ISHA_MODE] == MODE_MINUTES;
    }

    public double ishaValue() {
        return values[ISHA_VALUE];
    }

    /** Copy of the five slots. */
    public double[] toArray() {
        return values.clone();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof MethodParameters)) return false;
        MethodParameters other = (MethodParameters) o;
        return method == other.method && Arrays.equals(values, other.values);
    }

    @Override
    public int hashCode() {
        return 31 * method.hashCode() + Arrays.hashCode(values);
    }

    @Override
    public String toString() {
        return method + Arrays.toString(values);
    }
}
