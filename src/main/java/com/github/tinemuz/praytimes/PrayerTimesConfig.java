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

import java.time.ZoneOffset;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Location and convention settings for {@link PrayTimes#compute}.
 *
 * <p>Immutable once built, so one instance can be shared by any number of
 * threads computing different dates. All validation happens in
 * {@link Builder#build()}; the computation itself assumes valid values.</p>
 */
public final class PrayerTimesConfig {
    private final double latitudeDeg;
    private final double longitudeDeg;
    private final double timeZoneHours;
    private final double daylightSavingHours;
    private final MethodParameters parameters;
    private final AsrJuristicMethod asrJuristic;
    private final HighLatitudeMethod highLatitudeMethod;
    private final TimeFormat timeFormat;
    private final TuningOffsets tuning;
    private final double dhuhrMinutes;

    private PrayerTimesConfig(Builder b, MethodParameters parameters) {
        this.latitudeDeg = b.latitudeDeg;
        this.longitudeDeg = b.longitudeDeg;
        this.timeZoneHours = b.timeZoneHours;
        this.daylightSavingHours = b.daylightSavingHours;
        this.parameters = parameters;
        this.asrJuristic = b.asrJuristic;
        this.highLatitudeMethod = b.highLatitudeMethod;
        this.timeFormat = b.timeFormat;
        this.tuning = b.tuning;
        this.dhuhrMinutes = b.dhuhrMinutes;
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Builder pre-filled with this configuration's values. */
    public Builder toBuilder() {
        Builder b = new Builder()
                .location(latitudeDeg, longitudeDeg)
                .timeZone(timeZoneHours)
                .daylightSaving(daylightSavingHours)
                .asrJuristic(asrJuristic)
                .highLatitudeMethod(highLatitudeMethod)
                .timeFormat(timeFormat)
                .tuning(tuning)
                .dhuhrMinutes(dhuhrMinutes);
        b.parameters = parameters;
        return b;
    }

    public double latitudeDeg() {
        return latitudeDeg;
    }

    public double longitudeDeg() {
        return longitudeDeg;
    }

    public double timeZoneHours() {
        return timeZoneHours;
    }

    public double daylightSavingHours() {
        return daylightSavingHours;
    }

    /** Timezone plus daylight saving, in hours east of UTC. */
    public double effectiveOffsetHours() {
        return timeZoneHours + daylightSavingHours;
    }

    public MethodParameters parameters() {
        return parameters;
    }

    public AsrJuristicMethod asrJuristic() {
        return asrJuristic;
    }

    public HighLatitudeMethod highLatitudeMethod() {
        return highLatitudeMethod;
    }

    public TimeFormat timeFormat() {
        return timeFormat;
    }

    public TuningOffsets tuning() {
        return tuning;
    }

    public double dhuhrMinutes() {
        return dhuhrMinutes;
    }

    @Override
    public String toString() {
        return String.format(
                "PrayerTimesConfig[lat=%.4f, lon=%.4f, tz=%s, dst=%s, %s, %s, %s, %s, %s, dhuhr=+%smin]",
                latitudeDeg, longitudeDeg, timeZoneHours, daylightSavingHours, parameters,
                asrJuristic, highLatitudeMethod, timeFormat, tuning, dhuhrMinutes);
    }

    /**
     * Mutable builder. Defaults: {@link CalculationMethod#EGYPT},
     * {@link AsrJuristicMethod#STANDARD}, {@link HighLatitudeMethod#MIDNIGHT},
     * {@link TimeFormat#HOUR_12}, UTC, no daylight saving, no tuning.
     */
    public static final class Builder {
        private static final Logger log = LoggerFactory.getLogger(Builder.class);

        private double latitudeDeg = Double.NaN;
        private double longitudeDeg = Double.NaN;
        private double timeZoneHours;
        private double daylightSavingHours;
        private MethodParameters parameters = CalculationMethod.EGYPT.parameters();
        private double[] customOverrides;
        private AsrJuristicMethod asrJuristic = AsrJuristicMethod.STANDARD;
        private HighLatitudeMethod highLatitudeMethod = HighLatitudeMethod.MIDNIGHT;
        private TimeFormat timeFormat = TimeFormat.HOUR_12;
        private TuningOffsets tuning = TuningOffsets.none();
        private double dhuhrMinutes;

        private Builder() {}

        /**
         * @param latitudeDeg  latitude in [-90, 90], north positive
         * @param longitudeDeg longitude in [-180, 180], east positive
         */
        public Builder location(double latitudeDeg, double longitudeDeg) {
            this.latitudeDeg = latitudeDeg;
            this.longitudeDeg = longitudeDeg;
            return this;
        }

        /** Standard time offset in hours east of UTC, daylight saving excluded. */
        public Builder timeZone(double hours) {
            this.timeZoneHours = hours;
            return this;
        }

        public Builder timeZone(ZoneOffset offset) {
            return timeZone(offset.getTotalSeconds() / 3600.0);
        }

        public Builder daylightSaving(double hours) {
            this.daylightSavingHours = hours;
            return this;
        }

        /** Use a named convention; any custom overrides are applied on top of it. */
        public Builder method(CalculationMethod method) {
            this.parameters = Objects.requireNonNull(method, "method").parameters();
            return this;
        }

        /** Use already resolved parameters, e.g. from {@link MethodParameters#withFajrAngle}. */
        public Builder parameters(MethodParameters parameters) {
            this.parameters = Objects.requireNonNull(parameters, "parameters");
            return this;
        }

        /**
         * Five-slot override {@code [fajrAngle, maghribMode, maghribValue, ishaMode, ishaValue]}
         * applied at build time; {@link MethodParameters#KEEP} keeps the method's value.
         * A {@code null} or empty array means no override.
         */
        public Builder customParameters(double... overrides) {
            this.customOverrides = overrides == null ? null : overrides.clone();
            return this;
        }

        public Builder asrJuristic(AsrJuristicMethod juristic) {
            this.asrJuristic = Objects.requireNonNull(juristic, "juristic");
            return this;
        }

        public Builder highLatitudeMethod(HighLatitudeMethod method) {
            this.highLatitudeMethod = Objects.requireNonNull(method, "method");
            return this;
        }

        public Builder timeFormat(TimeFormat format) {
            this.timeFormat = Objects.requireNonNull(format, "format");
            return this;
        }

        public Builder tuning(TuningOffsets tuning) {
            this.tuning = Objects.requireNonNull(tuning, "tuning");
            return this;
        }

        /** Minutes added to solar noon for Dhuhr. */
        public Builder dhuhrMinutes(double minutes) {
            this.dhuhrMinutes = minutes;
            return this;
        }

        /**
         * @throws IllegalArgumentException if the location is missing or out of range,
         *                                  an offset is not finite, or the custom override
         *                                  array does not have five entries
         */
        public PrayerTimesConfig build() {
            requireInRange("latitude", latitudeDeg, 90.0);
            requireInRange("longitude", longitudeDeg, 180.0);
            requireFinite("timezone", timeZoneHours);
            requireFinite("daylight saving", daylightSavingHours);
            requireFinite("dhuhr minutes", dhuhrMinutes);

            MethodParameters resolved = parameters;
            if (customOverrides != null && customOverrides.length > 0) {
                resolved = parameters.withOverrides(customOverrides);
            }
            return new PrayerTimesConfig(this, resolved);
        }

        private static void requireInRange(String name, double value, double limit) {
            if (!(value >= -limit && value <= limit)) {
                log.error("Invalid {} {}; expected a value in [-{}, {}]", name, value, limit, limit);
                throw new IllegalArgumentException(
                        "Invalid " + name + " " + value + "; expected a value in [-" + limit + ", " + limit + "]");
            }
        }

        private static void requireFinite(String name, double value) {
            if (!Double.isFinite(value)) {
                log.error("Invalid {} {}; expected a finite value", name, value);
                throw new IllegalArgumentException("Invalid " + name + " " + value + "; expected a finite value");
            }
        }
    }
}
