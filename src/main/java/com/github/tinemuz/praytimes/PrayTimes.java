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

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Daily prayer time calculator.
 *
 * <p>Fajr and Isha are the moments the sun reaches a twilight depression
 * angle, Sunrise and Maghrib follow the sun's upper limb crossing the horizon
 * (0.833° below the geometric horizon, for refraction and solar radius),
 * Dhuhr is solar noon, and Asr is the moment an object's shadow exceeds its
 * noon shadow by one (standard) or two (Hanafi) object lengths.</p>
 *
 * <p>The single entry point is {@link #compute}, which returns an immutable
 * {@link Times}. It keeps no state between calls, never throws for a valid
 * {@link PrayerTimesConfig}, and reports times the sun geometry cannot
 * produce as {@code NaN}.</p>
 */
public final class PrayTimes {
    private static final Logger log = LoggerFactory.getLogger(PrayTimes.class);
    // Sun's upper limb at the horizon: refraction plus apparent radius
    private static final double HORIZON_DEPRESSION = 0.833;

    // Local-hour seeds at which the sun is sampled for each event
    private static final double FAJR_SEED = 5.0 / 24.0;
    private static final double SUNRISE_SEED = 6.0 / 24.0;
    private static final double DHUHR_SEED = 12.0 / 24.0;
    private static final double ASR_SEED = 13.0 / 24.0;
    private static final double SUNSET_SEED = 18.0 / 24.0;
    private static final double MAGHRIB_SEED = 18.0 / 24.0;
    private static final double ISHA_SEED = 18.0 / 24.0;

    private PrayTimes() {}

    /**
     * Compute the prayer times of the day containing the given instant.
     *
     * @param config      location and convention settings
     * @param epochMillis UTC time as epoch milliseconds; 00:00 UTC of the
     *                    desired date is the usual choice
     * @return the six times in local clock hours
     */
    public static Times compute(PrayerTimesConfig config, long epochMillis) {
        Objects.requireNonNull(config, "config");
        MethodParameters params = config.parameters();
        double lat = config.latitudeDeg();
        double jd = JulianDate.fromEpochMillis(epochMillis, config.longitudeDeg());
        log.debug("Computing prayer times for jd={} with {}", jd, config);

        // STEP 1-2: Solve every event at its seed, in local mean solar hours
        DayTimes t = new DayTimes();
        t.fajr = AngleTimeSolver.solve(180.0 - params.fajrAngle(), jd, FAJR_SEED, lat);
        t.sunrise = AngleTimeSolver.solve(180.0 - HORIZON_DEPRESSION, jd, SUNRISE_SEED, lat);
        t.dhuhr = AngleTimeSolver.midday(jd, DHUHR_SEED);
        t.asr = AsrTimeSolver.solve(config.asrJuristic(), jd, ASR_SEED, lat);
        t.sunset = AngleTimeSolver.solve(HORIZON_DEPRESSION, jd, SUNSET_SEED, lat);
        // Overwritten below when the convention is minutes-based
        t.maghrib = AngleTimeSolver.solve(params.maghribValue(), jd, MAGHRIB_SEED, lat);
        t.isha = AngleTimeSolver.solve(params.ishaValue(), jd, ISHA_SEED, lat);
        log.trace("Solar times: {}", t);

        // STEP 3: Solar time to clock time
        t.shift(config.effectiveOffsetHours() - config.longitudeDeg() / 15.0);

        // STEP 4: Dhuhr offset after noon
        t.dhuhr += config.dhuhrMinutes() / 60.0;

        // STEP 5-6: Minutes-based Maghrib and Isha. The Maghrib value is added
        // unconverted, the Isha value is converted from minutes.
        if (params.maghribByMinutes()) {
            t.maghrib = t.sunset + params.maghribValue();
        }
        if (params.ishaByMinutes()) {
            t.isha = t.maghrib + params.ishaValue() / 60.0;
        }

        // STEP 7: High latitude repair
        if (config.highLatitudeMethod() != HighLatitudeMethod.NONE) {
            HighLatitudeAdjuster.adjust(t, params, config.highLatitudeMethod());
        }

        // STEP 8: Tuning
        t.tune(config.tuning());

        // STEP 9-10: Drop sunset; formatting happens lazily in Times
        Times times = new Times(t, config.timeFormat());
        if (!times.allDefined()) {
            log.debug("Undefined times for jd={} at latitude {} with {}: {}",
                    jd, lat, config.highLatitudeMethod(), times);
        }
        return times;
    }

    public static Times compute(PrayerTimesConfig config, Instant instant) {
        return compute(config, instant.toEpochMilli());
    }

    /** Times for a calendar date, sampled from 00:00 UTC of that date. */
    public static Times compute(PrayerTimesConfig config, LocalDate date) {
        return compute(config, date.atStartOfDay(ZoneOffset.UTC).toInstant());
    }

    /**
     * Immutable result of {@link #compute}. Values are local clock hours and
     * may fall outside [0, 24) after offsets; {@code NaN} marks a time the
     * sun geometry could not produce.
     */
    public static final class Times {
        /** Fajr, start of dawn twilight. */
        public final double fajr;

        /** Sunrise, upper limb at the horizon. */
        public final double sunrise;

        /** Dhuhr, solar noon plus the configured offset. */
        public final double dhuhr;

        /** Asr, shadow criterion. */
        public final double asr;

        /** Maghrib, sunset or dusk angle. */
        public final double maghrib;

        /** Isha, end of dusk twilight. */
        public final double isha;

        /** Style used by {@link #formatted(Prayer)}. */
        public final TimeFormat format;

        private Times(DayTimes t, TimeFormat format) {
            this.fajr = t.fajr;
            this.sunrise = t.sunrise;
            this.dhuhr = t.dhuhr;
            this.asr = t.asr;
            this.maghrib = t.maghrib;
            this.isha = t.isha;
            this.format = format;
        }

        public double hours(Prayer prayer) {
            switch (prayer) {
                case FAJR: return fajr;
                case SUNRISE: return sunrise;
                case DHUHR: return dhuhr;
                case ASR: return asr;
                case MAGHRIB: return maghrib;
                case ISHA: return isha;
                default: throw new IllegalArgumentException("Unknown prayer " + prayer);
            }
        }

        public boolean isDefined(Prayer prayer) {
            return !Double.isNaN(hours(prayer));
        }

        public boolean allDefined() {
            for (Prayer p : Prayer.values()) {
                if (!isDefined(p)) return false;
            }
            return true;
        }

        public String formatted(Prayer prayer) {
            return TimeFormatter.format(hours(prayer), format);
        }

        /** Formatted times in {@link Prayer} order. */
        public List<String> formattedTimes() {
            List<String> out = new ArrayList<>(Prayer.values().length);
            for (Prayer p : Prayer.values()) {
                out.add(formatted(p));
            }
            return Collections.unmodifiableList(out);
        }

        /** One {@code Name: time} line per prayer. */
        @Override
        public String toString() {
            StringBuilder sb = new StringBuilder();
            for (Prayer p : Prayer.values()) {
                sb.append(p.displayName()).append(": ").append(formatted(p)).append('\n');
            }
            return sb.toString();
        }
    }
}
