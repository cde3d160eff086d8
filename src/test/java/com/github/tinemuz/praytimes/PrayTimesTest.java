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

import static org.junit.jupiter.api.Assertions.*;

import com.github.tinemuz.praytimes.PrayTimes.Times;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/**
 * End-to-end tests for the prayer time pipeline.
 *
 * <p>Reference hours come from an independent implementation of the
 * praytimes.org algorithm.</p>
 */
class PrayTimesTest {

    private static final double MINUTE = 1.0 / 60.0;
    private static final double REFERENCE_TOLERANCE = 1e-4; // hours
    private static final double EXACT = 1e-9;

    private static final double MECCA_LAT = 21.4225;
    private static final double MECCA_LON = 39.8262;
    private static final double OSLO_LAT = 59.9139;
    private static final double OSLO_LON = 10.7522;

    @Nested
    @DisplayName("Reference Values")
    class ReferenceValueTests {

        @Test
        @DisplayName("Mecca, MWL, 2024-01-01")
        void meccaMwl() {
            Times t = PrayTimes.compute(mecca(CalculationMethod.MWL).build(), epochMillis(2024, 1, 1));

            assertEquals(5.652208913, t.fajr, REFERENCE_TOLERANCE, "Fajr");
            assertEquals(6.972449097, t.sunrise, REFERENCE_TOLERANCE, "Sunrise");
            assertEquals(12.399546283, t.dhuhr, REFERENCE_TOLERANCE, "Dhuhr");
            assertEquals(15.476748904, t.asr, REFERENCE_TOLERANCE, "Asr");
            assertEquals(17.827865062, t.maghrib, REFERENCE_TOLERANCE, "Maghrib");
            assertEquals(19.071961920, t.isha, REFERENCE_TOLERANCE, "Isha");

            assertEquals(
                    List.of("05:39", "06:58", "12:24", "15:29", "17:50", "19:04"),
                    t.formattedTimes());
        }

        @Test
        @DisplayName("Mecca, MWL, 2024-06-21 within a minute of the reference")
        void meccaMwlSummer() {
            Times t = PrayTimes.compute(mecca(CalculationMethod.MWL).build(), LocalDate.of(2024, 6, 21));

            assertEquals(4.0 + 14.0 / 60, t.fajr, MINUTE, "Fajr");
            assertEquals(5.0 + 39.0 / 60, t.sunrise, MINUTE, "Sunrise");
            assertEquals(12.0 + 23.0 / 60, t.dhuhr, MINUTE, "Dhuhr");
            assertEquals(15.0 + 42.0 / 60, t.asr, MINUTE, "Asr");
            assertEquals(19.0 + 6.0 / 60, t.maghrib, MINUTE, "Maghrib");
            assertEquals(20.0 + 26.0 / 60, t.isha, MINUTE, "Isha");
        }

        @Test
        @DisplayName("Makkah convention: Isha 90 minutes after Maghrib")
        void makkahIshaMinutes() {
            Times t = PrayTimes.compute(mecca(CalculationMethod.MAKKAH).build(), epochMillis(2024, 1, 1));

            assertEquals(t.maghrib + 1.5, t.isha, EXACT);
            assertEquals("19:20", t.formatted(Prayer.ISHA));
            assertEquals("05:37", t.formatted(Prayer.FAJR));
        }

        @Test
        @DisplayName("Tehran convention: angle-based Maghrib")
        void tehranMaghribAngle() {
            PrayerTimesConfig config = PrayerTimesConfig.builder()
                    .location(35.6892, 51.3890)
                    .timeZone(3.5)
                    .method(CalculationMethod.TEHRAN)
                    .highLatitudeMethod(HighLatitudeMethod.NONE)
                    .timeFormat(TimeFormat.HOUR_24)
                    .build();
            Times t = PrayTimes.compute(config, epochMillis(2024, 1, 1));

            assertEquals(5.739030294, t.fajr, REFERENCE_TOLERANCE, "Fajr");
            assertEquals(14.721947379, t.asr, REFERENCE_TOLERANCE, "Asr");
            assertEquals(17.361044669, t.maghrib, REFERENCE_TOLERANCE, "Maghrib");
            assertEquals(18.201439258, t.isha, REFERENCE_TOLERANCE, "Isha");
        }

        @Test
        @DisplayName("Hanafi Asr is later than standard Asr")
        void hanafiAsr() {
            Times standard = PrayTimes.compute(mecca(CalculationMethod.MWL).build(), epochMillis(2024, 1, 1));
            Times hanafi = PrayTimes.compute(
                    mecca(CalculationMethod.MWL).asrJuristic(AsrJuristicMethod.HANAFI).build(),
                    epochMillis(2024, 1, 1));

            assertEquals("16:14", hanafi.formatted(Prayer.ASR));
            assertTrue(hanafi.asr > standard.asr);
            assertEquals(standard.dhuhr, hanafi.dhuhr, EXACT);
        }
    }

    @Nested
    @DisplayName("Offsets")
    class OffsetTests {

        @Test
        @DisplayName("Tuning Fajr by +10 minutes moves only Fajr")
        void tuningIsolation() {
            long time = epochMillis(2024, 1, 1);
            Times base = PrayTimes.compute(mecca(CalculationMethod.MWL).build(), time);
            Times tuned = PrayTimes.compute(
                    mecca(CalculationMethod.MWL)
                            .tuning(TuningOffsets.none().withPrayer(Prayer.FAJR, 10))
                            .build(),
                    time);

            assertEquals(base.fajr + 10 * MINUTE, tuned.fajr, EXACT);
            assertEquals("05:49", tuned.formatted(Prayer.FAJR));
            for (Prayer p : Prayer.values()) {
                if (p != Prayer.FAJR) {
                    assertEquals(base.hours(p), tuned.hours(p), p + " unchanged");
                }
            }
        }

        @Test
        @DisplayName("Sunset tuning slot never shows in the result")
        void sunsetTuningInternal() {
            long time = epochMillis(2024, 1, 1);
            Times base = PrayTimes.compute(mecca(CalculationMethod.MWL).build(), time);
            Times tuned = PrayTimes.compute(
                    mecca(CalculationMethod.MWL).tuning(TuningOffsets.of(0, 0, 0, 0, 30, 0, 0)).build(),
                    time);

            assertEquals(base.formattedTimes(), tuned.formattedTimes());
        }

        @Test
        @DisplayName("Dhuhr minutes shift Dhuhr only")
        void dhuhrMinutes() {
            long time = epochMillis(2024, 1, 1);
            Times base = PrayTimes.compute(mecca(CalculationMethod.MWL).build(), time);
            Times shifted = PrayTimes.compute(mecca(CalculationMethod.MWL).dhuhrMinutes(2).build(), time);

            assertEquals(base.dhuhr + 2 * MINUTE, shifted.dhuhr, EXACT);
            assertEquals("12:26", shifted.formatted(Prayer.DHUHR));
            assertEquals(base.asr, shifted.asr);
        }

        @Test
        @DisplayName("Daylight saving adds to the timezone")
        void daylightSaving() {
            long time = epochMillis(2024, 1, 1);
            Times base = PrayTimes.compute(mecca(CalculationMethod.MWL).build(), time);
            Times dst = PrayTimes.compute(mecca(CalculationMethod.MWL).daylightSaving(1).build(), time);

            assertEquals(
                    List.of("06:39", "07:58", "13:24", "16:29", "18:50", "20:04"),
                    dst.formattedTimes());
            for (Prayer p : Prayer.values()) {
                assertEquals(base.hours(p) + 1.0, dst.hours(p), EXACT, p.displayName());
            }
        }

        @Test
        @DisplayName("Minutes-based Maghrib adds the raw value as hours")
        void maghribMinutesUnits() {
            long time = epochMillis(2024, 1, 1);
            Times base = PrayTimes.compute(mecca(CalculationMethod.MWL).build(), time);
            Times custom = PrayTimes.compute(
                    mecca(CalculationMethod.MWL).customParameters(-1, 1, 1, -1, -1).build(), time);

            assertEquals(base.maghrib + 1.0, custom.maghrib, EXACT);
            assertEquals(base.isha, custom.isha, EXACT);
        }
    }

    @Nested
    @DisplayName("High Latitudes")
    class HighLatitudeTests {

        @Test
        @DisplayName("Persistent twilight leaves Fajr and Isha undefined without adjustment")
        void osloSummerUnadjusted() {
            Times t = PrayTimes.compute(oslo(HighLatitudeMethod.NONE).build(), epochMillis(2024, 6, 21));

            assertTrue(Double.isNaN(t.fajr), "Fajr undefined");
            assertTrue(Double.isNaN(t.isha), "Isha undefined");
            assertFalse(t.allDefined());
            assertEquals("", t.formatted(Prayer.FAJR));
            assertEquals("03:54", t.formatted(Prayer.SUNRISE));
            assertEquals("22:44", t.formatted(Prayer.MAGHRIB));
        }

        @Test
        @DisplayName("One-seventh rule repairs Oslo midsummer")
        void osloSummerOneSeventh() {
            Times t = PrayTimes.compute(oslo(HighLatitudeMethod.ONE_SEVENTH).build(), epochMillis(2024, 6, 21));

            assertEquals(
                    List.of("03:10", "03:54", "13:19", "18:01", "22:44", "23:28"),
                    t.formattedTimes());
        }

        @Test
        @DisplayName("Angle-based rule may push Isha past midnight")
        void osloSummerAngleBased() {
            Times t = PrayTimes.compute(oslo(HighLatitudeMethod.ANGLE_BASED).build(), epochMillis(2024, 6, 21));

            assertEquals("02:21", t.formatted(Prayer.FAJR));
            assertEquals("00:12", t.formatted(Prayer.ISHA));
            assertTrue(t.isha > 24.0, "raw Isha is after midnight of the computed day");
        }

        @Test
        @DisplayName("Adjusted Fajr, Maghrib and Isha are always defined while the sun rises and sets")
        void adjustedTimesDefined() {
            double[][] locations = {
                {OSLO_LAT, OSLO_LON, 1}, {59.3293, 18.0686, 1}, {60.1699, 24.9384, 2},
                {64.1466, -21.9426, 0}, {51.5074, -0.1278, 0}
            };
            LocalDate[] dates = {
                LocalDate.of(2024, 3, 20), LocalDate.of(2024, 6, 21), LocalDate.of(2024, 12, 21)
            };
            HighLatitudeMethod[] methods = {
                HighLatitudeMethod.MIDNIGHT, HighLatitudeMethod.ONE_SEVENTH, HighLatitudeMethod.ANGLE_BASED
            };
            for (double[] loc : locations) {
                for (LocalDate date : dates) {
                    for (HighLatitudeMethod method : methods) {
                        for (CalculationMethod calc : CalculationMethod.standardMethods()) {
                            PrayerTimesConfig config = PrayerTimesConfig.builder()
                                    .location(loc[0], loc[1])
                                    .timeZone(loc[2])
                                    .method(calc)
                                    .highLatitudeMethod(method)
                                    .build();
                            Times t = PrayTimes.compute(config, date);
                            String where = loc[0] + "," + loc[1] + " " + date + " " + method + " " + calc;
                            assertFalse(Double.isNaN(t.fajr), "Fajr at " + where);
                            assertFalse(Double.isNaN(t.maghrib), "Maghrib at " + where);
                            assertFalse(Double.isNaN(t.isha), "Isha at " + where);
                        }
                    }
                }
            }
        }

        @Test
        @DisplayName("Polar day cannot be repaired")
        void polarDay() {
            PrayerTimesConfig config = PrayerTimesConfig.builder()
                    .location(69.6492, 18.9553)
                    .timeZone(2)
                    .method(CalculationMethod.MWL)
                    .highLatitudeMethod(HighLatitudeMethod.MIDNIGHT)
                    .timeFormat(TimeFormat.HOUR_24)
                    .build();
            Times t = PrayTimes.compute(config, epochMillis(2024, 6, 21));

            assertTrue(Double.isNaN(t.sunrise), "Sun never sets, no sunrise");
            assertTrue(Double.isNaN(t.fajr));
            assertEquals("12:46", t.formatted(Prayer.DHUHR));
            assertEquals("17:58", t.formatted(Prayer.ASR));
        }
    }

    @Nested
    @DisplayName("Result Shape")
    class ResultShapeTests {

        @Test
        @DisplayName("Identical inputs give identical output")
        void idempotent() {
            PrayerTimesConfig config = oslo(HighLatitudeMethod.NONE).build();
            long time = epochMillis(2024, 6, 21);
            Times first = PrayTimes.compute(config, time);
            Times second = PrayTimes.compute(config, time);

            assertEquals(first.formattedTimes(), second.formattedTimes());
            assertEquals(first.toString(), second.toString());
            for (Prayer p : Prayer.values()) {
                assertEquals(first.hours(p), second.hours(p), p.displayName());
            }
        }

        @Test
        @DisplayName("Twelve hour output and description")
        void twelveHourDescription() {
            Times t = PrayTimes.compute(
                    mecca(CalculationMethod.MWL).timeFormat(TimeFormat.HOUR_12).build(),
                    epochMillis(2024, 1, 1));

            assertEquals(List.of("5:39", "6:58", "12:24", "3:29", "5:50", "7:04"), t.formattedTimes());
            assertEquals(
                    "Fajr: 5:39\nSunrise: 6:58\nDhuhr: 12:24\nAsr: 3:29\nMaghrib: 5:50\nIsha: 7:04\n",
                    t.toString());
        }

        @Test
        @DisplayName("Float output keeps the raw value")
        void floatOutput() {
            Times t = PrayTimes.compute(
                    mecca(CalculationMethod.MWL).timeFormat(TimeFormat.FLOAT).build(),
                    epochMillis(2024, 1, 1));

            assertEquals(Double.toString(t.fajr), t.formatted(Prayer.FAJR));
        }

        @Test
        @DisplayName("Instant and LocalDate entry points agree")
        void entryPointsAgree() {
            PrayerTimesConfig config = mecca(CalculationMethod.ISNA).build();
            Times fromMillis = PrayTimes.compute(config, epochMillis(2024, 3, 1));
            Times fromDate = PrayTimes.compute(config, LocalDate.of(2024, 3, 1));
            Times fromInstant = PrayTimes.compute(
                    config, LocalDateTime.of(2024, 3, 1, 0, 0).toInstant(ZoneOffset.UTC));

            assertEquals(fromMillis.formattedTimes(), fromDate.formattedTimes());
            assertEquals(fromMillis.formattedTimes(), fromInstant.formattedTimes());
        }
    }

    @Nested
    @DisplayName("Thread Safety Tests")
    class ThreadSafetyTests {

        @Test
        @DisplayName("Shared configuration used from multiple threads")
        void concurrentAccess() throws InterruptedException {
            final int threadCount = 8;
            final int iterationsPerThread = 200;
            final PrayerTimesConfig config = mecca(CalculationMethod.MWL).build();
            final String expected = PrayTimes.compute(config, epochMillis(2024, 1, 1)).toString();
            final String[] results = new String[threadCount];
            Thread[] threads = new Thread[threadCount];

            for (int i = 0; i < threadCount; i++) {
                final int threadId = i;
                threads[i] = new Thread(() -> {
                    for (int j = 0; j < iterationsPerThread; j++) {
                        results[threadId] = PrayTimes.compute(config, epochMillis(2024, 1, 1)).toString();
                    }
                });
                threads[i].start();
            }
            for (Thread thread : threads) {
                thread.join();
            }

            for (String result : results) {
                assertEquals(expected, result);
            }
        }
    }

    // Helper methods

    private static PrayerTimesConfig.Builder mecca(CalculationMethod method) {
        return PrayerTimesConfig.builder()
                .location(MECCA_LAT, MECCA_LON)
                .timeZone(3)
                .method(method)
                .asrJuristic(AsrJuristicMethod.STANDARD)
                .highLatitudeMethod(HighLatitudeMethod.NONE)
                .timeFormat(TimeFormat.HOUR_24);
    }

    private static PrayerTimesConfig.Builder oslo(HighLatitudeMethod method) {
        return PrayerTimesConfig.builder()
                .location(OSLO_LAT, OSLO_LON)
                .timeZone(1)
                .daylightSaving(1)
                .method(CalculationMethod.MWL)
                .highLatitudeMethod(method)
                .timeFormat(TimeFormat.HOUR_24);
    }

    private static long epochMillis(int year, int month, int day) {
        return LocalDateTime.of(year, month, day, 0, 0)
                .toInstant(ZoneOffset.UTC)
                .toEpochMilli();
    }
}
