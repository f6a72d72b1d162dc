package at.sv.sunmoon.time;

import org.junit.jupiter.api.Test;

import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class TimeScaleTest {

    private static ZonedDateTime utc(int year, int month, int day, int hour, int minute, int second) {
        return ZonedDateTime.of(year, month, day, hour, minute, second, 0, ZoneOffset.UTC);
    }

    @Test
    void toJulianDate_gregorian_meeusExample7a() {
        // 1957 October 4.81, launch of Sputnik 1
        assertThat(TimeScale.toJulianDate(utc(1957, 10, 4, 19, 26, 24))).isCloseTo(2436116.31, within(1e-6));
    }

    @Test
    void toJulianDate_julianCalendar_meeusExample7b() {
        assertThat(TimeScale.toJulianDate(utc(333, 1, 27, 12, 0, 0))).isCloseTo(1842713.0, within(1e-6));
    }

    @Test
    void toJulianDate_j2000() {
        assertThat(TimeScale.toJulianDate(utc(2000, 1, 1, 12, 0, 0))).isEqualTo(TimeScale.J2000);
        assertThat(TimeScale.toJulianCentury(utc(2000, 1, 1, 12, 0, 0))).isEqualTo(0.0);
        assertThat(TimeScale.toJulianCentury(utc(2100, 1, 1, 12, 0, 0))).isCloseTo(1.0, within(1e-12));
    }

    @Test
    void toJulianDate_usesUtcFields() {
        ZonedDateTime vienna = ZonedDateTime.of(2000, 1, 1, 13, 0, 0, 0, ZoneId.of("Europe/Vienna"));

        assertThat(TimeScale.toJulianDate(vienna)).isEqualTo(TimeScale.J2000);
    }

    @Test
    void toJulianDate_cutover_gregorianCorrectionStartsAtNoonOfFifteenthOfOctober() {
        double julianRule = TimeScale.toJulianDate(utc(1582, 10, 15, 11, 59, 59));
        double gregorianRule = TimeScale.toJulianDate(TimeScale.GREGORIAN_CUTOVER);

        assertThat(gregorianRule).isCloseTo(2299161.0, within(1e-9));
        // 1582-10-15 read as Julian calendar date lies ten days later
        assertThat(julianRule - gregorianRule).isCloseTo(10.0, within(1e-4));
    }

    @Test
    void toJulianDate_beforeCutoverOnFifteenthOfOctober_usesJulianRule() {
        double beforeCutover = TimeScale.toJulianDate(utc(1582, 10, 15, 6, 0, 0));

        assertThat(beforeCutover).isEqualTo(TimeScale.toJulianDate(utc(1582, 10, 25, 6, 0, 0)));
        assertThat(TimeScale.fromJulianDate(beforeCutover)).isEqualTo(utc(1582, 10, 25, 6, 0, 0));
    }

    @Test
    void fromJulianDate_meeusExamples() {
        assertThat(TimeScale.fromJulianDate(2436116.31)).isEqualTo(utc(1957, 10, 4, 19, 26, 24));
        assertThat(TimeScale.fromJulianDate(1842713.0)).isEqualTo(utc(333, 1, 27, 12, 0, 0));
        assertThat(TimeScale.fromJulianDate(2451545.0)).isEqualTo(utc(2000, 1, 1, 12, 0, 0));
        // Meeus example 7.c: 1957 October 4.81
        assertThat(TimeScale.fromJulianDate(2436116.31).toLocalDate()).hasToString("1957-10-04");
    }

    @Test
    void fromJulianDate_returnsUtc() {
        assertThat(TimeScale.fromJulianDate(2459215.5).getZone()).isEqualTo(ZoneOffset.UTC);
        assertThat(TimeScale.fromJulianDate(2459215.5)).isEqualTo(utc(2021, 1, 1, 0, 0, 0));
    }

    @Test
    void roundTrip_reproducesInstantToTheSecond() {
        ZonedDateTime cutoverGapStart = utc(1582, 10, 4, 0, 0, 0);
        ZonedDateTime cutoverGapEnd = utc(1582, 10, 16, 0, 0, 0);
        ZonedDateTime dateTime = utc(100, 1, 1, 0, 0, 0);
        ZonedDateTime end = utc(3000, 1, 1, 0, 0, 0);
        int checked = 0;
        while (dateTime.isBefore(end)) {
            if (dateTime.isBefore(cutoverGapStart) || !dateTime.isBefore(cutoverGapEnd)) {
                assertThat(TimeScale.fromJulianDate(TimeScale.toJulianDate(dateTime))).isEqualTo(dateTime);
                checked++;
            }
            dateTime = dateTime.plusSeconds(7_777_777);
        }
        assertThat(checked).isGreaterThan(10_000);
    }

    @Test
    void toJulianDate_isStrictlyIncreasing() {
        ZonedDateTime dateTime = utc(1600, 1, 1, 0, 0, 0);
        double previous = TimeScale.toJulianDate(dateTime);
        for (int i = 0; i < 20_000; i++) {
            dateTime = dateTime.plusSeconds(13 * 86_399 + 7);
            double current = TimeScale.toJulianDate(dateTime);
            assertThat(current).isGreaterThan(previous);
            previous = current;
        }
    }

    @Test
    void toJulianDate_secondsAreResolved() {
        double jd = TimeScale.toJulianDate(utc(2021, 6, 1, 0, 0, 0));
        double oneSecondLater = TimeScale.toJulianDate(utc(2021, 6, 1, 0, 0, 1));

        assertThat(oneSecondLater - jd).isCloseTo(1.0 / 86400, within(1e-9));
    }

    @Test
    void roundToNearestMinute() {
        assertThat(TimeScale.roundToNearestMinute(utc(2021, 1, 1, 7, 45, 29))).isEqualTo(utc(2021, 1, 1, 7, 45, 0));
        assertThat(TimeScale.roundToNearestMinute(utc(2021, 1, 1, 7, 45, 30))).isEqualTo(utc(2021, 1, 1, 7, 46, 0));
        assertThat(TimeScale.roundToNearestMinute(utc(2021, 12, 31, 23, 59, 45))).isEqualTo(utc(2022, 1, 1, 0, 0, 0));
    }

    @Test
    void roundToNearestMinute_isIdempotent() {
        ZonedDateTime rounded = TimeScale.roundToNearestMinute(utc(2021, 1, 1, 7, 45, 7));

        assertThat(TimeScale.roundToNearestMinute(rounded)).isEqualTo(rounded);
    }
}
