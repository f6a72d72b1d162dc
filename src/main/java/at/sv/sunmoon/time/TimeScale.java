package at.sv.sunmoon.time;

import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.temporal.ChronoUnit;

/**
 * Conversion between calendar instants and Julian Dates (Meeus, chapter 7).
 */
public final class TimeScale {

    public static final double J2000 = 2451545.0;
    public static final double DAYS_PER_CENTURY = 36525.0;

    /**
     * Instants at or after this moment use the Gregorian leap year rule.
     */
    public static final ZonedDateTime GREGORIAN_CUTOVER = ZonedDateTime.of(1582, 10, 15, 12, 0, 0, 0, ZoneOffset.UTC);

    private static final int FIRST_GREGORIAN_DAY_NUMBER = 2299161;
    private static final int SECONDS_PER_DAY = 86400;

    private TimeScale() {
    }

    public static double toJulianDate(ZonedDateTime dateTime) {
        ZonedDateTime utc = dateTime.withZoneSameInstant(ZoneOffset.UTC);
        int year = utc.getYear();
        int month = utc.getMonthValue();
        double day = utc.getDayOfMonth() + (utc.getHour() + (utc.getMinute() + utc.getSecond() / 60.0) / 60.0) / 24.0;
        if (month < 3) {
            year -= 1;
            month += 12;
        }
        int b = 0;
        if (!utc.isBefore(GREGORIAN_CUTOVER)) {
            int a = Math.floorDiv(year, 100);
            b = 2 - a + Math.floorDiv(a, 4);
        }
        return Math.floor(365.25 * (year + 4716)) + Math.floor(30.6001 * (month + 1)) + day + b - 1524.5;
    }

    /**
     * Converts the Julian Date back to a UTC date time, rounded to the nearest second.
     */
    public static ZonedDateTime fromJulianDate(double julianDate) {
        double jd = julianDate + 0.5;
        long z = (long) Math.floor(jd);
        double f = jd - z;
        long a = z;
        if (z >= FIRST_GREGORIAN_DAY_NUMBER) {
            long alpha = (long) Math.floor((z - 1867216.25) / 36524.25);
            a += 1 + alpha - Math.floorDiv(alpha, 4);
        }
        long b = a + 1524;
        long c = (long) Math.floor((b - 122.1) / 365.25);
        long d = (long) Math.floor(365.25 * c);
        long e = (long) Math.floor((b - d) / 30.6001);
        double fractionalDay = b - d - Math.floor(30.6001 * e) + f;
        int day = (int) Math.floor(fractionalDay);
        long secondOfDay = Math.round((fractionalDay - day) * SECONDS_PER_DAY);
        int month = (int) (e < 14 ? e - 1 : e - 13);
        int year = (int) (month > 2 ? c - 4716 : c - 4715);
        // day may not exist in the proleptic Gregorian calendar (e.g. Julian 1500-02-29)
        return LocalDate.of(year, month, 1).plusDays(day - 1).atStartOfDay(ZoneOffset.UTC).plusSeconds(secondOfDay);
    }

    /**
     * Rounds to the nearest whole minute; half a minute rounds up. Minute aligned values are returned unchanged.
     */
    public static ZonedDateTime roundToNearestMinute(ZonedDateTime dateTime) {
        return dateTime.plusSeconds(30).truncatedTo(ChronoUnit.MINUTES);
    }

    public static double julianDateToCentury(double julianDate) {
        return (julianDate - J2000) / DAYS_PER_CENTURY;
    }

    public static double toJulianCentury(ZonedDateTime dateTime) {
        return julianDateToCentury(toJulianDate(dateTime));
    }
}
