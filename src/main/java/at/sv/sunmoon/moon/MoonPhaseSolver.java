package at.sv.sunmoon.moon;

import at.sv.sunmoon.EngineConfig;
import at.sv.sunmoon.time.DeltaT;
import at.sv.sunmoon.time.TimeScale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import static at.sv.sunmoon.astro.AngleMath.cosd;
import static at.sv.sunmoon.astro.AngleMath.sind;

/**
 * Instants of the principal moon phases (Meeus, chapter 49).
 */
public final class MoonPhaseSolver {

    private static final Logger LOG = LoggerFactory.getLogger(MoonPhaseSolver.class);

    /**
     * Number of consecutive lunations examined per year. A calendar year spans at most 13 occurrences of a
     * phase, the search starts up to two lunations early.
     */
    static final int LUNATIONS_PER_SEARCH = 15;

    private static final double LUNATIONS_PER_YEAR = 12.3685;
    private static final double LUNATIONS_PER_CENTURY = 1236.85;

    private MoonPhaseSolver() {
    }

    /**
     * Calculates all moons of the given phase within the calendar year, as observed in the given zone.
     *
     * @param year   the calendar year
     * @param kind   the phase to look for
     * @param zone   the zone the year boundaries and the results refer to
     * @param config the engine options
     * @return the instants in chronological order, usually one per month
     */
    public static List<ZonedDateTime> phasesInYear(int year, MoonPhaseKind kind, ZoneId zone, EngineConfig config) {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(zone, "zone");
        Objects.requireNonNull(config, "config");
        ZonedDateTime yearBegin = ZonedDateTime.of(year, 1, 1, 0, 0, 0, 0, zone);
        ZonedDateTime yearEnd = yearBegin.plusYears(1);
        // the first lunation of the year or an earlier one
        long k = (long) Math.floor(approximateLunation(yearBegin)) - 1;
        List<ZonedDateTime> phases = new ArrayList<>();
        for (int i = 0; i < LUNATIONS_PER_SEARCH; i++, k++) {
            ZonedDateTime time = toUniversalTime(truePhase(k, kind), config).withZoneSameInstant(zone);
            if (time.isAfter(yearBegin) && time.isBefore(yearEnd)) {
                phases.add(time);
            } else {
                LOG.trace("Skip {} of lunation {} outside of {}: {}", kind.getDisplayName(), k, year, time);
            }
        }
        LOG.debug("Found {} {} instants in {}", phases.size(), kind.getDisplayName(), year);
        return phases;
    }

    /**
     * Approximate number of lunations since the new moon of 2000-01-06.
     */
    static double approximateLunation(ZonedDateTime dateTime) {
        double year = dateTime.getYear() + dateTime.getMonthValue() / 12.0 + dateTime.getDayOfMonth() / 365.25;
        return (year - 2000) * LUNATIONS_PER_YEAR;
    }

    /**
     * Treats the ephemeris time as Julian Date and subtracts ΔT.
     */
    private static ZonedDateTime toUniversalTime(double julianEphemerisDay, EngineConfig config) {
        ZonedDateTime time = TimeScale.fromJulianDate(julianEphemerisDay);
        time = time.minusSeconds(Math.round(DeltaT.seconds(time)));
        if (config.isRoundToNearestMinute()) {
            time = TimeScale.roundToNearestMinute(time);
        }
        return time;
    }

    /**
     * Calculates the true phase of the moon as Julian Ephemeris Day.
     *
     * @param k    the lunation, counted in new moons since 2000-01-06. Integer values correspond to new moons.
     * @param kind the phase, added as fraction of the lunation
     * @return the Julian Ephemeris Day of the phase
     */
    public static double truePhase(double k, MoonPhaseKind kind) {
        k += kind.lunationOffset();
        double t = k / LUNATIONS_PER_CENTURY;
        double e = eccentricityCorrection(t);
        double m = sunMeanAnomaly(t, k);
        double mPrime = moonMeanAnomaly(t, k);
        double f = moonArgumentOfLatitude(t, k);
        double omega = moonAscendingNodeLongitude(t, k);
        double correction = switch (kind) {
            case NEW_MOON, FULL_MOON -> newAndFullMoonCorrection(kind, e, m, mPrime, f, omega);
            case FIRST_QUARTER, LAST_QUARTER -> quarterCorrection(kind, e, m, mPrime, f, omega);
        };
        return meanPhase(t, k) + correction + planetaryCorrection(t, k);
    }

    static double meanPhase(double t, double k) {
        return 2451550.09766 + 29.530588861 * k + 0.00015437 * t * t - 0.000000150 * t * t * t
               + 0.00000000073 * t * t * t * t;
    }

    private static double eccentricityCorrection(double t) {
        return 1 - 0.002516 * t - 0.0000074 * t * t;
    }

    private static double sunMeanAnomaly(double t, double k) {
        return 2.5534 + 29.10535670 * k - 0.0000014 * t * t - 0.00000011 * t * t * t;
    }

    private static double moonMeanAnomaly(double t, double k) {
        return 201.5643 + 385.81693528 * k + 0.0107582 * t * t + 0.00001238 * t * t * t
               - 0.000000058 * t * t * t * t;
    }

    private static double moonArgumentOfLatitude(double t, double k) {
        return 160.7108 + 390.67050284 * k - 0.0016118 * t * t - 0.00000227 * t * t * t
               + 0.000000011 * t * t * t * t;
    }

    private static double moonAscendingNodeLongitude(double t, double k) {
        return 124.7746 - 1.56375588 * k + 0.0020672 * t * t + 0.00000215 * t * t * t;
    }

    private static double newAndFullMoonCorrection(MoonPhaseKind kind, double e, double m, double mPrime, double f,
                                                   double omega) {
        double correction = -0.00111 * sind(mPrime - 2 * f)
                            - 0.00057 * sind(mPrime + 2 * f)
                            + 0.00056 * e * sind(2 * mPrime + m)
                            - 0.00042 * sind(3 * mPrime)
                            + 0.00042 * e * sind(m + 2 * f)
                            + 0.00038 * e * sind(m - 2 * f)
                            - 0.00024 * e * sind(2 * mPrime - m)
                            - 0.00017 * sind(omega)
                            - 0.00007 * sind(mPrime + 2 * m)
                            + 0.00004 * sind(2 * mPrime - 2 * f)
                            + 0.00004 * sind(3 * m)
                            + 0.00003 * sind(mPrime + m - 2 * f)
                            + 0.00003 * sind(2 * mPrime + 2 * f)
                            - 0.00003 * sind(mPrime + m + 2 * f)
                            + 0.00003 * sind(mPrime - m + 2 * f)
                            - 0.00002 * sind(mPrime - m - 2 * f)
                            - 0.00002 * sind(3 * mPrime + m)
                            + 0.00002 * sind(4 * mPrime);
        if (kind == MoonPhaseKind.NEW_MOON) {
            correction += -0.40720 * sind(mPrime)
                          + 0.17241 * e * sind(m)
                          + 0.01608 * sind(2 * mPrime)
                          + 0.01039 * sind(2 * f)
                          + 0.00739 * e * sind(mPrime - m)
                          - 0.00514 * e * sind(mPrime + m)
                          + 0.00208 * e * e * sind(2 * m);
        } else {
            correction += -0.40614 * sind(mPrime)
                          + 0.17302 * e * sind(m)
                          + 0.01614 * sind(2 * mPrime)
                          + 0.01043 * sind(2 * f)
                          + 0.00734 * e * sind(mPrime - m)
                          - 0.00515 * e * sind(mPrime + m)
                          + 0.00209 * e * e * sind(2 * m);
        }
        return correction;
    }

    private static double quarterCorrection(MoonPhaseKind kind, double e, double m, double mPrime, double f,
                                            double omega) {
        double correction = -0.62801 * sind(mPrime)
                            + 0.17172 * e * sind(m)
                            - 0.01183 * e * sind(mPrime + m)
                            + 0.00862 * sind(2 * mPrime)
                            + 0.00804 * sind(2 * f)
                            + 0.00454 * e * sind(mPrime - m)
                            + 0.00204 * e * e * sind(2 * m)
                            - 0.00180 * sind(mPrime - 2 * f)
                            - 0.00070 * sind(mPrime + 2 * f)
                            - 0.00040 * sind(3 * mPrime)
                            - 0.00034 * e * sind(2 * mPrime - m)
                            + 0.00032 * e * sind(m + 2 * f)
                            + 0.00032 * e * sind(m - 2 * f)
                            - 0.00028 * e * e * sind(mPrime + 2 * m)
                            + 0.00027 * e * sind(2 * mPrime + m)
                            - 0.00017 * sind(omega)
                            - 0.00005 * sind(mPrime - m - 2 * f)
                            + 0.00004 * sind(2 * mPrime + 2 * f)
                            - 0.00004 * sind(mPrime + m + 2 * f)
                            + 0.00004 * sind(mPrime - 2 * m)
                            + 0.00003 * sind(mPrime + m - 2 * f)
                            + 0.00003 * sind(3 * m)
                            + 0.00002 * sind(2 * mPrime - 2 * f)
                            + 0.00002 * sind(mPrime - m + 2 * f)
                            - 0.00002 * sind(3 * mPrime + m);
        double w = 0.00306
                   - 0.00038 * e * cosd(m)
                   + 0.00026 * cosd(mPrime)
                   - 0.00002 * cosd(mPrime - m)
                   + 0.00002 * cosd(mPrime + m)
                   + 0.00002 * cosd(2 * f);
        return kind == MoonPhaseKind.FIRST_QUARTER ? correction + w : correction - w;
    }

    /**
     * Additional corrections for all phases, from the planetary arguments A1 to A14.
     */
    private static double planetaryCorrection(double t, double k) {
        return 0.000325 * sind(299.77 + 0.107408 * k - 0.009173 * t * t)
               + 0.000165 * sind(251.88 + 0.016321 * k)
               + 0.000164 * sind(251.83 + 26.651886 * k)
               + 0.000126 * sind(349.42 + 36.412478 * k)
               + 0.000110 * sind(84.66 + 18.206239 * k)
               + 0.000062 * sind(141.74 + 53.303771 * k)
               + 0.000060 * sind(207.14 + 2.453732 * k)
               + 0.000056 * sind(154.84 + 7.306860 * k)
               + 0.000047 * sind(34.52 + 27.261239 * k)
               + 0.000042 * sind(207.19 + 0.121824 * k)
               + 0.000040 * sind(291.34 + 1.844379 * k)
               + 0.000037 * sind(161.72 + 24.198154 * k)
               + 0.000035 * sind(239.56 + 25.513099 * k)
               + 0.000023 * sind(331.55 + 3.592518 * k);
    }
}
