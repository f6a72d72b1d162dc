package at.sv.sunmoon;

import at.sv.sunmoon.moon.MoonPhaseKind;
import at.sv.sunmoon.sun.SunEventOutcome;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.shredzone.commons.suncalc.MoonPhase;
import org.shredzone.commons.suncalc.SunTimes;

import java.time.DateTimeException;
import java.time.Duration;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SunMoonCalculatorImplTest {

    private static final ZoneId VIENNA = ZoneId.of("Europe/Vienna");
    private static final double LAT = 48.20;
    private static final double LONG = 16.39;

    private SunMoonCalculatorImpl calculator;
    private EngineConfig config;

    @BeforeEach
    void setUp() {
        calculator = new SunMoonCalculatorImpl();
        config = EngineConfig.defaults();
    }

    private static void assertCloseTo(ZonedDateTime actual, ZonedDateTime expected, Duration tolerance) {
        Duration difference = Duration.between(expected, actual).abs();
        assertThat(difference).as("%s vs %s", actual, expected).isLessThanOrEqualTo(tolerance);
    }

    @Test
    void sunEvents_agreeWithSuncalc_throughoutTheYear() {
        SunTimes.Parameters parameters = SunTimes.compute().at(LAT, LONG);
        ZonedDateTime start = ZonedDateTime.of(2021, 1, 1, 0, 0, 0, 0, VIENNA);
        for (int day = 0; day < 365; day += 11) {
            ZonedDateTime dateTime = start.plusDays(day);
            SunTimes expected = parameters.on(dateTime).execute();

            assertCloseTo(calculator.computeSunrise(dateTime, LAT, LONG, config).getTimeOrThrow(),
                    expected.getRise(), Duration.ofMinutes(3));
            assertCloseTo(calculator.computeSunset(dateTime, LAT, LONG, config).getTimeOrThrow(),
                    expected.getSet(), Duration.ofMinutes(3));
            assertCloseTo(calculator.computeSolarNoon(dateTime, LONG, config),
                    expected.getNoon(), Duration.ofMinutes(5));
        }
    }

    @Test
    void moonPhases_agreeWithSuncalc() {
        for (MoonPhaseKind kind : MoonPhaseKind.values()) {
            for (ZonedDateTime time : calculator.computeMoonPhasesForYear(2022, kind, "Europe/Vienna", config)) {
                ZonedDateTime searchStart = time.minusDays(3);
                ZonedDateTime expected = MoonPhase.compute()
                                                  .on(searchStart)
                                                  .phase(toSuncalcPhase(kind))
                                                  .execute()
                                                  .getTime();

                assertCloseTo(time, expected, Duration.ofMinutes(15));
            }
        }
    }

    private static MoonPhase.Phase toSuncalcPhase(MoonPhaseKind kind) {
        switch (kind) {
            case NEW_MOON:
                return MoonPhase.Phase.NEW_MOON;
            case FIRST_QUARTER:
                return MoonPhase.Phase.FIRST_QUARTER;
            case FULL_MOON:
                return MoonPhase.Phase.FULL_MOON;
            default:
                return MoonPhase.Phase.LAST_QUARTER;
        }
    }

    @Test
    void computeMoonPhasesForYear_noZone_usesUtc() {
        List<ZonedDateTime> withNull = calculator.computeMoonPhasesForYear(2021, MoonPhaseKind.FULL_MOON, null, config);
        List<ZonedDateTime> withBlank = calculator.computeMoonPhasesForYear(2021, MoonPhaseKind.FULL_MOON, " ", config);

        assertThat(withNull).isNotEmpty()
                            .allSatisfy(time -> assertThat(time.getZone()).isEqualTo(ZoneOffset.UTC))
                            .isEqualTo(withBlank);
        assertThat(withNull.get(0)).isEqualTo(ZonedDateTime.of(2021, 1, 28, 19, 16, 11, 0, ZoneOffset.UTC));
    }

    @Test
    void computeMoonPhasesForYear_invalidZone_throwsException() {
        assertThatThrownBy(() -> calculator.computeMoonPhasesForYear(2021, MoonPhaseKind.NEW_MOON, "Mars/Olympus_Mons", config))
                .isInstanceOf(DateTimeException.class);
    }

    @Test
    void concurrentCalls_withDifferentConfigs_doNotAffectEachOther() throws Exception {
        EngineConfig rounding = EngineConfig.builder().roundToNearestMinute(true).build();
        EngineConfig exact = EngineConfig.defaults();
        ZonedDateTime dateTime = ZonedDateTime.of(2021, 6, 21, 0, 0, 0, 0, VIENNA);
        ExecutorService executor = Executors.newFixedThreadPool(4);
        try {
            List<Callable<SunEventOutcome>> tasks = new ArrayList<>();
            for (int i = 0; i < 40; i++) {
                EngineConfig taskConfig = i % 2 == 0 ? rounding : exact;
                tasks.add(() -> calculator.computeSunrise(dateTime, LAT, LONG, taskConfig));
            }
            List<Future<SunEventOutcome>> results = executor.invokeAll(tasks);
            for (int i = 0; i < results.size(); i++) {
                ZonedDateTime sunrise = results.get(i).get().getTimeOrThrow();
                if (i % 2 == 0) {
                    assertThat(sunrise).isEqualTo(ZonedDateTime.of(2021, 6, 21, 4, 54, 0, 0, VIENNA));
                } else {
                    assertThat(sunrise).isEqualTo(ZonedDateTime.of(2021, 6, 21, 4, 53, 55, 0, VIENNA));
                }
            }
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    void toDebugString() {
        ZonedDateTime dateTime = ZonedDateTime.of(2021, 1, 1, 0, 0, 0, 0, VIENNA);

        assertThat(calculator.toDebugString(dateTime, LAT, LONG, config))
                .isEqualTo("sunrise: 07:45:07\nnoon: 11:58:06\nsunset: 16:11:15");
    }

    @Test
    void toDebugString_polarNight_withPlaceholder_appendsMarker() {
        config = EngineConfig.builder().returnPlaceholderForPolarEvents(true).polarNightMarker("*").build();
        ZonedDateTime dateTime = ZonedDateTime.of(2020, 12, 21, 0, 0, 0, 0, ZoneId.of("Europe/Oslo"));

        assertThat(calculator.toDebugString(dateTime, 69.65, 18.96, config))
                .startsWith("sunrise: 06:00:00*\nnoon: ")
                .endsWith("\nsunset: 18:00:00*");
    }
}
