package at.sv.sunmoon;

import at.sv.sunmoon.moon.MoonPhaseKind;
import at.sv.sunmoon.sun.SunEventOutcome;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.PrintWriter;
import java.io.UncheckedIOException;
import java.time.DateTimeException;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;
import java.util.stream.Collectors;

@Command(name = "SunMoon", version = "1.0.0", mixinStandardHelpOptions = true, sortOptions = false,
        description = "Calculates sunrise, solar noon and sunset for a location, or the moon phases of a year.")
public final class SunMoon implements Runnable {

    private static final Logger LOG = LoggerFactory.getLogger(SunMoon.class);

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    @Option(names = "--lat",
            defaultValue = "${env:LAT:-0.0}",
            description = "The latitude of your location in degrees [-90..90]. Default: ${DEFAULT-VALUE}")
    double latitude;
    @Option(names = "--long",
            defaultValue = "${env:LONG:-0.0}",
            description = "The longitude of your location in degrees [-180..180], east positive. Default: ${DEFAULT-VALUE}")
    double longitude;
    @Option(names = "--date", paramLabel = "<yyyy-mm-dd>",
            description = "The date to calculate the sun events for. Default: today")
    LocalDate date;
    @Option(names = "--zone", paramLabel = "<zone>",
            defaultValue = "${env:TZ_ID}",
            description = "The IANA time zone of the results, e.g. Europe/Vienna. Default: the system time zone")
    String zone;
    @Option(names = "--moon-phases", paramLabel = "<year>",
            description = "Print all new moons, first quarters, full moons and last quarters of the given year " +
                          "instead of the sun events.")
    Integer moonPhaseYear;
    @Option(names = "--round-to-minute",
            defaultValue = "${env:ROUND_TO_MINUTE:-false}",
            description = "Round all results to the nearest minute. Default: ${DEFAULT-VALUE}")
    boolean roundToNearestMinute;
    @Option(names = "--placeholder-for-polar-events",
            defaultValue = "${env:PLACEHOLDER_FOR_POLAR_EVENTS:-false}",
            description = "Print 06:00 and 18:00 (07:00 and 19:00 during DST) followed by a marker, " +
                          "if there is no sunrise or sunset on that day. Otherwise MS (midnight sun) or " +
                          "PN (polar night) is printed. Default: ${DEFAULT-VALUE}")
    boolean returnPlaceholderForPolarEvents;
    @Option(names = "--midnight-sun-marker", paramLabel = "<marker>",
            defaultValue = EngineConfig.DEFAULT_MIDNIGHT_SUN_MARKER,
            description = "The marker appended to placeholder times on midnight sun days. Default: ${DEFAULT-VALUE}")
    String midnightSunMarker;
    @Option(names = "--polar-night-marker", paramLabel = "<marker>",
            defaultValue = EngineConfig.DEFAULT_POLAR_NIGHT_MARKER,
            description = "The marker appended to placeholder times on polar night days. Default: ${DEFAULT-VALUE}")
    String polarNightMarker;
    @Option(names = "--json",
            description = "Print the results as JSON.")
    boolean json;

    private final SunMoonCalculator calculator;
    private final Supplier<ZonedDateTime> currentTime;
    private final ObjectMapper objectMapper;
    private PrintWriter out;

    public SunMoon() {
        this(new SunMoonCalculatorImpl(), ZonedDateTime::now);
    }

    public SunMoon(SunMoonCalculator calculator, Supplier<ZonedDateTime> currentTime) {
        this.calculator = calculator;
        this.currentTime = currentTime;
        objectMapper = new ObjectMapper();
        objectMapper.enable(SerializationFeature.INDENT_OUTPUT);
    }

    public static void main(String[] args) {
        int execute = createCommandLine(new SunMoon()).execute(args);
        if (execute != 0) {
            System.exit(execute);
        }
    }

    static CommandLine createCommandLine(SunMoon sunMoon) {
        return new CommandLine(sunMoon).setExecutionExceptionHandler((e, commandLine, parseResult) -> {
            LOG.error("Calculation failed: {}", e.getMessage(), e);
            commandLine.getErr().println(e.getMessage());
            return commandLine.getCommandSpec().exitCodeOnExecutionException();
        });
    }

    @Override
    public void run() {
        MDC.put("context", "init");
        assertConfigurationParameters();
        EngineConfig config = createConfig();
        ZoneId zoneId = getZoneId();
        out = spec != null ? spec.commandLine().getOut() : new PrintWriter(System.out, true);
        try {
            if (moonPhaseYear != null) {
                MDC.put("context", "moon " + moonPhaseYear);
                printMoonPhases(moonPhaseYear, zoneId, config);
            } else {
                ZonedDateTime dateTime = getDateTime(zoneId);
                MDC.put("context", "sun " + dateTime.toLocalDate());
                printSunEvents(dateTime, config);
            }
        } finally {
            out.flush();
            MDC.remove("context");
        }
    }

    private void assertConfigurationParameters() {
        if (latitude < -90 || latitude > 90) {
            fail("--lat must be between -90 and 90 degrees");
        }
        if (longitude < -180 || longitude > 180) {
            fail("--long must be between -180 and 180 degrees");
        }
        if (midnightSunMarker == null || polarNightMarker == null) {
            fail("--midnight-sun-marker and --polar-night-marker must not be empty");
        }
    }

    private void fail(String msg) {
        if (spec != null) {
            throw new CommandLine.ParameterException(spec.commandLine(), msg);
        }
        throw new IllegalArgumentException(msg);
    }

    EngineConfig createConfig() {
        return EngineConfig.builder()
                           .roundToNearestMinute(roundToNearestMinute)
                           .returnPlaceholderForPolarEvents(returnPlaceholderForPolarEvents)
                           .midnightSunMarker(midnightSunMarker)
                           .polarNightMarker(polarNightMarker)
                           .build();
    }

    private ZoneId getZoneId() {
        if (zone == null || zone.isBlank()) {
            return currentTime.get().getZone();
        }
        try {
            return ZoneId.of(zone);
        } catch (DateTimeException e) {
            fail("Invalid --zone '" + zone + "': " + e.getMessage());
            return null;
        }
    }

    private ZonedDateTime getDateTime(ZoneId zoneId) {
        if (date == null) {
            return currentTime.get().withZoneSameInstant(zoneId).toLocalDate().atStartOfDay(zoneId);
        }
        return date.atStartOfDay(zoneId);
    }

    private void printSunEvents(ZonedDateTime dateTime, EngineConfig config) {
        LOG.info("Calculate sun events at lat={}, long={}", latitude, longitude);
        SunEventOutcome sunrise = calculator.computeSunrise(dateTime, latitude, longitude, config);
        ZonedDateTime noon = calculator.computeSolarNoon(dateTime, longitude, config);
        SunEventOutcome sunset = calculator.computeSunset(dateTime, latitude, longitude, config);
        DateTimeFormatter formatter = DateTimeFormatter.ISO_OFFSET_DATE_TIME;
        SunEventsReport report = new SunEventsReport(dateTime.toLocalDate().toString(), dateTime.getZone().getId(),
                latitude, longitude,
                EventFormatter.format(sunrise, formatter, config),
                formatter.format(noon),
                EventFormatter.format(sunset, formatter, config));
        if (json) {
            out.println(toJson(report));
        } else {
            out.println("sunrise: " + report.getSunrise());
            out.println("noon: " + report.getNoon());
            out.println("sunset: " + report.getSunset());
        }
    }

    private void printMoonPhases(int year, ZoneId zoneId, EngineConfig config) {
        LOG.info("Calculate moon phases of {} in {}", year, zoneId);
        Map<String, List<String>> phases = new LinkedHashMap<>();
        for (MoonPhaseKind kind : MoonPhaseKind.values()) {
            List<ZonedDateTime> times = calculator.computeMoonPhasesForYear(year, kind, zoneId.getId(), config);
            phases.put(kind.getDisplayName(), times.stream()
                                                   .map(DateTimeFormatter.ISO_OFFSET_DATE_TIME::format)
                                                   .collect(Collectors.toList()));
        }
        MoonPhasesReport report = new MoonPhasesReport(year, zoneId.getId(), phases);
        if (json) {
            out.println(toJson(report));
        } else {
            phases.forEach((kind, times) -> out.println(kind + ": " + String.join(", ", times)));
        }
    }

    private String toJson(Object report) {
        try {
            return objectMapper.writeValueAsString(report);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException(e);
        }
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    static final class SunEventsReport {
        private String date;
        private String zone;
        private double latitude;
        private double longitude;
        private String sunrise;
        private String noon;
        private String sunset;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    static final class MoonPhasesReport {
        private int year;
        private String zone;
        private Map<String, List<String>> phases;
    }
}
