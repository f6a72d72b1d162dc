package at.sv.sunmoon;

import lombok.Builder;
import lombok.Data;

/**
 * Options for a single computation. Instances are immutable and passed into every call, so callers with
 * different options never affect each other.
 */
@Data
@Builder(toBuilder = true)
public final class EngineConfig {

    public static final String DEFAULT_MIDNIGHT_SUN_MARKER = "‡";
    public static final String DEFAULT_POLAR_NIGHT_MARKER = "†";

    /**
     * Snap all results to whole minutes.
     */
    private final boolean roundToNearestMinute;
    /**
     * Return 06:00 / 18:00 local time instead of a bare classification on days without sunrise or sunset.
     */
    private final boolean returnPlaceholderForPolarEvents;
    @Builder.Default
    private final String midnightSunMarker = DEFAULT_MIDNIGHT_SUN_MARKER;
    @Builder.Default
    private final String polarNightMarker = DEFAULT_POLAR_NIGHT_MARKER;

    public static EngineConfig defaults() {
        return builder().build();
    }
}
