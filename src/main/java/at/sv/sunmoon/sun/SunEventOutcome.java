package at.sv.sunmoon.sun;

import lombok.AccessLevel;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.time.ZonedDateTime;
import java.util.Objects;
import java.util.Optional;

/**
 * Result of a sunrise or sunset computation: either the time of the event, or the reason why the event
 * does not happen on that day.
 */
@Getter
@EqualsAndHashCode
@RequiredArgsConstructor(access = AccessLevel.PRIVATE)
public final class SunEventOutcome {

    public enum Type {
        EVENT,
        /**
         * The sun stays above the horizon the whole day.
         */
        MIDNIGHT_SUN,
        /**
         * The sun stays below the horizon the whole day.
         */
        POLAR_NIGHT
    }

    private final Type type;
    @Getter(AccessLevel.NONE)
    private final ZonedDateTime time;
    /**
     * If {@link #getTime()} is a substitute time for a {@link Type#MIDNIGHT_SUN} or {@link Type#POLAR_NIGHT} day.
     */
    private final boolean placeholder;

    public static SunEventOutcome event(ZonedDateTime time) {
        return new SunEventOutcome(Type.EVENT, Objects.requireNonNull(time, "time"), false);
    }

    public static SunEventOutcome midnightSun() {
        return new SunEventOutcome(Type.MIDNIGHT_SUN, null, false);
    }

    public static SunEventOutcome polarNight() {
        return new SunEventOutcome(Type.POLAR_NIGHT, null, false);
    }

    public static SunEventOutcome placeholder(Type type, ZonedDateTime time) {
        if (type == Type.EVENT) {
            throw new IllegalArgumentException("Placeholders are only supported for polar days and nights");
        }
        return new SunEventOutcome(type, Objects.requireNonNull(time, "time"), true);
    }

    public boolean isEvent() {
        return type == Type.EVENT;
    }

    public boolean isPolar() {
        return type != Type.EVENT;
    }

    /**
     * @return the event time, or the placeholder time; empty for a bare polar classification
     */
    public Optional<ZonedDateTime> getTime() {
        return Optional.ofNullable(time);
    }

    /**
     * @throws IllegalStateException if there is neither an event nor a placeholder time
     */
    public ZonedDateTime getTimeOrThrow() {
        if (time == null) {
            throw new IllegalStateException("No time available: " + this);
        }
        return time;
    }

    @Override
    public String toString() {
        if (time == null) {
            return type.name();
        }
        return type.name() + (placeholder ? " (placeholder) " : " ") + time;
    }
}
