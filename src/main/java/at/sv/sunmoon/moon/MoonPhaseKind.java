package at.sv.sunmoon.moon;

import java.util.Locale;

public enum MoonPhaseKind {
    NEW_MOON(0),
    FIRST_QUARTER(1),
    FULL_MOON(2),
    LAST_QUARTER(3);

    private final int index;

    MoonPhaseKind(int index) {
        this.index = index;
    }

    /**
     * @return the position within a lunation, 0 for new moon up to 3 for last quarter
     */
    public int getIndex() {
        return index;
    }

    /**
     * Fraction of a lunation after the new moon.
     */
    double lunationOffset() {
        return index / 4.0;
    }

    public static MoonPhaseKind fromIndex(int index) {
        for (MoonPhaseKind kind : values()) {
            if (kind.index == index) {
                return kind;
            }
        }
        throw new IllegalArgumentException("Unknown moon phase index " + index + ". Supported: 0 (new moon), " +
                                           "1 (first quarter), 2 (full moon), 3 (last quarter)");
    }

    public String getDisplayName() {
        return name().toLowerCase(Locale.ROOT).replace('_', ' ');
    }
}
