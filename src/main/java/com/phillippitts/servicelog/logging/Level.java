package com.phillippitts.servicelog.logging;

import com.phillippitts.servicelog.exception.InvalidLevelException;

import java.util.Locale;

/**
 * Severity levels, ordered by rank. Only these five values exist; ad hoc levels are not allowed.
 */
public enum Level {
    DEBUG(0),
    INFO(1),
    WARNING(2),
    ERROR(3),
    FATAL(4);

    private final int rank;

    Level(int rank) {
        this.rank = rank;
    }

    public int rank() {
        return rank;
    }

    /**
     * Returns true if this level passes a filter configured at {@code minimum}.
     */
    public boolean isAtLeast(Level minimum) {
        return rank >= minimum.rank;
    }

    /**
     * @return true iff {@code rank} identifies one of the five levels
     */
    public static boolean isValid(int rank) {
        return rank >= DEBUG.rank && rank <= FATAL.rank;
    }

    /**
     * Canonical uppercase name for a rank, or an empty string when the rank is invalid.
     */
    public static String nameOf(int rank) {
        return isValid(rank) ? values()[rank].name() : "";
    }

    /**
     * @throws InvalidLevelException if the rank is out of range
     */
    public static Level fromRank(int rank) {
        if (!isValid(rank)) {
            throw new InvalidLevelException(rank);
        }
        return values()[rank];
    }

    /**
     * Parses a level name, ignoring case and surrounding whitespace.
     *
     * @throws InvalidLevelException if the name is null or unknown
     */
    public static Level parse(String name) {
        if (name == null) {
            throw new InvalidLevelException((String) null);
        }
        String normalized = name.trim().toUpperCase(Locale.ROOT);
        for (Level level : values()) {
            if (level.name().equals(normalized)) {
                return level;
            }
        }
        throw new InvalidLevelException(name);
    }
}
