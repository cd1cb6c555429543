package com.taskboard.servicebackend.task;

import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Task priority. {@link #rank()} defines the listing order: lower rank sorts first.
 */
public enum Priority {
    LOW("low", 2),
    MEDIUM("medium", 1),
    HIGH("high", 0);

    private static final Comparator<Priority> BY_RANK = Comparator.comparingInt(Priority::rank);

    private final String code;
    private final int rank;

    Priority(String code, int rank) {
        this.code = code;
        this.rank = rank;
    }

    /** Wire and column value. */
    public String code() {
        return code;
    }

    public int rank() {
        return rank;
    }

    public static Optional<Priority> fromCode(String code) {
        if (code == null) {
            return Optional.empty();
        }
        return Arrays.stream(values())
                .filter(p -> p.code.equals(code))
                .findFirst();
    }

    /** All priorities, highest first. */
    public static List<Priority> byRank() {
        return Arrays.stream(values()).sorted(BY_RANK).toList();
    }
}
