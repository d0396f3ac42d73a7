package dev.evalkit.cost;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import dev.evalkit.error.EvalException;
import java.time.DayOfWeek;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.temporal.ChronoUnit;
import java.time.temporal.TemporalAdjusters;
import java.util.Locale;

/** Budget windows, aligned to UTC calendar boundaries. */
public enum BudgetPeriod {
    HOURLY,
    DAILY,
    /** ISO week, starting Monday 00:00 UTC. */
    WEEKLY,
    MONTHLY;

    /** Start of the window containing {@code at}. */
    public Instant windowStart(Instant at) {
        var utc = at.atOffset(ZoneOffset.UTC);
        return switch (this) {
            case HOURLY -> utc.truncatedTo(ChronoUnit.HOURS).toInstant();
            case DAILY -> utc.truncatedTo(ChronoUnit.DAYS).toInstant();
            case WEEKLY ->
                    utc.truncatedTo(ChronoUnit.DAYS)
                            .with(TemporalAdjusters.previousOrSame(DayOfWeek.MONDAY))
                            .toInstant();
            case MONTHLY ->
                    utc.truncatedTo(ChronoUnit.DAYS)
                            .with(TemporalAdjusters.firstDayOfMonth())
                            .toInstant();
        };
    }

    /** Start of the window following the one that starts at {@code windowStart}. */
    public Instant nextWindowStart(Instant windowStart) {
        var utc = windowStart.atOffset(ZoneOffset.UTC);
        return switch (this) {
            case HOURLY -> utc.plusHours(1).toInstant();
            case DAILY -> utc.plusDays(1).toInstant();
            case WEEKLY -> utc.plusWeeks(1).toInstant();
            case MONTHLY -> utc.plusMonths(1).toInstant();
        };
    }

    @JsonValue
    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static BudgetPeriod fromName(String name) {
        try {
            return valueOf(name.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw EvalException.configuration("unknown budget period '%s'".formatted(name));
        }
    }
}
