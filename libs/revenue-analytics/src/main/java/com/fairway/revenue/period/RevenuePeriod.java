package com.fairway.revenue.period;

import com.fairway.eventmodel.DateRange;
import com.fairway.revenue.RevenueException;

import java.math.BigDecimal;
import java.math.MathContext;
import java.time.DayOfWeek;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.YearMonth;
import java.time.ZoneOffset;
import java.time.temporal.TemporalAdjusters;

/**
 * A concrete, half-open time bucket {@code [start, end)}.
 *
 * <p>Calendar buckets are aligned in UTC; weeks start on Monday. Consecutive calendar buckets of
 * one granularity are contiguous and never overlap. A {@link Granularity#CUSTOM} period carries an
 * explicit window; its {@link #previous()} is the window of equal length ending at its start.
 *
 * @param granularity bucket size
 * @param start       inclusive start
 * @param end         exclusive end, strictly after start
 */
public record RevenuePeriod(Granularity granularity, Instant start, Instant end) {

    private static final BigDecimal SECONDS_PER_DAY = BigDecimal.valueOf(86_400);

    public RevenuePeriod {
        if (granularity == null || start == null || end == null) {
            throw RevenueException.invalidPeriod("granularity, start and end are required");
        }
        if (!start.isBefore(end)) {
            throw RevenueException.invalidPeriod("start " + start + " must be before end " + end);
        }
    }

    /**
     * The calendar bucket of {@code granularity} that contains {@code instant}.
     *
     * @throws RevenueException INVALID_PERIOD for {@link Granularity#CUSTOM}
     */
    public static RevenuePeriod containing(Granularity granularity, Instant instant) {
        LocalDate day = LocalDate.ofInstant(instant, ZoneOffset.UTC);
        LocalDate first;
        LocalDate next;
        switch (granularity) {
            case DAILY -> {
                first = day;
                next = day.plusDays(1);
            }
            case WEEKLY -> {
                first = day.with(TemporalAdjusters.previousOrSame(DayOfWeek.MONDAY));
                next = first.plusWeeks(1);
            }
            case MONTHLY -> {
                first = day.withDayOfMonth(1);
                next = first.plusMonths(1);
            }
            case QUARTERLY -> {
                int firstMonth = ((day.getMonthValue() - 1) / 3) * 3 + 1;
                first = LocalDate.of(day.getYear(), firstMonth, 1);
                next = first.plusMonths(3);
            }
            case YEARLY -> {
                first = LocalDate.of(day.getYear(), 1, 1);
                next = first.plusYears(1);
            }
            case CUSTOM -> throw RevenueException.invalidPeriod("a custom period needs explicit bounds");
            default -> throw new IllegalStateException("Unhandled granularity " + granularity);
        }
        return new RevenuePeriod(granularity, startOfDay(first), startOfDay(next));
    }

    public static RevenuePeriod custom(Instant start, Instant end) {
        return new RevenuePeriod(Granularity.CUSTOM, start, end);
    }

    public static RevenuePeriod month(YearMonth month) {
        return containing(Granularity.MONTHLY, startOfDay(month.atDay(1)));
    }

    public static RevenuePeriod day(LocalDate day) {
        return containing(Granularity.DAILY, startOfDay(day));
    }

    /** Quarter {@code 1..4} of {@code year}. */
    public static RevenuePeriod quarter(int year, int quarter) {
        if (quarter < 1 || quarter > 4) {
            throw RevenueException.invalidPeriod("quarter must be 1..4, was " + quarter);
        }
        return containing(Granularity.QUARTERLY, startOfDay(LocalDate.of(year, (quarter - 1) * 3 + 1, 1)));
    }

    /** The adjacent bucket immediately before this one. */
    public RevenuePeriod previous() {
        if (granularity == Granularity.CUSTOM) {
            Duration length = Duration.between(start, end);
            return custom(start.minus(length), start);
        }
        return containing(granularity, start.minusNanos(1));
    }

    /** The adjacent bucket immediately after this one. */
    public RevenuePeriod next() {
        if (granularity == Granularity.CUSTOM) {
            Duration length = Duration.between(start, end);
            return custom(end, end.plus(length));
        }
        return containing(granularity, end);
    }

    /** The same bucket one year earlier; only defined for calendar buckets of a month or longer. */
    public RevenuePeriod yearEarlier() {
        return switch (granularity) {
            case MONTHLY, QUARTERLY, YEARLY -> containing(granularity,
                    LocalDate.ofInstant(start, ZoneOffset.UTC).minusYears(1)
                            .atStartOfDay().toInstant(ZoneOffset.UTC));
            case DAILY, WEEKLY, CUSTOM -> throw RevenueException.invalidPeriod(
                    granularity.value() + " periods have no year-earlier counterpart");
        };
    }

    public boolean isCalendarAligned() {
        return granularity != Granularity.CUSTOM;
    }

    /** True once the whole bucket lies at or before {@code instant}. */
    public boolean isCompleteAt(Instant instant) {
        return !end.isAfter(instant);
    }

    public boolean overlaps(RevenuePeriod other) {
        return start.isBefore(other.end) && other.start.isBefore(end);
    }

    public boolean contains(Instant instant) {
        return !instant.isBefore(start) && instant.isBefore(end);
    }

    public DateRange toDateRange() {
        return DateRange.of(start, end);
    }

    /**
     * Length in days, fractional for custom windows that do not fall on day boundaries. Always
     * positive, sub-second windows included.
     */
    public BigDecimal lengthInDays() {
        Duration length = Duration.between(start, end);
        BigDecimal seconds = BigDecimal.valueOf(length.getSeconds())
                .add(BigDecimal.valueOf(length.getNano(), 9));
        return seconds.divide(SECONDS_PER_DAY, MathContext.DECIMAL64);
    }

    /** Human-readable label, e.g. {@code 2024-03} or {@code 2024-Q1}. */
    public String label() {
        LocalDate first = LocalDate.ofInstant(start, ZoneOffset.UTC);
        return switch (granularity) {
            case DAILY -> first.toString();
            case WEEKLY -> "week of " + first;
            case MONTHLY -> YearMonth.from(first).toString();
            case QUARTERLY -> first.getYear() + "-Q" + ((first.getMonthValue() - 1) / 3 + 1);
            case YEARLY -> Integer.toString(first.getYear());
            case CUSTOM -> start + "/" + end;
        };
    }

    private static Instant startOfDay(LocalDate day) {
        return day.atStartOfDay().toInstant(ZoneOffset.UTC);
    }
}
