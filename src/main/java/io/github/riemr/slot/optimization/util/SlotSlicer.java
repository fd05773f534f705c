package io.github.riemr.slot.optimization.util;

import io.github.riemr.slot.domain.ScheduleValidationException;
import io.github.riemr.slot.domain.model.ActivePeriod;
import io.github.riemr.slot.domain.model.BreakPattern;
import io.github.riemr.slot.optimization.entity.Slot;

import java.time.Duration;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

public final class SlotSlicer {
    private SlotSlicer() {}

    public static final LocalTime DEFAULT_DAY_START = LocalTime.of(9, 0);
    public static final LocalTime DEFAULT_DAY_END = LocalTime.of(17, 0);

    /**
     * Lays whole slots of {@code slotLength} over the active portions of [horizonStart, horizonEnd).
     * Slots are aligned to the start of each (merged) active period; a slot is emitted only if it fits
     * entirely inside both the period and the horizon.
     */
    public static List<Slot> slice(LocalDateTime horizonStart, LocalDateTime horizonEnd,
                                   Collection<ActivePeriod> activePeriods, Duration slotLength) {
        return slice(horizonStart, horizonEnd, activePeriods, slotLength, BreakPattern.NONE);
    }

    /**
     * Same as {@link #slice(LocalDateTime, LocalDateTime, Collection, Duration)}, but leaves the gaps of
     * {@code breaks} after each slot. The break count restarts at every merged period and also counts
     * slots that fall before the horizon, so the layout inside a period does not depend on horizonStart.
     */
    public static List<Slot> slice(LocalDateTime horizonStart, LocalDateTime horizonEnd,
                                   Collection<ActivePeriod> activePeriods, Duration slotLength,
                                   BreakPattern breaks) {
        Objects.requireNonNull(horizonStart, "horizonStart");
        Objects.requireNonNull(breaks, "breaks");
        Objects.requireNonNull(horizonEnd, "horizonEnd");
        requirePositive(slotLength);
        if (!horizonEnd.isAfter(horizonStart)) {
            throw new ScheduleValidationException("Empty horizon: " + horizonStart + " .. " + horizonEnd);
        }

        List<Slot> res = new ArrayList<>();
        for (ActivePeriod period : merge(activePeriods)) {
            LocalDateTime cur = period.start();
            int inRun = 0;
            while (!cur.plus(slotLength).isAfter(period.end())) {
                LocalDateTime next = cur.plus(slotLength);
                if (next.isAfter(horizonEnd)) break;
                if (!cur.isBefore(horizonStart)) {
                    res.add(new Slot(res.size(), cur, next));
                }
                inRun++;
                cur = next.plus(breaks.gapAfter(inRun));
            }
        }
        return res;
    }

    /** Sorts periods by start and merges overlapping or touching ones. */
    public static List<ActivePeriod> merge(Collection<ActivePeriod> activePeriods) {
        if (activePeriods == null || activePeriods.isEmpty()) return List.of();
        for (ActivePeriod p : activePeriods) {
            if (p == null || p.isMalformed()) {
                throw new ScheduleValidationException("Malformed active period: " + p);
            }
        }
        List<ActivePeriod> sorted = activePeriods.stream()
                .sorted(Comparator.comparing(ActivePeriod::start).thenComparing(ActivePeriod::end))
                .toList();

        List<ActivePeriod> res = new ArrayList<>();
        ActivePeriod run = sorted.get(0);
        for (int i = 1; i < sorted.size(); i++) {
            ActivePeriod cur = sorted.get(i);
            if (run.overlapsOrTouches(cur)) {
                LocalDateTime end = cur.end().isAfter(run.end()) ? cur.end() : run.end();
                run = new ActivePeriod(run.start(), end);
            } else {
                res.add(run);
                run = cur;
            }
        }
        res.add(run);
        return res;
    }

    /** One active period per day in [from, to], each spanning dayStart..dayEnd. */
    public static List<ActivePeriod> daily(LocalDate from, LocalDate to, LocalTime dayStart, LocalTime dayEnd) {
        Objects.requireNonNull(from, "from");
        Objects.requireNonNull(to, "to");
        if (dayStart == null || dayEnd == null || dayEnd.isBefore(dayStart)) {
            throw new ScheduleValidationException("Malformed daily window: " + dayStart + " .. " + dayEnd);
        }
        List<ActivePeriod> res = new ArrayList<>();
        for (LocalDate d = from; !d.isAfter(to); d = d.plusDays(1)) {
            res.add(new ActivePeriod(d.atTime(dayStart), d.atTime(dayEnd)));
        }
        return res;
    }

    public static List<ActivePeriod> daily(LocalDate from, LocalDate to) {
        return daily(from, to, DEFAULT_DAY_START, DEFAULT_DAY_END);
    }

    /** Number of whole slots needed to cover {@code length}, rounded up. */
    public static int slotsRequired(Duration length, Duration slotLength) {
        Objects.requireNonNull(length, "length");
        requirePositive(slotLength);
        if (length.isNegative() || length.isZero()) return 0;
        try {
            long whole = length.dividedBy(slotLength);
            long n = slotLength.multipliedBy(whole).equals(length) ? whole : Math.addExact(whole, 1);
            return Math.toIntExact(n);
        } catch (ArithmeticException e) {
            throw new ScheduleValidationException("Task duration too large: " + length + " in slots of " + slotLength);
        }
    }

    private static void requirePositive(Duration slotLength) {
        if (slotLength == null || slotLength.isNegative() || slotLength.isZero()) {
            throw new ScheduleValidationException("Slot length must be positive: " + slotLength);
        }
    }
}
