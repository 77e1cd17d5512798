package com.loadforecast.features;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.util.Collection;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * Finds bridge days: single working days squeezed between a holiday and a weekend.
 * <p>
 * Relative to an anchor date {@code A}: {@code A+1} is a bridge day when {@code A+2} is a
 * holiday or a Saturday and {@code A+1} itself is neither a holiday nor a weekend day.
 * Symmetrically {@code A-1} is a bridge day when {@code A-2} is a holiday or a Sunday.
 */
public final class BridgeDayDetector {

    private final Set<LocalDate> holidays;

    public BridgeDayDetector(Collection<LocalDate> holidays) {
        this.holidays = Set.copyOf(holidays);
    }

    public Optional<LocalDate> forwardBridgeDay(LocalDate anchor) {
        LocalDate candidate = anchor.plusDays(1);
        LocalDate next = anchor.plusDays(2);
        if ((holidays.contains(next) || next.getDayOfWeek() == DayOfWeek.SATURDAY) && isWorkingDay(candidate)) {
            return Optional.of(candidate);
        }
        return Optional.empty();
    }

    public Optional<LocalDate> backwardBridgeDay(LocalDate anchor) {
        LocalDate candidate = anchor.minusDays(1);
        LocalDate previous = anchor.minusDays(2);
        if ((holidays.contains(previous) || previous.getDayOfWeek() == DayOfWeek.SUNDAY) && isWorkingDay(candidate)) {
            return Optional.of(candidate);
        }
        return Optional.empty();
    }

    /** Bridge days around one anchor, in date order. */
    public Set<LocalDate> bridgeDaysAround(LocalDate anchor) {
        Set<LocalDate> found = new TreeSet<>();
        backwardBridgeDay(anchor).ifPresent(found::add);
        forwardBridgeDay(anchor).ifPresent(found::add);
        return found;
    }

    /** Bridge days around every known holiday. */
    public Set<LocalDate> allBridgeDays() {
        Set<LocalDate> found = new TreeSet<>();
        holidays.forEach(h -> found.addAll(bridgeDaysAround(h)));
        return found;
    }

    private boolean isWorkingDay(LocalDate date) {
        DayOfWeek day = date.getDayOfWeek();
        return !holidays.contains(date) && day != DayOfWeek.SATURDAY && day != DayOfWeek.SUNDAY;
    }
}
