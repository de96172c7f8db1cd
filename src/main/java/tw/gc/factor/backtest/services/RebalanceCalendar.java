package tw.gc.factor.backtest.services;

import tw.gc.factor.backtest.enums.RebalanceCadence;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Simulation clock: every weekday in [start, end] is a tick. A rebalance happens on the first tick
 * on or after each cadence anchor (start, start + 1 period, ...).
 */
public class RebalanceCalendar {

    private final List<LocalDate> tradingDays;
    private final Set<LocalDate> rebalanceDates;

    public RebalanceCalendar(LocalDate start, LocalDate end, RebalanceCadence cadence) {
        if (start.isAfter(end)) {
            throw new IllegalArgumentException("start " + start + " is after end " + end);
        }
        List<LocalDate> days = new ArrayList<>();
        for (LocalDate d = start; !d.isAfter(end); d = d.plusDays(1)) {
            if (isWeekday(d)) {
                days.add(d);
            }
        }
        this.tradingDays = Collections.unmodifiableList(days);

        Set<LocalDate> rebalances = new LinkedHashSet<>();
        int index = 0;
        for (int n = 0; index < days.size(); n++) {
            LocalDate anchor = cadence.anchor(start, n);
            if (anchor.isAfter(end)) {
                break;
            }
            while (index < days.size() && days.get(index).isBefore(anchor)) {
                index++;
            }
            if (index < days.size()) {
                rebalances.add(days.get(index));
            }
        }
        this.rebalanceDates = Collections.unmodifiableSet(rebalances);
    }

    private static boolean isWeekday(LocalDate date) {
        DayOfWeek day = date.getDayOfWeek();
        return day != DayOfWeek.SATURDAY && day != DayOfWeek.SUNDAY;
    }

    public List<LocalDate> tradingDays() {
        return tradingDays;
    }

    public boolean isRebalanceDate(LocalDate date) {
        return rebalanceDates.contains(date);
    }

    public List<LocalDate> rebalanceDates() {
        return List.copyOf(rebalanceDates);
    }
}
