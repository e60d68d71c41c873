package com.phillippitts.vibedj.service.history;

import com.phillippitts.vibedj.domain.HistoryRecord;

import java.time.LocalDate;
import java.time.temporal.IsoFields;

/**
 * Lazy reset of rolling play counters when a period boundary has been crossed since the
 * stored reset date.
 *
 * <ul>
 *   <li>day: the date differs</li>
 *   <li>week: the ISO week number or the calendar year differs</li>
 *   <li>month: the month or the year differs</li>
 *   <li>year: the year differs</li>
 * </ul>
 * The all-time counter is never touched. A record without a reset date only gets the
 * date stamped.
 */
final class PeriodCounters {

    private PeriodCounters() {}

    static HistoryRecord resetIfNeeded(HistoryRecord r, LocalDate today) {
        LocalDate last = r.lastCountReset();
        if (last == null) {
            return withCounters(r, r.playsToday(), r.playsWeek(), r.playsMonth(), r.playsYear(), today);
        }
        boolean newYear = today.getYear() != last.getYear();
        boolean newDay = !today.equals(last);
        boolean newWeek = newYear || today.get(IsoFields.WEEK_OF_WEEK_BASED_YEAR)
                != last.get(IsoFields.WEEK_OF_WEEK_BASED_YEAR);
        boolean newMonth = newYear || today.getMonthValue() != last.getMonthValue();
        return withCounters(r,
                newDay ? 0 : r.playsToday(),
                newWeek ? 0 : r.playsWeek(),
                newMonth ? 0 : r.playsMonth(),
                newYear ? 0 : r.playsYear(),
                today);
    }

    private static HistoryRecord withCounters(HistoryRecord r, int day, int week, int month, int year,
                                              LocalDate resetDate) {
        return new HistoryRecord(r.id(), r.title(), r.artist(), r.searchQuery(), r.firstPlayed(),
                r.lastPlayed(), day, week, month, year, r.playsAllTime(), resetDate, r.lastTargets());
    }
}
