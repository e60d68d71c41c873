package com.phillippitts.vibedj.service.chat;

import com.phillippitts.vibedj.domain.CalendarEvent;

import java.time.Instant;
import java.util.List;

/**
 * Supplies calendar context for vibe planning.
 */
public interface CalendarSource {

    /**
     * Events overlapping the window around {@code now}.
     *
     * @throws RuntimeException when the calendar backend is unavailable; callers treat this
     *         as "no events"
     */
    List<CalendarEvent> eventsAround(Instant now);
}
