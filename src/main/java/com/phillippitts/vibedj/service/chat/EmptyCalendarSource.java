package com.phillippitts.vibedj.service.chat;

import com.phillippitts.vibedj.domain.CalendarEvent;

import java.time.Instant;
import java.util.List;

/** Calendar source used when no calendar integration is configured. */
public class EmptyCalendarSource implements CalendarSource {

    @Override
    public List<CalendarEvent> eventsAround(Instant now) {
        return List.of();
    }
}
