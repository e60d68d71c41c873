package com.phillippitts.vibedj.service.oracle;

import com.phillippitts.vibedj.domain.CalendarEvent;
import com.phillippitts.vibedj.domain.ChatExcerpt;

import java.time.DayOfWeek;
import java.util.List;

/**
 * Input of the vibe oracle.
 *
 * @param previousState {@code null} when no plan is active
 */
public record VibeRequest(
        DayOfWeek dayOfWeek,
        List<CalendarEvent> calendarEvents,
        List<ChatExcerpt> recentChat,
        PreviousVibeState previousState
) {

    public VibeRequest {
        calendarEvents = calendarEvents == null ? List.of() : List.copyOf(calendarEvents);
        recentChat = recentChat == null ? List.of() : List.copyOf(recentChat);
    }
}
