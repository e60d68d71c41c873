package com.phillippitts.vibedj.domain;

import java.time.Instant;

/**
 * Calendar context handed to the vibe oracle.
 */
public record CalendarEvent(String summary, Instant start, Instant end) {
}
