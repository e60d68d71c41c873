/**
 * Play history persistence, period counters and cooldown scoring.
 *
 * <p>Recording a pick merges case-variant duplicate rows into the lowest id and resets
 * day, week, month and year counters when their period has rolled over.
 */
package com.phillippitts.vibedj.service.history;
