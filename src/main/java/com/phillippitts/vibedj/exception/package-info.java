/**
 * Exception hierarchy for vibe-dj.
 *
 * <p>All exceptions are unchecked and extend {@link com.phillippitts.vibedj.exception.VibeDjException}.
 * None of them is allowed to escape the coordinator's event-handling boundary; they are
 * caught per event and converted into a retry cooldown or an empty result.
 */
package com.phillippitts.vibedj.exception;
