/**
 * Vibe plan lifecycle: initial planning, periodic and chat-triggered rechecks, failure
 * backoff, and interpolation of the current slider targets.
 */
package com.phillippitts.vibedj.service.vibe;
