/**
 * Command channel to the remote player and the inbound player events.
 *
 * <p>Outbound commands are {@code {"command": ..., "payload": {...}}} envelopes. Sending
 * with no connected player returns {@code false}.
 */
package com.phillippitts.vibedj.service.playback;
