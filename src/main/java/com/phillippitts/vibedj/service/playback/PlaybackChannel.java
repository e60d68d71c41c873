package com.phillippitts.vibedj.service.playback;

import java.util.Map;

/**
 * Outbound connection to the remote player.
 */
public interface PlaybackChannel {

    /**
     * Sends {@code {"command": ..., "payload": {...}}} to the connected player.
     *
     * @param payload command arguments, may be empty
     * @return {@code true} if at least one player received the command; {@code false} when
     *         none is connected or every send failed
     */
    boolean send(PlaybackCommand command, Map<String, Object> payload);

    boolean isConnected();
}
