package com.phillippitts.vibedj.exception;

/**
 * Thrown when a playback command cannot be delivered because no remote player is connected
 * or the connection failed mid-send.
 */
public class PlaybackUnavailableException extends VibeDjException {

    public PlaybackUnavailableException(String message) {
        super(message);
    }

    public PlaybackUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
