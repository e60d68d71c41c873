package com.phillippitts.vibedj.service.playback;

/**
 * How a chosen track is handed to the player.
 */
public enum PlayMode {
    /** Queue after the current track without interrupting it. */
    QUEUE_NEXT(PlaybackCommand.QUEUE_NEXT),
    /** Search and start playing immediately. */
    SEARCH_AND_PLAY(PlaybackCommand.SEARCH_AND_PLAY);

    private final PlaybackCommand command;

    PlayMode(PlaybackCommand command) {
        this.command = command;
    }

    public PlaybackCommand command() {
        return command;
    }
}
