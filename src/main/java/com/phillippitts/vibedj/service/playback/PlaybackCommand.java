package com.phillippitts.vibedj.service.playback;

/**
 * Commands understood by the remote player.
 */
public enum PlaybackCommand {
    PLAY("play"),
    PAUSE("pause"),
    NEXT("next"),
    PREVIOUS("previous"),
    SEARCH_AND_PLAY("search_and_play"),
    SET_VOLUME("set_volume"),
    QUEUE_NEXT("queue_next");

    private final String wireName;

    PlaybackCommand(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }
}
