package com.phillippitts.vibedj.service.playback;

/**
 * Track identity as reported by the player.
 */
public record PlayerTrack(String title, String artist) {

    public PlayerTrack {
        title = title == null ? "" : title.strip();
        artist = artist == null ? "" : artist.strip();
    }

    /** Identity used to detect track changes: {@code "title-artist"}. */
    public String identity() {
        return title + "-" + artist;
    }
}
