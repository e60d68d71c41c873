package com.phillippitts.vibedj.service.playback;

/**
 * Receives notifications sent by the remote player.
 */
public interface PlayerEventListener {

    /**
     * @param track the track now playing, or {@code null} when playback stopped
     */
    void onTrackChanged(PlayerTrack track);

    void onFrontendQueued(PlayerTrack track);

    /** The player asks for a track to be picked and queued. */
    void onPickRequested(String reason);

    /** The player could not find the last queued track and wants a backup queued. */
    void onNeedBackup();
}
