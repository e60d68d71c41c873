package com.phillippitts.vibedj.testutil;

import com.phillippitts.vibedj.service.playback.PlaybackChannel;
import com.phillippitts.vibedj.service.playback.PlaybackCommand;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Test double for {@link PlaybackChannel} that records every command sent.
 */
public class RecordingPlaybackChannel implements PlaybackChannel {

    public record Sent(PlaybackCommand command, Map<String, Object> payload) {
    }

    public final List<Sent> sent = new CopyOnWriteArrayList<>();
    private volatile boolean connected = true;

    public void setConnected(boolean connected) {
        this.connected = connected;
    }

    @Override
    public boolean send(PlaybackCommand command, Map<String, Object> payload) {
        if (!connected) {
            return false;
        }
        sent.add(new Sent(command, payload));
        return true;
    }

    @Override
    public boolean isConnected() {
        return connected;
    }

    public List<Sent> ofCommand(PlaybackCommand command) {
        return sent.stream().filter(s -> s.command() == command).toList();
    }
}
