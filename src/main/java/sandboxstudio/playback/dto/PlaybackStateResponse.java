package sandboxstudio.playback.dto;

import sandboxstudio.playback.domain.PlaybackStatus;
import sandboxstudio.playback.engine.PlaybackEngine;

public record PlaybackStateResponse(
        String scenarioId,
        PlaybackStatus status,
        double cursorSeconds,
        double totalDurationSeconds,
        double progressPercent,
        double speed,
        boolean playbackReady,
        boolean playing,
        int framesBuffered,
        boolean feedCompleted,
        String errorMessage
) {
    public static PlaybackStateResponse idle() {
        return new PlaybackStateResponse(null, PlaybackStatus.IDLE, 0, 0, 0, 1.0, false, false, 0, false, null);
    }

    public static PlaybackStateResponse from(PlaybackEngine engine) {
        return new PlaybackStateResponse(
                engine.scenario().scenarioId(),
                engine.status(),
                engine.cursor(),
                engine.totalDuration(),
                engine.progressPercent(),
                engine.speed(),
                engine.isPlaybackReady(),
                engine.isPlaying(),
                engine.framesBuffered(),
                engine.isFeedCompleted(),
                engine.errorMessage()
        );
    }
}
