package sandboxstudio.playback.domain;

import com.fasterxml.jackson.annotation.JsonValue;

public enum PlaybackStatus {
    IDLE("idle"),
    READY("ready"),
    RUNNING("running"),
    PAUSED("paused"),
    COMPLETED("completed"),
    ERROR("error");

    private final String value;

    PlaybackStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
