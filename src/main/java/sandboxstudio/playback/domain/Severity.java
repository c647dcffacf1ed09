package sandboxstudio.playback.domain;

import com.fasterxml.jackson.annotation.JsonValue;

public enum Severity {
    INFO("info"),
    SUCCESS("success"),
    WARNING("warning"),
    DANGER("danger");

    private final String value;

    Severity(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
