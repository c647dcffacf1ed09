package sandboxstudio.playback.domain;

import com.fasterxml.jackson.annotation.JsonValue;

public enum Leader {
    GOP("GOP"),
    DEM("DEM"),
    TIE("TIE");

    private final String value;

    Leader(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /** Positive margins lean Republican, negative lean Democratic. */
    public static Leader fromMargin(long marginVotes) {
        if (marginVotes == 0) {
            return TIE;
        }
        return marginVotes > 0 ? GOP : DEM;
    }
}
