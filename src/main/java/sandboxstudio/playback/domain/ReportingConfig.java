package sandboxstudio.playback.domain;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Upstream pacing hints. Carried through untouched; only its presence is checked.
 */
public record ReportingConfig(Map<String, Object> content) {

    public ReportingConfig {
        content = content == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(content));
    }

    public static ReportingConfig none() {
        return new ReportingConfig(Map.of());
    }

    public boolean isPresent() {
        return !content.isEmpty();
    }

    public String description() {
        Object description = content.get("description");
        return description instanceof String text && !text.isBlank() ? text : null;
    }
}
