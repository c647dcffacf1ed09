package sandboxstudio.playback.domain;

/**
 * Normalization of county FIPS codes.
 * County ids are 5-character, zero-padded; the state id is the leading 2 characters.
 */
public final class EntityIds {

    public static final int COUNTY_ID_LENGTH = 5;
    public static final int STATE_ID_LENGTH = 2;

    private EntityIds() {
    }

    /**
     * Returns the normalized county id, or {@code null} when the raw value is blank
     * or longer than a county code can be.
     */
    public static String normalize(String raw) {
        if (raw == null) {
            return null;
        }
        String trimmed = raw.trim();
        if (trimmed.isEmpty() || trimmed.length() > COUNTY_ID_LENGTH) {
            return null;
        }
        StringBuilder padded = new StringBuilder(COUNTY_ID_LENGTH);
        for (int i = trimmed.length(); i < COUNTY_ID_LENGTH; i++) {
            padded.append('0');
        }
        return padded.append(trimmed).toString();
    }

    public static String stateIdOf(String countyId) {
        String normalized = normalize(countyId);
        if (normalized == null) {
            throw new IllegalArgumentException("Invalid county id: " + countyId);
        }
        return normalized.substring(0, STATE_ID_LENGTH);
    }

    public static String normalizeState(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        String trimmed = raw.trim();
        if (trimmed.length() == 1) {
            return "0" + trimmed;
        }
        return trimmed.length() == STATE_ID_LENGTH ? trimmed : null;
    }
}
