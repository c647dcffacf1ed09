package sandboxstudio.playback.exception;

public class InvalidOverrideException extends IllegalArgumentException {

    private final String countyId;

    public InvalidOverrideException(String countyId, String message) {
        super("Invalid override for county " + countyId + ": " + message);
        this.countyId = countyId;
    }

    public String getCountyId() {
        return countyId;
    }
}
