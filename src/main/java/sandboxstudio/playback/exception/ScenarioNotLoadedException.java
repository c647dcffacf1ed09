package sandboxstudio.playback.exception;

public class ScenarioNotLoadedException extends RuntimeException {

    public ScenarioNotLoadedException() {
        super("No scenario loaded");
    }
}
