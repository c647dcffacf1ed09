package sandboxstudio.playback.engine;

public record NewsroomSettings(
        double callReportingPercent,
        double callMarginPercent,
        double swingPercent,
        double swingReportingFloor,
        int maxEvents
) {
    public NewsroomSettings {
        if (maxEvents <= 0) {
            throw new IllegalArgumentException("maxEvents must be positive");
        }
    }

    public static NewsroomSettings defaults() {
        return new NewsroomSettings(99.0, 3.0, 10.0, 20.0, 60);
    }
}
