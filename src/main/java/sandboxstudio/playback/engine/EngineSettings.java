package sandboxstudio.playback.engine;

/**
 * Tunables for one playback engine.
 */
public record EngineSettings(
        double noiseFloorPercent,
        NewsroomSettings newsroom
) {
    public static EngineSettings defaults() {
        return new EngineSettings(AggregationEngine.DEFAULT_NOISE_FLOOR_PERCENT, NewsroomSettings.defaults());
    }
}
