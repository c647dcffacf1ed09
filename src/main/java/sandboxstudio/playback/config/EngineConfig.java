package sandboxstudio.playback.config;

import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import sandboxstudio.playback.engine.EngineSettings;
import sandboxstudio.playback.engine.HeuristicWinProbabilityEstimator;
import sandboxstudio.playback.engine.NewsroomSettings;
import sandboxstudio.playback.engine.WinProbabilityEstimator;

import java.util.function.LongSupplier;

@Configuration
public class EngineConfig {

    private static final Logger log = LoggerFactory.getLogger(EngineConfig.class);

    @Value("${app.aggregation.noise-floor-percent:1.0}")
    private double noiseFloorPercent;

    @Value("${app.aggregation.win-probability-scale:160}")
    private double winProbabilityScale;

    @Value("${app.newsroom.call-reporting-percent:99.0}")
    private double callReportingPercent;

    @Value("${app.newsroom.call-margin-percent:3.0}")
    private double callMarginPercent;

    @Value("${app.newsroom.swing-percent:10.0}")
    private double swingPercent;

    @Value("${app.newsroom.swing-reporting-floor:20.0}")
    private double swingReportingFloor;

    @Value("${app.newsroom.max-events:60}")
    private int maxEvents;

    @PostConstruct
    public void logConfig() {
        log.info("Engine config: noise floor {}%, call at {}% reporting and {} point margin, swing {} points, {} events kept",
                noiseFloorPercent, callReportingPercent, callMarginPercent, swingPercent, maxEvents);
    }

    @Bean
    public EngineSettings engineSettings() {
        return new EngineSettings(
                noiseFloorPercent,
                new NewsroomSettings(callReportingPercent, callMarginPercent, swingPercent, swingReportingFloor, maxEvents)
        );
    }

    @Bean
    public WinProbabilityEstimator winProbabilityEstimator() {
        return new HeuristicWinProbabilityEstimator(winProbabilityScale);
    }

    @Bean
    public LongSupplier playbackClock() {
        return System::nanoTime;
    }
}
