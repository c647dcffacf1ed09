package sandboxstudio.playback.scheduler;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import sandboxstudio.playback.service.SimulationService;

/**
 * Drives the playback clock. Disabled in tests, which tick manually.
 */
@Component
@ConditionalOnProperty(name = "app.playback.auto-tick", havingValue = "true", matchIfMissing = true)
public class PlaybackTickScheduler {

    private static final Logger log = LoggerFactory.getLogger(PlaybackTickScheduler.class);

    private final SimulationService simulationService;

    public PlaybackTickScheduler(SimulationService simulationService) {
        this.simulationService = simulationService;
    }

    @Scheduled(fixedRateString = "${app.playback.tick-ms:100}")
    public void tick() {
        try {
            simulationService.tick();
        } catch (RuntimeException e) {
            log.error("Playback tick failed", e);
        }
    }
}
