package sandboxstudio.playback.scheduler;

import io.micrometer.core.instrument.Counter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.messaging.simp.SimpMessagingTemplate;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import sandboxstudio.playback.domain.NewsroomEvent;
import sandboxstudio.playback.domain.Rollups;
import sandboxstudio.playback.dto.PlaybackStateResponse;
import sandboxstudio.playback.dto.SimulationEnvelope;
import sandboxstudio.playback.engine.PlaybackEngine;
import sandboxstudio.playback.service.SimulationService;

import java.util.List;

/**
 * Pushes the latest rebuild to subscribers of the active scenario. Only publishes when a rebuild
 * happened since the previous run, so a paused scenario produces no traffic.
 */
@Component
public class SnapshotBroadcastScheduler {

    private static final Logger log = LoggerFactory.getLogger(SnapshotBroadcastScheduler.class);

    private final SimulationService simulationService;
    private final SimpMessagingTemplate messagingTemplate;
    private final Counter newsroomEventsCounter;

    public SnapshotBroadcastScheduler(
            SimulationService simulationService,
            SimpMessagingTemplate messagingTemplate,
            @Qualifier("newsroomEventsCounter") Counter newsroomEventsCounter
    ) {
        this.simulationService = simulationService;
        this.messagingTemplate = messagingTemplate;
        this.newsroomEventsCounter = newsroomEventsCounter;
    }

    @Scheduled(fixedRateString = "${app.broadcast.interval-ms:250}")
    public void broadcastSnapshots() {
        PlaybackEngine engine = simulationService.currentEngine().orElse(null);
        if (engine == null || engine.isDisposed()) {
            return;
        }
        String destination = "/topic/simulation/" + engine.scenario().scenarioId();

        List<NewsroomEvent> events = engine.drainNewEvents();
        for (NewsroomEvent event : events) {
            messagingTemplate.convertAndSend(destination, SimulationEnvelope.newsroom(event));
            newsroomEventsCounter.increment();
        }

        if (engine.isDirtyAndClear()) {
            Rollups rollups = engine.getRollups();
            messagingTemplate.convertAndSend(destination, SimulationEnvelope.snapshot(
                    PlaybackStateResponse.from(engine),
                    rollups == null ? null : rollups.national()
            ));
            log.trace("Broadcast snapshot for scenario {} at {}s", engine.scenario().scenarioId(), engine.cursor());
        }
    }
}
