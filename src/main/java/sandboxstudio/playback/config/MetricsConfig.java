package sandboxstudio.playback.config;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import sandboxstudio.playback.service.SimulationService;

@Configuration
public class MetricsConfig {

    @Bean
    public Gauge cursorGauge(MeterRegistry registry, SimulationService simulationService) {
        return Gauge.builder("sandbox.playback.cursor.seconds", simulationService,
                        service -> service.currentEngine().map(engine -> engine.cursor()).orElse(0.0))
                .description("Playback cursor of the loaded scenario in simulated seconds")
                .register(registry);
    }

    @Bean
    public Gauge framesBufferedGauge(MeterRegistry registry, SimulationService simulationService) {
        return Gauge.builder("sandbox.frames.buffered", simulationService,
                        service -> service.currentEngine().map(engine -> engine.framesBuffered()).orElse(0))
                .description("Distinct frame timestamps held in the buffer")
                .register(registry);
    }

    @Bean
    public Gauge editedCountiesGauge(MeterRegistry registry, SimulationService simulationService) {
        return Gauge.builder("sandbox.counties.edited", simulationService,
                        service -> service.currentEngine().map(engine -> engine.editedCounties().size()).orElse(0))
                .description("Counties currently pinned by a manual override")
                .register(registry);
    }

    @Bean
    public Gauge invariantCorrectionsGauge(MeterRegistry registry, SimulationService simulationService) {
        return Gauge.builder("sandbox.frames.corrections", simulationService,
                        service -> service.currentEngine().map(engine -> engine.invariantCorrections()).orElse(0))
                .description("County updates corrected for inconsistent vote totals")
                .register(registry);
    }

    @Bean
    public Counter framesIngestedCounter(MeterRegistry registry) {
        return Counter.builder("sandbox.frames.ingested.total")
                .description("Total number of frames received from the feed")
                .register(registry);
    }

    @Bean
    public Counter overridesCounter(MeterRegistry registry) {
        return Counter.builder("sandbox.overrides.total")
                .description("Total number of manual county overrides applied")
                .register(registry);
    }

    @Bean
    public Counter newsroomEventsCounter(MeterRegistry registry) {
        return Counter.builder("sandbox.newsroom.events.total")
                .description("Total number of newsroom events published")
                .register(registry);
    }
}
