package sandboxstudio.playback.websocket;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.messaging.handler.annotation.MessageMapping;
import org.springframework.stereotype.Controller;
import sandboxstudio.playback.dto.FeedEnvelope;
import sandboxstudio.playback.service.FeedService;

@Controller
public class FeedController {

    private static final Logger log = LoggerFactory.getLogger(FeedController.class);

    private final FeedService feedService;

    public FeedController(FeedService feedService) {
        this.feedService = feedService;
    }

    @MessageMapping("/simulation/feed")
    public void feed(FeedEnvelope envelope) {
        log.debug("Feed message received: type={}", envelope == null ? null : envelope.type());
        feedService.handleEnvelope(envelope);
    }
}
