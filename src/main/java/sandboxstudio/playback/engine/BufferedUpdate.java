package sandboxstudio.playback.engine;

import sandboxstudio.playback.domain.CountyUpdate;

/**
 * A county update together with the timestamp of the frame that carried it.
 */
public record BufferedUpdate(double timestamp, CountyUpdate update) {
}
