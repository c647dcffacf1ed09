package sandboxstudio.playback.dto;

import java.util.Set;

public record WarningsResponse(
        Set<String> unknownCounties,
        int invariantCorrections,
        Set<String> editedCounties
) {}
