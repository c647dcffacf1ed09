package sandboxstudio.playback.domain;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("EntityIds Unit Tests")
class EntityIdsTest {

    @Test
    @DisplayName("Should trim and left-pad county ids to five characters")
    void shouldNormalize() {
        assertThat(EntityIds.normalize(" 1001")).isEqualTo("01001");
        assertThat(EntityIds.normalize("48201")).isEqualTo("48201");
        assertThat(EntityIds.normalize("7")).isEqualTo("00007");
    }

    @Test
    @DisplayName("Should reject blank and oversized ids")
    void shouldRejectInvalid() {
        assertThat(EntityIds.normalize(null)).isNull();
        assertThat(EntityIds.normalize("   ")).isNull();
        assertThat(EntityIds.normalize("123456")).isNull();
    }

    @Test
    @DisplayName("Should derive the state from the leading two characters")
    void shouldDeriveState() {
        assertThat(EntityIds.stateIdOf("1001")).isEqualTo("01");
        assertThat(EntityIds.normalizeState("6")).isEqualTo("06");
        assertThat(EntityIds.normalizeState("national")).isNull();
        assertThatThrownBy(() -> EntityIds.stateIdOf("")).isInstanceOf(IllegalArgumentException.class);
    }
}
