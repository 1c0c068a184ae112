package fr.lapetina.airouter.domain.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class UsageTest {

    @Test
    @DisplayName("should derive total from prompt and completion")
    void shouldDeriveTotal() {
        assertThat(Usage.of(12, 30).totalTokens()).isEqualTo(42);
    }

    @Test
    @DisplayName("should keep the total exact for counts near the int limit")
    void shouldNotOverflowTotal() {
        Usage usage = Usage.ofNullable(Integer.MAX_VALUE, Integer.MAX_VALUE);

        assertThat(usage.totalTokens()).isEqualTo(2L * Integer.MAX_VALUE);
        assertThat(usage.totalTokens()).isEqualTo((long) usage.promptTokens() + usage.completionTokens());
    }

    @Test
    @DisplayName("should treat missing vendor counts as zero")
    void shouldTreatMissingCountsAsZero() {
        Usage usage = Usage.ofNullable(null, 7);

        assertThat(usage.promptTokens()).isZero();
        assertThat(usage.completionTokens()).isEqualTo(7);
    }

    @Test
    @DisplayName("should reject negative counts")
    void shouldRejectNegativeCounts() {
        assertThatThrownBy(() -> Usage.of(-1, 0))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
