package io.invoicedesk.backend.operations;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Duration;
import org.junit.jupiter.api.Test;

class IssuancePropertiesTest {

  @Test
  void acceptsGrowingBackoff() {
    var properties = new IssuanceProperties(5, Duration.ofMillis(50), Duration.ofSeconds(1));

    assertThat(properties.maxAttempts()).isEqualTo(5);
    assertThat(properties.maxBackoff()).isGreaterThan(properties.initialBackoff());
  }

  @Test
  void rejectsMaxBackoffNotAboveInitialBackoff() {
    assertThatThrownBy(
            () -> new IssuanceProperties(3, Duration.ofMillis(100), Duration.ofMillis(100)))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("max-backoff");
    assertThatThrownBy(
            () -> new IssuanceProperties(3, Duration.ofMillis(200), Duration.ofMillis(100)))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void rejectsNonPositiveInitialBackoffAndAttempts() {
    assertThatThrownBy(() -> new IssuanceProperties(3, Duration.ZERO, Duration.ofMillis(100)))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(
            () -> new IssuanceProperties(0, Duration.ofMillis(10), Duration.ofMillis(100)))
        .isInstanceOf(IllegalArgumentException.class);
  }
}
