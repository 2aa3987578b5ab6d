package io.github.terrafield.realtime;

import io.github.terrafield.realtime.errors.RealtimeException;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RealtimeOptionsTest {

    @Test
    void defaultValues() {
        RealtimeOptions options = RealtimeOptions.builder().build();

        assertThat(options.getToken()).isNull();
        assertThat(options.getTimeout()).isEqualTo(Duration.ofSeconds(30));
        assertThat(options.getPushPath()).isEqualTo("/ws");
        assertThat(options.isHeartbeatEnabled()).isTrue();
        assertThat(options.getHeartbeatInterval()).isEqualTo(Duration.ofSeconds(15));
        assertThat(options.getHeartbeatTimeout()).isEqualTo(Duration.ofSeconds(30));
        assertThat(options.getReconcileInterval()).isEqualTo(Duration.ofSeconds(5));
        assertThat(options.getValidators()).isEmpty();
    }

    @Test
    void customValues() {
        RealtimeOptions options = RealtimeOptions.builder()
                .token("test-token")
                .timeout(Duration.ofSeconds(10))
                .pushPath("/realtime")
                .heartbeatEnabled(false)
                .heartbeatInterval(Duration.ofSeconds(5))
                .heartbeatTimeout(Duration.ofSeconds(20))
                .reconcileInterval(Duration.ofSeconds(1))
                .validator("property-update", PayloadValidator.OBJECT)
                .build();

        assertThat(options.getToken()).isEqualTo("test-token");
        assertThat(options.getTimeout()).isEqualTo(Duration.ofSeconds(10));
        assertThat(options.getPushPath()).isEqualTo("/realtime");
        assertThat(options.isHeartbeatEnabled()).isFalse();
        assertThat(options.getHeartbeatInterval()).isEqualTo(Duration.ofSeconds(5));
        assertThat(options.getHeartbeatTimeout()).isEqualTo(Duration.ofSeconds(20));
        assertThat(options.getReconcileInterval()).isEqualTo(Duration.ofSeconds(1));
        assertThat(options.getValidators()).containsEntry("property-update", PayloadValidator.OBJECT);
    }

    @Test
    void timeoutValidation() {
        assertThatThrownBy(() -> RealtimeOptions.builder().timeout(null))
                .isInstanceOf(NullPointerException.class);

        assertThatThrownBy(() -> RealtimeOptions.builder().timeout(Duration.ZERO))
                .isInstanceOf(RealtimeException.class)
                .hasMessageContaining("positive");

        assertThatThrownBy(() -> RealtimeOptions.builder().timeout(Duration.ofSeconds(-1)))
                .isInstanceOf(RealtimeException.class)
                .hasMessageContaining("positive");
    }

    @Test
    void heartbeatValidation() {
        assertThatThrownBy(() -> RealtimeOptions.builder().heartbeatInterval(Duration.ZERO))
                .isInstanceOf(RealtimeException.class)
                .hasMessageContaining("heartbeatInterval must be positive");

        assertThatThrownBy(() -> RealtimeOptions.builder()
                .heartbeatInterval(Duration.ofSeconds(20))
                .heartbeatTimeout(Duration.ofSeconds(10))
                .build())
                .isInstanceOf(RealtimeException.class)
                .hasMessageContaining("heartbeatTimeout must not be shorter");

        // equal interval and timeout is valid
        RealtimeOptions options = RealtimeOptions.builder()
                .heartbeatInterval(Duration.ofSeconds(10))
                .heartbeatTimeout(Duration.ofSeconds(10))
                .build();
        assertThat(options.getHeartbeatTimeout()).isEqualTo(Duration.ofSeconds(10));
    }

    @Test
    void durationsBelowOneMillisecondRejected() {
        assertThatThrownBy(() -> RealtimeOptions.builder().reconcileInterval(Duration.ofNanos(500)))
                .isInstanceOf(RealtimeException.class)
                .hasMessageContaining("reconcileInterval must be at least 1ms");

        assertThatThrownBy(() -> RealtimeOptions.builder().heartbeatInterval(Duration.ofNanos(999_999)))
                .isInstanceOf(RealtimeException.class)
                .hasMessageContaining("heartbeatInterval must be at least 1ms");

        assertThatThrownBy(() -> RealtimeOptions.builder().timeout(Duration.ofNanos(1)))
                .isInstanceOf(RealtimeException.class)
                .hasMessageContaining("timeout must be at least 1ms");

        RealtimeOptions options = RealtimeOptions.builder().reconcileInterval(Duration.ofMillis(1)).build();
        assertThat(options.getReconcileInterval()).isEqualTo(Duration.ofMillis(1));
    }

    @Test
    void pushPathValidation() {
        assertThatThrownBy(() -> RealtimeOptions.builder().pushPath(null))
                .isInstanceOf(NullPointerException.class);

        assertThatThrownBy(() -> RealtimeOptions.builder().pushPath("ws"))
                .isInstanceOf(RealtimeException.class)
                .hasMessageContaining("must start with '/'");
    }

    @Test
    void validatorValidation() {
        assertThatThrownBy(() -> RealtimeOptions.builder().validator("", PayloadValidator.ANY))
                .isInstanceOf(RealtimeException.class)
                .hasMessageContaining("event cannot be empty");

        assertThatThrownBy(() -> RealtimeOptions.builder().validator("property-update", null))
                .isInstanceOf(NullPointerException.class);
    }

    @Test
    void validatorsAreImmutable() {
        RealtimeOptions options = RealtimeOptions.builder()
                .validator("property-update", PayloadValidator.OBJECT)
                .build();

        assertThatThrownBy(() -> options.getValidators().put("other", PayloadValidator.ANY))
                .isInstanceOf(UnsupportedOperationException.class);
    }
}
