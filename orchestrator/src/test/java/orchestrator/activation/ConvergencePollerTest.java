package orchestrator.activation;

import orchestrator.exceptions.ConvergenceTimeoutException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("ConvergencePoller")
class ConvergencePollerTest {

    private final AtomicLong clock = new AtomicLong();
    private final AtomicInteger sleeps = new AtomicInteger();
    private final ConvergencePoller poller = new ConvergencePoller(Duration.ofSeconds(3), clock::get, d -> {
        sleeps.incrementAndGet();
        clock.addAndGet(d.toNanos());
    });

    @Test
    @DisplayName("should return immediately when the condition already holds")
    void shouldReturnImmediatelyWhenTheConditionAlreadyHolds() {
        poller.await("ready", Duration.ofMinutes(1), () -> true);

        assertThat(sleeps.get()).isZero();
    }

    @Test
    @DisplayName("should poll until the condition holds")
    void shouldPollUntilTheConditionHolds() {
        AtomicInteger calls = new AtomicInteger();

        poller.await("third time", Duration.ofMinutes(1), () -> calls.incrementAndGet() == 3);

        assertThat(calls.get()).isEqualTo(3);
        assertThat(sleeps.get()).isEqualTo(2);
        assertThat(clock.get()).isEqualTo(Duration.ofSeconds(6).toNanos());
    }

    @Test
    @DisplayName("should throw ConvergenceTimeoutException when the bound elapses")
    void shouldThrowConvergenceTimeoutExceptionWhenTheBoundElapses() {
        assertThatThrownBy(() -> poller.await("host0 UP", Duration.ofSeconds(10), () -> false))
                .isInstanceOf(ConvergenceTimeoutException.class)
                .hasMessageContaining("host0 UP")
                .satisfies(e -> assertThat(((ConvergenceTimeoutException) e).getTimeout())
                        .isEqualTo(Duration.ofSeconds(10)));

        assertThat(clock.get()).isEqualTo(Duration.ofSeconds(10).toNanos());
    }

    @Test
    @DisplayName("should evaluate at least once with a zero bound")
    void shouldEvaluateAtLeastOnceWithAZeroBound() {
        AtomicInteger calls = new AtomicInteger();

        poller.await("once", Duration.ZERO, () -> calls.incrementAndGet() > 0);

        assertThat(calls.get()).isEqualTo(1);
    }

    @Test
    @DisplayName("should propagate exceptions thrown by the condition")
    void shouldPropagateExceptionsThrownByTheCondition() {
        assertThatThrownBy(() -> poller.await("broken", Duration.ofMinutes(1), () -> {
            throw new IllegalStateException("api down");
        })).isInstanceOf(IllegalStateException.class).hasMessage("api down");
    }

    @Test
    @DisplayName("should stop waiting and keep the interrupt flag when interrupted")
    void shouldStopWaitingAndKeepTheInterruptFlagWhenInterrupted() {
        ConvergencePoller interrupted = new ConvergencePoller(Duration.ofSeconds(1), clock::get, d -> {
            throw new InterruptedException();
        });

        assertThatThrownBy(() -> interrupted.await("never", Duration.ofMinutes(1), () -> false))
                .isInstanceOf(ConvergenceTimeoutException.class)
                .hasCauseInstanceOf(InterruptedException.class);
        assertThat(Thread.interrupted()).isTrue();
    }
}
