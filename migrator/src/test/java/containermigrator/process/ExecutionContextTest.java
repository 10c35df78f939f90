package containermigrator.process;

import containermigrator.exceptions.MigrationTimeoutException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledOnOs;
import org.junit.jupiter.api.condition.OS;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("ExecutionContext")
class ExecutionContextTest {

    @Nested
    @DisplayName("unbounded")
    class Unbounded {

        @Test
        @DisplayName("should never expire")
        void shouldNeverExpire() {
            ExecutionContext ctx = ExecutionContext.unbounded();

            assertThat(ctx.hasDeadline()).isFalse();
            assertThat(ctx.remaining()).isNull();
            assertThat(ctx.isExpired()).isFalse();
        }

        @Test
        @DisplayName("should use the per-call timeout as is")
        void shouldUseThePerCallTimeoutAsIs() {
            ExecutionContext ctx = ExecutionContext.unbounded();

            assertThat(ctx.timeoutFor("scp", Duration.ofSeconds(30))).isEqualTo(Duration.ofSeconds(30));
            assertThat(ctx.timeoutFor("scp", Duration.ZERO)).isEqualTo(Duration.ZERO);
            assertThat(ctx.timeoutFor("scp", null)).isEqualTo(Duration.ZERO);
        }

        @Test
        @DisplayName("should treat a zero or negative deadline as none")
        void shouldTreatAZeroOrNegativeDeadlineAsNone() {
            assertThat(ExecutionContext.withDeadline(Duration.ZERO).hasDeadline()).isFalse();
            assertThat(ExecutionContext.withDeadline(Duration.ofSeconds(-1)).hasDeadline()).isFalse();
            assertThat(ExecutionContext.withDeadline(null).hasDeadline()).isFalse();
        }
    }

    @Nested
    @DisplayName("with deadline")
    class WithDeadline {

        @Test
        @DisplayName("should bound the per-call timeout by the time left")
        void shouldBoundThePerCallTimeoutByTheTimeLeft() {
            ExecutionContext ctx = ExecutionContext.withDeadline(Duration.ofSeconds(60));

            assertThat(ctx.timeoutFor("criu", Duration.ofSeconds(5))).isEqualTo(Duration.ofSeconds(5));
            assertThat(ctx.timeoutFor("criu", Duration.ofMinutes(10))).isLessThanOrEqualTo(Duration.ofSeconds(60));
            assertThat(ctx.timeoutFor("criu", Duration.ZERO))
                    .isLessThanOrEqualTo(Duration.ofSeconds(60))
                    .isGreaterThan(Duration.ofSeconds(50));
        }

        @Test
        @DisplayName("should fail fast once expired")
        void shouldFailFastOnceExpired() throws InterruptedException {
            ExecutionContext ctx = ExecutionContext.withDeadline(Duration.ofMillis(20));
            Thread.sleep(40);

            assertThat(ctx.isExpired()).isTrue();
            assertThatThrownBy(() -> ctx.timeoutFor("ssh", Duration.ofSeconds(1)))
                    .isInstanceOf(MigrationTimeoutException.class)
                    .hasMessage("Operation 'ssh' timed out after 20 ms");
            assertThatThrownBy(() -> ctx.checkDeadline("validation"))
                    .isInstanceOf(MigrationTimeoutException.class);
        }
    }

    @Nested
    @DisplayName("cancel")
    class Cancel {

        @Test
        @DisplayName("should mark the context cancelled")
        void shouldMarkTheContextCancelled() {
            ExecutionContext ctx = ExecutionContext.unbounded();

            ctx.cancel();

            assertThat(ctx.isCancelled()).isTrue();
            assertThat(ctx.hasLiveProcess()).isFalse();
        }

        @Test
        @DisplayName("should track the live process until it finishes")
        @EnabledOnOs({OS.LINUX, OS.MAC})
        void shouldTrackTheLiveProcessUntilItFinishes() throws Exception {
            ExecutionContext ctx = ExecutionContext.unbounded();
            Process process = new ProcessBuilder("sleep", "5").start();
            try {
                ctx.processStarted(process);
                assertThat(ctx.hasLiveProcess()).isTrue();

                ctx.cancel();

                assertThat(process.waitFor(5, TimeUnit.SECONDS)).isTrue();
                ctx.processFinished(process);
                assertThat(ctx.hasLiveProcess()).isFalse();
            } finally {
                process.destroyForcibly();
            }
        }

        @Test
        @DisplayName("should kill a process registered after cancellation")
        @EnabledOnOs({OS.LINUX, OS.MAC})
        void shouldKillAProcessRegisteredAfterCancellation() throws Exception {
            ExecutionContext ctx = ExecutionContext.unbounded();
            ctx.cancel();
            Process process = new ProcessBuilder("sleep", "5").start();
            try {
                ctx.processStarted(process);

                assertThat(process.waitFor(5, TimeUnit.SECONDS)).isTrue();
            } finally {
                process.destroyForcibly();
            }
        }
    }
}
