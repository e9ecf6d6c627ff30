package ru.javaboys.huntymatch.util;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;
import ru.javaboys.huntymatch.exception.InvalidInputException;
import ru.javaboys.huntymatch.exception.ServiceUnavailableException;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ExternalCallGuardTest {

    private final ExternalCallGuard guard = new ExternalCallGuard();

    @AfterEach
    void tearDown() {
        guard.shutdown();
        MDC.clear();
    }

    @Test
    void returnsResultAndCarriesMdc() {
        MDC.put("resumeId", "42");

        String seen = guard.call("test", Duration.ofSeconds(5), () -> MDC.get("resumeId"));

        assertThat(seen).isEqualTo("42");
    }

    @Test
    void slowCallTimesOut() {
        assertThatThrownBy(() -> guard.call("slow", Duration.ofMillis(50), () -> {
            try {
                Thread.sleep(5_000);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return "late";
        }))
                .isInstanceOf(ServiceUnavailableException.class)
                .hasMessageContaining("slow");
    }

    @Test
    void foreignExceptionsAreWrapped() {
        assertThatThrownBy(() -> guard.call("chat", Duration.ofSeconds(5), () -> {
            throw new IllegalStateException("401 Unauthorized");
        }))
                .isInstanceOf(ServiceUnavailableException.class)
                .hasCauseInstanceOf(IllegalStateException.class);
    }

    @Test
    void ownExceptionsPassThrough() {
        assertThatThrownBy(() -> guard.call("chat", Duration.ofSeconds(5), () -> {
            throw new InvalidInputException("bad");
        }))
                .isInstanceOf(InvalidInputException.class);
    }

    @Test
    void timedOutCallIsInterrupted() throws InterruptedException {
        CountDownLatch interrupted = new CountDownLatch(1);

        assertThatThrownBy(() -> guard.call("index", Duration.ofMillis(50), () -> {
            try {
                Thread.sleep(10_000);
            } catch (InterruptedException e) {
                interrupted.countDown();
            }
            return "late";
        }))
                .isInstanceOf(ServiceUnavailableException.class);

        assertThat(interrupted.await(2, TimeUnit.SECONDS)).isTrue();
    }

    @Test
    void callsBeyondCapacityAreRefusedOnceTimeoutPasses() throws InterruptedException {
        ExternalCallGuard single = new ExternalCallGuard(1);
        CountDownLatch started = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        Thread holder = new Thread(() -> single.call("embedding", Duration.ofSeconds(5), () -> {
            started.countDown();
            try {
                release.await();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return "done";
        }));
        try {
            holder.start();
            assertThat(started.await(2, TimeUnit.SECONDS)).isTrue();

            assertThatThrownBy(() -> single.call("embedding", Duration.ofMillis(100), () -> "second"))
                    .isInstanceOf(ServiceUnavailableException.class)
                    .hasMessageContaining("too many calls in flight");

            release.countDown();
            assertThat(single.call("embedding", Duration.ofSeconds(2), () -> "third")).isEqualTo("third");
            holder.join(2_000);
        } finally {
            release.countDown();
            single.shutdown();
        }
    }
}
