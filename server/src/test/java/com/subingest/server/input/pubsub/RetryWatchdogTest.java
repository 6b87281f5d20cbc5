/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.subingest.server.input.pubsub;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import com.subingest.common.concurrent.CancellationScope;
import com.subingest.common.exception.MessageSourceException;
import com.subingest.common.model.WorkerState;
import com.subingest.messaging.core.ReceiveSettings;
import com.subingest.messaging.core.Subscription;
import com.subingest.server.metrics.InputMetrics;
import com.subingest.server.pipeline.EventSink;
import com.subingest.server.status.WorkerStatus;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.mock;

class RetryWatchdogTest {

    private final CancellationScope worker = CancellationScope.root();
    private final WorkerStatus status = new WorkerStatus(null);
    private final ListAppender<ILoggingEvent> logs = new ListAppender<>();
    private final Logger logger = (Logger) LoggerFactory.getLogger(RetryWatchdog.class);

    @BeforeEach
    void attachAppender() {
        logs.start();
        logger.addAppender(logs);
    }

    @AfterEach
    void detachAppender() {
        logger.detachAppender(logs);
        worker.cancel("test finished");
    }

    private RetryWatchdog watchdog(Duration interval, RetryWatchdog.Attempt attempt) {
        return new RetryWatchdog("[orders]", worker, new RestartThrottle(interval), attempt, status);
    }

    @Test
    void restartsAfterTransientFailuresUntilWorkerCancelled() {
        AtomicInteger calls = new AtomicInteger();
        RetryWatchdog watchdog = watchdog(Duration.ZERO, scope -> {
            if (calls.incrementAndGet() < 3) throw new MessageSourceException("unavailable");
            worker.cancel("stop requested");
        });

        watchdog.run();

        assertThat(watchdog.getAttempts()).isEqualTo(3);
        assertThat(watchdog.getLastError()).isInstanceOf(MessageSourceException.class);
        assertThat(status.getState()).isEqualTo(WorkerState.STOPPED);
        assertThat(logs.list)
                .filteredOn(e -> e.getLevel() == Level.WARN)
                .extracting(ILoggingEvent::getFormattedMessage)
                .hasSize(2)
                .allMatch(m -> m.contains("Restarting failed Pub/Sub input worker"));
    }

    @Test
    void attemptCancellingItselfDoesNotStopWorker() {
        List<CancellationScope> scopes = new CopyOnWriteArrayList<>();
        RetryWatchdog watchdog = watchdog(Duration.ZERO, scope -> {
            scopes.add(scope);
            if (scopes.size() == 1) {
                scope.cancel("pipeline rejected event");
                assertThat(worker.isCancelled()).isFalse();
            } else {
                worker.cancel("stop requested");
            }
        });

        watchdog.run();

        assertThat(scopes).hasSize(2);
        assertThat(scopes).allMatch(CancellationScope::isCancelled);
        assertThat(scopes.get(0)).isNotSameAs(scopes.get(1));
        assertThat(logs.list).noneMatch(e -> e.getLevel() == Level.WARN || e.getLevel() == Level.ERROR);
    }

    @Test
    void failureAfterShutdownIsLoggedAsError() {
        RetryWatchdog watchdog = watchdog(Duration.ZERO, scope -> {
            worker.cancel("stop requested");
            throw new MessageSourceException("connection closed");
        });

        watchdog.run();

        assertThat(watchdog.getAttempts()).isEqualTo(1);
        assertThat(logs.list)
                .filteredOn(e -> e.getLevel() == Level.ERROR)
                .hasSize(1);
        assertThat(logs.list).noneMatch(e -> e.getLevel() == Level.WARN);
    }

    @Test
    void cancellationAfterShutdownIsClean() {
        RetryWatchdog watchdog = watchdog(Duration.ZERO, scope -> {
            worker.cancel("stop requested");
            scope.throwIfCancelled();
        });

        watchdog.run();

        assertThat(watchdog.getLastError()).isInstanceOf(CancellationException.class);
        assertThat(logs.list).noneMatch(e -> e.getLevel() == Level.WARN || e.getLevel() == Level.ERROR);
        assertThat(status.getState()).isEqualTo(WorkerState.STOPPED);
    }

    @Test
    void cancellingWorkerEndsRunningAttempt() throws InterruptedException {
        CountDownLatch inAttempt = new CountDownLatch(1);
        RetryWatchdog watchdog = watchdog(Duration.ZERO, scope -> {
            inAttempt.countDown();
            try {
                scope.awaitCancellation();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        });
        Thread thread = new Thread(watchdog);
        thread.start();
        assertThat(inAttempt.await(5, TimeUnit.SECONDS)).isTrue();

        worker.cancel("stop requested");
        thread.join(5000);

        assertThat(thread.isAlive()).isFalse();
        assertThat(watchdog.getAttempts()).isEqualTo(1);
        assertThat(status.getState()).isEqualTo(WorkerState.STOPPED);
    }

    @Test
    void attemptsStartNoMoreOftenThanTheInterval() {
        List<Long> starts = new CopyOnWriteArrayList<>();
        RetryWatchdog watchdog = watchdog(Duration.ofMillis(150), scope -> {
            starts.add(System.nanoTime());
            if (starts.size() == 3) worker.cancel("stop requested");
            throw new MessageSourceException("unavailable");
        });

        watchdog.run();

        assertThat(starts).hasSize(3);
        for (int i = 1; i < starts.size(); i++) {
            assertThat(Duration.ofNanos(starts.get(i) - starts.get(i - 1)))
                    .isGreaterThanOrEqualTo(Duration.ofMillis(140));
        }
    }

    @Test
    void alreadyCancelledWorkerRunsNoAttempt() {
        worker.cancel("stopped before start");
        AtomicInteger calls = new AtomicInteger();

        watchdog(Duration.ZERO, scope -> calls.incrementAndGet()).run();

        assertThat(calls).hasValue(0);
        assertThat(status.getState()).isEqualTo(WorkerState.STOPPED);
    }

    @Test
    void shutdownDuringReceiveIsCleanAndNotDegraded() throws InterruptedException {
        Subscription subscription = mock(Subscription.class);
        CountDownLatch receiving = new CountDownLatch(1);
        doAnswer(inv -> {
            CancellationScope scope = inv.getArgument(0);
            receiving.countDown();
            scope.awaitCancellation();
            scope.throwIfCancelled();
            return null;
        }).when(subscription).receive(any(), any());
        MessagePump pump = new MessagePump("[orders]", "acme", "orders", new EventMapper("acme", "orders"),
                mock(EventSink.class), new InputMetrics("orders", new SimpleMeterRegistry()), status);
        RetryWatchdog watchdog = watchdog(Duration.ZERO,
                scope -> pump.receive(scope, subscription, new ReceiveSettings(1, 10)));
        Thread thread = new Thread(watchdog);
        thread.start();
        assertThat(receiving.await(5, TimeUnit.SECONDS)).isTrue();

        worker.cancel("stop");
        thread.join(5000);

        assertThat(thread.isAlive()).isFalse();
        assertThat(watchdog.getLastError()).isInstanceOf(CancellationException.class);
        assertThat(status.hasReported(WorkerState.DEGRADED)).isFalse();
        assertThat(status.getState()).isEqualTo(WorkerState.STOPPED);
        assertThat(logs.list).noneMatch(e -> e.getLevel() == Level.WARN || e.getLevel() == Level.ERROR);
    }

    @Test
    void wrappedCancellationAfterShutdownIsClean() {
        RetryWatchdog watchdog = watchdog(Duration.ZERO, scope -> {
            worker.cancel("stop requested");
            throw new MessageSourceException("receive aborted", new CancellationException("stop requested"));
        });

        watchdog.run();

        assertThat(logs.list).noneMatch(e -> e.getLevel() == Level.WARN || e.getLevel() == Level.ERROR);
    }

    @Test
    void attemptCancellationIsNotLoggedAsFailure() {
        AtomicInteger calls = new AtomicInteger();
        RetryWatchdog watchdog = watchdog(Duration.ZERO, scope -> {
            if (calls.incrementAndGet() == 1) {
                scope.cancel("pipeline rejected event");
                scope.throwIfCancelled();
            }
            worker.cancel("stop requested");
        });

        watchdog.run();

        assertThat(calls).hasValue(2);
        assertThat(logs.list).noneMatch(e -> e.getLevel() == Level.WARN || e.getLevel() == Level.ERROR);
    }
}
