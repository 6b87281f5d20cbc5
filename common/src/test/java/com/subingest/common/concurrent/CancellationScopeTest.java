/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.subingest.common.concurrent;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CancellationScopeTest {

    @Test
    void cancellingParentCancelsChildren() {
        CancellationScope worker = CancellationScope.root();
        CancellationScope attempt = worker.child();
        CancellationScope nested = attempt.child();

        worker.cancel("shutdown");

        assertThat(attempt.isCancelled()).isTrue();
        assertThat(nested.isCancelled()).isTrue();
        assertThat(nested.getReason()).isEqualTo("shutdown");
    }

    @Test
    void cancellingChildLeavesParentActive() {
        CancellationScope worker = CancellationScope.root();
        CancellationScope attempt = worker.child();

        attempt.cancel("backpressure");

        assertThat(attempt.isCancelled()).isTrue();
        assertThat(worker.isCancelled()).isFalse();
        assertThat(worker.getReason()).isNull();
    }

    @Test
    void firstReasonWins() {
        CancellationScope scope = CancellationScope.root();

        assertThat(scope.cancel("first")).isTrue();
        assertThat(scope.cancel("second")).isFalse();
        assertThat(scope.getReason()).isEqualTo("first");
    }

    @Test
    void childOfCancelledScopeStartsCancelled() {
        CancellationScope worker = CancellationScope.root();
        worker.cancel("done");

        assertThat(worker.child().isCancelled()).isTrue();
    }

    @Test
    void callbacksRunExactlyOnce() {
        CancellationScope scope = CancellationScope.root();
        AtomicInteger calls = new AtomicInteger();
        scope.onCancel(calls::incrementAndGet);

        scope.cancel("a");
        scope.cancel("b");

        assertThat(calls).hasValue(1);
    }

    @Test
    void callbackOnCancelledScopeRunsImmediately() {
        CancellationScope scope = CancellationScope.root();
        scope.cancel("x");
        AtomicInteger calls = new AtomicInteger();

        scope.onCancel(calls::incrementAndGet);

        assertThat(calls).hasValue(1);
    }

    @Test
    void unregisteredCallbackDoesNotRun() {
        CancellationScope scope = CancellationScope.root();
        AtomicInteger calls = new AtomicInteger();
        Runnable unregister = scope.onCancel(calls::incrementAndGet);

        unregister.run();
        scope.cancel("x");

        assertThat(calls).hasValue(0);
    }

    @Test
    void failingCallbackDoesNotStopOthers() {
        CancellationScope scope = CancellationScope.root();
        AtomicInteger calls = new AtomicInteger();
        scope.onCancel(() -> { throw new IllegalStateException("boom"); });
        scope.onCancel(calls::incrementAndGet);

        assertThatCode(() -> scope.cancel("x")).doesNotThrowAnyException();
        assertThat(calls).hasValue(1);
    }

    @Test
    void awaitTimesOutWhileActive() throws InterruptedException {
        assertThat(CancellationScope.root().await(Duration.ofMillis(20))).isFalse();
    }

    @Test
    void awaitReturnsWhenCancelledFromAnotherThread() throws InterruptedException {
        CancellationScope worker = CancellationScope.root();
        CancellationScope attempt = worker.child();
        CountDownLatch waiting = new CountDownLatch(1);
        CountDownLatch woke = new CountDownLatch(1);

        Thread t = new Thread(() -> {
            waiting.countDown();
            try {
                attempt.awaitCancellation();
                woke.countDown();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        });
        t.start();
        assertThat(waiting.await(5, TimeUnit.SECONDS)).isTrue();

        worker.cancel("stop");

        assertThat(woke.await(5, TimeUnit.SECONDS)).isTrue();
        t.join(5000);
    }

    @Test
    void throwIfCancelledCarriesReason() {
        CancellationScope scope = CancellationScope.root();
        assertThatCode(scope::throwIfCancelled).doesNotThrowAnyException();

        scope.cancel("stopping");

        assertThatThrownBy(scope::throwIfCancelled)
                .isInstanceOf(CancellationException.class)
                .hasMessage("stopping");
    }
}
