package com.ryuqq.promise.testkit.contract;

import com.ryuqq.promise.core.outcome.Outcome;
import com.ryuqq.promise.core.promise.Promise;
import com.ryuqq.promise.core.statemachine.PromiseState;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Contract Test: Settlement and Callback Dispatch.
 *
 * <p>Validates that a promise settles exactly once and that every registered
 * callback observes that settlement exactly once.</p>
 *
 * <p><strong>Test Scenarios:</strong></p>
 * <ul>
 *   <li>resolve(v).await() returns v</li>
 *   <li>reject(e).await() returns e</li>
 *   <li>A fault thrown by the executor becomes a rejection carrying that fault</li>
 *   <li>Two callbacks on a pending promise run in registration order, once each</li>
 *   <li>A callback registered after settlement still runs</li>
 * </ul>
 *
 * @author Promise Team
 * @since 1.0.0
 */
class SettlementContractTest extends AbstractPromiseContractTest {

    @Test
    void testResolve_Value_AwaitReturnsValue() {
        // Given/When: an already-resolved promise
        Promise<String> promise = runtime.resolve("value");

        // Then: await returns the value without error
        Outcome<String> outcome = awaitSettled(promise);
        assertTrue(outcome.isFulfilled());
        assertEquals("value", outcome.valueOrNull());
        assertNull(outcome.errorOrNull());
    }

    @Test
    void testReject_Error_AwaitReturnsError() {
        // Given/When: an already-rejected promise
        IOException error = new IOException("disk unavailable");
        Promise<String> promise = runtime.reject(error);

        // Then: await returns the error and no value
        Outcome<String> outcome = awaitSettled(promise);
        assertTrue(outcome.isRejected());
        assertSame(error, outcome.errorOrNull());
        assertNull(outcome.valueOrNull());
    }

    @Test
    void testExecutorFault_BecomesRejection() {
        // Given: an executor that throws on a worker thread
        IllegalStateException fault = new IllegalStateException("executor blew up");

        // When
        Promise<String> promise = runtime.create((resolver, rejecter) -> {
            throw fault;
        });

        // Then: the promise rejects with the thrown fault as its error
        assertRejectedWith(fault, promise);
        assertEquals(PromiseState.REJECTED, promise.state());
    }

    @Test
    void testExecutorError_BecomesRejection() {
        // Given: an executor that throws an Error, not an Exception
        AssertionError fault = new AssertionError("invariant broken");

        // When
        Promise<String> promise = runtime.create((resolver, rejecter) -> {
            throw fault;
        });

        // Then: the worker survives and the promise rejects
        assertRejectedWith(fault, promise);
        assertFulfilledWith("still alive", delayedResolve("still alive", 0));
    }

    @Test
    void testTwoCallbacksOnPendingPromise_RunInOrderOnce() throws InterruptedException {
        // Given: a pending promise with two registered callbacks
        CountDownLatch release = new CountDownLatch(1);
        Promise<Integer> promise = runtime.create((resolver, rejecter) -> {
            release.await();
            resolver.resolve(42);
        });
        List<String> calls = new CopyOnWriteArrayList<>();
        CountDownLatch bothRan = new CountDownLatch(2);
        promise.then(value -> {
            calls.add("first:" + value);
            bothRan.countDown();
            return null;
        });
        promise.then(value -> {
            calls.add("second:" + value);
            bothRan.countDown();
            return null;
        });

        // When: the promise is resolved
        release.countDown();

        // Then: both callbacks ran, in registration order, exactly once
        assertTrue(bothRan.await(5, TimeUnit.SECONDS));
        sleep(50);
        assertEquals(List.of("first:42", "second:42"), calls);
    }

    @Test
    void testCallbackAfterSettlement_StillDispatched() {
        // Given: an already-fulfilled promise
        Promise<String> settled = runtime.resolve("done");
        assertFulfilledWith("done", settled);

        // When: a callback is registered afterwards
        Promise<Integer> chained = settled.then(String::length);

        // Then: it is dispatched, not dropped
        assertFulfilledWith(4, chained);
    }

    @Test
    void testFirstSettlementWins_LaterCallsIgnored() {
        // Given/When: an executor that settles several times
        Promise<String> promise = runtime.create((resolver, rejecter) -> {
            resolver.resolve("first");
            rejecter.reject(new IllegalStateException("second"));
            resolver.resolve("third");
        });

        // Then: only the first settlement is visible
        assertFulfilledWith("first", promise);
        assertEquals(PromiseState.FULFILLED, promise.state());
    }

    @Test
    void testExecutorRunsOnWorkerThread_NotCaller() {
        // Given
        Thread caller = Thread.currentThread();

        // When
        Promise<Thread> promise = runtime.create((resolver, rejecter) -> resolver.resolve(Thread.currentThread()));

        // Then
        Thread worker = awaitSettled(promise).valueOrNull();
        assertNotSame(caller, worker);
        assertTrue(worker.getName().startsWith("contract-worker-"));
    }
}
