package com.ryuqq.promise.core.promise;

import com.ryuqq.promise.core.outcome.Outcome;
import com.ryuqq.promise.core.spi.Scheduler;
import com.ryuqq.promise.core.statemachine.PromiseState;
import com.ryuqq.promise.core.statemachine.StateTransition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.List;
import java.util.Queue;
import java.util.concurrent.Callable;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;

/**
 * Promise 기본 구현체.
 *
 * <p>상태 머신, 정착, 콜백 등록/디스패치, 평탄화, 블로킹 대기를 담당합니다.</p>
 *
 * <p><strong>동기화:</strong></p>
 * <ul>
 *   <li>상태, 결과, 콜백 목록은 모두 {@code lock}으로 보호</li>
 *   <li>정착 신호는 같은 lock의 {@link Condition} (signalAll 1회)</li>
 *   <li>콜백은 lock을 보유하지 않은 상태에서 실행</li>
 *   <li>늦은 등록은 lock 안에서 상태를 확인: 목록에 추가되거나 정착 결과를 보고 예약되거나, 둘 중 정확히 하나</li>
 * </ul>
 *
 * <p><strong>디스패치 깊이:</strong> 대기 중인 체인이 정착되면 콜백이 다음 Promise를 정착시키며 스택이 깊어집니다.
 * 스레드별 디스패치 깊이가 {@value #MAX_DISPATCH_STACK_DEPTH}에 도달하면 이후 콜백은 스레드별 대기열에 쌓이고,
 * 가장 바깥 디스패치 프레임이 등록 순서대로 비웁니다. 한 콜백이 실패해도 나머지 콜백은 실행됩니다.
 * 깊은 체인 안의 콜백에서 같은 스레드가 정착시킬 Promise를 await하면 반환되지 않습니다.</p>
 *
 * <p><strong>최초 호출 우선:</strong> executor에 전달된 resolver/rejecter는 최초 호출만 유효합니다.
 * 다른 Promise를 따르는 중(평탄화 대기)이어도 이후 호출은 무시됩니다.</p>
 *
 * @param <T> 값 타입
 *
 * @author Promise Team
 * @since 1.0.0
 */
final class DefaultPromise<T> implements Promise<T> {

    private static final Logger log = LoggerFactory.getLogger(DefaultPromise.class);

    static final int MAX_DISPATCH_STACK_DEPTH = 16;

    private static final ThreadLocal<DispatchStack> DISPATCH_STACK = ThreadLocal.withInitial(DispatchStack::new);

    private final Scheduler scheduler;
    private final ReentrantLock lock = new ReentrantLock();
    private final Condition settledSignal = lock.newCondition();

    private PromiseState state = PromiseState.PENDING;
    private Outcome<T> outcome;
    private boolean resolutionClaimed;
    private List<Consumer<? super T>> fulfillmentCallbacks = new ArrayList<>();
    private List<Consumer<? super Throwable>> rejectionCallbacks = new ArrayList<>();

    /**
     * 생성자.
     *
     * @param scheduler 작업 스케줄러
     * @throws IllegalArgumentException scheduler가 null인 경우
     */
    DefaultPromise(Scheduler scheduler) {
        if (scheduler == null) {
            throw new IllegalArgumentException("scheduler cannot be null");
        }
        this.scheduler = scheduler;
    }

    /**
     * executor를 Scheduler에 제출.
     *
     * <p>executor에서 던져진 예외는 rejection으로 변환됩니다.
     * Scheduler가 작업을 거부하면 그 예외로 reject됩니다.</p>
     *
     * @param executor 작업 본문
     */
    void start(PromiseExecutor<T> executor) {
        Settler settler = new Settler();
        Runnable task = () -> {
            try {
                executor.execute(settler, settler);
            } catch (Throwable t) {
                if (rejectOnce(t)) {
                    log.debug("Promise executor threw, converting to rejection", t);
                } else {
                    log.warn("Promise executor threw after its promise was already resolved, fault not delivered", t);
                }
            }
        };

        try {
            scheduler.schedule(task);
        } catch (RuntimeException e) {
            log.warn("Scheduler refused promise executor, rejecting promise", e);
            rejectOnce(e);
        }
    }

    /**
     * 외부(resolver, 콜백 결과)에서의 resolve. 최초 호출만 유효.
     *
     * @param value 값 (런타임에 Promise이면 평탄화)
     * @return 이 호출이 결과를 결정했으면 true
     */
    boolean resolveOnce(T value) {
        if (!claimResolution()) {
            return false;
        }
        resolveValue(value);
        return true;
    }

    /**
     * 다른 Promise의 결과를 따르도록 resolve. 최초 호출만 유효.
     *
     * @param promise 따를 Promise
     * @return 이 호출이 결과를 결정했으면 true
     */
    boolean adoptOnce(Promise<? extends T> promise) {
        if (!claimResolution()) {
            return false;
        }
        adopt(promise);
        return true;
    }

    /**
     * 외부(rejecter, 콜백 결과)에서의 reject. 최초 호출만 유효.
     *
     * @param error 오류
     * @return 이 호출이 결과를 결정했으면 true
     */
    boolean rejectOnce(Throwable error) {
        if (!claimResolution()) {
            return false;
        }
        settle(Outcome.rejected(nonNullError(error)));
        return true;
    }

    @Override
    public <R> Promise<R> then(ThrowingFunction<? super T, ? extends R> onFulfilled) {
        if (onFulfilled == null) {
            throw new IllegalArgumentException("onFulfilled cannot be null");
        }
        DefaultPromise<R> next = new DefaultPromise<>(scheduler);
        subscribe(
            value -> next.resolveFrom(() -> onFulfilled.apply(value)),
            next::rejectOnce
        );
        return next;
    }

    @Override
    public <R> Promise<R> thenCompose(ThrowingFunction<? super T, ? extends Promise<? extends R>> onFulfilled) {
        if (onFulfilled == null) {
            throw new IllegalArgumentException("onFulfilled cannot be null");
        }
        DefaultPromise<R> next = new DefaultPromise<>(scheduler);
        subscribe(
            value -> next.adoptFrom(() -> {
                Promise<? extends R> composed = onFulfilled.apply(value);
                if (composed == null) {
                    throw new IllegalStateException("thenCompose callback returned null");
                }
                return composed;
            }),
            next::rejectOnce
        );
        return next;
    }

    @Override
    public Promise<T> catchError(ThrowingFunction<? super Throwable, ? extends Throwable> onRejected) {
        if (onRejected == null) {
            throw new IllegalArgumentException("onRejected cannot be null");
        }
        DefaultPromise<T> next = new DefaultPromise<>(scheduler);
        subscribe(
            next::resolveOnce,
            error -> {
                Throwable replacement;
                try {
                    replacement = onRejected.apply(error);
                } catch (Throwable t) {
                    log.debug("catchError callback threw, converting to rejection", t);
                    next.rejectOnce(t);
                    return;
                }
                if (replacement == null) {
                    next.resolveOnce(null);
                } else {
                    next.rejectOnce(replacement);
                }
            }
        );
        return next;
    }

    @Override
    public Promise<T> recover(ThrowingFunction<? super Throwable, ? extends T> onRejected) {
        if (onRejected == null) {
            throw new IllegalArgumentException("onRejected cannot be null");
        }
        DefaultPromise<T> next = new DefaultPromise<>(scheduler);
        subscribe(
            next::resolveOnce,
            error -> next.resolveFrom(() -> onRejected.apply(error))
        );
        return next;
    }

    @Override
    public Outcome<T> await() {
        lock.lock();
        try {
            while (!state.isSettled()) {
                settledSignal.await();
            }
            return outcome;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new PromiseInterruptedException("Await interrupted", e);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public PromiseState state() {
        lock.lock();
        try {
            return state;
        } finally {
            lock.unlock();
        }
    }

    /**
     * 콜백 쌍 등록.
     *
     * <p>PENDING이면 목록에 추가하여 정착 시 실행하고,
     * 이미 정착되었으면 Scheduler를 통해 비동기로 실행합니다.</p>
     *
     * @param onFulfilled 값 콜백
     * @param onRejected 오류 콜백
     */
    void subscribe(Consumer<? super T> onFulfilled, Consumer<? super Throwable> onRejected) {
        Outcome<T> settled;
        lock.lock();
        try {
            if (!state.isSettled()) {
                fulfillmentCallbacks.add(onFulfilled);
                rejectionCallbacks.add(onRejected);
                return;
            }
            settled = outcome;
        } finally {
            lock.unlock();
        }

        Runnable dispatch = () -> notifyCallback(() -> deliver(settled, onFulfilled, onRejected));
        try {
            scheduler.schedule(dispatch);
        } catch (RuntimeException e) {
            // 콜백 유실 방지: 예약 실패 시 호출 스레드에서 실행
            log.warn("Scheduler refused callback dispatch, running it on the registering thread", e);
            dispatch.run();
        }
    }

    /**
     * Callable 결과로 resolve. 예외는 rejection으로 변환.
     */
    private void resolveFrom(Callable<? extends T> computation) {
        T result;
        try {
            result = computation.call();
        } catch (Throwable t) {
            log.debug("Promise callback threw, converting to rejection", t);
            rejectOnce(t);
            return;
        }
        resolveOnce(result);
    }

    /**
     * Callable이 반환한 Promise를 따름. 예외는 rejection으로 변환.
     */
    private void adoptFrom(Callable<? extends Promise<? extends T>> computation) {
        Promise<? extends T> composed;
        try {
            composed = computation.call();
        } catch (Throwable t) {
            log.debug("Promise callback threw, converting to rejection", t);
            rejectOnce(t);
            return;
        }
        adoptOnce(composed);
    }

    /**
     * 값으로 정착하거나, 값이 Promise이면 그 결과를 따름 (평탄화).
     */
    private void resolveValue(T value) {
        if (value instanceof Promise) {
            // 값 자리에 놓인 Promise는 자신의 최종 값으로 대체되므로, 그 값은 이 Promise의 T 자리에 놓인다
            @SuppressWarnings("unchecked")
            Promise<? extends T> nested = (Promise<? extends T>) value;
            adopt(nested);
            return;
        }
        settle(Outcome.fulfilled(value));
    }

    /**
     * 내부 Promise의 최종 결과를 따르도록 pass-through 콜백 등록.
     */
    private void adopt(Promise<? extends T> inner) {
        if (inner == this) {
            settle(Outcome.rejected(new IllegalStateException("promise cannot adopt itself")));
            return;
        }

        if (inner instanceof DefaultPromise) {
            ((DefaultPromise<? extends T>) inner).subscribe(this::resolveValue, this::settleRejected);
            return;
        }

        try {
            inner.then(value -> {
                resolveValue(value);
                return null;
            });
            inner.catchError(error -> {
                settleRejected(error);
                return null;
            });
        } catch (Throwable t) {
            log.warn("Adopted promise {} failed to register callbacks, rejecting", inner.getClass().getName(), t);
            settleRejected(t);
        }
    }

    private void settleRejected(Throwable error) {
        settle(Outcome.rejected(nonNullError(error)));
    }

    /**
     * 정착 수행 (단 한 번).
     *
     * <p>이미 정착된 경우 무시합니다. 정착 시 대기 중인 스레드를 모두 깨우고,
     * 등록된 콜백을 등록 순서대로 현재 스레드에서 실행합니다.</p>
     */
    private void settle(Outcome<T> result) {
        List<Consumer<? super T>> onFulfilled;
        List<Consumer<? super Throwable>> onRejected;

        lock.lock();
        try {
            if (state.isSettled()) {
                log.debug("Ignoring settlement of already {} promise", state);
                return;
            }
            state = StateTransition.transition(
                state,
                result.isFulfilled() ? PromiseState.FULFILLED : PromiseState.REJECTED
            );
            outcome = result;
            onFulfilled = fulfillmentCallbacks;
            onRejected = rejectionCallbacks;
            fulfillmentCallbacks = null;
            rejectionCallbacks = null;
            settledSignal.signalAll();
        } finally {
            lock.unlock();
        }

        if (result.isFulfilled()) {
            T value = result.valueOrNull();
            for (Consumer<? super T> callback : onFulfilled) {
                notifyCallback(() -> callback.accept(value));
            }
        } else {
            Throwable error = result.errorOrNull();
            for (Consumer<? super Throwable> callback : onRejected) {
                notifyCallback(() -> callback.accept(error));
            }
        }
    }

    /**
     * 콜백 실행 (스레드별 깊이 제한).
     *
     * <p>깊이 한도에 도달하면 대기열에 넣고, 가장 바깥 프레임이 대기열을 비웁니다.</p>
     */
    private static void notifyCallback(Runnable callback) {
        DispatchStack stack = DISPATCH_STACK.get();
        if (stack.depth >= MAX_DISPATCH_STACK_DEPTH) {
            stack.deferred.add(callback);
            return;
        }

        stack.depth++;
        try {
            runGuarded(callback);
            if (stack.depth == 1) {
                Runnable deferred;
                while ((deferred = stack.deferred.poll()) != null) {
                    runGuarded(deferred);
                }
            }
        } finally {
            stack.depth--;
        }
    }

    private static void runGuarded(Runnable callback) {
        try {
            callback.run();
        } catch (Throwable t) {
            log.warn("Promise callback dispatch failed, continuing with remaining callbacks", t);
        }
    }

    private boolean claimResolution() {
        lock.lock();
        try {
            if (resolutionClaimed || state.isSettled()) {
                log.debug("Ignoring resolve/reject on promise whose resolution is already decided");
                return false;
            }
            resolutionClaimed = true;
            return true;
        } finally {
            lock.unlock();
        }
    }

    private void deliver(Outcome<T> settled, Consumer<? super T> onFulfilled, Consumer<? super Throwable> onRejected) {
        if (settled.isFulfilled()) {
            onFulfilled.accept(settled.valueOrNull());
        } else {
            onRejected.accept(settled.errorOrNull());
        }
    }

    private static Throwable nonNullError(Throwable error) {
        return error != null ? error : new IllegalArgumentException("error cannot be null");
    }

    @Override
    public String toString() {
        lock.lock();
        try {
            if (!state.isSettled()) {
                return "DefaultPromise{state=PENDING}";
            }
            if (state == PromiseState.FULFILLED) {
                return "DefaultPromise{state=FULFILLED, value=" + outcome.valueOrNull() + "}";
            }
            return "DefaultPromise{state=REJECTED, error=" + outcome.errorOrNull() + "}";
        } finally {
            lock.unlock();
        }
    }

    /**
     * executor에 전달되는 resolver/rejecter.
     */
    private final class Settler implements Resolver<T>, Rejecter {

        @Override
        public void resolve(T value) {
            resolveOnce(value);
        }

        @Override
        public void resolve(Promise<? extends T> promise) {
            if (promise == null) {
                resolveOnce(null);
                return;
            }
            adoptOnce(promise);
        }

        @Override
        public void reject(Throwable error) {
            rejectOnce(error);
        }
    }

    /**
     * 스레드별 디스패치 깊이와 지연된 콜백.
     */
    private static final class DispatchStack {

        private final Queue<Runnable> deferred = new ArrayDeque<>();
        private int depth;
    }
}
