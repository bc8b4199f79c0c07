package com.ryuqq.promise.core.promise;

import com.ryuqq.promise.core.combinator.Combinators;
import com.ryuqq.promise.core.outcome.Outcome;
import com.ryuqq.promise.core.spi.Scheduler;

import java.util.Arrays;
import java.util.List;

/**
 * 하나의 {@link Scheduler}에 묶인 Promise 팩토리.
 *
 * <p>Promise 생성, 정착된 Promise 생성(resolve / reject), 조합(all / allSettled / race)의
 * 진입점입니다. 이 런타임으로 생성된 Promise와 그로부터 파생된 Promise는 모두 같은
 * Scheduler를 사용합니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * PromiseRuntime runtime = new PromiseRuntime(new ThreadPoolScheduler(new SchedulerConfig()));
 *
 * Promise&lt;List&lt;Integer&gt;&gt; both = runtime.all(
 *     runtime.create((resolver, rejecter) -&gt; resolver.resolve(1)),
 *     runtime.resolve(2)
 * );
 * </pre>
 *
 * <p>이 클래스는 thread-safe합니다.</p>
 *
 * @author Promise Team
 * @since 1.0.0
 */
public final class PromiseRuntime {

    private final Scheduler scheduler;

    /**
     * 생성자.
     *
     * @param scheduler 작업 스케줄러
     * @throws IllegalArgumentException scheduler가 null인 경우
     */
    public PromiseRuntime(Scheduler scheduler) {
        if (scheduler == null) {
            throw new IllegalArgumentException("scheduler cannot be null");
        }
        this.scheduler = scheduler;
    }

    /**
     * 런타임의 Scheduler 조회.
     *
     * @return Scheduler
     */
    public Scheduler scheduler() {
        return scheduler;
    }

    /**
     * Promise 생성 및 executor 실행 예약.
     *
     * <p>즉시(비블로킹) PENDING 상태의 Promise를 반환하며,
     * executor는 Scheduler에서 호출자와 독립적으로 실행됩니다.</p>
     *
     * @param executor 작업 본문
     * @param <T> 값 타입
     * @return PENDING 상태의 Promise
     * @throws IllegalArgumentException executor가 null인 경우
     */
    public <T> Promise<T> create(PromiseExecutor<T> executor) {
        if (executor == null) {
            throw new IllegalArgumentException("executor cannot be null");
        }
        DefaultPromise<T> promise = new DefaultPromise<>(scheduler);
        promise.start(executor);
        return promise;
    }

    /**
     * 값으로 정착된 Promise 생성.
     *
     * <p>value가 런타임에 {@link Promise}이면 즉시 정착하지 않고 그 결과를 따릅니다.</p>
     *
     * @param value 값 (null 허용)
     * @param <T> 값 타입
     * @return FULFILLED 상태의 Promise (value가 Promise이면 그 결과를 따르는 Promise)
     */
    public <T> Promise<T> resolve(T value) {
        DefaultPromise<T> promise = new DefaultPromise<>(scheduler);
        promise.resolveOnce(value);
        return promise;
    }

    /**
     * 다른 Promise의 결과를 따르는 Promise 생성.
     *
     * @param promise 따를 Promise
     * @param <T> 값 타입
     * @return promise의 결과를 따르는 Promise
     * @throws IllegalArgumentException promise가 null인 경우
     */
    public <T> Promise<T> resolve(Promise<? extends T> promise) {
        if (promise == null) {
            throw new IllegalArgumentException("promise cannot be null");
        }
        DefaultPromise<T> adopted = new DefaultPromise<>(scheduler);
        adopted.adoptOnce(promise);
        return adopted;
    }

    /**
     * 오류로 정착된 Promise 생성.
     *
     * <p>오류는 평탄화 대상이 아닙니다.</p>
     *
     * @param error 오류
     * @param <T> 값 타입
     * @return REJECTED 상태의 Promise
     * @throws IllegalArgumentException error가 null인 경우
     */
    public <T> Promise<T> reject(Throwable error) {
        if (error == null) {
            throw new IllegalArgumentException("error cannot be null");
        }
        DefaultPromise<T> promise = new DefaultPromise<>(scheduler);
        promise.rejectOnce(error);
        return promise;
    }

    /**
     * 모든 Promise가 FULFILLED되면 입력 순서대로 값 목록을 반환.
     *
     * @see Combinators#all(PromiseRuntime, List)
     */
    public <T> Promise<List<T>> all(List<? extends Promise<? extends T>> promises) {
        return Combinators.all(this, promises);
    }

    /**
     * {@link #all(List)}의 가변 인자 형태.
     */
    @SafeVarargs
    public final <T> Promise<List<T>> all(Promise<? extends T>... promises) {
        return Combinators.all(this, asList(promises));
    }

    /**
     * 모든 Promise가 정착되면 입력 순서대로 결과 목록을 반환 (reject되지 않음).
     *
     * @see Combinators#allSettled(PromiseRuntime, List)
     */
    public <T> Promise<List<Outcome<T>>> allSettled(List<? extends Promise<? extends T>> promises) {
        return Combinators.allSettled(this, promises);
    }

    /**
     * {@link #allSettled(List)}의 가변 인자 형태.
     */
    @SafeVarargs
    public final <T> Promise<List<Outcome<T>>> allSettled(Promise<? extends T>... promises) {
        return Combinators.allSettled(this, asList(promises));
    }

    /**
     * 가장 먼저 정착된 Promise의 결과를 따름.
     *
     * @see Combinators#race(PromiseRuntime, List)
     */
    public <T> Promise<T> race(List<? extends Promise<? extends T>> promises) {
        return Combinators.race(this, promises);
    }

    /**
     * {@link #race(List)}의 가변 인자 형태.
     */
    @SafeVarargs
    public final <T> Promise<T> race(Promise<? extends T>... promises) {
        return Combinators.race(this, asList(promises));
    }

    private static <E> List<E> asList(E[] elements) {
        if (elements == null) {
            throw new IllegalArgumentException("promises cannot be null");
        }
        return Arrays.asList(elements);
    }
}
