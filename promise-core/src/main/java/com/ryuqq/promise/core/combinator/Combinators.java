package com.ryuqq.promise.core.combinator;

import com.ryuqq.promise.core.outcome.Outcome;
import com.ryuqq.promise.core.promise.Promise;
import com.ryuqq.promise.core.promise.PromiseRuntime;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReferenceArray;

/**
 * Promise 조합기.
 *
 * <p>여러 Promise를 하나의 집계 Promise로 조합합니다. 모든 조합기는 Promise의 공개 계약
 * (생성, then / catchError)만 사용하며, 내부 상태에 접근하지 않습니다.
 * 입력 Promise를 블로킹 대기하지 않고 콜백 등록으로 결과를 수집합니다.</p>
 *
 * <p><strong>조합기:</strong></p>
 * <ul>
 *   <li>{@link #all}: 모두 FULFILLED → 값 목록, 최초 REJECTED → 즉시 reject</li>
 *   <li>{@link #allSettled}: 모두 정착 → 결과 목록 (reject되지 않음)</li>
 *   <li>{@link #race}: 최초 정착 결과를 그대로 따름 (동시 정착 시 순서는 비결정적)</li>
 * </ul>
 *
 * @author Promise Team
 * @since 1.0.0
 */
public final class Combinators {

    private static final Logger log = LoggerFactory.getLogger(Combinators.class);

    // Utility class - prevent instantiation
    private Combinators() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 모든 Promise가 FULFILLED되면 입력 순서대로 값 목록으로 FULFILLED.
     *
     * <p><strong>동작 방식:</strong></p>
     * <ol>
     *   <li>빈 입력: 즉시 빈 목록으로 FULFILLED</li>
     *   <li>각 입력의 값을 인덱스 위치에 기록</li>
     *   <li>마지막 입력이 FULFILLED되면 수정 불가능한 목록으로 resolve</li>
     *   <li>어느 입력이든 REJECTED되면 그 오류로 즉시 reject (나머지 입력은 더 이상 기다리지 않음)</li>
     * </ol>
     *
     * @param runtime Promise 런타임
     * @param promises 입력 Promise 목록
     * @param <T> 값 타입
     * @return 값 목록 Promise
     * @throws IllegalArgumentException runtime, promises 또는 원소가 null인 경우
     */
    public static <T> Promise<List<T>> all(PromiseRuntime runtime, List<? extends Promise<? extends T>> promises) {
        List<Promise<? extends T>> inputs = validate(runtime, promises);
        if (inputs.isEmpty()) {
            return runtime.resolve(Collections.<T>emptyList());
        }

        int size = inputs.size();
        return runtime.<List<T>>create((resolver, rejecter) -> {
            AtomicReferenceArray<T> values = new AtomicReferenceArray<>(size);
            AtomicInteger remaining = new AtomicInteger(size);

            for (int i = 0; i < size; i++) {
                int index = i;
                Promise<? extends T> input = inputs.get(i);
                input.then(value -> {
                    values.set(index, value);
                    if (remaining.decrementAndGet() == 0) {
                        resolver.resolve(snapshot(values));
                    }
                    return null;
                });
                input.catchError(error -> {
                    rejecter.reject(error);
                    return null;
                });
            }
        });
    }

    /**
     * 모든 Promise가 정착되면 입력 순서대로 결과 목록으로 FULFILLED.
     *
     * <p>각 결과는 {@link com.ryuqq.promise.core.outcome.Fulfilled} 또는
     * {@link com.ryuqq.promise.core.outcome.Rejected}입니다. 이 조합기 자체는 reject되지 않습니다.</p>
     *
     * @param runtime Promise 런타임
     * @param promises 입력 Promise 목록
     * @param <T> 값 타입
     * @return 결과 목록 Promise
     * @throws IllegalArgumentException runtime, promises 또는 원소가 null인 경우
     */
    public static <T> Promise<List<Outcome<T>>> allSettled(PromiseRuntime runtime,
                                                           List<? extends Promise<? extends T>> promises) {
        List<Promise<? extends T>> inputs = validate(runtime, promises);
        if (inputs.isEmpty()) {
            return runtime.resolve(Collections.<Outcome<T>>emptyList());
        }

        int size = inputs.size();
        return runtime.<List<Outcome<T>>>create((resolver, rejecter) -> {
            AtomicReferenceArray<Outcome<T>> outcomes = new AtomicReferenceArray<>(size);
            AtomicInteger remaining = new AtomicInteger(size);

            for (int i = 0; i < size; i++) {
                int index = i;
                Promise<? extends T> input = inputs.get(i);
                input.then(value -> {
                    outcomes.set(index, Outcome.<T>fulfilled(value));
                    if (remaining.decrementAndGet() == 0) {
                        resolver.resolve(snapshot(outcomes));
                    }
                    return null;
                });
                input.catchError(error -> {
                    outcomes.set(index, Outcome.<T>rejected(error));
                    if (remaining.decrementAndGet() == 0) {
                        resolver.resolve(snapshot(outcomes));
                    }
                    return null;
                });
            }
        });
    }

    /**
     * 가장 먼저 정착된 Promise의 결과(값 또는 오류)로 정착.
     *
     * <p>늦게 정착된 입력의 결과는 버려집니다. 동시에 정착된 경우 어느 쪽이 이길지는
     * 비결정적입니다. 빈 입력이면 영원히 PENDING인 Promise를 반환합니다.</p>
     *
     * @param runtime Promise 런타임
     * @param promises 입력 Promise 목록
     * @param <T> 값 타입
     * @return 최초 정착 결과를 따르는 Promise
     * @throws IllegalArgumentException runtime, promises 또는 원소가 null인 경우
     */
    public static <T> Promise<T> race(PromiseRuntime runtime, List<? extends Promise<? extends T>> promises) {
        List<Promise<? extends T>> inputs = validate(runtime, promises);
        if (inputs.isEmpty()) {
            log.debug("race called with no promises, returned promise stays pending");
        }

        return runtime.<T>create((resolver, rejecter) -> {
            for (Promise<? extends T> input : inputs) {
                input.then(value -> {
                    resolver.resolve(value);
                    return null;
                });
                input.catchError(error -> {
                    rejecter.reject(error);
                    return null;
                });
            }
        });
    }

    private static <T> List<Promise<? extends T>> validate(PromiseRuntime runtime,
                                                          List<? extends Promise<? extends T>> promises) {
        if (runtime == null) {
            throw new IllegalArgumentException("runtime cannot be null");
        }
        if (promises == null) {
            throw new IllegalArgumentException("promises cannot be null");
        }
        List<Promise<? extends T>> inputs = new ArrayList<>(promises.size());
        for (int i = 0; i < promises.size(); i++) {
            Promise<? extends T> promise = promises.get(i);
            if (promise == null) {
                throw new IllegalArgumentException("promises cannot contain null (index: " + i + ")");
            }
            inputs.add(promise);
        }
        return inputs;
    }

    private static <E> List<E> snapshot(AtomicReferenceArray<E> array) {
        List<E> list = new ArrayList<>(array.length());
        for (int i = 0; i < array.length(); i++) {
            list.add(array.get(i));
        }
        return Collections.unmodifiableList(list);
    }
}
