package com.ryuqq.promise.core.promise;

import com.ryuqq.promise.core.outcome.Outcome;
import com.ryuqq.promise.core.statemachine.PromiseState;

/**
 * 비동기 결과 컨테이너.
 *
 * <p>백그라운드에서 생성되는 값을 가리키는 핸들로, 관찰자 등록(then / catchError)과
 * 블로킹 조회(await)를 제공합니다.</p>
 *
 * <p><strong>정착 규칙:</strong></p>
 * <ul>
 *   <li>PENDING → FULFILLED 또는 PENDING → REJECTED, 단 한 번</li>
 *   <li>정착 이후 값/오류는 변경되지 않음</li>
 * </ul>
 *
 * <p><strong>콜백 디스패치:</strong></p>
 * <ul>
 *   <li>PENDING 상태에서 등록된 콜백: 정착 시점에 정착을 수행한 스레드에서 등록 순서대로 한 번씩 실행</li>
 *   <li>정착 이후 등록된 콜백: 버려지지 않고 Scheduler를 통해 비동기로 실행 (등록 호출 내에서 인라인 실행하지 않음)</li>
 *   <li>같은 Promise에 여러 번 등록하면 각각 독립된 체인이 생성됨</li>
 *   <li>콜백에서 던져진 예외는 하위 Promise의 rejection으로 변환</li>
 * </ul>
 *
 * <p><strong>동시성:</strong> 모든 메서드는 thread-safe합니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * Promise&lt;Integer&gt; length = runtime.create((resolver, rejecter) -&gt; resolver.resolve("hello"))
 *     .then(String::length);
 *
 * Outcome&lt;Integer&gt; outcome = length.await();
 * if (outcome.isFulfilled()) {
 *     int value = outcome.valueOrNull();
 * }
 * </pre>
 *
 * @param <T> 값 타입
 *
 * @author Promise Team
 * @since 1.0.0
 */
public interface Promise<T> {

    /**
     * 값 처리 콜백 등록.
     *
     * <p>콜백의 반환값이 반환되는 Promise의 값이 됩니다. 반환값이 {@link Promise}이면
     * 평탄화되어 그 결과를 따릅니다. 이 Promise가 REJECTED이면 콜백은 호출되지 않고
     * 동일한 오류가 하위로 전파됩니다.</p>
     *
     * @param onFulfilled 값 처리 콜백
     * @param <R> 결과 타입
     * @return 콜백 결과를 나타내는 새 Promise
     * @throws IllegalArgumentException onFulfilled가 null인 경우
     */
    <R> Promise<R> then(ThrowingFunction<? super T, ? extends R> onFulfilled);

    /**
     * Promise를 반환하는 값 처리 콜백 등록.
     *
     * <p>{@link #then(ThrowingFunction)}의 타입 안전한 형태로, 콜백이 반환한 Promise의
     * 결과를 따릅니다. 콜백이 null을 반환하면 {@link IllegalStateException}으로 reject됩니다.</p>
     *
     * @param onFulfilled Promise를 반환하는 콜백
     * @param <R> 결과 타입
     * @return 반환된 Promise의 결과를 따르는 새 Promise
     * @throws IllegalArgumentException onFulfilled가 null인 경우
     */
    <R> Promise<R> thenCompose(ThrowingFunction<? super T, ? extends Promise<? extends R>> onFulfilled);

    /**
     * 오류 처리 콜백 등록.
     *
     * <p><strong>복구 규칙:</strong></p>
     * <ul>
     *   <li>null 반환: 복구 - 하위 Promise는 null 값으로 FULFILLED</li>
     *   <li>non-null Throwable 반환: 하위 Promise는 반환된 오류로 REJECTED</li>
     *   <li>예외 발생: 하위 Promise는 던져진 예외로 REJECTED</li>
     * </ul>
     *
     * <p>이 Promise가 FULFILLED이면 콜백은 호출되지 않고 값이 그대로 전달됩니다.</p>
     *
     * @param onRejected 오류 처리 콜백
     * @return 처리 결과를 나타내는 새 Promise
     * @throws IllegalArgumentException onRejected가 null인 경우
     */
    Promise<T> catchError(ThrowingFunction<? super Throwable, ? extends Throwable> onRejected);

    /**
     * 오류를 대체 값으로 복구하는 콜백 등록.
     *
     * <p>콜백 반환값이 하위 Promise의 값이 됩니다 (Promise이면 평탄화).</p>
     *
     * @param onRejected 대체 값을 계산하는 콜백
     * @return 복구 결과를 나타내는 새 Promise
     * @throws IllegalArgumentException onRejected가 null인 경우
     */
    Promise<T> recover(ThrowingFunction<? super Throwable, ? extends T> onRejected);

    /**
     * 정착될 때까지 블로킹 대기 후 결과 반환.
     *
     * <p>타임아웃 없이 무기한 대기합니다. 여러 스레드가 동시에 대기할 수 있으며,
     * 모두 정착 후 동일한 결과를 받습니다. 정착 이후 호출은 블로킹하지 않습니다.</p>
     *
     * @return 정착 결과 (Fulfilled 또는 Rejected)
     * @throws PromiseInterruptedException 대기 중 인터럽트된 경우 (인터럽트 플래그 복원됨)
     */
    Outcome<T> await();

    /**
     * 현재 상태 조회 (비블로킹 스냅샷).
     *
     * @return 현재 상태
     */
    PromiseState state();

    /**
     * 정착 여부 확인.
     *
     * @return FULFILLED 또는 REJECTED인 경우 true
     */
    default boolean isSettled() {
        return state().isSettled();
    }
}
