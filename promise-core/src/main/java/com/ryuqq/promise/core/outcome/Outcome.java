package com.ryuqq.promise.core.outcome;

/**
 * Promise 정착 결과.
 *
 * <p>Outcome은 두 가지 가능한 결과를 나타냅니다:</p>
 * <ul>
 *   <li>{@link Fulfilled}: 값으로 정착됨</li>
 *   <li>{@link Rejected}: 오류로 정착됨</li>
 * </ul>
 *
 * <p>(value, error) 쌍의 Java 표현으로, 정확히 한 쪽만 의미를 가집니다.
 * 호출자는 값을 사용하기 전에 반드시 오류 여부를 확인해야 합니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * Outcome&lt;String&gt; outcome = promise.await();
 * if (outcome.isRejected()) {
 *     log.warn("failed", outcome.errorOrNull());
 *     return;
 * }
 * String value = outcome.valueOrNull();
 * </pre>
 *
 * @param <T> 값 타입
 *
 * @author Promise Team
 * @since 1.0.0
 */
public sealed interface Outcome<T> permits Fulfilled, Rejected {

    /**
     * 값으로 정착된 결과 생성.
     *
     * @param value 값 (null 가능)
     * @param <T> 값 타입
     * @return Fulfilled 인스턴스
     */
    static <T> Outcome<T> fulfilled(T value) {
        return new Fulfilled<>(value);
    }

    /**
     * 오류로 정착된 결과 생성.
     *
     * @param error 오류
     * @param <T> 값 타입
     * @return Rejected 인스턴스
     * @throws IllegalArgumentException error가 null인 경우
     */
    static <T> Outcome<T> rejected(Throwable error) {
        return new Rejected<>(error);
    }

    /**
     * 결과가 값인지 확인.
     *
     * @return 값으로 정착된 경우 true
     */
    default boolean isFulfilled() {
        return this instanceof Fulfilled;
    }

    /**
     * 결과가 오류인지 확인.
     *
     * @return 오류로 정착된 경우 true
     */
    default boolean isRejected() {
        return this instanceof Rejected;
    }

    /**
     * 값 조회.
     *
     * @return 값 또는 null (오류로 정착된 경우)
     */
    T valueOrNull();

    /**
     * 오류 조회.
     *
     * @return 오류 또는 null (값으로 정착된 경우)
     */
    Throwable errorOrNull();

    /**
     * 값을 반환하거나, 오류로 정착된 경우 예외를 던집니다.
     *
     * @return 값
     * @throws PromiseRejectedException 오류로 정착된 경우 (cause = 원래 오류)
     */
    T getOrThrow();
}
