package com.ryuqq.promise.core.outcome;

/**
 * 오류로 정착된 결과.
 *
 * <p>명시적 reject 호출뿐 아니라, executor나 콜백에서 던져진 예외도
 * 그대로 error로 담깁니다.</p>
 *
 * @param error 정착 오류 (non-null)
 * @param <T> 값 타입
 *
 * @author Promise Team
 * @since 1.0.0
 */
public record Rejected<T>(Throwable error) implements Outcome<T> {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException error가 null인 경우
     */
    public Rejected {
        if (error == null) {
            throw new IllegalArgumentException("error cannot be null");
        }
    }

    @Override
    public T valueOrNull() {
        return null;
    }

    @Override
    public Throwable errorOrNull() {
        return error;
    }

    @Override
    public T getOrThrow() {
        throw new PromiseRejectedException(error);
    }
}
