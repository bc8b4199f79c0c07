package com.ryuqq.promise.core.outcome;

/**
 * 값으로 정착된 결과.
 *
 * @param value 정착 값 (null 허용)
 * @param <T> 값 타입
 *
 * @author Promise Team
 * @since 1.0.0
 */
public record Fulfilled<T>(T value) implements Outcome<T> {

    @Override
    public T valueOrNull() {
        return value;
    }

    @Override
    public Throwable errorOrNull() {
        return null;
    }

    @Override
    public T getOrThrow() {
        return value;
    }
}
