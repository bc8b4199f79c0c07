package com.ryuqq.promise.core.promise;

/**
 * Promise를 오류로 정착시키는 콜백.
 *
 * <p>null 오류로 호출하면 {@link IllegalArgumentException}으로 reject됩니다.</p>
 *
 * @author Promise Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface Rejecter {

    /**
     * 오류로 정착.
     *
     * @param error 정착 오류
     */
    void reject(Throwable error);
}
