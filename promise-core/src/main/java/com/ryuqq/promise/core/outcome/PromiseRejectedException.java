package com.ryuqq.promise.core.outcome;

/**
 * 오류로 정착된 결과에서 값을 꺼내려 할 때 발생하는 예외.
 *
 * <p>원래 정착 오류는 {@link #getCause()}로 조회할 수 있습니다.</p>
 *
 * @author Promise Team
 * @since 1.0.0
 */
public final class PromiseRejectedException extends RuntimeException {

    /**
     * 생성자.
     *
     * @param cause 정착 오류
     */
    public PromiseRejectedException(Throwable cause) {
        super("Promise was rejected: " + cause, cause);
    }
}
