package com.ryuqq.promise.core.promise;

/**
 * Promise를 값으로 정착시키는 콜백.
 *
 * <p>{@link PromiseExecutor}에 전달됩니다. 최초 resolve/reject 호출만 유효하며,
 * 이후 호출은 무시됩니다.</p>
 *
 * <p><strong>평탄화:</strong> 전달된 값이 {@link Promise}이면 그 Promise 자체를 값으로
 * 사용하지 않고, 해당 Promise의 최종 결과를 그대로 따릅니다 (재귀적).</p>
 *
 * @param <T> 값 타입
 *
 * @author Promise Team
 * @since 1.0.0
 */
public interface Resolver<T> {

    /**
     * 값으로 정착.
     *
     * <p>값이 런타임에 {@link Promise}인 경우에도 평탄화가 적용됩니다.</p>
     *
     * @param value 정착 값 (null 허용)
     */
    void resolve(T value);

    /**
     * 다른 Promise의 결과를 따라 정착.
     *
     * @param promise 따를 Promise
     */
    void resolve(Promise<? extends T> promise);
}
