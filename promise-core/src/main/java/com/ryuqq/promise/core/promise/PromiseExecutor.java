package com.ryuqq.promise.core.promise;

/**
 * Promise 생성 시 백그라운드에서 실행되는 작업 본문.
 *
 * <p>resolver 또는 rejecter 중 하나를 호출하여 Promise를 정착시킵니다.
 * 본문에서 던져진 예외(Error 포함)는 해당 예외를 오류로 하는 rejection으로 변환됩니다.</p>
 *
 * <p><strong>주의:</strong> 둘 중 어느 것도 호출하지 않으면 Promise는 영원히 PENDING 상태로 남습니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * Promise&lt;Integer&gt; promise = runtime.create((resolver, rejecter) -&gt; {
 *     int result = compute();
 *     if (result &lt; 0) {
 *         rejecter.reject(new IllegalStateException("negative"));
 *         return;
 *     }
 *     resolver.resolve(result);
 * });
 * </pre>
 *
 * @param <T> 값 타입
 *
 * @author Promise Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface PromiseExecutor<T> {

    /**
     * 작업 실행.
     *
     * @param resolver 값으로 정착시키는 콜백
     * @param rejecter 오류로 정착시키는 콜백
     * @throws Exception 실패 시 (rejection으로 변환됨)
     */
    void execute(Resolver<T> resolver, Rejecter rejecter) throws Exception;
}
