package com.ryuqq.promise.core.promise;

/**
 * 예외를 던질 수 있는 함수.
 *
 * <p>then / catchError / recover 콜백의 형태입니다.
 * 콜백에서 던져진 예외는 하위 Promise의 rejection으로 변환됩니다.</p>
 *
 * @param <T> 입력 타입
 * @param <R> 반환 타입
 *
 * @author Promise Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface ThrowingFunction<T, R> {

    /**
     * 함수 적용.
     *
     * @param input 입력
     * @return 결과
     * @throws Exception 실패 시 (rejection으로 변환됨)
     */
    R apply(T input) throws Exception;
}
