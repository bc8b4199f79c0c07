package com.ryuqq.promise.core.promise;

/**
 * {@link Promise#await()} 대기 중 스레드가 인터럽트되었을 때 발생하는 예외.
 *
 * <p>예외 발생 시 현재 스레드의 인터럽트 플래그는 복원되어 있습니다.</p>
 *
 * @author Promise Team
 * @since 1.0.0
 */
public final class PromiseInterruptedException extends RuntimeException {

    /**
     * 생성자.
     *
     * @param message 메시지
     * @param cause 원인
     */
    public PromiseInterruptedException(String message, InterruptedException cause) {
        super(message, cause);
    }
}
