package com.ryuqq.promise.core.spi;

/**
 * 작업 스케줄러 SPI.
 *
 * <p>Promise 코어가 외부에 요구하는 유일한 실행 계약입니다:
 * "이 작업을 호출자와 독립적으로 실행하라".</p>
 *
 * <p><strong>책임:</strong></p>
 * <ul>
 *   <li>executor 본문 실행 (Promise 생성 시)</li>
 *   <li>정착 이후 등록된 콜백의 비동기 디스패치</li>
 * </ul>
 *
 * <p><strong>동시성:</strong></p>
 * <ul>
 *   <li>구현체는 thread-safe해야 합니다.</li>
 *   <li>schedule()은 여러 스레드에서 동시에 호출될 수 있습니다.</li>
 *   <li>작업을 수락할 수 없으면 {@link java.util.concurrent.RejectedExecutionException}을 던집니다.</li>
 * </ul>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * ExecutorService pool = Executors.newFixedThreadPool(4);
 * Scheduler scheduler = pool::execute;
 * PromiseRuntime runtime = new PromiseRuntime(scheduler);
 * </pre>
 *
 * @author Promise Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface Scheduler {

    /**
     * 작업 실행 예약.
     *
     * <p>이 메서드는 비블로킹으로 즉시 반환되어야 하며,
     * 실제 실행은 호출자와 독립적으로 수행됩니다.</p>
     *
     * @param task 실행할 작업
     * @throws java.util.concurrent.RejectedExecutionException 작업을 수락할 수 없는 경우
     */
    void schedule(Runnable task);
}
