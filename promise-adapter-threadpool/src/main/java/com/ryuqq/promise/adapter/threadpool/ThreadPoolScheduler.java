package com.ryuqq.promise.adapter.threadpool;

import com.ryuqq.promise.core.spi.Scheduler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 고정 크기 스레드 풀 기반 Scheduler 구현체.
 *
 * <p>Promise executor 본문과 정착 이후 등록된 콜백을 워커 스레드에서 병렬로 실행합니다.</p>
 *
 * <p><strong>동작 방식:</strong></p>
 * <ul>
 *   <li>schedule(): 작업을 풀에 제출하고 즉시 반환 (비블로킹)</li>
 *   <li>작업에서 빠져나온 예외는 로그로 남기고 워커 스레드는 계속 사용</li>
 *   <li>shutdown 이후 schedule()은 {@link RejectedExecutionException}을 던짐
 *       (Promise는 이 예외로 reject됨)</li>
 * </ul>
 *
 * <p><strong>종료:</strong> {@link #shutdown()}은 진행 중인 작업이 끝나기를
 * shutdownTimeoutMs 동안 기다린 후 강제 종료합니다.</p>
 *
 * <p>이 클래스는 thread-safe합니다.</p>
 *
 * @author Promise Team
 * @since 1.0.0
 */
public final class ThreadPoolScheduler implements Scheduler, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ThreadPoolScheduler.class);

    private final SchedulerConfig config;
    private final ExecutorService workerExecutor;

    /**
     * 기본 설정 생성자.
     */
    public ThreadPoolScheduler() {
        this(new SchedulerConfig());
    }

    /**
     * 생성자.
     *
     * @param config 설정
     * @throws IllegalArgumentException config가 null인 경우
     */
    public ThreadPoolScheduler(SchedulerConfig config) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        this.config = config;
        this.workerExecutor = Executors.newFixedThreadPool(config.poolSize(), new WorkerThreadFactory(config));
        log.debug("ThreadPoolScheduler started: poolSize={}, threadNamePrefix={}",
            config.poolSize(), config.threadNamePrefix());
    }

    @Override
    public void schedule(Runnable task) {
        if (task == null) {
            throw new IllegalArgumentException("task cannot be null");
        }
        workerExecutor.execute(() -> {
            try {
                task.run();
            } catch (RuntimeException | Error e) {
                log.error("Scheduled task failed on {}", Thread.currentThread().getName(), e);
            }
        });
    }

    /**
     * 설정 조회.
     *
     * @return 설정
     */
    public SchedulerConfig config() {
        return config;
    }

    /**
     * 종료 여부 확인.
     *
     * @return shutdown()이 호출된 경우 true
     */
    public boolean isShutdown() {
        return workerExecutor.isShutdown();
    }

    /**
     * Scheduler 종료 (리소스 정리).
     *
     * <p>새 작업 수락을 중단하고, 진행 중인 작업이 완료되도록 shutdownTimeoutMs 동안 대기합니다.
     * 시간 내 완료되지 않으면 강제 종료합니다.</p>
     *
     * @throws InterruptedException shutdown 대기 중 인터럽트 발생 시
     */
    public void shutdown() throws InterruptedException {
        workerExecutor.shutdown();
        if (!workerExecutor.awaitTermination(config.shutdownTimeoutMs(), TimeUnit.MILLISECONDS)) {
            log.warn("ThreadPoolScheduler did not terminate within {}ms, forcing shutdown",
                config.shutdownTimeoutMs());
            workerExecutor.shutdownNow();
        }
    }

    /**
     * {@link #shutdown()} 호출.
     *
     * <p>인터럽트 발생 시 현재 스레드의 인터럽트 플래그를 복원하고 강제 종료합니다.</p>
     */
    @Override
    public void close() {
        try {
            shutdown();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            workerExecutor.shutdownNow();
        }
    }

    /**
     * 이름과 데몬 여부가 지정된 워커 스레드 생성.
     */
    private static final class WorkerThreadFactory implements ThreadFactory {

        private final AtomicInteger threadCounter = new AtomicInteger();
        private final String threadNamePrefix;
        private final boolean daemon;

        private WorkerThreadFactory(SchedulerConfig config) {
            this.threadNamePrefix = config.threadNamePrefix();
            this.daemon = config.daemon();
        }

        @Override
        public Thread newThread(Runnable task) {
            Thread thread = new Thread(task, threadNamePrefix + threadCounter.incrementAndGet());
            thread.setDaemon(daemon);
            return thread;
        }
    }
}
