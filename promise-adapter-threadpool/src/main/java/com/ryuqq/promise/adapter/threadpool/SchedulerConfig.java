package com.ryuqq.promise.adapter.threadpool;

/**
 * ThreadPoolScheduler 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>poolSize: 워커 스레드 수 (기본 8)</li>
 *   <li>threadNamePrefix: 워커 스레드 이름 접두사 (기본 "promise-worker-")</li>
 *   <li>daemon: 데몬 스레드 여부 (기본 true)</li>
 *   <li>shutdownTimeoutMs: shutdown 시 작업 완료 대기 시간 (기본 60000ms)</li>
 * </ul>
 *
 * <p><strong>튜닝 가이드:</strong></p>
 * <ul>
 *   <li>executor 본문이 await()로 다른 Promise를 기다린다면, 동시에 대기할 수 있는 수보다 poolSize가 커야 함</li>
 *   <li>CPU 바운드 작업 위주: poolSize = CPU 코어 수</li>
 * </ul>
 *
 * @author Promise Team
 * @since 1.0.0
 * @param poolSize 워커 스레드 수 (1 이상이어야 함)
 * @param threadNamePrefix 스레드 이름 접두사 (null 또는 빈 문자열 불가)
 * @param daemon 데몬 스레드 여부
 * @param shutdownTimeoutMs shutdown 대기 시간 (밀리초, 양수여야 함)
 */
public record SchedulerConfig(
    int poolSize,
    String threadNamePrefix,
    boolean daemon,
    long shutdownTimeoutMs
) {

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: poolSize=8, threadNamePrefix="promise-worker-", daemon=true, shutdownTimeoutMs=60000ms</p>
     */
    public SchedulerConfig() {
        this(8, "promise-worker-", true, 60000);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public SchedulerConfig {
        if (poolSize <= 0) {
            throw new IllegalArgumentException(
                "poolSize must be positive (current: " + poolSize + ")"
            );
        }
        if (threadNamePrefix == null || threadNamePrefix.isBlank()) {
            throw new IllegalArgumentException("threadNamePrefix cannot be null or blank");
        }
        if (shutdownTimeoutMs <= 0) {
            throw new IllegalArgumentException(
                "shutdownTimeoutMs must be positive (current: " + shutdownTimeoutMs + ")"
            );
        }
    }

    /**
     * poolSize만 변경한 새 인스턴스 생성.
     */
    public SchedulerConfig withPoolSize(int poolSize) {
        return new SchedulerConfig(poolSize, threadNamePrefix, daemon, shutdownTimeoutMs);
    }

    /**
     * threadNamePrefix만 변경한 새 인스턴스 생성.
     */
    public SchedulerConfig withThreadNamePrefix(String threadNamePrefix) {
        return new SchedulerConfig(poolSize, threadNamePrefix, daemon, shutdownTimeoutMs);
    }

    /**
     * daemon만 변경한 새 인스턴스 생성.
     */
    public SchedulerConfig withDaemon(boolean daemon) {
        return new SchedulerConfig(poolSize, threadNamePrefix, daemon, shutdownTimeoutMs);
    }

    /**
     * shutdownTimeoutMs만 변경한 새 인스턴스 생성.
     */
    public SchedulerConfig withShutdownTimeoutMs(long shutdownTimeoutMs) {
        return new SchedulerConfig(poolSize, threadNamePrefix, daemon, shutdownTimeoutMs);
    }
}
