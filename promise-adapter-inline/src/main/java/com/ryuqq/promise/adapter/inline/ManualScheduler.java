package com.ryuqq.promise.adapter.inline;

import com.ryuqq.promise.core.spi.Scheduler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;

/**
 * 작업을 큐에 쌓아 두고 명시적으로 실행하는 Scheduler 구현체.
 *
 * <p>테스트가 "언제" 작업이 실행될지 직접 제어할 수 있습니다.
 * 예를 들어 정착 이후 등록된 콜백이 등록 호출 안에서 실행되지 않고
 * Scheduler를 거쳐 디스패치되는지 검증할 때 사용합니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * ManualScheduler scheduler = new ManualScheduler();
 * PromiseRuntime runtime = new PromiseRuntime(scheduler);
 *
 * Promise&lt;Integer&gt; promise = runtime.create((resolver, rejecter) -&gt; resolver.resolve(1));
 * assert promise.state() == PromiseState.PENDING;
 *
 * scheduler.runUntilIdle();
 * assert promise.state() == PromiseState.FULFILLED;
 * </pre>
 *
 * <p>schedule()는 thread-safe하며, 실행은 runNext()/runUntilIdle()을 호출한 스레드에서 수행됩니다.</p>
 *
 * @author Promise Team
 * @since 1.0.0
 */
public final class ManualScheduler implements Scheduler {

    private static final Logger log = LoggerFactory.getLogger(ManualScheduler.class);

    private final Queue<Runnable> tasks = new ConcurrentLinkedQueue<>();

    @Override
    public void schedule(Runnable task) {
        if (task == null) {
            throw new IllegalArgumentException("task cannot be null");
        }
        tasks.add(task);
    }

    /**
     * 대기 중인 작업 하나 실행.
     *
     * @return 실행한 작업이 있으면 true
     */
    public boolean runNext() {
        Runnable task = tasks.poll();
        if (task == null) {
            return false;
        }
        task.run();
        return true;
    }

    /**
     * 큐가 빌 때까지 실행 (실행 중 새로 예약된 작업 포함).
     *
     * @return 실행한 작업 수
     */
    public int runUntilIdle() {
        int executed = 0;
        while (runNext()) {
            executed++;
        }
        log.debug("ManualScheduler drained {} tasks", executed);
        return executed;
    }

    /**
     * 대기 중인 작업 수 조회.
     *
     * @return 대기 중인 작업 수
     */
    public int pendingCount() {
        return tasks.size();
    }
}
