package com.ryuqq.promise.adapter.inline;

import com.ryuqq.promise.core.spi.Scheduler;

/**
 * 호출 스레드에서 즉시 실행하는 Scheduler 구현체.
 *
 * <p>단위 테스트에서 결정적인 실행 순서를 얻기 위한 용도입니다.
 * schedule() 호출이 반환되기 전에 작업이 완료됩니다.</p>
 *
 * <p><strong>주의:</strong></p>
 * <ul>
 *   <li>executor 본문이 블로킹되면 Promise 생성 호출도 블로킹됨</li>
 *   <li>executor 안에서 같은 Promise를 await()하면 교착 상태</li>
 * </ul>
 *
 * @author Promise Team
 * @since 1.0.0
 */
public final class InlineScheduler implements Scheduler {

    @Override
    public void schedule(Runnable task) {
        if (task == null) {
            throw new IllegalArgumentException("task cannot be null");
        }
        task.run();
    }
}
