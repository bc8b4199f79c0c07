package com.ryuqq.promise.core.promise;

import com.ryuqq.promise.core.outcome.Outcome;

import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 기본 {@link PromiseRuntime}에 위임하는 정적 진입점.
 *
 * <p>런타임을 직접 주입하지 않는 코드를 위한 편의 API입니다. 기본 런타임은 최초 사용 시
 * 데몬 스레드 기반의 cached thread pool로 생성되며, {@link #setDefaultRuntime(PromiseRuntime)}로
 * 교체할 수 있습니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * Promise&lt;String&gt; greeting = Promises.create((resolver, rejecter) -&gt; resolver.resolve("hello"));
 * Outcome&lt;List&lt;Object&gt;&gt; outcome = Promises.all(greeting, Promises.resolve(42)).await();
 * </pre>
 *
 * @author Promise Team
 * @since 1.0.0
 */
public final class Promises {

    private static volatile PromiseRuntime defaultRuntime;

    // Utility class - prevent instantiation
    private Promises() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 기본 런타임 조회 (최초 호출 시 생성).
     *
     * @return 기본 런타임
     */
    public static PromiseRuntime defaultRuntime() {
        PromiseRuntime runtime = defaultRuntime;
        if (runtime == null) {
            synchronized (Promises.class) {
                runtime = defaultRuntime;
                if (runtime == null) {
                    runtime = createDefaultRuntime();
                    defaultRuntime = runtime;
                }
            }
        }
        return runtime;
    }

    /**
     * 기본 런타임 교체.
     *
     * <p>이전 런타임으로 생성된 Promise는 계속 이전 Scheduler를 사용합니다.</p>
     *
     * @param runtime 새 기본 런타임
     * @throws IllegalArgumentException runtime이 null인 경우
     */
    public static void setDefaultRuntime(PromiseRuntime runtime) {
        if (runtime == null) {
            throw new IllegalArgumentException("runtime cannot be null");
        }
        synchronized (Promises.class) {
            defaultRuntime = runtime;
        }
    }

    /**
     * @see PromiseRuntime#create(PromiseExecutor)
     */
    public static <T> Promise<T> create(PromiseExecutor<T> executor) {
        return defaultRuntime().create(executor);
    }

    /**
     * @see PromiseRuntime#resolve(Object)
     */
    public static <T> Promise<T> resolve(T value) {
        return defaultRuntime().resolve(value);
    }

    /**
     * @see PromiseRuntime#resolve(Promise)
     */
    public static <T> Promise<T> resolve(Promise<? extends T> promise) {
        return defaultRuntime().resolve(promise);
    }

    /**
     * @see PromiseRuntime#reject(Throwable)
     */
    public static <T> Promise<T> reject(Throwable error) {
        return defaultRuntime().reject(error);
    }

    /**
     * @see PromiseRuntime#all(List)
     */
    public static <T> Promise<List<T>> all(List<? extends Promise<? extends T>> promises) {
        return defaultRuntime().all(promises);
    }

    /**
     * @see PromiseRuntime#all(Promise[])
     */
    @SafeVarargs
    public static <T> Promise<List<T>> all(Promise<? extends T>... promises) {
        return defaultRuntime().all(promises);
    }

    /**
     * @see PromiseRuntime#allSettled(List)
     */
    public static <T> Promise<List<Outcome<T>>> allSettled(List<? extends Promise<? extends T>> promises) {
        return defaultRuntime().allSettled(promises);
    }

    /**
     * @see PromiseRuntime#allSettled(Promise[])
     */
    @SafeVarargs
    public static <T> Promise<List<Outcome<T>>> allSettled(Promise<? extends T>... promises) {
        return defaultRuntime().allSettled(promises);
    }

    /**
     * @see PromiseRuntime#race(List)
     */
    public static <T> Promise<T> race(List<? extends Promise<? extends T>> promises) {
        return defaultRuntime().race(promises);
    }

    /**
     * @see PromiseRuntime#race(Promise[])
     */
    @SafeVarargs
    public static <T> Promise<T> race(Promise<? extends T>... promises) {
        return defaultRuntime().race(promises);
    }

    private static PromiseRuntime createDefaultRuntime() {
        AtomicInteger threadCounter = new AtomicInteger();
        ExecutorService pool = Executors.newCachedThreadPool(task -> {
            Thread thread = new Thread(task, "promise-default-" + threadCounter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
        return new PromiseRuntime(pool::execute);
    }
}
