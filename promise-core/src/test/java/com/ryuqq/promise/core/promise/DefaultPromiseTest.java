package com.ryuqq.promise.core.promise;

import com.ryuqq.promise.core.outcome.Outcome;
import com.ryuqq.promise.core.spi.Scheduler;
import com.ryuqq.promise.core.statemachine.PromiseState;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

/**
 * DefaultPromise 정착 및 콜백 디스패치 테스트.
 *
 * <p>인라인 Scheduler로 실행 순서를 결정적으로 만들고,
 * 비동기 디스패치 검증에는 Mockito Scheduler로 예약된 작업을 직접 실행합니다.</p>
 *
 * @author Promise Team
 * @since 1.0.0
 */
@ExtendWith(MockitoExtension.class)
class DefaultPromiseTest {

    @Mock
    private Scheduler scheduler;

    private PromiseRuntime inlineRuntime;

    @BeforeEach
    void setUp() {
        inlineRuntime = new PromiseRuntime(Runnable::run);
    }

    // ========== 생성 및 정착 ==========

    @Test
    void create_resolve_호출_시_FULFILLED() {
        // when
        Promise<String> promise = inlineRuntime.create((resolver, rejecter) -> resolver.resolve("done"));

        // then
        assertThat(promise.state()).isEqualTo(PromiseState.FULFILLED);
        assertThat(promise.await()).isEqualTo(Outcome.fulfilled("done"));
    }

    @Test
    void create_reject_호출_시_REJECTED() {
        // given
        IOException error = new IOException("disk");

        // when
        Promise<String> promise = inlineRuntime.create((resolver, rejecter) -> rejecter.reject(error));

        // then
        Outcome<String> outcome = promise.await();
        assertThat(outcome.isRejected()).isTrue();
        assertThat(outcome.errorOrNull()).isSameAs(error);
        assertThat(outcome.valueOrNull()).isNull();
    }

    @Test
    void create_executor_예외는_같은_예외로_reject() {
        // given
        IOException panic = new IOException("checked failure");

        // when
        Promise<String> promise = inlineRuntime.create((resolver, rejecter) -> {
            throw panic;
        });

        // then
        assertThat(promise.await().errorOrNull()).isSameAs(panic);
    }

    @Test
    void create_executor_Error도_reject로_변환() {
        // given
        Error panic = new Error("fatal in executor");

        // when
        Promise<String> promise = inlineRuntime.create((resolver, rejecter) -> {
            throw panic;
        });

        // then
        assertThat(promise.state()).isEqualTo(PromiseState.REJECTED);
        assertThat(promise.await().errorOrNull()).isSameAs(panic);
    }

    @Test
    void create_아무것도_호출하지_않으면_PENDING_유지() {
        // when
        Promise<String> promise = inlineRuntime.create((resolver, rejecter) -> {
        });

        // then
        assertThat(promise.state()).isEqualTo(PromiseState.PENDING);
        assertThat(promise.isSettled()).isFalse();
    }

    @Test
    void create_null_executor는_예외() {
        assertThatThrownBy(() -> inlineRuntime.create(null))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("executor cannot be null");
    }

    // ========== 최초 호출 우선 ==========

    @Test
    void resolve_후_reject는_무시() {
        // when
        Promise<String> promise = inlineRuntime.create((resolver, rejecter) -> {
            resolver.resolve("first");
            rejecter.reject(new IllegalStateException("second"));
            resolver.resolve("third");
        });

        // then
        assertThat(promise.await()).isEqualTo(Outcome.fulfilled("first"));
    }

    @Test
    void reject_후_resolve는_무시() {
        // given
        IllegalStateException error = new IllegalStateException("first");

        // when
        Promise<String> promise = inlineRuntime.create((resolver, rejecter) -> {
            rejecter.reject(error);
            resolver.resolve("second");
        });

        // then
        assertThat(promise.await().errorOrNull()).isSameAs(error);
    }

    @Test
    void resolve_후_예외가_발생해도_값_유지() {
        // when
        Promise<String> promise = inlineRuntime.create((resolver, rejecter) -> {
            resolver.resolve("value");
            throw new IllegalStateException("after resolve");
        });

        // then
        assertThat(promise.await()).isEqualTo(Outcome.fulfilled("value"));
    }

    @Test
    void reject_null_오류는_IllegalArgumentException으로_reject() {
        // when
        Promise<String> promise = inlineRuntime.create((resolver, rejecter) -> rejecter.reject(null));

        // then
        assertThat(promise.await().errorOrNull())
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("error cannot be null");
    }

    // ========== 콜백 디스패치 ==========

    @Test
    void PENDING_상태에서_등록한_then_콜백은_등록_순서대로_한번씩_실행() {
        // given
        AtomicReference<Resolver<Integer>> resolverRef = new AtomicReference<>();
        Promise<Integer> promise = inlineRuntime.create((resolver, rejecter) -> resolverRef.set(resolver));
        List<String> calls = new ArrayList<>();

        promise.then(value -> calls.add("first:" + value));
        promise.then(value -> calls.add("second:" + value));

        // when
        resolverRef.get().resolve(7);
        resolverRef.get().resolve(8);

        // then
        assertThat(calls).containsExactly("first:7", "second:7");
    }

    @Test
    void PENDING_상태에서_등록한_catchError_콜백도_등록_순서대로_실행() {
        // given
        AtomicReference<Rejecter> rejecterRef = new AtomicReference<>();
        Promise<Integer> promise = inlineRuntime.create((resolver, rejecter) -> rejecterRef.set(rejecter));
        List<String> calls = new ArrayList<>();

        promise.catchError(error -> {
            calls.add("first:" + error.getMessage());
            return null;
        });
        promise.catchError(error -> {
            calls.add("second:" + error.getMessage());
            return null;
        });

        // when
        rejecterRef.get().reject(new IllegalStateException("boom"));

        // then
        assertThat(calls).containsExactly("first:boom", "second:boom");
    }

    @Test
    void 정착_이후_등록한_then_콜백은_Scheduler를_통해_실행() {
        // given
        List<Runnable> scheduled = new ArrayList<>();
        doAnswer(invocation -> scheduled.add(invocation.getArgument(0)))
            .when(scheduler).schedule(any());
        PromiseRuntime runtime = new PromiseRuntime(scheduler);
        Promise<String> promise = runtime.resolve("settled");
        AtomicBoolean called = new AtomicBoolean(false);

        // when
        Promise<Integer> chained = promise.then(value -> {
            called.set(true);
            return value.length();
        });

        // then - 등록 호출 안에서는 실행되지 않음
        assertThat(called).isFalse();
        assertThat(chained.state()).isEqualTo(PromiseState.PENDING);
        verify(scheduler, times(1)).schedule(any());

        // when - 예약된 디스패치 실행
        scheduled.forEach(Runnable::run);

        // then
        assertThat(called).isTrue();
        assertThat(chained.await()).isEqualTo(Outcome.fulfilled(7));
    }

    @Test
    void 같은_Promise에_두번_등록하면_독립된_두_체인() {
        // given
        Promise<Integer> source = inlineRuntime.resolve(10);

        // when
        Promise<Integer> doubled = source.then(value -> value * 2);
        Promise<Integer> tripled = source.then(value -> value * 3);

        // then
        assertThat(doubled.await().valueOrNull()).isEqualTo(20);
        assertThat(tripled.await().valueOrNull()).isEqualTo(30);
    }

    @Test
    void then_콜백_예외는_하위_Promise_reject() {
        // given
        IllegalStateException error = new IllegalStateException("callback failure");

        // when
        Promise<Integer> chained = inlineRuntime.resolve("value").then(value -> {
            throw error;
        });

        // then
        assertThat(chained.await().errorOrNull()).isSameAs(error);
    }

    @Test
    void then_null_콜백은_예외() {
        Promise<String> promise = inlineRuntime.resolve("value");

        assertThatThrownBy(() -> promise.then(null))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("onFulfilled cannot be null");
    }

    // ========== 깊은 체인 ==========

    @Test
    void PENDING_상태의_만_단계_then_체인도_모두_정착() {
        // given
        AtomicReference<Resolver<Integer>> headResolver = new AtomicReference<>();
        Promise<Integer> head = inlineRuntime.create((resolver, rejecter) -> headResolver.set(resolver));
        Promise<Integer> last = head;
        for (int i = 0; i < 10_000; i++) {
            last = last.then(value -> value + 1);
        }
        AtomicInteger siblingCalls = new AtomicInteger();
        head.then(value -> siblingCalls.incrementAndGet());

        // when
        headResolver.get().resolve(0);

        // then
        assertThat(last.await()).isEqualTo(Outcome.fulfilled(10_000));
        assertThat(siblingCalls).hasValue(1);
    }

    @Test
    void PENDING_상태의_만_단계_체인에서_reject도_끝까지_전파() {
        // given
        AtomicReference<Rejecter> headRejecter = new AtomicReference<>();
        Promise<Integer> head = inlineRuntime.create((resolver, rejecter) -> headRejecter.set(rejecter));
        Promise<Integer> last = head;
        for (int i = 0; i < 10_000; i++) {
            last = last.then(value -> value + 1);
        }
        IllegalStateException error = new IllegalStateException("head failed");

        // when
        headRejecter.get().reject(error);

        // then
        assertThat(last.await().errorOrNull()).isSameAs(error);
    }

    @Test
    void 콜백_하나가_실패해도_이후_등록된_콜백은_실행() {
        // given
        AtomicReference<Resolver<String>> resolverRef = new AtomicReference<>();
        DefaultPromise<String> promise =
            (DefaultPromise<String>) inlineRuntime.<String>create((resolver, rejecter) -> resolverRef.set(resolver));
        List<String> calls = new ArrayList<>();
        promise.subscribe(value -> {
            throw new IllegalStateException("first callback failed");
        }, error -> {
        });
        promise.subscribe(value -> calls.add("second:" + value), error -> {
        });

        // when
        resolverRef.get().resolve("v");

        // then
        assertThat(calls).containsExactly("second:v");
        assertThat(promise.await()).isEqualTo(Outcome.fulfilled("v"));
    }

    // ========== Scheduler 거부 ==========

    @Test
    void Scheduler가_executor를_거부하면_그_예외로_reject() {
        // given
        RejectedExecutionException refused = new RejectedExecutionException("shut down");
        doThrow(refused).when(scheduler).schedule(any());
        PromiseRuntime runtime = new PromiseRuntime(scheduler);

        // when
        Promise<String> promise = runtime.create((resolver, rejecter) -> resolver.resolve("never"));

        // then
        assertThat(promise.await().errorOrNull()).isSameAs(refused);
    }

    @Test
    void Scheduler가_디스패치를_거부해도_콜백은_유실되지_않음() {
        // given
        doThrow(new RejectedExecutionException("shut down")).when(scheduler).schedule(any());
        PromiseRuntime runtime = new PromiseRuntime(scheduler);
        Promise<String> promise = runtime.resolve("settled");

        // when
        Promise<String> chained = promise.then(String::toUpperCase);

        // then
        assertThat(chained.await()).isEqualTo(Outcome.fulfilled("SETTLED"));
    }

    // ========== await ==========

    @Test
    void await_정착_이후_호출은_블로킹하지_않고_같은_결과() {
        // given
        Promise<String> promise = inlineRuntime.resolve("value");

        // when
        Outcome<String> first = promise.await();
        Outcome<String> second = promise.await();

        // then
        assertThat(first).isSameAs(second);
    }

    @Test
    void await_인터럽트_시_PromiseInterruptedException_및_플래그_복원() throws InterruptedException {
        // given
        Promise<String> pending = inlineRuntime.create((resolver, rejecter) -> {
        });
        AtomicReference<Throwable> thrown = new AtomicReference<>();
        AtomicBoolean interruptFlag = new AtomicBoolean(false);
        CountDownLatch finished = new CountDownLatch(1);

        Thread waiter = new Thread(() -> {
            try {
                pending.await();
            } catch (PromiseInterruptedException e) {
                thrown.set(e);
                interruptFlag.set(Thread.currentThread().isInterrupted());
            } finally {
                finished.countDown();
            }
        });

        // when
        waiter.start();
        waiter.interrupt();

        // then
        assertThat(finished.await(5, TimeUnit.SECONDS)).isTrue();
        assertThat(thrown.get())
            .isInstanceOf(PromiseInterruptedException.class)
            .hasMessageContaining("Await interrupted");
        assertThat(interruptFlag).isTrue();
    }

    @Test
    void toString_상태별_표현() {
        assertThat(inlineRuntime.resolve("v").toString()).contains("FULFILLED").contains("value=v");
        assertThat(inlineRuntime.reject(new IllegalStateException("e")).toString()).contains("REJECTED");
        assertThat(inlineRuntime.create((resolver, rejecter) -> {
        }).toString()).contains("PENDING");
    }
}
