package com.ryuqq.resilience.core.executor;

import com.ryuqq.resilience.core.context.ExecutionContext;
import com.ryuqq.resilience.core.error.CircuitBreakerOpenException;
import com.ryuqq.resilience.core.error.DeadlineExceededException;
import com.ryuqq.resilience.core.error.PermanentException;
import com.ryuqq.resilience.core.model.Operation;
import com.ryuqq.resilience.core.policy.Policy;
import com.ryuqq.resilience.core.protection.CircuitBreaker;
import com.ryuqq.resilience.core.protection.CircuitBreakerSettings;
import com.ryuqq.resilience.core.protection.CircuitBreakerState;
import com.ryuqq.resilience.core.protection.DefaultCircuitBreaker;
import com.ryuqq.resilience.core.retry.RetryPolicy;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * PolicyExecutor 테스트.
 *
 * <p>가드 조합 순서 (Retry → Circuit Breaker → Timeout → 작업)와
 * 가드가 없는 경우의 동작을 검증합니다.</p>
 *
 * @author Resilience Team
 * @since 1.0.0
 */
@DisplayName("PolicyExecutor 테스트")
@ExtendWith(MockitoExtension.class)
class PolicyExecutorTest {

    private static final ExecutionContext AMBIENT = ExecutionContext.background();

    @Mock
    private CircuitBreaker circuitBreaker;

    private ExecutorService timeoutExecutor;

    @BeforeEach
    void setUp() {
        timeoutExecutor = Executors.newCachedThreadPool();
    }

    @AfterEach
    void tearDown() {
        timeoutExecutor.shutdownNow();
    }

    private void delegateToOperation() throws Exception {
        when(circuitBreaker.<Object>execute(any(), any())).thenAnswer(invocation -> {
            ExecutionContext ctx = invocation.getArgument(0);
            Operation<Object> operation = invocation.getArgument(1);
            return operation.execute(ctx);
        });
    }

    // ============================================================
    // 가드 없음
    // ============================================================

    @Test
    void policy가_null이면_호출자_컨텍스트로_한번_실행() throws Exception {
        // given
        Executor executor = PolicyExecutor.create(AMBIENT, null);
        List<ExecutionContext> seen = new CopyOnWriteArrayList<>();

        // when
        String result = executor.execute(ctx -> {
            seen.add(ctx);
            return "plain";
        });

        // then
        assertThat(result).isEqualTo("plain");
        assertThat(seen).containsExactly(AMBIENT);
    }

    @Test
    void 빈_policy는_오류를_그대로_전달() {
        Executor executor = PolicyExecutor.create(AMBIENT, Policy.none());
        AtomicInteger attempts = new AtomicInteger();
        IOException failure = new IOException("boom");

        assertThatThrownBy(() -> executor.execute(ctx -> {
            attempts.incrementAndGet();
            throw failure;
        })).isSameAs(failure);
        assertThat(attempts.get()).isEqualTo(1);
    }

    @Test
    void 재시도_가드가_없어도_PermanentException은_원인으로_풀려서_전달() {
        // given
        IOException cause = new IOException("not found");
        DefaultCircuitBreaker breaker = new DefaultCircuitBreaker(
            new CircuitBreakerSettings("lookup", 1, Duration.ZERO, Duration.ofMinutes(1), 5));
        Executor plain = PolicyExecutor.create(AMBIENT, Policy.none());
        Executor breakerOnly = PolicyExecutor.create(AMBIENT, Policy.none().withCircuitBreaker(breaker));

        // when & then
        assertThatThrownBy(() -> plain.execute(ctx -> {
            throw PermanentException.of(cause);
        })).isSameAs(cause);
        assertThatThrownBy(() -> breakerOnly.execute(ctx -> {
            throw PermanentException.of(cause);
        })).isSameAs(cause);
    }

    @Test
    void operation_null은_예외() {
        Executor executor = PolicyExecutor.create(AMBIENT, Policy.none());

        assertThatThrownBy(() -> executor.execute(null))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void 컨텍스트_null은_예외() {
        assertThatThrownBy(() -> PolicyExecutor.create(null, Policy.none()))
            .isInstanceOf(IllegalArgumentException.class);
    }

    // ============================================================
    // 단일 가드
    // ============================================================

    @Test
    void retry만_있으면_성공할_때까지_재시도() throws Exception {
        // given
        Policy policy = Policy.none().withRetry(RetryPolicy.of("1ms", 3));
        Executor executor = PolicyExecutor.create(AMBIENT, policy);
        AtomicInteger attempts = new AtomicInteger();

        // when
        Integer result = executor.execute(ctx -> {
            if (attempts.incrementAndGet() < 3) {
                throw new IOException("transient");
            }
            return attempts.get();
        });

        // then
        assertThat(result).isEqualTo(3);
    }

    @Test
    void timeout만_있으면_느린_작업은_DeadlineExceededException() {
        Policy policy = Policy.none().withTimeout(Duration.ofMillis(50));
        Executor executor = PolicyExecutor.create(AMBIENT, policy, timeoutExecutor);

        assertThatThrownBy(() -> executor.execute(ctx -> {
            Thread.sleep(2_000);
            return "slow";
        })).isInstanceOf(DeadlineExceededException.class);
    }

    // ============================================================
    // 조합
    // ============================================================

    @Test
    void Circuit_Breaker는_Timeout_바깥에서_호출자_컨텍스트를_받음() throws Exception {
        // given
        delegateToOperation();
        Policy policy = Policy.none()
            .withTimeout(Duration.ofSeconds(5))
            .withCircuitBreaker(circuitBreaker);
        Executor executor = PolicyExecutor.create(AMBIENT, policy, timeoutExecutor);
        List<ExecutionContext> operationContexts = new CopyOnWriteArrayList<>();

        // when
        String result = executor.execute(ctx -> {
            operationContexts.add(ctx);
            return "guarded";
        });

        // then
        ArgumentCaptor<ExecutionContext> breakerContext = ArgumentCaptor.forClass(ExecutionContext.class);
        verify(circuitBreaker).execute(breakerContext.capture(), any());
        assertThat(result).isEqualTo("guarded");
        assertThat(breakerContext.getValue()).isSameAs(AMBIENT);
        assertThat(operationContexts).singleElement().satisfies(ctx -> {
            assertThat(ctx).isNotSameAs(AMBIENT);
            assertThat(ctx.hasDeadline()).isTrue();
        });
    }

    @Test
    void Retry는_시도마다_Circuit_Breaker를_거침() throws Exception {
        // given
        delegateToOperation();
        Policy policy = Policy.none()
            .withRetry(RetryPolicy.of("1ms", 2))
            .withCircuitBreaker(circuitBreaker);
        Executor executor = PolicyExecutor.create(AMBIENT, policy);

        // when & then
        assertThatThrownBy(() -> executor.execute(ctx -> {
            throw new IOException("always");
        })).isInstanceOf(IOException.class);
        verify(circuitBreaker, times(3)).execute(any(), any());
    }

    @Test
    void timeout과_retry를_함께_쓰면_느린_시도는_재시도됨() throws Exception {
        // given
        Policy policy = Policy.none()
            .withTimeout(Duration.ofMillis(50))
            .withRetry(RetryPolicy.of("0", 5));
        Executor executor = PolicyExecutor.create(AMBIENT, policy, timeoutExecutor);
        AtomicInteger attempts = new AtomicInteger();

        // when
        String result = executor.execute(ctx -> {
            if (attempts.incrementAndGet() < 3) {
                Thread.sleep(1_000);
                return "late";
            }
            return "on-time";
        });

        // then
        assertThat(result).isEqualTo("on-time");
        assertThat(attempts.get()).isEqualTo(3);
    }

    @Test
    void Circuit_Breaker가_열리면_Retry는_즉시_중단() {
        // given
        DefaultCircuitBreaker breaker = new DefaultCircuitBreaker(
            new CircuitBreakerSettings("payment", 1, Duration.ZERO, Duration.ofMinutes(1), 1));
        Policy policy = Policy.none()
            .withRetry(RetryPolicy.of("1ms", 5))
            .withCircuitBreaker(breaker);
        Executor executor = PolicyExecutor.create(AMBIENT, policy);
        AtomicInteger attempts = new AtomicInteger();

        // when & then
        assertThatThrownBy(() -> executor.execute(ctx -> {
            attempts.incrementAndGet();
            throw new IOException("down");
        })).isInstanceOf(CircuitBreakerOpenException.class);
        assertThat(attempts.get()).isEqualTo(1);
        assertThat(breaker.getState()).isEqualTo(CircuitBreakerState.OPEN);
    }

    @Test
    void 시간_초과는_Circuit_Breaker의_실패로_기록() {
        // given
        DefaultCircuitBreaker breaker = new DefaultCircuitBreaker(
            new CircuitBreakerSettings("slow", 1, Duration.ZERO, Duration.ofMinutes(1), 1));
        Policy policy = Policy.none()
            .withTimeout(Duration.ofMillis(50))
            .withCircuitBreaker(breaker);
        Executor executor = PolicyExecutor.create(AMBIENT, policy, timeoutExecutor);

        // when & then
        assertThatThrownBy(() -> executor.execute(ctx -> {
            Thread.sleep(1_000);
            return "slow";
        })).isInstanceOf(DeadlineExceededException.class);
        assertThat(breaker.getState()).isEqualTo(CircuitBreakerState.OPEN);
    }

    @Test
    void 같은_Executor를_여러_스레드에서_공유() throws Exception {
        // given
        Policy policy = Policy.none()
            .withTimeout(Duration.ofSeconds(5))
            .withRetry(RetryPolicy.of("1ms", 1));
        Executor executor = PolicyExecutor.create(AMBIENT, policy, timeoutExecutor);
        ExecutorService callers = Executors.newFixedThreadPool(4);
        AtomicInteger completed = new AtomicInteger();

        // when
        List<Callable<Object>> tasks = new ArrayList<>();
        for (int i = 0; i < 20; i++) {
            int id = i;
            tasks.add(() -> {
                String value = executor.execute(ctx -> "call-" + id);
                assertThat(value).isEqualTo("call-" + id);
                return completed.incrementAndGet();
            });
        }
        for (Future<Object> future : callers.invokeAll(tasks)) {
            future.get();
        }
        callers.shutdown();

        // then
        assertThat(completed.get()).isEqualTo(20);
    }
}
