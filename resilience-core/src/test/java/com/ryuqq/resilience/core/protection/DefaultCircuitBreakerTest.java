package com.ryuqq.resilience.core.protection;

import com.ryuqq.resilience.core.context.ExecutionContext;
import com.ryuqq.resilience.core.error.CircuitBreakerOpenException;
import com.ryuqq.resilience.core.error.TooManyRequestsException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * DefaultCircuitBreaker 테스트.
 *
 * <p>검증 항목:</p>
 * <ul>
 *   <li>CLOSED → OPEN (연속 실패 임계값)</li>
 *   <li>OPEN 상태 즉시 거부 (작업 미실행)</li>
 *   <li>OPEN → HALF_OPEN (openTimeout 경과)</li>
 *   <li>HALF_OPEN probe 성공/실패 처리, 초과 요청 거부</li>
 *   <li>interval 기반 카운터 초기화, 세대별 결과 무시</li>
 * </ul>
 *
 * @author Resilience Team
 * @since 1.0.0
 */
@DisplayName("DefaultCircuitBreaker 테스트")
class DefaultCircuitBreakerTest {

    private static final ExecutionContext CTX = ExecutionContext.background();
    private static final Duration OPEN_TIMEOUT = Duration.ofSeconds(30);

    private MutableClock clock;
    private List<String> transitions;
    private DefaultCircuitBreaker breaker;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2024-01-01T00:00:00Z"));
        transitions = new CopyOnWriteArrayList<>();
        breaker = create(new CircuitBreakerSettings("payment", 1, Duration.ZERO, OPEN_TIMEOUT, 2));
    }

    private DefaultCircuitBreaker create(CircuitBreakerSettings settings) {
        return new DefaultCircuitBreaker(
            settings,
            (name, from, to) -> transitions.add(name + ":" + from + "->" + to),
            clock
        );
    }

    private void fail(CircuitBreaker target) {
        assertThatThrownBy(() -> target.execute(CTX, ctx -> {
            throw new IOException("downstream failure");
        })).isInstanceOf(IOException.class);
    }

    private String succeed(CircuitBreaker target) throws Exception {
        return target.execute(CTX, ctx -> "ok");
    }

    private void trip() {
        fail(breaker);
        fail(breaker);
        assertThat(breaker.getState()).isEqualTo(CircuitBreakerState.OPEN);
    }

    // ============================================================
    // CLOSED
    // ============================================================

    @Test
    void 초기_상태는_CLOSED() {
        assertThat(breaker.name()).isEqualTo("payment");
        assertThat(breaker.getState()).isEqualTo(CircuitBreakerState.CLOSED);
        assertThat(breaker.getCounts()).isEqualTo(Counts.EMPTY);
    }

    @Test
    void 성공은_결과를_그대로_반환하고_카운트() throws Exception {
        // when
        String result = succeed(breaker);

        // then
        assertThat(result).isEqualTo("ok");
        assertThat(breaker.getCounts()).isEqualTo(new Counts(1, 1, 0, 1, 0));
    }

    @Test
    void 연속_실패가_임계값에_도달하면_OPEN() {
        // when
        fail(breaker);
        assertThat(breaker.getState()).isEqualTo(CircuitBreakerState.CLOSED);
        fail(breaker);

        // then
        assertThat(breaker.getState()).isEqualTo(CircuitBreakerState.OPEN);
        assertThat(transitions).containsExactly("payment:CLOSED->OPEN");
    }

    @Test
    void 성공은_연속_실패를_끊음() throws Exception {
        fail(breaker);
        succeed(breaker);
        fail(breaker);

        assertThat(breaker.getState()).isEqualTo(CircuitBreakerState.CLOSED);
        assertThat(breaker.getCounts().consecutiveFailures()).isEqualTo(1);
        assertThat(breaker.getCounts().totalFailures()).isEqualTo(2);
    }

    @Test
    void 임계값_0은_첫_실패에_OPEN() {
        DefaultCircuitBreaker eager = create(new CircuitBreakerSettings("eager", 1, Duration.ZERO, OPEN_TIMEOUT, 0));

        fail(eager);

        assertThat(eager.getState()).isEqualTo(CircuitBreakerState.OPEN);
    }

    @Test
    void Error도_실패로_기록하고_다시_던짐() {
        // when
        for (int i = 0; i < 2; i++) {
            assertThatThrownBy(() -> breaker.execute(CTX, ctx -> {
                throw new AssertionError("fatal");
            })).isInstanceOf(AssertionError.class);
        }

        // then
        assertThat(breaker.getState()).isEqualTo(CircuitBreakerState.OPEN);
    }

    @Test
    void interval이_지나면_CLOSED_카운터_초기화() {
        // given
        DefaultCircuitBreaker rolling = create(
            new CircuitBreakerSettings("rolling", 1, Duration.ofSeconds(10), OPEN_TIMEOUT, 3));
        fail(rolling);
        fail(rolling);

        // when
        clock.advance(Duration.ofSeconds(11));
        fail(rolling);

        // then
        assertThat(rolling.getState()).isEqualTo(CircuitBreakerState.CLOSED);
        assertThat(rolling.getCounts()).isEqualTo(new Counts(1, 0, 1, 0, 1));
    }

    @Test
    void interval이_지나면_호출이_없어도_카운터_조회_시_초기화() {
        // given
        DefaultCircuitBreaker rolling = create(
            new CircuitBreakerSettings("rolling", 1, Duration.ofSeconds(10), OPEN_TIMEOUT, 5));
        fail(rolling);
        assertThat(rolling.getCounts().consecutiveFailures()).isEqualTo(1);

        // when
        clock.advance(Duration.ofSeconds(11));

        // then
        assertThat(rolling.getCounts()).isEqualTo(Counts.EMPTY);
    }

    @Test
    void interval이_0이면_카운터를_초기화하지_않음() {
        DefaultCircuitBreaker nonRolling = create(
            new CircuitBreakerSettings("static", 1, Duration.ZERO, OPEN_TIMEOUT, 3));
        fail(nonRolling);
        fail(nonRolling);

        clock.advance(Duration.ofDays(1));
        fail(nonRolling);

        assertThat(nonRolling.getState()).isEqualTo(CircuitBreakerState.OPEN);
    }

    // ============================================================
    // OPEN
    // ============================================================

    @Test
    void OPEN_상태는_작업을_실행하지_않고_즉시_거부() {
        // given
        trip();
        AtomicInteger invocations = new AtomicInteger();

        // when & then
        assertThatThrownBy(() -> breaker.execute(CTX, ctx -> invocations.incrementAndGet()))
            .isInstanceOf(CircuitBreakerOpenException.class)
            .hasMessageContaining("payment");
        assertThat(invocations.get()).isZero();
    }

    @Test
    void openTimeout_이전에는_OPEN_유지() {
        trip();

        clock.advance(OPEN_TIMEOUT);

        assertThat(breaker.getState()).isEqualTo(CircuitBreakerState.OPEN);
    }

    @Test
    void openTimeout_경과_후_HALF_OPEN() {
        trip();

        clock.advance(OPEN_TIMEOUT.plusMillis(1));

        assertThat(breaker.getState()).isEqualTo(CircuitBreakerState.HALF_OPEN);
        assertThat(transitions).containsExactly("payment:CLOSED->OPEN", "payment:OPEN->HALF_OPEN");
    }

    @Test
    void openTimeout_경과_후_카운터_조회는_HALF_OPEN_새_세대를_반영() {
        // given
        trip();
        assertThat(breaker.getCounts().consecutiveFailures()).isZero();

        // when
        clock.advance(OPEN_TIMEOUT.plusMillis(1));
        Counts counts = breaker.getCounts();

        // then
        assertThat(counts).isEqualTo(Counts.EMPTY);
        assertThat(transitions).containsExactly("payment:CLOSED->OPEN", "payment:OPEN->HALF_OPEN");
    }

    // ============================================================
    // HALF_OPEN
    // ============================================================

    @Test
    void HALF_OPEN_probe_성공_시_CLOSED() throws Exception {
        // given
        trip();
        clock.advance(OPEN_TIMEOUT.plusMillis(1));

        // when
        String result = succeed(breaker);

        // then
        assertThat(result).isEqualTo("ok");
        assertThat(breaker.getState()).isEqualTo(CircuitBreakerState.CLOSED);
        assertThat(breaker.getCounts()).isEqualTo(Counts.EMPTY);
        assertThat(transitions).endsWith("payment:HALF_OPEN->CLOSED");
    }

    @Test
    void HALF_OPEN_probe_실패_시_다시_OPEN() {
        // given
        trip();
        clock.advance(OPEN_TIMEOUT.plusMillis(1));

        // when
        fail(breaker);

        // then
        assertThat(breaker.getState()).isEqualTo(CircuitBreakerState.OPEN);
        assertThatThrownBy(() -> succeed(breaker)).isInstanceOf(CircuitBreakerOpenException.class);
    }

    @Test
    void HALF_OPEN_허용량_초과_요청은_TooManyRequests() throws Exception {
        // given
        trip();
        clock.advance(OPEN_TIMEOUT.plusMillis(1));
        List<Throwable> rejected = new ArrayList<>();

        // when: probe 실행 중에 들어온 두 번째 요청
        String result = breaker.execute(CTX, ctx -> {
            try {
                succeed(breaker);
            } catch (TooManyRequestsException e) {
                rejected.add(e);
            }
            return "probe";
        });

        // then
        assertThat(result).isEqualTo("probe");
        assertThat(rejected).singleElement().isInstanceOf(TooManyRequestsException.class);
        assertThat(breaker.getState()).isEqualTo(CircuitBreakerState.CLOSED);
    }

    @Test
    void maxRequests만큼_연속_성공해야_CLOSED() throws Exception {
        // given
        DefaultCircuitBreaker cautious = create(
            new CircuitBreakerSettings("cautious", 3, Duration.ZERO, OPEN_TIMEOUT, 1));
        fail(cautious);
        clock.advance(OPEN_TIMEOUT.plusMillis(1));

        // when & then
        succeed(cautious);
        succeed(cautious);
        assertThat(cautious.getState()).isEqualTo(CircuitBreakerState.HALF_OPEN);
        succeed(cautious);
        assertThat(cautious.getState()).isEqualTo(CircuitBreakerState.CLOSED);
    }

    // ============================================================
    // 세대 / reset / 리스너
    // ============================================================

    @Test
    void 이전_세대에서_통과한_요청의_결과는_무시() {
        // when: 실행 중 reset으로 세대가 바뀐 뒤 실패
        assertThatThrownBy(() -> breaker.execute(CTX, ctx -> {
            breaker.reset();
            throw new IOException("late failure");
        })).isInstanceOf(IOException.class);

        // then
        assertThat(breaker.getCounts()).isEqualTo(Counts.EMPTY);
    }

    @Test
    void OPEN_전이_이후_도착한_이전_세대_성공은_CLOSED로_되돌리지_않음() throws Exception {
        // when: 실행 중 다른 요청들이 breaker를 OPEN으로 만든 뒤 성공
        String result = breaker.execute(CTX, ctx -> {
            fail(breaker);
            fail(breaker);
            return "late";
        });

        // then
        assertThat(result).isEqualTo("late");
        assertThat(breaker.getState()).isEqualTo(CircuitBreakerState.OPEN);
    }

    @Test
    void reset은_CLOSED_새_세대로_전환() {
        // given
        trip();

        // when
        breaker.reset();

        // then
        assertThat(breaker.getState()).isEqualTo(CircuitBreakerState.CLOSED);
        assertThat(breaker.getCounts()).isEqualTo(Counts.EMPTY);
        assertThat(transitions).containsExactly("payment:CLOSED->OPEN", "payment:OPEN->CLOSED");
    }

    @Test
    void 리스너_예외는_상태_전이를_막지_않음() {
        DefaultCircuitBreaker noisy = new DefaultCircuitBreaker(
            new CircuitBreakerSettings("noisy", 1, Duration.ZERO, OPEN_TIMEOUT, 1),
            (name, from, to) -> {
                throw new IllegalStateException("listener failure");
            },
            clock
        );

        fail(noisy);

        assertThat(noisy.getState()).isEqualTo(CircuitBreakerState.OPEN);
    }

    @Test
    void 생성자_null_검증() {
        assertThatThrownBy(() -> new DefaultCircuitBreaker(null))
            .isInstanceOf(IllegalArgumentException.class);
        CircuitBreakerSettings settings = new CircuitBreakerSettings("x", 1, null, null, 1);
        assertThatThrownBy(() -> new DefaultCircuitBreaker(settings, null, null))
            .isInstanceOf(IllegalArgumentException.class);
    }

    // ============================================================
    // 동시성
    // ============================================================

    @Test
    void 동시_요청도_모든_결과를_기록() throws Exception {
        // given
        DefaultCircuitBreaker shared = create(
            new CircuitBreakerSettings("shared", 1, Duration.ZERO, OPEN_TIMEOUT, 1_000));
        int threads = 8;
        int callsPerThread = 200;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<?>> futures = new ArrayList<>();

        // when
        for (int t = 0; t < threads; t++) {
            futures.add(pool.submit(() -> {
                start.await();
                for (int i = 0; i < callsPerThread; i++) {
                    shared.execute(CTX, ctx -> "ok");
                }
                return null;
            }));
        }
        start.countDown();
        for (Future<?> future : futures) {
            future.get(10, TimeUnit.SECONDS);
        }
        pool.shutdown();

        // then
        Counts counts = shared.getCounts();
        assertThat(counts.requests()).isEqualTo(threads * callsPerThread);
        assertThat(counts.totalSuccesses()).isEqualTo(threads * callsPerThread);
        assertThat(shared.getState()).isEqualTo(CircuitBreakerState.CLOSED);
    }

    /**
     * 테스트용 수동 시계.
     */
    private static final class MutableClock extends Clock {

        private volatile Instant now;

        private MutableClock(Instant now) {
            this.now = now;
        }

        void advance(Duration duration) {
            now = now.plus(duration);
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return now;
        }
    }
}
