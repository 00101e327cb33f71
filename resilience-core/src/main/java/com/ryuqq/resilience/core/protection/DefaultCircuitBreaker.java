package com.ryuqq.resilience.core.protection;

import com.ryuqq.resilience.core.context.ExecutionContext;
import com.ryuqq.resilience.core.error.CircuitBreakerOpenException;
import com.ryuqq.resilience.core.error.TooManyRequestsException;
import com.ryuqq.resilience.core.model.Operation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.locks.ReentrantLock;

/**
 * 연속 실패 기반 Circuit Breaker 구현체.
 *
 * <p>상태와 카운터는 하나의 {@link ReentrantLock}으로 보호되며, 모든 읽기/쓰기가 직렬화됩니다.
 * 동시 호출자들은 항상 하나의 일관된 상태 전이 순서를 관찰합니다.</p>
 *
 * <p><strong>세대(generation):</strong></p>
 * <ul>
 *   <li>상태가 바뀌거나 CLOSED 상태의 interval이 경과할 때마다 세대 번호가 증가하고 카운터가 초기화됩니다.</li>
 *   <li>요청은 통과 시점의 세대를 기억하며, 결과 기록 시 세대가 달라졌다면 그 결과는 버려집니다.</li>
 * </ul>
 *
 * <p><strong>잠금 구간:</strong> 통과 판정(beforeRequest)과 결과 기록(afterRequest)만 잠금 안에서 수행되고,
 * 작업 실행과 리스너 통지는 잠금 밖에서 수행됩니다.</p>
 *
 * @author Resilience Team
 * @since 1.0.0
 */
public final class DefaultCircuitBreaker implements CircuitBreaker {

    private static final Logger log = LoggerFactory.getLogger(DefaultCircuitBreaker.class);

    private final CircuitBreakerSettings settings;
    private final StateChangeListener listener;
    private final Clock clock;
    private final ReentrantLock lock = new ReentrantLock();

    private CircuitBreakerState state = CircuitBreakerState.CLOSED;
    private long generation;
    private Counts counts = Counts.EMPTY;
    private Instant expiry;

    /**
     * 생성자 (리스너 없음, 시스템 시계).
     *
     * @param settings 설정
     * @throws IllegalArgumentException settings가 null인 경우
     */
    public DefaultCircuitBreaker(CircuitBreakerSettings settings) {
        this(settings, null, Clock.systemUTC());
    }

    /**
     * 생성자 (시스템 시계).
     *
     * @param settings 설정
     * @param listener 상태 전이 리스너 (null 허용)
     * @throws IllegalArgumentException settings가 null인 경우
     */
    public DefaultCircuitBreaker(CircuitBreakerSettings settings, StateChangeListener listener) {
        this(settings, listener, Clock.systemUTC());
    }

    /**
     * 생성자 (시계 커스터마이징).
     *
     * @param settings 설정
     * @param listener 상태 전이 리스너 (null 허용)
     * @param clock 시계
     * @throws IllegalArgumentException settings 또는 clock이 null인 경우
     */
    public DefaultCircuitBreaker(CircuitBreakerSettings settings, StateChangeListener listener, Clock clock) {
        if (settings == null) {
            throw new IllegalArgumentException("settings cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.settings = settings;
        this.listener = listener;
        this.clock = clock;
        toNewGeneration(clock.instant());
    }

    @Override
    public String name() {
        return settings.name();
    }

    /**
     * 설정 조회.
     *
     * @return 기본값이 적용된 설정
     */
    public CircuitBreakerSettings settings() {
        return settings;
    }

    @Override
    public <T> T execute(ExecutionContext ctx, Operation<T> operation) throws Exception {
        long admittedGeneration = beforeRequest();

        T result;
        try {
            result = operation.execute(ctx);
        } catch (Throwable t) {
            afterRequest(admittedGeneration, false);
            throw t;
        }
        afterRequest(admittedGeneration, true);
        return result;
    }

    @Override
    public CircuitBreakerState getState() {
        List<Transition> transitions = new ArrayList<>(1);
        CircuitBreakerState current;
        lock.lock();
        try {
            currentState(clock.instant(), transitions);
            current = state;
        } finally {
            lock.unlock();
        }
        publish(transitions);
        return current;
    }

    @Override
    public Counts getCounts() {
        List<Transition> transitions = new ArrayList<>(1);
        Counts current;
        lock.lock();
        try {
            currentState(clock.instant(), transitions);
            current = counts;
        } finally {
            lock.unlock();
        }
        publish(transitions);
        return current;
    }

    @Override
    public void reset() {
        List<Transition> transitions = new ArrayList<>(1);
        lock.lock();
        try {
            setState(CircuitBreakerState.CLOSED, clock.instant(), transitions);
            if (transitions.isEmpty()) {
                toNewGeneration(clock.instant());
            }
        } finally {
            lock.unlock();
        }
        log.info("Circuit breaker {} reset to CLOSED", settings.name());
        publish(transitions);
    }

    private long beforeRequest() {
        List<Transition> transitions = new ArrayList<>(1);
        RuntimeException rejection = null;
        long admitted = -1;
        lock.lock();
        try {
            currentState(clock.instant(), transitions);

            if (state == CircuitBreakerState.OPEN) {
                rejection = new CircuitBreakerOpenException(settings.name());
            } else if (state == CircuitBreakerState.HALF_OPEN && counts.requests() >= settings.maxRequests()) {
                rejection = new TooManyRequestsException(settings.name());
            } else {
                counts = counts.onRequest();
                admitted = generation;
            }
        } finally {
            lock.unlock();
        }
        publish(transitions);

        if (rejection != null) {
            log.debug("Circuit breaker {} rejected request: {}", settings.name(), rejection.getMessage());
            throw rejection;
        }
        return admitted;
    }

    private void afterRequest(long admittedGeneration, boolean success) {
        List<Transition> transitions = new ArrayList<>(1);
        lock.lock();
        try {
            Instant now = clock.instant();
            currentState(now, transitions);
            if (generation != admittedGeneration) {
                return;
            }
            if (success) {
                onSuccess(now, transitions);
            } else {
                onFailure(now, transitions);
            }
        } finally {
            lock.unlock();
            publish(transitions);
        }
    }

    private void onSuccess(Instant now, List<Transition> transitions) {
        switch (state) {
            case CLOSED -> counts = counts.onSuccess();
            case HALF_OPEN -> {
                counts = counts.onSuccess();
                if (counts.consecutiveSuccesses() >= settings.maxRequests()) {
                    setState(CircuitBreakerState.CLOSED, now, transitions);
                }
            }
            case OPEN -> {
                // OPEN 세대에는 통과한 요청이 없음
            }
        }
    }

    private void onFailure(Instant now, List<Transition> transitions) {
        switch (state) {
            case CLOSED -> {
                counts = counts.onFailure();
                if (settings.readyToTrip(counts)) {
                    setState(CircuitBreakerState.OPEN, now, transitions);
                }
            }
            case HALF_OPEN -> setState(CircuitBreakerState.OPEN, now, transitions);
            case OPEN -> {
                // OPEN 세대에는 통과한 요청이 없음
            }
        }
    }

    private void currentState(Instant now, List<Transition> transitions) {
        switch (state) {
            case CLOSED -> {
                if (expiry != null && expiry.isBefore(now)) {
                    toNewGeneration(now);
                }
            }
            case OPEN -> {
                if (expiry.isBefore(now)) {
                    setState(CircuitBreakerState.HALF_OPEN, now, transitions);
                }
            }
            case HALF_OPEN -> {
                // probe 결과로만 전이
            }
        }
    }

    private void setState(CircuitBreakerState next, Instant now, List<Transition> transitions) {
        if (state == next) {
            return;
        }
        CircuitBreakerState previous = state;
        state = next;
        toNewGeneration(now);
        transitions.add(new Transition(previous, next));
    }

    private void toNewGeneration(Instant now) {
        generation++;
        counts = Counts.EMPTY;
        expiry = switch (state) {
            case CLOSED -> settings.hasInterval() ? now.plus(settings.interval()) : null;
            case OPEN -> now.plus(settings.openTimeout());
            case HALF_OPEN -> null;
        };
    }

    private void publish(List<Transition> transitions) {
        for (Transition transition : transitions) {
            log.info("Circuit breaker {} state changed: {} → {}",
                settings.name(), transition.from(), transition.to());
            if (listener == null) {
                continue;
            }
            try {
                listener.onStateChange(settings.name(), transition.from(), transition.to());
            } catch (RuntimeException e) {
                log.warn("State change listener failed for circuit breaker {}", settings.name(), e);
            }
        }
    }

    private record Transition(CircuitBreakerState from, CircuitBreakerState to) {
    }
}
