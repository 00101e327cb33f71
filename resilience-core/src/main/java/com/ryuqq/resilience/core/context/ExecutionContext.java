package com.ryuqq.resilience.core.context;

import com.ryuqq.resilience.core.error.CancelledException;
import com.ryuqq.resilience.core.error.DeadlineExceededException;
import com.ryuqq.resilience.core.error.ResilienceException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;

/**
 * 취소 가능한 실행 컨텍스트.
 *
 * <p>작업(Operation)과 가드 계층이 공유하는 취소 신호와 데드라인을 전달합니다.
 * 컨텍스트는 트리를 이루며, 부모가 종료(취소 또는 데드라인 경과)되면 모든 자식도 같은 원인으로 종료됩니다.</p>
 *
 * <p><strong>종료 원인:</strong></p>
 * <ul>
 *   <li>{@link CancelledException}: {@link CancellableContext#cancel()} 호출</li>
 *   <li>{@link DeadlineExceededException}: 데드라인 경과</li>
 * </ul>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>{@code
 * try (CancellableContext ctx = ExecutionContext.background().withTimeout(Duration.ofSeconds(2))) {
 *     while (!ctx.isDone()) {
 *         pollOnce();
 *     }
 * }
 * }</pre>
 *
 * <p>작업은 컨텍스트를 협조적으로 관찰해야 합니다. 컨텍스트 종료가 실행 중인 스레드를 인터럽트하지는 않습니다.</p>
 *
 * @author Resilience Team
 * @since 1.0.0
 */
public class ExecutionContext {

    private static final Logger log = LoggerFactory.getLogger(ExecutionContext.class);

    private static final ExecutionContext BACKGROUND = new ExecutionContext(null, 0L, false);

    private static final ScheduledThreadPoolExecutor DEADLINE_TIMER = createDeadlineTimer();

    private final ExecutionContext parent;
    private final long deadlineNanos;
    private final boolean hasDeadline;

    private final ReentrantLock lock = new ReentrantLock();
    private final CountDownLatch doneLatch = new CountDownLatch(1);
    private final List<Consumer<ResilienceException>> listeners = new ArrayList<>();
    private final Set<ExecutionContext> children = new LinkedHashSet<>();

    private volatile ResilienceException error;
    private ScheduledFuture<?> deadlineTimer;

    ExecutionContext(ExecutionContext parent, long deadlineNanos, boolean hasDeadline) {
        this.parent = parent;
        this.deadlineNanos = deadlineNanos;
        this.hasDeadline = hasDeadline;
    }

    /**
     * 루트 컨텍스트 조회.
     *
     * <p>취소되지 않으며 데드라인도 없습니다.</p>
     *
     * @return 루트 컨텍스트
     */
    public static ExecutionContext background() {
        return BACKGROUND;
    }

    /**
     * 취소 가능한 자식 컨텍스트 생성.
     *
     * @return 자식 컨텍스트
     */
    public CancellableContext withCancel() {
        return attach(new CancellableContext(this, deadlineNanos, hasDeadline));
    }

    /**
     * 현재 시각부터 주어진 시간 뒤에 종료되는 자식 컨텍스트 생성.
     *
     * @param timeout 허용 시간
     * @return 자식 컨텍스트
     * @throws IllegalArgumentException timeout이 null인 경우
     */
    public CancellableContext withTimeout(Duration timeout) {
        if (timeout == null) {
            throw new IllegalArgumentException("timeout cannot be null");
        }
        return withDeadline(System.nanoTime() + Math.max(saturatedNanos(timeout), 0L));
    }

    /**
     * 주어진 {@link System#nanoTime()} 시점에 종료되는 자식 컨텍스트 생성.
     *
     * <p>부모의 데드라인이 더 이르면 부모의 데드라인을 따릅니다.</p>
     *
     * @param deadlineNanos 데드라인 ({@link System#nanoTime()} 기준)
     * @return 자식 컨텍스트
     */
    public CancellableContext withDeadline(long deadlineNanos) {
        long effective = deadlineNanos;
        if (hasDeadline && this.deadlineNanos - deadlineNanos < 0) {
            effective = this.deadlineNanos;
        }
        CancellableContext child = attach(new CancellableContext(this, effective, true));
        child.scheduleDeadline();
        return child;
    }

    /**
     * 종료 여부 확인.
     *
     * @return 취소되었거나 데드라인이 지났으면 true
     */
    public boolean isDone() {
        return error() != null;
    }

    /**
     * 종료 원인 조회.
     *
     * @return 종료 원인, 아직 종료되지 않았으면 null
     */
    public ResilienceException error() {
        ResilienceException current = error;
        if (current == null && hasDeadline && System.nanoTime() - deadlineNanos >= 0) {
            finish(new DeadlineExceededException());
            current = error;
        }
        return current;
    }

    /**
     * 종료되었으면 종료 원인을 던집니다.
     *
     * @throws ResilienceException 컨텍스트가 종료된 경우
     */
    public void throwIfDone() {
        ResilienceException current = error();
        if (current != null) {
            throw current;
        }
    }

    /**
     * 데드라인 보유 여부.
     *
     * @return 데드라인이 있으면 true
     */
    public boolean hasDeadline() {
        return hasDeadline;
    }

    /**
     * 데드라인까지 남은 시간 조회.
     *
     * @return 남은 시간 (이미 지났으면 {@link Duration#ZERO}), 데드라인이 없으면 empty
     */
    public Optional<Duration> remaining() {
        if (!hasDeadline) {
            return Optional.empty();
        }
        long left = deadlineNanos - System.nanoTime();
        return Optional.of(left > 0 ? Duration.ofNanos(left) : Duration.ZERO);
    }

    /**
     * 종료 시 호출될 리스너 등록.
     *
     * <p>이미 종료된 경우 호출 스레드에서 즉시 실행됩니다.
     * 루트 컨텍스트는 종료되지 않으므로 등록된 리스너를 보관하지 않습니다.</p>
     *
     * @param listener 종료 원인을 받는 리스너
     * @throws IllegalArgumentException listener가 null인 경우
     */
    public void onDone(Consumer<ResilienceException> listener) {
        if (listener == null) {
            throw new IllegalArgumentException("listener cannot be null");
        }
        if (this == BACKGROUND) {
            return;
        }
        ResilienceException current;
        lock.lock();
        try {
            current = error;
            if (current == null) {
                listeners.add(listener);
                return;
            }
        } finally {
            lock.unlock();
        }
        notifyListener(listener, current);
    }

    /**
     * 주어진 시간 동안 대기하되, 컨텍스트가 먼저 종료되면 즉시 반환합니다.
     *
     * <p>대기 중 스레드가 인터럽트되면 인터럽트 플래그를 복원하고
     * {@link CancelledException}을 던집니다.</p>
     *
     * @param duration 최대 대기 시간
     * @return 대기 중(또는 대기 전) 컨텍스트가 종료되었으면 true, 시간이 모두 흘렀으면 false
     * @throws CancelledException 대기 중 인터럽트된 경우
     */
    public boolean await(Duration duration) {
        if (isDone()) {
            return true;
        }
        long nanos = saturatedNanos(duration);
        if (nanos <= 0) {
            return isDone();
        }
        if (this == BACKGROUND) {
            sleepUninterrupted(nanos);
            return false;
        }
        try {
            doneLatch.await(nanos, TimeUnit.NANOSECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CancelledException(e);
        }
        return isDone();
    }

    /**
     * 컨텍스트를 주어진 원인으로 종료.
     *
     * <p>최초 1회만 유효하며, 자식 컨텍스트와 리스너에게 같은 원인이 전파됩니다.</p>
     *
     * @param cause 종료 원인
     */
    void finish(ResilienceException cause) {
        List<Consumer<ResilienceException>> toNotify;
        List<ExecutionContext> toFinish;
        lock.lock();
        try {
            if (error != null) {
                return;
            }
            error = cause;
            toNotify = new ArrayList<>(listeners);
            toFinish = new ArrayList<>(children);
            listeners.clear();
            children.clear();
            if (deadlineTimer != null) {
                deadlineTimer.cancel(false);
                deadlineTimer = null;
            }
        } finally {
            lock.unlock();
        }

        doneLatch.countDown();
        if (parent != null) {
            parent.detach(this);
        }
        for (ExecutionContext child : toFinish) {
            child.finish(cause);
        }
        for (Consumer<ResilienceException> listener : toNotify) {
            notifyListener(listener, cause);
        }
    }

    private <C extends ExecutionContext> C attach(C child) {
        if (this == BACKGROUND) {
            return child;
        }
        ResilienceException current;
        lock.lock();
        try {
            current = error;
            if (current == null) {
                children.add(child);
                return child;
            }
        } finally {
            lock.unlock();
        }
        child.finish(current);
        return child;
    }

    private void detach(ExecutionContext child) {
        if (this == BACKGROUND) {
            return;
        }
        lock.lock();
        try {
            children.remove(child);
        } finally {
            lock.unlock();
        }
    }

    void scheduleDeadline() {
        long delay = deadlineNanos - System.nanoTime();
        if (delay <= 0) {
            finish(new DeadlineExceededException());
            return;
        }
        lock.lock();
        try {
            if (error != null) {
                return;
            }
            deadlineTimer = DEADLINE_TIMER.schedule(
                () -> finish(new DeadlineExceededException()), delay, TimeUnit.NANOSECONDS);
        } finally {
            lock.unlock();
        }
    }

    private static void notifyListener(Consumer<ResilienceException> listener, ResilienceException cause) {
        try {
            listener.accept(cause);
        } catch (RuntimeException e) {
            log.warn("ExecutionContext done-listener failed (cause: {})", cause.getMessage(), e);
        }
    }

    private static long saturatedNanos(Duration duration) {
        if (duration == null) {
            return 0L;
        }
        try {
            return duration.toNanos();
        } catch (ArithmeticException e) {
            return duration.isNegative() ? Long.MIN_VALUE : Long.MAX_VALUE;
        }
    }

    private static void sleepUninterrupted(long nanos) {
        try {
            TimeUnit.NANOSECONDS.sleep(nanos);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CancelledException(e);
        }
    }

    private static ScheduledThreadPoolExecutor createDeadlineTimer() {
        ScheduledThreadPoolExecutor timer = new ScheduledThreadPoolExecutor(1, runnable -> {
            Thread thread = new Thread(runnable, "resilience-deadline-timer");
            thread.setDaemon(true);
            return thread;
        });
        timer.setRemoveOnCancelPolicy(true);
        return timer;
    }
}
