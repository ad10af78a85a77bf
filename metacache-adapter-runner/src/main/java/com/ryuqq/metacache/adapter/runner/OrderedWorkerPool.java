package com.ryuqq.metacache.adapter.runner;

import com.ryuqq.metacache.core.config.ExecutionOrder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * 준비 큐가 deque인 고정 크기 작업자 풀.
 *
 * <p><strong>순서 정책:</strong></p>
 * <ul>
 *   <li>FIFO: 큐 뒤에 추가 (제출 순서대로 시작)</li>
 *   <li>LIFO: 큐 앞에 추가 (가장 최근 제출이 먼저 시작)</li>
 *   <li>이미 시작된 작업은 순서 정책의 영향을 받지 않음</li>
 * </ul>
 *
 * <p><strong>지원 기능:</strong></p>
 * <ul>
 *   <li>시작 전 작업 제거 ({@link #remove(Runnable)})</li>
 *   <li>일시 중지 ({@link #setSuspended(boolean)}): 대기 작업이 시작되지 않음, 실행 중 작업은 계속</li>
 *   <li>크기 변경 ({@link #resize(int)}): 줄이면 남는 작업자는 현재 작업을 마친 뒤 종료</li>
 * </ul>
 *
 * <p>ThreadPoolExecutor의 큐는 일시 중지와 앞쪽 삽입을 제공하지 않으므로 작업자 루프를 직접 둡니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class OrderedWorkerPool implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(OrderedWorkerPool.class);

    private final String threadPrefix;
    private final ReentrantLock lock = new ReentrantLock();
    private final Condition changed = lock.newCondition();
    private final Deque<Runnable> ready = new ArrayDeque<>();
    private final Set<Thread> workers = new HashSet<>();

    private int targetSize;
    private int activeCount;
    private int threadSequence;
    private boolean suspended;
    private boolean shutdown;

    /**
     * 생성자.
     *
     * @param threadPrefix 작업자 스레드 이름 접두사
     * @param size 작업자 수 (1 이상)
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public OrderedWorkerPool(String threadPrefix, int size) {
        if (threadPrefix == null || threadPrefix.isBlank()) {
            throw new IllegalArgumentException("threadPrefix cannot be null or blank");
        }
        validateSize(size);
        this.threadPrefix = threadPrefix;
        lock.lock();
        try {
            this.targetSize = size;
            spawnMissingWorkers();
        } finally {
            lock.unlock();
        }
    }

    /**
     * 작업 제출.
     *
     * @param task 실행할 작업
     * @param order 큐 삽입 위치
     * @throws IllegalStateException 풀이 종료된 경우
     */
    public void submit(Runnable task, ExecutionOrder order) {
        if (task == null) {
            throw new IllegalArgumentException("task cannot be null");
        }
        if (order == null) {
            throw new IllegalArgumentException("order cannot be null");
        }
        lock.lock();
        try {
            if (shutdown) {
                throw new IllegalStateException("Worker pool is shut down");
            }
            if (order == ExecutionOrder.LIFO) {
                ready.offerFirst(task);
            } else {
                ready.offerLast(task);
            }
            changed.signal();
        } finally {
            lock.unlock();
        }
    }

    /**
     * 아직 시작되지 않은 작업 제거.
     *
     * @return 큐에서 제거되었으면 true
     */
    public boolean remove(Runnable task) {
        lock.lock();
        try {
            return ready.remove(task);
        } finally {
            lock.unlock();
        }
    }

    public void setSuspended(boolean suspended) {
        lock.lock();
        try {
            this.suspended = suspended;
            changed.signalAll();
        } finally {
            lock.unlock();
        }
    }

    public boolean isSuspended() {
        lock.lock();
        try {
            return suspended;
        } finally {
            lock.unlock();
        }
    }

    /**
     * 작업자 수 변경.
     *
     * @param size 새 작업자 수 (1 이상)
     */
    public void resize(int size) {
        validateSize(size);
        lock.lock();
        try {
            if (shutdown) {
                return;
            }
            targetSize = size;
            spawnMissingWorkers();
            changed.signalAll();
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        lock.lock();
        try {
            return targetSize;
        } finally {
            lock.unlock();
        }
    }

    public int activeCount() {
        lock.lock();
        try {
            return activeCount;
        } finally {
            lock.unlock();
        }
    }

    public int queuedCount() {
        lock.lock();
        try {
            return ready.size();
        } finally {
            lock.unlock();
        }
    }

    /**
     * 풀 종료. 실행 중 작업은 끝까지 실행되고, 대기 작업은 시작되지 않습니다.
     *
     * @return 시작되지 못한 작업 목록
     */
    public List<Runnable> shutdown() {
        lock.lock();
        try {
            shutdown = true;
            List<Runnable> pending = new ArrayList<>(ready);
            ready.clear();
            changed.signalAll();
            return pending;
        } finally {
            lock.unlock();
        }
    }

    /**
     * 모든 작업자 종료 대기.
     *
     * @return 제한 시간 안에 모두 종료되면 true
     */
    public boolean awaitTermination(long timeout, TimeUnit unit) throws InterruptedException {
        long deadline = System.nanoTime() + unit.toNanos(timeout);
        List<Thread> snapshot;
        lock.lock();
        try {
            snapshot = new ArrayList<>(workers);
        } finally {
            lock.unlock();
        }
        for (Thread worker : snapshot) {
            long remaining = deadline - System.nanoTime();
            if (remaining <= 0) {
                return false;
            }
            TimeUnit.NANOSECONDS.timedJoin(worker, remaining);
            if (worker.isAlive()) {
                return false;
            }
        }
        return true;
    }

    /**
     * 종료 후 최대 5초 대기, 남은 작업자는 인터럽트.
     */
    @Override
    public void close() {
        List<Runnable> dropped = shutdown();
        if (!dropped.isEmpty()) {
            log.debug("Dropped {} queued tasks on close", dropped.size());
        }
        try {
            if (!awaitTermination(5, TimeUnit.SECONDS)) {
                interruptWorkers();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            interruptWorkers();
        }
    }

    private void interruptWorkers() {
        lock.lock();
        try {
            workers.forEach(Thread::interrupt);
        } finally {
            lock.unlock();
        }
    }

    private void spawnMissingWorkers() {
        while (workers.size() < targetSize) {
            Thread worker = new Thread(this::workLoop, threadPrefix + "-" + (++threadSequence));
            worker.setDaemon(true);
            workers.add(worker);
            worker.start();
        }
    }

    private void workLoop() {
        while (true) {
            Runnable task = nextTask();
            if (task == null) {
                return;
            }
            try {
                task.run();
            } catch (RuntimeException e) {
                log.error("Unexpected failure in worker {}", Thread.currentThread().getName(), e);
            } catch (Error e) {
                log.error("Worker {} terminated by {}", Thread.currentThread().getName(), e.getClass().getName(), e);
                replaceCurrentWorker();
                throw e;
            } finally {
                lock.lock();
                try {
                    activeCount--;
                } finally {
                    lock.unlock();
                }
            }
        }
    }

    /**
     * 종료되는 현재 작업자를 목록에서 빼고, 풀이 살아 있으면 새 작업자로 채웁니다.
     */
    private void replaceCurrentWorker() {
        lock.lock();
        try {
            workers.remove(Thread.currentThread());
            if (!shutdown) {
                spawnMissingWorkers();
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * @return 다음 작업, 작업자가 종료해야 하면 null
     */
    private Runnable nextTask() {
        lock.lock();
        try {
            while (true) {
                if (shutdown || workers.size() > targetSize) {
                    workers.remove(Thread.currentThread());
                    return null;
                }
                if (!suspended && !ready.isEmpty()) {
                    activeCount++;
                    return ready.pollFirst();
                }
                changed.awaitUninterruptibly();
            }
        } finally {
            lock.unlock();
        }
    }

    private static void validateSize(int size) {
        if (size <= 0) {
            throw new IllegalArgumentException("size must be positive (current: " + size + ")");
        }
    }
}
