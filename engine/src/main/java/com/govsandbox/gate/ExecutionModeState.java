package com.govsandbox.gate;

import com.govsandbox.domain.ExecutionMode;
import org.springframework.stereotype.Component;

import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Function;
import java.util.function.UnaryOperator;

/**
 * The process-wide execution mode. Starts in SHADOW. Readers share the lock; a transition holds it exclusively,
 * so no reader observes a mode change in the middle of a decision.
 */
@Component
public class ExecutionModeState {

    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock(true);
    private ExecutionMode mode = ExecutionMode.SHADOW;

    public ExecutionMode current() {
        lock.readLock().lock();
        try {
            return mode;
        } finally {
            lock.readLock().unlock();
        }
    }

    /** Runs {@code work} with the mode pinned for its whole duration. */
    public <T> T withModeRead(Function<ExecutionMode, T> work) {
        lock.readLock().lock();
        try {
            return work.apply(mode);
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Runs {@code decide} exclusively; its result becomes the new mode. If it throws, the mode is unchanged.
     */
    ExecutionMode transition(UnaryOperator<ExecutionMode> decide) {
        lock.writeLock().lock();
        try {
            mode = decide.apply(mode);
            return mode;
        } finally {
            lock.writeLock().unlock();
        }
    }
}
