package com.rgp.application.port.out;

import java.util.function.Supplier;

/**
 * Output port - atomic execution of a chain of state changes.
 * If the work throws, every enlisted resource returns to the state it had
 * when the outermost unit started. Nested calls join the outer unit.
 */
public interface UnitOfWork {

    <T> T execute(Supplier<T> work);

    default void run(Runnable work) {
        execute(() -> {
            work.run();
            return null;
        });
    }

    /**
     * Register an action that runs once the outermost unit commits.
     * Discarded on rollback.
     */
    void afterCommit(Runnable action);
}
