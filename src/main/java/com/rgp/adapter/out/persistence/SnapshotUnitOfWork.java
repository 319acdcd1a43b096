package com.rgp.adapter.out.persistence;

import com.rgp.application.port.out.UnitOfWork;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Supplier;

/**
 * Unit of work over in-memory participants.
 * The outermost execute snapshots every participant; any exception restores them all
 * and drops pending after-commit actions. Not thread-safe: callers run on one event loop.
 */
@Slf4j
public class SnapshotUnitOfWork implements UnitOfWork {

    private final List<SnapshotParticipant<?>> participants = new ArrayList<>();
    private final List<Runnable> pendingActions = new ArrayList<>();
    private int depth;

    public SnapshotUnitOfWork enlist(SnapshotParticipant<?> participant) {
        participants.add(participant);
        return this;
    }

    @Override
    public <T> T execute(Supplier<T> work) {
        if (depth > 0) {
            depth++;
            try {
                return work.get();
            } finally {
                depth--;
            }
        }

        List<Snapshot<?>> snapshots = new ArrayList<>();
        for (SnapshotParticipant<?> participant : participants) {
            snapshots.add(Snapshot.of(participant));
        }

        depth = 1;
        T result;
        try {
            result = work.get();
        } catch (RuntimeException | Error e) {
            rollback(snapshots, e);
            throw e;
        } finally {
            depth = 0;
        }

        runAfterCommit();
        return result;
    }

    @Override
    public void afterCommit(Runnable action) {
        if (depth == 0) {
            action.run();
            return;
        }
        pendingActions.add(action);
    }

    public boolean isActive() {
        return depth > 0;
    }

    private void rollback(List<Snapshot<?>> snapshots, Throwable cause) {
        snapshots.forEach(Snapshot::restore);
        int dropped = pendingActions.size();
        pendingActions.clear();
        log.debug("Rolled back unit of work ({} participants, {} pending actions dropped): {}",
                snapshots.size(), dropped, cause.toString());
    }

    private void runAfterCommit() {
        List<Runnable> actions = new ArrayList<>(pendingActions);
        pendingActions.clear();
        for (Runnable action : actions) {
            try {
                action.run();
            } catch (RuntimeException e) {
                // state is already committed; the failed action cannot undo it
                log.error("After-commit action failed", e);
            }
        }
    }

    private record Snapshot<S>(SnapshotParticipant<S> participant, S state) {

        static <S> Snapshot<S> of(SnapshotParticipant<S> participant) {
            return new Snapshot<>(participant, participant.snapshot());
        }

        void restore() {
            participant.restore(state);
        }
    }
}
