package com.rgp.adapter.out.persistence;

/**
 * In-memory resource that can be rolled back by {@link SnapshotUnitOfWork}
 *
 * @param <S> type of the captured state
 */
public interface SnapshotParticipant<S> {

    /**
     * @return an independent copy of the current state
     */
    S snapshot();

    /**
     * Replace the current state with a copy previously returned by {@link #snapshot()}
     */
    void restore(S snapshot);
}
