package com.rgp.adapter.out.persistence;

import com.rgp.application.port.out.VenueAssignmentRepository;
import com.rgp.domain.model.CommittedStake;
import com.rgp.domain.model.VenueAssignment;
import com.rgp.domain.model.VenueStakeKey;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * In-memory persistence adapter for venue assignments.
 * Commitments are a flat table keyed by (venueId, underwriter); the roster order lives on the assignment.
 */
public class InMemoryVenueAssignmentPersistenceAdapter implements VenueAssignmentRepository, SnapshotParticipant<InMemoryVenueAssignmentPersistenceAdapter.State> {

    private Map<String, VenueAssignment> assignments = new HashMap<>();
    private Map<VenueStakeKey, CommittedStake> commitments = new HashMap<>();

    @Override
    public Optional<VenueAssignment> findByVenueId(String venueId) {
        return Optional.ofNullable(assignments.get(venueId));
    }

    @Override
    public boolean exists(String venueId) {
        return assignments.containsKey(venueId);
    }

    @Override
    public void save(VenueAssignment assignment) {
        assignments.put(assignment.getVenueId(), assignment);
    }

    @Override
    public Optional<CommittedStake> findCommitment(VenueStakeKey key) {
        return Optional.ofNullable(commitments.get(key));
    }

    @Override
    public void saveCommitment(VenueStakeKey key, CommittedStake commitment) {
        commitments.put(key, commitment);
    }

    @Override
    public State snapshot() {
        Map<String, VenueAssignment> assignmentCopy = new HashMap<>();
        assignments.forEach((venueId, assignment) -> assignmentCopy.put(venueId, assignment.copy()));
        Map<VenueStakeKey, CommittedStake> commitmentCopy = new HashMap<>();
        commitments.forEach((key, commitment) -> commitmentCopy.put(key, commitment.copy()));
        return new State(assignmentCopy, commitmentCopy);
    }

    @Override
    public void restore(State snapshot) {
        assignments = snapshot.assignments();
        commitments = snapshot.commitments();
    }

    record State(Map<String, VenueAssignment> assignments, Map<VenueStakeKey, CommittedStake> commitments) {}
}
