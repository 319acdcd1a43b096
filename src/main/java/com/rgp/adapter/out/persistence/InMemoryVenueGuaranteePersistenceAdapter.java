package com.rgp.adapter.out.persistence;

import com.rgp.application.port.out.VenueGuaranteeRepository;
import com.rgp.domain.model.VenueGuarantee;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * In-memory persistence adapter for guarantee engine state.
 * Reports are held on the aggregate, indexed by month.
 */
public class InMemoryVenueGuaranteePersistenceAdapter implements VenueGuaranteeRepository, SnapshotParticipant<Map<String, VenueGuarantee>> {

    private Map<String, VenueGuarantee> guarantees = new HashMap<>();

    @Override
    public Optional<VenueGuarantee> findByVenueId(String venueId) {
        return Optional.ofNullable(guarantees.get(venueId));
    }

    @Override
    public boolean exists(String venueId) {
        return guarantees.containsKey(venueId);
    }

    @Override
    public void save(VenueGuarantee guarantee) {
        guarantees.put(guarantee.getVenueId(), guarantee);
    }

    @Override
    public Map<String, VenueGuarantee> snapshot() {
        Map<String, VenueGuarantee> copy = new HashMap<>();
        guarantees.forEach((venueId, guarantee) -> copy.put(venueId, guarantee.copy()));
        return copy;
    }

    @Override
    public void restore(Map<String, VenueGuarantee> snapshot) {
        guarantees = snapshot;
    }
}
