package com.rgp.adapter.out.persistence;

import com.rgp.application.port.out.UnderwriterRepository;
import com.rgp.domain.model.UnderwriterStake;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * In-memory persistence adapter for underwriter stake triples
 */
public class InMemoryUnderwriterPersistenceAdapter implements UnderwriterRepository, SnapshotParticipant<Map<String, UnderwriterStake>> {

    private Map<String, UnderwriterStake> stakes = new HashMap<>();

    @Override
    public Optional<UnderwriterStake> findByUnderwriter(String underwriter) {
        return Optional.ofNullable(stakes.get(underwriter));
    }

    @Override
    public boolean exists(String underwriter) {
        return stakes.containsKey(underwriter);
    }

    @Override
    public void save(UnderwriterStake stake) {
        stakes.put(stake.getUnderwriter(), stake);
    }

    @Override
    public Map<String, UnderwriterStake> snapshot() {
        Map<String, UnderwriterStake> copy = new HashMap<>();
        stakes.forEach((underwriter, stake) -> copy.put(underwriter, stake.copy()));
        return copy;
    }

    @Override
    public void restore(Map<String, UnderwriterStake> snapshot) {
        stakes = snapshot;
    }
}
