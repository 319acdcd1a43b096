package com.rgp.application.port.out;

import com.rgp.domain.model.CommittedStake;
import com.rgp.domain.model.VenueAssignment;
import com.rgp.domain.model.VenueStakeKey;

import java.util.Optional;

/**
 * Output port - venue assignments and the (venue, underwriter) commitment table
 */
public interface VenueAssignmentRepository {

    Optional<VenueAssignment> findByVenueId(String venueId);

    boolean exists(String venueId);

    void save(VenueAssignment assignment);

    Optional<CommittedStake> findCommitment(VenueStakeKey key);

    void saveCommitment(VenueStakeKey key, CommittedStake commitment);
}
