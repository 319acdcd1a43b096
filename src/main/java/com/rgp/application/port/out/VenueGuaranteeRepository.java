package com.rgp.application.port.out;

import com.rgp.domain.model.VenueGuarantee;

import java.util.Optional;

/**
 * Output port - guarantee engine state keyed by venue
 */
public interface VenueGuaranteeRepository {

    Optional<VenueGuarantee> findByVenueId(String venueId);

    boolean exists(String venueId);

    void save(VenueGuarantee guarantee);
}
