package com.rgp.application.port.out;

import com.rgp.domain.model.UnderwriterStake;

import java.util.Optional;

/**
 * Output port - underwriter collateral triples keyed by identity.
 * Records are never deleted.
 */
public interface UnderwriterRepository {

    Optional<UnderwriterStake> findByUnderwriter(String underwriter);

    boolean exists(String underwriter);

    void save(UnderwriterStake stake);
}
