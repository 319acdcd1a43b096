package com.rgp.application.service;

import com.rgp.application.port.out.CollateralToken;
import com.rgp.domain.exception.TransferException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.math.BigInteger;

/**
 * Collateral movements with the asset's boolean result checked.
 * A refused movement raises {@link TransferException}.
 */
@Slf4j
@RequiredArgsConstructor
public class CollateralTransfers {

    private final CollateralToken token;

    /**
     * Pull from an external party
     */
    public void pull(String from, String to, BigInteger amount) {
        if (amount.signum() == 0) {
            return;
        }
        log.debug("transferFrom {} -> {}: {}", from, to, amount);
        if (!token.transferFrom(from, to, amount)) {
            throw new TransferException(String.format("Transfer of %s from %s to %s was refused", amount, from, to));
        }
    }

    /**
     * Push out of a protocol-held account
     */
    public void push(String from, String to, BigInteger amount) {
        if (amount.signum() == 0) {
            return;
        }
        log.debug("transfer {} -> {}: {}", from, to, amount);
        if (!token.transfer(from, to, amount)) {
            throw new TransferException(String.format("Transfer of %s from %s to %s was refused", amount, from, to));
        }
    }
}
