package com.rgp.domain.model;

import lombok.Builder;
import lombok.Value;

import java.math.BigInteger;
import java.time.Duration;

/**
 * Protocol-wide settings: collateral accounts, protocol cut and period length
 */
@Value
@Builder
public class ProtocolSettings {
    public static final String DEFAULT_POOL_ACCOUNT = "underwriter-pool";
    public static final String DEFAULT_TREASURY_ACCOUNT = "protocol-treasury";
    public static final int DEFAULT_PROTOCOL_FEE_BPS = 500;
    public static final Duration DEFAULT_PERIOD_LENGTH = Duration.ofDays(30);

    private static final BigInteger BPS_DENOMINATOR = BigInteger.valueOf(10_000);

    String poolAccount;
    String treasuryAccount;
    int protocolFeeBps;
    Duration periodLength;

    public static ProtocolSettings defaults() {
        return ProtocolSettings.builder()
                .poolAccount(DEFAULT_POOL_ACCOUNT)
                .treasuryAccount(DEFAULT_TREASURY_ACCOUNT)
                .protocolFeeBps(DEFAULT_PROTOCOL_FEE_BPS)
                .periodLength(DEFAULT_PERIOD_LENGTH)
                .build();
    }

    public Duration contractDuration(int totalMonths) {
        return periodLength.multipliedBy(totalMonths);
    }

    /**
     * Protocol cut of a gross payout, floor(gross * bps / 10000).
     */
    public BigInteger protocolCut(BigInteger gross) {
        return gross.multiply(BigInteger.valueOf(protocolFeeBps)).divide(BPS_DENOMINATOR);
    }
}
