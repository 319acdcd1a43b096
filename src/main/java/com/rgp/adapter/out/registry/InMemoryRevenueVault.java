package com.rgp.adapter.out.registry;

import com.rgp.application.port.out.RevenueVault;

import java.math.BigInteger;

/**
 * Fixed-terms revenue vault
 */
public record InMemoryRevenueVault(
        String address,
        BigInteger promisedRevenue,
        int totalMonths
) implements RevenueVault {
}
