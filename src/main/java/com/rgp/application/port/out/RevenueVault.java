package com.rgp.application.port.out;

import java.math.BigInteger;

/**
 * Investor revenue vault of a venue
 */
public interface RevenueVault {

    String address();

    /**
     * Revenue the venue promises per period
     */
    BigInteger promisedRevenue();

    int totalMonths();
}
