package com.rgp.application.port.out;

import java.math.BigInteger;

/**
 * Output port for the fungible collateral asset.
 * A false result means the asset refused the movement; callers must abort.
 */
public interface CollateralToken {

    /**
     * Pull funds from an external party into a protocol account or vault
     */
    boolean transferFrom(String from, String to, BigInteger amount);

    /**
     * Push funds out of a protocol-held account
     */
    boolean transfer(String from, String to, BigInteger amount);

    BigInteger balanceOf(String account);
}
