package com.rgp.application.port.out;

import java.util.Optional;

/**
 * Output port resolving vault addresses to vaults
 */
public interface RevenueVaultProvider {

    Optional<RevenueVault> vaultAt(String address);
}
