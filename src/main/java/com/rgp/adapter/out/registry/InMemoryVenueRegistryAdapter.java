package com.rgp.adapter.out.registry;

import com.rgp.application.port.out.RevenueVault;
import com.rgp.application.port.out.RevenueVaultProvider;
import com.rgp.application.port.out.VenueRegistry;
import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;
import lombok.extern.slf4j.Slf4j;

import java.math.BigInteger;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * In-memory venue registry and vault directory, seeded from the "venues" config section
 */
@Slf4j
public class InMemoryVenueRegistryAdapter implements VenueRegistry, RevenueVaultProvider {

    private final Map<String, VenueRecord> venues = new HashMap<>();
    private final Map<String, RevenueVault> vaults = new HashMap<>();

    public static InMemoryVenueRegistryAdapter fromConfig(JsonArray venues) {
        InMemoryVenueRegistryAdapter registry = new InMemoryVenueRegistryAdapter();
        if (venues == null) {
            return registry;
        }
        for (int i = 0; i < venues.size(); i++) {
            JsonObject venue = venues.getJsonObject(i);
            registry.register(
                    venue.getString("id"),
                    venue.getString("owner"),
                    new InMemoryRevenueVault(
                            venue.getString("vault"),
                            new BigInteger(String.valueOf(venue.getValue("promisedRevenue"))),
                            venue.getInteger("totalMonths")
                    )
            );
        }
        return registry;
    }

    public void register(String venueId, String owner, RevenueVault vault) {
        if (venues.containsKey(venueId)) {
            throw new IllegalStateException("Venue already registered: " + venueId);
        }
        venues.put(venueId, new VenueRecord(owner, vault.address()));
        vaults.put(vault.address(), vault);
        log.info("Registered venue {} (owner={}, vault={}, promisedRevenue={}, totalMonths={})",
                venueId, owner, vault.address(), vault.promisedRevenue(), vault.totalMonths());
    }

    @Override
    public boolean venueExists(String venueId) {
        return venues.containsKey(venueId);
    }

    @Override
    public String ownerOf(String venueId) {
        VenueRecord venue = venues.get(venueId);
        return venue == null ? null : venue.owner();
    }

    @Override
    public String vaultAddressOf(String venueId) {
        VenueRecord venue = venues.get(venueId);
        return venue == null ? null : venue.vaultAddress();
    }

    @Override
    public Optional<RevenueVault> vaultAt(String address) {
        return Optional.ofNullable(vaults.get(address));
    }

    private record VenueRecord(String owner, String vaultAddress) {}
}
