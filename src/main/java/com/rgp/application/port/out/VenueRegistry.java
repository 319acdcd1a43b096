package com.rgp.application.port.out;

/**
 * Output port for venue identity lookups.
 * Venue registration itself happens outside this service.
 */
public interface VenueRegistry {

    boolean venueExists(String venueId);

    /**
     * @return owner identity, or null if the venue is unknown
     */
    String ownerOf(String venueId);

    /**
     * @return address of the venue's revenue vault, or null if the venue is unknown
     */
    String vaultAddressOf(String venueId);
}
