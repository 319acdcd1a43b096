package com.rgp.domain.model;

/**
 * Composite key of the per-venue commitment table
 */
public record VenueStakeKey(String venueId, String underwriter) {
}
