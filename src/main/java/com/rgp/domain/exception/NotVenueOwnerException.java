package com.rgp.domain.exception;

/**
 * Caller is not the registered owner of the venue
 */
public class NotVenueOwnerException extends AuthorizationException {

    private final String venueId;

    public NotVenueOwnerException(String venueId, String caller) {
        super("Caller " + caller + " is not the owner of venue " + venueId);
        this.venueId = venueId;
    }

    public String getVenueId() {
        return venueId;
    }
}
