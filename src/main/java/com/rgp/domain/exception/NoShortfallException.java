package com.rgp.domain.exception;

/**
 * Liability was requested for a month whose report shows no missing revenue
 */
public class NoShortfallException extends StateException {

    private final int month;

    public NoShortfallException(String venueId, int month) {
        super("No shortfall reported for venue " + venueId + " in month " + month);
        this.month = month;
    }

    public int getMonth() {
        return month;
    }
}
