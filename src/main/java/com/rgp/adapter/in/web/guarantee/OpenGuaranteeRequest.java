package com.rgp.adapter.in.web.guarantee;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * DTO for opening a venue guarantee; admin defaults to the caller
 */
public record OpenGuaranteeRequest(String admin) {
    @JsonCreator
    public OpenGuaranteeRequest(@JsonProperty("admin") String admin) {
        this.admin = admin;
    }
}
