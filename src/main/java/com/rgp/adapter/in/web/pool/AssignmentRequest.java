package com.rgp.adapter.in.web.pool;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigInteger;
import java.util.List;

/**
 * DTO for assigning underwriters to a venue.
 * Underwriters and amounts are parallel arrays.
 */
public record AssignmentRequest(
        List<String> underwriters,
        List<BigInteger> amounts,
        BigInteger fee
) {
    @JsonCreator
    public AssignmentRequest(
            @JsonProperty("underwriters") List<String> underwriters,
            @JsonProperty("amounts") List<BigInteger> amounts,
            @JsonProperty("fee") BigInteger fee
    ) {
        this.underwriters = underwriters;
        this.amounts = amounts;
        this.fee = fee;
    }
}
