package com.rgp.adapter.in.web.pool;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigInteger;

/**
 * DTO carrying a single collateral amount
 */
public record AmountRequest(BigInteger amount) {
    @JsonCreator
    public AmountRequest(@JsonProperty("amount") BigInteger amount) {
        this.amount = amount;
    }
}
