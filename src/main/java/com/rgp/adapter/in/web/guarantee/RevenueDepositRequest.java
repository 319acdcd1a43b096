package com.rgp.adapter.in.web.guarantee;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigInteger;

/**
 * DTO for an owner's revenue deposit into the venue vault
 */
public record RevenueDepositRequest(Integer month, BigInteger amount) {
    @JsonCreator
    public RevenueDepositRequest(
            @JsonProperty("month") Integer month,
            @JsonProperty("amount") BigInteger amount
    ) {
        this.month = month;
        this.amount = amount;
    }
}
