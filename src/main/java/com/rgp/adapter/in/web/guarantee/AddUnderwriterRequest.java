package com.rgp.adapter.in.web.guarantee;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigInteger;

public record AddUnderwriterRequest(String underwriter, BigInteger stake) {
    @JsonCreator
    public AddUnderwriterRequest(
            @JsonProperty("underwriter") String underwriter,
            @JsonProperty("stake") BigInteger stake
    ) {
        this.underwriter = underwriter;
        this.stake = stake;
    }
}
