package com.rgp.adapter.in.web.guarantee;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

public record OperatorRequest(String operator) {
    @JsonCreator
    public OperatorRequest(@JsonProperty("operator") String operator) {
        this.operator = operator;
    }
}
