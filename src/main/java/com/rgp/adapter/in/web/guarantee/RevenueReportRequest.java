package com.rgp.adapter.in.web.guarantee;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigInteger;

/**
 * DTO for an operator's monthly revenue report
 */
public record RevenueReportRequest(BigInteger actualRevenue) {
    @JsonCreator
    public RevenueReportRequest(@JsonProperty("actualRevenue") BigInteger actualRevenue) {
        this.actualRevenue = actualRevenue;
    }
}
