package com.rgp.domain.model;

import lombok.Getter;
import lombok.ToString;

import java.math.BigInteger;

/**
 * Underwriter entry in a guarantee engine's local roster
 */
@Getter
@ToString
public class GuaranteeUnderwriter {
    private final String underwriter;
    private final BigInteger stake;
    private final boolean approved;
    private boolean feeClaimed;

    public GuaranteeUnderwriter(String underwriter, BigInteger stake) {
        this(underwriter, stake, true, false);
    }

    private GuaranteeUnderwriter(String underwriter, BigInteger stake, boolean approved, boolean feeClaimed) {
        this.underwriter = underwriter;
        this.stake = stake;
        this.approved = approved;
        this.feeClaimed = feeClaimed;
    }

    public boolean isEligibleForFee() {
        return approved && !feeClaimed;
    }

    public void markFeeClaimed() {
        feeClaimed = true;
    }

    public GuaranteeUnderwriter copy() {
        return new GuaranteeUnderwriter(underwriter, stake, approved, feeClaimed);
    }
}
