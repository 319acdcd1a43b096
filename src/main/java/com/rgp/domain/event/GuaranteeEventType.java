package com.rgp.domain.event;

/**
 * State changes announced after a unit of work commits
 */
public enum GuaranteeEventType {
    STAKE_REGISTERED,
    STAKE_WITHDRAWN,
    UNDERWRITERS_ASSIGNED,
    LIABILITY_SETTLED,
    ASSIGNMENT_FEE_CLAIMED,
    GUARANTEE_OPENED,
    OPERATOR_ADDED,
    OPERATOR_REMOVED,
    FEE_AMOUNT_SET,
    UNDERWRITER_ADDED,
    FEE_DEPOSITED,
    REPORT_SUBMITTED,
    LIABILITY_PROCESSED,
    OWNER_REVENUE_DEPOSITED,
    FEES_DISTRIBUTED,
    FEE_CLAIMED
}
