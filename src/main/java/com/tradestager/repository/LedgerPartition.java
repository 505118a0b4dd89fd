package com.tradestager.repository;

/** Which partition of the staging ledger a lookup covers. */
public enum LedgerPartition {
    /** Records still moving through the lifecycle. */
    ACTIVE,
    /** Terminal records moved out of the active partition. Read-only. */
    HISTORY,
    ALL
}
