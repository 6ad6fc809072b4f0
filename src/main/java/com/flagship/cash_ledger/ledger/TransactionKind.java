package com.flagship.cash_ledger.ledger;

/**
 * Kind of a cash transaction entry.
 *
 * The set is closed: statistics switch over it exhaustively, so adding a kind
 * forces every aggregation to decide how to count it.
 */
public enum TransactionKind {
    /** Cash put into the drawer by hand (change fund top-up and the like). */
    MANUAL_IN,
    /** Cash taken out of the drawer by hand. */
    MANUAL_OUT,
    /** Cash an employee handed over for orders they collected. */
    HANDOVER_IN;

    public boolean isManual() {
        return this == MANUAL_IN || this == MANUAL_OUT;
    }
}
