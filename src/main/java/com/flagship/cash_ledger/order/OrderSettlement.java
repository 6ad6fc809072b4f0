package com.flagship.cash_ledger.order;

/**
 * Where the money of a completed order went.
 */
public enum OrderSettlement {
    /** Paid by card, nothing for the cash ledger to track. */
    CARD,
    /** Cash taken by the courier, now part of their balance. */
    COURIER_DEBT,
    /** Cash taken by the waiter, now part of their balance. */
    WAITER_DEBT,
    /** Cash paid straight into the drawer. */
    DRAWER
}
