package eryxon.qrm.cache;

/**
 * Load state of a snapshot slot.
 * EMPTY -> LOADING -> READY | FAILED, and READY | FAILED -> LOADING on every recompute.
 */
public enum LoadState {
    /** No recompute dispatched yet (or invalidated) */
    EMPTY,
    /** A recompute is in flight */
    LOADING,
    /** Last recompute succeeded */
    READY,
    /** Last recompute failed */
    FAILED
}
