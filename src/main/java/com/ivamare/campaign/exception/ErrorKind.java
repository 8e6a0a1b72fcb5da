package com.ivamare.campaign.exception;

/**
 * Classification of failures surfaced by the campaign engine.
 */
public enum ErrorKind {
    /** Requested entity does not exist */
    NOT_FOUND,

    /** Caller may not read the requested document */
    FORBIDDEN,

    /** State machine call made before its precondition holds */
    NOT_READY,

    /** Duplicate terminal transition of a split test */
    ALREADY_DECIDED,

    /** Per-recipient transport failure (recorded, never raised by the dispatcher) */
    TRANSPORT_FAILURE,

    /** Durable store could not confirm a read or write */
    STORE_FAILURE,

    /** Invalid argument or lost concurrent state transition */
    INVALID_OPERATION
}
