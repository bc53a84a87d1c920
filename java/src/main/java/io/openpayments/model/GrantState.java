package io.openpayments.model;

/** States of one grant negotiation attempt. */
public enum GrantState {
    BUILDING,
    SENT,
    GRANTED,
    PENDING_INTERACTION,
    CONTINUING,
    FAILED
}
