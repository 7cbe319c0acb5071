package com.buildhook.dispatcher.model;

/**
 * Delivery state of an inbox message.
 *
 * Transitions:
 *   PENDING   → IN_FLIGHT (claimed by the dispatcher, lease set)
 *   IN_FLIGHT → (deleted) acknowledged after the handler settled
 *   IN_FLIGHT → IN_FLIGHT re-claimed once its lease expired (consumer died)
 */
public enum MessageState {
    PENDING,
    IN_FLIGHT
}
