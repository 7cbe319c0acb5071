package com.buildhook.dispatcher.model;

import jakarta.persistence.*;

import java.time.Instant;
import java.util.UUID;

/**
 * One queued message awaiting (or undergoing) handling.
 *
 * The inbox table is the queue: publishers insert rows, the dispatcher claims
 * them with SELECT FOR UPDATE SKIP LOCKED and deletes them once handled.
 * A row whose lease ran out is claimable again, which is how a message is
 * redelivered after a consumer crash.
 *
 * DB table: inbox_messages  (created by Flyway V1 migration)
 */
@Entity
@Table(name = "inbox_messages")
public class InboxMessage {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private Subscription subscription;

    // Raw JSON body as published.
    @Column(nullable = false, columnDefinition = "TEXT")
    private String payload;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private MessageState state = MessageState.PENDING;

    // How many times this message has been handed to a handler.
    @Column(nullable = false)
    private int deliveries = 0;

    @Column(name = "lease_until")
    private Instant leaseUntil;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt = Instant.now();

    protected InboxMessage() {}   // required by JPA

    public InboxMessage(Subscription subscription, String payload) {
        this.subscription = subscription;
        this.payload      = payload;
    }

    public UUID         getId()           { return id; }
    public Subscription getSubscription() { return subscription; }
    public String       getPayload()      { return payload; }
    public MessageState getState()        { return state; }
    public int          getDeliveries()   { return deliveries; }
    public Instant      getLeaseUntil()   { return leaseUntil; }
    public Instant      getCreatedAt()    { return createdAt; }

    /** Mark as claimed until {@code leaseUntil}. */
    public void lease(Instant leaseUntil) {
        this.state      = MessageState.IN_FLIGHT;
        this.leaseUntil = leaseUntil;
        this.deliveries++;
    }
}
