package com.buildhook.dispatcher.dispatch;

import com.buildhook.dispatcher.model.InboxMessage;
import com.buildhook.dispatcher.model.Subscription;

import java.time.Duration;
import java.util.List;
import java.util.UUID;

/**
 * The queue the dispatcher consumes: claim, then acknowledge.
 */
public interface MessageQueue {

    InboxMessage publish(Subscription subscription, String payload);

    /**
     * Claim up to {@code max} messages; each stays invisible to other
     * consumers for {@code lease} unless acknowledged first.
     */
    List<InboxMessage> claim(Subscription subscription, int max, Duration lease);

    /** Remove a handled message. Acknowledging an unknown id is a no-op. */
    void ack(UUID messageId);
}
