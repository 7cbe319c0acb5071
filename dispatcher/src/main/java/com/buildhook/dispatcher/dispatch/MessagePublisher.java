package com.buildhook.dispatcher.dispatch;

import com.buildhook.dispatcher.event.MessageDecoder;
import com.buildhook.dispatcher.model.InboxMessage;
import com.buildhook.dispatcher.model.Subscription;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.Objects;
import java.util.Optional;

/**
 * Entry point for publishers: the webhook receiver (job subscription) and the
 * bridge from Taskcluster's queue exchanges (task-status, group-status).
 *
 * Task and group events are only queued when they were emitted for this
 * deployment's scheduler id; other deployments share the exchange.
 */
@Service
public class MessagePublisher {

    private static final Logger log = LoggerFactory.getLogger(MessagePublisher.class);

    private final MessageQueue   queue;
    private final MessageDecoder decoder;
    private final String         schedulerId;

    public MessagePublisher(MessageQueue queue,
                            MessageDecoder decoder,
                            @Value("${buildhook.taskcluster.scheduler-id}") String schedulerId) {
        this.queue       = queue;
        this.decoder     = decoder;
        this.schedulerId = schedulerId;
    }

    /**
     * @return the queued message, or empty when filtered out by scheduler id
     * @throws com.buildhook.dispatcher.event.MalformedMessageException if the payload is not a JSON object
     */
    public Optional<InboxMessage> publish(Subscription subscription, String payload) {
        decoder.requireObject(payload);
        if (subscription.filteredBySchedulerId()) {
            String messageSchedulerId = decoder.schedulerIdOf(payload);
            if (!Objects.equals(schedulerId, messageSchedulerId)) {
                log.debug("Ignoring {} message for scheduler {}", subscription.path(), messageSchedulerId);
                return Optional.empty();
            }
        }
        InboxMessage message = queue.publish(subscription, payload);
        log.debug("Queued {} message {}", subscription.path(), message.getId());
        return Optional.of(message);
    }
}
