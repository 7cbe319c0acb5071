package com.buildhook.dispatcher.dispatch;

import com.buildhook.dispatcher.model.InboxMessage;
import com.buildhook.dispatcher.model.Subscription;
import com.buildhook.dispatcher.repository.InboxMessageRepository;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * {@link MessageQueue} on the inbox_messages table.
 *
 * claim() is @Transactional so the row locks taken by SELECT FOR UPDATE
 * SKIP LOCKED are held until the lease is written, then released on commit.
 */
@Component
public class JpaMessageQueue implements MessageQueue {

    private final InboxMessageRepository repo;
    private final Clock                  clock;

    public JpaMessageQueue(InboxMessageRepository repo, Clock clock) {
        this.repo  = repo;
        this.clock = clock;
    }

    @Override
    @Transactional
    public InboxMessage publish(Subscription subscription, String payload) {
        return repo.save(new InboxMessage(subscription, payload));
    }

    @Override
    @Transactional
    public List<InboxMessage> claim(Subscription subscription, int max, Duration lease) {
        Instant now = clock.instant();
        List<InboxMessage> claimed = repo.lockDeliverable(subscription.name(), now, max);
        for (InboxMessage message : claimed) {
            message.lease(now.plus(lease));
        }
        return repo.saveAll(claimed);
    }

    @Override
    @Transactional
    public void ack(UUID messageId) {
        repo.deleteById(messageId);
    }
}
