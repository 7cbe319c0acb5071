package com.buildhook.dispatcher.repository;

import com.buildhook.dispatcher.model.InboxMessage;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Queue operations on the inbox_messages table.
 */
public interface InboxMessageRepository extends JpaRepository<InboxMessage, UUID> {

    /**
     * Lock up to {@code limit} deliverable messages of one subscription.
     *
     * Deliverable means PENDING, or IN_FLIGHT with an expired lease (the
     * consumer that claimed it died before acknowledging). SKIP LOCKED lets
     * several dispatcher instances poll the same table without blocking each
     * other or claiming the same row twice.
     *
     * Must run inside a transaction; the caller leases the rows before commit.
     */
    @Query(value = """
            SELECT * FROM inbox_messages
            WHERE subscription = :subscription
              AND (state = 'PENDING' OR (state = 'IN_FLIGHT' AND lease_until < :now))
            ORDER BY created_at ASC
            LIMIT :limit
            FOR UPDATE SKIP LOCKED
            """, nativeQuery = true)
    List<InboxMessage> lockDeliverable(@Param("subscription") String subscription,
                                       @Param("now") Instant now,
                                       @Param("limit") int limit);
}
