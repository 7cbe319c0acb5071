package com.buildhook.dispatcher.api;

import com.buildhook.dispatcher.api.dto.PublishResponse;
import com.buildhook.dispatcher.dispatch.MessagePublisher;
import com.buildhook.dispatcher.event.MalformedMessageException;
import com.buildhook.dispatcher.model.Subscription;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;

/**
 * Inbound side of the message queue.
 *
 * POST /messages/job            a GitHub event, already normalised by the webhook receiver
 * POST /messages/task-status    a task-completed / task-failed / task-exception message
 * POST /messages/group-status   a task-group-resolved message
 *
 * 202 with the message id when queued, 204 when dropped because the message
 * belongs to another scheduler, 400 for an unknown subscription or a body
 * that is not a JSON object.
 *
 * Example:
 *   curl -X POST http://localhost:8080/messages/group-status \
 *     -H "Content-Type: application/json" \
 *     -d '{"taskGroupId":"abc123","schedulerId":"taskcluster-github"}'
 */
@RestController
@RequestMapping("/messages")
public class MessageController {

    private final MessagePublisher publisher;

    public MessageController(MessagePublisher publisher) {
        this.publisher = publisher;
    }

    @PostMapping(path = "/{subscription}", consumes = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<PublishResponse> publish(@PathVariable String subscription,
                                                   @RequestBody String payload) {
        Subscription target;
        try {
            target = Subscription.fromPath(subscription);
        } catch (IllegalArgumentException e) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, e.getMessage(), e);
        }
        try {
            return publisher.publish(target, payload)
                    .map(m -> ResponseEntity.status(HttpStatus.ACCEPTED)
                            .body(new PublishResponse(m.getId(), target.path())))
                    .orElseGet(() -> ResponseEntity.noContent().build());
        } catch (MalformedMessageException e) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, e.getMessage(), e);
        }
    }
}
