package com.buildhook.dispatcher.api.dto;

import java.util.UUID;

/** Response body for an accepted POST /messages/{subscription}. */
public record PublishResponse(
        UUID   messageId,
        String subscription
) {}
