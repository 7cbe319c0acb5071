package com.buildhook.dispatcher.api.dto;

import java.util.List;

/**
 * One page of builds; {@code hasMore} tells the caller to ask for page + 1.
 */
public record BuildPage(
        List<BuildResponse> builds,
        int                 page,
        int                 size,
        long                total,
        boolean             hasMore
) {}
