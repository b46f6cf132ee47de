package com.bugbounty.api.error;

import java.util.UUID;

/**
 * Resolves path and body identifiers. A value that is not a UUID can never
 * name a stored resource, so it is reported as not found.
 */
public final class ResourceIds {

    private ResourceIds() {}

    public static UUID parse(String raw, String notFoundMessage) {
        if (raw == null || raw.isBlank()) {
            throw new ResourceNotFoundException(notFoundMessage);
        }
        try {
            return UUID.fromString(raw.trim());
        } catch (IllegalArgumentException e) {
            throw new ResourceNotFoundException(notFoundMessage);
        }
    }
}
