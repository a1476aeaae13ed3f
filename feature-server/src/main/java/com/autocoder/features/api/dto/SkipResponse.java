package com.autocoder.features.api.dto;

import com.autocoder.features.service.SkipResult;

/**
 * Response body for POST /features/{id}/skip.
 */
public record SkipResponse(long id, String name, int oldPriority, int newPriority, String message) {

    public static SkipResponse from(SkipResult r) {
        return new SkipResponse(r.id(), r.name(), r.oldPriority(), r.newPriority(),
                "Feature '" + r.name() + "' moved to end of queue");
    }
}
