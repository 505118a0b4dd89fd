package com.tradestager.exception;

import java.util.Map;
import lombok.Getter;

/** An id that neither ledger partition knows. */
@Getter
public class ResourceNotFoundException extends BaseException {

    private final String resourceType;
    private final String identifier;

    public ResourceNotFoundException(String resourceType, String identifier) {
        super(
                ErrorCode.NOT_FOUND,
                resourceType + " not found: " + identifier,
                Map.of("resourceType", resourceType, "id", String.valueOf(identifier)));
        this.resourceType = resourceType;
        this.identifier = identifier;
    }
}
