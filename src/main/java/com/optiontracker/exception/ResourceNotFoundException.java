package com.optiontracker.exception;

import java.util.Map;

public class ResourceNotFoundException extends BaseException {

    public static final String POSITION = "Position";

    public ResourceNotFoundException(String resourceType, String identifier) {
        super(
                ErrorCode.NOT_FOUND,
                String.format("%s not found with identifier: %s", resourceType, identifier),
                Map.of("resource", resourceType, "identifier", identifier));
    }

    /** No position with this id is in the position book. */
    public static ResourceNotFoundException position(String positionId) {
        return new ResourceNotFoundException(POSITION, positionId);
    }
}
