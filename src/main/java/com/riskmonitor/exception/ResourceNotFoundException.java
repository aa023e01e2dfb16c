package com.riskmonitor.exception;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A monitor or alert addressed by the API does not exist.
 */
public class ResourceNotFoundException extends BaseException {

    public ResourceNotFoundException(String resourceType, String identifier) {
        super(
                ErrorCode.NOT_FOUND,
                resourceType + " '" + identifier + "' does not exist",
                details(resourceType, identifier));
    }

    private static Map<String, Object> details(String resourceType, String identifier) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("resource", resourceType);
        details.put("id", identifier);
        return details;
    }
}
