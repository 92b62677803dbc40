package com.kiln.policy;

import java.nio.file.Path;

/**
 * Thrown when a runtime policy document is absent, empty, malformed, missing a required key, or uses a
 * deprecated schema. The loader never caches a policy that raised this.
 */
public class PolicyValidationException extends RuntimeException {

    private final String source;

    public PolicyValidationException(String source, String message) {
        super(message);
        this.source = source;
    }

    public PolicyValidationException(String source, String message, Throwable cause) {
        super(message, cause);
        this.source = source;
    }

    public PolicyValidationException(Path source, String message) {
        this(source != null ? source.toString() : null, message);
    }

    /** Path or resource name of the policy that failed validation. */
    public String getSource() {
        return source;
    }
}
