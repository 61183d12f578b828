package com.openrangelabs.donpetre.pipeline.upload;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.Locale;
import java.util.Set;

/**
 * Limits applied to uploaded files before any processor sees them.
 */
@Value
@Builder
public class UploadPolicy {

    @Singular
    Set<String> allowedExtensions;

    @Builder.Default
    long maxBytes = 100L * 1024 * 1024;

    public boolean isAllowed(String extension) {
        return extension != null && allowedExtensions.contains(extension.toLowerCase(Locale.ROOT));
    }

    public void validate() {
        if (maxBytes <= 0) {
            throw new IllegalArgumentException("max upload size must be greater than 0, got " + maxBytes);
        }
    }
}
