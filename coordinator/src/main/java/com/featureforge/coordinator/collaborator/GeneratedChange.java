package com.featureforge.coordinator.collaborator;

import java.util.Map;

/**
 * Result of code generation for one chunk.
 *
 * @param modifiedFiles relative path → full new file content
 * @param commitMessage message to use when opening the integration
 */
public record GeneratedChange(Map<String, String> modifiedFiles, String commitMessage) {
    public GeneratedChange {
        modifiedFiles = modifiedFiles == null ? Map.of() : Map.copyOf(modifiedFiles);
    }
}
