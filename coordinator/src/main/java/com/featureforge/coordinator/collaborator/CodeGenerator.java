package com.featureforge.coordinator.collaborator;

import com.featureforge.coordinator.model.Chunk;

import java.util.Map;

/**
 * Produces new file contents for a chunk.
 */
public interface CodeGenerator {

    /**
     * @param existingFiles relative path → current content, for those of the
     *                      chunk's files that already exist
     * @throws CollaboratorException on failure; {@link CollaboratorException#isRetryable()}
     *                               decides whether the chunk is tried again
     */
    GeneratedChange generate(Chunk chunk, Map<String, String> existingFiles);
}
