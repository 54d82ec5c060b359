package com.featureforge.coordinator.collaborator;

import com.featureforge.coordinator.model.Chunk;

import java.util.Map;

/**
 * Publishes a chunk's changes for review and integrates them afterwards
 * (for example: open a pull request, later merge it).
 */
public interface IntegrationGateway {

    /**
     * Open an integration for the chunk's changes.
     *
     * @return an opaque handle identifying the integration
     */
    String open(Chunk chunk, Map<String, String> changedFiles, String commitMessage);

    /**
     * Complete (merge) a previously opened integration.
     *
     * @return true if the integration is now complete; false to retry later
     */
    boolean complete(String handle);
}
