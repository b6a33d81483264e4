package com.agentvet.validation.integrity;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Last-known-good state of one document, keyed in the registry by its
 * normalized path.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record HashRegistryEntry(
        String hash,
        String type,
        String version,
        String timestamp,
        String path
) {}
