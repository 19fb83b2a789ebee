package com.msst.core.discovery;

/**
 * A candidate test unit found in a namespace, before ID parsing and range checks.
 *
 * @param namespace the namespace (group directory / package) it was found in
 * @param name      artifact name; its leading digit run is the test ID
 * @param title     optional description
 * @param type      compiled class carrying the entry point
 */
public record TestArtifact(
    String namespace,
    String name,
    String title,
    Class<?> type
) {}
