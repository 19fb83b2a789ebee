package com.msst.core.model;

/**
 * Identity of the system under test as recorded in a validation report.
 */
public record EndpointInfo(
    String endpoint,
    String vendor
) {}
