package com.ayni.core.domain;

/**
 * Registry-wide counters.
 */
public record RegistryStats(long totalIdentities, int trustedIssuers, long auditEvents) {}
