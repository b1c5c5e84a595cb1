package com.canary.intel;

/**
 * What one maintenance pass changed.
 */
public record MaintenanceResult(int patternsDecayed, int sourcesDecayed, int recordsQuarantined) {}
