package com.questrail.echosrv.security;

public record ConnectionMetrics(
    int activeConnections,
    long totalConnections,
    int availableSlots,
    int maxConnections
) {
}
