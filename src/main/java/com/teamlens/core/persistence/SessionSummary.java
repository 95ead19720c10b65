package com.teamlens.core.persistence;

/**
 * One row of the session history index.
 */
public record SessionSummary(
    long id,
    String teamName,
    String description,
    long createdAt,
    long startedAt,
    Long endedAt,
    int memberCount,
    int messageCount,
    int taskCount
) {}
