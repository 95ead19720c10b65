package com.teamlens.core.persistence;

/**
 * Identity of a persisted session.
 *
 * @param id        database id
 * @param teamName  team name
 * @param createdAt config creation time that keys the session
 * @param created   {@code true} only for the call that actually inserted the row
 */
public record SessionRef(long id, String teamName, long createdAt, boolean created) {}
