package com.teamlens.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * One agent listed in a team config snapshot.
 *
 * @param agentId   unique agent id within the team (e.g. "researcher@my-team")
 * @param name      display name, also the inbox file name
 * @param agentType role of the agent (e.g. "team-lead", "general-purpose")
 * @param model     backing model identifier
 * @param color     display color
 * @param joinedAt  epoch millis the agent joined the team
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record Member(
    String agentId,
    String name,
    String agentType,
    String model,
    String color,
    Long joinedAt
) {}
