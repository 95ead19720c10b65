package com.teamlens.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;

/**
 * Snapshot of a team's {@code config.json}. Replaced wholesale whenever the file changes.
 *
 * @param name        team name as written by the agent runtime
 * @param description free-text purpose of the team
 * @param createdAt   epoch millis the team run was created; identifies the session
 * @param leadAgentId agent id of the team lead
 * @param members     ordered roster
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record TeamConfig(
    String name,
    String description,
    Long createdAt,
    String leadAgentId,
    List<Member> members
) {

    public TeamConfig {
        members = members == null ? List.of() : List.copyOf(members);
    }
}
