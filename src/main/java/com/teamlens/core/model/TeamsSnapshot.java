package com.teamlens.core.model;

import java.util.Map;

/**
 * Point-in-time view of every known team, sent to observers on connect.
 *
 * @param teams      team name to visible team state
 * @param activeTeam most recently active team (or the team an observer switched to), may be {@code null}
 */
public record TeamsSnapshot(
    Map<String, TeamView> teams,
    String activeTeam
) {

    public TeamsSnapshot withActiveTeam(String teamName) {
        return new TeamsSnapshot(teams, teamName);
    }
}
