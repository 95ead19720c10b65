package com.teamlens.core.persistence;

import com.teamlens.core.model.Member;
import com.teamlens.core.model.TeamConfig;
import com.teamlens.core.model.TeamTask;

import java.util.List;

/**
 * Everything recorded for one session. Deleted and internal tasks are not included.
 */
public record SessionDetail(
    SessionSummary session,
    TeamConfig config,
    List<Member> members,
    List<SessionMessage> messages,
    List<TeamTask> tasks
) {}
