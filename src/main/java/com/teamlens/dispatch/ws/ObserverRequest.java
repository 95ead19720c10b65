package com.teamlens.dispatch.ws;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * Request sent by an observer, in the same envelope as {@link ObserverMessage}:
 * {@code {"type":"switch_team","payload":{"teamName":"beta"},"timestamp":"..."}}.
 * Arguments placed at the top level next to {@code type} are accepted when the
 * payload does not carry them.
 *
 * @param type      {@code switch_team}, {@code get_history} or {@code get_session}
 * @param payload   request arguments, may be absent for {@code get_history}
 * @param timestamp send time as reported by the observer, informational only
 * @param teamName  top-level {@code switch_team} argument
 * @param sessionId top-level {@code get_session} argument
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ObserverRequest(
    String type,
    JsonNode payload,
    String timestamp,
    String teamName,
    Long sessionId
) {

    public static final String SWITCH_TEAM = "switch_team";
    public static final String GET_HISTORY = "get_history";
    public static final String GET_SESSION = "get_session";

    public String requestedTeam() {
        if (payload != null && payload.hasNonNull("teamName")) {
            return payload.get("teamName").asText();
        }
        return teamName;
    }

    /** {@code null} when absent or not a whole number. */
    public Long requestedSessionId() {
        if (payload != null && payload.hasNonNull("sessionId")) {
            JsonNode id = payload.get("sessionId");
            if (id.canConvertToExactIntegral() && id.canConvertToLong()) {
                return id.asLong();
            }
            if (id.isTextual()) {
                try {
                    return Long.valueOf(id.asText().trim());
                } catch (NumberFormatException e) {
                    return null;
                }
            }
            return null;
        }
        return sessionId;
    }
}
