package org.matchcard.render;

/**
 * The tracked account does not appear in the match. Retrying the same input will not help.
 */
public class MissingParticipantException extends RenderException {
    private final String puuid;
    private final String matchId;

    public MissingParticipantException(String puuid, String matchId) {
        super("Player " + puuid + " not found in match " + matchId);
        this.puuid = puuid;
        this.matchId = matchId;
    }

    public String puuid() {
        return puuid;
    }

    public String matchId() {
        return matchId;
    }
}
