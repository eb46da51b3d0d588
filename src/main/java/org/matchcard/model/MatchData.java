package org.matchcard.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;
import java.util.Optional;

/**
 * The subset of a match-v5 match document the scoreboard needs.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record MatchData(Metadata metadata, Info info) {

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Metadata(String matchId, List<String> participants) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Info(long gameDuration, String gameMode, List<Participant> participants) {
        public Info {
            participants = participants == null ? List.of() : List.copyOf(participants);
        }
    }

    @JsonIgnore
    public List<Participant> participants() {
        return info == null ? List.of() : info.participants();
    }

    @JsonIgnore
    public String matchId() {
        return metadata == null || metadata.matchId() == null ? "unknown" : metadata.matchId();
    }

    public Optional<Participant> findParticipant(String puuid) {
        if (puuid == null) return Optional.empty();
        return participants().stream()
                .filter(p -> puuid.equals(p.puuid()))
                .findFirst();
    }
}
