package org.matchcard.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;

/**
 * One player's end-of-game line from match-v5. Item ids of {@code 0} are empty slots;
 * {@code item6} is always the trinket.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record Participant(
        String puuid,
        String riotIdGameName,
        String summonerName,
        String championName,
        int champLevel,
        int kills,
        int deaths,
        int assists,
        int totalMinionsKilled,
        int neutralMinionsKilled,
        int goldEarned,
        int totalDamageDealtToChampions,
        boolean win,
        int teamId,
        int item0,
        int item1,
        int item2,
        int item3,
        int item4,
        int item5,
        int item6,
        int roleBoundItem,
        String teamPosition
) {

    @JsonIgnore
    public String displayName() {
        if (riotIdGameName != null && !riotIdGameName.isBlank()) return riotIdGameName;
        return summonerName == null ? "" : summonerName;
    }

    /**
     * Inventory slots {@code item0..item5} in slot order, zeros included.
     */
    @JsonIgnore
    public List<Integer> mainItems() {
        return List.of(item0, item1, item2, item3, item4, item5);
    }

    @JsonIgnore
    public int trinket() {
        return item6;
    }

    @JsonIgnore
    public int creepScore() {
        return totalMinionsKilled + neutralMinionsKilled;
    }

    @JsonIgnore
    public TeamPosition position() {
        return TeamPosition.parse(teamPosition);
    }
}
