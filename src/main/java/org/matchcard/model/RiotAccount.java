package org.matchcard.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record RiotAccount(String puuid, String gameName, String tagLine) {

    public String riotId() {
        return gameName + "#" + tagLine;
    }
}
