package org.matchcard.riot;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.matchcard.model.MatchData;

import java.io.File;
import java.io.IOException;

/**
 * Match documents on disk, in the same JSON shape match-v5 returns.
 */
public class MatchDataStore {
    private final ObjectMapper mapper = new ObjectMapper()
            .enable(SerializationFeature.INDENT_OUTPUT)
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    private final File matchFile;

    public MatchDataStore(File matchFile) {
        this.matchFile = matchFile;
    }

    public void save(MatchData match) throws IOException {
        mapper.writeValue(matchFile, match);
    }

    public MatchData load() throws IOException {
        if (!matchFile.exists()) return null;
        return mapper.readValue(matchFile, MatchData.class);
    }
}
