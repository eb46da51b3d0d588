package org.matchcard.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import java.io.File;
import java.io.IOException;

public class SettingsStore {
    private final ObjectMapper mapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);
    private final File settingsFile;

    public SettingsStore(File settingsFile) {
        this.settingsFile = settingsFile;
    }

    public void save(RenderSettings settings) throws IOException {
        File parent = settingsFile.getAbsoluteFile().getParentFile();
        if (parent != null && !parent.exists() && !parent.mkdirs()) {
            throw new IOException("Could not create " + parent);
        }
        mapper.writeValue(settingsFile, settings);
    }

    /**
     * Reads the settings file, or returns defaults when it does not exist.
     */
    public RenderSettings load() throws IOException {
        if (!settingsFile.exists()) return new RenderSettings();
        return mapper.readValue(settingsFile, RenderSettings.class);
    }
}
