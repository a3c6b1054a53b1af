package org.chessrules.settings;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Keeps the rule settings in a JSON file. Problems reading or writing the file are logged and
 * never reach the caller; defaults are used instead.
 */
public class SettingsManager {
    private static final Logger logger = LoggerFactory.getLogger(SettingsManager.class);

    private final Gson gson;
    private final Path settingsPath;
    private AppSettings settings;

    public SettingsManager(Path settingsPath) {
        this.gson = new GsonBuilder().setPrettyPrinting().create();
        this.settingsPath = settingsPath;
        logger.debug("Rule settings file: {}", settingsPath);
        load();
    }

    public AppSettings getSettings() {
        return settings;
    }

    public void load() {
        if (!Files.exists(settingsPath)) {
            logger.info("No rule settings at {}, writing defaults", settingsPath);
            settings = new AppSettings();
            save();
            return;
        }

        settings = read();
        if (settings.getRules() == null) {
            logger.warn("Rule settings in {} have no rules section, using defaults for it", settingsPath);
            settings.setRules(new RulesSettings());
        }
        RulesSettings rules = settings.getRules();
        logger.info("Rule settings loaded: rejectOwnColorTargets={}, logQueries={}",
                rules.isRejectOwnColorTargets(), rules.isLogQueries());
    }

    private AppSettings read() {
        try {
            AppSettings parsed = gson.fromJson(Files.readString(settingsPath), AppSettings.class);
            if (parsed == null) {
                logger.warn("Rule settings file {} is empty, using defaults", settingsPath);
                return new AppSettings();
            }
            return parsed;
        } catch (IOException e) {
            logger.error("Could not read rule settings from {}", settingsPath, e);
        } catch (JsonParseException e) {
            logger.error("Rule settings file {} is not valid JSON, using defaults", settingsPath, e);
        }
        return new AppSettings();
    }

    public void save() {
        try {
            Path parent = settingsPath.getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.writeString(settingsPath, gson.toJson(settings));
            logger.debug("Rule settings written to {}", settingsPath);
        } catch (IOException e) {
            logger.error("Could not write rule settings to {}", settingsPath, e);
        }
    }

    public void reset() {
        logger.info("Restoring default rule settings");
        settings = new AppSettings();
        save();
    }
}
