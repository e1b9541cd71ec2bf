package com.github.musiKk.stubs;

import java.io.FileInputStream;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Properties;

import com.github.musiKk.stubs.parser.ParseTarget;

public class ConfigReader {

    static final String CONFIG_FILE = "stubs.cfg";

    static Config readConfig() {
        return readConfig(Path.of(CONFIG_FILE));
    }

    // a missing file means the default target
    static Config readConfig(Path file) {
        var config = new Config();
        if (!Files.isRegularFile(file)) {
            return config;
        }
        Properties properties = new Properties();
        try (var in = new FileInputStream(file.toFile())) {
            properties.load(in);
        } catch (IOException e) {
            throw new RuntimeException(e);
        }

        config.version = properties.getProperty("version", config.version).trim();
        config.platform = properties.getProperty("platform", config.platform).trim();
        return config;
    }

    // values are checked when the target is built
    static class Config {
        String version = ParseTarget.DEFAULT.versionString();
        String platform = ParseTarget.DEFAULT.platform();

        public void applyConfig(ConfigTarget ct) {
            ct.setVersion(version);
            ct.setPlatform(platform);
        }
    }

    interface ConfigTarget {
        void setVersion(String version);
        void setPlatform(String platform);
    }

}
