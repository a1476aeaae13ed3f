package com.autocoder.features.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.nio.file.Path;

/**
 * Settings under {@code autocoder.*} in application.yml.
 */
@Component
@ConfigurationProperties(prefix = "autocoder")
public class AutocoderProperties {

    private String projectDir = ".";
    private String stopFileName = ".agent-stop";
    private String legacyFeatureFile = "feature_list.json";

    public String getProjectDir() {
        return projectDir;
    }

    public void setProjectDir(String projectDir) {
        this.projectDir = projectDir;
    }

    public String getStopFileName() {
        return stopFileName;
    }

    public void setStopFileName(String stopFileName) {
        this.stopFileName = stopFileName;
    }

    public String getLegacyFeatureFile() {
        return legacyFeatureFile;
    }

    public void setLegacyFeatureFile(String legacyFeatureFile) {
        this.legacyFeatureFile = legacyFeatureFile;
    }

    /** Absolute, normalised project directory. */
    public Path projectPath() {
        return Path.of(projectDir).toAbsolutePath().normalize();
    }
}
