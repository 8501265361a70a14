package com.storyline.core.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "storyline")
public class StorylineProperties {

    private int maxNestingDepth = 64;
    private String defaultDocumentId = "document";
    private Long shuffleSeed;
    private String stateFile;

    public int getMaxNestingDepth() {
        return maxNestingDepth;
    }

    public void setMaxNestingDepth(int maxNestingDepth) {
        if (maxNestingDepth < 1) {
            throw new IllegalArgumentException("storyline.max-nesting-depth must be at least 1: " + maxNestingDepth);
        }
        this.maxNestingDepth = maxNestingDepth;
    }

    public String getDefaultDocumentId() {
        return defaultDocumentId;
    }

    public void setDefaultDocumentId(String defaultDocumentId) {
        this.defaultDocumentId = defaultDocumentId;
    }

    public Long getShuffleSeed() {
        return shuffleSeed;
    }

    public void setShuffleSeed(Long shuffleSeed) {
        this.shuffleSeed = shuffleSeed;
    }

    public String getStateFile() {
        return stateFile;
    }

    public void setStateFile(String stateFile) {
        this.stateFile = stateFile;
    }

    public boolean hasShuffleSeed() {
        return shuffleSeed != null;
    }

    public boolean hasStateFile() {
        return stateFile != null && !stateFile.isBlank();
    }
}
