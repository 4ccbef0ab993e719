package com.logsentinel.core.config;

import java.util.ArrayList;
import java.util.List;

/**
 * Message filters applied before feature extraction
 * ({@code analysisRules.featureExtraction}).
 *
 * @since 1.0.0
 */
public class FeatureExtractionRules {

    /** Entries whose message matches none of these are dropped; empty keeps all. */
    private List<String> includePatterns = new ArrayList<>();

    /** Entries whose message matches any of these are dropped. */
    private List<String> excludePatterns = new ArrayList<>();

    public List<String> getIncludePatterns() {
        return includePatterns;
    }

    public void setIncludePatterns(List<String> includePatterns) {
        this.includePatterns = includePatterns != null ? new ArrayList<>(includePatterns) : new ArrayList<>();
    }

    public List<String> getExcludePatterns() {
        return excludePatterns;
    }

    public void setExcludePatterns(List<String> excludePatterns) {
        this.excludePatterns = excludePatterns != null ? new ArrayList<>(excludePatterns) : new ArrayList<>();
    }
}
