package com.helmsman.core.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "helmsman.processing")
public class ProcessingProperties {

    private String catalogLocation = "classpath:catalog/maritime-patterns.json";
    private int summaryMaxLength = 150;
    private int minTextLength = 10;
    private int maxTextLength = 10 * 1024 * 1024;
    private double fallbackThreshold = 0.5;
    private String processingVersion = "1.0.0";

    public String getCatalogLocation() {
        return catalogLocation;
    }

    public void setCatalogLocation(String catalogLocation) {
        this.catalogLocation = catalogLocation;
    }

    public int getSummaryMaxLength() {
        return summaryMaxLength;
    }

    public void setSummaryMaxLength(int summaryMaxLength) {
        this.summaryMaxLength = summaryMaxLength;
    }

    public int getMinTextLength() {
        return minTextLength;
    }

    public void setMinTextLength(int minTextLength) {
        this.minTextLength = minTextLength;
    }

    public int getMaxTextLength() {
        return maxTextLength;
    }

    public void setMaxTextLength(int maxTextLength) {
        this.maxTextLength = maxTextLength;
    }

    public double getFallbackThreshold() {
        return fallbackThreshold;
    }

    public void setFallbackThreshold(double fallbackThreshold) {
        this.fallbackThreshold = fallbackThreshold;
    }

    public String getProcessingVersion() {
        return processingVersion;
    }

    public void setProcessingVersion(String processingVersion) {
        this.processingVersion = processingVersion;
    }
}
