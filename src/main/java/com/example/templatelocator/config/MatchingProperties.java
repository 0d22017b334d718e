package com.example.templatelocator.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "matching")
public class MatchingProperties {

    private boolean enabled = true;
    private String defaultMethod = "ccoeff_normed";
    private String defaultMode = "gray";
    private int defaultMaxResults = 5;
    private double defaultMinScore = 0.80;
    private double defaultNmsThreshold = 0.30;
    private String defaultDraw = "bbox+label+score";
    private int defaultThickness = 2;
    private double defaultFontScale = 0.5;
    private int candidateMultiplier = 10;
    private int suppressionDivisor = 4;

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public String getDefaultMethod() {
        return defaultMethod;
    }

    public void setDefaultMethod(String defaultMethod) {
        this.defaultMethod = defaultMethod;
    }

    public String getDefaultMode() {
        return defaultMode;
    }

    public void setDefaultMode(String defaultMode) {
        this.defaultMode = defaultMode;
    }

    public int getDefaultMaxResults() {
        return defaultMaxResults;
    }

    public void setDefaultMaxResults(int defaultMaxResults) {
        this.defaultMaxResults = defaultMaxResults;
    }

    public double getDefaultMinScore() {
        return defaultMinScore;
    }

    public void setDefaultMinScore(double defaultMinScore) {
        this.defaultMinScore = defaultMinScore;
    }

    public double getDefaultNmsThreshold() {
        return defaultNmsThreshold;
    }

    public void setDefaultNmsThreshold(double defaultNmsThreshold) {
        this.defaultNmsThreshold = defaultNmsThreshold;
    }

    public String getDefaultDraw() {
        return defaultDraw;
    }

    public void setDefaultDraw(String defaultDraw) {
        this.defaultDraw = defaultDraw;
    }

    public int getDefaultThickness() {
        return defaultThickness;
    }

    public void setDefaultThickness(int defaultThickness) {
        this.defaultThickness = defaultThickness;
    }

    public double getDefaultFontScale() {
        return defaultFontScale;
    }

    public void setDefaultFontScale(double defaultFontScale) {
        this.defaultFontScale = defaultFontScale;
    }

    public int getCandidateMultiplier() {
        return candidateMultiplier;
    }

    public void setCandidateMultiplier(int candidateMultiplier) {
        this.candidateMultiplier = candidateMultiplier;
    }

    public int getSuppressionDivisor() {
        return suppressionDivisor;
    }

    public void setSuppressionDivisor(int suppressionDivisor) {
        this.suppressionDivisor = suppressionDivisor;
    }
}
