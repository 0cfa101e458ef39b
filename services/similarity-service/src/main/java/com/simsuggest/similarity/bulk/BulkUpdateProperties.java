package com.simsuggest.similarity.bulk;

import java.util.ArrayList;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "similarity.bulk")
public class BulkUpdateProperties {
    private boolean enabled = false;
    private long throttleMs = 0;
    private String mode = "lexical";
    private List<Integer> languageIds = new ArrayList<>(List.of(0));
    /** Empty means every root that has a configured core. */
    private List<Integer> rootIds = new ArrayList<>();

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public long getThrottleMs() {
        return throttleMs;
    }

    public void setThrottleMs(long throttleMs) {
        this.throttleMs = throttleMs;
    }

    public String getMode() {
        return mode;
    }

    public void setMode(String mode) {
        this.mode = mode;
    }

    public List<Integer> getLanguageIds() {
        return languageIds;
    }

    public void setLanguageIds(List<Integer> languageIds) {
        this.languageIds = languageIds == null ? new ArrayList<>() : languageIds;
    }

    public List<Integer> getRootIds() {
        return rootIds;
    }

    public void setRootIds(List<Integer> rootIds) {
        this.rootIds = rootIds == null ? new ArrayList<>() : rootIds;
    }
}
