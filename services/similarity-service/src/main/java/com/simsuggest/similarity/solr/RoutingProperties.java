package com.simsuggest.similarity.solr;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "similarity.routing")
public class RoutingProperties {
    /** Root container used when site resolution fails and no core mapping names a root. */
    private int defaultRootId = 1;

    public int getDefaultRootId() {
        return defaultRootId;
    }

    public void setDefaultRootId(int defaultRootId) {
        this.defaultRootId = defaultRootId;
    }
}
