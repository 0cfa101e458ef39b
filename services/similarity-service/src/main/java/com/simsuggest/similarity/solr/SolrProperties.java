package com.simsuggest.similarity.solr;

import java.util.ArrayList;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "similarity.solr")
public class SolrProperties {
    private String baseUrl = "http://localhost:8983/solr";
    private int connectTimeoutMs = 300;
    private int readTimeoutMs = 2000;
    private String selectHandler = "/select";
    private String mltHandler = "/mlt";
    private String hybridHandler = "/smlt";
    private List<Core> cores = new ArrayList<>();

    public String getBaseUrl() {
        return baseUrl;
    }

    public void setBaseUrl(String baseUrl) {
        this.baseUrl = baseUrl;
    }

    public int getConnectTimeoutMs() {
        return connectTimeoutMs;
    }

    public void setConnectTimeoutMs(int connectTimeoutMs) {
        this.connectTimeoutMs = connectTimeoutMs;
    }

    public int getReadTimeoutMs() {
        return readTimeoutMs;
    }

    public void setReadTimeoutMs(int readTimeoutMs) {
        this.readTimeoutMs = readTimeoutMs;
    }

    public String getSelectHandler() {
        return selectHandler;
    }

    public void setSelectHandler(String selectHandler) {
        this.selectHandler = selectHandler;
    }

    public String getMltHandler() {
        return mltHandler;
    }

    public void setMltHandler(String mltHandler) {
        this.mltHandler = mltHandler;
    }

    public String getHybridHandler() {
        return hybridHandler;
    }

    public void setHybridHandler(String hybridHandler) {
        this.hybridHandler = hybridHandler;
    }

    public List<Core> getCores() {
        return cores;
    }

    public void setCores(List<Core> cores) {
        this.cores = cores;
    }

    /**
     * One core serves one site root in one language.
     */
    public static class Core {
        private int rootId;
        private int languageId;
        private String name;

        public Core() {
        }

        public Core(int rootId, int languageId, String name) {
            this.rootId = rootId;
            this.languageId = languageId;
            this.name = name;
        }

        public int getRootId() {
            return rootId;
        }

        public void setRootId(int rootId) {
            this.rootId = rootId;
        }

        public int getLanguageId() {
            return languageId;
        }

        public void setLanguageId(int languageId) {
            this.languageId = languageId;
        }

        public String getName() {
            return name;
        }

        public void setName(String name) {
            this.name = name;
        }
    }
}
