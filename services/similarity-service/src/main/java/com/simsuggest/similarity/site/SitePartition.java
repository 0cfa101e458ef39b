package com.simsuggest.similarity.site;

public record SitePartition(int rootContainerId, int languageId) {
}
