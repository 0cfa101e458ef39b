package com.simsuggest.similarity.query;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.simsuggest.similarity.mode.HybridStrategy;
import com.simsuggest.similarity.mode.SimilarityMode;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class SimilaritySettingsTest {

    @Test
    void absentKeysTakeDefaults() {
        SimilaritySettings settings = SimilaritySettings.defaults();

        assertThat(settings.getMode()).isEqualTo(SimilarityMode.AUTO);
        assertThat(settings.getHybridStrategy()).isEqualTo(HybridStrategy.DUAL);
        assertThat(settings.getMaxResults()).isEqualTo(6);
        assertThat(settings.getMltFields()).containsExactly("content", "title", "keywords");
        assertThat(settings.getBoostFields()).containsEntry("title", 1.2).containsEntry("keywords", 2.0);
        assertThat(settings.getFusionPolicy().lexicalWeight()).isEqualTo(0.4);
        assertThat(settings.getFusionPolicy().vectorWeight()).isEqualTo(0.6);
        assertThat(settings.getMinScore()).isZero();
        assertThat(settings.getFilters().getAllowedTypes()).isEmpty();
        assertThat(settings.getOverfetchFactor()).isEqualTo(2);
    }

    @Test
    void unknownKeysAndDisplayTogglesAreIgnored() {
        SimilaritySettings settings = SimilaritySettings.fromMap(Map.of("showImage", "1", "whatever", "x"));

        assertThat(settings.getMaxResults()).isEqualTo(6);
    }

    @Test
    void parsesListsWeightsAndLegacyWeightKeys() {
        SimilaritySettings settings = SimilaritySettings.fromMap(Map.of(
            "similarityMode", "smlt",
            "boostFields", "title^2 content",
            "smltMltWeight", "0.3",
            "smltVectorWeight", "0.7",
            "allowedTypes", "pages, tx_news_domain_model_news",
            "filterByPids", "3,7"
        ));

        assertThat(settings.getMode()).isEqualTo(SimilarityMode.HYBRID);
        assertThat(settings.getBoostFields()).containsOnly(Map.entry("title", 2.0), Map.entry("content", 1.0));
        assertThat(settings.getBoostFields().keySet()).containsExactly("title", "content");
        assertThat(settings.getFusionPolicy().lexicalWeight()).isEqualTo(0.3);
        assertThat(settings.getFusionPolicy().vectorWeight()).isEqualTo(0.7);
        assertThat(settings.getFilters().getAllowedTypes()).containsExactly("pages", "tx_news_domain_model_news");
        assertThat(settings.getFilters().getContainerIds()).isEqualTo(List.of(3, 7));
    }

    @Test
    void currentWeightKeysWinOverLegacyOnes() {
        SimilaritySettings settings = SimilaritySettings.fromMap(Map.of("mltWeight", "0.5", "smltMltWeight", "0.3"));

        assertThat(settings.getFusionPolicy().lexicalWeight()).isEqualTo(0.5);
    }

    @Test
    void malformedNumbersFailFast() {
        assertThatThrownBy(() -> SimilaritySettings.fromMap(Map.of("maxResults", "six")))
            .isInstanceOf(InvalidConfigurationException.class)
            .hasMessageContaining("maxResults");
        assertThatThrownBy(() -> SimilaritySettings.fromMap(Map.of("maxResults", "0")))
            .isInstanceOf(InvalidConfigurationException.class);
        assertThatThrownBy(() -> SimilaritySettings.fromMap(Map.of("minScore", "high")))
            .isInstanceOf(InvalidConfigurationException.class);
        assertThatThrownBy(() -> SimilaritySettings.fromMap(Map.of("filterByPids", "1,a")))
            .isInstanceOf(InvalidConfigurationException.class);
        assertThatThrownBy(() -> SimilaritySettings.fromMap(Map.of("boostFields", "title^x")))
            .isInstanceOf(InvalidConfigurationException.class);
        assertThatThrownBy(() -> SimilaritySettings.fromMap(Map.of("vectorWeight", "-1")))
            .isInstanceOf(InvalidConfigurationException.class);
    }
}
