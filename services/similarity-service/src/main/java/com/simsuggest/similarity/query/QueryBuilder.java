package com.simsuggest.similarity.query;

import com.simsuggest.similarity.document.DocumentRef;
import com.simsuggest.similarity.fusion.FusionPolicy;
import com.simsuggest.similarity.mode.AlgorithmPath;
import com.simsuggest.similarity.mode.HybridStrategy;
import com.simsuggest.similarity.solr.SolrProperties;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.apache.solr.client.solrj.util.ClientUtils;
import org.springframework.stereotype.Component;

/**
 * Renders backend query descriptors. Every literal that ends up inside query syntax is escaped with SolrJ's
 * {@link ClientUtils#escapeQueryChars}; local-param values must pass {@link LocalParams#requireIdentifier}
 * instead, and source text for text-to-vector queries travels in its own parameter.
 */
@Component
public class QueryBuilder {
    static final String SOURCE_TEXT_PARAM = "simq";
    private static final String RETURN_FIELDS = "*,score";

    private final SolrProperties solrProperties;

    public QueryBuilder(SolrProperties solrProperties) {
        this.solrProperties = solrProperties;
    }

    public List<Algorithm> algorithmsFor(AlgorithmPath path, HybridStrategy strategy) {
        return switch (path) {
            case LEXICAL -> List.of(Algorithm.LEXICAL);
            case VECTOR -> List.of(Algorithm.VECTOR);
            case HYBRID -> strategy == HybridStrategy.NATIVE
                ? List.of(Algorithm.HYBRID_NATIVE)
                : List.of(Algorithm.LEXICAL, Algorithm.VECTOR);
        };
    }

    /**
     * Sub-queries feeding client-side fusion ask for more rows than the caller wants, since merging shrinks the pool.
     */
    public int rowsFor(AlgorithmPath path, HybridStrategy strategy, SimilaritySettings settings) {
        if (path == AlgorithmPath.HYBRID && strategy != HybridStrategy.NATIVE) {
            return settings.getMaxResults() * settings.getOverfetchFactor();
        }
        return settings.getMaxResults();
    }

    public QueryDescriptor build(Algorithm algorithm, SourceDocument source, SimilaritySettings settings, int rows) {
        return switch (algorithm) {
            case LEXICAL -> lexical(source, settings, rows);
            case VECTOR -> vector(source, settings, rows);
            case HYBRID_NATIVE -> hybridNative(source, settings, rows);
        };
    }

    public QueryDescriptor lexical(SourceDocument source, SimilaritySettings settings, int rows) {
        String backendId = requireBackendId(source);
        QueryDescriptor.Builder builder = QueryDescriptor.builder(Algorithm.LEXICAL, source.getRef())
            .sourceBackendId(backendId)
            .handler(solrProperties.getMltHandler())
            .param("q", "id:" + ClientUtils.escapeQueryChars(backendId));
        applyMltParams(builder, settings);
        builder.param("mlt.match.include", "false")
            .param("fl", RETURN_FIELDS)
            .rows(rows);
        applyFilters(builder, settings.getFilters());
        return builder.build();
    }

    public QueryDescriptor vector(SourceDocument source, SimilaritySettings settings, int rows) {
        if (source.getText() == null || source.getText().isBlank()) {
            throw new IllegalArgumentException("vector query needs source text for " + source.getRef());
        }
        String model = LocalParams.requireIdentifier("vectorModelName", settings.getVectorModelName());
        String field = LocalParams.requireIdentifier("vectorField", settings.getVectorField());
        int topK = Math.max(settings.getVectorTopK(), rows);
        DocumentRef ref = source.getRef();

        QueryDescriptor.Builder builder = QueryDescriptor.builder(Algorithm.VECTOR, ref)
            .handler(solrProperties.getSelectHandler())
            .param(
                "q",
                "{!knn_text_to_vector model=" + model + " f=" + field + " topK=" + topK + " v=$" + SOURCE_TEXT_PARAM + "}"
            )
            .param(SOURCE_TEXT_PARAM, source.getText())
            .param("fl", RETURN_FIELDS)
            .rows(rows)
            .param("fq", excludeSelf(ref));
        applyFilters(builder, settings.getFilters());
        return builder.build();
    }

    public QueryDescriptor hybridNative(SourceDocument source, SimilaritySettings settings, int rows) {
        String backendId = requireBackendId(source);
        String model = LocalParams.requireIdentifier("vectorModelName", settings.getVectorModelName());
        String field = LocalParams.requireIdentifier("vectorField", settings.getVectorField());
        FusionPolicy policy = settings.getFusionPolicy();

        QueryDescriptor.Builder builder = QueryDescriptor.builder(Algorithm.HYBRID_NATIVE, source.getRef())
            .sourceBackendId(backendId)
            .handler(solrProperties.getHybridHandler())
            .param("q", "id:" + ClientUtils.escapeQueryChars(backendId))
            .param("smlt.mode", "hybrid")
            .param("smlt.mltWeight", Double.toString(policy.lexicalWeight()))
            .param("smlt.vectorWeight", Double.toString(policy.vectorWeight()))
            .param("smlt.model", model)
            .param("smlt.vectorField", field)
            .param("smlt.topK", Integer.toString(Math.max(settings.getVectorTopK(), rows)));
        applyMltParams(builder, settings);
        builder.param("mlt.match.include", "false")
            .param("fl", RETURN_FIELDS)
            .rows(rows);
        applyFilters(builder, settings.getFilters());
        return builder.build();
    }

    /**
     * Point lookup for a document by record type and uid.
     */
    public static String pointLookupQuery(DocumentRef ref) {
        return "type:" + ClientUtils.escapeQueryChars(ref.type()) + " AND uid:" + ref.id();
    }

    static String excludeSelf(DocumentRef ref) {
        return "-(" + pointLookupQuery(ref) + ")";
    }

    private void applyMltParams(QueryDescriptor.Builder builder, SimilaritySettings settings) {
        List<String> fields = new ArrayList<>();
        for (String field : settings.getMltFields()) {
            fields.add(LocalParams.requireIdentifier("mltFields", field));
        }
        builder.param("mlt.fl", String.join(",", fields))
            .param("mlt.mintf", Integer.toString(settings.getMinTermFreq()))
            .param("mlt.mindf", Integer.toString(settings.getMinDocFreq()))
            .param("mlt.boost", "true");
        if (!settings.getBoostFields().isEmpty()) {
            builder.param("mlt.qf", renderBoostFields(settings.getBoostFields()));
        }
    }

    static String renderBoostFields(Map<String, Double> boostFields) {
        List<String> parts = new ArrayList<>(boostFields.size());
        for (Map.Entry<String, Double> entry : boostFields.entrySet()) {
            String field = LocalParams.requireIdentifier("boostFields", entry.getKey());
            parts.add(field + "^" + entry.getValue());
        }
        return String.join(" ", parts);
    }

    private void applyFilters(QueryDescriptor.Builder builder, FilterClauses filters) {
        if (!filters.getAllowedTypes().isEmpty()) {
            builder.param("fq", "type:(" + joinEscaped(filters.getAllowedTypes()) + ")");
        } else if (!filters.getExcludedTypes().isEmpty()) {
            builder.param("fq", "-type:(" + joinEscaped(filters.getExcludedTypes()) + ")");
        }
        if (!filters.getContainerIds().isEmpty()) {
            List<String> ids = new ArrayList<>(filters.getContainerIds().size());
            for (Integer id : filters.getContainerIds()) {
                ids.add(Integer.toString(id));
            }
            builder.param("fq", "pid:(" + String.join(" OR ", ids) + ")");
        }
    }

    private String joinEscaped(List<String> values) {
        List<String> escaped = new ArrayList<>(values.size());
        for (String value : values) {
            escaped.add(ClientUtils.escapeQueryChars(value));
        }
        return String.join(" OR ", escaped);
    }

    private String requireBackendId(SourceDocument source) {
        if (source.getBackendId() == null || source.getBackendId().isBlank()) {
            throw new IllegalArgumentException("backend document id is required for " + source.getRef());
        }
        return source.getBackendId();
    }
}
