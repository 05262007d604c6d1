package io.agentmind.memory;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.document.Document;
import org.springframework.ai.vectorstore.SearchRequest;
import org.springframework.ai.vectorstore.VectorStore;
import org.springframework.ai.vectorstore.filter.Filter;
import org.springframework.ai.vectorstore.filter.FilterExpressionBuilder;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Semantic similarity index over any Spring AI {@link VectorStore}.
 * Embedding is the vector store's concern; this class only maps record ids in and out.
 */
public class VectorStoreSimilarityIndex implements SimilarityIndex {

    private static final Logger log = LoggerFactory.getLogger(VectorStoreSimilarityIndex.class);

    static final String RECORD_ID = "record_id";
    static final String MEMORY_TYPE = "memory_type";
    static final String IMPORTANCE = "importance";

    private final VectorStore vectorStore;

    public VectorStoreSimilarityIndex(VectorStore vectorStore) {
        this.vectorStore = vectorStore;
    }

    @Override
    public String name() {
        return "vector-store";
    }

    @Override
    public boolean isAvailable() {
        return vectorStore != null;
    }

    @Override
    public void index(long recordId, String content, MemoryType type, double importance) {
        Document document = new Document(UUID.randomUUID().toString(), content, Map.of(
                RECORD_ID, recordId,
                MEMORY_TYPE, type.wireName(),
                IMPORTANCE, importance));
        try {
            vectorStore.add(List.of(document));
        } catch (RuntimeException e) {
            throw new IllegalStateException("Vector store rejected record " + recordId, e);
        }
    }

    @Override
    public List<Hit> search(String query, int limit, MemoryType typeFilter, double minImportance) {
        if (query == null || query.isBlank() || limit <= 0) {
            return List.of();
        }

        FilterExpressionBuilder b = new FilterExpressionBuilder();
        Filter.Expression filter = typeFilter != null
                ? b.and(b.eq(MEMORY_TYPE, typeFilter.wireName()), b.gte(IMPORTANCE, minImportance)).build()
                : b.gte(IMPORTANCE, minImportance).build();

        SearchRequest request = SearchRequest.builder()
                .query(query)
                .topK(limit)
                .filterExpression(filter)
                .build();

        List<Document> documents;
        try {
            documents = vectorStore.similaritySearch(request);
        } catch (RuntimeException e) {
            throw new IllegalStateException("Vector search failed", e);
        }

        List<Hit> hits = new ArrayList<>();
        if (documents == null) {
            return hits;
        }
        for (Document document : documents) {
            Object id = document.getMetadata().get(RECORD_ID);
            if (!(id instanceof Number number)) {
                log.debug("Skipping vector document {} without a record id", document.getId());
                continue;
            }
            Double score = document.getScore();
            hits.add(new Hit(number.longValue(), score != null ? MemoryRecord.clamp(score) : 0.0));
        }
        return hits;
    }
}
