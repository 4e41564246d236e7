package com.example.courserag.retrieval;

import org.springframework.lang.Nullable;

import java.util.List;
import java.util.Map;

/**
 * Outcome of one content search. {@code documents}, {@code metadata} and {@code distances}
 * are parallel lists in relevance order. When {@code error} is set all three are empty.
 */
public record SearchResults(List<String> documents,
                            List<Map<String, Object>> metadata,
                            List<Double> distances,
                            @Nullable String error) {

    public SearchResults {
        documents = documents == null ? List.of() : List.copyOf(documents);
        metadata = metadata == null ? List.of() : List.copyOf(metadata);
        distances = distances == null ? List.of() : List.copyOf(distances);
        if (error != null) {
            if (!documents.isEmpty() || !metadata.isEmpty() || !distances.isEmpty()) {
                throw new IllegalArgumentException("An errored search must not carry results");
            }
        } else if (documents.size() != metadata.size() || documents.size() != distances.size()) {
            throw new IllegalArgumentException("documents, metadata and distances differ in size: "
                    + documents.size() + "/" + metadata.size() + "/" + distances.size());
        }
    }

    public static SearchResults of(List<String> documents, List<Map<String, Object>> metadata, List<Double> distances) {
        return new SearchResults(documents, metadata, distances, null);
    }

    public static SearchResults empty(String error) {
        return new SearchResults(List.of(), List.of(), List.of(), error);
    }

    public boolean hasError() {
        return error != null;
    }

    public boolean isEmpty() {
        return documents.isEmpty();
    }
}
