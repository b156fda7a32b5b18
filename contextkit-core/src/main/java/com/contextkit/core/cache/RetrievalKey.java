package com.contextkit.core.cache;

/**
 * Composite key of the retrieval partition. Equality is pair equality, so
 * ("a_b", "c") and ("a", "b_c") are distinct keys.
 */
public record RetrievalKey(String eventType, String keywords) {

    public RetrievalKey {
        eventType = eventType == null ? "" : eventType;
        keywords = keywords == null ? "" : keywords;
    }

    public static RetrievalKey of(String eventType, String keywords) {
        return new RetrievalKey(eventType, keywords);
    }
}
