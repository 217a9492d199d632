package com.nevis.ingest.infra;

public final class RateLimitKeys {

    public static final String CHAT_LIMIT = "chat_limit";
    public static final String FILE_SEARCH_LIMIT = "file_search_limit";

    private RateLimitKeys() {
    }
}
