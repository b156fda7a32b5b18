package com.contextkit.common.constants;

public final class ContextKeys {
    public static final String IDENTITY = "identity";
    public static final String FACTS_SUMMARY = "facts_summary";

    public static final String KEYWORD_SEPARATOR = " ";

    private ContextKeys() {}
}
