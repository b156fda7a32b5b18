package com.contextkit.core.prompt;

/**
 * Fixed headers and texts of the assembled prompt.
 */
public final class PromptSections {

    public static final String WORKING_MEMORY_HEADER = "{Layer 2: Working Memory}";
    public static final String CONVERSATION_HISTORY = "[Conversation History]";
    public static final String REALTIME_STATE = "[Real-time State]";
    public static final String ENVIRONMENT = "[Environment]";

    public static final String FACTS_HEADER = "{Layer 3: Long-term Memory - Facts Summary}";
    public static final String NO_FACTS = "[No user preferences yet]";
    public static final String PREFERENCES = "[Preferences]";
    public static final String BEHAVIOR_PATTERNS = "[Behavior Patterns]";

    public static final String INSTRUCTIONS_HEADER = "{Instructions}";
    public static final String INSTRUCTIONS =
        "Reply to the current event using the context above. Keep the reply short, natural and in character.";

    public static final String CURRENT_EVENT_HEADER = "{Current Event}";
    public static final String USER_INPUT_PREFIX = "User input: ";
    public static final String NO_INPUT = "[none]";

    private PromptSections() {}
}
