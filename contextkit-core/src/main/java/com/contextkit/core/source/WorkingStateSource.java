package com.contextkit.core.source;

import java.util.List;

/**
 * Layer 2: recent conversation and live state.
 */
public interface WorkingStateSource {

    /**
     * Most recent turns, oldest first.
     */
    List<String> getRecentConversations(int limit);

    String getStateSnapshot();
}
