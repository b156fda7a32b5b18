package com.contextkit.core.source;

import java.util.List;

/**
 * User preferences and behaviour patterns behind the facts summary.
 */
public interface FactsSource {

    List<String> getPreferences();

    List<String> getBehaviorPatterns();
}
