package com.contextkit.core.source;

import com.contextkit.core.prompt.model.RetrievalQuery;

/**
 * Long-term memory search. The result is used as opaque text and may be empty.
 */
public interface RetrievalSource {

    String retrieve(RetrievalQuery query);
}
