package com.nginx.log.index;

import java.io.IOException;

/**
 * Accumulated writes, applied together by {@link #execute()}. Indexing an existing id
 * replaces the document.
 */
public interface IndexBatch {

    void index(LogDocument document);

    void delete(String id);

    int size();

    /**
     * Applies and commits the operations; they are visible to searches on return.
     */
    void execute() throws IOException;
}
