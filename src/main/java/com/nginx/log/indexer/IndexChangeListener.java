package com.nginx.log.indexer;

/**
 * Notified after the indexer changed the set of indexed documents.
 */
public interface IndexChangeListener {

    /** Documents were added or removed. */
    void onIndexChanged();

    /** The whole index was dropped and recreated. */
    default void onIndexReset() {
        onIndexChanged();
    }
}
