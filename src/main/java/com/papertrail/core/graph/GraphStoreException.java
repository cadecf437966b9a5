package com.papertrail.core.graph;

import com.papertrail.core.PaperTrailException;

/**
 * The graph store is unreachable or rejected a write.
 */
public class GraphStoreException extends PaperTrailException {

    public GraphStoreException(String message) {
        super(message);
    }

    public GraphStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
