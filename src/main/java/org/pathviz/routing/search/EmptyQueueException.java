package org.pathviz.routing.search;

/**
 * Thrown when extracting from an empty {@link SearchQueue}.
 */
public class EmptyQueueException extends IllegalStateException {
    public EmptyQueueException(String message) {
        super(message);
    }
}
