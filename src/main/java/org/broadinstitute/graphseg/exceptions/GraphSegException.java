package org.broadinstitute.graphseg.exceptions;

/**
 * <p/>
 * Class GraphSegException.
 * <p/>
 * This exception is for errors that are beyond the user's control, such as internal pre/post condition failures,
 * numerical routines that fail to converge, and "this should never happen" kinds of scenarios.
 */
public class GraphSegException extends RuntimeException {
    private static final long serialVersionUID = 0L;

    public GraphSegException( String msg ) {
        super(msg);
    }

    public GraphSegException( String message, Throwable throwable ) {
        super(message, throwable);
    }
}
