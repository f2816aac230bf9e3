package tech.ochestra.kubecostguard.exception;

/**
 * A mutating call against the Kubernetes API failed.
 */
public class ClusterOperationException extends RuntimeException {

    public ClusterOperationException(String message) {
        super(message);
    }

    public ClusterOperationException(String message, Throwable cause) {
        super(message, cause);
    }
}
