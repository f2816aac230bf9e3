package tech.ochestra.kubecostguard.exception;

/**
 * A section the whole cycle depends on (nodes, pods) could not be enumerated.
 * The cycle aborts and no partial report is produced.
 */
public class SnapshotUnavailableException extends RuntimeException {

    public SnapshotUnavailableException(String message) {
        super(message);
    }

    public SnapshotUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
