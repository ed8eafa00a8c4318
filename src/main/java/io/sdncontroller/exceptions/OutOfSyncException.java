package io.sdncontroller.exceptions;

/**
 * Thrown by strict listings when backend resources have no local counterpart.
 */
public class OutOfSyncException extends NetworkControllerException {

    private final int orphanCount;

    public OutOfSyncException(String resourceType, int orphanCount) {
        super(String.format("Found %d %s not bound to local records; local and backend state are out of sync",
                orphanCount, resourceType));
        this.orphanCount = orphanCount;
    }

    public int getOrphanCount() {
        return orphanCount;
    }
}
