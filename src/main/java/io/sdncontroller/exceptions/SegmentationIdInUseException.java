package io.sdncontroller.exceptions;

/**
 * Thrown when a (physical network, segmentation id) pair is already bound to another network.
 */
public class SegmentationIdInUseException extends NetworkControllerException {

    private final String physicalNetwork;
    private final int segmentationId;

    public SegmentationIdInUseException(String physicalNetwork, int segmentationId) {
        super(String.format("Unable to create the network. The VLAN %d on physical network %s is in use.",
                segmentationId, physicalNetwork));
        this.physicalNetwork = physicalNetwork;
        this.segmentationId = segmentationId;
    }

    public String getPhysicalNetwork() {
        return physicalNetwork;
    }

    public int getSegmentationId() {
        return segmentationId;
    }
}
