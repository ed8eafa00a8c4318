package io.sdncontroller.engine;

import io.sdncontroller.enums.NetworkType;
import io.sdncontroller.exceptions.InvalidInputException;
import io.sdncontroller.exceptions.SegmentationIdInUseException;
import io.sdncontroller.models.NetworkBinding;
import io.sdncontroller.models.NetworkRequest;
import io.sdncontroller.store.RecordStore;
import lombok.extern.slf4j.Slf4j;

import java.util.Optional;

import static io.sdncontroller.config.Constants.MAX_SEGMENTATION_ID;
import static io.sdncontroller.config.Constants.MIN_SEGMENTATION_ID;

/**
 * Validates the provider attributes of a network create request.
 * <p>
 * The segment uniqueness check reads the record store outside the create
 * transaction, so it only narrows the window for duplicates; the store
 * repeats the check when the binding is written.
 */
@Slf4j
public class ProviderBindingValidator {

    private final RecordStore recordStore;

    public ProviderBindingValidator(RecordStore recordStore) {
        this.recordStore = recordStore;
    }

    /**
     * @return the binding to record for the network (without network id), or empty when the
     * request has no provider attributes
     */
    public Optional<NetworkBinding> validate(NetworkRequest request)
            throws InvalidInputException, SegmentationIdInUseException {
        if (!request.hasProviderAttributes()) {
            return Optional.empty();
        }
        if (request.getNetworkType() == null) {
            throw new InvalidInputException("provider:network_type required");
        }
        NetworkType type = NetworkType.fromString(request.getNetworkType());
        if (type == null) {
            throw new InvalidInputException("provider:network_type " + request.getNetworkType() + " not supported");
        }

        Integer segmentationId = request.getSegmentationId();
        if (type == NetworkType.VLAN) {
            if (segmentationId == null) {
                throw new InvalidInputException("Segmentation ID must be specified with vlan network type");
            }
            if (segmentationId < MIN_SEGMENTATION_ID || segmentationId > MAX_SEGMENTATION_ID) {
                throw new InvalidInputException(String.format("%d out of range (%d to %d)",
                        segmentationId, MIN_SEGMENTATION_ID, MAX_SEGMENTATION_ID));
            }
            if (recordStore.findBindingBySegment(request.getPhysicalNetwork(), segmentationId).isPresent()) {
                log.error("Segmentation id {} on physical network {} is already allocated",
                        segmentationId, request.getPhysicalNetwork());
                throw new SegmentationIdInUseException(request.getPhysicalNetwork(), segmentationId);
            }
        } else if (segmentationId != null) {
            throw new InvalidInputException("Segmentation ID cannot be specified with "
                    + type.getValue() + " network type");
        }

        return Optional.of(new NetworkBinding(null, type, request.getPhysicalNetwork(), segmentationId));
    }
}
