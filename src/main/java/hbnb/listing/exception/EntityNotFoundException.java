package hbnb.listing.exception;

import lombok.Getter;

/**
 * Entity not found exception
 */
@Getter
public class EntityNotFoundException extends BusinessException {

    private final String entityType;

    private final String entityId;

    public EntityNotFoundException(String entityType, String entityId) {
        super(ErrorKind.NOT_FOUND, entityType + " not found: " + entityId);
        this.entityType = entityType;
        this.entityId = entityId;
    }
}
