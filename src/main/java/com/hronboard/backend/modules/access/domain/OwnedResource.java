package com.hronboard.backend.modules.access.domain;

import java.util.UUID;

/**
 * A resource that can be checked against ownership or department access modes.
 */
public interface OwnedResource {

    UUID getOwnerId();

    default String getOwnerDepartment() {
        return null;
    }
}
