package com.barthel.fragility.domain.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A component as persisted: hierarchy expressed through uuid references.
 *
 * @param uuid                   component identifier
 * @param label                  display label
 * @param assetType              asset type, null means unknown
 * @param canonicalComponentType canonical registry type, may be null
 * @param level                  recorded depth
 * @param nodePath               recorded ancestry path
 * @param parentUuid             parent reference, null for roots
 * @param childrenUuids          ordered child references, may point at missing records
 * @param metadata               free form attributes
 */
public record FlatComponentRecord(
        String uuid,
        String label,
        String assetType,
        String canonicalComponentType,
        Integer level,
        String nodePath,
        String parentUuid,
        List<String> childrenUuids,
        Map<String, String> metadata) {

    public FlatComponentRecord {
        if (uuid == null || uuid.isBlank()) {
            throw new IllegalArgumentException("Component uuid is required");
        }
        childrenUuids = childrenUuids == null ? List.of() : List.copyOf(childrenUuids);
        metadata = metadata == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    public boolean isRoot() {
        return parentUuid == null;
    }

    public FlatComponentRecord withoutParent() {
        return new FlatComponentRecord(uuid, label, assetType, canonicalComponentType, level, nodePath,
                null, childrenUuids, metadata);
    }
}
