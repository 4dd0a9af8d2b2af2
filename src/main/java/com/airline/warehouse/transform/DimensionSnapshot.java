package com.airline.warehouse.transform;

import com.airline.warehouse.entity.DimensionType;
import com.airline.warehouse.entity.VersionedDimension;
import lombok.Value;

/**
 * Incoming state of one dimension entity: an unsaved row carrying the business key and
 * attributes but no surrogate key, version or validity window yet.
 */
@Value
public class DimensionSnapshot implements TransformedRecord {

    DimensionType type;
    VersionedDimension row;

    @Override
    public String getKey() {
        return row.getBusinessKey();
    }
}
