package dev.devanks.solarcrm.catalog.repository.query;

import lombok.Value;

/**
 * Fields an entity can be looked up by. The secondary field, when set, is accepted as an alias of the
 * primary id.
 */
@Value
public class IdFields {

    String primary;
    String secondary;

    public static IdFields primary(String field) {
        return new IdFields(field, null);
    }

    public static IdFields of(String primary, String secondary) {
        return new IdFields(primary, secondary);
    }

    public boolean hasSecondary() {
        return secondary != null;
    }
}
