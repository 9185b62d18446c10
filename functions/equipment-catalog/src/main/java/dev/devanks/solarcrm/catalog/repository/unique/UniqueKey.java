package dev.devanks.solarcrm.catalog.repository.unique;

import com.google.common.hash.Hashing;
import dev.devanks.solarcrm.catalog.aggregate.ViolationType;
import dev.devanks.solarcrm.catalog.model.Inverter;
import dev.devanks.solarcrm.catalog.model.Manufacturer;
import dev.devanks.solarcrm.catalog.model.SolarModule;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

import java.util.Locale;

import static java.nio.charset.StandardCharsets.UTF_8;

/**
 * Name that must be unique within its scope key. Names are trimmed and lower-cased.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class UniqueKey {

    public enum Kind {
        MANUFACTURER_NAME,
        MODULE_MODEL,
        INVERTER_MODEL
    }

    Kind kind;
    String scopeKey;
    String name;

    public static UniqueKey of(Kind kind, String scopeKey, String name) {
        return new UniqueKey(kind, scopeKey, normalise(name));
    }

    public static UniqueKey manufacturerName(Manufacturer manufacturer) {
        return of(Kind.MANUFACTURER_NAME, manufacturer.getScope(), manufacturer.getName());
    }

    public static UniqueKey moduleModel(SolarModule module) {
        return of(Kind.MODULE_MODEL, module.getScope() + "/" + module.getManufacturerId(), module.getModel());
    }

    public static UniqueKey inverterModel(Inverter inverter) {
        return of(Kind.INVERTER_MODEL, inverter.getScope() + "/" + inverter.getManufacturerId(), inverter.getModel());
    }

    /**
     * Stable document id of the reservation.
     */
    public String documentId() {
        return Hashing.sha256()
                .hashString(kind + "|" + scopeKey + "|" + name, UTF_8)
                .toString();
    }

    public ViolationType violationType() {
        return kind == Kind.MANUFACTURER_NAME ? ViolationType.DUPLICATE_NAME : ViolationType.DUPLICATE_MODEL;
    }

    private static String normalise(String name) {
        return name == null ? "" : name.trim().toLowerCase(Locale.ROOT);
    }
}
