package dev.devanks.solarcrm.catalog.model;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

import static org.springframework.util.StringUtils.hasText;

/**
 * Visibility scope used when reading the catalog.
 * A team sees its own records plus public ones. The system view sees every record regardless of owner.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class CatalogScope {

    /**
     * Reserved scope value for globally visible equipment and manufacturers.
     */
    public static final String PUBLIC_EQUIPMENT = "public";

    public enum Kind {
        TEAM,
        PUBLIC_ONLY,
        ALL
    }

    private static final CatalogScope PUBLIC_ONLY = new CatalogScope(Kind.PUBLIC_ONLY, null);
    private static final CatalogScope ALL = new CatalogScope(Kind.ALL, null);

    Kind kind;
    String teamId;

    /**
     * Scope of a team; a blank team id (or the public scope value) degrades to {@link #publicOnly()}.
     */
    public static CatalogScope team(String teamId) {
        if (!hasText(teamId) || isPublic(teamId)) {
            return PUBLIC_ONLY;
        }
        return new CatalogScope(Kind.TEAM, teamId);
    }

    public static CatalogScope publicOnly() {
        return PUBLIC_ONLY;
    }

    public static CatalogScope all() {
        return ALL;
    }

    public static boolean isPublic(String scope) {
        return PUBLIC_EQUIPMENT.equals(scope);
    }

    /**
     * Whether a record owned by {@code scope} is visible from this scope.
     */
    public boolean includes(String scope) {
        switch (kind) {
            case ALL:
                return true;
            case TEAM:
                return isPublic(scope) || teamId.equals(scope);
            default:
                return isPublic(scope);
        }
    }

    @Override
    public String toString() {
        return kind == Kind.TEAM ? "team:" + teamId : kind.name().toLowerCase();
    }
}
