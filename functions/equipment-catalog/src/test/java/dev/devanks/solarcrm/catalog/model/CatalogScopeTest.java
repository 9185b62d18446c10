package dev.devanks.solarcrm.catalog.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("CatalogScope Unit Tests")
class CatalogScopeTest {

    @Test
    @DisplayName("a team sees public data and its own")
    void team_includesPublicAndOwn() {
        CatalogScope scope = CatalogScope.team("team-a");

        assertThat(scope.includes("public")).isTrue();
        assertThat(scope.includes("team-a")).isTrue();
        assertThat(scope.includes("team-b")).isFalse();
    }

    @Test
    @DisplayName("a missing team falls back to public data")
    void team_nullIsPublicOnly() {
        assertThat(CatalogScope.team(null)).isEqualTo(CatalogScope.publicOnly());
        assertThat(CatalogScope.publicOnly().includes("team-a")).isFalse();
    }

    @Test
    @DisplayName("the system scope sees everything")
    void all_includesEverything() {
        assertThat(CatalogScope.all().includes("team-z")).isTrue();
        assertThat(CatalogScope.isPublic("public")).isTrue();
    }
}
