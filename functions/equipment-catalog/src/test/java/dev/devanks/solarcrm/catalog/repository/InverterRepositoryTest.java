package dev.devanks.solarcrm.catalog.repository;

import dev.devanks.solarcrm.catalog.model.CatalogScope;
import dev.devanks.solarcrm.catalog.model.Inverter;
import dev.devanks.solarcrm.catalog.model.InverterFilter;
import dev.devanks.solarcrm.catalog.support.CatalogFixture;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static dev.devanks.solarcrm.catalog.support.CatalogFixture.inverter;
import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("InverterRepository Unit Tests")
class InverterRepositoryTest {

    private CatalogFixture fixture;
    private InverterRepository repository;

    @BeforeEach
    void setUp() {
        fixture = new CatalogFixture();
        repository = fixture.inverters;
        repository.create(inverter("inv-public", "man-1", "SUN2000-5KTL", "public", 5000)).block();
        repository.create(inverter("inv-a", "man-1", "Team A Special", "team-a", 8000)).block();
        repository.create(inverter("inv-b", "man-2", "Team B Special", "team-b", 3000)).block();
    }

    private List<String> idsVisibleTo(CatalogScope scope) {
        return repository.findByFilters(InverterFilter.builder().scope(scope).build())
                .map(Inverter::getId)
                .collectList()
                .block();
    }

    @Test
    @DisplayName("a public inverter is visible to every team")
    void publicInverter_visibleToEveryTeam() {
        assertThat(idsVisibleTo(CatalogScope.team("team-a"))).contains("inv-public");
        assertThat(idsVisibleTo(CatalogScope.team("team-b"))).contains("inv-public");
        assertThat(idsVisibleTo(CatalogScope.team("team-c"))).containsExactly("inv-public");
        assertThat(idsVisibleTo(CatalogScope.publicOnly())).containsExactly("inv-public");
    }

    @Test
    @DisplayName("a team inverter is hidden from other teams")
    void teamInverter_hiddenFromOtherTeams() {
        assertThat(idsVisibleTo(CatalogScope.team("team-a"))).containsExactlyInAnyOrder("inv-public", "inv-a");
        assertThat(idsVisibleTo(CatalogScope.team("team-b"))).doesNotContain("inv-a");
    }

    @Test
    @DisplayName("the system scope sees every inverter")
    void systemScope_seesAll() {
        assertThat(idsVisibleTo(CatalogScope.all())).containsExactlyInAnyOrder("inv-public", "inv-a", "inv-b");
    }

    @Test
    @DisplayName("filters by power range and search term within the caller's scope")
    void findByFilters_rangeAndSearch() {
        InverterFilter filter = InverterFilter.builder()
                .scope(CatalogScope.team("team-a"))
                .minPowerW(4000.0)
                .search("special")
                .build();

        List<String> ids = repository.findByFilters(filter).map(Inverter::getId).collectList().block();

        assertThat(ids).containsExactly("inv-a");
    }

    @Test
    @DisplayName("findByManufacturer: respects the scope it is given")
    void findByManufacturer_scoped() {
        List<String> teamB = repository.findByManufacturer("man-1", CatalogScope.team("team-b"))
                .map(Inverter::getId).collectList().block();
        List<String> all = repository.findByManufacturer("man-1", CatalogScope.all())
                .map(Inverter::getId).collectList().block();

        assertThat(teamB).containsExactly("inv-public");
        assertThat(all).containsExactlyInAnyOrder("inv-public", "inv-a");
    }
}
