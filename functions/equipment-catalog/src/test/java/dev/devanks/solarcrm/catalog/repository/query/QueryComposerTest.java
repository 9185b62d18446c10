package dev.devanks.solarcrm.catalog.repository.query;

import dev.devanks.solarcrm.catalog.entity.ManufacturerEntity;
import dev.devanks.solarcrm.catalog.entity.SolarModuleEntity;
import dev.devanks.solarcrm.catalog.model.CatalogScope;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static dev.devanks.solarcrm.catalog.repository.query.Condition.eq;
import static dev.devanks.solarcrm.catalog.repository.query.QueryComposer.buildAccessFilter;
import static dev.devanks.solarcrm.catalog.repository.query.QueryComposer.buildIdQuery;
import static dev.devanks.solarcrm.catalog.repository.query.QueryComposer.buildRangeFilter;
import static dev.devanks.solarcrm.catalog.repository.query.QueryComposer.buildSearchFilter;
import static dev.devanks.solarcrm.catalog.repository.query.QueryComposer.mergeAll;
import static dev.devanks.solarcrm.catalog.repository.query.QueryComposer.mergeQueries;
import static dev.devanks.solarcrm.catalog.repository.query.QueryComposer.softDeleteQuery;
import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("QueryComposer Unit Tests")
class QueryComposerTest {

    private static SolarModuleEntity module(String scope, String model, String cellType, Double powerW) {
        return SolarModuleEntity.builder()
                .id(model)
                .scope(scope)
                .model(model)
                .cellType(cellType)
                .nominalPowerW(powerW)
                .build();
    }

    @Test
    @DisplayName("mergeQueries: an empty fragment yields the other fragment unchanged")
    void mergeQueries_emptyFragment_returnsOther() {
        Query access = buildAccessFilter("team-a");

        assertThat(mergeQueries(Query.empty(), access)).isSameAs(access);
        assertThat(mergeQueries(access, Query.empty())).isSameAs(access);
        assertThat(mergeQueries(Query.empty(), Query.empty()).isEmpty()).isTrue();
    }

    @Test
    @DisplayName("mergeQueries: two OR groups are both kept under an AND")
    void mergeQueries_twoOrGroups_bothEnforced() {
        // Arrange
        Query access = buildAccessFilter("team-a");
        Query search = buildSearchFilter("mono", "model", "cellType");

        // Act
        Query merged = mergeQueries(access, search);

        // Assert
        assertThat(merged.hasAnyOf()).isFalse();
        assertThat(merged.getAllOf()).hasSize(2);
        assertThat(merged.matches(module("team-a", "X-100", "Monocrystalline", 400.0))).isTrue();
        assertThat(merged.matches(module("public", "Mono Max", "PERC", 400.0))).isTrue();
        assertThat(merged.matches(module("team-b", "Mono Max", "PERC", 400.0)))
                .as("search match outside the team's scope")
                .isFalse();
        assertThat(merged.matches(module("team-a", "X-100", "Poly", 400.0)))
                .as("scope match without search match")
                .isFalse();
    }

    @Test
    @DisplayName("mergeQueries: a shared field key keeps both conditions")
    void mergeQueries_sharedFieldKey_doesNotOverwrite() {
        Query first = Query.where("scope", eq("team-a"));
        Query second = Query.where("scope", eq("team-b"));

        Query merged = mergeQueries(first, second);

        assertThat(merged.matches(module("team-a", "M", "Mono", 1.0))).isFalse();
        assertThat(merged.matches(module("team-b", "M", "Mono", 1.0))).isFalse();
        assertThat(merged.getAllOf()).containsExactly(first, second);
    }

    @Test
    @DisplayName("mergeQueries: a single OR group is kept next to plain fields")
    void mergeQueries_singleOrGroup_fieldMerge() {
        Query access = buildAccessFilter("team-a");
        Query cellType = Query.where("cellType", eq("Mono"));

        Query merged = mergeQueries(access, cellType);

        assertThat(merged.getAnyOf()).isEqualTo(access.getAnyOf());
        assertThat(merged.getFields()).containsOnlyKeys("cellType");
        assertThat(merged.matches(module("public", "M", "Mono", 1.0))).isTrue();
        assertThat(merged.matches(module("team-b", "M", "Mono", 1.0))).isFalse();
    }

    @Test
    @DisplayName("mergeAll: the order of fragments does not change the result set")
    void mergeAll_orderIndependent() {
        Query access = buildAccessFilter("team-a");
        Query search = buildSearchFilter("max", "model");
        Query range = buildRangeFilter("nominalPowerW", 300, 450);
        Query cellType = Query.where("cellType", eq("Mono"));
        List<SolarModuleEntity> documents = List.of(
                module("team-a", "Max 400", "Mono", 400.0),
                module("public", "Max 500", "Mono", 500.0),
                module("public", "Max 350", "Poly", 350.0),
                module("team-b", "Max 400", "Mono", 400.0),
                module("team-a", "Mini 400", "Mono", 400.0),
                module("public", "MAX 300", "Mono", 300.0));

        Query forward = mergeAll(access, search, range, cellType);
        Query backward = mergeAll(cellType, range, search, access);

        List<String> forwardIds = documents.stream().filter(forward::matches).map(SolarModuleEntity::getId).toList();
        List<String> backwardIds = documents.stream().filter(backward::matches).map(SolarModuleEntity::getId).toList();
        assertThat(forwardIds).containsExactly("Max 400", "MAX 300");
        assertThat(backwardIds).isEqualTo(forwardIds);
    }

    @Test
    @DisplayName("buildAccessFilter: team sees own and public, blank team sees public, system sees all")
    void buildAccessFilter_scopes() {
        Query team = buildAccessFilter("team-a");
        Query anonymous = buildAccessFilter("  ");
        Query system = buildAccessFilter(CatalogScope.all());

        assertThat(team.matches(module("team-a", "M", null, null))).isTrue();
        assertThat(team.matches(module("public", "M", null, null))).isTrue();
        assertThat(team.matches(module("team-b", "M", null, null))).isFalse();
        assertThat(anonymous).isEqualTo(Query.where("scope", eq(CatalogScope.PUBLIC_EQUIPMENT)));
        assertThat(system.isEmpty()).isTrue();
    }

    @Test
    @DisplayName("buildSearchFilter: matches case-insensitively and treats the term literally")
    void buildSearchFilter_literalCaseInsensitive() {
        Query search = buildSearchFilter("tiger (neo)", "model");

        assertThat(search.matches(module("public", "Tiger (Neo) 420", null, null))).isTrue();
        assertThat(search.matches(module("public", "Tiger Neo 420", null, null))).isFalse();
        assertThat(buildSearchFilter("", "model").isEmpty()).isTrue();
        assertThat(buildSearchFilter(null, "model").isEmpty()).isTrue();
    }

    @Test
    @DisplayName("buildRangeFilter: closed interval with open ends for unset bounds")
    void buildRangeFilter_closedInterval() {
        Query between = buildRangeFilter("nominalPowerW", 400, 450);
        Query atLeast = buildRangeFilter("nominalPowerW", 400, null);

        assertThat(between.matches(module("public", "A", null, 400.0))).isTrue();
        assertThat(between.matches(module("public", "B", null, 450.0))).isTrue();
        assertThat(between.matches(module("public", "C", null, 450.5))).isFalse();
        assertThat(between.matches(module("public", "D", null, null))).isFalse();
        assertThat(atLeast.matches(module("public", "E", null, 9000.0))).isTrue();
        assertThat(buildRangeFilter("nominalPowerW", null, null).isEmpty()).isTrue();
    }

    @Test
    @DisplayName("softDeleteQuery: live when the flag is false or absent")
    void softDeleteQuery_flagFalseOrMissing() {
        Query live = softDeleteQuery();
        SolarModuleEntity neverFlagged = module("public", "A", null, null);
        SolarModuleEntity restored = neverFlagged.toBuilder().isDeleted(false).build();
        SolarModuleEntity deleted = neverFlagged.toBuilder().isDeleted(true).build();

        assertThat(live.matches(neverFlagged)).isTrue();
        assertThat(live.matches(restored)).isTrue();
        assertThat(live.matches(deleted)).isFalse();
    }

    @Test
    @DisplayName("buildIdQuery: a secondary id field is accepted as an alias")
    void buildIdQuery_secondaryField() {
        ManufacturerEntity manufacturer = ManufacturerEntity.builder().id("m-1").externalId("legacy-7").build();

        Query primaryOnly = buildIdQuery(IdFields.primary("id"), "legacy-7");
        Query withAlias = buildIdQuery(IdFields.of("id", "externalId"), "legacy-7");

        assertThat(primaryOnly.matches(manufacturer)).isFalse();
        assertThat(withAlias.matches(manufacturer)).isTrue();
        assertThat(buildIdQuery(IdFields.of("id", "externalId"), "m-1").matches(manufacturer)).isTrue();
    }
}
