package dev.devanks.solarcrm.catalog.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

@Data
@Validated
@Configuration
@ConfigurationProperties(prefix = "catalog")
public class CatalogProperties {

    /**
     * Upper bound for loading the three catalog collections.
     */
    @NotNull
    private Duration loadTimeout = Duration.ofSeconds(30);

    @Min(1)
    private int defaultPageSize = 20;

    @Min(1)
    @Max(1000)
    private int maxPageSize = 100;

    @Valid
    @NotNull
    private UniqueKeyProperties uniqueKeys = new UniqueKeyProperties();

    @Valid
    @NotNull
    private MaintenanceProperties maintenance = new MaintenanceProperties();

    @Data
    @Validated
    public static class UniqueKeyProperties {
        /**
         * Reserve names and models in a dedicated collection before writing.
         */
        private boolean enabled = true;
        @NotEmpty
        private String collectionName = "catalog_unique_keys";
    }

    @Data
    @Validated
    public static class MaintenanceProperties {
        /**
         * Whether the maintenance function may write repairs. Defaults to false, a repair request then only
         * reports what it would fix.
         */
        private boolean repairEnabled = false;
    }
}
