package dev.devanks.solarcrm.catalog.function;

import com.google.common.annotations.VisibleForTesting;
import dev.devanks.solarcrm.catalog.service.CatalogMaintenanceService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.function.Function;

@Service
@RequiredArgsConstructor
@Slf4j
public class CatalogMaintenanceFunction {

    static final String ACTION = "action";
    static final String VALIDATE = "validate";
    static final String REPAIR = "repair";

    private final CatalogMaintenanceService maintenanceService;

    /**
     * Main function bean: catalogMaintenance. Payload {@code {"action": "validate" | "repair"}}, validate by
     * default.
     */
    @Bean
    public Function<HashMap<String, Object>, String> catalogMaintenance() {
        return payload -> {
            log.info("catalogMaintenance function triggered with payload: {}", payload);
            return runAction(payload).block();
        };
    }

    @VisibleForTesting
    Mono<String> runAction(Map<String, Object> payload) {
        String action = resolveAction(payload);
        switch (action) {
            case VALIDATE:
                return maintenanceService.validateCatalog();
            case REPAIR:
                return maintenanceService.repairCatalog();
            default:
                log.error("Unknown catalog maintenance action '{}' in payload: {}", action, payload);
                return Mono.just("Error: Unknown action '" + action + "'. Use 'validate' or 'repair'.");
        }
    }

    private static String resolveAction(Map<String, Object> payload) {
        if (payload == null || payload.get(ACTION) == null) {
            return VALIDATE;
        }
        return String.valueOf(payload.get(ACTION)).trim().toLowerCase(Locale.ROOT);
    }
}
