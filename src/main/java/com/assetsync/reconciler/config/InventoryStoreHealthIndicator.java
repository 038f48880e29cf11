package com.assetsync.reconciler.config;

import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import com.assetsync.reconciler.inventory.InventoryStoreClient;

import lombok.RequiredArgsConstructor;

/**
 * Spring Boot Actuator health indicator for the downstream inventory store.
 *
 * Reports DOWN when the store does not answer; sync runs will then abort
 * at snapshot load.
 */
@Component
@RequiredArgsConstructor
public class InventoryStoreHealthIndicator implements HealthIndicator {

    private final InventoryStoreClient inventoryStore;
    private final ReconcilerProperties properties;

    @Override
    public Health health() {
        if (inventoryStore.isAvailable()) {
            return Health.up()
                    .withDetail("inventory-store", "connected")
                    .withDetail("url", properties.getInventory().getApiUrl())
                    .build();
        }
        return Health.down()
                .withDetail("inventory-store", "unreachable")
                .withDetail("url", properties.getInventory().getApiUrl())
                .build();
    }
}
