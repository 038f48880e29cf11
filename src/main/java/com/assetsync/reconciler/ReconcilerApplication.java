package com.assetsync.reconciler;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;

import com.assetsync.reconciler.config.ReconcilerProperties;

/**
 * Asset Reconciler - multi-source asset inventory synchronization.
 *
 * Device records from MDM, SNMP polling, network scans and a static table are
 * resolved to one identity each, categorized, merged field by field and
 * written to the inventory store as one canonical record per device.
 */
@SpringBootApplication
@EnableConfigurationProperties(ReconcilerProperties.class)
@EnableScheduling
public class ReconcilerApplication {

    public static void main(String[] args) {
        SpringApplication.run(ReconcilerApplication.class, args);
    }
}
