package com.assetsync.reconciler.model.enums;

import java.util.Optional;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Closed set of device categories known to the inventory store.
 */
@Getter
@RequiredArgsConstructor
public enum AssetCategory {

    SERVER("Server", "Servers", "Generic Server"),
    SWITCH("Switch", "Switches", "Generic Switch"),
    ROUTER("Router", "Routers", "Generic Router"),
    FIREWALL("Firewall", "Firewalls", "Generic Firewall"),
    ACCESS_POINT("Access Point", "Access Points", "Generic Access Point"),
    PRINTER("Printer", "Printers", "Generic Printer"),
    LAPTOP("Laptop", "Laptops", "Generic Laptop"),
    DESKTOP("Desktop", "Desktops", "Generic Desktop"),
    TABLET("Tablet", "Tablets", "Generic Tablet"),
    MOBILE_PHONE("Mobile Phone", "Mobile Phones", "Generic Mobile Phone"),
    VIRTUAL_MACHINE("Virtual Machine", "Virtual Machines (On-Premises)", "Generic Virtual Machine"),
    IOT_DEVICE("IoT Device", "IoT Devices", "Generic IoT Device"),
    STORAGE_DEVICE("Storage Device", "Storage Devices", "Generic Storage Device"),

    /**
     * Fallback when no rule matches.
     */
    OTHER("Other Device", "Other Assets", "Generic Unknown Device");

    /**
     * Device type name as produced by classification
     */
    private final String deviceType;

    /**
     * Category name in the inventory store
     */
    private final String inventoryLabel;

    /**
     * Generic model used when the source reports no vendor model
     */
    private final String genericModelName;

    /**
     * Resolve a label from the static table or the store. Matches the device
     * type name, the inventory label or the constant name, ignoring case.
     */
    public static Optional<AssetCategory> fromLabel(String label) {
        if (label == null || label.isBlank()) {
            return Optional.empty();
        }
        String trimmed = label.trim();
        for (AssetCategory category : values()) {
            if (category.deviceType.equalsIgnoreCase(trimmed)
                    || category.inventoryLabel.equalsIgnoreCase(trimmed)
                    || category.name().equalsIgnoreCase(trimmed)) {
                return Optional.of(category);
            }
        }
        return Optional.empty();
    }
}
