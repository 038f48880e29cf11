package com.assetsync.reconciler.service;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import com.assetsync.reconciler.model.domain.Classification;
import com.assetsync.reconciler.model.domain.RawDeviceRecord;
import com.assetsync.reconciler.model.domain.StaticOverride;
import com.assetsync.reconciler.model.enums.AssetCategory;
import com.assetsync.reconciler.model.enums.ClassificationPath;
import com.assetsync.reconciler.model.enums.SourceType;
import com.assetsync.reconciler.rules.CategorizationRules;
import com.assetsync.reconciler.rules.DeviceFacts;
import com.assetsync.reconciler.rules.StaticOverrideTable;

class CategorizationEngineTest {

    private CategorizationEngine engine;
    private IdentityResolver resolver;

    @BeforeEach
    void setUp() {
        engine = new CategorizationEngine(CategorizationRules.defaults());
        resolver = new IdentityResolver(new StaticOverrideTable(List.of(StaticOverride.builder()
                .ip("192.168.1.1")
                .deviceType("Firewall")
                .category(AssetCategory.FIREWALL)
                .name("Meraki MX85 Gateway")
                .location("Glostrup")
                .placement("Server Room")
                .build())));
    }

    private Classification classify(RawDeviceRecord record) {
        return engine.classify(record, resolver.resolve(record));
    }

    private static RawDeviceRecord device(String vendor, String model, String os) {
        RawDeviceRecord.RawDeviceRecordBuilder builder = RawDeviceRecord.builder()
                .source(SourceType.MDM)
                .serial("SN-" + Math.abs((vendor + model + os).hashCode()));
        if (vendor != null) builder.attribute(RawDeviceRecord.MANUFACTURER, vendor);
        if (model != null) builder.attribute(RawDeviceRecord.MODEL, model);
        if (os != null) builder.attribute(RawDeviceRecord.OS_PLATFORM, os);
        return builder.build();
    }

    @Nested
    @DisplayName("Rule table")
    class RuleTable {

        @ParameterizedTest(name = "{0} / {1} / {2} -> {3}")
        @CsvSource({
                "Lenovo,          ThinkPad T14 Gen 3,       Windows,             LAPTOP",
                "Lenovo,          10ABC123,                 Windows,             DESKTOP",
                "Lenovo,          20XW004KMX,               Windows,             LAPTOP",
                "Samsung,         Galaxy Tab S8,            Android,             TABLET",
                "Google,          Pixel 8,                  Android,             MOBILE_PHONE",
                "Yealink,         MeetingBar A30,           Android,             IOT_DEVICE",
                "Apple,           iPad Pro (11\"),          iPadOS,              TABLET",
                "Apple,           iPhone 14,                iOS,                 MOBILE_PHONE",
                "Apple,           MacBook Air,              macOS,               LAPTOP",
                "Apple,           iMac 24,                  macOS,               DESKTOP",
                "Dell Inc.,       PowerEdge R740,           Windows Server 2022, SERVER",
                "'VMware, Inc.',  VMware Virtual Platform,  Windows Server 2019, VIRTUAL_MACHINE",
                "Cisco Meraki,    MX85,                     '',                  FIREWALL",
                "Aruba,           2930F Switch,             '',                  SWITCH",
                "Cisco,           ISR4331 Router,           '',                  ROUTER",
                "Ubiquiti,        UniFi U6 Pro,             '',                  ACCESS_POINT",
                "Microsoft Corporation, Surface Laptop 5,   Windows,             LAPTOP",
                "Dell Inc.,       OptiPlex 7090,            Windows,             LAPTOP",
        })
        void classifiesByFirstMatchingRule(String vendor, String model, String os, AssetCategory expected) {
            Classification classification = classify(device(vendor, model, os));

            assertThat(classification.category()).isEqualTo(expected);
            assertThat(classification.path()).isEqualTo(ClassificationPath.RULE_BASED);
        }

        @Test
        @DisplayName("printer is recognized from open services")
        void printerByServices() {
            Classification classification = engine.classify(new DeviceFacts("hp", "", "", "ipp, jetdirect"));

            assertThat(classification.category()).isEqualTo(AssetCategory.PRINTER);
        }

        @ParameterizedTest(name = "{0} -> {1}")
        @CsvSource({
                "'domain, ldap, kerberos',   SERVER",
                "'domain',                   OTHER",
                "'mysql',                    SERVER",
                "'ssh, postgresql',          SERVER",
                "'mongodb',                  SERVER",
                "'ldap, ipp',                PRINTER",
                "'domain, ldap, jetdirect',  SERVER",
                "'mssql, nfs',               SERVER",
        })
        void classifiesByOpenServices(String services, AssetCategory expected) {
            Classification classification = engine.classify(new DeviceFacts("", "", "linux", services));

            assertThat(classification.category()).isEqualTo(expected);
        }

        @ParameterizedTest(name = "{0} / {1} -> {2}")
        @CsvSource({
                "Cisco,  Cisco IOS,          OTHER",
                "'',     Cisco IOS XE 17.9,  OTHER",
                "'',     Phoenix BIOS,       OTHER",
                "Apple,  iOS 17.2,           MOBILE_PHONE",
        })
        @DisplayName("iOS must be a whole word and not Cisco's router OS")
        void iosNeedsWholeWordAndNoCisco(String vendor, String os, AssetCategory expected) {
            assertThat(classify(device(vendor, null, os)).category()).isEqualTo(expected);
        }

        @Test
        void storageByServices() {
            Classification classification = engine.classify(new DeviceFacts("synology", "ds920+", "linux", "smb, nfs"));

            assertThat(classification.category()).isEqualTo(AssetCategory.STORAGE_DEVICE);
        }

        @Test
        @DisplayName("network rules need vendor and model together")
        void networkNeedsBoth() {
            assertThat(classify(device("Acme", "Firewall 9000", null)).category()).isEqualTo(AssetCategory.OTHER);
        }
    }

    @Nested
    @DisplayName("Fallback")
    class Fallback {

        @Test
        void nothingMatchingIsOther() {
            Classification classification = classify(device("Acme", "Widget", null));

            assertThat(classification.category()).isEqualTo(AssetCategory.OTHER);
            assertThat(classification.path()).isEqualTo(ClassificationPath.FALLBACK);
        }

        @Test
        void emptyRecordIsOther() {
            RawDeviceRecord empty = RawDeviceRecord.builder().source(SourceType.SCAN).ip("10.9.9.9").build();

            assertThat(classify(empty)).isEqualTo(Classification.fallback());
        }
    }

    @Nested
    @DisplayName("Static override")
    class StaticOverrides {

        @Test
        @DisplayName("override decides regardless of reported vendor")
        void overrideWins() {
            RawDeviceRecord record = RawDeviceRecord.builder()
                    .source(SourceType.SCAN)
                    .ip("192.168.1.1")
                    .attribute(RawDeviceRecord.MANUFACTURER, "Generic")
                    .attribute(RawDeviceRecord.OS_PLATFORM, "Windows")
                    .build();

            Classification classification = classify(record);

            assertThat(classification.category()).isEqualTo(AssetCategory.FIREWALL);
            assertThat(classification.path()).isEqualTo(ClassificationPath.STATIC_OVERRIDE);
        }
    }
}
