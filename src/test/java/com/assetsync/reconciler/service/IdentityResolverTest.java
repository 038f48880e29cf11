package com.assetsync.reconciler.service;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import com.assetsync.reconciler.model.domain.IdentityKey;
import com.assetsync.reconciler.model.domain.RawDeviceRecord;
import com.assetsync.reconciler.model.domain.ResolvedIdentity;
import com.assetsync.reconciler.model.domain.StaticOverride;
import com.assetsync.reconciler.model.enums.AssetCategory;
import com.assetsync.reconciler.model.enums.IdentityBasis;
import com.assetsync.reconciler.model.enums.SourceType;
import com.assetsync.reconciler.rules.StaticOverrideTable;

class IdentityResolverTest {

    private IdentityResolver resolver;

    @BeforeEach
    void setUp() {
        resolver = new IdentityResolver(new StaticOverrideTable(List.of(StaticOverride.builder()
                .ip("192.168.1.181")
                .deviceType("Server")
                .category(AssetCategory.SERVER)
                .name("DC03")
                .build())));
    }

    private static RawDeviceRecord.RawDeviceRecordBuilder record(SourceType source) {
        return RawDeviceRecord.builder().source(source);
    }

    @Nested
    @DisplayName("Precedence")
    class Precedence {

        @Test
        @DisplayName("static override beats every other hint")
        void staticOverrideFirst() {
            ResolvedIdentity identity = resolver.resolve(record(SourceType.SCAN)
                    .ip("192.168.1.181").deviceId("abc").serial("SN1").mac("aa:bb:cc:dd:ee:ff")
                    .build());

            assertThat(identity.key()).isEqualTo(new IdentityKey(IdentityBasis.STATIC_OVERRIDE, "192.168.1.181"));
            assertThat(identity.isStaticOverride()).isTrue();
            assertThat(identity.staticOverride().getName()).isEqualTo("DC03");
        }

        @Test
        void deviceIdBeforeSerial() {
            ResolvedIdentity identity = resolver.resolve(record(SourceType.MDM)
                    .deviceId("4F2A-11").serial("PF3ABC12").build());

            assertThat(identity.key().toString()).isEqualTo("device:4f2a-11");
            assertThat(identity.isStaticOverride()).isFalse();
        }

        @Test
        void serialBeforeMac() {
            ResolvedIdentity identity = resolver.resolve(record(SourceType.SNMP)
                    .serial(" pf3abc12 ").mac("aa:bb:cc:dd:ee:ff").ip("10.0.0.5").build());

            assertThat(identity.key().toString()).isEqualTo("serial:PF3ABC12");
        }

        @Test
        void macBeforeIp() {
            ResolvedIdentity identity = resolver.resolve(record(SourceType.SCAN)
                    .mac("aa-bb-cc-dd-ee-ff").ip("10.0.0.5").build());

            assertThat(identity.key().toString()).isEqualTo("mac:AA:BB:CC:DD:EE:FF");
        }

        @Test
        void ipWhenNothingBetter() {
            ResolvedIdentity identity = resolver.resolve(record(SourceType.SCAN)
                    .mac("not-a-mac").ip("10.0.0.5").build());

            assertThat(identity.key().toString()).isEqualTo("ip:10.0.0.5");
        }
    }

    @Nested
    @DisplayName("Serial placeholders")
    class SerialPlaceholders {

        @ParameterizedTest
        @ValueSource(strings = {"Unknown", "0", "None", "N/A", "Default string", "To Be Filled By O.E.M."})
        void placeholderSerialIsIgnored(String serial) {
            ResolvedIdentity identity = resolver.resolve(record(SourceType.SNMP)
                    .serial(serial).ip("10.0.0.7").build());

            assertThat(identity.key().basis()).isEqualTo(IdentityBasis.IP);
        }
    }

    @Test
    @DisplayName("the same device seen by two sources resolves to one key")
    void sameMacDifferentNotation() {
        IdentityKey fromScan = resolver.resolve(record(SourceType.SCAN).mac("aabb.ccdd.eeff").build()).key();
        IdentityKey fromSnmp = resolver.resolve(record(SourceType.SNMP).mac("AA:BB:CC:DD:EE:FF").build()).key();

        assertThat(fromScan).isEqualTo(fromSnmp);
    }

    @Nested
    @DisplayName("Hostname fallback")
    class HostnameFallback {

        @Test
        void shortHostnameQualifiedBySource() {
            ResolvedIdentity identity = resolver.resolve(record(SourceType.SCAN)
                    .hostname("Laptop-01.corp.example.com").build());

            assertThat(identity.key().toString()).isEqualTo("hostname:scan:laptop-01");
            assertThat(identity.key().isLowConfidence()).isTrue();
        }

        @Test
        void usesNameAttributeWithoutHostname() {
            ResolvedIdentity identity = resolver.resolve(record(SourceType.MDM)
                    .attribute(RawDeviceRecord.NAME, "Reception PC").build());

            assertThat(identity.key().toString()).isEqualTo("hostname:mdm:reception-pc");
        }

        @Test
        @DisplayName("a record with no usable hint still gets a stable key")
        void anonymousKeyIsStable() {
            RawDeviceRecord bare = record(SourceType.SCAN)
                    .hostname("unknown")
                    .attribute("os_platform", "Linux")
                    .build();

            IdentityKey first = resolver.resolve(bare).key();
            IdentityKey second = resolver.resolve(bare.toBuilder().build()).key();

            assertThat(first.value()).startsWith("scan:anon-");
            assertThat(first).isEqualTo(second);
        }
    }

    @Test
    void placeholderNames() {
        assertThat(IdentityResolver.isPlaceholderName("Device-10.0.0.5")).isTrue();
        assertThat(IdentityResolver.isPlaceholderName("_gateway")).isTrue();
        assertThat(IdentityResolver.isPlaceholderName("ab")).isTrue();
        assertThat(IdentityResolver.isPlaceholderName(null)).isTrue();
        assertThat(IdentityResolver.isPlaceholderName("core-sw-01")).isFalse();
    }
}
