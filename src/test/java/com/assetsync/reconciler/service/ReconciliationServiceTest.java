package com.assetsync.reconciler.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.AdditionalAnswers.delegatesTo;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import com.assetsync.reconciler.adapter.MdmSourceAdapter;
import com.assetsync.reconciler.adapter.SourceCollaborator;
import com.assetsync.reconciler.exception.AcquisitionException;
import com.assetsync.reconciler.model.domain.CanonicalAssetRecord;
import com.assetsync.reconciler.model.dto.RecordOutcome;
import com.assetsync.reconciler.model.dto.SyncOutcome;
import com.assetsync.reconciler.model.enums.AssetCategory;
import com.assetsync.reconciler.model.enums.ClassificationPath;
import com.assetsync.reconciler.model.enums.FieldType;
import com.assetsync.reconciler.model.enums.RecordStatus;
import com.assetsync.reconciler.model.enums.SourceType;
import com.assetsync.reconciler.rules.FieldDictionary;

class ReconciliationServiceTest {

    private ReconcilerFixture fixture = new ReconcilerFixture();

    @AfterEach
    void tearDown() {
        fixture.close();
    }

    private static Map<String, Object> mdmDevice(String serial, String model) {
        Map<String, Object> device = new LinkedHashMap<>();
        device.put("deviceName", "LT-" + serial);
        device.put("serialNumber", serial);
        device.put("manufacturer", "Lenovo");
        device.put("model", model);
        device.put("operatingSystem", "Windows");
        return device;
    }

    private static SourceCollaborator collaborator(SourceType source, List<Map<String, Object>> records) {
        return new SourceCollaborator() {
            @Override
            public SourceType getSourceType() {
                return source;
            }

            @Override
            public List<Map<String, Object>> fetchSince(Instant since) {
                return records;
            }
        };
    }

    @Nested
    @DisplayName("reconcileNative")
    class ReconcileNative {

        @Test
        void createsThenSkipsOnIdenticalRerun() {
            List<Map<String, Object>> batch = List.of(
                    mdmDevice("PF1AAA", "ThinkPad T14"),
                    mdmDevice("PF2BBB", "ThinkCentre M70q"));

            SyncOutcome first = fixture.service.reconcileNative(SourceType.MDM, batch);
            SyncOutcome second = fixture.service.reconcileNative(SourceType.MDM, batch);

            assertThat(first.toResult().created()).isEqualTo(2);
            assertThat(second.toResult().skipped()).isEqualTo(2);
            assertThat(second.toResult().processed()).isEqualTo(2);
            assertThat(fixture.store.createCount()).isEqualTo(2);
            assertThat(fixture.store.updateCount()).isZero();

            CanonicalAssetRecord laptop = fixture.store.get("serial:PF1AAA");
            assertThat(laptop.getCategory()).isEqualTo(AssetCategory.LAPTOP);
            assertThat(laptop.getName()).isEqualTo("LT-PF1AAA");
            assertThat(fixture.store.get("serial:PF2BBB").getCategory()).isEqualTo(AssetCategory.DESKTOP);
        }

        @Test
        @DisplayName("a static override sets name, location and category")
        void staticOverride() {
            Map<String, Object> host = new LinkedHashMap<>();
            host.put("ip", "192.168.1.1");
            host.put("hostname", "unknown-host");
            host.put("vendor", "Cisco Meraki");

            SyncOutcome outcome = fixture.service.reconcileNative(SourceType.SCAN, List.of(host));

            assertThat(outcome.getCreated()).isEqualTo(1);
            CanonicalAssetRecord gateway = fixture.store.get("static:192.168.1.1");
            assertThat(gateway.getName()).isEqualTo("Meraki MX85 Gateway");
            assertThat(gateway.getLocation()).isEqualTo("Glostrup");
            assertThat(gateway.getPlacement()).isEqualTo("Server Room");
            assertThat(gateway.getCategory()).isEqualTo(AssetCategory.FIREWALL);
            assertThat(gateway.getClassificationPath()).isEqualTo(ClassificationPath.STATIC_OVERRIDE);
        }

        @Test
        @DisplayName("a repeated device merges onto its earlier occurrence, not the stored record")
        void repeatedDeviceKeepsFresherValue() {
            Map<String, Object> seen = mdmDevice("PF1AAA", "ThinkPad T14");
            seen.put("osVersion", "14.2");
            fixture.service.reconcileNative(SourceType.MDM, List.of(seen));

            Map<String, Object> upgraded = mdmDevice("PF1AAA", "ThinkPad T14");
            upgraded.put("osVersion", "15.0");
            Map<String, Object> partial = mdmDevice("PF1AAA", "ThinkPad T14");

            SyncOutcome outcome = fixture.service.reconcileNative(SourceType.MDM, List.of(upgraded, partial));

            assertThat(outcome.getUpdated()).isEqualTo(1);
            assertThat(outcome.getSkipped()).isZero();
            assertThat(fixture.store.get("serial:PF1AAA").fieldValue("os_version")).isEqualTo("15.0");
        }

        @Test
        void unreadableRecordRejectsBatch() {
            List<Map<String, Object>> batch = new ArrayList<>();
            batch.add(mdmDevice("PF1AAA", "ThinkPad T14"));
            batch.add(null);

            assertThatThrownBy(() -> fixture.service.reconcileNative(SourceType.MDM, batch))
                    .isInstanceOf(AcquisitionException.class);
            assertThat(fixture.store.size()).isZero();
        }
    }

    @Nested
    @DisplayName("failure isolation")
    class Failures {

        @Test
        @DisplayName("an unreadable inventory aborts the batch before any write")
        void snapshotUnavailable() {
            fixture.store.failGetAll(true);

            SyncOutcome outcome = fixture.service.reconcileNative(SourceType.MDM,
                    List.of(mdmDevice("PF1AAA", "ThinkPad T14")));

            assertThat(outcome.isAborted()).isTrue();
            assertThat(outcome.getError()).startsWith("inventory snapshot unavailable");
            assertThat(outcome.toResult().processed()).isZero();
            assertThat(fixture.service.getLastOutcomes()).containsEntry(SourceType.MDM, outcome);
        }

        @Test
        @DisplayName("a value that does not fit its field fails only that record")
        void mergeConflict() {
            fixture.close();
            fixture = new ReconcilerFixture(new FieldDictionary(Map.of("total_storage", FieldType.NUMBER)));

            Map<String, Object> bad = mdmDevice("PF1AAA", "ThinkPad T14");
            bad.put("totalStorageSpaceInBytes", "lots");
            Map<String, Object> good = mdmDevice("PF2BBB", "ThinkPad X1");
            good.put("totalStorageSpaceInBytes", 256000000000L);

            SyncOutcome outcome = fixture.service.reconcileNative(SourceType.MDM, List.of(bad, good));

            assertThat(outcome.isAborted()).isFalse();
            assertThat(outcome.recordsWithStatus(RecordStatus.FAILED))
                    .singleElement()
                    .extracting(RecordOutcome::identityKey)
                    .isEqualTo("serial:PF1AAA");
            assertThat(outcome.getCreated()).isEqualTo(1);
            assertThat(fixture.store.get("serial:PF2BBB").fieldValue("total_storage")).isEqualTo("256000000000");
        }

        @Test
        @DisplayName("a record whose identity cannot be resolved fails alone")
        void identityFailure() {
            IdentityResolver resolver = mock(IdentityResolver.class, delegatesTo(fixture.identityResolver));
            doThrow(new IllegalStateException("resolver broke"))
                    .when(resolver).resolve(argThat(record -> record != null && "PF1AAA".equals(record.getSerial())));
            ReconciliationService service = new ReconciliationService(resolver, fixture.categorizationEngine,
                    fixture.mergeResolver, fixture.decisionEngine, fixture.store, Map.of(SourceType.MDM,
                            new MdmSourceAdapter()), fixture.collaborators, fixture.properties, fixture.clock);

            SyncOutcome outcome = service.reconcileNative(SourceType.MDM, List.of(
                    mdmDevice("PF1AAA", "ThinkPad T14"),
                    mdmDevice("PF2BBB", "ThinkPad X1")));

            assertThat(outcome.isAborted()).isFalse();
            assertThat(outcome.recordsWithStatus(RecordStatus.FAILED))
                    .singleElement()
                    .satisfies(failed -> {
                        assertThat(failed.identityKey()).isEqualTo(ReconciliationService.UNRESOLVED_KEY);
                        assertThat(failed.detail()).contains("resolver broke");
                    });
            assertThat(outcome.getCreated()).isEqualTo(1);
        }

        @Test
        @DisplayName("a failed acquisition leaves the last success time untouched")
        void acquisitionFailure() {
            SourceCollaborator broken = new SourceCollaborator() {
                @Override
                public SourceType getSourceType() {
                    return SourceType.MDM;
                }

                @Override
                public List<Map<String, Object>> fetchSince(Instant since) {
                    throw new AcquisitionException("MDM token expired");
                }
            };

            SyncOutcome outcome = fixture.service.ingest(SourceType.MDM, broken);

            assertThat(outcome.isAborted()).isTrue();
            assertThat(outcome.getError()).isEqualTo("acquisition failed: MDM token expired");
            assertThat(fixture.service.getLastSuccess(SourceType.MDM)).isEmpty();
            assertThat(fixture.store.size()).isZero();
        }
    }

    @Nested
    @DisplayName("runAll")
    class RunAll {

        @Test
        @DisplayName("later sources in the configured order win on shared fields")
        void laterSourceWins() {
            Map<String, Object> poll = new LinkedHashMap<>();
            poll.put("ip", "10.0.0.50");
            poll.put("sysName", "LT-PF1AAA");
            poll.put("sysSerial", "PF1AAA");
            poll.put("model", "Legacy Model");

            fixture.collaborators.put(SourceType.SNMP, collaborator(SourceType.SNMP, List.of(poll)));
            fixture.collaborators.put(SourceType.MDM,
                    collaborator(SourceType.MDM, List.of(mdmDevice("PF1AAA", "ThinkPad T14"))));

            Map<SourceType, SyncOutcome> outcomes = fixture.service.runAll();

            assertThat(outcomes).containsOnlyKeys(SourceType.SNMP, SourceType.MDM);
            assertThat(outcomes.get(SourceType.SNMP).getCreated()).isEqualTo(1);
            assertThat(outcomes.get(SourceType.MDM).getUpdated()).isEqualTo(1);

            CanonicalAssetRecord merged = fixture.store.get("serial:PF1AAA");
            assertThat(merged.fieldValue(FieldDictionary.MODEL)).isEqualTo("ThinkPad T14");
            assertThat(merged.fieldValue(FieldDictionary.LAST_SEEN_IP)).isEqualTo("10.0.0.50");
            assertThat(merged.getFields().get(FieldDictionary.MODEL).source()).isEqualTo(SourceType.MDM);
            assertThat(merged.getCategory()).isEqualTo(AssetCategory.LAPTOP);
            assertThat(merged.getLastUpdateSource()).isEqualTo(SourceType.MDM);
            assertThat(fixture.store.size()).isEqualTo(1);

            assertThat(fixture.service.getLastSuccess(SourceType.SNMP)).contains(ReconcilerFixture.NOW);
            assertThat(fixture.service.getLastSuccess(SourceType.MDM)).contains(ReconcilerFixture.NOW);
        }

        @Test
        void sourcesWithoutCollaboratorAreSkipped() {
            assertThat(fixture.service.runAll()).isEmpty();
        }
    }
}
