package com.assetsync.reconciler.adapter;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;

import com.assetsync.reconciler.model.domain.RawDeviceRecord;
import com.assetsync.reconciler.model.domain.StaticOverride;
import com.assetsync.reconciler.model.enums.AssetCategory;
import com.assetsync.reconciler.model.enums.SourceType;
import com.assetsync.reconciler.rules.StaticOverrideTable;

class StaticTableCollaboratorTest {

    private final StaticOverrideTable table = new StaticOverrideTable(List.of(
            StaticOverride.builder()
                    .ip("192.168.1.181")
                    .deviceType("Server")
                    .category(AssetCategory.SERVER)
                    .name("DC03")
                    .services("domain, ldap")
                    .build()));

    @Test
    void everyEntryIsFetchedAndAdapted() {
        StaticTableCollaborator collaborator = new StaticTableCollaborator(table);

        List<Map<String, Object>> entries = collaborator.fetchSince(Instant.now());
        List<RawDeviceRecord> records = new StaticSourceAdapter().adapt(entries, Instant.EPOCH);

        assertThat(collaborator.getSourceType()).isEqualTo(SourceType.STATIC);
        assertThat(records).singleElement().satisfies(record -> {
            assertThat(record.getSource()).isEqualTo(SourceType.STATIC);
            assertThat(record.getIp()).isEqualTo("192.168.1.181");
            assertThat(record.text(RawDeviceRecord.NAME)).isEqualTo("DC03");
            assertThat(record.text(RawDeviceRecord.SERVICES)).isEqualTo("domain, ldap");
        });
    }
}
