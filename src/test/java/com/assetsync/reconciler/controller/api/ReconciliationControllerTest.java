package com.assetsync.reconciler.controller.api;

import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import java.time.Instant;
import java.util.Optional;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import com.assetsync.reconciler.exception.AcquisitionException;
import com.assetsync.reconciler.exception.InventoryStoreException;
import com.assetsync.reconciler.inventory.InventoryStoreClient;
import com.assetsync.reconciler.model.domain.CanonicalAssetRecord;
import com.assetsync.reconciler.model.domain.IdentityKey;
import com.assetsync.reconciler.model.dto.RecordOutcome;
import com.assetsync.reconciler.model.dto.SyncOutcome;
import com.assetsync.reconciler.model.enums.AssetCategory;
import com.assetsync.reconciler.model.enums.ClassificationPath;
import com.assetsync.reconciler.model.enums.IdentityBasis;
import com.assetsync.reconciler.model.enums.RecordStatus;
import com.assetsync.reconciler.model.enums.SourceType;
import com.assetsync.reconciler.service.ReconciliationService;

class ReconciliationControllerTest {

    private static final Instant STARTED = Instant.parse("2026-02-01T08:00:00Z");
    private static final String BATCH = "[{\"serialNumber\":\"PF3ABC12\",\"model\":\"ThinkPad T14\"}]";

    private ReconciliationService reconciliationService;
    private InventoryStoreClient inventoryStore;
    private MockMvc mvc;

    @BeforeEach
    void setUp() {
        reconciliationService = mock(ReconciliationService.class);
        inventoryStore = mock(InventoryStoreClient.class);
        mvc = MockMvcBuilders
                .standaloneSetup(new ReconciliationController(reconciliationService, inventoryStore))
                .setControllerAdvice(new ApiExceptionHandler())
                .build();
    }

    @Nested
    @DisplayName("POST /sync/{source}")
    class Sync {

        @Test
        void returnsPerRecordStatuses() throws Exception {
            SyncOutcome outcome = new SyncOutcome(SourceType.MDM, STARTED);
            outcome.record(RecordOutcome.of("serial:PF3ABC12", RecordStatus.CREATED, 17L));
            outcome.complete(STARTED);
            when(reconciliationService.reconcileNative(eq(SourceType.MDM), anyList())).thenReturn(outcome);

            mvc.perform(post("/api/v1/reconciler/sync/mdm")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content(BATCH))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.source").value("MDM"))
                    .andExpect(jsonPath("$.result.created").value(1))
                    .andExpect(jsonPath("$.records[0].identityKey").value("serial:PF3ABC12"))
                    .andExpect(jsonPath("$.records[0].inventoryId").value(17));
        }

        @Test
        void abortedBatchIsServiceUnavailable() throws Exception {
            SyncOutcome outcome = SyncOutcome.aborted(SourceType.MDM, STARTED, "inventory snapshot unavailable: timeout");
            when(reconciliationService.reconcileNative(eq(SourceType.MDM), anyList())).thenReturn(outcome);

            mvc.perform(post("/api/v1/reconciler/sync/MDM")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content(BATCH))
                    .andExpect(status().isServiceUnavailable())
                    .andExpect(jsonPath("$.error").value("inventory snapshot unavailable: timeout"));
        }

        @Test
        void unknownSourceIsBadRequest() throws Exception {
            mvc.perform(post("/api/v1/reconciler/sync/fax")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content(BATCH))
                    .andExpect(status().isBadRequest())
                    .andExpect(jsonPath("$.code").value("UNKNOWN_SOURCE"))
                    .andExpect(jsonPath("$.message").value("Unknown source: fax"));
        }

        @Test
        void unreadableRecordsAreBadRequest() throws Exception {
            when(reconciliationService.reconcileNative(eq(SourceType.SNMP), anyList()))
                    .thenThrow(new AcquisitionException("SNMP record #0 is null"));

            mvc.perform(post("/api/v1/reconciler/sync/snmp")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("[null]"))
                    .andExpect(status().isBadRequest())
                    .andExpect(jsonPath("$.code").value("UNREADABLE_SOURCE_DATA"));
        }
    }

    @Nested
    @DisplayName("GET /assets/{identityKey}")
    class Assets {

        @Test
        void returnsStoredRecord() throws Exception {
            CanonicalAssetRecord record = CanonicalAssetRecord.builder()
                    .identityKey(new IdentityKey(IdentityBasis.SERIAL, "PF3ABC12"))
                    .inventoryId(17L)
                    .category(AssetCategory.LAPTOP)
                    .classificationPath(ClassificationPath.RULE_BASED)
                    .name("LT-ANNA")
                    .lastUpdateSource(SourceType.MDM)
                    .build();
            when(inventoryStore.getByIdentity(new IdentityKey(IdentityBasis.SERIAL, "PF3ABC12")))
                    .thenReturn(Optional.of(record));

            mvc.perform(get("/api/v1/reconciler/assets/serial:PF3ABC12"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.category").value("Laptops"))
                    .andExpect(jsonPath("$.name").value("LT-ANNA"))
                    .andExpect(jsonPath("$.lastUpdateSource").value("MDM"));
        }

        @Test
        void unknownKeyIsNotFound() throws Exception {
            when(inventoryStore.getByIdentity(new IdentityKey(IdentityBasis.MAC, "AA:BB:CC:DD:EE:FF")))
                    .thenReturn(Optional.empty());

            mvc.perform(get("/api/v1/reconciler/assets/mac:AA:BB:CC:DD:EE:FF"))
                    .andExpect(status().isNotFound());
        }

        @Test
        void malformedKeyIsBadRequest() throws Exception {
            mvc.perform(get("/api/v1/reconciler/assets/PF3ABC12"))
                    .andExpect(status().isBadRequest())
                    .andExpect(jsonPath("$.code").value("BAD_REQUEST"));
        }

        @Test
        void storeFailureIsBadGateway() throws Exception {
            when(inventoryStore.getByIdentity(new IdentityKey(IdentityBasis.SERIAL, "X1")))
                    .thenThrow(new InventoryStoreException("connection refused"));

            mvc.perform(get("/api/v1/reconciler/assets/serial:X1"))
                    .andExpect(status().isBadGateway())
                    .andExpect(jsonPath("$.code").value("INVENTORY_STORE_ERROR"));
        }
    }

    @Test
    void cancelIsAccepted() throws Exception {
        mvc.perform(post("/api/v1/reconciler/runs/cancel"))
                .andExpect(status().isAccepted())
                .andExpect(jsonPath("$.status").value("CANCEL_REQUESTED"));

        verify(reconciliationService).cancel();
    }
}
