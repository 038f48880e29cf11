package com.assetsync.reconciler.controller.api;

import java.util.List;
import java.util.Map;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import com.assetsync.reconciler.inventory.InventoryStoreClient;
import com.assetsync.reconciler.model.domain.IdentityKey;
import com.assetsync.reconciler.model.dto.AssetRecordView;
import com.assetsync.reconciler.model.dto.SyncOutcome;
import com.assetsync.reconciler.model.dto.SyncRunResponse;
import com.assetsync.reconciler.model.enums.SourceType;
import com.assetsync.reconciler.service.ReconciliationService;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * REST API for sync runs and reconciled assets.
 */
@RestController
@RequestMapping("/api/v1/reconciler")
@RequiredArgsConstructor
@Slf4j
@Tag(name = "Reconciliation", description = "APIs for feeding sources and inspecting reconciled assets")
public class ReconciliationController {

    private final ReconciliationService reconciliationService;
    private final InventoryStoreClient inventoryStore;

    @PostMapping("/sync/{source}")
    @Operation(summary = "Sync a source batch",
            description = "Adapt records in the source's native shape and reconcile them synchronously")
    @ApiResponse(responseCode = "200", description = "Batch processed, see per-record statuses")
    @ApiResponse(responseCode = "400", description = "Unknown source or unreadable records")
    @ApiResponse(responseCode = "503", description = "Batch aborted, inventory store unavailable")
    public ResponseEntity<SyncRunResponse> sync(
            @PathVariable String source,
            @RequestBody List<Map<String, Object>> records) {

        SourceType sourceType = SourceType.fromName(source);
        log.info("Received {} {} records", records.size(), sourceType);

        SyncOutcome outcome = reconciliationService.reconcileNative(sourceType, records);
        HttpStatus status = outcome.isAborted() ? HttpStatus.SERVICE_UNAVAILABLE : HttpStatus.OK;
        return ResponseEntity.status(status).body(SyncRunResponse.from(outcome));
    }

    @GetMapping("/assets/{identityKey}")
    @Operation(summary = "Get asset", description = "Look up the canonical record for an identity key such as serial:PF3ABC12")
    @ApiResponse(responseCode = "200", description = "Record found")
    @ApiResponse(responseCode = "404", description = "No record for this key")
    public ResponseEntity<AssetRecordView> getAsset(@PathVariable String identityKey) {
        IdentityKey key = IdentityKey.parse(identityKey);

        return inventoryStore.getByIdentity(key)
                .map(AssetRecordView::from)
                .map(ResponseEntity::ok)
                .orElse(ResponseEntity.notFound().build());
    }

    @GetMapping("/runs")
    @Operation(summary = "Last runs", description = "Last sync outcome per source")
    public ResponseEntity<List<SyncRunResponse>> getRuns() {
        List<SyncRunResponse> runs = reconciliationService.getLastOutcomes().values().stream()
                .map(SyncRunResponse::from)
                .toList();
        return ResponseEntity.ok(runs);
    }

    @PostMapping("/runs")
    @Operation(summary = "Run all sources", description = "Ingest every pullable source in the configured order")
    public ResponseEntity<List<SyncRunResponse>> runAll() {
        List<SyncRunResponse> runs = reconciliationService.runAll().values().stream()
                .map(SyncRunResponse::from)
                .toList();
        return ResponseEntity.ok(runs);
    }

    @PostMapping("/runs/cancel")
    @Operation(summary = "Cancel run", description = "Stop starting new inventory writes in the running batch")
    @ApiResponse(responseCode = "202", description = "Cancellation requested")
    public ResponseEntity<Map<String, String>> cancel() {
        reconciliationService.cancel();
        return ResponseEntity.accepted().body(Map.of("status", "CANCEL_REQUESTED"));
    }
}
