package com.assetsync.reconciler.inventory;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import com.assetsync.reconciler.config.ReconcilerProperties;
import com.assetsync.reconciler.exception.InventoryStoreException;
import com.assetsync.reconciler.model.domain.CanonicalAssetRecord;
import com.assetsync.reconciler.model.domain.IdentityKey;

import lombok.extern.slf4j.Slf4j;

/**
 * REST client for the inventory store.
 *
 * List responses are expected as {@code {"total": n, "rows": [...]}}, write
 * responses as {@code {"status": "success", "payload": {"id": n}}}.
 */
@Component
@Slf4j
public class HttpInventoryStoreClient implements InventoryStoreClient {

    private static final ParameterizedTypeReference<Map<String, Object>> JSON_MAP =
            new ParameterizedTypeReference<>() {};
    private static final Duration HEALTH_TIMEOUT = Duration.ofSeconds(5);

    private final WebClient webClient;
    private final String assetsPath;
    private final Duration readTimeout;
    private final InventoryCache cache;

    public HttpInventoryStoreClient(
            WebClient.Builder webClientBuilder,
            ReconcilerProperties properties,
            Clock reconcilerClock) {

        ReconcilerProperties.InventoryConfig config = properties.getInventory();
        this.assetsPath = config.getAssetsPath();
        this.readTimeout = Duration.ofSeconds(config.getReadTimeout());
        this.cache = new InventoryCache(Duration.ofSeconds(config.getCacheTtlSeconds()), reconcilerClock);

        WebClient.Builder builder = webClientBuilder
                .baseUrl(config.getApiUrl())
                .defaultHeader(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                .defaultHeader(HttpHeaders.ACCEPT, MediaType.APPLICATION_JSON_VALUE);

        if (config.getApiToken() != null && !config.getApiToken().isBlank()) {
            builder.defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + config.getApiToken());
        }

        this.webClient = builder.build();

        log.info("INVENTORY: Initialized - store URL: {}{}", config.getApiUrl(), assetsPath);
    }

    @Override
    public List<CanonicalAssetRecord> getAll() {
        return cache.get(this::fetchAll);
    }

    @Override
    public Optional<CanonicalAssetRecord> getByIdentity(IdentityKey key) {
        try {
            Map<String, Object> response = webClient.get()
                    .uri(assetsPath + "/by-identity/{key}", key.toString())
                    .retrieve()
                    .bodyToMono(JSON_MAP)
                    .block(readTimeout);

            if (response == null || response.isEmpty()) {
                return Optional.empty();
            }
            return Optional.of(InventoryRecordMapper.fromPayload(response));

        } catch (WebClientResponseException e) {
            if (e.getStatusCode().value() == HttpStatus.NOT_FOUND.value()) {
                return Optional.empty();
            }
            throw new InventoryStoreException(
                    "HTTP " + e.getStatusCode().value() + " looking up " + key, e);
        } catch (InventoryStoreException e) {
            throw e;
        } catch (Exception e) {
            throw new InventoryStoreException("Lookup of " + key + " failed: " + e.getMessage(), e);
        }
    }

    @Override
    public long create(CanonicalAssetRecord record) {
        try {
            Map<String, Object> response = webClient.post()
                    .uri(assetsPath)
                    .bodyValue(InventoryRecordMapper.toPayload(record))
                    .retrieve()
                    .bodyToMono(JSON_MAP)
                    .block(readTimeout);

            long id = extractId(response, record.getIdentityKey());
            log.debug("INVENTORY: Created {} as #{}", record.getIdentityKey(), id);
            return id;

        } catch (WebClientResponseException e) {
            throw new InventoryStoreException(
                    "HTTP " + e.getStatusCode().value() + " creating " + record.getIdentityKey(), e);
        } catch (InventoryStoreException e) {
            throw e;
        } catch (Exception e) {
            throw new InventoryStoreException(
                    "Create of " + record.getIdentityKey() + " failed: " + e.getMessage(), e);
        } finally {
            cache.invalidate();
        }
    }

    @Override
    public void update(long inventoryId, CanonicalAssetRecord record) {
        try {
            Map<String, Object> response = webClient.patch()
                    .uri(assetsPath + "/{id}", inventoryId)
                    .bodyValue(InventoryRecordMapper.toPayload(record))
                    .retrieve()
                    .bodyToMono(JSON_MAP)
                    .block(readTimeout);

            checkStatus(response, record.getIdentityKey());
            log.debug("INVENTORY: Updated #{} ({})", inventoryId, record.getIdentityKey());

        } catch (WebClientResponseException e) {
            throw new InventoryStoreException(
                    "HTTP " + e.getStatusCode().value() + " updating #" + inventoryId, e);
        } catch (InventoryStoreException e) {
            throw e;
        } catch (Exception e) {
            throw new InventoryStoreException("Update of #" + inventoryId + " failed: " + e.getMessage(), e);
        } finally {
            cache.invalidate();
        }
    }

    @Override
    public boolean isAvailable() {
        try {
            webClient.get()
                    .uri(uriBuilder -> uriBuilder.path(assetsPath).queryParam("limit", 1).build())
                    .retrieve()
                    .toBodilessEntity()
                    .block(HEALTH_TIMEOUT);
            return true;
        } catch (Exception e) {
            log.debug("INVENTORY: Health check failed: {}", e.getMessage());
            return false;
        }
    }

    @SuppressWarnings("unchecked")
    private List<CanonicalAssetRecord> fetchAll() {
        try {
            Map<String, Object> response = webClient.get()
                    .uri(assetsPath)
                    .retrieve()
                    .bodyToMono(JSON_MAP)
                    .block(readTimeout);

            List<CanonicalAssetRecord> records = new ArrayList<>();
            int unreadable = 0;
            if (response != null && response.get("rows") instanceof List<?> rows) {
                for (Object row : rows) {
                    if (!(row instanceof Map<?, ?> payload)) {
                        continue;
                    }
                    try {
                        records.add(InventoryRecordMapper.fromPayload((Map<String, Object>) payload));
                    } catch (RuntimeException e) {
                        unreadable++;
                        log.warn("INVENTORY: Skipping asset #{}: {}", payload.get("id"), e.getMessage());
                    }
                }
            }
            log.debug("INVENTORY: Fetched {} assets ({} unreadable)", records.size(), unreadable);
            return records;

        } catch (WebClientResponseException e) {
            throw new InventoryStoreException("HTTP " + e.getStatusCode().value() + " listing assets", e);
        } catch (Exception e) {
            throw new InventoryStoreException("Listing assets failed: " + e.getMessage(), e);
        }
    }

    private static long extractId(Map<String, Object> response, IdentityKey key) {
        checkStatus(response, key);
        Object payload = response.get("payload");
        Object id = payload instanceof Map<?, ?> body ? body.get("id") : response.get("id");
        if (id instanceof Number number) {
            return number.longValue();
        }
        throw new InventoryStoreException("Store returned no id for " + key);
    }

    private static void checkStatus(Map<String, Object> response, IdentityKey key) {
        if (response == null) {
            throw new InventoryStoreException("Empty response from store for " + key);
        }
        if ("error".equals(response.get("status"))) {
            throw new InventoryStoreException("Store rejected " + key + ": " + response.get("messages"));
        }
    }
}
