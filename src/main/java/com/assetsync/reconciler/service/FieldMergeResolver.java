package com.assetsync.reconciler.service;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;

import org.springframework.stereotype.Service;

import com.assetsync.reconciler.exception.MergeConflictException;
import com.assetsync.reconciler.model.domain.CanonicalAssetRecord;
import com.assetsync.reconciler.model.domain.Classification;
import com.assetsync.reconciler.model.domain.FieldValue;
import com.assetsync.reconciler.model.domain.RawDeviceRecord;
import com.assetsync.reconciler.model.domain.ResolvedIdentity;
import com.assetsync.reconciler.model.domain.StaticOverride;
import com.assetsync.reconciler.model.enums.ClassificationPath;
import com.assetsync.reconciler.model.enums.FieldType;
import com.assetsync.reconciler.model.enums.SourceType;
import com.assetsync.reconciler.rules.FieldDictionary;
import com.assetsync.reconciler.util.MacAddresses;
import com.assetsync.reconciler.util.TextNormalizer;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Combines an incoming raw record with the known canonical record, field by field.
 *
 * Rules:
 * - an empty incoming value never replaces a known one
 * - a non-empty incoming value replaces value and provenance (last writer wins)
 * - an identical incoming value is not a change; provenance stays
 * - fields the incoming record does not carry are left untouched
 * - category is replaced only by an equal or higher precedence path
 * - last update source/time are refreshed whenever anything changed
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class FieldMergeResolver {

    private final FieldDictionary dictionary;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    /**
     * Merge {@code incoming} into {@code existing} (which is not modified).
     *
     * @param existing       stored record for the identity, or null on first sight
     * @throws MergeConflictException if an incoming value does not fit its field's shape
     */
    public CanonicalAssetRecord merge(
            CanonicalAssetRecord existing,
            RawDeviceRecord incoming,
            ResolvedIdentity identity,
            Classification classification) {

        SourceType source = incoming.getSource();
        Instant observedAt = incoming.getObservedAt() != null ? incoming.getObservedAt() : clock.instant();
        Map<String, String> incomingFields = extractFields(incoming);
        StaticOverride override = identity.staticOverride();

        if (existing == null) {
            Map<String, FieldValue> fields = new LinkedHashMap<>();
            incomingFields.forEach((name, value) -> fields.put(name, new FieldValue(value, source, observedAt)));
            fields.put(FieldDictionary.DEVICE_TYPE,
                    new FieldValue(deviceType(classification, override), source, observedAt));

            return CanonicalAssetRecord.builder()
                    .identityKey(identity.key())
                    .category(classification.category())
                    .classificationPath(classification.path())
                    .name(resolveName(null, incoming, override))
                    .fields(fields)
                    .location(override != null ? blankToNull(override.getLocation()) : null)
                    .placement(override != null ? blankToNull(override.getPlacement()) : null)
                    .lastUpdateSource(source)
                    .lastUpdateAt(observedAt)
                    .build();
        }

        CanonicalAssetRecord merged = existing.copy();
        merged.setIdentityKey(identity.key());
        boolean changed = false;

        for (Map.Entry<String, String> entry : incomingFields.entrySet()) {
            changed |= putIfDifferent(merged, entry.getKey(), new FieldValue(entry.getValue(), source, observedAt));
        }

        if (classification.path().mayReplace(existing.getClassificationPath())
                && (classification.category() != existing.getCategory()
                    || classification.path() != existing.getClassificationPath())) {
            log.debug("Category of {} changes {} -> {} ({})", identity.key(),
                    existing.getCategory(), classification.category(), classification.path());
            merged.setCategory(classification.category());
            merged.setClassificationPath(classification.path());
            changed = true;
        }
        Classification effective = new Classification(
                merged.getCategory(), merged.getClassificationPath(), classification.ruleName());
        changed |= putIfDifferent(merged, FieldDictionary.DEVICE_TYPE,
                new FieldValue(deviceType(effective, override), source, observedAt));

        String name = resolveName(existing.getName(), incoming, override);
        if (!Objects.equals(name, existing.getName())) {
            merged.setName(name);
            changed = true;
        }

        if (override != null) {
            String location = blankToNull(override.getLocation());
            String placement = blankToNull(override.getPlacement());
            if (location != null && !location.equals(existing.getLocation())) {
                merged.setLocation(location);
                changed = true;
            }
            if (placement != null && !placement.equals(existing.getPlacement())) {
                merged.setPlacement(placement);
                changed = true;
            }
        }

        if (changed) {
            merged.setLastUpdateSource(source);
            merged.setLastUpdateAt(observedAt);
        }
        return merged;
    }

    /**
     * Fold a later record of the same identity into the first one of a batch.
     * Later non-empty values win unless they were observed before the value
     * already held; category follows path precedence.
     */
    public CanonicalAssetRecord mergeRecords(CanonicalAssetRecord first, CanonicalAssetRecord later) {
        CanonicalAssetRecord merged = first.copy();
        boolean changed = false;

        for (Map.Entry<String, FieldValue> entry : later.getFields().entrySet()) {
            FieldValue value = entry.getValue();
            if (isEmpty(value.value()) || isOlder(value, merged.getFields().get(entry.getKey()))) {
                continue;
            }
            changed |= putIfDifferent(merged, entry.getKey(), value);
        }

        if (later.getClassificationPath().mayReplace(first.getClassificationPath())
                && (later.getCategory() != first.getCategory()
                    || later.getClassificationPath() != first.getClassificationPath())) {
            merged.setCategory(later.getCategory());
            merged.setClassificationPath(later.getClassificationPath());
            changed = true;
        }

        String laterName = later.getName();
        if (!TextNormalizer.isBlank(laterName) && !laterName.equals(first.getName())
                && !(IdentityResolver.isPlaceholderName(laterName)
                        && !IdentityResolver.isPlaceholderName(first.getName()))) {
            merged.setName(laterName);
            changed = true;
        }
        if (later.getLocation() != null && !later.getLocation().equals(first.getLocation())) {
            merged.setLocation(later.getLocation());
            changed = true;
        }
        if (later.getPlacement() != null && !later.getPlacement().equals(first.getPlacement())) {
            merged.setPlacement(later.getPlacement());
            changed = true;
        }
        if (merged.getInventoryId() == null) {
            merged.setInventoryId(later.getInventoryId());
        }
        if (changed) {
            merged.setLastUpdateSource(later.getLastUpdateSource());
            merged.setLastUpdateAt(later.getLastUpdateAt());
        }
        return merged;
    }

    /**
     * Canonical field map of a raw record: identity hints plus dictionary-coerced attributes.
     * Empty values are left out.
     */
    Map<String, String> extractFields(RawDeviceRecord incoming) {
        Map<String, String> fields = new LinkedHashMap<>();

        for (Map.Entry<String, Object> attribute : incoming.getAttributes().entrySet()) {
            String name = attribute.getKey();
            if (RawDeviceRecord.NAME.equals(name)) {
                continue;
            }
            Optional<FieldType> type = dictionary.typeOf(name);
            if (type.isEmpty()) {
                log.trace("Dropping attribute '{}' not in field dictionary", name);
                continue;
            }
            String value = coerce(name, type.get(), attribute.getValue());
            if (value != null) {
                fields.put(name, value);
            }
        }

        putHint(fields, FieldDictionary.SERIAL,
                incoming.getSerial() != null ? incoming.getSerial().trim().toUpperCase(Locale.ROOT) : null);
        putHint(fields, FieldDictionary.MAC_ADDRESS, MacAddresses.primary(incoming.getMac()).orElse(null));
        putHint(fields, FieldDictionary.LAST_SEEN_IP, incoming.getIp());
        putHint(fields, FieldDictionary.DEVICE_ID, incoming.getDeviceId());
        putHint(fields, FieldDictionary.DNS_HOSTNAME, incoming.getHostname());
        fields.put(FieldDictionary.STATUS_LABEL, incoming.getSource().getStatusLabel());
        return fields;
    }

    /**
     * Convert a raw attribute value to the store's string form for its field type.
     *
     * @return the canonical string, or null when the value is empty
     */
    String coerce(String field, FieldType type, Object raw) {
        if (raw == null) {
            return null;
        }
        if (raw instanceof String text && isEmpty(text)) {
            return null;
        }
        if (raw instanceof Collection<?> items && items.isEmpty()) {
            return null;
        }

        return switch (type) {
            case TEXT -> coerceText(field, raw);
            case TEXTAREA -> coerceTextArea(field, raw);
            case NUMBER -> coerceNumber(field, raw);
            case BOOLEAN -> coerceBoolean(field, raw);
        };
    }

    private String coerceText(String field, Object raw) {
        if (raw instanceof Map<?, ?>) {
            throw new MergeConflictException(field, "expected text but got a structured value");
        }
        if (raw instanceof Collection<?> items) {
            if (items.stream().anyMatch(item -> item instanceof Map<?, ?> || item instanceof Collection<?>)) {
                throw new MergeConflictException(field, "expected text but got nested values");
            }
            String joined = items.stream()
                    .filter(Objects::nonNull)
                    .map(String::valueOf)
                    .map(String::trim)
                    .filter(item -> !item.isEmpty())
                    .collect(Collectors.joining("\n"));
            return joined.isEmpty() ? null : joined;
        }
        return String.valueOf(raw).trim();
    }

    private String coerceTextArea(String field, Object raw) {
        if (raw instanceof Map<?, ?> || raw instanceof Collection<?>) {
            try {
                return objectMapper.writeValueAsString(raw);
            } catch (JsonProcessingException e) {
                throw new MergeConflictException(field, "value cannot be serialized: " + e.getOriginalMessage());
            }
        }
        return String.valueOf(raw).trim();
    }

    private String coerceNumber(String field, Object raw) {
        if (raw instanceof Number number) {
            return toPlain(new BigDecimal(number.toString()));
        }
        if (raw instanceof String text) {
            try {
                return toPlain(new BigDecimal(text.trim()));
            } catch (NumberFormatException e) {
                throw new MergeConflictException(field, "expected a number but got '" + text + "'");
            }
        }
        throw new MergeConflictException(field, "expected a number but got " + raw.getClass().getSimpleName());
    }

    private String coerceBoolean(String field, Object raw) {
        if (raw instanceof Boolean flag) {
            return flag ? "1" : "0";
        }
        if (raw instanceof Number number) {
            long value = number.longValue();
            if (value == 0 || value == 1) {
                return String.valueOf(value);
            }
        }
        if (raw instanceof String text) {
            switch (text.trim().toLowerCase(Locale.ROOT)) {
                case "true", "yes", "1" -> {
                    return "1";
                }
                case "false", "no", "0" -> {
                    return "0";
                }
                default -> {
                    // fall through to conflict
                }
            }
        }
        throw new MergeConflictException(field, "expected a boolean but got '" + raw + "'");
    }

    private static String toPlain(BigDecimal value) {
        BigDecimal stripped = value.stripTrailingZeros();
        return stripped.scale() < 0 ? stripped.setScale(0).toPlainString() : stripped.toPlainString();
    }

    private static boolean isOlder(FieldValue candidate, FieldValue current) {
        return current != null && current.updatedAt() != null && candidate.updatedAt() != null
                && candidate.updatedAt().isBefore(current.updatedAt());
    }

    private static boolean putIfDifferent(CanonicalAssetRecord record, String name, FieldValue value) {
        FieldValue current = record.getFields().get(name);
        if (current != null && Objects.equals(current.value(), value.value())) {
            return false;
        }
        record.getFields().put(name, value);
        return true;
    }

    private String resolveName(String existingName, RawDeviceRecord incoming, StaticOverride override) {
        if (override != null && !TextNormalizer.isBlank(override.getName())) {
            return override.getName().trim();
        }
        String candidate = TextNormalizer.normalize(incoming.text(RawDeviceRecord.NAME));
        if (candidate.isEmpty() || isEmpty(candidate)) {
            return existingName;
        }
        if (existingName != null && IdentityResolver.isPlaceholderName(candidate)
                && !IdentityResolver.isPlaceholderName(existingName)) {
            return existingName;
        }
        return candidate;
    }

    private static String deviceType(Classification classification, StaticOverride override) {
        if (classification.path() == ClassificationPath.STATIC_OVERRIDE
                && override != null && !TextNormalizer.isBlank(override.getDeviceType())) {
            return override.getDeviceType().trim();
        }
        return classification.category().getDeviceType();
    }

    private static void putHint(Map<String, String> fields, String name, String value) {
        if (!isEmpty(value)) {
            fields.put(name, value.trim());
        }
    }

    /**
     * Null, blank and the "Unknown" placeholder all count as missing data.
     */
    static boolean isEmpty(String value) {
        return value == null || value.isBlank() || value.trim().equalsIgnoreCase("unknown");
    }

    private static String blankToNull(String value) {
        return TextNormalizer.isBlank(value) ? null : value.trim();
    }
}
