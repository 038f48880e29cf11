package com.assetsync.reconciler.model.domain;

import java.time.Instant;
import java.util.Map;

import com.assetsync.reconciler.model.enums.SourceType;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

/**
 * One device as reported by a single source in a single ingestion cycle.
 *
 * Identity hints are lifted out of the attribute map by the source adapter;
 * everything else stays in {@link #attributes} under canonical field names.
 * Instances are immutable and discarded after the merge.
 */
@Value
@Builder(toBuilder = true)
public class RawDeviceRecord {

    public static final String NAME = "name";
    public static final String MANUFACTURER = "manufacturer";
    public static final String MODEL = "model";
    public static final String OS_PLATFORM = "os_platform";
    public static final String SERVICES = "services";
    public static final String ASSET_TAG = "asset_tag";

    SourceType source;

    String ip;

    String mac;

    String serial;

    /**
     * Management-system unique device identifier (e.g. MDM device id).
     */
    String deviceId;

    String hostname;

    @Singular
    Map<String, Object> attributes;

    Instant observedAt;

    public Object attribute(String name) {
        return attributes.get(name);
    }

    /**
     * Attribute rendered as text, or {@code null} when absent.
     */
    public String text(String name) {
        Object value = attributes.get(name);
        if (value == null) {
            return null;
        }
        if (value instanceof Iterable<?> items) {
            StringBuilder sb = new StringBuilder();
            for (Object item : items) {
                if (item == null) continue;
                if (sb.length() > 0) sb.append(' ');
                sb.append(item);
            }
            return sb.toString();
        }
        return String.valueOf(value);
    }
}
