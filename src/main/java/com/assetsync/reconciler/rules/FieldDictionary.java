package com.assetsync.reconciler.rules;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

import com.assetsync.reconciler.model.enums.FieldType;

/**
 * Field names the inventory store accepts and the shape of each.
 *
 * Supplied from outside the core. The built-in fields every asset carries are
 * always present; an otherwise empty dictionary accepts any field as text.
 */
public final class FieldDictionary {

    public static final String SERIAL = "serial";
    public static final String ASSET_TAG = "asset_tag";
    public static final String MAC_ADDRESS = "mac_address";
    public static final String LAST_SEEN_IP = "last_seen_ip";
    public static final String DEVICE_ID = "device_id";
    public static final String DNS_HOSTNAME = "dns_hostname";
    public static final String MANUFACTURER = "manufacturer";
    public static final String MODEL = "model";
    public static final String OS_PLATFORM = "os_platform";
    public static final String STATUS_LABEL = "status_label";
    public static final String DEVICE_TYPE = "device_type";

    private static final Map<String, FieldType> BUILT_IN;

    static {
        Map<String, FieldType> builtIn = new LinkedHashMap<>();
        builtIn.put(SERIAL, FieldType.TEXT);
        builtIn.put(ASSET_TAG, FieldType.TEXT);
        builtIn.put(MAC_ADDRESS, FieldType.TEXT);
        builtIn.put(LAST_SEEN_IP, FieldType.TEXT);
        builtIn.put(DEVICE_ID, FieldType.TEXT);
        builtIn.put(DNS_HOSTNAME, FieldType.TEXT);
        builtIn.put(MANUFACTURER, FieldType.TEXT);
        builtIn.put(MODEL, FieldType.TEXT);
        builtIn.put(OS_PLATFORM, FieldType.TEXT);
        builtIn.put(STATUS_LABEL, FieldType.TEXT);
        builtIn.put(DEVICE_TYPE, FieldType.TEXT);
        BUILT_IN = Collections.unmodifiableMap(builtIn);
    }

    private final Map<String, FieldType> custom;
    private final Map<String, FieldType> all;

    public FieldDictionary(Map<String, FieldType> customFields) {
        this.custom = Collections.unmodifiableMap(new LinkedHashMap<>(customFields));
        Map<String, FieldType> merged = new LinkedHashMap<>(BUILT_IN);
        merged.putAll(customFields);
        this.all = Collections.unmodifiableMap(merged);
    }

    public static FieldDictionary builtInOnly() {
        return new FieldDictionary(Map.of());
    }

    /**
     * Whether arbitrary attributes are accepted (no custom fields declared).
     */
    public boolean isOpen() {
        return custom.isEmpty();
    }

    /**
     * Declared type of a field. Unknown fields are TEXT in an open dictionary, absent otherwise.
     */
    public Optional<FieldType> typeOf(String fieldName) {
        FieldType type = all.get(fieldName);
        if (type == null && isOpen()) {
            return Optional.of(FieldType.TEXT);
        }
        return Optional.ofNullable(type);
    }

    public Map<String, FieldType> getFields() {
        return all;
    }
}
