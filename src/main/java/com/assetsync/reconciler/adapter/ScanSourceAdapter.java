package com.assetsync.reconciler.adapter;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;

import org.springframework.stereotype.Component;

import com.assetsync.reconciler.model.domain.RawDeviceRecord;
import com.assetsync.reconciler.model.enums.SourceType;

/**
 * Adapter for network scan hosts: address, reverse-DNS name, ARP MAC, OS guess
 * and the names of open-port services.
 */
@Component
public class ScanSourceAdapter extends BaseSourceAdapter {

    @Override
    public SourceType getSourceType() {
        return SourceType.SCAN;
    }

    @Override
    protected void adaptRecord(Map<String, Object> host, RawDeviceRecord.RawDeviceRecordBuilder builder) {
        String hostname = text(host, "hostname");

        builder.ip(text(host, "ip"))
                .hostname(hostname)
                .mac(text(host, "mac"));

        putAttribute(builder, RawDeviceRecord.NAME, hostname);
        putAttribute(builder, RawDeviceRecord.MANUFACTURER, text(host, "vendor"));
        putAttribute(builder, RawDeviceRecord.OS_PLATFORM, text(host, "os"));

        List<String> services = serviceNames(host.get("services"));
        if (!services.isEmpty()) {
            putAttribute(builder, RawDeviceRecord.SERVICES, String.join(", ", services));
        }
    }

    /**
     * Service names from either a list of names or a list of {@code {port, name}} objects.
     */
    static List<String> serviceNames(Object raw) {
        List<String> names = new ArrayList<>();
        if (!(raw instanceof Collection<?> items)) {
            return names;
        }
        for (Object item : items) {
            Object name = item instanceof Map<?, ?> service ? service.get("name") : item;
            if (name != null && !String.valueOf(name).isBlank()) {
                names.add(String.valueOf(name).trim());
            }
        }
        return names;
    }
}
