package com.assetsync.reconciler.adapter;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.Map;

import org.springframework.stereotype.Component;

import com.assetsync.reconciler.model.domain.RawDeviceRecord;
import com.assetsync.reconciler.model.enums.SourceType;
import com.assetsync.reconciler.util.MacAddresses;

/**
 * Adapter for managed-device objects from an MDM (Graph-style managedDevice).
 *
 * @see <a href="https://learn.microsoft.com/en-us/graph/api/resources/intune-devices-manageddevice">managedDevice resource</a>
 */
@Component
public class MdmSourceAdapter extends BaseSourceAdapter {

    /**
     * Native property -> canonical field, copied as-is.
     */
    static final Map<String, String> PASSTHROUGH = new LinkedHashMap<>();

    static {
        PASSTHROUGH.put("manufacturer", RawDeviceRecord.MANUFACTURER);
        PASSTHROUGH.put("model", RawDeviceRecord.MODEL);
        PASSTHROUGH.put("operatingSystem", RawDeviceRecord.OS_PLATFORM);
        PASSTHROUGH.put("osVersion", "os_version");
        PASSTHROUGH.put("userPrincipalName", "primary_user_upn");
        PASSTHROUGH.put("userDisplayName", "primary_user_display_name");
        PASSTHROUGH.put("complianceState", "compliance_state");
        PASSTHROUGH.put("lastSyncDateTime", "mdm_last_sync");
        PASSTHROUGH.put("enrolledDateTime", "mdm_enrollment_date");
        PASSTHROUGH.put("managedDeviceOwnerType", "ownership");
        PASSTHROUGH.put("azureADDeviceId", "azure_ad_id");
        PASSTHROUGH.put("skuFamily", "sku_family");
        PASSTHROUGH.put("isEncrypted", "encrypted");
        PASSTHROUGH.put("totalStorageSpaceInBytes", "total_storage");
        PASSTHROUGH.put("freeStorageSpaceInBytes", "free_storage");
        PASSTHROUGH.put("physicalMemoryInBytes", "physical_memory_in_bytes");
        PASSTHROUGH.put("imei", "imei");
    }

    @Override
    public SourceType getSourceType() {
        return SourceType.MDM;
    }

    @Override
    protected void adaptRecord(Map<String, Object> device, RawDeviceRecord.RawDeviceRecordBuilder builder) {
        String deviceName = text(device, "deviceName");
        String macs = MacAddresses.combine(Arrays.asList(
                text(device, "wiFiMacAddress"), text(device, "ethernetMacAddress")));

        builder.deviceId(text(device, "id"))
                .serial(text(device, "serialNumber"))
                .hostname(deviceName)
                .mac(macs);

        putAttribute(builder, RawDeviceRecord.NAME, deviceName);
        putAttribute(builder, "mac_addresses", macs);
        PASSTHROUGH.forEach((nativeName, field) -> putAttribute(builder, field, device.get(nativeName)));
    }
}
