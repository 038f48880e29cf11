package com.assetsync.reconciler.adapter;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Pattern;

import org.springframework.stereotype.Component;

import com.assetsync.reconciler.model.domain.RawDeviceRecord;
import com.assetsync.reconciler.model.enums.SourceType;

/**
 * Adapter for SNMP poll results (system group plus ENTITY-MIB serial and first
 * interface MAC), keyed by OID name.
 */
@Component
public class SnmpSourceAdapter extends BaseSourceAdapter {

    private static final long TICKS_PER_DAY = 8_640_000L;
    private static final long TICKS_PER_HOUR = 360_000L;
    private static final long TICKS_PER_MINUTE = 6_000L;

    /**
     * sysDescr keyword -> manufacturer, first match wins.
     */
    private static final Map<Pattern, String> VENDOR_HINTS = new LinkedHashMap<>();

    static {
        vendorHint("meraki", "Cisco Meraki");
        vendorHint("cisco", "Cisco");
        vendorHint("juniper", "Juniper Networks");
        vendorHint("junos", "Juniper Networks");
        vendorHint("aruba", "Aruba");
        vendorHint("procurve", "HP");
        vendorHint("hewlett[- ]packard", "HP");
        vendorHint("hp", "HP");
        vendorHint("dell", "Dell");
        vendorHint("ubiquiti", "Ubiquiti");
        vendorHint("edgeos", "Ubiquiti");
        vendorHint("mikrotik", "MikroTik");
        vendorHint("routeros", "MikroTik");
        vendorHint("fortinet", "Fortinet");
        vendorHint("fortigate", "Fortinet");
        vendorHint("palo alto", "Palo Alto Networks");
        vendorHint("sonicwall", "SonicWall");
        vendorHint("ruckus", "Ruckus");
        vendorHint("synology", "Synology");
        vendorHint("qnap", "QNAP");
        vendorHint("brother", "Brother");
        vendorHint("xerox", "Xerox");
        vendorHint("ricoh", "Ricoh");
        vendorHint("kyocera", "Kyocera");
        vendorHint("lexmark", "Lexmark");
        vendorHint("apc", "APC");
    }

    private static void vendorHint(String regex, String manufacturer) {
        VENDOR_HINTS.put(Pattern.compile("\\b" + regex + "\\b", Pattern.CASE_INSENSITIVE), manufacturer);
    }

    @Override
    public SourceType getSourceType() {
        return SourceType.SNMP;
    }

    @Override
    protected void adaptRecord(Map<String, Object> poll, RawDeviceRecord.RawDeviceRecordBuilder builder) {
        String sysName = text(poll, "sysName");
        String sysDescr = text(poll, "sysDescr");
        String vendor = text(poll, "vendor");

        builder.ip(text(poll, "ip"))
                .hostname(sysName)
                .serial(text(poll, "sysSerial"))
                .mac(stripHexPrefix(text(poll, "ifPhysAddress.1")));

        putAttribute(builder, RawDeviceRecord.NAME, sysName);
        putAttribute(builder, RawDeviceRecord.MANUFACTURER, vendor != null ? vendor : inferManufacturer(sysDescr));
        putAttribute(builder, RawDeviceRecord.MODEL, text(poll, "model"));
        putAttribute(builder, "snmp_sys_description", sysDescr);
        putAttribute(builder, "snmp_object_id", text(poll, "sysObjectID"));
        putAttribute(builder, "snmp_location", text(poll, "sysLocation"));
        putAttribute(builder, "snmp_contact", text(poll, "sysContact"));
        putAttribute(builder, "snmp_uptime", formatUptime(text(poll, "sysUpTime")));
        putAttribute(builder, "switch_port_count", text(poll, "ifNumber"));
    }

    /**
     * Manufacturer named in a sysDescr string, or null.
     */
    static String inferManufacturer(String sysDescr) {
        if (sysDescr == null) {
            return null;
        }
        for (Map.Entry<Pattern, String> hint : VENDOR_HINTS.entrySet()) {
            if (hint.getKey().matcher(sysDescr).find()) {
                return hint.getValue();
            }
        }
        return null;
    }

    /**
     * Timeticks (hundredths of a second) as {@code Nd Nh Nm}. Unparseable input is returned unchanged.
     */
    static String formatUptime(String timeticks) {
        if (timeticks == null) {
            return null;
        }
        try {
            long ticks = Long.parseLong(timeticks.trim());
            long days = ticks / TICKS_PER_DAY;
            long hours = (ticks % TICKS_PER_DAY) / TICKS_PER_HOUR;
            long minutes = (ticks % TICKS_PER_HOUR) / TICKS_PER_MINUTE;
            return days + "d " + hours + "h " + minutes + "m";
        } catch (NumberFormatException e) {
            return timeticks;
        }
    }

    private static String stripHexPrefix(String value) {
        if (value != null && (value.startsWith("0x") || value.startsWith("0X"))) {
            return value.substring(2);
        }
        return value;
    }
}
