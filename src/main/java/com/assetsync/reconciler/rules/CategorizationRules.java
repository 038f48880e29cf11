package com.assetsync.reconciler.rules;

import static com.assetsync.reconciler.rules.Condition.all;
import static com.assetsync.reconciler.rules.Condition.any;
import static com.assetsync.reconciler.rules.Condition.modelContains;
import static com.assetsync.reconciler.rules.Condition.not;
import static com.assetsync.reconciler.rules.Condition.osContains;
import static com.assetsync.reconciler.rules.Condition.osHasWord;
import static com.assetsync.reconciler.rules.Condition.servicesContain;
import static com.assetsync.reconciler.rules.Condition.vendorContains;
import static com.assetsync.reconciler.rules.Condition.vendorModelPrefix;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import com.assetsync.reconciler.model.enums.AssetCategory;

/**
 * Ordered classification table. Rows are evaluated top to bottom and the
 * first match wins; there is no scoring across categories.
 *
 * Built once at startup and never mutated.
 */
public final class CategorizationRules {

    public static final String GROUP_NETWORK = "network";
    public static final String GROUP_VIRTUAL = "virtual-machine";
    public static final String GROUP_SERVER = "server";
    public static final String GROUP_MOBILE = "mobile-os";
    public static final String GROUP_COMPUTER = "computer";
    public static final String GROUP_IOT = "iot";
    public static final String GROUP_SERVICES = "service-fingerprint";

    // ========================================================================
    // KEYWORD TABLES
    // ========================================================================

    static final List<String> FIREWALL_VENDORS = List.of(
            "cisco", "meraki", "fortinet", "palo alto", "sonicwall", "juniper", "checkpoint");
    static final List<String> FIREWALL_MODELS = List.of(
            "firewall", "asa", "srx", "pa-", "mx", "security gateway", "firepower");

    static final List<String> SWITCH_VENDORS = List.of(
            "cisco", "juniper", "aruba", "hp", "dell", "meraki", "ubiquiti");
    // Juniper EX and Meraki MS series by model number, bare "ex"/"ms" hit OptiPlex and friends
    static final List<String> SWITCH_MODELS = List.of(
            "switch", "catalyst", "nexus", "comware", "procurve",
            "ex2", "ex3", "ex4", "ex9", "ms1", "ms2", "ms3", "ms4", "edgeswitch");

    static final List<String> ROUTER_VENDORS = List.of("cisco", "juniper", "mikrotik", "ubiquiti");
    static final List<String> ROUTER_MODELS = List.of("router", "isr", "asr", "edgerouter");

    static final List<String> ACCESS_POINT_VENDORS = List.of("cisco", "meraki", "aruba", "ubiquiti", "ruckus");
    static final List<String> ACCESS_POINT_MODELS = List.of("access point", "ap", "aironet", "unifi", "mr");

    static final List<String> HYPERVISOR_VENDORS = List.of(
            "vmware", "virtualbox", "innotek", "qemu", "xen", "parallels");
    static final List<String> VIRTUAL_MODELS = List.of("virtual machine", "vm");

    static final List<String> SERVER_KEYWORDS = List.of("server");

    static final List<String> IOS_KEYWORDS = List.of("ios", "ipados");
    // Cisco IOS is router firmware
    static final List<String> NETWORK_OS_VENDORS = List.of("cisco");
    static final List<String> IOS_TABLET_MODELS = List.of("ipad", "ipad pro", "ipad air", "ipad mini");

    static final List<String> ANDROID_KEYWORDS = List.of("android");
    static final List<String> ANDROID_TABLET_MODELS = List.of("tablet", "tab");
    static final List<String> ANDROID_TABLET_VENDORS = List.of("samsung", "lenovo", "huawei");
    static final List<String> ANDROID_IOT_MODELS = List.of("meetingbar", "roompanel", "ctp");

    static final List<String> COMPUTER_OS_KEYWORDS = List.of("windows", "mac");
    static final List<String> LAPTOP_MODELS = List.of(
            "laptop", "notebook", "book", "zenbook", "vivobook",
            "thinkpad", "latitude", "xps", "precision", "elitebook",
            "probook", "spectre", "envy", "surface laptop", "studiobook",
            "proart", "macbook", "macbook pro", "macbook air");
    static final Map<String, List<String>> LAPTOP_VENDOR_PREFIXES = Map.of(
            "lenovo", List.of("20", "21", "40"));
    static final List<String> DESKTOP_MODELS = List.of(
            "desktop", "workstation", "station", "studio", "thinkcentre",
            "ideacentre", "thinkstation", "neo", "tower", "sff", "tiny",
            "all-in-one", "aio", "m70s", "m70t", "m70q", "m90s", "m90t",
            "m90q", "m75s", "m75t", "m75q", "p320", "p520", "p360", "p340",
            "imac", "mac mini", "mac studio", "mac pro", "zbook", "z840",
            "z640", "z440", "z240", "z620", "precision", "proart station");
    static final Map<String, List<String>> DESKTOP_VENDOR_PREFIXES = Map.of(
            "lenovo", List.of("10", "11", "12", "30"));
    static final List<String> DESKTOP_OS_KEYWORDS = List.of("desktop");

    static final List<String> IOT_KEYWORDS = List.of("iot");

    static final List<String> PRINTER_SERVICES = List.of("ipp", "jetdirect", "printer", "cups");
    static final List<String> PRINTER_MODELS = List.of("laserjet", "officejet", "printer");
    static final List<String> STORAGE_SERVICES = List.of("nfs", "iscsi", "smb", "cifs");
    static final List<String> DIRECTORY_SERVICES = List.of("domain");
    static final List<String> LDAP_SERVICES = List.of("ldap");
    static final List<String> DATABASE_SERVICES = List.of("mysql", "mssql", "postgresql", "oracle", "mongodb");

    private final List<ClassificationRule> rules;

    private CategorizationRules(List<ClassificationRule> rules) {
        this.rules = Collections.unmodifiableList(new ArrayList<>(rules));
    }

    public List<ClassificationRule> getRules() {
        return rules;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Default table. Group order: network, virtual machine, server, mobile OS,
     * computer, IoT, service fingerprint. Within the network group the order
     * Firewall, Switch, Router, Access Point resolves overlapping keywords.
     */
    public static CategorizationRules defaults() {
        Condition ios = all(osHasWord(IOS_KEYWORDS),
                not(any(vendorContains(NETWORK_OS_VENDORS), osContains(NETWORK_OS_VENDORS))));
        Condition android = osContains(ANDROID_KEYWORDS);
        Condition computer = osContains(COMPUTER_OS_KEYWORDS);

        return builder()
                // Network hardware: vendor AND model keyword
                .rule(GROUP_NETWORK, "firewall", AssetCategory.FIREWALL,
                        all(vendorContains(FIREWALL_VENDORS), modelContains(FIREWALL_MODELS)))
                .rule(GROUP_NETWORK, "switch", AssetCategory.SWITCH,
                        all(vendorContains(SWITCH_VENDORS), modelContains(SWITCH_MODELS)))
                .rule(GROUP_NETWORK, "router", AssetCategory.ROUTER,
                        all(vendorContains(ROUTER_VENDORS), modelContains(ROUTER_MODELS)))
                .rule(GROUP_NETWORK, "access-point", AssetCategory.ACCESS_POINT,
                        all(vendorContains(ACCESS_POINT_VENDORS), modelContains(ACCESS_POINT_MODELS)))

                .rule(GROUP_VIRTUAL, "virtual-machine", AssetCategory.VIRTUAL_MACHINE,
                        any(vendorContains(HYPERVISOR_VENDORS), modelContains(VIRTUAL_MODELS)))

                .rule(GROUP_SERVER, "server", AssetCategory.SERVER,
                        any(osContains(SERVER_KEYWORDS), modelContains(SERVER_KEYWORDS)))

                .rule(GROUP_MOBILE, "ios-tablet", AssetCategory.TABLET,
                        all(ios, modelContains(IOS_TABLET_MODELS)))
                .rule(GROUP_MOBILE, "ios-phone", AssetCategory.MOBILE_PHONE, ios)
                .rule(GROUP_MOBILE, "android-tablet", AssetCategory.TABLET,
                        all(android, any(modelContains(ANDROID_TABLET_MODELS),
                                vendorContains(ANDROID_TABLET_VENDORS))))
                .rule(GROUP_MOBILE, "android-iot", AssetCategory.IOT_DEVICE,
                        all(android, modelContains(ANDROID_IOT_MODELS)))
                .rule(GROUP_MOBILE, "android-phone", AssetCategory.MOBILE_PHONE, android)

                .rule(GROUP_COMPUTER, "laptop-keyword", AssetCategory.LAPTOP,
                        all(computer, modelContains(LAPTOP_MODELS)))
                .rule(GROUP_COMPUTER, "laptop-vendor-prefix", AssetCategory.LAPTOP,
                        all(computer, vendorModelPrefix(LAPTOP_VENDOR_PREFIXES)))
                .rule(GROUP_COMPUTER, "desktop", AssetCategory.DESKTOP,
                        all(computer, any(modelContains(DESKTOP_MODELS),
                                vendorModelPrefix(DESKTOP_VENDOR_PREFIXES),
                                osContains(DESKTOP_OS_KEYWORDS))))
                // Ambiguous Windows/macOS hardware lands on Laptop
                .rule(GROUP_COMPUTER, "computer-default", AssetCategory.LAPTOP, computer)

                .rule(GROUP_IOT, "iot", AssetCategory.IOT_DEVICE,
                        any(modelContains(IOT_KEYWORDS), osContains(IOT_KEYWORDS)))

                .rule(GROUP_SERVICES, "domain-controller-services", AssetCategory.SERVER,
                        all(servicesContain(DIRECTORY_SERVICES), servicesContain(LDAP_SERVICES)))
                .rule(GROUP_SERVICES, "printer-services", AssetCategory.PRINTER,
                        any(servicesContain(PRINTER_SERVICES), modelContains(PRINTER_MODELS)))
                .rule(GROUP_SERVICES, "database-services", AssetCategory.SERVER,
                        servicesContain(DATABASE_SERVICES))
                .rule(GROUP_SERVICES, "storage-services", AssetCategory.STORAGE_DEVICE,
                        servicesContain(STORAGE_SERVICES))
                .build();
    }

    public static final class Builder {

        private final List<ClassificationRule> rules = new ArrayList<>();

        public Builder rule(String group, String name, AssetCategory category, Condition condition) {
            rules.add(new ClassificationRule(group, name, category, condition));
            return this;
        }

        public Builder rule(ClassificationRule rule) {
            rules.add(rule);
            return this;
        }

        public CategorizationRules build() {
            return new CategorizationRules(rules);
        }
    }
}
