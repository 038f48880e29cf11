package com.assetsync.reconciler.rules;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.function.Function;
import java.util.regex.Pattern;

/**
 * Predicate over {@link DeviceFacts}. Keyword tests are case-insensitive
 * substring tests; an empty keyword set never matches.
 */
@FunctionalInterface
public interface Condition {

    boolean test(DeviceFacts facts);

    static Condition vendorContains(Collection<String> keywords) {
        return containsAny(DeviceFacts::vendor, keywords);
    }

    static Condition modelContains(Collection<String> keywords) {
        return containsAny(DeviceFacts::model, keywords);
    }

    static Condition osContains(Collection<String> keywords) {
        return containsAny(DeviceFacts::os, keywords);
    }

    static Condition servicesContain(Collection<String> keywords) {
        return containsAny(DeviceFacts::services, keywords);
    }

    /**
     * OS has one of the keywords as a whole word, so "ios" does not match "bios".
     */
    static Condition osHasWord(Collection<String> keywords) {
        List<Pattern> patterns = lowerAll(keywords).stream()
                .map(keyword -> Pattern.compile("(?<![a-z0-9])" + Pattern.quote(keyword) + "(?![a-z0-9])"))
                .toList();
        return facts -> facts.os() != null
                && patterns.stream().anyMatch(pattern -> pattern.matcher(facts.os()).find());
    }

    /**
     * Vendor contains one of the map keys and the model starts with one of that vendor's prefixes.
     */
    static Condition vendorModelPrefix(Map<String, ? extends Collection<String>> prefixesByVendor) {
        Map<String, List<String>> table = new LinkedHashMap<>();
        prefixesByVendor.forEach((vendor, prefixes) -> table.put(lower(vendor), lowerAll(prefixes)));
        return facts -> table.entrySet().stream()
                .anyMatch(entry -> facts.vendor().contains(entry.getKey())
                        && entry.getValue().stream().anyMatch(facts.model()::startsWith));
    }

    static Condition all(Condition... conditions) {
        List<Condition> parts = List.of(conditions);
        return facts -> parts.stream().allMatch(c -> c.test(facts));
    }

    static Condition any(Condition... conditions) {
        List<Condition> parts = List.of(conditions);
        return facts -> parts.stream().anyMatch(c -> c.test(facts));
    }

    static Condition not(Condition condition) {
        return facts -> !condition.test(facts);
    }

    static Condition always() {
        return facts -> true;
    }

    private static Condition containsAny(Function<DeviceFacts, String> property, Collection<String> keywords) {
        List<String> lowered = lowerAll(keywords);
        return facts -> {
            String value = property.apply(facts);
            if (value == null || value.isEmpty()) {
                return false;
            }
            return lowered.stream().anyMatch(value::contains);
        };
    }

    private static List<String> lowerAll(Collection<String> values) {
        return values.stream().map(Condition::lower).filter(v -> !v.isEmpty()).toList();
    }

    private static String lower(String value) {
        return value == null ? "" : value.trim().toLowerCase(Locale.ROOT);
    }
}
