package com.msst.core.validation;

import com.msst.core.config.MsstProperties;
import com.msst.core.discovery.TestIds;
import com.msst.core.model.Suite;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Ordered, immutable table of validation suites plus the key of the critical suite.
 */
public final class SuiteCatalog {

    private final List<Suite> suites;
    private final String criticalKey;
    private final List<String> quickKeys;

    public SuiteCatalog(List<Suite> suites, String criticalKey, Collection<String> quickKeys) {
        this.suites = List.copyOf(suites);
        this.criticalKey = criticalKey;
        this.quickKeys = List.copyOf(quickKeys);
    }

    /**
     * Builds the catalog from configuration. A configured suite table replaces the shipped one;
     * the shipped table applies only when none is configured and {@code use-default-suites} is on.
     */
    public static SuiteCatalog from(MsstProperties.Validation validation) {
        Map<String, MsstProperties.SuiteSpec> specs = validation.getSuites();
        if (specs.isEmpty() && validation.isUseDefaultSuites()) {
            specs = MsstProperties.Validation.defaultSuites();
        }
        var suites = new ArrayList<Suite>();
        specs.forEach((key, spec) -> suites.add(new Suite(
                key,
                spec.getName() != null && !spec.getName().isBlank() ? spec.getName() : key,
                spec.getTests().stream().map(id -> TestIds.normalize(id).orElse(id)).toList(),
                spec.getRequiredPassRate(),
                spec.getDescription() != null ? spec.getDescription() : "")));
        return new SuiteCatalog(suites, validation.getCriticalSuite(), validation.getQuickSuites());
    }

    public List<Suite> suites() {
        return suites;
    }

    public Optional<Suite> get(String key) {
        return suites.stream().filter(s -> s.key().equals(key)).findFirst();
    }

    public String criticalKey() {
        return criticalKey;
    }

    public boolean isEmpty() {
        return suites.isEmpty();
    }

    /** The catalog restricted to the quick-mode suites, in configuration order. */
    public SuiteCatalog quick() {
        return new SuiteCatalog(
                suites.stream().filter(s -> quickKeys.contains(s.key())).toList(),
                criticalKey, quickKeys);
    }
}
