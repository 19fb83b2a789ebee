package com.msst.core.discovery;

import com.msst.core.model.TestUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.TreeMap;

/**
 * Builds the in-memory catalog of {@link TestUnit}s without executing anything.
 * <p>
 * Each group of the {@link TestGroups} table is looked up as a namespace of the
 * {@link TestUnitSource}. Group ranges are authoritative: an artifact whose ID falls
 * outside the range of the namespace it was found in is excluded. When two artifacts
 * normalize to the same ID the first one in sorted order wins and a warning is logged.
 * Missing namespaces are skipped; unreadable ones are logged and treated as empty.
 */
public class TestDiscovery {

    private static final Logger log = LoggerFactory.getLogger(TestDiscovery.class);

    private static final Comparator<TestArtifact> ARTIFACT_ORDER =
            Comparator.comparing(TestArtifact::name).thenComparing(a -> a.type().getName());

    private final TestGroups groups;
    private final Map<String, TestUnit> catalog;

    public TestDiscovery(TestGroups groups, TestUnitSource source) {
        this.groups = groups;
        this.catalog = discover(groups, source);
    }

    private static Map<String, TestUnit> discover(TestGroups groups, TestUnitSource source) {
        var units = new TreeMap<String, TestUnit>(Comparator.comparingInt(Integer::parseInt));
        for (TestGroups.Range group : groups.ranges()) {
            List<TestArtifact> artifacts;
            try {
                artifacts = new ArrayList<>(source.list(group.name()));
            } catch (IOException e) {
                log.warn("Cannot read test namespace '{}', treating it as empty: {}", group.name(), e.getMessage());
                continue;
            }
            if (artifacts.isEmpty()) {
                log.debug("No tests in namespace '{}'", group.name());
                continue;
            }
            artifacts.sort(ARTIFACT_ORDER);

            for (TestArtifact artifact : artifacts) {
                OptionalInt parsed = TestIds.parse(artifact.name());
                if (parsed.isEmpty()) {
                    log.debug("Ignoring artifact '{}' in '{}': name has no numeric prefix",
                            artifact.name(), group.name());
                    continue;
                }
                int id = parsed.getAsInt();
                if (!group.contains(id)) {
                    log.warn("Excluding test {} ({}) found in '{}': outside group range [{},{}]",
                            artifact.name(), artifact.type().getName(), group.name(), group.start(), group.end());
                    continue;
                }
                String key = TestIds.pad(id);
                TestUnit existing = units.get(key);
                if (existing != null) {
                    log.warn("Duplicate test ID {}: keeping {}, ignoring {}",
                            key, existing.location().getName(), artifact.type().getName());
                    continue;
                }
                units.put(key, new TestUnit(key, "test_" + key, group.name(),
                        artifact.title() != null ? artifact.title() : "", artifact.type()));
            }
        }
        log.info("Discovered {} tests in {} groups", units.size(), groups.ranges().size());
        return units;
    }

    /**
     * Looks up a unit by un-padded, padded or over-padded numeric ID.
     */
    public Optional<TestUnit> getById(String id) {
        return TestIds.normalize(id).map(catalog::get);
    }

    /** Units of a group, ordered by ID; empty for unknown groups. */
    public List<TestUnit> getByGroup(String group) {
        return catalog.values().stream()
                .filter(u -> u.group().equals(group))
                .toList();
    }

    /** All units, ordered by ID. */
    public List<TestUnit> getAll() {
        return List.copyOf(catalog.values());
    }

    public TestGroups groups() {
        return groups;
    }
}
