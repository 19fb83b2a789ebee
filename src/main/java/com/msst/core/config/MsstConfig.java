package com.msst.core.config;

import com.msst.core.discovery.ClasspathTestUnitSource;
import com.msst.core.discovery.TestDiscovery;
import com.msst.core.discovery.TestGroups;
import com.msst.core.discovery.TestUnitSource;
import com.msst.core.validation.SuiteCatalog;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;

/**
 * Turns {@link MsstProperties} into the immutable values the core is built from.
 */
@Configuration
public class MsstConfig {

    @Bean
    public TestGroups testGroups(MsstProperties properties) {
        var ranges = new ArrayList<TestGroups.Range>();
        properties.getDiscovery().getGroups().forEach((name, range) ->
                ranges.add(new TestGroups.Range(name, range.getStart(), range.getEnd())));
        return TestGroups.of(ranges);
    }

    @Bean
    public TestUnitSource testUnitSource(MsstProperties properties) {
        return new ClasspathTestUnitSource(properties.getDiscovery().getBasePackage());
    }

    @Bean
    public TestDiscovery testDiscovery(TestGroups testGroups, TestUnitSource testUnitSource) {
        return new TestDiscovery(testGroups, testUnitSource);
    }

    @Bean
    public SuiteCatalog suiteCatalog(MsstProperties properties) {
        return SuiteCatalog.from(properties.getValidation());
    }
}
