package com.msst.core.discovery;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.BeanDefinitionStoreException;
import org.springframework.beans.factory.config.BeanDefinition;
import org.springframework.context.annotation.ClassPathScanningCandidateComponentProvider;
import org.springframework.core.type.filter.AnnotationTypeFilter;
import org.springframework.util.ClassUtils;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Registry of compiled test units: scans {@code <basePackage>.<namespace>} on the
 * class path for classes annotated with {@link CompatibilityTest}.
 */
public class ClasspathTestUnitSource implements TestUnitSource {

    private static final Logger log = LoggerFactory.getLogger(ClasspathTestUnitSource.class);

    private final String basePackage;
    private final ClassLoader classLoader;

    public ClasspathTestUnitSource(String basePackage) {
        this(basePackage, ClassUtils.getDefaultClassLoader());
    }

    public ClasspathTestUnitSource(String basePackage, ClassLoader classLoader) {
        this.basePackage = basePackage;
        this.classLoader = classLoader;
    }

    @Override
    public List<TestArtifact> list(String namespace) throws IOException {
        var scanner = new ClassPathScanningCandidateComponentProvider(false);
        scanner.addIncludeFilter(new AnnotationTypeFilter(CompatibilityTest.class));

        String pkg = basePackage + "." + namespace;
        List<TestArtifact> artifacts = new ArrayList<>();
        try {
            for (BeanDefinition candidate : scanner.findCandidateComponents(pkg)) {
                Class<?> type = ClassUtils.forName(candidate.getBeanClassName(), classLoader);
                CompatibilityTest marker = type.getAnnotation(CompatibilityTest.class);
                // the scanner also descends into sub-packages; only direct members belong here
                if (marker == null || !pkg.equals(type.getPackageName())) {
                    continue;
                }
                artifacts.add(new TestArtifact(namespace, marker.id(), marker.name(), type));
            }
        } catch (BeanDefinitionStoreException e) {
            throw new IOException("Cannot scan package " + pkg, e);
        } catch (ClassNotFoundException | LinkageError e) {
            throw new IOException("Cannot load test class in package " + pkg, e);
        }
        log.debug("Found {} test artifacts in {}", artifacts.size(), pkg);
        return artifacts;
    }
}
