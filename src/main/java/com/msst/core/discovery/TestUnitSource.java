package com.msst.core.discovery;

import java.io.IOException;
import java.util.List;

/**
 * Enumerates the artifacts of a namespace.
 * Implementations: ClasspathTestUnitSource (compiled registry); tests supply in-memory sources.
 */
public interface TestUnitSource {

    /**
     * Lists every artifact in the namespace.
     *
     * @return the artifacts, or an empty list when the namespace does not exist
     * @throws IOException when the namespace exists but cannot be read
     */
    List<TestArtifact> list(String namespace) throws IOException;
}
