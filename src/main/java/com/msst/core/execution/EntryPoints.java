package com.msst.core.execution;

import com.msst.core.config.EndpointConfig;
import com.msst.storage.S3StorageClient;

import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.util.Optional;

/**
 * Locates a unit's entry point by naming convention: {@code test<id>} first
 * (e.g. {@code test016}), then {@code run}. Both take
 * {@code (S3StorageClient, EndpointConfig)}.
 */
final class EntryPoints {

    static final String FALLBACK = "run";

    private EntryPoints() {}

    static String conventionalName(String testId) {
        return "test" + testId;
    }

    static Optional<Method> resolve(Class<?> type, String testId) {
        Optional<Method> named = find(type, conventionalName(testId));
        return named.isPresent() ? named : find(type, FALLBACK);
    }

    private static Optional<Method> find(Class<?> type, String name) {
        for (Method m : type.getMethods()) {
            if (!m.getName().equals(name) || m.getParameterCount() != 2) {
                continue;
            }
            Class<?>[] params = m.getParameterTypes();
            if (params[0].isAssignableFrom(S3StorageClient.class)
                    && params[1].isAssignableFrom(EndpointConfig.class)
                    && Modifier.isPublic(m.getModifiers())) {
                return Optional.of(m);
            }
        }
        return Optional.empty();
    }
}
