package com.msst.core.execution;

import com.msst.core.config.EndpointConfig;
import com.msst.core.metrics.MsstMetrics;
import com.msst.storage.StorageClientFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

/**
 * Creates {@link TestExecutor}s bound to a storage client for the given endpoint.
 */
@Service
public class TestExecutorFactory {

    private final StorageClientFactory clientFactory;
    private final MsstMetrics metrics;

    public TestExecutorFactory(StorageClientFactory clientFactory,
                               @Autowired(required = false) MsstMetrics metrics) {
        this.clientFactory = clientFactory;
        this.metrics = metrics;
    }

    public TestExecutor create(EndpointConfig config) {
        return new TestExecutor(clientFactory.create(config), config, metrics);
    }
}
