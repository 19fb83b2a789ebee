package com.msst.storage;

import com.msst.core.config.EndpointConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import software.amazon.awssdk.auth.credentials.AwsBasicCredentials;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;
import software.amazon.awssdk.http.SdkHttpConfigurationOption;
import software.amazon.awssdk.http.SdkHttpClient;
import software.amazon.awssdk.http.urlconnection.UrlConnectionHttpClient;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.S3Configuration;
import software.amazon.awssdk.utils.AttributeMap;

import java.net.URI;

/**
 * Builds {@link S3StorageClient}s from endpoint configuration.
 */
@Service
public class StorageClientFactory {

    private static final Logger log = LoggerFactory.getLogger(StorageClientFactory.class);

    public S3StorageClient create(EndpointConfig config) {
        String endpoint = resolveEndpoint(config);
        log.debug("Creating S3 client for {} (region {}, path-style {})",
                endpoint, config.region(), config.pathStyle());

        S3Client s3 = S3Client.builder()
                .endpointOverride(URI.create(endpoint))
                .region(Region.of(config.region()))
                .credentialsProvider(StaticCredentialsProvider.create(
                        AwsBasicCredentials.create(config.accessKey(), config.secretKey())))
                .serviceConfiguration(S3Configuration.builder()
                        .pathStyleAccessEnabled(config.pathStyle())
                        .build())
                .httpClient(httpClient(config))
                .build();
        return new S3StorageClient(s3, config.region(), endpoint);
    }

    /** Endpoint URL with a scheme; a bare host gets http or https per {@code s3_use_ssl}. */
    static String resolveEndpoint(EndpointConfig config) {
        String url = config.endpointUrl().trim();
        if (url.contains("://")) {
            return url;
        }
        return (config.useSsl() ? "https://" : "http://") + url;
    }

    private static SdkHttpClient httpClient(EndpointConfig config) {
        if (config.verifySsl()) {
            return UrlConnectionHttpClient.builder().build();
        }
        log.warn("TLS certificate verification disabled for {}", config.endpointUrl());
        return UrlConnectionHttpClient.builder().buildWithDefaults(AttributeMap.builder()
                .put(SdkHttpConfigurationOption.TRUST_ALL_CERTIFICATES, Boolean.TRUE)
                .build());
    }
}
