package com.xammer.anomaly.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import software.amazon.awssdk.auth.credentials.DefaultCredentialsProvider;
import software.amazon.awssdk.core.client.config.ClientOverrideConfiguration;
import software.amazon.awssdk.core.retry.RetryPolicy;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.costexplorer.CostExplorerClient;

import java.time.Duration;

@Configuration
public class AwsConfig {

    @Value("${aws.region:us-east-1}")
    private String region;

    @Value("${aws.costexplorer.api-call-timeout-seconds:60}")
    private long apiCallTimeoutSeconds;

    @Value("${aws.costexplorer.max-retries:2}")
    private int maxRetries;

    private DefaultCredentialsProvider getCredentialsProvider() {
        return DefaultCredentialsProvider.create();
    }

    @Bean(destroyMethod = "close")
    public CostExplorerClient costExplorerClient() {
        return CostExplorerClient.builder()
                .region(Region.of(region))
                .credentialsProvider(getCredentialsProvider())
                .overrideConfiguration(ClientOverrideConfiguration.builder()
                        .apiCallTimeout(Duration.ofSeconds(apiCallTimeoutSeconds))
                        .retryPolicy(RetryPolicy.builder().numRetries(maxRetries).build())
                        .build())
                .build();
    }
}
