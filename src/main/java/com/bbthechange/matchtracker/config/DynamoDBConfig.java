package com.bbthechange.matchtracker.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import software.amazon.awssdk.auth.credentials.AwsBasicCredentials;
import software.amazon.awssdk.auth.credentials.DefaultCredentialsProvider;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;
import software.amazon.awssdk.core.client.config.ClientOverrideConfiguration;
import software.amazon.awssdk.enhanced.dynamodb.DynamoDbEnhancedClient;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.dynamodb.DynamoDbClient;

import java.net.URI;
import java.time.Duration;

/**
 * DynamoDB clients for the tracker's single table.
 * Every store call is bounded by {@code aws.dynamodb.api-call-timeout}.
 */
@Configuration
public class DynamoDBConfig {

    private static final Logger logger = LoggerFactory.getLogger(DynamoDBConfig.class);

    /**
     * Holds subscriptions and notified entries, keyed by {@code EVENT#id}.
     */
    public static final String TABLE_NAME = "MatchTrackerTable";

    @Value("${aws.region:us-west-2}")
    private String region;

    @Value("${aws.dynamodb.endpoint:}")
    private String endpoint;

    @Value("${aws.dynamodb.api-call-timeout:10s}")
    private Duration apiCallTimeout;

    @Bean
    public DynamoDbClient dynamoDbClient() {
        return buildClient(region, endpoint, apiCallTimeout);
    }

    @Bean
    public DynamoDbEnhancedClient dynamoDbEnhancedClient(DynamoDbClient dynamoDbClient) {
        return DynamoDbEnhancedClient.builder()
                .dynamoDbClient(dynamoDbClient)
                .build();
    }

    static DynamoDbClient buildClient(String region, String endpoint, Duration apiCallTimeout) {
        var builder = DynamoDbClient.builder()
                .region(Region.of(region))
                .overrideConfiguration(ClientOverrideConfiguration.builder()
                        .apiCallTimeout(apiCallTimeout)
                        .build());

        if (endpoint != null && !endpoint.isBlank()) {
            // DynamoDB Local accepts any credentials
            logger.info("Using local DynamoDB at {} for table {}", endpoint, TABLE_NAME);
            builder.endpointOverride(URI.create(endpoint))
                   .credentialsProvider(StaticCredentialsProvider.create(
                       AwsBasicCredentials.create("match-tracker", "local")
                   ));
        } else {
            logger.info("Using DynamoDB in {} for table {}", region, TABLE_NAME);
            builder.credentialsProvider(DefaultCredentialsProvider.create());
        }

        return builder.build();
    }
}
