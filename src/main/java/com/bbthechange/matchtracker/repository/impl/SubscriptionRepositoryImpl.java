package com.bbthechange.matchtracker.repository.impl;

import com.bbthechange.matchtracker.config.DynamoDBConfig;
import com.bbthechange.matchtracker.exception.RepositoryException;
import com.bbthechange.matchtracker.model.Subscription;
import com.bbthechange.matchtracker.repository.SubscriptionRepository;
import com.bbthechange.matchtracker.util.QueryPerformanceTracker;
import com.bbthechange.matchtracker.util.TrackerKeyFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Repository;
import software.amazon.awssdk.enhanced.dynamodb.TableSchema;
import software.amazon.awssdk.services.dynamodb.DynamoDbClient;
import software.amazon.awssdk.services.dynamodb.model.AttributeValue;
import software.amazon.awssdk.services.dynamodb.model.DeleteItemRequest;
import software.amazon.awssdk.services.dynamodb.model.DeleteItemResponse;
import software.amazon.awssdk.services.dynamodb.model.DynamoDbException;
import software.amazon.awssdk.services.dynamodb.model.GetItemRequest;
import software.amazon.awssdk.services.dynamodb.model.GetItemResponse;
import software.amazon.awssdk.services.dynamodb.model.PutItemRequest;
import software.amazon.awssdk.services.dynamodb.model.QueryRequest;
import software.amazon.awssdk.services.dynamodb.model.QueryResponse;
import software.amazon.awssdk.services.dynamodb.model.ReturnValue;
import software.amazon.awssdk.services.dynamodb.model.ScanRequest;
import software.amazon.awssdk.services.dynamodb.model.ScanResponse;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * DynamoDB-backed SubscriptionRepository on the MatchTrackerTable.
 */
@Repository
public class SubscriptionRepositoryImpl implements SubscriptionRepository {

    private static final Logger logger = LoggerFactory.getLogger(SubscriptionRepositoryImpl.class);

    private static final String TABLE_NAME = DynamoDBConfig.TABLE_NAME;

    private final DynamoDbClient dynamoDbClient;
    private final TableSchema<Subscription> subscriptionSchema;
    private final QueryPerformanceTracker performanceTracker;

    @Autowired
    public SubscriptionRepositoryImpl(DynamoDbClient dynamoDbClient, QueryPerformanceTracker performanceTracker) {
        this.dynamoDbClient = dynamoDbClient;
        this.subscriptionSchema = TableSchema.fromBean(Subscription.class);
        this.performanceTracker = performanceTracker;
    }

    @Override
    public Subscription save(Subscription subscription) {
        return performanceTracker.trackQuery("saveSubscription", TABLE_NAME, () -> {
            try {
                subscription.touch();

                PutItemRequest request = PutItemRequest.builder()
                    .tableName(TABLE_NAME)
                    .item(subscriptionSchema.itemToMap(subscription, true))
                    .build();

                dynamoDbClient.putItem(request);

                logger.debug("Saved subscription of group {} to event {}",
                    subscription.getGroupId(), subscription.getEventId());
                return subscription;

            } catch (DynamoDbException e) {
                logger.error("Failed to save subscription of group {} to event {}",
                    subscription.getGroupId(), subscription.getEventId(), e);
                throw new RepositoryException("Failed to save subscription", e);
            }
        });
    }

    @Override
    public Optional<Subscription> find(String groupId, String eventId) {
        return performanceTracker.trackQuery("findSubscription", TABLE_NAME, () -> {
            try {
                GetItemRequest request = GetItemRequest.builder()
                    .tableName(TABLE_NAME)
                    .key(key(groupId, eventId))
                    .build();

                GetItemResponse response = dynamoDbClient.getItem(request);
                if (!response.hasItem() || response.item().isEmpty()) {
                    return Optional.empty();
                }
                return Optional.of(subscriptionSchema.mapToItem(response.item()));

            } catch (DynamoDbException e) {
                logger.error("Failed to find subscription of group {} to event {}", groupId, eventId, e);
                throw new RepositoryException("Failed to retrieve subscription", e);
            }
        });
    }

    @Override
    public boolean delete(String groupId, String eventId) {
        return performanceTracker.trackQuery("deleteSubscription", TABLE_NAME, () -> {
            try {
                DeleteItemRequest request = DeleteItemRequest.builder()
                    .tableName(TABLE_NAME)
                    .key(key(groupId, eventId))
                    .returnValues(ReturnValue.ALL_OLD)
                    .build();

                DeleteItemResponse response = dynamoDbClient.deleteItem(request);
                boolean existed = response.hasAttributes() && !response.attributes().isEmpty();

                logger.debug("Deleted subscription of group {} to event {} (existed={})", groupId, eventId, existed);
                return existed;

            } catch (DynamoDbException e) {
                logger.error("Failed to delete subscription of group {} to event {}", groupId, eventId, e);
                throw new RepositoryException("Failed to delete subscription", e);
            }
        });
    }

    @Override
    public List<Subscription> findByEventId(String eventId) {
        return performanceTracker.trackQuery("findSubscriptionsByEvent", TABLE_NAME, () -> {
            try {
                List<Subscription> subscriptions = new ArrayList<>();
                Map<String, AttributeValue> lastKey = null;

                do {
                    QueryRequest.Builder builder = QueryRequest.builder()
                        .tableName(TABLE_NAME)
                        .keyConditionExpression("pk = :pk AND begins_with(sk, :prefix)")
                        .expressionAttributeValues(Map.of(
                            ":pk", AttributeValue.builder().s(TrackerKeyFactory.getEventPk(eventId)).build(),
                            ":prefix", AttributeValue.builder().s(TrackerKeyFactory.getSubscriptionPrefix()).build()
                        ));
                    if (lastKey != null) {
                        builder.exclusiveStartKey(lastKey);
                    }

                    QueryResponse response = dynamoDbClient.query(builder.build());
                    response.items().stream()
                        .map(subscriptionSchema::mapToItem)
                        .forEach(subscriptions::add);
                    lastKey = response.hasLastEvaluatedKey() ? response.lastEvaluatedKey() : null;
                } while (lastKey != null && !lastKey.isEmpty());

                logger.debug("Found {} subscriptions for event {}", subscriptions.size(), eventId);
                return subscriptions;

            } catch (DynamoDbException e) {
                logger.error("Failed to query subscriptions for event {}", eventId, e);
                throw new RepositoryException("Failed to query subscriptions by event", e);
            }
        });
    }

    @Override
    public List<Subscription> findAll() {
        return performanceTracker.trackQuery("findAllSubscriptions", TABLE_NAME, () -> {
            try {
                List<Subscription> subscriptions = new ArrayList<>();
                Map<String, AttributeValue> lastKey = null;

                do {
                    ScanRequest.Builder builder = ScanRequest.builder()
                        .tableName(TABLE_NAME)
                        .filterExpression("itemType = :itemType")
                        .expressionAttributeValues(Map.of(
                            ":itemType", AttributeValue.builder().s(Subscription.ITEM_TYPE).build()
                        ));
                    if (lastKey != null) {
                        builder.exclusiveStartKey(lastKey);
                    }

                    ScanResponse response = dynamoDbClient.scan(builder.build());
                    response.items().stream()
                        .map(subscriptionSchema::mapToItem)
                        .forEach(subscriptions::add);
                    lastKey = response.hasLastEvaluatedKey() ? response.lastEvaluatedKey() : null;
                } while (lastKey != null && !lastKey.isEmpty());

                return subscriptions;

            } catch (DynamoDbException e) {
                logger.error("Failed to scan subscriptions", e);
                throw new RepositoryException("Failed to scan subscriptions", e);
            }
        });
    }

    private static Map<String, AttributeValue> key(String groupId, String eventId) {
        return Map.of(
            "pk", AttributeValue.builder().s(TrackerKeyFactory.getEventPk(eventId)).build(),
            "sk", AttributeValue.builder().s(TrackerKeyFactory.getSubscriptionSk(groupId)).build()
        );
    }
}
