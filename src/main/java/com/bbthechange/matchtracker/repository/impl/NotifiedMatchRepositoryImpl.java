package com.bbthechange.matchtracker.repository.impl;

import com.bbthechange.matchtracker.config.DynamoDBConfig;
import com.bbthechange.matchtracker.exception.RepositoryException;
import com.bbthechange.matchtracker.model.NotificationCategory;
import com.bbthechange.matchtracker.model.NotifiedMatch;
import com.bbthechange.matchtracker.repository.NotifiedMatchRepository;
import com.bbthechange.matchtracker.util.QueryPerformanceTracker;
import com.bbthechange.matchtracker.util.TrackerKeyFactory;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Repository;
import software.amazon.awssdk.enhanced.dynamodb.TableSchema;
import software.amazon.awssdk.services.dynamodb.DynamoDbClient;
import software.amazon.awssdk.services.dynamodb.model.AttributeValue;
import software.amazon.awssdk.services.dynamodb.model.ConditionalCheckFailedException;
import software.amazon.awssdk.services.dynamodb.model.DeleteItemRequest;
import software.amazon.awssdk.services.dynamodb.model.DynamoDbException;
import software.amazon.awssdk.services.dynamodb.model.GetItemRequest;
import software.amazon.awssdk.services.dynamodb.model.GetItemResponse;
import software.amazon.awssdk.services.dynamodb.model.PutItemRequest;
import software.amazon.awssdk.services.dynamodb.model.QueryRequest;
import software.amazon.awssdk.services.dynamodb.model.QueryResponse;
import software.amazon.awssdk.services.dynamodb.model.ScanRequest;
import software.amazon.awssdk.services.dynamodb.model.ScanResponse;

import java.time.Clock;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.TimeUnit;

/**
 * DynamoDB-backed notified sets. Inserts are conditional so an entry is written once.
 * Positive lookups are cached in memory since entries never change once written.
 */
@Repository
public class NotifiedMatchRepositoryImpl implements NotifiedMatchRepository {

    private static final Logger logger = LoggerFactory.getLogger(NotifiedMatchRepositoryImpl.class);

    private static final String TABLE_NAME = DynamoDBConfig.TABLE_NAME;

    private final DynamoDbClient dynamoDbClient;
    private final TableSchema<NotifiedMatch> notifiedSchema;
    private final QueryPerformanceTracker performanceTracker;
    private final Clock clock;

    // eventId|sk -> present
    private final Cache<String, Boolean> notifiedCache = Caffeine.newBuilder()
            .expireAfterAccess(12, TimeUnit.HOURS)
            .maximumSize(10_000)
            .build();

    @Autowired
    public NotifiedMatchRepositoryImpl(DynamoDbClient dynamoDbClient,
                                       QueryPerformanceTracker performanceTracker,
                                       Clock clock) {
        this.dynamoDbClient = dynamoDbClient;
        this.notifiedSchema = TableSchema.fromBean(NotifiedMatch.class);
        this.performanceTracker = performanceTracker;
        this.clock = clock;
    }

    @Override
    public boolean isNotified(String eventId, NotificationCategory category, String matchId) {
        String cacheKey = cacheKey(eventId, category, matchId);
        if (notifiedCache.getIfPresent(cacheKey) != null) {
            return true;
        }

        return performanceTracker.trackQuery("isNotified", TABLE_NAME, () -> {
            try {
                GetItemRequest request = GetItemRequest.builder()
                    .tableName(TABLE_NAME)
                    .key(key(eventId, category, matchId))
                    .consistentRead(true)
                    .build();

                GetItemResponse response = dynamoDbClient.getItem(request);
                boolean present = response.hasItem() && !response.item().isEmpty();
                if (present) {
                    notifiedCache.put(cacheKey, Boolean.TRUE);
                }
                return present;

            } catch (DynamoDbException e) {
                logger.error("Failed to read {} notified entry for match {} of event {}",
                    category, matchId, eventId, e);
                throw new RepositoryException("Failed to read notified entry", e);
            }
        });
    }

    @Override
    public boolean markNotified(String eventId, NotificationCategory category, String matchId) {
        String cacheKey = cacheKey(eventId, category, matchId);
        if (notifiedCache.getIfPresent(cacheKey) != null) {
            return false;
        }

        return performanceTracker.trackQuery("markNotified", TABLE_NAME, () -> {
            try {
                NotifiedMatch entry = new NotifiedMatch(eventId, category, matchId, clock.instant());

                PutItemRequest request = PutItemRequest.builder()
                    .tableName(TABLE_NAME)
                    .item(notifiedSchema.itemToMap(entry, true))
                    .conditionExpression("attribute_not_exists(pk)")
                    .build();

                dynamoDbClient.putItem(request);
                notifiedCache.put(cacheKey, Boolean.TRUE);

                logger.debug("Marked match {} of event {} as {} notified", matchId, eventId, category);
                return true;

            } catch (ConditionalCheckFailedException e) {
                notifiedCache.put(cacheKey, Boolean.TRUE);
                logger.debug("Match {} of event {} already {} notified", matchId, eventId, category);
                return false;

            } catch (DynamoDbException e) {
                logger.error("Failed to mark match {} of event {} as {} notified", matchId, eventId, category, e);
                throw new RepositoryException("Failed to write notified entry", e);
            }
        });
    }

    @Override
    public int deleteByEventId(String eventId) {
        int deleted = performanceTracker.trackQuery("deleteNotifiedByEvent", TABLE_NAME, () -> {
            try {
                int count = 0;
                Map<String, AttributeValue> lastKey = null;

                do {
                    QueryRequest.Builder builder = QueryRequest.builder()
                        .tableName(TABLE_NAME)
                        .keyConditionExpression("pk = :pk AND begins_with(sk, :prefix)")
                        .projectionExpression("pk, sk")
                        .expressionAttributeValues(Map.of(
                            ":pk", AttributeValue.builder().s(TrackerKeyFactory.getEventPk(eventId)).build(),
                            ":prefix", AttributeValue.builder().s(TrackerKeyFactory.getNotifiedPrefix()).build()
                        ));
                    if (lastKey != null) {
                        builder.exclusiveStartKey(lastKey);
                    }

                    QueryResponse response = dynamoDbClient.query(builder.build());
                    for (Map<String, AttributeValue> item : response.items()) {
                        dynamoDbClient.deleteItem(DeleteItemRequest.builder()
                            .tableName(TABLE_NAME)
                            .key(Map.of("pk", item.get("pk"), "sk", item.get("sk")))
                            .build());
                        count++;
                    }
                    lastKey = response.hasLastEvaluatedKey() ? response.lastEvaluatedKey() : null;
                } while (lastKey != null && !lastKey.isEmpty());

                return count;

            } catch (DynamoDbException e) {
                logger.error("Failed to delete notified entries for event {}", eventId, e);
                throw new RepositoryException("Failed to delete notified entries", e);
            }
        });

        String prefix = eventId + "|";
        notifiedCache.asMap().keySet().removeIf(key -> key.startsWith(prefix));
        logger.info("Removed {} notified entries for event {}", deleted, eventId);
        return deleted;
    }

    @Override
    public Set<String> findEventIdsWithEntries() {
        return performanceTracker.trackQuery("findNotifiedEventIds", TABLE_NAME, () -> {
            try {
                Set<String> eventIds = new HashSet<>();
                Map<String, AttributeValue> lastKey = null;

                do {
                    ScanRequest.Builder builder = ScanRequest.builder()
                        .tableName(TABLE_NAME)
                        .filterExpression("itemType = :itemType")
                        .projectionExpression("eventId")
                        .expressionAttributeValues(Map.of(
                            ":itemType", AttributeValue.builder().s(NotifiedMatch.ITEM_TYPE).build()
                        ));
                    if (lastKey != null) {
                        builder.exclusiveStartKey(lastKey);
                    }

                    ScanResponse response = dynamoDbClient.scan(builder.build());
                    for (Map<String, AttributeValue> item : response.items()) {
                        AttributeValue eventId = item.get("eventId");
                        if (eventId != null && eventId.s() != null) {
                            eventIds.add(eventId.s());
                        }
                    }
                    lastKey = response.hasLastEvaluatedKey() ? response.lastEvaluatedKey() : null;
                } while (lastKey != null && !lastKey.isEmpty());

                return eventIds;

            } catch (DynamoDbException e) {
                logger.error("Failed to scan notified entries", e);
                throw new RepositoryException("Failed to scan notified entries", e);
            }
        });
    }

    private static Map<String, AttributeValue> key(String eventId, NotificationCategory category, String matchId) {
        return Map.of(
            "pk", AttributeValue.builder().s(TrackerKeyFactory.getEventPk(eventId)).build(),
            "sk", AttributeValue.builder().s(TrackerKeyFactory.getNotifiedSk(category, matchId)).build()
        );
    }

    private static String cacheKey(String eventId, NotificationCategory category, String matchId) {
        return eventId + "|" + category.name() + "|" + matchId;
    }
}
