package com.bbthechange.matchtracker.service.impl;

import com.bbthechange.matchtracker.dto.NotificationPayload;
import com.bbthechange.matchtracker.service.NotificationSink;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;
import software.amazon.awssdk.services.sns.SnsClient;
import software.amazon.awssdk.services.sns.model.MessageAttributeValue;
import software.amazon.awssdk.services.sns.model.PublishRequest;
import software.amazon.awssdk.services.sns.model.PublishResponse;
import software.amazon.awssdk.services.sns.model.SnsException;

import java.util.HashMap;
import java.util.Map;

/**
 * Publishes notifications to an SNS topic. Bot adapters subscribe to the topic and
 * filter on the groupId message attribute.
 */
@Service
@ConditionalOnProperty(name = "tracker.notifications.sns.enabled", havingValue = "true")
public class SnsNotificationSink implements NotificationSink {

    private static final Logger logger = LoggerFactory.getLogger(SnsNotificationSink.class);

    private final SnsClient snsClient;
    private final ObjectMapper objectMapper;
    private final MeterRegistry meterRegistry;
    private final String topicArn;

    @Autowired
    public SnsNotificationSink(SnsClient snsClient,
                               ObjectMapper objectMapper,
                               MeterRegistry meterRegistry,
                               @Value("${tracker.notifications.sns.topic-arn}") String topicArn) {
        this.snsClient = snsClient;
        this.objectMapper = objectMapper;
        this.meterRegistry = meterRegistry;
        this.topicArn = topicArn;
    }

    @Override
    public boolean deliver(String groupId, NotificationPayload payload) {
        try {
            Map<String, MessageAttributeValue> messageAttributes = new HashMap<>();
            messageAttributes.put("groupId", stringAttribute(groupId));
            messageAttributes.put("category", stringAttribute(payload.getCategory().name()));

            PublishRequest request = PublishRequest.builder()
                    .topicArn(topicArn)
                    .subject(payload.getTitle())
                    .message(objectMapper.writeValueAsString(payload))
                    .messageAttributes(messageAttributes)
                    .build();

            PublishResponse response = snsClient.publish(request);
            logger.info("Published {} notification for match {} to group {} with messageId: {}",
                    payload.getCategory(), payload.getMatchId(), groupId, response.messageId());
            meterRegistry.counter("tracker_sns_publish_total", "status", "success").increment();
            return true;

        } catch (JsonProcessingException e) {
            logger.error("Could not serialize notification for match {}", payload.getMatchId(), e);
            meterRegistry.counter("tracker_sns_publish_total", "status", "serialization_error").increment();
            return false;
        } catch (SnsException e) {
            logger.error("Failed to publish notification for match {} to group {}: {}",
                    payload.getMatchId(), groupId, e.getMessage(), e);
            meterRegistry.counter("tracker_sns_publish_total", "status", "error").increment();
            return false;
        }
    }

    private static MessageAttributeValue stringAttribute(String value) {
        return MessageAttributeValue.builder()
                .dataType("String")
                .stringValue(value)
                .build();
    }
}
