package com.bbthechange.matchtracker.model;

import com.bbthechange.matchtracker.util.InstantAsLongAttributeConverter;
import com.bbthechange.matchtracker.util.TrackerKeyFactory;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.ToString;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbBean;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbConvertedBy;

import java.time.Instant;

/**
 * Entry of a notified set. Its presence means the match was already notified for the category.
 *
 * Key Pattern: PK = EVENT#{eventId}, SK = NOTIFIED#{category}#{matchId}
 */
@ToString
@NoArgsConstructor
@EqualsAndHashCode(callSuper = true)
@DynamoDbBean
public class NotifiedMatch extends BaseItem {

    public static final String ITEM_TYPE = "NOTIFIED";

    @Getter @Setter
    private String eventId;
    @Getter @Setter
    private String matchId;
    @Getter @Setter
    private String category;

    private Instant notifiedAt;

    public NotifiedMatch(String eventId, NotificationCategory category, String matchId, Instant notifiedAt) {
        super();
        setItemType(ITEM_TYPE);
        this.eventId = eventId;
        this.matchId = matchId;
        this.category = category.name();
        this.notifiedAt = notifiedAt;
        setPk(TrackerKeyFactory.getEventPk(eventId));
        setSk(TrackerKeyFactory.getNotifiedSk(category, matchId));
    }

    @DynamoDbConvertedBy(InstantAsLongAttributeConverter.class)
    public Instant getNotifiedAt() {
        return notifiedAt;
    }

    public void setNotifiedAt(Instant notifiedAt) {
        this.notifiedAt = notifiedAt;
    }
}
