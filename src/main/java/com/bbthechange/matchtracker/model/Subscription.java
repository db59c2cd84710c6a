package com.bbthechange.matchtracker.model;

import com.bbthechange.matchtracker.util.TrackerKeyFactory;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.ToString;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbBean;

/**
 * A group's subscription to an event.
 *
 * Key Pattern: PK = EVENT#{eventId}, SK = GROUP#{groupId}
 */
@ToString
@NoArgsConstructor
@EqualsAndHashCode(callSuper = true)
@DynamoDbBean
public class Subscription extends BaseItem {

    public static final String ITEM_TYPE = "SUBSCRIPTION";

    @Getter @Setter
    private String groupId;
    @Getter @Setter
    private String eventId;
    @Getter @Setter
    private String title;
    // MM-DD, year inferred at evaluation time
    @Getter @Setter
    private String startDate;
    @Getter @Setter
    private String endDate;

    public Subscription(String groupId, String eventId, String title, String startDate, String endDate) {
        super();
        setItemType(ITEM_TYPE);
        this.groupId = groupId;
        this.eventId = eventId;
        this.title = title;
        this.startDate = startDate;
        this.endDate = endDate;
        setPk(TrackerKeyFactory.getEventPk(eventId));
        setSk(TrackerKeyFactory.getSubscriptionSk(groupId));
    }
}
