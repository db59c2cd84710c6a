package com.bbthechange.matchtracker.dto;

import com.bbthechange.matchtracker.model.NotificationCategory;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * What a sink delivers to a group for a match start or result.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class NotificationPayload {

    private NotificationCategory category;
    private String eventId;
    private String eventTitle;
    private String matchId;
    private String title;
    private String body;
}
