package com.bbthechange.matchtracker.model;

public enum NotificationCategory {
    START,
    RESULT
}
