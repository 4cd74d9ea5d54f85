package com.example.datalifecycle.access;

import com.example.datalifecycle.models.Notification;

public interface NotificationAccess extends UserLinkedDataAccess<Notification> {
}
