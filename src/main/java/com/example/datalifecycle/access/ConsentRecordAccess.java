package com.example.datalifecycle.access;

import com.example.datalifecycle.models.ConsentRecord;

public interface ConsentRecordAccess extends UserLinkedDataAccess<ConsentRecord> {
}
