package com.example.datalifecycle.models;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.NonNull;
import lombok.Setter;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbAttribute;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbBean;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbPartitionKey;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbSecondaryPartitionKey;

@DynamoDbBean
@NoArgsConstructor
@AllArgsConstructor(access = AccessLevel.PRIVATE)
@Builder(toBuilder = true)
@Getter @Setter
public class Notification implements UserLinked {

    @NonNull private String id;
    @NonNull private String userId;
    @NonNull private String type;

    private String title;
    private Long createdAt;

    @Override
    @DynamoDbPartitionKey
    @DynamoDbAttribute("id")
    public String getId() { return id; }

    @Override
    @DynamoDbSecondaryPartitionKey(indexNames = BY_USER_ID_INDEX)
    @DynamoDbAttribute("user_id")
    public String getUserId() { return userId; }

    @DynamoDbAttribute("type")
    public String getType() { return type; }

    @DynamoDbAttribute("title")
    public String getTitle() { return title; }

    @DynamoDbAttribute("created_at")
    public Long getCreatedAt() { return createdAt; }
}
