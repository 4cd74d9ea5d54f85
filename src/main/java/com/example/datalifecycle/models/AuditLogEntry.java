package com.example.datalifecycle.models;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonInclude.Include;
import java.util.Map;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.NonNull;
import lombok.Setter;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbAttribute;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbBean;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbConvertedBy;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbPartitionKey;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbSecondaryPartitionKey;

@JsonInclude(Include.NON_NULL)
@DynamoDbBean
@NoArgsConstructor
@AllArgsConstructor(access = AccessLevel.PRIVATE)
@Builder(toBuilder = true)
@Getter @Setter
public class AuditLogEntry {

    // Required; Lombok @NonNull adds the null checks to the builder
    @NonNull private String id;
    @NonNull private String action;
    @NonNull private Long createdAt;

    // Identifying fields, cleared once the entry ages past the retention window
    private String userId;
    private String ipAddress;
    private String userAgent;

    // Optional fields
    private String resourceType;
    private String resourceId;
    private Map<String, Object> metadata;

    @DynamoDbPartitionKey
    @DynamoDbAttribute("id")
    public String getId() { return id; }

    @DynamoDbAttribute("action")
    public String getAction() { return action; }

    @DynamoDbAttribute("created_at")
    public Long getCreatedAt() { return createdAt; }

    @DynamoDbSecondaryPartitionKey(indexNames = UserLinked.BY_USER_ID_INDEX)
    @DynamoDbAttribute("user_id")
    public String getUserId() { return userId; }

    @DynamoDbAttribute("ip_address")
    public String getIpAddress() { return ipAddress; }

    @DynamoDbAttribute("user_agent")
    public String getUserAgent() { return userAgent; }

    @DynamoDbAttribute("resource_type")
    public String getResourceType() { return resourceType; }

    @DynamoDbAttribute("resource_id")
    public String getResourceId() { return resourceId; }

    @DynamoDbConvertedBy(JsonStringMapAttributeConverter.class)
    @DynamoDbAttribute("metadata")
    public Map<String, Object> getMetadata() { return metadata; }

    /**
     * Whether any of the identifying fields still holds a value.
     */
    public boolean hasIdentifiers() {
        return userId != null || ipAddress != null || userAgent != null;
    }

    public AuditLogEntry clearIdentifiers() {
        this.userId = null;
        this.ipAddress = null;
        this.userAgent = null;
        return this;
    }
}
