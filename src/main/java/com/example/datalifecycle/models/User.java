package com.example.datalifecycle.models;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonInclude.Include;
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

/**
 * Platform account as seen by the data-lifecycle engine. Only the PII fields, the
 * terminal markers and the visibility flags are mapped; everything else on the row
 * is left untouched by updates because the engine never writes attributes it does not know.
 */
@JsonInclude(Include.NON_NULL)
@DynamoDbBean
@NoArgsConstructor                     // needed for DynamoDB Enhanced Client reflection
@AllArgsConstructor(access = AccessLevel.PRIVATE) // used by Lombok @Builder
@Builder(toBuilder = true)
@Getter @Setter
public class User {

    @NonNull
    private String id;

    @NonNull
    private String email;

    private String name;
    private String bio;
    private String avatarUrl;

    private Long createdAt;
    private Long anonymizedAt;
    private Long deletedAt;

    private Boolean showEmailOnProfile;
    private Boolean includeInSearch;
    private Boolean showActivityPublicly;

    @DynamoDbPartitionKey
    @DynamoDbAttribute("id")
    public String getId() { return id; }

    @DynamoDbAttribute("email")
    public String getEmail() { return email; }

    @DynamoDbAttribute("name")
    public String getName() { return name; }

    @DynamoDbAttribute("bio")
    public String getBio() { return bio; }

    @DynamoDbAttribute("avatar_url")
    public String getAvatarUrl() { return avatarUrl; }

    @DynamoDbAttribute("created_at")
    public Long getCreatedAt() { return createdAt; }

    @DynamoDbAttribute("anonymized_at")
    public Long getAnonymizedAt() { return anonymizedAt; }

    @DynamoDbAttribute("deleted_at")
    public Long getDeletedAt() { return deletedAt; }

    @DynamoDbAttribute("show_email_on_profile")
    public Boolean getShowEmailOnProfile() { return showEmailOnProfile; }

    @DynamoDbAttribute("include_in_search")
    public Boolean getIncludeInSearch() { return includeInSearch; }

    @DynamoDbAttribute("show_activity_publicly")
    public Boolean getShowActivityPublicly() { return showActivityPublicly; }
}
