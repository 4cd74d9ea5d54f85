package com.example.datalifecycle.service;

import com.example.datalifecycle.models.DeletionOptions;
import com.example.datalifecycle.models.User;
import java.time.Instant;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Pure decisions about what to destroy: which strategy applies to a deletion request, what an
 * anonymized user looks like, and which metadata keys are stripped from aged audit entries.
 * Nothing here touches the store.
 */
public class PiiScrubPolicy {

    public static final String SENTINEL_NAME = "[Deleted User]";
    public static final String PLACEHOLDER_EMAIL_DOMAIN = "deleted.local";
    public static final List<String> DEFAULT_PII_METADATA_KEYS = List.of("email", "name", "phoneNumber", "address");

    private final Set<String> piiMetadataKeys;

    public PiiScrubPolicy(Collection<String> piiMetadataKeys) {
        this.piiMetadataKeys = Collections.unmodifiableSet(new LinkedHashSet<>(piiMetadataKeys));
    }

    public static PiiScrubPolicy defaults() {
        return new PiiScrubPolicy(DEFAULT_PII_METADATA_KEYS);
    }

    /**
     * Only an explicit {@code anonymizeContributions=false} selects a full delete; missing options
     * or a missing flag mean anonymize.
     */
    public DeletionStrategy selectStrategy(DeletionOptions options) {
        if (options != null && Boolean.FALSE.equals(options.getAnonymizeContributions())) {
            return DeletionStrategy.FULL_DELETE;
        }
        return DeletionStrategy.ANONYMIZE;
    }

    public static String placeholderEmail(String userId) {
        return "deleted-" + userId + "@" + PLACEHOLDER_EMAIL_DOMAIN;
    }

    /**
     * Returns a copy of the user with every identifying field replaced. The input is not modified.
     */
    public User anonymize(User user, Instant processedAt) {
        long now = processedAt.toEpochMilli();
        return user.toBuilder()
                .email(placeholderEmail(user.getId()))
                .name(SENTINEL_NAME)
                .bio(null)
                .avatarUrl(null)
                .anonymizedAt(now)
                .deletedAt(now)
                .showEmailOnProfile(false)
                .includeInSearch(false)
                .showActivityPublicly(false)
                .build();
    }

    /**
     * Removes the configured PII keys from the top level of an audit metadata bag.
     */
    public MetadataScrub scrubMetadata(Map<String, Object> metadata) {
        if (metadata == null) {
            return new MetadataScrub(null, Set.of());
        }
        Map<String, Object> sanitized = new LinkedHashMap<>(metadata);
        Set<String> removed = new LinkedHashSet<>();
        for (String key : piiMetadataKeys) {
            if (sanitized.containsKey(key)) {
                sanitized.remove(key);
                removed.add(key);
            }
        }
        return new MetadataScrub(sanitized, removed);
    }

    public record MetadataScrub(Map<String, Object> sanitized, Set<String> removedKeys) {

        public boolean changed() {
            return !removedKeys.isEmpty();
        }
    }
}
