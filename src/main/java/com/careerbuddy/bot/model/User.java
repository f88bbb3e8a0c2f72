package com.careerbuddy.bot.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.EnumMap;
import java.util.Map;

@Entity
@Table(name = "users")
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class User {

    @Id
    private Long telegramId;

    private String firstName;

    private String username;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    @Builder.Default
    private Tier tier = Tier.FREE;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "user_document_counts", joinColumns = @JoinColumn(name = "user_id"))
    @MapKeyEnumerated(EnumType.STRING)
    @MapKeyColumn(name = "document_type")
    @Column(name = "used_count", nullable = false)
    @Builder.Default
    private Map<DocumentType, Integer> documentCounts = new EnumMap<>(DocumentType.class);

    @Column(name = "quota_reset_at")
    private LocalDateTime quotaResetAt;

    @Column(name = "premium_expires_at")
    private LocalDateTime premiumExpiresAt;

    @Column(name = "registered_at")
    private LocalDateTime registeredAt;

    @Column(name = "last_activity")
    private LocalDateTime lastActivity;

    @Version
    private Long version;

    public int getUsed(DocumentType type) {
        return documentCounts.getOrDefault(type, 0);
    }

    /** Zeroes every document type counter, keeping all types present. */
    public void resetCounters() {
        for (DocumentType type : DocumentType.values()) {
            documentCounts.put(type, 0);
        }
    }

    public void increment(DocumentType type) {
        documentCounts.merge(type, 1, Integer::sum);
    }

    public boolean isPro() {
        return tier == Tier.PRO;
    }
}
