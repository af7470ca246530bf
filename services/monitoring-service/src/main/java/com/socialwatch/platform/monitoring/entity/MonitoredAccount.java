package com.socialwatch.platform.monitoring.entity;

import com.socialwatch.platform.monitoring.model.AccountStatus;
import com.socialwatch.platform.monitoring.model.Platform;
import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import java.time.OffsetDateTime;
import java.util.UUID;

@Entity
@Table(name = "monitored_accounts",
        uniqueConstraints = @UniqueConstraint(name = "uk_monitored_account",
                columnNames = {"user_id", "platform", "target_account_id"}))
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MonitoredAccount {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "user_id", nullable = false)
    private UUID userId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 50)
    private Platform platform;

    @Column(name = "target_account_id", nullable = false, length = 200)
    private String targetAccountId;

    @Column(name = "target_username", length = 200)
    private String targetUsername;

    @Column(name = "target_display_name", length = 200)
    private String targetDisplayName;

    @Enumerated(EnumType.STRING)
    @Column(length = 20)
    @Builder.Default
    private AccountStatus status = AccountStatus.ACTIVE;

    @Column(name = "check_interval_minutes")
    @Builder.Default
    private Integer checkIntervalMinutes = 30;

    @Column(name = "last_check_at")
    private OffsetDateTime lastCheckAt;

    @Column(name = "last_post_id", length = 500)
    private String lastPostId;

    @Column(name = "last_post_content", columnDefinition = "TEXT")
    private String lastPostContent;

    @Column(name = "consecutive_error_count")
    @Builder.Default
    private Integer consecutiveErrorCount = 0;

    @Column(name = "last_error_message", columnDefinition = "TEXT")
    private String lastErrorMessage;

    @CreationTimestamp
    @Column(name = "created_at")
    private OffsetDateTime createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at")
    private OffsetDateTime updatedAt;

    public boolean isDue(OffsetDateTime now) {
        if (lastCheckAt == null) {
            return true;
        }
        int interval = checkIntervalMinutes != null ? checkIntervalMinutes : 30;
        return !lastCheckAt.plusMinutes(interval).isAfter(now);
    }

    public String label() {
        return targetDisplayName != null ? targetDisplayName
                : targetUsername != null ? targetUsername : targetAccountId;
    }
}
