package com.socialwatch.platform.monitoring.entity;

import com.socialwatch.platform.monitoring.model.Platform;
import com.socialwatch.platform.monitoring.model.StatField;
import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.UpdateTimestamp;

import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.util.UUID;

@Entity
@Table(name = "daily_stats",
        uniqueConstraints = @UniqueConstraint(name = "uk_user_platform_date",
                columnNames = {"user_id", "platform", "stat_date"}))
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DailyStat {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "user_id", nullable = false)
    private UUID userId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 50)
    private Platform platform;

    @Column(name = "stat_date", nullable = false)
    private LocalDate statDate;

    @Column(name = "checks_performed")
    @Builder.Default
    private Integer checksPerformed = 0;

    @Column(name = "posts_found")
    @Builder.Default
    private Integer postsFound = 0;

    @Column(name = "notifications_sent")
    @Builder.Default
    private Integer notificationsSent = 0;

    @Builder.Default
    private Integer errors = 0;

    @UpdateTimestamp
    @Column(name = "updated_at")
    private OffsetDateTime updatedAt;

    public void increment(StatField field) {
        switch (field) {
            case CHECKS_PERFORMED -> checksPerformed = next(checksPerformed);
            case POSTS_FOUND -> postsFound = next(postsFound);
            case NOTIFICATIONS_SENT -> notificationsSent = next(notificationsSent);
            case ERRORS -> errors = next(errors);
        }
    }

    private static Integer next(Integer value) {
        return value != null ? value + 1 : 1;
    }
}
