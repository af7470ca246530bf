package com.socialwatch.platform.monitoring.repository;

import com.socialwatch.platform.monitoring.entity.DailyStat;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.LocalDate;
import java.util.UUID;

public interface DailyStatRepository extends JpaRepository<DailyStat, UUID> {

    /**
     * Creates the (user, platform, day) row or adds the deltas to it in one statement.
     * {@code id} is only used when the row is created.
     */
    @Modifying
    @Query(value = "INSERT INTO daily_stats (id, user_id, platform, stat_date, checks_performed, posts_found, "
            + "notifications_sent, errors, updated_at) "
            + "VALUES (:id, :userId, :platform, :statDate, :checks, :posts, :notifications, :errors, now()) "
            + "ON CONFLICT (user_id, platform, stat_date) DO UPDATE SET "
            + "checks_performed = COALESCE(daily_stats.checks_performed, 0) + EXCLUDED.checks_performed, "
            + "posts_found = COALESCE(daily_stats.posts_found, 0) + EXCLUDED.posts_found, "
            + "notifications_sent = COALESCE(daily_stats.notifications_sent, 0) + EXCLUDED.notifications_sent, "
            + "errors = COALESCE(daily_stats.errors, 0) + EXCLUDED.errors, "
            + "updated_at = now()",
            nativeQuery = true)
    int upsertIncrement(@Param("id") UUID id,
                        @Param("userId") UUID userId,
                        @Param("platform") String platform,
                        @Param("statDate") LocalDate statDate,
                        @Param("checks") int checks,
                        @Param("posts") int posts,
                        @Param("notifications") int notifications,
                        @Param("errors") int errors);
}
