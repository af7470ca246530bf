package com.socialwatch.platform.monitoring.store;

import com.socialwatch.platform.monitoring.entity.DiscoveredPost;
import com.socialwatch.platform.monitoring.entity.MonitoredAccount;
import com.socialwatch.platform.monitoring.entity.WebhookDestination;
import com.socialwatch.platform.monitoring.model.AccountStatus;
import com.socialwatch.platform.monitoring.model.Platform;
import com.socialwatch.platform.monitoring.model.StatField;
import com.socialwatch.platform.monitoring.repository.DailyStatRepository;
import com.socialwatch.platform.monitoring.repository.DiscoveredPostRepository;
import com.socialwatch.platform.monitoring.repository.MonitoredAccountRepository;
import com.socialwatch.platform.monitoring.repository.WebhookDestinationRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.stream.Collectors;

@Component
@RequiredArgsConstructor
@Slf4j
public class JpaMonitoringStore implements MonitoringStore {

    private final MonitoredAccountRepository accountRepository;
    private final DiscoveredPostRepository postRepository;
    private final WebhookDestinationRepository webhookRepository;
    private final DailyStatRepository statRepository;
    private final Clock clock;

    @Override
    @Transactional(readOnly = true)
    public List<MonitoredAccount> listDueAccounts(OffsetDateTime now) {
        return accountRepository.findByStatusOrderByLastCheckAtAsc(AccountStatus.ACTIVE)
                .stream()
                .filter(account -> account.isDue(now))
                .collect(Collectors.toList());
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<MonitoredAccount> findAccount(UUID accountId) {
        return accountRepository.findById(accountId);
    }

    // Not transactional: a unique-key race must not mark an enclosing transaction rollback-only.
    @Override
    public UpsertResult upsertPostIfNew(Platform platform, String platformPostId, DiscoveredPost fields) {
        Optional<DiscoveredPost> existing = postRepository.findByPlatformAndPlatformPostId(platform, platformPostId);
        if (existing.isPresent()) {
            return UpsertResult.existing(existing.get().getId());
        }

        fields.setId(null);
        fields.setPlatform(platform);
        fields.setPlatformPostId(platformPostId);
        fields.setNotified(false);

        try {
            DiscoveredPost saved = postRepository.saveAndFlush(fields);
            return UpsertResult.inserted(saved.getId());
        } catch (DataIntegrityViolationException e) {
            log.info("Post {}/{} was stored concurrently, skipping", platform, platformPostId);
            return postRepository.findByPlatformAndPlatformPostId(platform, platformPostId)
                    .map(post -> UpsertResult.existing(post.getId()))
                    .orElseThrow(() -> e);
        }
    }

    @Override
    @Transactional
    public void updateAccountAfterCheck(UUID accountId, OffsetDateTime checkedAt, String lastPostId, String lastPostContent) {
        MonitoredAccount account = requireAccount(accountId);
        account.setLastCheckAt(checkedAt);
        if (lastPostId != null) {
            account.setLastPostId(lastPostId);
            account.setLastPostContent(lastPostContent);
        }
        account.setConsecutiveErrorCount(0);
        account.setLastErrorMessage(null);
        accountRepository.save(account);
    }

    @Override
    @Transactional
    public int recordAccountError(UUID accountId, String message) {
        MonitoredAccount account = requireAccount(accountId);
        int count = orZero(account.getConsecutiveErrorCount()) + 1;
        account.setConsecutiveErrorCount(count);
        account.setLastErrorMessage(message);
        accountRepository.save(account);
        return count;
    }

    @Override
    @Transactional
    public void pauseAccount(UUID accountId) {
        MonitoredAccount account = requireAccount(accountId);
        account.setStatus(AccountStatus.PAUSED);
        accountRepository.save(account);
    }

    @Override
    @Transactional(readOnly = true)
    public List<WebhookDestination> listActiveWebhooks(UUID userId) {
        return webhookRepository.findByUserIdAndActiveTrue(userId);
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<WebhookDestination> findWebhook(UUID destinationId) {
        return webhookRepository.findById(destinationId);
    }

    @Override
    @Transactional
    public void recordWebhookOutcome(UUID destinationId, boolean success, String errorMessage) {
        WebhookDestination destination = webhookRepository.findById(destinationId)
                .orElseThrow(() -> new IllegalArgumentException("Webhook destination not found: " + destinationId));
        OffsetDateTime now = OffsetDateTime.now(clock);
        if (success) {
            destination.setSuccessCount(orZero(destination.getSuccessCount()) + 1);
            destination.setLastSuccessAt(now);
        } else {
            destination.setFailureCount(orZero(destination.getFailureCount()) + 1);
            destination.setLastFailureAt(now);
            destination.setLastErrorMessage(errorMessage);
        }
        webhookRepository.save(destination);
    }

    @Override
    @Transactional
    public void markPostNotified(UUID postId) {
        postRepository.findById(postId).ifPresent(post -> {
            post.setNotified(true);
            post.setNotifiedAt(OffsetDateTime.now(clock));
            post.setNotificationError(null);
            postRepository.save(post);
        });
    }

    @Override
    @Transactional
    public void recordPostNotificationError(UUID postId, String errorMessage) {
        postRepository.findById(postId).ifPresent(post -> {
            post.setNotificationError(errorMessage);
            postRepository.save(post);
        });
    }

    @Override
    @Transactional
    public void incrementDailyStat(UUID userId, Platform platform, LocalDate date, StatField field) {
        statRepository.upsertIncrement(UUID.randomUUID(), userId, platform.name(), date,
                field == StatField.CHECKS_PERFORMED ? 1 : 0,
                field == StatField.POSTS_FOUND ? 1 : 0,
                field == StatField.NOTIFICATIONS_SENT ? 1 : 0,
                field == StatField.ERRORS ? 1 : 0);
    }

    // rows written by other services may carry null counters
    private static int orZero(Integer value) {
        return value != null ? value : 0;
    }

    private MonitoredAccount requireAccount(UUID accountId) {
        return accountRepository.findById(accountId)
                .orElseThrow(() -> new IllegalArgumentException("Monitored account not found: " + accountId));
    }
}
