package com.socialwatch.platform.monitoring.repository;

import com.socialwatch.platform.monitoring.entity.WebhookDestination;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.UUID;

public interface WebhookDestinationRepository extends JpaRepository<WebhookDestination, UUID> {

    List<WebhookDestination> findByUserIdAndActiveTrue(UUID userId);
}
