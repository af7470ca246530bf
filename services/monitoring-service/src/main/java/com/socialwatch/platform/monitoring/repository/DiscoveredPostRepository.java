package com.socialwatch.platform.monitoring.repository;

import com.socialwatch.platform.monitoring.entity.DiscoveredPost;
import com.socialwatch.platform.monitoring.model.Platform;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Optional;
import java.util.UUID;

public interface DiscoveredPostRepository extends JpaRepository<DiscoveredPost, UUID> {

    Optional<DiscoveredPost> findByPlatformAndPlatformPostId(Platform platform, String platformPostId);
}
