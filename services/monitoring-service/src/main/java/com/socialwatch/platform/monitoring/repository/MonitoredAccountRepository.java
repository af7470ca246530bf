package com.socialwatch.platform.monitoring.repository;

import com.socialwatch.platform.monitoring.entity.MonitoredAccount;
import com.socialwatch.platform.monitoring.model.AccountStatus;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.UUID;

public interface MonitoredAccountRepository extends JpaRepository<MonitoredAccount, UUID> {

    List<MonitoredAccount> findByStatusOrderByLastCheckAtAsc(AccountStatus status);
}
