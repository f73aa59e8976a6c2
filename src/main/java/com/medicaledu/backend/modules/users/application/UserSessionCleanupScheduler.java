package com.medicaledu.backend.modules.users.application;

import java.time.Clock;
import java.time.Duration;
import java.time.OffsetDateTime;

import com.medicaledu.backend.modules.users.infrastructure.persistence.UserSessionRepository;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

@Component
public class UserSessionCleanupScheduler {

    private static final Logger log = LoggerFactory.getLogger(UserSessionCleanupScheduler.class);

    static final Duration RETENTION = Duration.ofDays(30);

    private final UserSessionRepository userSessionRepository;
    private final Clock clock;

    public UserSessionCleanupScheduler(UserSessionRepository userSessionRepository, Clock clock) {
        this.userSessionRepository = userSessionRepository;
        this.clock = clock;
    }

    @Scheduled(cron = "0 30 3 * * *")
    @Transactional
    public void purgeStaleSessions() {
        OffsetDateTime threshold = OffsetDateTime.now(clock).minus(RETENTION);
        int deleted = userSessionRepository.deleteStaleSessions(threshold);
        if (deleted > 0) {
            log.info("Purged {} user sessions older than {}", deleted, threshold);
        }
    }
}
