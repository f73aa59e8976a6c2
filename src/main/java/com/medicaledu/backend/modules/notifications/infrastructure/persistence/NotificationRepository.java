package com.medicaledu.backend.modules.notifications.infrastructure.persistence;

import java.time.OffsetDateTime;
import java.util.Optional;
import java.util.UUID;

import com.medicaledu.backend.modules.notifications.domain.Notification;

import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface NotificationRepository extends JpaRepository<Notification, UUID> {

    Optional<Notification> findByIdAndUserId(UUID id, UUID userId);

    long countByUserIdAndReadFalse(UUID userId);

    @Query("""
            select n
              from Notification n
             where n.userId = :userId
               and (:unreadOnly = false or n.read = false)
             order by case when n.read = false then 0 else 1 end,
                      n.createdAt desc
            """)
    Page<Notification> findForUser(@Param("userId") UUID userId,
                                   @Param("unreadOnly") boolean unreadOnly,
                                   Pageable pageable);

    @Modifying
    @Query("""
            update Notification n
               set n.read = true,
                   n.readAt = :now
             where n.userId = :userId
               and n.read = false
            """)
    int markAllRead(@Param("userId") UUID userId, @Param("now") OffsetDateTime now);
}
