package com.medicaledu.backend.modules.notifications.application;

import com.medicaledu.backend.global.common.result.Result;
import com.medicaledu.backend.global.pipeline.RequestHandler;
import com.medicaledu.backend.modules.notifications.domain.Notification;
import com.medicaledu.backend.modules.notifications.infrastructure.persistence.NotificationRepository;
import com.medicaledu.backend.modules.notifications.presentation.dto.NotificationItemResponse;
import com.medicaledu.backend.modules.notifications.presentation.dto.NotificationListResponse;

import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@Transactional(readOnly = true)
public class GetNotificationsHandler implements RequestHandler<GetNotificationsQuery, Result<NotificationListResponse>> {

    private final NotificationRepository notificationRepository;

    public GetNotificationsHandler(NotificationRepository notificationRepository) {
        this.notificationRepository = notificationRepository;
    }

    @Override
    public Result<NotificationListResponse> handle(GetNotificationsQuery query) {
        Page<Notification> page = notificationRepository.findForUser(
                query.userId(), query.unreadOnly(), PageRequest.of(query.page(), query.size()));
        long unreadCount = notificationRepository.countByUserIdAndReadFalse(query.userId());
        return Result.success(new NotificationListResponse(
                page.getContent().stream().map(NotificationItemResponse::from).toList(),
                page.getNumber(),
                page.getSize(),
                page.getTotalElements(),
                unreadCount
        ));
    }
}
