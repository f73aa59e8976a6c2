package com.medicaledu.backend.modules.users.application;

import java.time.Clock;
import java.time.OffsetDateTime;

import com.medicaledu.backend.global.common.result.Result;
import com.medicaledu.backend.global.pipeline.RequestHandler;
import com.medicaledu.backend.modules.users.domain.User;
import com.medicaledu.backend.modules.users.infrastructure.persistence.UserRepository;
import com.medicaledu.backend.modules.users.infrastructure.persistence.UserSessionRepository;
import com.medicaledu.backend.modules.users.presentation.dto.UserResponse;

import org.springframework.stereotype.Service;

@Service
public class DeactivateUserHandler implements RequestHandler<DeactivateUserCommand, Result<UserResponse>> {

    private static final String REASON_DEACTIVATED = "USER_DEACTIVATED";

    private final UserRepository userRepository;
    private final UserSessionRepository userSessionRepository;
    private final Clock clock;

    public DeactivateUserHandler(UserRepository userRepository, UserSessionRepository userSessionRepository, Clock clock) {
        this.userRepository = userRepository;
        this.userSessionRepository = userSessionRepository;
        this.clock = clock;
    }

    @Override
    public Result<UserResponse> handle(DeactivateUserCommand command) {
        User user = userRepository.findById(command.userId()).orElse(null);
        if (user == null) {
            return Result.notFound("USER_NOT_FOUND");
        }
        if (!user.isActive()) {
            return Result.conflict("USER_ALREADY_INACTIVE");
        }
        OffsetDateTime now = OffsetDateTime.now(clock);
        user.deactivate(now);
        userRepository.save(user);
        userSessionRepository.revokeAllActiveSessions(user.getId(), now, REASON_DEACTIVATED);
        return Result.success(UserResponse.from(user));
    }
}
