package com.medicaledu.backend.modules.users.application;

import java.time.Clock;
import java.time.OffsetDateTime;

import com.medicaledu.backend.global.common.result.Result;
import com.medicaledu.backend.global.pipeline.RequestHandler;
import com.medicaledu.backend.modules.users.domain.User;
import com.medicaledu.backend.modules.users.infrastructure.persistence.UserRepository;
import com.medicaledu.backend.modules.users.presentation.dto.UserResponse;

import org.springframework.stereotype.Service;

@Service
public class ConfirmEmailHandler implements RequestHandler<ConfirmEmailCommand, Result<UserResponse>> {

    private final UserRepository userRepository;
    private final Clock clock;

    public ConfirmEmailHandler(UserRepository userRepository, Clock clock) {
        this.userRepository = userRepository;
        this.clock = clock;
    }

    @Override
    public Result<UserResponse> handle(ConfirmEmailCommand command) {
        User user = userRepository.findById(command.userId()).orElse(null);
        if (user == null) {
            return Result.notFound("USER_NOT_FOUND");
        }
        if (user.isEmailConfirmed()) {
            return Result.conflict("EMAIL_ALREADY_CONFIRMED");
        }
        OffsetDateTime now = OffsetDateTime.now(clock);
        if (!command.token().equals(user.getEmailConfirmationToken())) {
            return Result.failure("INVALID_CONFIRMATION_TOKEN");
        }
        if (user.getEmailConfirmationTokenExpiresAt() != null && user.getEmailConfirmationTokenExpiresAt().isBefore(now)) {
            return Result.failure("CONFIRMATION_TOKEN_EXPIRED");
        }
        user.confirmEmail(command.token(), now);
        userRepository.save(user);
        return Result.success(UserResponse.from(user));
    }
}
