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
public class ActivateUserHandler implements RequestHandler<ActivateUserCommand, Result<UserResponse>> {

    private final UserRepository userRepository;
    private final Clock clock;

    public ActivateUserHandler(UserRepository userRepository, Clock clock) {
        this.userRepository = userRepository;
        this.clock = clock;
    }

    @Override
    public Result<UserResponse> handle(ActivateUserCommand command) {
        User user = userRepository.findById(command.userId()).orElse(null);
        if (user == null) {
            return Result.notFound("USER_NOT_FOUND");
        }
        if (user.isActive()) {
            return Result.conflict("USER_ALREADY_ACTIVE");
        }
        user.activate(OffsetDateTime.now(clock));
        userRepository.save(user);
        return Result.success(UserResponse.from(user));
    }
}
