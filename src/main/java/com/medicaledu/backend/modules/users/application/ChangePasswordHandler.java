package com.medicaledu.backend.modules.users.application;

import java.time.Clock;
import java.time.OffsetDateTime;

import com.medicaledu.backend.global.common.result.Result;
import com.medicaledu.backend.global.pipeline.RequestHandler;
import com.medicaledu.backend.modules.users.domain.User;
import com.medicaledu.backend.modules.users.infrastructure.persistence.UserRepository;
import com.medicaledu.backend.modules.users.presentation.dto.UserResponse;

import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;

@Service
public class ChangePasswordHandler implements RequestHandler<ChangePasswordCommand, Result<UserResponse>> {

    private final UserRepository userRepository;
    private final PasswordEncoder passwordEncoder;
    private final Clock clock;

    public ChangePasswordHandler(UserRepository userRepository, PasswordEncoder passwordEncoder, Clock clock) {
        this.userRepository = userRepository;
        this.passwordEncoder = passwordEncoder;
        this.clock = clock;
    }

    @Override
    public Result<UserResponse> handle(ChangePasswordCommand command) {
        User user = userRepository.findById(command.userId()).orElse(null);
        if (user == null) {
            return Result.notFound("USER_NOT_FOUND");
        }
        if (!passwordEncoder.matches(command.currentPassword(), user.getPasswordHash())) {
            return Result.unauthorized("INVALID_CURRENT_PASSWORD");
        }
        user.updatePassword(passwordEncoder.encode(command.newPassword()), OffsetDateTime.now(clock));
        userRepository.save(user);
        return Result.success(UserResponse.from(user));
    }
}
