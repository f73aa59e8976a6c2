package com.medicaledu.backend.modules.users.application;

import java.time.Clock;
import java.time.Duration;
import java.time.OffsetDateTime;

import com.medicaledu.backend.global.common.domain.Email;
import com.medicaledu.backend.global.common.result.Result;
import com.medicaledu.backend.global.pipeline.RequestHandler;
import com.medicaledu.backend.modules.users.domain.User;
import com.medicaledu.backend.modules.users.infrastructure.persistence.UserRepository;
import com.medicaledu.backend.modules.users.presentation.dto.UserResponse;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;

@Service
public class CreateUserHandler implements RequestHandler<CreateUserCommand, Result<UserResponse>> {

    private static final Logger log = LoggerFactory.getLogger(CreateUserHandler.class);

    static final Duration EMAIL_CONFIRMATION_TTL = Duration.ofHours(24);

    private final UserRepository userRepository;
    private final PasswordEncoder passwordEncoder;
    private final Clock clock;

    public CreateUserHandler(UserRepository userRepository, PasswordEncoder passwordEncoder, Clock clock) {
        this.userRepository = userRepository;
        this.passwordEncoder = passwordEncoder;
        this.clock = clock;
    }

    @Override
    public Result<UserResponse> handle(CreateUserCommand command) {
        Email email = Email.of(command.email());
        if (userRepository.existsByEmail(email)) {
            return Result.conflict("EMAIL_ALREADY_REGISTERED");
        }

        OffsetDateTime now = OffsetDateTime.now(clock);
        User user = User.register(
                command.name(),
                email,
                passwordEncoder.encode(command.password()),
                command.role(),
                AuthService.newOpaqueToken(),
                now.plus(EMAIL_CONFIRMATION_TTL),
                now
        );
        userRepository.save(user);
        log.info("Registered user {} with role {}", user.getId(), user.getRole());
        return Result.success(UserResponse.from(user));
    }
}
