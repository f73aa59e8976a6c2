package com.medicaledu.backend.modules.users.application;

import java.time.Clock;
import java.time.OffsetDateTime;

import com.medicaledu.backend.global.common.domain.Url;
import com.medicaledu.backend.global.common.result.Result;
import com.medicaledu.backend.global.pipeline.RequestHandler;
import com.medicaledu.backend.modules.users.domain.User;
import com.medicaledu.backend.modules.users.infrastructure.persistence.UserRepository;
import com.medicaledu.backend.modules.users.presentation.dto.UserResponse;

import org.springframework.stereotype.Service;

@Service
public class UpdateUserProfileHandler implements RequestHandler<UpdateUserProfileCommand, Result<UserResponse>> {

    private final UserRepository userRepository;
    private final Clock clock;

    public UpdateUserProfileHandler(UserRepository userRepository, Clock clock) {
        this.userRepository = userRepository;
        this.clock = clock;
    }

    @Override
    public Result<UserResponse> handle(UpdateUserProfileCommand command) {
        User user = userRepository.findById(command.userId()).orElse(null);
        if (user == null) {
            return Result.notFound("USER_NOT_FOUND");
        }
        Url pictureUrl = command.profilePictureUrl() == null || command.profilePictureUrl().isBlank()
                ? null
                : Url.of(command.profilePictureUrl());
        user.updateProfile(command.name(), command.timeZone(), command.phoneNumber(), pictureUrl, OffsetDateTime.now(clock));
        userRepository.save(user);
        return Result.success(UserResponse.from(user));
    }
}
