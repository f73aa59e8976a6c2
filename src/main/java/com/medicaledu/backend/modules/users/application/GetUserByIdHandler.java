package com.medicaledu.backend.modules.users.application;

import com.medicaledu.backend.global.common.result.Result;
import com.medicaledu.backend.global.pipeline.RequestHandler;
import com.medicaledu.backend.modules.users.infrastructure.persistence.UserRepository;
import com.medicaledu.backend.modules.users.presentation.dto.UserResponse;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@Transactional(readOnly = true)
public class GetUserByIdHandler implements RequestHandler<GetUserByIdQuery, Result<UserResponse>> {

    private final UserRepository userRepository;

    public GetUserByIdHandler(UserRepository userRepository) {
        this.userRepository = userRepository;
    }

    @Override
    public Result<UserResponse> handle(GetUserByIdQuery query) {
        return userRepository.findById(query.userId())
                .map(UserResponse::from)
                .map(Result::success)
                .orElseGet(() -> Result.notFound("USER_NOT_FOUND"));
    }
}
