package com.medicaledu.backend.modules.users.application;

import com.medicaledu.backend.global.common.result.Result;
import com.medicaledu.backend.global.pipeline.RequestHandler;
import com.medicaledu.backend.global.web.PageResponse;
import com.medicaledu.backend.modules.users.infrastructure.persistence.UserRepository;
import com.medicaledu.backend.modules.users.presentation.dto.UserResponse;

import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@Transactional(readOnly = true)
public class GetUsersByRoleHandler implements RequestHandler<GetUsersByRoleQuery, Result<PageResponse<UserResponse>>> {

    private final UserRepository userRepository;

    public GetUsersByRoleHandler(UserRepository userRepository) {
        this.userRepository = userRepository;
    }

    @Override
    public Result<PageResponse<UserResponse>> handle(GetUsersByRoleQuery query) {
        PageRequest pageRequest = PageRequest.of(query.page(), query.size(), Sort.by(Sort.Direction.ASC, "name"));
        return Result.success(PageResponse.from(userRepository.findByRole(query.role(), pageRequest), UserResponse::from));
    }
}
