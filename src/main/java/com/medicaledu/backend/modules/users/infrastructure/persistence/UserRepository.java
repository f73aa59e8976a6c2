package com.medicaledu.backend.modules.users.infrastructure.persistence;

import java.util.Optional;
import java.util.UUID;

import com.medicaledu.backend.global.common.domain.Email;
import com.medicaledu.backend.modules.users.domain.User;
import com.medicaledu.backend.modules.users.domain.UserRole;

import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;

public interface UserRepository extends JpaRepository<User, UUID> {

    Optional<User> findByEmail(Email email);

    boolean existsByEmail(Email email);

    Page<User> findByRole(UserRole role, Pageable pageable);
}
