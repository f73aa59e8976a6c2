package com.medicaledu.backend.modules.promotions.infrastructure.persistence;

import java.util.Optional;
import java.util.UUID;

import com.medicaledu.backend.global.common.domain.PromoCodeValue;
import com.medicaledu.backend.modules.promotions.domain.PromoCode;

import jakarta.persistence.LockModeType;

import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface PromoCodeRepository extends JpaRepository<PromoCode, UUID> {

    Optional<PromoCode> findByCode(PromoCodeValue code);

    boolean existsByCode(PromoCodeValue code);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select p from PromoCode p where p.code = :code")
    Optional<PromoCode> findByCodeForUpdate(@Param("code") PromoCodeValue code);

    Page<PromoCode> findByActive(boolean active, Pageable pageable);
}
