package com.medicaledu.backend.modules.promotions.presentation;

import java.net.URI;
import java.util.UUID;

import com.medicaledu.backend.global.error.ResultProblems;
import com.medicaledu.backend.global.pipeline.Mediator;
import com.medicaledu.backend.global.security.SecurityUtils;
import com.medicaledu.backend.global.web.PageRequests;
import com.medicaledu.backend.global.web.PageResponse;
import com.medicaledu.backend.modules.promotions.application.CreatePromoCodeCommand;
import com.medicaledu.backend.modules.promotions.application.DeactivatePromoCodeCommand;
import com.medicaledu.backend.modules.promotions.application.GetPromoCodesQuery;
import com.medicaledu.backend.modules.promotions.application.ValidatePromoCodeQuery;
import com.medicaledu.backend.modules.promotions.presentation.dto.CreatePromoCodeRequest;
import com.medicaledu.backend.modules.promotions.presentation.dto.PromoCodeResponse;
import com.medicaledu.backend.modules.promotions.presentation.dto.PromoCodeValidationResponse;

import io.swagger.v3.oas.annotations.Operation;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/promo-codes")
public class PromoCodeController {

    private final Mediator mediator;

    public PromoCodeController(Mediator mediator) {
        this.mediator = mediator;
    }

    @PostMapping
    public ResponseEntity<PromoCodeResponse> createPromoCode(@RequestBody CreatePromoCodeRequest request) {
        SecurityUtils.requireAdmin();
        PromoCodeResponse created = ResultProblems.orThrow(mediator.send(new CreatePromoCodeCommand(
                request.code(),
                request.description(),
                request.discountType(),
                request.discountValue(),
                request.currency(),
                request.maxUses(),
                request.validFrom(),
                request.validUntil(),
                request.applicableCourseIds()
        )));
        return ResponseEntity.created(URI.create("/api/promo-codes/" + created.code())).body(created);
    }

    @PostMapping("/{promoCodeId}/deactivate")
    public ResponseEntity<PromoCodeResponse> deactivate(@PathVariable("promoCodeId") UUID promoCodeId) {
        SecurityUtils.requireAdmin();
        return ResponseEntity.ok(ResultProblems.orThrow(mediator.send(new DeactivatePromoCodeCommand(promoCodeId))));
    }

    @Operation(summary = "Check a promo code", description = "Reports whether the code is usable now, optionally for one course.")
    @GetMapping("/{code}")
    public ResponseEntity<PromoCodeValidationResponse> validate(
            @PathVariable("code") String code,
            @RequestParam(name = "courseId", required = false) UUID courseId
    ) {
        return ResponseEntity.ok(ResultProblems.orThrow(mediator.send(new ValidatePromoCodeQuery(code, courseId))));
    }

    @GetMapping
    public ResponseEntity<PageResponse<PromoCodeResponse>> getPromoCodes(
            @RequestParam(name = "active", required = false) Boolean active,
            @RequestParam(name = "page", required = false) Integer page,
            @RequestParam(name = "size", required = false) Integer size
    ) {
        SecurityUtils.requireAdmin();
        return ResponseEntity.ok(ResultProblems.orThrow(mediator.send(
                new GetPromoCodesQuery(active, PageRequests.page(page), PageRequests.size(size)))));
    }
}
