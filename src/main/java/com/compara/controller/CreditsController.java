package com.compara.controller;

import com.compara.credit.AdmissionDecision;
import com.compara.credit.AdmissionGate;
import com.compara.model.Identity;
import com.compara.model.dto.CreditBalance;
import com.compara.service.IdentityResolver;
import org.springframework.http.ResponseEntity;
import org.springframework.http.server.reactive.ServerHttpRequest;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.Locale;

/**
 * Credit balance of the calling identity.
 */
@RestController
@RequestMapping("/api/credits")
public class CreditsController {

    private final AdmissionGate admissionGate;
    private final IdentityResolver identityResolver;

    public CreditsController(AdmissionGate admissionGate, IdentityResolver identityResolver) {
        this.admissionGate = admissionGate;
        this.identityResolver = identityResolver;
    }

    @GetMapping("/balance")
    public Mono<ResponseEntity<CreditBalance>> getBalance(
            @RequestParam(value = "fingerprint", required = false) String fingerprint,
            @RequestParam(value = "timezone", required = false) String timezone,
            ServerHttpRequest httpRequest) {

        Identity identity = identityResolver.resolve(httpRequest.getHeaders(), httpRequest.getRemoteAddress(),
                fingerprint, timezone);

        return Mono.fromCallable(() -> admissionGate.check(identity, 0))
                .subscribeOn(Schedulers.boundedElastic())
                .map(decision -> ResponseEntity.ok(toBalance(decision)));
    }

    private static CreditBalance toBalance(AdmissionDecision decision) {
        return CreditBalance.builder()
                .creditsAllocated(decision.getAllocated())
                .creditsRemaining(decision.getRemaining())
                .creditsUsed(decision.getUsed())
                .period(decision.getPeriodKind().name().toLowerCase(Locale.ROOT))
                .resetAt(decision.getResetAt())
                .tier(decision.getTier().getId())
                .build();
    }
}
