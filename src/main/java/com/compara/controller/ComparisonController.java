package com.compara.controller;

import com.compara.model.ComparisonRequest;
import com.compara.model.Identity;
import com.compara.service.ComparisonOrchestrator;
import com.compara.service.IdentityResolver;
import com.compara.service.StreamingService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.buffer.DataBuffer;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.server.reactive.ServerHttpRequest;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/**
 * Multi-model comparison endpoint streaming Server-Sent Events.
 */
@Slf4j
@RestController
@RequestMapping("/api")
public class ComparisonController {

    private final ComparisonOrchestrator orchestrator;
    private final StreamingService streamingService;
    private final IdentityResolver identityResolver;

    public ComparisonController(ComparisonOrchestrator orchestrator,
                                StreamingService streamingService,
                                IdentityResolver identityResolver) {
        this.orchestrator = orchestrator;
        this.streamingService = streamingService;
        this.identityResolver = identityResolver;
    }

    /**
     * Stream one prompt through several models at once.
     * Validation and credit failures are returned as plain JSON errors before any event is sent.
     */
    @PostMapping(value = "/compare-stream", consumes = MediaType.APPLICATION_JSON_VALUE)
    public Mono<ResponseEntity<Flux<DataBuffer>>> compareStream(
            @RequestBody ComparisonRequest request,
            ServerHttpRequest httpRequest) {

        Identity identity = identityResolver.resolve(httpRequest.getHeaders(), httpRequest.getRemoteAddress(),
                request.getBrowserFingerprint(), request.getTimezone());

        log.info("Received comparison request: models={}, anonymous={}",
                request.getModels(), identity.isAnonymous());

        // Admission reads the ledger, which may be remote
        return Mono.fromCallable(() -> orchestrator.prepare(request, identity))
                .subscribeOn(Schedulers.boundedElastic())
                .map(prepared -> ResponseEntity.ok()
                        .contentType(MediaType.TEXT_EVENT_STREAM)
                        .header(HttpHeaders.CACHE_CONTROL, "no-cache")
                        .header("X-Accel-Buffering", "no")
                        .body(streamingService.toServerSentEvents(orchestrator.stream(prepared))));
    }
}
