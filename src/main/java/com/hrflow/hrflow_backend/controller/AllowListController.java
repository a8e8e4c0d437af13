package com.hrflow.hrflow_backend.controller;

import com.hrflow.hrflow_backend.model.domain.AllowedDomain;
import com.hrflow.hrflow_backend.service.AllowListService;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/settings/allowed-domains")
@RequiredArgsConstructor
public class AllowListController {

    // Set by the authenticating gateway in front of this service
    static final String ACTOR_HEADER = "X-User-Id";

    private final AllowListService allowListService;

    @GetMapping
    public List<AllowedDomain> list() {
        return allowListService.list();
    }

    @PostMapping
    public ResponseEntity<AllowedDomain> add(@Valid @RequestBody AddDomainRequest request,
                                             @RequestHeader(value = ACTOR_HEADER, required = false) Long actorId) {
        return ResponseEntity.status(HttpStatus.CREATED).body(allowListService.add(request.domain(), actorId));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> remove(@PathVariable Long id,
                                       @RequestHeader(value = ACTOR_HEADER, required = false) Long actorId) {
        return allowListService.remove(id, actorId)
                ? ResponseEntity.noContent().build()
                : ResponseEntity.notFound().build();
    }

    public record AddDomainRequest(@NotBlank String domain) {}
}
