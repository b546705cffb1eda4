package com.bastion.controller;

import com.bastion.model.dto.CacheStatistics;
import com.bastion.model.dto.InvalidationRequest;
import com.bastion.model.dto.InvalidationResult;
import com.bastion.service.GatewayAdminService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

/**
 * Cache management controller.
 */
@Slf4j
@RestController
@RequestMapping("/v1/cache")
public class CacheController {

    private final GatewayAdminService adminService;

    public CacheController(GatewayAdminService adminService) {
        this.adminService = adminService;
    }

    @GetMapping("/stats")
    public CacheStatistics getStats() {
        return adminService.getStatistics();
    }

    /**
     * Invalidate by pattern within a namespace, a whole namespace, or everything.
     */
    @PostMapping("/invalidate")
    public Mono<InvalidationResult> invalidate(@RequestBody InvalidationRequest request) {
        log.info("Cache invalidation requested: namespace={}, pattern={}", request.getNamespace(), request.getPattern());
        return adminService.invalidate(request);
    }

    /**
     * Clear every namespace and reset statistics.
     */
    @PostMapping("/clear")
    public Mono<InvalidationResult> clearCache() {
        log.info("Cache clear requested");
        return adminService.clearAll();
    }
}
