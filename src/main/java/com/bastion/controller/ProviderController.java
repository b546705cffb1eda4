package com.bastion.controller;

import com.bastion.model.dto.ProviderHealthReport;
import com.bastion.service.GatewayAdminService;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

@RestController
@RequestMapping("/v1/providers")
public class ProviderController {

    private final GatewayAdminService adminService;

    public ProviderController(GatewayAdminService adminService) {
        this.adminService = adminService;
    }

    /**
     * Health records with live quota, circuit states and admission windows.
     */
    @GetMapping("/health")
    public Mono<ProviderHealthReport> health() {
        return adminService.checkHealth();
    }
}
