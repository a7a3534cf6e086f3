package com.ztverify.riskauth.api;

import com.ztverify.riskauth.application.AuditLogService;
import com.ztverify.riskauth.domain.Decision;
import com.ztverify.riskauth.domain.LoginAttempt;
import com.ztverify.riskauth.domain.LoginStats;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Read-only views over the login audit trail.
 */
@RestController
@RequestMapping("/admin")
@PreAuthorize("hasRole('ADMIN')")
@Tag(name = "Admin - audit", description = "Login attempt history and statistics")
@SecurityRequirement(name = "Bearer Authentication")
public class AdminAuditController {

    private final AuditLogService audit;

    public AdminAuditController(AuditLogService audit) {
        this.audit = audit;
    }

    @GetMapping("/login-attempts")
    @Operation(summary = "Most recent login attempts across all users")
    public ResponseEntity<?> recent(@RequestParam(value = "limit", defaultValue = "100") int limit) {
        return ResponseEntity.ok(page(audit.recent(limit)));
    }

    @GetMapping("/login-attempts/{username}")
    @Operation(summary = "Most recent login attempts for one user")
    public ResponseEntity<?> recentForUser(@PathVariable("username") String username,
                                           @RequestParam(value = "limit", defaultValue = "50") int limit) {
        Map<String, Object> body = page(audit.recentForUser(username, limit));
        body.put("username", username);
        return ResponseEntity.ok(body);
    }

    @GetMapping("/login-stats")
    @Operation(summary = "Decision counts over the last N days")
    public ResponseEntity<?> stats(@RequestParam(value = "days", defaultValue = "7") int days) {
        LoginStats stats = audit.statsForLastDays(days);
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("since", stats.since());
        body.put("total", stats.total());
        body.put("succeeded", stats.succeeded());
        body.put("failed", stats.total() - stats.succeeded());
        for (Decision d : Decision.values()) {
            body.put(d.wireValue(), stats.count(d));
        }
        return ResponseEntity.ok(body);
    }

    private static Map<String, Object> page(List<LoginAttempt> attempts) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("count", attempts.size());
        body.put("attempts", attempts.stream().map(AdminAuditController::toView).collect(Collectors.toList()));
        return body;
    }

    private static Map<String, Object> toView(LoginAttempt a) {
        Map<String, Object> view = new LinkedHashMap<>();
        view.put("id", a.getId());
        view.put("username", a.getUsername());
        view.put("timestamp", a.getTimestamp());
        view.put("sourceIp", a.getSourceIp());
        view.put("deviceFingerprint", a.getDeviceFingerprint());
        view.put("location", a.getLocation());
        view.put("riskScore", a.getRiskScore());
        view.put("decision", a.getDecision().wireValue());
        view.put("succeeded", a.isSucceeded());
        view.put("reason", a.getReason());
        view.put("riskFactors", a.getRiskFactors());
        return view;
    }
}
