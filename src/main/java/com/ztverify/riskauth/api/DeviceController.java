package com.ztverify.riskauth.api;

import com.ztverify.riskauth.application.DeviceTrustService;
import com.ztverify.riskauth.domain.DeviceRecord;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.Authentication;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

@RestController
@RequestMapping("/api/devices")
@Tag(name = "Trusted devices", description = "Devices the signed-in user has logged in from")
@SecurityRequirement(name = "Bearer Authentication")
public class DeviceController {

    private final DeviceTrustService devices;

    public DeviceController(DeviceTrustService devices) {
        this.devices = devices;
    }

    @GetMapping
    @Operation(summary = "List trusted devices, most recently seen first")
    public ResponseEntity<?> list(Authentication auth) {
        List<Map<String, Object>> items = devices.listDevices(auth.getName()).stream()
                .map(DeviceController::toView)
                .collect(Collectors.toList());
        return ResponseEntity.ok(Map.of("devices", items, "count", items.size()));
    }

    @DeleteMapping("/{fingerprint}")
    @Operation(summary = "Forget a trusted device; its next login is treated as unknown")
    public ResponseEntity<?> remove(@PathVariable("fingerprint") String fingerprint, Authentication auth) {
        if (devices.removeDevice(auth.getName(), fingerprint)) {
            return ResponseEntity.noContent().build();
        }
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(Map.of(
                "error", "device_not_found",
                "message", "No trusted device with that fingerprint"));
    }

    private static Map<String, Object> toView(DeviceRecord d) {
        Map<String, Object> view = new LinkedHashMap<>();
        view.put("deviceFingerprint", d.getDeviceFingerprint());
        view.put("firstSeen", d.getFirstSeen());
        view.put("lastSeen", d.getLastSeen());
        return view;
    }
}
