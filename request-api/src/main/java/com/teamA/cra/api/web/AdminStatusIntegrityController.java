package com.teamA.cra.api.web;

import com.teamA.cra.common.integrity.StatusIntegrityInspector;
import com.teamA.cra.common.integrity.StatusIntegrityReport;
import com.teamA.cra.common.integrity.StatusIntegrityService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequiredArgsConstructor
public class AdminStatusIntegrityController {

    private final StatusIntegrityService statusIntegrityService;

    @GetMapping("/admin/status-integrity")
    public ResponseEntity<StatusIntegrityReport> report(@RequestParam(required = false) Integer limit) {
        int lim = limit == null ? StatusIntegrityInspector.DEFAULT_LIMIT : limit;
        return ResponseEntity.ok(statusIntegrityService.generateReport(lim));
    }
}
