package com.cellarexport.controller;

import com.cellarexport.exception.ExportNotFoundException;
import com.cellarexport.model.ExportJob;
import com.cellarexport.repository.ExportJobRepository;
import com.cellarexport.service.ExportJobService;
import com.cellarexport.service.ValidationService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Internal trigger boundary. The API layer creates the export record, then calls
 * {@code start}; the call returns as soon as the first alarm is armed.
 */
@RestController
@RequestMapping("/api/exports")
@Slf4j
public class ExportController {

    private final ExportJobService exportJobService;
    private final ExportJobRepository jobRepository;
    private final ValidationService validationService;

    public ExportController(ExportJobService exportJobService,
                            ExportJobRepository jobRepository,
                            ValidationService validationService) {
        this.exportJobService = exportJobService;
        this.jobRepository = jobRepository;
        this.validationService = validationService;
    }

    @PostMapping("/{exportId}/start")
    public ResponseEntity<Map<String, Object>> start(@PathVariable String exportId) {
        validationService.validateExportId(exportId);
        log.info("Received start request for export {}", exportId);

        exportJobService.trigger(exportId);

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("success", true);
        body.put("exportId", exportId);
        return ResponseEntity.accepted().body(body);
    }

    @GetMapping("/{exportId}")
    public ResponseEntity<ExportJob> status(@PathVariable String exportId) {
        validationService.validateExportId(exportId);
        ExportJob job = jobRepository.findById(exportId)
                .orElseThrow(() -> new ExportNotFoundException(exportId));
        return ResponseEntity.ok(job);
    }
}
