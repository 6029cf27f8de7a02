package com.cgi.medscrub.api.controller;

import com.cgi.medscrub.api.ScrubReportGenerator;
import com.cgi.medscrub.api.ScrubService;
import com.cgi.medscrub.api.dto.ApiResponse;
import com.cgi.medscrub.api.dto.ScrubRequest;
import com.cgi.medscrub.model.ScrubResult;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.Locale;

/**
 * REST Controller for document de-identification.
 */
@RestController
@RequestMapping("/api/scrub")
@Tag(name = "Scrubber", description = "API for removing personal information from medical text")
public class ScrubController {
    private static final Logger log = LoggerFactory.getLogger(ScrubController.class);

    private final ScrubService scrubService;
    private final ScrubReportGenerator reportGenerator;

    @Autowired
    public ScrubController(ScrubService scrubService, ScrubReportGenerator reportGenerator) {
        this.scrubService = scrubService;
        this.reportGenerator = reportGenerator;
    }

    @Operation(summary = "De-identify a document")
    @PostMapping
    public ResponseEntity<ApiResponse<ScrubResult>> scrub(@RequestBody ScrubRequest request) {
        ScrubResult result = run(request);
        log.info("Scrub completed: {} entities replaced, {} warning(s)",
                result.getCount(), result.getWarnings().size());
        return ResponseEntity.ok(ApiResponse.success(result));
    }

    @Operation(summary = "De-identify a document and export the result with its audit trail")
    @PostMapping("/export")
    public ResponseEntity<byte[]> export(
            @RequestBody ScrubRequest request,
            @RequestParam(defaultValue = "json") String format) {

        String normalized = format.toLowerCase(Locale.ROOT);
        ScrubResult result = run(request);
        byte[] content = reportGenerator.exportResult(result, normalized);

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType("csv".equals(normalized)
                ? new MediaType("text", "csv")
                : MediaType.APPLICATION_JSON);
        headers.setContentDispositionFormData("attachment", "scrub-result." + normalized);

        return ResponseEntity.ok().headers(headers).body(content);
    }

    @Operation(summary = "De-identify a document and return a plain-text summary")
    @PostMapping("/summary")
    public ResponseEntity<ApiResponse<String>> summary(@RequestBody ScrubRequest request) {
        ScrubResult result = run(request);
        return ResponseEntity.ok(ApiResponse.success(reportGenerator.generateSummary(result)));
    }

    private ScrubResult run(ScrubRequest request) {
        if (request == null) {
            throw new IllegalArgumentException("Request body is required");
        }
        return scrubService.scrub(request.getText(), request.toConfig(scrubService.getDefaultConfig()));
    }
}
