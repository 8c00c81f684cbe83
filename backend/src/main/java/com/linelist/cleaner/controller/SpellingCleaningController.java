package com.linelist.cleaner.controller;

import java.util.Map;

import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import com.linelist.cleaner.dto.cleaning.SpellingCleaningRequest;
import com.linelist.cleaner.dto.cleaning.SpellingCleaningResponse;
import com.linelist.cleaner.service.SpellingCleaningService;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

@Slf4j
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
@Tag(name = "Spelling Cleaning", description = "Wordlist-driven recoding of table columns")
public class SpellingCleaningController {

  private final SpellingCleaningService spellingCleaningService;

  @PostMapping(
      value = "/clean/spelling",
      consumes = MediaType.APPLICATION_JSON_VALUE,
      produces = MediaType.APPLICATION_JSON_VALUE)
  @Operation(
      summary = "Clean column spelling",
      description =
          "Rewrites raw values of text and categorical columns into canonical labels using one"
              + " grouped wordlist or a collection of per-column wordlists")
  @ApiResponses(
      value = {
        @ApiResponse(
            responseCode = "200",
            description = "Cleaned table",
            content = @Content(schema = @Schema(implementation = SpellingCleaningResponse.class))),
        @ApiResponse(
            responseCode = "400",
            description = "Invalid table, wordlists or options",
            content = @Content),
        @ApiResponse(
            responseCode = "500",
            description = "Internal server error",
            content = @Content)
      })
  public ResponseEntity<SpellingCleaningResponse> cleanSpelling(
      @Valid @RequestBody SpellingCleaningRequest request) {
    log.info(
        "[SPELLING-CLEANING-CONTROLLER] Received request for table: {} ({} columns, {} rows)",
        request.getTableName(),
        request.getColumns().size(),
        request.getData().size());

    SpellingCleaningResponse response = spellingCleaningService.clean(request);
    log.info(
        "[SPELLING-CLEANING-CONTROLLER] Cleaning completed, diagnostics present: {}",
        response.getDiagnostics() != null);
    return ResponseEntity.ok(response);
  }

  @GetMapping("/health")
  @Operation(summary = "Health check", description = "Check if the cleaning service is healthy")
  @ApiResponses(value = {@ApiResponse(responseCode = "200", description = "Service is healthy")})
  public ResponseEntity<Map<String, Object>> health() {
    return ResponseEntity.ok(Map.of("status", "UP", "timestamp", System.currentTimeMillis()));
  }
}
