package com.linelist.cleaner.controller;

import java.io.IOException;
import java.util.Locale;
import java.util.Set;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

import com.linelist.cleaner.dto.cleaning.SpellingCleaningResponse;
import com.linelist.cleaner.model.DataTable;
import com.linelist.cleaner.model.GroupReference;
import com.linelist.cleaner.model.SingleTableBundle;
import com.linelist.cleaner.model.Wordlist;
import com.linelist.cleaner.service.SpellingCleaningService;
import com.linelist.cleaner.service.cleaning.CleaningResult;
import com.linelist.cleaner.service.cleaning.SpellingCleaningOptions;
import com.linelist.cleaner.service.cleaning.VariableSpellingService;
import com.linelist.cleaner.service.data_processing.CsvParsingService;
import com.linelist.cleaner.service.data_processing.CsvWritingService;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

@Slf4j
@RestController
@RequestMapping("/api/clean/spelling")
@RequiredArgsConstructor
@Tag(name = "File Upload", description = "CSV upload endpoints for spelling cleaning")
public class FileUploadController {

  @Value("${app.upload.max-file-size:10485760}")
  private long maxFileSize;

  @Value("${app.upload.allowed-extensions:csv}")
  private Set<String> allowedExtensions;

  @Value("${cleaner.defaults.spelling-vars:3}")
  private String defaultSpellingVars;

  private final CsvParsingService csvParsingService;
  private final CsvWritingService csvWritingService;
  private final SpellingCleaningService spellingCleaningService;
  private final VariableSpellingService variableSpellingService;

  @PostMapping(
      value = "/upload",
      consumes = MediaType.MULTIPART_FORM_DATA_VALUE,
      produces = MediaType.APPLICATION_JSON_VALUE)
  @Operation(
      summary = "Clean an uploaded CSV",
      description =
          "Cleans a CSV dataset with a grouped CSV wordlist and returns the result as JSON")
  @ApiResponses(
      value = {
        @ApiResponse(
            responseCode = "200",
            description = "Cleaned table",
            content = @Content(schema = @Schema(implementation = SpellingCleaningResponse.class))),
        @ApiResponse(
            responseCode = "400",
            description = "Invalid file, wordlist or options",
            content = @Content)
      })
  public ResponseEntity<SpellingCleaningResponse> upload(
      @Parameter(description = "Dataset CSV", required = true) @RequestParam("file")
          MultipartFile file,
      @Parameter(description = "Wordlist CSV", required = true) @RequestParam("wordlist")
          MultipartFile wordlist,
      @Parameter(description = "Name or 1-based position of the wordlist group column")
          @RequestParam(value = "spelling_vars", required = false)
          String spellingVars,
      @Parameter(description = "Wordlist column used to order categorical levels")
          @RequestParam(value = "sort_by", required = false)
          String sortBy,
      @Parameter(description = "Return consolidated diagnostics")
          @RequestParam(value = "warn", required = false, defaultValue = "false")
          boolean warn,
      @Parameter(description = "Apply the wordlist to every text column")
          @RequestParam(value = "use_globally", required = false, defaultValue = "false")
          boolean useGlobally)
      throws IOException {
    validateFile(file);
    validateFile(wordlist);

    DataTable table =
        csvParsingService.parseDataTable(file.getInputStream(), file.getOriginalFilename());
    Wordlist words = csvParsingService.parseWordlist(wordlist.getInputStream());
    log.info(
        "Cleaning uploaded file {} ({} rows) with wordlist {} ({} rows)",
        file.getOriginalFilename(),
        table.rowCount(),
        wordlist.getOriginalFilename(),
        words.rowCount());

    SpellingCleaningResponse response =
        spellingCleaningService.clean(
            table,
            SingleTableBundle.of(words),
            options(spellingVars, sortBy, warn, useGlobally));
    return ResponseEntity.ok(response);
  }

  @PostMapping(
      value = "/export",
      consumes = MediaType.MULTIPART_FORM_DATA_VALUE,
      produces = "text/csv")
  @Operation(
      summary = "Clean an uploaded CSV and download it",
      description = "Same input as /upload; the cleaned dataset is returned as CSV")
  public ResponseEntity<byte[]> export(
      @RequestParam("file") MultipartFile file,
      @RequestParam("wordlist") MultipartFile wordlist,
      @RequestParam(value = "spelling_vars", required = false) String spellingVars,
      @RequestParam(value = "sort_by", required = false) String sortBy,
      @RequestParam(value = "use_globally", required = false, defaultValue = "false")
          boolean useGlobally)
      throws IOException {
    validateFile(file);
    validateFile(wordlist);

    DataTable table =
        csvParsingService.parseDataTable(file.getInputStream(), file.getOriginalFilename());
    Wordlist words = csvParsingService.parseWordlist(wordlist.getInputStream());
    CleaningResult result =
        variableSpellingService.cleanVariableSpelling(
            table, SingleTableBundle.of(words), options(spellingVars, sortBy, false, useGlobally));

    String fileName = (table.getName() != null ? table.getName() : "cleaned") + "_clean.csv";
    return ResponseEntity.ok()
        .header(HttpHeaders.CONTENT_DISPOSITION, "attachment; filename=\"" + fileName + "\"")
        .contentType(MediaType.parseMediaType("text/csv"))
        .body(csvWritingService.write(result.getData()));
  }

  private SpellingCleaningOptions options(
      String spellingVars, String sortBy, boolean warn, boolean useGlobally) {
    GroupReference groupReference =
        useGlobally
            ? GroupReference.none()
            : GroupReference.parse(spellingVars != null ? spellingVars : defaultSpellingVars);
    return SpellingCleaningOptions.builder()
        .groupReference(groupReference)
        .sortBy(sortBy != null && !sortBy.isBlank() ? sortBy : null)
        .reportDiagnostics(warn)
        .build();
  }

  private void validateFile(MultipartFile file) {
    if (file == null || file.isEmpty()) {
      throw new IllegalArgumentException("File is empty");
    }
    if (file.getSize() > maxFileSize) {
      throw new IllegalArgumentException(
          String.format("File size exceeds maximum allowed size of %d bytes", maxFileSize));
    }
    String extension = extractFileExtension(file.getOriginalFilename());
    if (!allowedExtensions.contains(extension)) {
      throw new IllegalArgumentException(
          String.format(
              "File type not allowed. Allowed types: %s", String.join(", ", allowedExtensions)));
    }
  }

  private String extractFileExtension(String fileName) {
    if (fileName == null || fileName.lastIndexOf('.') < 0) {
      return "";
    }
    return fileName.substring(fileName.lastIndexOf('.') + 1).toLowerCase(Locale.ROOT);
  }
}
