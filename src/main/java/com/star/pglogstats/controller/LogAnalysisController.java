package com.star.pglogstats.controller;

import com.star.pglogstats.dto.AnalysisReport;
import com.star.pglogstats.dto.AnalysisRequest;
import com.star.pglogstats.dto.ApiResponse;
import com.star.pglogstats.dto.QueryRequest;
import com.star.pglogstats.entity.Query;
import com.star.pglogstats.exception.FileSizeLimitExceededException;
import com.star.pglogstats.exception.FileUploadException;
import com.star.pglogstats.exception.InvalidFileTypeException;
import com.star.pglogstats.exception.LogProcessingException;
import com.star.pglogstats.output.ReportFormat;
import com.star.pglogstats.service.LogAnalysisService;
import io.swagger.v3.oas.annotations.Parameter;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ModelAttribute;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.io.InputStream;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;

@RestController
@RequestMapping("/analysis")
@RequiredArgsConstructor
@Slf4j
public class LogAnalysisController {

    private final LogAnalysisService logAnalysisService;

    @Value("${app.file.max-size:52428800}")
    private long maxFileSize = 52_428_800L;

    @Value("${app.file.allowed-types:log,txt}")
    private String[] allowedFileTypes = {"log", "txt"};

    @PostMapping(consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<String> analyzeLogFile(
            @RequestParam("logfile") MultipartFile logfile,
            @Parameter(description = "Report options; unset fields use the service defaults")
            @Valid @ModelAttribute AnalysisRequest request) {

        log.info("Received analysis request: {} ({} bytes)",
                logfile.getOriginalFilename(), logfile.getSize());

        if (logfile.isEmpty()) {
            throw new FileUploadException("No file uploaded or file is empty");
        }

        if (logfile.getSize() > maxFileSize) {
            throw new FileSizeLimitExceededException(maxFileSize, logfile.getSize());
        }

        String originalFilename = logfile.getOriginalFilename();
        if (originalFilename == null || !isValidFileType(originalFilename)) {
            throw new InvalidFileTypeException(
                    "Invalid file type. Allowed types: " + String.join(", ", allowedFileTypes)
            );
        }

        ReportFormat format = ReportFormat.fromString(request.getFormat());

        AnalysisReport report;
        try (InputStream in = logfile.getInputStream()) {
            report = logAnalysisService.analyzeStream(originalFilename, in, request);
        } catch (IOException e) {
            log.error("Error reading uploaded file {}", originalFilename, e);
            throw new LogProcessingException("Failed to read uploaded file", e);
        }

        String body = logAnalysisService.render(report, format.name());
        String filename = baseName(originalFilename) + "-report." + format.getFileExtension();

        return ResponseEntity.ok()
                .contentType(MediaType.parseMediaType(format.getContentType()))
                .header(HttpHeaders.CONTENT_DISPOSITION, "inline; filename=\"" + filename + "\"")
                .body(body);
    }

    @PostMapping(value = "/queries", consumes = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<ApiResponse<List<Query>>> extractQueries(
            @Valid @RequestBody QueryRequest request) {

        List<Query> queries = logAnalysisService.extractQueries(request.getSql());
        log.debug("Extracted {} queries", queries.size());

        return ResponseEntity.ok(
                ApiResponse.success("Queries extracted successfully", queries)
        );
    }

    private boolean isValidFileType(String filename) {
        String extension = filename.substring(filename.lastIndexOf('.') + 1).toLowerCase(Locale.ROOT);
        return Arrays.asList(allowedFileTypes).contains(extension);
    }

    private static String baseName(String filename) {
        int dot = filename.lastIndexOf('.');
        return dot > 0 ? filename.substring(0, dot) : filename;
    }
}
