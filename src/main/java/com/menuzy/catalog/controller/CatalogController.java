package com.menuzy.catalog.controller;

import com.menuzy.catalog.dto.CatalogBatch;
import com.menuzy.catalog.dto.ErrorKind;
import com.menuzy.catalog.dto.LoadResult;
import com.menuzy.catalog.service.CatalogLoader;
import com.menuzy.common.dto.ApiResponse;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Positive;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;

import java.time.Duration;

/**
 * Bulk catalog load.
 *
 * <pre>
 * POST /api/catalog/batches?timeout_seconds=10
 *   201  committed, body carries the generated ids
 *   422  rejected by validation
 *   409  refused by the store (taken email or display order, concurrent load)
 *   504  timed out and rolled back
 * </pre>
 */
@Validated
@RestController
@RequestMapping("/api/catalog")
@RequiredArgsConstructor
public class CatalogController {

    private final CatalogLoader catalogLoader;

    @PostMapping("/batches")
    public ResponseEntity<ApiResponse<LoadResult>> load(
            @RequestBody CatalogBatch batch,
            @RequestParam(name = "timeout_seconds", required = false) @Positive @Max(3600) Integer timeoutSeconds) {
        LoadResult result = timeoutSeconds == null
                ? catalogLoader.load(batch)
                : catalogLoader.load(batch, Duration.ofSeconds(timeoutSeconds));

        if (result.ok()) {
            return ResponseEntity.status(HttpStatus.CREATED).body(ApiResponse.ok(result));
        }
        HttpStatus status = statusOf(result);
        return ResponseEntity.status(status).body(ApiResponse.error(result, "Catalog load " + result.status()));
    }

    private static HttpStatus statusOf(LoadResult result) {
        if (result.hasErrorOf(ErrorKind.TIMEOUT)) {
            return HttpStatus.GATEWAY_TIMEOUT;
        }
        if (result.hasErrorOf(ErrorKind.VALIDATION)) {
            return HttpStatus.UNPROCESSABLE_ENTITY;
        }
        return HttpStatus.CONFLICT;
    }
}
