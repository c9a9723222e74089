package com.example.CommonSupplier.controller;

import com.example.CommonSupplier.config.CommonSupplierProperties;
import com.example.CommonSupplier.logic.ClassificationMode;
import com.example.CommonSupplier.logic.CommonSupplierException;
import com.example.CommonSupplier.logic.CommonSupplierLogic;
import com.example.CommonSupplier.logic.ExplicitPairClassifier;
import com.example.CommonSupplier.logic.IdentityClassifier;
import com.example.CommonSupplier.logic.MergePair;
import com.example.CommonSupplier.logic.MergePairValidator;
import com.example.CommonSupplier.logic.MergeResult;
import com.example.CommonSupplier.logic.PoiUploadFilePresenter;
import com.example.CommonSupplier.logic.PositionalClassifier;
import com.example.CommonSupplier.logic.SheetTable;
import com.example.CommonSupplier.logic.WorkbookProcessingException;
import com.example.CommonSupplier.logic.WorkbookReader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@CrossOrigin(origins = "http://localhost:3000")
@RestController
@RequestMapping("/api/common-supplier")
public class CommonSupplierController {

    private static final Logger log = LoggerFactory.getLogger(CommonSupplierController.class);

    static final MediaType XLSX = MediaType.parseMediaType(
            "application/vnd.openxmlformats-officedocument.spreadsheetml.sheet");

    private final CommonSupplierProperties properties;

    public CommonSupplierController(CommonSupplierProperties properties) {
        this.properties = properties;
    }

    @PostMapping("/generate")
    public ResponseEntity<byte[]> generateUploadFile(
            @RequestParam("preFile") MultipartFile preFile,
            @RequestParam(value = "parentIds", required = false) List<String> parentIds,
            @RequestParam(value = "childIds", required = false) List<String> childIds,
            @RequestParam(value = "mode", required = false, defaultValue = "EXPLICIT_PAIRS") ClassificationMode mode
    ) {
        String fileLabel = preFile.getOriginalFilename();
        log.info("Received pre-file {} ({} bytes), mode {}", fileLabel, preFile.getSize(), mode);

        try {
            Map<String, SheetTable> sheets = WorkbookReader.read(preFile.getBytes(), fileLabel);

            IdentityClassifier classifier;
            if (mode == ClassificationMode.POSITIONAL) {
                classifier = new PositionalClassifier();
            } else {
                List<MergePair> pairs = toPairs(parentIds, childIds);
                List<String> errors = MergePairValidator.validate(pairs, sheets);
                if (!errors.isEmpty()) {
                    log.warn("Rejected {} pair(s): {}", pairs.size(), errors);
                    return textResponse(HttpStatus.BAD_REQUEST,
                            "Please fix the following issues before proceeding:\n" + String.join("\n", errors));
                }
                classifier = new ExplicitPairClassifier(pairs);
            }

            MergeResult result = CommonSupplierLogic.merge(sheets, classifier);
            byte[] fileContent = CommonSupplierLogic.toBytes(
                    result, new PoiUploadFilePresenter(properties.toStyle()), properties.getOutputFileName());

            HttpHeaders headers = new HttpHeaders();
            headers.setContentType(XLSX);
            headers.setContentDispositionFormData("attachment", properties.getOutputFileName());

            log.info("Upload file generated: {} bytes, {} cells changed", fileContent.length, result.getLedger().size());
            return ResponseEntity.ok()
                    .headers(headers)
                    .body(fileContent);

        } catch (WorkbookProcessingException e) {
            log.error("Error during processing of {}", fileLabel, e);
            return textResponse(HttpStatus.INTERNAL_SERVER_ERROR, "Error during processing: " + e.getMessage());
        } catch (CommonSupplierException | IllegalArgumentException e) {
            log.warn("Invalid pre-file {}: {}", fileLabel, e.getMessage());
            return textResponse(HttpStatus.BAD_REQUEST, "Error during processing: " + e.getMessage());
        } catch (IOException e) {
            log.error("Could not read upload {}", fileLabel, e);
            return textResponse(HttpStatus.INTERNAL_SERVER_ERROR, "Failed to read Excel file: " + e.getMessage());
        }
    }

    @PostMapping("/validate")
    public ResponseEntity<Map<String, Object>> validatePairs(
            @RequestParam("preFile") MultipartFile preFile,
            @RequestParam(value = "parentIds", required = false) List<String> parentIds,
            @RequestParam(value = "childIds", required = false) List<String> childIds
    ) {
        Map<String, Object> response = new LinkedHashMap<>();
        try {
            Map<String, SheetTable> sheets = WorkbookReader.read(preFile.getBytes(), preFile.getOriginalFilename());
            List<String> errors = MergePairValidator.validate(toPairs(parentIds, childIds), sheets);
            response.put("valid", errors.isEmpty());
            response.put("errors", errors);
            return ResponseEntity.ok(response);
        } catch (CommonSupplierException | IllegalArgumentException e) {
            response.put("valid", false);
            response.put("errors", List.of("Failed to read Excel file or Source_ID column: " + e.getMessage()));
            return ResponseEntity.badRequest().body(response);
        } catch (IOException e) {
            log.error("Could not read upload {}", preFile.getOriginalFilename(), e);
            response.put("valid", false);
            response.put("errors", List.of("Failed to read Excel file: " + e.getMessage()));
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(response);
        }
    }

    static List<MergePair> toPairs(List<String> parentIds, List<String> childIds) {
        List<String> parents = parentIds == null ? List.of() : parentIds;
        List<String> children = childIds == null ? List.of() : childIds;
        if (parents.size() != children.size()) {
            throw new IllegalArgumentException("Got " + parents.size() + " parent IDs but "
                    + children.size() + " child IDs; every parent needs exactly one child.");
        }

        List<MergePair> pairs = new ArrayList<>();
        for (int i = 0; i < parents.size(); i++) {
            pairs.add(new MergePair(parents.get(i), children.get(i)));
        }
        return pairs;
    }

    private static ResponseEntity<byte[]> textResponse(HttpStatus status, String message) {
        return ResponseEntity.status(status)
                .contentType(MediaType.TEXT_PLAIN)
                .body(message.getBytes(StandardCharsets.UTF_8));
    }
}
