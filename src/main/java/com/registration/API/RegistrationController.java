package com.registration.API;

import com.registration.exception.RegistrationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.CrossOrigin;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

import java.util.HashMap;
import java.util.Map;

@Slf4j
@RestController
@RequestMapping("/api")
@CrossOrigin(origins = "*")
public class RegistrationController {

    @Autowired
    private RegistrationService registrationService;

    @Autowired
    private ImageStorageService imageStorageService;

    @PostMapping(value = "/register", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<?> register(
            @RequestParam(value = "source", required = false) MultipartFile source,
            @RequestParam(value = "target", required = false) MultipartFile target) {
        if (source == null || target == null) {
            return error(HttpStatus.BAD_REQUEST, "Both source and target images are required.");
        }
        for (MultipartFile file : new MultipartFile[]{source, target}) {
            if (!imageStorageService.isValidImageFile(file)) {
                return error(HttpStatus.BAD_REQUEST, "Invalid file: " + file.getOriginalFilename());
            }
        }

        try {
            RegistrationJob job = registrationService.register(source, target);

            Map<String, Object> response = new HashMap<>();
            response.put("success", true);
            response.put("jobId", job.getJobId());
            response.put("imageUrl", job.getImageUrl());
            response.put("matches", job.getMatches());
            response.put("inliers", job.getInliers());
            return ResponseEntity.ok().body(response);
        } catch (RegistrationException e) {
            log.warn("Registration failed: {}", e.getMessage());
            return failure(e);
        } catch (Exception e) {
            log.error("Registration failed", e);
            return error(HttpStatus.INTERNAL_SERVER_ERROR, "Error: " + e.getMessage());
        }
    }

    @PostMapping("/adjust")
    public ResponseEntity<?> adjust(
            @RequestParam("jobId") String jobId,
            @RequestParam("dx") double dx,
            @RequestParam("dy") double dy) {
        if (!imageStorageService.isValidJobId(jobId)) {
            return error(HttpStatus.BAD_REQUEST, "Invalid job id.");
        }
        if (!registrationService.hasRegisteredOutput(jobId)) {
            return error(HttpStatus.NOT_FOUND, "No registered image for job " + jobId);
        }

        try {
            String imageUrl = registrationService.adjust(jobId, dx, dy);

            Map<String, Object> response = new HashMap<>();
            response.put("success", true);
            response.put("jobId", jobId);
            response.put("imageUrl", imageUrl);
            return ResponseEntity.ok().body(response);
        } catch (RegistrationException e) {
            log.warn("Adjustment failed: {}", e.getMessage());
            return failure(e);
        } catch (Exception e) {
            log.error("Adjustment failed", e);
            return error(HttpStatus.INTERNAL_SERVER_ERROR, "Error: " + e.getMessage());
        }
    }

    private static ResponseEntity<Map<String, String>> failure(RegistrationException e) {
        Map<String, String> error = new HashMap<>();
        error.put("error", e.getMessage());
        error.put("kind", e.kind());
        return ResponseEntity.unprocessableEntity().body(error);
    }

    private static ResponseEntity<Map<String, String>> error(HttpStatus status, String message) {
        Map<String, String> error = new HashMap<>();
        error.put("error", message);
        return ResponseEntity.status(status).body(error);
    }
}
