package com.registration.API;

import com.registration.config.RegistrationProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.util.Locale;
import java.util.UUID;
import java.util.regex.Pattern;

/**
 * Job directories under the workspace: one per registration request, holding the uploads and
 * every output of the job.
 */
@Slf4j
@Service
public class ImageStorageService {
    private static final Pattern IMAGE_NAME = Pattern.compile("(?i).+\\.(tif|tiff|png|jpg|jpeg)$");
    private static final Pattern JOB_ID = Pattern.compile("[A-Za-z0-9-]+");

    private final Path workspace;

    public ImageStorageService(RegistrationProperties properties) {
        this.workspace = Paths.get(properties.getWorkspace()).toAbsolutePath().normalize();
    }

    /**
     * Tạo thư mục job mới, trả về jobId
     */
    public String createJob() throws IOException {
        String jobId = UUID.randomUUID().toString();
        Files.createDirectories(workspace.resolve(jobId));
        log.debug("Created job directory {}", workspace.resolve(jobId));
        return jobId;
    }

    /**
     * Lưu file upload dưới tên {@code baseName} + phần mở rộng gốc
     */
    public Path store(String jobId, MultipartFile file, String baseName) throws IOException {
        String original = file.getOriginalFilename();
        String extension = original.substring(original.lastIndexOf('.')).toLowerCase(Locale.ROOT);
        Path target = jobDirectory(jobId).resolve(baseName + extension);
        try (InputStream in = file.getInputStream()) {
            Files.copy(in, target, StandardCopyOption.REPLACE_EXISTING);
        }
        return target;
    }

    /**
     * Kiểm tra xem file upload có phải raster được hỗ trợ không
     */
    public boolean isValidImageFile(MultipartFile file) {
        if (file == null || file.isEmpty()) return false;
        String originalFilename = file.getOriginalFilename();
        return originalFilename != null && IMAGE_NAME.matcher(originalFilename).matches();
    }

    public boolean isValidJobId(String jobId) {
        return jobId != null && JOB_ID.matcher(jobId).matches();
    }

    public Path jobDirectory(String jobId) {
        if (!isValidJobId(jobId)) {
            throw new IllegalArgumentException("Invalid job id: " + jobId);
        }
        return workspace.resolve(jobId);
    }

    public String imageUrl(String jobId, String filename) {
        return "/outputs/" + jobId + "/" + filename;
    }

    public Path getWorkspace() {
        return workspace;
    }
}
