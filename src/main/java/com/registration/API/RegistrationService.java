package com.registration.API;

import com.registration.exception.RegistrationException;
import com.registration.imageRegistration.ImageRegistration;
import com.registration.imageRegistration.LoggingRegistrationListener;
import com.registration.imageRegistration.ManualAdjustment;
import com.registration.imageRegistration.RegistrationResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

@Slf4j
@Service
public class RegistrationService {
    public static final String REGISTERED_FILE = "registered.tif";
    public static final String ADJUSTED_FILE = "final_adjusted.tif";

    private final ImageRegistration registration;
    private final ManualAdjustment adjustment;
    private final ImageStorageService storage;

    public RegistrationService(ImageRegistration registration, ManualAdjustment adjustment, ImageStorageService storage) {
        this.registration = registration;
        this.adjustment = adjustment;
        this.storage = storage;
    }

    public RegistrationJob register(MultipartFile source, MultipartFile target) throws IOException, RegistrationException {
        String jobId = storage.createJob();
        Path sourcePath = storage.store(jobId, source, "source");
        Path targetPath = storage.store(jobId, target, "target");
        Path outputPath = storage.jobDirectory(jobId).resolve(REGISTERED_FILE);

        RegistrationResult result = registration.registerFiles(sourcePath, targetPath, outputPath,
                new LoggingRegistrationListener(jobId));
        return new RegistrationJob(jobId, storage.imageUrl(jobId, REGISTERED_FILE),
                result.getMatchCount(), result.getInliers().size());
    }

    public boolean hasRegisteredOutput(String jobId) {
        return storage.isValidJobId(jobId) && Files.isRegularFile(storage.jobDirectory(jobId).resolve(REGISTERED_FILE));
    }

    /**
     * @return URL of the adjusted raster
     */
    public String adjust(String jobId, double dx, double dy) throws RegistrationException {
        Path jobDir = storage.jobDirectory(jobId);
        adjustment.apply(jobDir.resolve(REGISTERED_FILE), jobDir.resolve(ADJUSTED_FILE), dx, dy);
        return storage.imageUrl(jobId, ADJUSTED_FILE);
    }
}
