package com.rightsparser.service.storage;

import com.rightsparser.config.RightsParserProperties;
import com.rightsparser.exception.BadRequestException;
import com.rightsparser.model.FileMetadata;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.codec.multipart.FilePart;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Locale;
import java.util.Set;
import java.util.UUID;

/**
 * Stores uploaded agreements on local disk until a worker processes them.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class UploadStorage {

    static final Set<String> SUPPORTED_EXTENSIONS = Set.of("pdf", "txt");

    private final RightsParserProperties properties;

    /**
     * Validate and persist an uploaded file.
     *
     * @param filePart Multipart file
     * @return Name, stored path and size of the upload
     */
    public Mono<FileMetadata> store(FilePart filePart) {
        return Mono.defer(() -> {
            String fileName = safeFileName(filePart.filename());
            if (!SUPPORTED_EXTENSIONS.contains(extensionOf(fileName))) {
                return Mono.error(new BadRequestException(
                        "Unsupported file type '" + fileName + "', expected one of " + SUPPORTED_EXTENSIONS));
            }
            return write(filePart, fileName);
        });
    }

    private Mono<FileMetadata> write(FilePart filePart, String fileName) {
        return Mono.fromCallable(() -> {
                    Path dir = Paths.get(properties.getStorage().getUploadDir()).toAbsolutePath();
                    Files.createDirectories(dir);
                    return dir.resolve(UUID.randomUUID() + "_" + fileName);
                })
                .subscribeOn(Schedulers.boundedElastic())
                .flatMap(target -> filePart.transferTo(target)
                        .then(Mono.fromCallable(() -> verifySize(target)).subscribeOn(Schedulers.boundedElastic()))
                        .map(size -> FileMetadata.builder()
                                .fileName(fileName)
                                .filePath(target.toString())
                                .fileSize(size)
                                .build()))
                .doOnSuccess(stored -> log.info("Stored upload {} ({} bytes) at {}",
                        stored.getFileName(), stored.getFileSize(), stored.getFilePath()));
    }

    private long verifySize(Path target) throws IOException {
        long size = Files.size(target);
        long maxSize = properties.getStorage().getMaxFileSize().toBytes();
        if (size == 0 || size > maxSize) {
            Files.deleteIfExists(target);
            throw new BadRequestException(size == 0
                    ? "Uploaded file is empty"
                    : String.format("File exceeds the maximum size of %d bytes", maxSize));
        }
        return size;
    }

    static String safeFileName(String original) {
        if (original == null || original.isBlank()) {
            throw new BadRequestException("Uploaded file has no name");
        }
        String name = original.replace('\\', '/');
        name = name.substring(name.lastIndexOf('/') + 1);
        if (name.isBlank() || name.equals(".") || name.equals("..")) {
            throw new BadRequestException("Uploaded file has no usable name");
        }
        return name.replaceAll("[^A-Za-z0-9._-]", "_");
    }

    private static String extensionOf(String fileName) {
        int dot = fileName.lastIndexOf('.');
        return dot < 0 ? "" : fileName.substring(dot + 1).toLowerCase(Locale.ROOT);
    }
}
