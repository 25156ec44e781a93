package com.rightsparser.service.document;

import com.rightsparser.config.RightsParserProperties;
import com.rightsparser.exception.DocumentConversionException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.TimeUnit;

/**
 * Reads text files directly and converts PDFs with the {@code pdftotext} command line tool.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CommandLineTextExtractor implements DocumentTextExtractor {

    private final RightsParserProperties properties;

    @Override
    public Mono<String> extractText(Path file) {
        return Mono.fromCallable(() -> convert(file))
                .subscribeOn(Schedulers.boundedElastic());
    }

    private String convert(Path file) throws InterruptedException {
        if (!Files.isRegularFile(file)) {
            throw new DocumentConversionException("Uploaded file is missing: " + file.getFileName(), false);
        }

        String name = file.getFileName().toString().toLowerCase(Locale.ROOT);
        String raw;
        if (name.endsWith(".txt")) {
            raw = readText(file);
        } else if (name.endsWith(".pdf")) {
            raw = runPdfToText(file);
        } else {
            throw new DocumentConversionException("Unsupported document type: " + file.getFileName(), false);
        }

        String text = cleanWhitespace(raw);
        if (text.isEmpty()) {
            throw new DocumentConversionException("Document contains no extractable text", false);
        }
        log.info("Extracted {} characters from {}", text.length(), file.getFileName());
        return text;
    }

    private String readText(Path file) {
        try {
            return Files.readString(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new DocumentConversionException("Failed to read " + file.getFileName() + ": " + e.getMessage(),
                    true, e);
        }
    }

    private String runPdfToText(Path file) throws InterruptedException {
        Path output;
        try {
            output = Files.createTempFile("rights-parser-text-", ".txt");
        } catch (IOException e) {
            throw new DocumentConversionException("Failed to create conversion output: " + e.getMessage(), true, e);
        }

        try {
            executeCommand(List.of(properties.getStorage().getPdfToTextCommand(),
                    file.toAbsolutePath().toString(), output.toString()));
            return readText(output);
        } finally {
            cleanup(output);
        }
    }

    private void executeCommand(List<String> command) throws InterruptedException {
        log.debug("Text conversion command: {}", String.join(" ", command));

        // The text is written to the output file argument; both pipes are discarded
        ProcessBuilder processBuilder = new ProcessBuilder(command);
        processBuilder.redirectOutput(ProcessBuilder.Redirect.DISCARD);
        processBuilder.redirectError(ProcessBuilder.Redirect.DISCARD);

        Process process;
        try {
            process = processBuilder.start();
        } catch (IOException e) {
            throw new DocumentConversionException("Failed to start text conversion: " + e.getMessage(), true, e);
        }

        Duration timeout = properties.getStorage().getConversionTimeout();
        boolean finished;
        try {
            finished = process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            process.destroyForcibly();
            throw e;
        }
        if (!finished) {
            process.destroyForcibly();
            throw new DocumentConversionException("Text conversion timed out after " + timeout, true);
        }
        if (process.exitValue() != 0) {
            throw new DocumentConversionException(
                    "Text conversion failed with exit code " + process.exitValue() + ", the PDF may be damaged",
                    false);
        }
    }

    private void cleanup(Path file) {
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            log.warn("Could not delete temporary file {}: {}", file, e.getMessage());
        }
    }

    static String cleanWhitespace(String raw) {
        return raw.replace("\r\n", "\n")
                .replace('\f', '\n')
                .replaceAll("[ \\t\\x0B]+", " ")
                .replaceAll(" *\\n *", "\n")
                .replaceAll("\\n{3,}", "\n\n")
                .trim();
    }
}
