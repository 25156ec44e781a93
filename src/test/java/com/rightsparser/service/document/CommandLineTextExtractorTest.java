package com.rightsparser.service.document;

import com.rightsparser.config.RightsParserProperties;
import com.rightsparser.exception.DocumentConversionException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.DisabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;
import reactor.test.StepVerifier;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for CommandLineTextExtractor.
 */
class CommandLineTextExtractorTest {

    @TempDir
    Path dir;

    private RightsParserProperties properties;
    private CommandLineTextExtractor extractor;

    @BeforeEach
    void setUp() {
        properties = new RightsParserProperties();
        extractor = new CommandLineTextExtractor(properties);
    }

    @Test
    void extractText_PlainTextFile() throws IOException {
        Path file = write("deal.txt", "LICENSOR:   Sony Pictures\r\n\r\n\r\n\r\nTERRITORY:\tIndia  \n");

        StepVerifier.create(extractor.extractText(file))
                .expectNext("LICENSOR: Sony Pictures\n\nTERRITORY: India")
                .verifyComplete();
    }

    @Test
    void extractText_BlankDocument_IsPermanentFailure() throws IOException {
        Path file = write("blank.txt", "  \n\n \t ");

        StepVerifier.create(extractor.extractText(file))
                .expectErrorSatisfies(error -> {
                    assertThat(error).isInstanceOf(DocumentConversionException.class);
                    assertThat(((DocumentConversionException) error).isRetryable()).isFalse();
                })
                .verify();
    }

    @Test
    void extractText_MissingFile_IsPermanentFailure() {
        StepVerifier.create(extractor.extractText(dir.resolve("gone.pdf")))
                .expectErrorMatches(error -> error instanceof DocumentConversionException conversion
                        && !conversion.isRetryable())
                .verify();
    }

    @Test
    void extractText_UnsupportedType_IsPermanentFailure() throws IOException {
        Path file = write("deal.docx", "binary");

        StepVerifier.create(extractor.extractText(file))
                .expectErrorMatches(error -> error instanceof DocumentConversionException conversion
                        && !conversion.isRetryable())
                .verify();
    }

    @Test
    void extractText_ConverterUnavailable_IsRetryable() throws IOException {
        properties.getStorage().setPdfToTextCommand("rights-parser-missing-converter");
        Path file = write("deal.pdf", "%PDF-1.4");

        StepVerifier.create(extractor.extractText(file))
                .expectErrorMatches(error -> error instanceof DocumentConversionException conversion
                        && conversion.isRetryable())
                .verify();
    }

    @Test
    @DisabledOnOs(OS.WINDOWS)
    void extractText_PdfConvertedThroughCommand() throws IOException {
        Path converter = script("convert.sh", "printf 'LICENSOR:  Sony Pictures\\nTERRITORY: India' > \"$2\"");
        properties.getStorage().setPdfToTextCommand(converter.toString());
        Path file = write("deal.pdf", "%PDF-1.4");

        StepVerifier.create(extractor.extractText(file))
                .expectNext("LICENSOR: Sony Pictures\nTERRITORY: India")
                .verifyComplete();
    }

    @Test
    @DisabledOnOs(OS.WINDOWS)
    void extractText_HungConverter_TimesOut() throws IOException {
        Path converter = script("hang.sh", "exec sleep 20");
        properties.getStorage().setPdfToTextCommand(converter.toString());
        properties.getStorage().setConversionTimeout(Duration.ofSeconds(1));
        Path file = write("deal.pdf", "%PDF-1.4");

        long startedAt = System.nanoTime();
        StepVerifier.create(extractor.extractText(file))
                .expectErrorSatisfies(error -> {
                    assertThat(error).isInstanceOf(DocumentConversionException.class)
                            .hasMessageContaining("timed out");
                    assertThat(((DocumentConversionException) error).isRetryable()).isTrue();
                })
                .verify(Duration.ofSeconds(10));
        assertThat(Duration.ofNanos(System.nanoTime() - startedAt)).isLessThan(Duration.ofSeconds(10));
    }

    @Test
    @DisabledOnOs(OS.WINDOWS)
    void extractText_ConverterExitCode_IsPermanentFailure() throws IOException {
        Path converter = script("broken.sh", "exit 1");
        properties.getStorage().setPdfToTextCommand(converter.toString());
        Path file = write("deal.pdf", "%PDF-1.4");

        StepVerifier.create(extractor.extractText(file))
                .expectErrorMatches(error -> error instanceof DocumentConversionException conversion
                        && !conversion.isRetryable()
                        && conversion.getMessage().contains("exit code 1"))
                .verify();
    }

    private Path script(String name, String body) throws IOException {
        Path script = write(name, "#!/bin/sh\n" + body + "\n");
        assertThat(script.toFile().setExecutable(true)).isTrue();
        return script;
    }

    private Path write(String name, String content) throws IOException {
        return Files.write(dir.resolve(name), content.getBytes(StandardCharsets.UTF_8));
    }
}
