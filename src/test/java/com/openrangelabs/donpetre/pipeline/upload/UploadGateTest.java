package com.openrangelabs.donpetre.pipeline.upload;

import com.openrangelabs.donpetre.pipeline.exception.FileRejectedException;
import com.openrangelabs.donpetre.pipeline.model.IngestionResult;
import com.openrangelabs.donpetre.pipeline.processor.IngestionSource;
import com.openrangelabs.donpetre.pipeline.service.IngestionPipeline;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.io.ByteArrayInputStream;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class UploadGateTest {

    @Mock
    private IngestionPipeline pipeline;

    private UploadGate gate;

    @BeforeEach
    void setUp() {
        UploadPolicy policy = UploadPolicy.builder()
                .allowedExtension("csv")
                .allowedExtension("jsonl")
                .allowedExtension("pdf")
                .maxBytes(16)
                .build();
        gate = new UploadGate(pipeline, policy);
    }

    @Test
    void accept_SpoolsAndDelegatesToPipeline() {
        IngestionResult expected = IngestionResult.builder("csv", "data.csv").addIngested(1).build();
        when(pipeline.ingest(eq("csv"), any(IngestionSource.class))).thenAnswer(invocation -> {
            IngestionSource source = invocation.getArgument(1);
            try (InputStream in = source.openStream()) {
                assertThat(new String(in.readAllBytes(), StandardCharsets.UTF_8)).isEqualTo("id\n1\n");
            }
            return Mono.just(expected);
        });

        StepVerifier.create(gate.accept("data.csv", stream("id\n1\n")))
                .expectNext(expected)
                .verifyComplete();

        ArgumentCaptor<IngestionSource> source = ArgumentCaptor.forClass(IngestionSource.class);
        verify(pipeline).ingest(eq("csv"), source.capture());
        assertThat(source.getValue().getName()).isEqualTo("data.csv");
    }

    @Test
    void accept_RejectsExtensionOutsidePolicy() {
        StepVerifier.create(gate.accept("archive.zip", stream("PK")))
                .expectErrorSatisfies(error -> assertThat(((FileRejectedException) error).getReason())
                        .isEqualTo(FileRejectedException.Reason.UNSUPPORTED_EXTENSION))
                .verify();

        verify(pipeline, never()).ingest(anyString(), any());
    }

    @Test
    void accept_RejectsUnparsedFormatEvenWhenAllowed() {
        StepVerifier.create(gate.accept("report.pdf", stream("%PDF")))
                .expectError(FileRejectedException.class)
                .verify();
    }

    @Test
    void accept_RejectsOversizedUploadBeforePipeline() {
        StepVerifier.create(gate.accept("big.csv", stream("id\n1234567890123456789\n")))
                .expectErrorSatisfies(error -> assertThat(((FileRejectedException) error).getReason())
                        .isEqualTo(FileRejectedException.Reason.TOO_LARGE))
                .verify();

        verify(pipeline, never()).ingest(anyString(), any());
    }

    private static InputStream stream(String content) {
        return new ByteArrayInputStream(content.getBytes(StandardCharsets.UTF_8));
    }
}
