package service;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.lite.knowledge.config.SchemaInferenceProperties;
import org.lite.knowledge.dto.SchemaInferenceRequest;
import org.lite.knowledge.dto.SchemaInferenceResult;
import org.lite.knowledge.enums.CachedFileType;
import org.lite.knowledge.enums.LlmProviderType;
import org.lite.knowledge.exception.CachedDocumentNotFoundException;
import org.lite.knowledge.model.CachedDocument;
import org.lite.knowledge.model.GraphSchema;
import org.lite.knowledge.model.TextStats;
import org.lite.knowledge.provider.LlmProviderFactory;
import org.lite.knowledge.service.DocumentCacheService;
import org.lite.knowledge.service.KnowledgeGraphExtractionService;
import org.lite.knowledge.service.impl.SchemaInferenceServiceImpl;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class SchemaInferenceServiceImplTest {

    @Mock
    private DocumentCacheService documentCacheService;

    @Mock
    private KnowledgeGraphExtractionService extractionService;

    @Mock
    private LlmProviderFactory providerFactory;

    private SchemaInferenceServiceImpl schemaInferenceService;

    @BeforeEach
    void setUp() {
        schemaInferenceService = new SchemaInferenceServiceImpl(
                documentCacheService, extractionService, providerFactory, new SchemaInferenceProperties());
    }

    @Test
    void testInferFromCachedDocument_MaxLengthOverridesPercentage() {
        // Given
        givenCachedDocument("doc-key", "a".repeat(1000));
        givenSchema();
        SchemaInferenceRequest request = SchemaInferenceRequest.builder()
                .documentKey("doc-key")
                .samplePercentage(50.0)
                .maxSampleLength(100)
                .provider("ollama")
                .build();

        // When
        SchemaInferenceResult result = schemaInferenceService.inferFromCachedDocument(request).block();

        // Then
        assertEquals(100, capturedSample().length());
        assertEquals(100, result.getDocumentInfo().getSampleSize());
        assertEquals(10.0, result.getDocumentInfo().getSamplePercentage());
        verifyNoInteractions(providerFactory);
    }

    @Test
    void testInferFromCachedDocument_HalfOfDocument() {
        // Given
        givenCachedDocument("doc-key", "b".repeat(1000));
        givenSchema();
        SchemaInferenceRequest request = SchemaInferenceRequest.builder()
                .documentKey("doc-key")
                .samplePercentage(50.0)
                .provider("ollama")
                .build();

        // When
        SchemaInferenceResult result = schemaInferenceService.inferFromCachedDocument(request).block();

        // Then
        assertEquals(500, capturedSample().length());
        assertEquals(50.0, result.getDocumentInfo().getSamplePercentage());
        assertEquals(1000, result.getDocumentInfo().getTotalChars());
        assertEquals("ollama", result.getProvider());
    }

    @Test
    void testInferFromCachedDocument_SmallPercentageOfShortTextUsesWholeText() {
        // Given
        givenCachedDocument("doc-key", "Small text");
        givenSchema();
        SchemaInferenceRequest request = SchemaInferenceRequest.builder()
                .documentKey("doc-key")
                .samplePercentage(10.0)
                .provider("ollama")
                .build();

        // When
        SchemaInferenceResult result = schemaInferenceService.inferFromCachedDocument(request).block();

        // Then
        assertEquals("Small text", capturedSample());
        assertEquals(100.0, result.getDocumentInfo().getSamplePercentage());
    }

    @Test
    void testInferFromCachedDocument_SmallPercentageRaisedToMinimumLength() {
        // Given
        givenCachedDocument("doc-key", "d".repeat(1000));
        givenSchema();
        SchemaInferenceRequest request = SchemaInferenceRequest.builder()
                .documentKey("doc-key")
                .samplePercentage(2.0)
                .provider("ollama")
                .build();

        // When
        SchemaInferenceResult result = schemaInferenceService.inferFromCachedDocument(request).block();

        // Then
        assertEquals(50, capturedSample().length());
        assertEquals(5.0, result.getDocumentInfo().getSamplePercentage());
    }

    @Test
    void testInferFromCachedDocument_DefaultLengthAndDefaultProvider() {
        // Given
        givenCachedDocument("doc-key", "c".repeat(5000));
        givenSchema();
        when(providerFactory.getDefaultType()).thenReturn(LlmProviderType.OLLAMA);
        SchemaInferenceRequest request = SchemaInferenceRequest.builder().documentKey("doc-key").build();

        // When
        schemaInferenceService.inferFromCachedDocument(request).block();

        // Then
        assertEquals(1000, capturedSample().length());
    }

    @Test
    void testInferFromCachedDocument_RejectsOutOfRangeArguments() {
        SchemaInferenceRequest tooShort = SchemaInferenceRequest.builder()
                .documentKey("doc-key").maxSampleLength(10).provider("ollama").build();
        SchemaInferenceRequest zeroPercent = SchemaInferenceRequest.builder()
                .documentKey("doc-key").samplePercentage(0.0).provider("ollama").build();
        SchemaInferenceRequest overHundred = SchemaInferenceRequest.builder()
                .documentKey("doc-key").samplePercentage(100.5).provider("ollama").build();

        StepVerifier.create(schemaInferenceService.inferFromCachedDocument(tooShort))
                .expectError(IllegalArgumentException.class).verify();
        StepVerifier.create(schemaInferenceService.inferFromCachedDocument(zeroPercent))
                .expectError(IllegalArgumentException.class).verify();
        StepVerifier.create(schemaInferenceService.inferFromCachedDocument(overHundred))
                .expectError(IllegalArgumentException.class).verify();
        verifyNoInteractions(documentCacheService, extractionService);
    }

    @Test
    void testInferFromCachedDocument_UnknownKey() {
        // Given
        when(documentCacheService.require("missing"))
                .thenReturn(Mono.error(new CachedDocumentNotFoundException("missing")));
        SchemaInferenceRequest request = SchemaInferenceRequest.builder()
                .documentKey("missing").provider("ollama").build();

        // When / Then
        StepVerifier.create(schemaInferenceService.inferFromCachedDocument(request))
                .expectError(CachedDocumentNotFoundException.class)
                .verify();
    }

    @Test
    void testInferFromText_NoDocumentInfo() {
        // Given
        givenSchema();

        // When
        SchemaInferenceResult result = schemaInferenceService.inferFromText("d".repeat(300), 200, "ollama").block();

        // Then
        assertEquals(200, capturedSample().length());
        assertNull(result.getDocumentInfo());
        assertEquals(GraphSchema.fallback(), result.getSchema());
    }

    private void givenCachedDocument(String key, String text) {
        Instant now = Instant.parse("2024-05-01T10:00:00Z");
        CachedDocument document = CachedDocument.builder()
                .key(key)
                .filename("contract.txt")
                .rawText(text)
                .fileType(CachedFileType.TXT)
                .sizeBytes(text.length())
                .textStats(TextStats.of(text))
                .createdAt(now)
                .expiresAt(now.plusSeconds(1800))
                .lastAccessedAt(now)
                .build();
        when(documentCacheService.require(key)).thenReturn(Mono.just(document));
    }

    private void givenSchema() {
        when(extractionService.inferSchema(anyString(), eq(LlmProviderType.OLLAMA)))
                .thenReturn(Mono.just(GraphSchema.fallback()));
    }

    private String capturedSample() {
        ArgumentCaptor<String> captor = ArgumentCaptor.forClass(String.class);
        verify(extractionService).inferSchema(captor.capture(), eq(LlmProviderType.OLLAMA));
        return captor.getValue();
    }
}
