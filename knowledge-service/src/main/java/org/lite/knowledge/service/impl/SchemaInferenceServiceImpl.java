package org.lite.knowledge.service.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.lite.knowledge.config.SchemaInferenceProperties;
import org.lite.knowledge.dto.SchemaInferenceRequest;
import org.lite.knowledge.dto.SchemaInferenceResult;
import org.lite.knowledge.enums.LlmProviderType;
import org.lite.knowledge.provider.LlmProviderFactory;
import org.lite.knowledge.service.DocumentCacheService;
import org.lite.knowledge.service.KnowledgeGraphExtractionService;
import org.lite.knowledge.service.SchemaInferenceService;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

@Service
@Slf4j
@RequiredArgsConstructor
public class SchemaInferenceServiceImpl implements SchemaInferenceService {

    private final DocumentCacheService documentCacheService;
    private final KnowledgeGraphExtractionService extractionService;
    private final LlmProviderFactory providerFactory;
    private final SchemaInferenceProperties properties;

    @Override
    public Mono<SchemaInferenceResult> inferFromCachedDocument(SchemaInferenceRequest request) {
        return Mono.defer(() -> {
            validateMaxSampleLength(request.getMaxSampleLength());
            validatePercentage(request.getSamplePercentage());
            LlmProviderType providerType = resolveProvider(request.getProvider());

            return documentCacheService.require(request.getDocumentKey())
                    .flatMap(document -> {
                        String text = document.getRawText();
                        if (text == null || text.isBlank()) {
                            return Mono.error(new IllegalArgumentException(
                                    "Cached document '" + document.getFilename() + "' has no text"));
                        }
                        int sampleSize = sampleLength(text.length(), request.getMaxSampleLength(),
                                request.getSamplePercentage());
                        String sample = text.substring(0, sampleSize);
                        log.info("Inferring schema for {} from {} of {} chars with {}",
                                document.getFilename(), sampleSize, text.length(), providerType.getId());

                        SchemaInferenceResult.DocumentInfo info = SchemaInferenceResult.DocumentInfo.builder()
                                .key(document.getKey())
                                .filename(document.getFilename())
                                .totalChars(text.length())
                                .sampleSize(sampleSize)
                                .samplePercentage(Math.round(sampleSize * 10000.0 / text.length()) / 100.0)
                                .build();

                        return extractionService.inferSchema(sample, providerType)
                                .map(schema -> SchemaInferenceResult.builder()
                                        .schema(schema)
                                        .provider(providerType.getId())
                                        .documentInfo(info)
                                        .build());
                    });
        });
    }

    @Override
    public Mono<SchemaInferenceResult> inferFromText(String text, Integer maxSampleLength, String provider) {
        return Mono.defer(() -> {
            if (text == null || text.isBlank()) {
                return Mono.error(new IllegalArgumentException("Text must not be empty"));
            }
            validateMaxSampleLength(maxSampleLength);
            LlmProviderType providerType = resolveProvider(provider);
            int sampleSize = sampleLength(text.length(), maxSampleLength, null);

            return extractionService.inferSchema(text.substring(0, sampleSize), providerType)
                    .map(schema -> SchemaInferenceResult.builder()
                            .schema(schema)
                            .provider(providerType.getId())
                            .build());
        });
    }

    /**
     * maxSampleLength wins over samplePercentage. A percentage sample is never shorter than the
     * minimum sample length unless the whole text is.
     */
    int sampleLength(int textLength, Integer maxSampleLength, Double samplePercentage) {
        int length;
        if (maxSampleLength != null) {
            length = maxSampleLength;
        } else if (samplePercentage != null) {
            length = Math.max(properties.getMinSampleLength(),
                    (int) Math.floor(textLength * samplePercentage / 100.0));
        } else {
            length = properties.getDefaultSampleLength();
        }
        return Math.min(length, textLength);
    }

    private LlmProviderType resolveProvider(String provider) {
        return provider == null || provider.isBlank() ? providerFactory.getDefaultType() : LlmProviderType.fromId(provider);
    }

    private void validateMaxSampleLength(Integer maxSampleLength) {
        if (maxSampleLength != null
                && (maxSampleLength < properties.getMinSampleLength() || maxSampleLength > properties.getMaxSampleLength())) {
            throw new IllegalArgumentException(String.format("maxSampleLength must be between %d and %d",
                    properties.getMinSampleLength(), properties.getMaxSampleLength()));
        }
    }

    private static void validatePercentage(Double samplePercentage) {
        if (samplePercentage != null && (samplePercentage <= 0 || samplePercentage > 100)) {
            throw new IllegalArgumentException("samplePercentage must be greater than 0 and at most 100");
        }
    }
}
