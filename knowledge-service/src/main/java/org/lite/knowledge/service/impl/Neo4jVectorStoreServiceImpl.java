package org.lite.knowledge.service.impl;

import lombok.extern.slf4j.Slf4j;
import org.lite.knowledge.config.VectorStoreProperties;
import org.lite.knowledge.dto.DocumentSummary;
import org.lite.knowledge.enums.StoreStatus;
import org.lite.knowledge.exception.KnowledgePipelineException;
import org.lite.knowledge.exception.StoreUnavailableException;
import org.lite.knowledge.model.Chunk;
import org.lite.knowledge.model.ExtractedKnowledge;
import org.lite.knowledge.model.KnowledgeDocument;
import org.lite.knowledge.model.ScoredChunk;
import org.lite.knowledge.model.Source;
import org.lite.knowledge.service.VectorStoreService;
import org.lite.knowledge.util.CypherNames;
import org.neo4j.driver.Driver;
import org.neo4j.driver.Record;
import org.neo4j.driver.Result;
import org.neo4j.driver.Session;
import org.neo4j.driver.Value;
import org.neo4j.driver.exceptions.Neo4jException;
import org.neo4j.driver.exceptions.ServiceUnavailableException;
import org.neo4j.driver.exceptions.SessionExpiredException;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Function;
import java.util.function.Supplier;

@Slf4j
@Service
public class Neo4jVectorStoreServiceImpl implements VectorStoreService {

    private static final Set<String> SIMILARITY_FUNCTIONS = Set.of("cosine", "euclidean");

    private static final String CREATE_DOCUMENT =
            "CREATE (d:Document {id: $id, filename: $filename, filetype: $filetype, ingested_at: datetime($ingestedAt)})";

    private static final String CREATE_CHUNKS =
            "MATCH (d:Document {id: $documentId}) " +
            "UNWIND $chunks AS chunk " +
            "CREATE (c:Chunk {id: chunk.id, text: chunk.text, embedding: chunk.embedding, " +
            "document_id: $documentId, chunk_index: chunk.ordinal, source_filename: chunk.sourceFilename, " +
            "created_at: datetime(chunk.createdAt)}) " +
            "CREATE (d)-[:HAS_CHUNK]->(c)";

    private static final String LINK_CHUNKS =
            "MATCH (c:Chunk {document_id: $documentId}) " +
            "WITH c ORDER BY c.chunk_index " +
            "WITH collect(c) AS chunks " +
            "UNWIND range(0, size(chunks) - 2) AS i " +
            "WITH chunks[i] AS current, chunks[i + 1] AS next " +
            "CREATE (current)-[:NEXT]->(next)";

    private static final String VECTOR_SEARCH =
            "CALL db.index.vector.queryNodes($indexName, $k, $embedding) YIELD node, score " +
            "RETURN node.id AS id, node.text AS text, node.document_id AS documentId, " +
            "node.chunk_index AS ordinal, node.source_filename AS sourceFilename, score " +
            "ORDER BY score DESC";

    private static final String TEXT_SEARCH =
            "MATCH (d:Document)-[:HAS_CHUNK]->(c:Chunk) " +
            "WHERE toLower(c.text) CONTAINS toLower($query) " +
            "RETURN c.id AS id, c.text AS text, c.document_id AS documentId, " +
            "c.chunk_index AS ordinal, c.source_filename AS sourceFilename " +
            "ORDER BY d.ingested_at, c.chunk_index " +
            "LIMIT $limit";

    private static final String INDEX_DIMENSION =
            "SHOW INDEXES YIELD name, options WHERE name = $name " +
            "RETURN options.indexConfig['vector.dimensions'] AS dimension";

    private static final String STORED_DIMENSION =
            "MATCH (c:Chunk) WHERE c.embedding IS NOT NULL RETURN size(c.embedding) AS dimension LIMIT 1";

    private final Driver neo4jDriver;
    private final VectorStoreProperties properties;
    private final AtomicBoolean available = new AtomicBoolean(true);
    private final AtomicLong lastProbeNanos = new AtomicLong(System.nanoTime());
    private final Set<String> verifiedIndexes = ConcurrentHashMap.newKeySet();

    public Neo4jVectorStoreServiceImpl(Driver neo4jDriver, VectorStoreProperties properties) {
        this.neo4jDriver = neo4jDriver;
        this.properties = properties;
        if (properties.isVerifyConnectivity()) {
            probe();
        }
    }

    @Override
    public StoreStatus getStatus() {
        return available.get() ? StoreStatus.AVAILABLE : StoreStatus.DEGRADED;
    }

    @Override
    public boolean isAvailable() {
        return available.get();
    }

    @Override
    public Mono<StoreStatus> refreshStatus() {
        return Mono.fromCallable(() -> {
            probe();
            return getStatus();
        }).subscribeOn(Schedulers.boundedElastic());
    }

    @Override
    public Mono<StoreStatus> currentStatus() {
        if (isAvailable()) {
            return Mono.just(StoreStatus.AVAILABLE);
        }
        return Mono.fromCallable(() -> {
            reconnectIfDue("status-check");
            return getStatus();
        }).subscribeOn(Schedulers.boundedElastic());
    }

    @Override
    public Mono<Boolean> ensureIndex() {
        return ensureIndex(properties.getIndexName(), properties.getDimension(), properties.getSimilarityFunction());
    }

    @Override
    public Mono<Boolean> ensureIndex(String indexName, int dimension, String similarityFunction) {
        String name = CypherNames.indexName(indexName);
        String function = similarityFunction.toLowerCase(Locale.ROOT);
        if (!SIMILARITY_FUNCTIONS.contains(function)) {
            return Mono.error(new IllegalArgumentException("Unsupported similarity function: " + similarityFunction));
        }
        if (dimension <= 0) {
            return Mono.error(new IllegalArgumentException("Index dimension must be positive"));
        }
        if (verifiedIndexes.contains(name) && isAvailable()) {
            return Mono.just(true);
        }

        return withSession("ensure-index", session -> {
            Result existing = session.run("SHOW INDEXES YIELD name WHERE name = $name RETURN count(*) AS count",
                    Map.of("name", name));
            if (existing.hasNext() && existing.next().get("count").asLong() > 0) {
                log.debug("Vector index {} already exists", name);
            } else {
                // index name and options cannot be parameterised
                String cypher = "CREATE VECTOR INDEX `" + name + "` IF NOT EXISTS " +
                        "FOR (c:Chunk) ON (c.embedding) " +
                        "OPTIONS {indexConfig: {`vector.dimensions`: " + dimension +
                        ", `vector.similarity_function`: '" + function + "'}}";
                session.run(cypher).consume();
                log.info("Created vector index {} ({} dimensions, {})", name, dimension, function);
            }
            verifiedIndexes.add(name);
            return true;
        }, () -> false);
    }

    @Override
    public Mono<String> saveDocument(KnowledgeDocument document, List<Chunk> chunks) {
        return withSession("save-document", session -> session.executeWrite(tx -> {
            Map<String, Object> documentParams = new HashMap<>();
            documentParams.put("id", document.getId());
            documentParams.put("filename", document.getFilename());
            documentParams.put("filetype", document.getFiletype());
            documentParams.put("ingestedAt", isoTimestamp(document.getIngestedAt()));
            tx.run(CREATE_DOCUMENT, documentParams).consume();

            List<Map<String, Object>> chunkParams = new ArrayList<>(chunks.size());
            for (Chunk chunk : chunks) {
                Map<String, Object> row = new HashMap<>();
                row.put("id", chunk.getId());
                row.put("text", chunk.getText());
                row.put("embedding", chunk.getEmbedding());
                row.put("ordinal", chunk.getOrdinal());
                row.put("sourceFilename", chunk.getSourceFilename());
                row.put("createdAt", isoTimestamp(chunk.getCreatedAt()));
                chunkParams.add(row);
            }
            tx.run(CREATE_CHUNKS, Map.of("documentId", document.getId(), "chunks", chunkParams)).consume();
            tx.run(LINK_CHUNKS, Map.of("documentId", document.getId())).consume();

            log.info("Persisted document {} ({}) with {} chunks", document.getId(), document.getFilename(), chunks.size());
            return document.getId();
        }), () -> {
            log.warn("Vector store degraded, document {} was not persisted", document.getId());
            return document.getId();
        });
    }

    @Override
    public Mono<List<ScoredChunk>> search(List<Float> queryVector, int k) {
        return withSession("vector-search", session -> {
            Map<String, Object> params = Map.of(
                    "indexName", properties.getIndexName(),
                    "k", k,
                    "embedding", queryVector);
            List<ScoredChunk> hits = new ArrayList<>();
            for (Record record : session.run(VECTOR_SEARCH, params).list()) {
                hits.add(new ScoredChunk(toChunk(record), record.get("score").asDouble()));
            }
            log.debug("Vector search returned {} hits", hits.size());
            return hits;
        }, List::of);
    }

    @Override
    public Mono<List<Source>> textSearch(String query, int limit) {
        return withSession("text-search", session -> {
            List<Source> sources = new ArrayList<>();
            for (Record record : session.run(TEXT_SEARCH, Map.of("query", query, "limit", limit)).list()) {
                Chunk chunk = toChunk(record);
                sources.add(Source.builder()
                        .text(chunk.getText())
                        .score(Source.TEXT_MATCH_SCORE)
                        .metadata(chunk.toMetadata())
                        .build());
            }
            log.debug("Text search returned {} chunks", sources.size());
            return sources;
        }, List::of);
    }

    @Override
    public Mono<Integer> getStoredEmbeddingDimension() {
        return withSession("stored-dimension", session -> {
            Result result = session.run(STORED_DIMENSION);
            if (!result.hasNext()) {
                return null;
            }
            return result.next().get("dimension").asInt();
        }, () -> null);
    }

    @Override
    public Mono<Integer> getIndexDimension() {
        return withSession("index-dimension", session -> {
            Result result = session.run(INDEX_DIMENSION,
                    Map.of("name", CypherNames.indexName(properties.getIndexName())));
            if (!result.hasNext()) {
                return null;
            }
            Value dimension = result.next().get("dimension");
            return dimension == null || dimension.isNull() ? null : dimension.asInt();
        }, () -> null);
    }

    @Override
    public Mono<Integer> saveKnowledgeGraph(String chunkId, ExtractedKnowledge knowledge) {
        if (knowledge == null || knowledge.isEmpty()) {
            return Mono.just(0);
        }
        return withSession("save-knowledge-graph", session -> session.executeWrite(tx -> {
            Map<String, String> labelsByName = new LinkedHashMap<>();
            for (ExtractedKnowledge.Entity entity : knowledge.entities()) {
                String label = CypherNames.label(entity.label());
                if (label == null || entity.name() == null || entity.name().isBlank()) {
                    continue;
                }
                String cypher = "MATCH (c:Chunk {id: $chunkId}) " +
                        "MERGE (e:" + label + " {name: $name}) " +
                        "ON CREATE SET e.createdAt = timestamp() " +
                        "MERGE (c)-[:MENTIONS]->(e)";
                tx.run(cypher, Map.of("chunkId", chunkId, "name", entity.name())).consume();
                labelsByName.putIfAbsent(entity.name(), label);
            }

            for (ExtractedKnowledge.Relationship relationship : knowledge.relationships()) {
                String type = CypherNames.relationshipType(relationship.type());
                String sourceLabel = labelsByName.get(relationship.source());
                String targetLabel = labelsByName.get(relationship.target());
                if (type == null || sourceLabel == null || targetLabel == null) {
                    log.debug("Skipping relationship {} with unknown endpoints", relationship);
                    continue;
                }
                String cypher = "MATCH (a:" + sourceLabel + " {name: $source}) " +
                        "MATCH (b:" + targetLabel + " {name: $target}) " +
                        "MERGE (a)-[r:" + type + "]->(b) " +
                        "ON CREATE SET r.createdAt = timestamp()";
                tx.run(cypher, Map.of("source", relationship.source(), "target", relationship.target())).consume();
            }
            log.debug("Saved {} entities for chunk {}", labelsByName.size(), chunkId);
            return labelsByName.size();
        }), () -> 0);
    }

    @Override
    public Mono<List<DocumentSummary>> listDocuments() {
        return withSession("list-documents", session -> {
            String cypher = "MATCH (d:Document) " +
                    "OPTIONAL MATCH (d)-[:HAS_CHUNK]->(c:Chunk) " +
                    "RETURN d.id AS documentId, d.filename AS filename, d.ingested_at AS ingestedAt, " +
                    "count(c) AS chunkCount " +
                    "ORDER BY d.ingested_at DESC";
            List<DocumentSummary> documents = new ArrayList<>();
            for (Record record : session.run(cypher).list()) {
                Value ingestedAt = record.get("ingestedAt");
                documents.add(DocumentSummary.builder()
                        .documentId(stringOrNull(record, "documentId"))
                        .filename(stringOrNull(record, "filename"))
                        .chunkCount(record.get("chunkCount").asLong())
                        .ingestedAt(ingestedAt == null || ingestedAt.isNull()
                                ? null : ingestedAt.asZonedDateTime().toInstant())
                        .build());
            }
            return documents;
        }, List::of);
    }

    @Override
    public Mono<List<Chunk>> listChunks(String documentId, int limit) {
        return withSession("list-chunks", session -> {
            String cypher = "MATCH (d:Document {id: $documentId})-[:HAS_CHUNK]->(c:Chunk) " +
                    "RETURN c.id AS id, c.text AS text, c.document_id AS documentId, " +
                    "c.chunk_index AS ordinal, c.source_filename AS sourceFilename " +
                    "ORDER BY c.chunk_index " +
                    "LIMIT $limit";
            List<Chunk> chunks = new ArrayList<>();
            for (Record record : session.run(cypher, Map.of("documentId", documentId, "limit", limit)).list()) {
                chunks.add(toChunk(record));
            }
            return chunks;
        }, List::of);
    }

    @Override
    public Mono<Boolean> deleteDocument(String documentId) {
        return withSession("delete-document", session -> session.executeWrite(tx -> {
            Result found = tx.run("MATCH (d:Document {id: $id}) RETURN count(d) AS count", Map.of("id", documentId));
            if (!found.hasNext() || found.next().get("count").asLong() == 0) {
                return false;
            }
            tx.run("MATCH (d:Document {id: $id}) " +
                    "OPTIONAL MATCH (d)-[:HAS_CHUNK]->(c:Chunk) " +
                    "DETACH DELETE c, d", Map.of("id", documentId)).consume();
            log.info("Deleted document {} and its chunks", documentId);
            return true;
        }), () -> {
            throw new StoreUnavailableException("delete-document", null);
        });
    }

    @Override
    public Mono<Void> clearDatabase() {
        return withSession("clear-database", session -> {
            String indexName = CypherNames.indexName(properties.getIndexName());
            session.run("DROP INDEX `" + indexName + "` IF EXISTS").consume();
            session.run("MATCH (n) DETACH DELETE n").consume();
            verifiedIndexes.clear();
            log.info("Dropped index {} and cleared all nodes", indexName);
            return true;
        }, () -> {
            throw new StoreUnavailableException("clear-database", null);
        }).then();
    }

    /**
     * Runs blocking session work off the event loop. A null result completes the Mono empty.
     * Lost connectivity flips the store to DEGRADED and answers with {@code degradedResult} until a
     * later probe finds the store reachable again.
     */
    private <T> Mono<T> withSession(String operation, Function<Session, T> work, Supplier<T> degradedResult) {
        return Mono.fromCallable(() -> {
            if (!isAvailable() && !reconnectIfDue(operation)) {
                log.debug("Skipping {} while the vector store is degraded", operation);
                return degradedResult.get();
            }
            try (Session session = neo4jDriver.session()) {
                return work.apply(session);
            } catch (ServiceUnavailableException | SessionExpiredException e) {
                markDegraded(operation, e);
                return degradedResult.get();
            } catch (Neo4jException e) {
                log.error("Vector store {} failed: {}", operation, e.getMessage());
                throw new KnowledgePipelineException("Vector store " + operation + " failed: " + e.getMessage(), e);
            }
        }).subscribeOn(Schedulers.boundedElastic());
    }

    private boolean reconnectIfDue(String operation) {
        long last = lastProbeNanos.get();
        long now = System.nanoTime();
        if (now - last < properties.getReprobeInterval().toNanos() || !lastProbeNanos.compareAndSet(last, now)) {
            return false;
        }
        log.debug("Probing degraded vector store before {}", operation);
        probe();
        return isAvailable();
    }

    private void probe() {
        lastProbeNanos.set(System.nanoTime());
        try {
            neo4jDriver.verifyConnectivity();
            if (!available.getAndSet(true)) {
                log.info("Vector store is reachable again");
            } else {
                log.info("Connected to vector store");
            }
        } catch (Neo4jException e) {
            markDegraded("connectivity-check", e);
        }
    }

    private void markDegraded(String operation, Exception cause) {
        if (available.getAndSet(false)) {
            log.warn("Vector store unreachable during {}, switching to degraded mode: {}", operation, cause.getMessage());
        }
    }

    private static Chunk toChunk(Record record) {
        Value ordinal = record.get("ordinal");
        return Chunk.builder()
                .id(stringOrNull(record, "id"))
                .text(stringOrNull(record, "text"))
                .documentId(stringOrNull(record, "documentId"))
                .ordinal(ordinal == null || ordinal.isNull() ? 0 : ordinal.asInt())
                .sourceFilename(stringOrNull(record, "sourceFilename"))
                .build();
    }

    private static String stringOrNull(Record record, String key) {
        Value value = record.get(key);
        return value == null || value.isNull() ? null : value.asString();
    }

    private static String isoTimestamp(Instant instant) {
        return (instant != null ? instant : Instant.now()).atOffset(ZoneOffset.UTC).toString();
    }
}
