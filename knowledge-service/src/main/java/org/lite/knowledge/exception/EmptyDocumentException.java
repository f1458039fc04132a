package org.lite.knowledge.exception;

public class EmptyDocumentException extends KnowledgePipelineException {

    public EmptyDocumentException(String filename) {
        super(String.format("No content to process after chunking '%s'", filename), null, "ingest", 0, null);
    }
}
