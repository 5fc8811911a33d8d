package com.fanfic.ingest.service.ingest;

/**
 * Exception thrown when a URL file, a URL or the watched folder cannot be processed.
 */
public class IngestionException extends RuntimeException {

    public static final String FOLDER_UNAVAILABLE = "FOLDER_UNAVAILABLE";
    public static final String FOLDER_SCAN_FAILED = "FOLDER_SCAN_FAILED";
    public static final String UNPARSEABLE_URL = "UNPARSEABLE_URL";

    private final String entityId;
    private final String errorCode;

    public IngestionException(String message, String entityId, String errorCode) {
        super(message);
        this.entityId = entityId;
        this.errorCode = errorCode;
    }

    public IngestionException(String message, String entityId, String errorCode, Throwable cause) {
        super(message, cause);
        this.entityId = entityId;
        this.errorCode = errorCode;
    }

    public String getEntityId() {
        return entityId;
    }

    public String getErrorCode() {
        return errorCode;
    }
}
