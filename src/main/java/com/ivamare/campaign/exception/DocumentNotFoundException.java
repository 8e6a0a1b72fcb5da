package com.ivamare.campaign.exception;

import java.util.UUID;

/**
 * Thrown when a document cannot be found.
 */
public class DocumentNotFoundException extends CampaignException {

    private final String documentRef;

    public DocumentNotFoundException(UUID documentId) {
        this(String.valueOf(documentId));
    }

    public DocumentNotFoundException(String documentRef) {
        super("Document " + documentRef + " not found");
        this.documentRef = documentRef;
    }

    public String getDocumentRef() {
        return documentRef;
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.NOT_FOUND;
    }
}
