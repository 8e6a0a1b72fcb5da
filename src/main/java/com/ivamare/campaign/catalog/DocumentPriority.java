package com.ivamare.campaign.catalog;

/**
 * Editorial priority of a document.
 */
public enum DocumentPriority {
    STANDARD,

    /** Core campaign position, counted separately in catalog statistics */
    CAMPAIGN
}
