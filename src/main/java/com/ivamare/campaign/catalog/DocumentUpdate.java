package com.ivamare.campaign.catalog;

import com.ivamare.campaign.access.Tier;

/**
 * Partial update of a document. Null fields are left unchanged.
 */
public record DocumentUpdate(
    String title,
    String body,
    String category,
    Tier tier,
    Boolean featured,
    DocumentPriority priority
) {
    public static DocumentUpdate empty() {
        return new DocumentUpdate(null, null, null, null, null, null);
    }

    public DocumentUpdate withTitle(String newTitle) {
        return new DocumentUpdate(newTitle, body, category, tier, featured, priority);
    }

    public DocumentUpdate withBody(String newBody) {
        return new DocumentUpdate(title, newBody, category, tier, featured, priority);
    }

    public DocumentUpdate withCategory(String newCategory) {
        return new DocumentUpdate(title, body, newCategory, tier, featured, priority);
    }

    public DocumentUpdate withTier(Tier newTier) {
        return new DocumentUpdate(title, body, category, newTier, featured, priority);
    }

    public DocumentUpdate withFeatured(boolean newFeatured) {
        return new DocumentUpdate(title, body, category, tier, newFeatured, priority);
    }

    public DocumentUpdate withPriority(DocumentPriority newPriority) {
        return new DocumentUpdate(title, body, category, tier, featured, newPriority);
    }

    public boolean isEmpty() {
        return title == null && body == null && category == null
            && tier == null && featured == null && priority == null;
    }
}
