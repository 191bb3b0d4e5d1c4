package com.example.syncreconciler;

import java.util.List;

/**
 * Immutable runtime settings for reconciliation and config persistence.
 */
public record ReconcilerSettings(
        String storeDirectory,
        String storeName,
        int maxSlots,
        String debrisFolderName,
        boolean followLinks,
        boolean hashContent,
        List<String> defaultExclusions
) {
}
