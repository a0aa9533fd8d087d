package com.vectorstore.dedup.cluster;

/**
 * What deleting every non-retained group member would save.
 *
 * @param documentsToDelete     sum over groups of (members - 1)
 * @param estimatedStorageSaved rough human-readable size estimate
 */
public record PotentialSavings(int documentsToDelete, String estimatedStorageSaved) {

    static final int AVERAGE_DOCUMENT_SIZE_KB = 2;

    public static PotentialSavings forDocuments(int documentsToDelete) {
        return new PotentialSavings(documentsToDelete, estimateStorage(documentsToDelete));
    }

    static String estimateStorage(int documentsToDelete) {
        long totalKb = (long) documentsToDelete * AVERAGE_DOCUMENT_SIZE_KB;
        if (totalKb < 1024) {
            return "~" + totalKb + " KB";
        }
        if (totalKb < 1024L * 1024) {
            return "~" + Math.round(totalKb / 1024.0) + " MB";
        }
        return "~" + Math.round(totalKb / (1024.0 * 1024.0)) + " GB";
    }
}
