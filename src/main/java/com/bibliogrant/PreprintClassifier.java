package com.bibliogrant;

import java.util.Set;

/**
 * Decides whether an entry is an unpublished preprint.
 *
 * <p>An entry is a preprint when its type is article, unpublished or misc and it names no
 * journal ({@code journal} or {@code journaltitle}). A DOI does not make an entry published:
 * arXiv assigns DOIs to preprints too.
 */
public final class PreprintClassifier {

    private PreprintClassifier() {
    }

    private static final Set<String> PREPRINT_TYPES = Set.of("article", "unpublished", "misc");

    public static boolean isPreprint(BibRecord record) {
        if (!PREPRINT_TYPES.contains(record.type())) {
            return false;
        }
        return FieldNormalizer.firstText(record, "journal", "journaltitle").isEmpty();
    }
}
