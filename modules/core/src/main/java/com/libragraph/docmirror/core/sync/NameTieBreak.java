package com.libragraph.docmirror.core.sync;

import com.libragraph.docmirror.core.document.DocumentRecord;

import java.util.List;
import java.util.Set;

/**
 * Picks the local document for a remote one matched only by display name, when several local
 * documents share that name. Candidates arrive in insertion order.
 */
public enum NameTieBreak {

    /** The first-inserted candidate, matched or not. */
    FIRST_INSERTED {
        @Override
        DocumentRecord choose(List<DocumentRecord> candidates, Set<Long> matched) {
            return candidates.get(0);
        }
    },

    /** The first-inserted candidate not matched yet, else the first-inserted. */
    FIRST_UNMATCHED {
        @Override
        DocumentRecord choose(List<DocumentRecord> candidates, Set<Long> matched) {
            for (DocumentRecord candidate : candidates) {
                if (!matched.contains(candidate.id())) return candidate;
            }
            return candidates.get(0);
        }
    };

    abstract DocumentRecord choose(List<DocumentRecord> candidates, Set<Long> matched);
}
