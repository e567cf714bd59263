package com.stone.orchestrator.classify;

import java.util.Optional;

/**
 * Maps free text onto a closed set of categories.
 *
 * The workflow only depends on this interface, so a keyword heuristic can be
 * replaced by a stronger strategy without touching the callers. Every
 * implementation must be total: text it cannot place yields an empty
 * {@link #match} and {@link #fallback()} from {@link #classify}, never null
 * or an exception.
 *
 * @param <T> category type, usually an enum
 */
public interface TextClassifier<T> {

    /** The category the text positively matches, empty when it matches none. */
    Optional<T> match(String text);

    default T classify(String text) {
        return match(text).orElse(fallback());
    }

    /** Category returned for text that matches nothing. */
    T fallback();
}
