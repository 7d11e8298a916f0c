package com.example.doisync.source;

import com.example.doisync.model.Facet;

/**
 * Turns some external representation into desired rows per DOI, preserving submission order.
 *
 * @param <S> the raw input type
 */
public interface DesiredStateSource<S> {

    /**
     * @throws InvalidDesiredStateException when the input as a whole is unusable
     */
    ParsedDesiredState parse(Facet facet, S source);
}
