package com.largomodo.ksynth.core;

import java.util.Optional;

/**
 * One row of a header classification table.
 *
 * @param <D> the classification a matching header yields
 */
@FunctionalInterface
public interface DispatchRule<D> {

    /**
     * @param header message bytes starting at the channel byte
     * @return the classification, or empty if this rule does not match
     */
    Optional<D> match(byte[] header);
}
