package com.largomodo.ksynth.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Per-call decode state shared by a reader and all its slices.
 * <p>
 * Holds the checksum policy, the observer, and the mismatches reported so far.
 * A context belongs to one decode call and is not shared between threads.
 */
public class DecodeContext {

    private static final Logger log = LoggerFactory.getLogger(DecodeContext.class);

    private final ChecksumPolicy policy;
    private final DecodeObserver observer;
    private final List<ChecksumMismatch> mismatches = new ArrayList<>();

    public DecodeContext(ChecksumPolicy policy, DecodeObserver observer) {
        this.policy = Objects.requireNonNull(policy, "policy must not be null");
        this.observer = Objects.requireNonNull(observer, "observer must not be null");
    }

    public static DecodeContext defaults() {
        return new DecodeContext(ChecksumPolicy.WARN, DecodeObserver.NONE);
    }

    public ChecksumPolicy policy() {
        return policy;
    }

    /**
     * Compares a computed checksum against the stored one and applies the policy.
     *
     * @throws SysexParseException with kind CHECKSUM_MISMATCH under {@link ChecksumPolicy#STRICT}
     */
    public void verifyChecksum(String block, int offset, int expected, int actual) {
        if (expected == actual) {
            return;
        }
        ChecksumMismatch mismatch = new ChecksumMismatch(block, offset, expected, actual);
        observer.onChecksumMismatch(mismatch);
        switch (policy) {
            case STRICT -> throw SysexParseException.checksumMismatch(mismatch);
            case WARN -> {
                log.warn("{}", mismatch);
                mismatches.add(mismatch);
            }
            case IGNORE -> mismatches.add(mismatch);
        }
    }

    public void blockDecoded(String block, int offset) {
        log.debug("Decoded {} at offset {}", block, offset);
        observer.onBlockDecoded(block, offset);
    }

    public List<ChecksumMismatch> mismatches() {
        return Collections.unmodifiableList(mismatches);
    }
}
