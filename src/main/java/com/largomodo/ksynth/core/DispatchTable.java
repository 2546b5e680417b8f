package com.largomodo.ksynth.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HexFormat;
import java.util.List;
import java.util.Optional;

/**
 * Stateless header classifier built from mutually exclusive rules.
 * <p>
 * Every rule is evaluated on each call. A header matched by two rules means the
 * table itself is wrong, which is reported as {@link IllegalStateException};
 * a header matched by none yields {@link ParseError#UNIDENTIFIED}.
 *
 * @param <D> classification type
 */
public class DispatchTable<D> {

    private static final Logger log = LoggerFactory.getLogger(DispatchTable.class);

    private final String name;
    private final List<DispatchRule<D>> rules;

    public DispatchTable(String name, List<DispatchRule<D>> rules) {
        this.name = name;
        this.rules = List.copyOf(rules);
    }

    /**
     * @throws SysexParseException with kind UNIDENTIFIED if no rule matches
     */
    public D classify(byte[] header) {
        D found = null;
        for (DispatchRule<D> rule : rules) {
            Optional<D> match = rule.match(header);
            if (match.isPresent()) {
                if (found != null) {
                    throw new IllegalStateException(name + " rules overlap: " + found + " and " + match.get());
                }
                found = match.get();
            }
        }
        if (found == null) {
            throw SysexParseException.unidentified(name + " header " + preview(header));
        }
        log.debug("{} header classified as {}", name, found);
        return found;
    }

    public int size() {
        return rules.size();
    }

    private static String preview(byte[] header) {
        int length = Math.min(header.length, 8);
        return HexFormat.ofDelimiter(" ").withUpperCase().formatHex(header, 0, length);
    }
}
