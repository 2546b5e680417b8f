package com.largomodo.ksynth.inspect;

import com.largomodo.ksynth.core.ChecksumMismatch;

import java.io.PrintWriter;
import java.util.List;
import java.util.Objects;

/**
 * Printable outcome of inspecting one message.
 *
 * @param title      what the message is, e.g. "K4 INT ONE_SINGLE #3, channel 1"
 * @param entries    one line per decoded patch
 * @param mismatches checksum mismatches the policy let through
 */
public record Inspection(String title, List<String> entries, List<ChecksumMismatch> mismatches) {

    public Inspection {
        Objects.requireNonNull(title, "title must not be null");
        entries = List.copyOf(entries);
        mismatches = List.copyOf(mismatches);
    }

    public void print(PrintWriter out) {
        out.println(title);
        entries.forEach(entry -> out.println("  " + entry));
        if (mismatches.isEmpty()) {
            out.println("  checksums OK");
        } else {
            mismatches.forEach(mismatch -> out.println("  " + mismatch));
        }
        out.flush();
    }
}
