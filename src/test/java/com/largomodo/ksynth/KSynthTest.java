package com.largomodo.ksynth;

import com.largomodo.ksynth.core.ByteWriter;
import com.largomodo.ksynth.core.ChecksumPolicy;
import com.largomodo.ksynth.core.SysexFrame;
import com.largomodo.ksynth.format.Dialect;
import com.largomodo.ksynth.k4.SinglePatch;
import com.largomodo.ksynth.k5000.MultiPatch;
import com.largomodo.ksynth.k5000.sysex.Header;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the ksynth command line: argument parsing, exit codes and output.
 */
class KSynthTest {

    @TempDir
    Path tempDir;

    private CommandLine cmd;
    private KSynth ksynth;
    private StringWriter out;

    @BeforeEach
    void setUp() {
        ksynth = new KSynth();
        cmd = new CommandLine(ksynth).setCaseInsensitiveEnumValuesAllowed(true);
        out = new StringWriter();
        cmd.setOut(new PrintWriter(out));
        cmd.setErr(new PrintWriter(new StringWriter()));
    }

    private static byte[] k4Single(SinglePatch patch) {
        ByteWriter body = new ByteWriter();
        body.writeBytes(new byte[]{0x00, 0x20, 0x00, 0x04, 0x00, 0x00});
        body.write(SinglePatch.CODEC, patch);
        return SysexFrame.wrap(body.toByteArray());
    }

    private static byte[] k5000Multi() {
        ByteWriter body = new ByteWriter();
        Header.oneMulti(1, 7).write(body);
        body.write(MultiPatch.CODEC, MultiPatch.defaults());
        return SysexFrame.wrap(body.toByteArray());
    }

    private Path file(String name, byte[] content) throws IOException {
        return Files.write(tempDir.resolve(name), content);
    }

    @Test
    void testDefaults() throws IOException {
        Path single = file("single.syx", k4Single(SinglePatch.defaults()));

        cmd.parseArgs(single.toString());

        assertEquals(1, ksynth.files.size());
        assertEquals(ChecksumPolicy.WARN, ksynth.checksumPolicy);
        assertNull(ksynth.dialect, "dialect is detected per file when not forced");
    }

    @Test
    void testEnumOptionsAreCaseInsensitive() throws IOException {
        Path single = file("single.syx", k4Single(SinglePatch.defaults()));

        cmd.parseArgs("--checksum-policy", "strict", "--dialect", "k5000", single.toString());

        assertEquals(ChecksumPolicy.STRICT, ksynth.checksumPolicy);
        assertEquals(Dialect.K5000, ksynth.dialect);
    }

    @Test
    void testHelpEndsWithExitCodes() {
        assertEquals(0, cmd.execute("--help"));

        String help = out.toString();
        assertTrue(help.contains("Exit Codes:"), help);
        assertFalse(help.contains("See Also"), help);
        assertFalse(help.contains("http"), help);
    }

    @Test
    void testVersionComesFromBundle() {
        assertEquals(0, cmd.execute("--version"));

        assertEquals("ksynth 1.0.0", out.toString().trim());
    }

    @Test
    void testDecodesK4Single() throws IOException {
        Path single = file("single.syx", k4Single(SinglePatch.defaults().withName("Brass")));

        int exitCode = cmd.execute(single.toString());

        assertEquals(0, exitCode);
        String text = out.toString();
        assertTrue(text.contains("single.syx:"), text);
        assertTrue(text.contains("K4 INT ONE_SINGLE #0, channel 1"), text);
        assertTrue(text.contains("A-1  Brass"), text);
        assertTrue(text.contains("checksums OK"), text);
    }

    @Test
    void testDecodesK5000Multi() throws IOException {
        Path multi = file("multi.syx", k5000Multi());

        int exitCode = cmd.execute(multi.toString());

        assertEquals(0, exitCode);
        assertTrue(out.toString().contains("M08  NewMulti volume=127"), out.toString());
    }

    @Test
    void testMissingEndMarkerIsAccepted() throws IOException {
        byte[] message = k4Single(SinglePatch.defaults());
        Path single = file("noend.syx", Arrays.copyOf(message, message.length - 1));

        assertEquals(0, cmd.execute(single.toString()));
    }

    @Test
    void testMissingFileIsUsageError() {
        int exitCode = cmd.execute(tempDir.resolve("absent.syx").toString());

        assertEquals(2, exitCode);
    }

    @Test
    void testNoFilesIsUsageError() {
        assertEquals(2, cmd.execute());
    }

    @Test
    void testInvalidPolicyIsUsageError() throws IOException {
        Path single = file("single.syx", k4Single(SinglePatch.defaults()));

        assertEquals(2, cmd.execute("--checksum-policy", "lenient", single.toString()));
    }

    @Test
    void testNonKawaiMessageFails() throws IOException {
        Path roland = file("roland.syx", new byte[]{(byte) 0xF0, 0x41, 0x10, 0x42, (byte) 0xF7});

        assertEquals(1, cmd.execute(roland.toString()));
    }

    @Test
    void testOtherKawaiMachineNeedsDialect() throws IOException {
        Path k1 = file("k1.syx", new byte[]{(byte) 0xF0, 0x40, 0x00, 0x20, 0x00, 0x03, 0x00, 0x00, (byte) 0xF7});

        assertEquals(1, cmd.execute(k1.toString()));
    }

    @Test
    void testOutOfRangePatchNumberFailsWithoutAborting() throws IOException {
        Path bad = file("bad-number.syx",
                new byte[]{(byte) 0xF0, 0x40, 0x00, 0x20, 0x00, 0x0A, 0x00, 0x00, (byte) 0xFF, (byte) 0xF7});
        Path single = file("single.syx", k4Single(SinglePatch.defaults()));

        assertEquals(1, cmd.execute(bad.toString(), single.toString()));
        assertTrue(out.toString().contains("single.syx:"), out.toString());
    }

    @Test
    void testForcedDialectOverridesDetection() throws IOException {
        Path multi = file("multi.syx", k5000Multi());

        assertEquals(1, cmd.execute("--dialect", "K4", multi.toString()));
    }

    @Test
    void testOneFailureDoesNotStopOtherFiles() throws IOException {
        Path broken = file("a-broken.syx", new byte[]{(byte) 0xF0, 0x40, 0x00, 0x20, 0x00, 0x04, 0x00, 0x00, 0x01});
        Path single = file("b-single.syx", k4Single(SinglePatch.defaults()));

        int exitCode = cmd.execute(broken.toString(), single.toString());

        assertEquals(1, exitCode);
        assertTrue(out.toString().contains("b-single.syx:"), out.toString());
        assertFalse(out.toString().contains("a-broken.syx:"), out.toString());
    }

    @Test
    void testChecksumPolicyDecidesExitCode() throws IOException {
        byte[] message = k4Single(SinglePatch.defaults());
        // checksum byte sits just before the end marker
        message[message.length - 2] ^= 0x01;
        Path corrupt = file("corrupt.syx", message);

        assertEquals(0, cmd.execute(corrupt.toString()));
        assertTrue(out.toString().contains("Checksum mismatch in K4 single at offset 130"), out.toString());

        assertEquals(1, new CommandLine(new KSynth()).setCaseInsensitiveEnumValuesAllowed(true)
                .execute("--checksum-policy", "strict", corrupt.toString()));
        assertEquals(0, new CommandLine(new KSynth()).execute("--checksum-policy", "IGNORE", corrupt.toString()));
    }
}
