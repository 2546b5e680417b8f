package com.largomodo.ksynth;

import com.largomodo.ksynth.core.ChecksumMismatch;
import com.largomodo.ksynth.core.ChecksumPolicy;
import com.largomodo.ksynth.core.DecodeObserver;
import com.largomodo.ksynth.core.SysexDecoder;
import com.largomodo.ksynth.core.SysexFrame;
import com.largomodo.ksynth.core.SysexParseException;
import com.largomodo.ksynth.format.Dialect;
import com.largomodo.ksynth.inspect.InspectorFactory;
import com.largomodo.ksynth.inspect.Inspection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import picocli.CommandLine;
import picocli.CommandLine.*;
import picocli.CommandLine.Model.CommandSpec;

import java.io.File;
import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Files;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * CLI entry point for inspecting Kawai System Exclusive dumps.
 * <p>
 * Each file holds one exclusive message. The frame is stripped, the
 * instrument family is detected from the group and machine ID bytes unless
 * {@code --dialect} forces one, and the decoded patches are summarised on
 * standard output. A file that fails to decode does not stop the others.
 */
@Command(
        name = "ksynth",
        mixinStandardHelpOptions = true,
        resourceBundle = "ksynth.ksynth",
        version = "${bundle:application.version}",
        header = "Inspects Kawai K4 and K5000 System Exclusive dumps.",
        description = {
                "Decodes single, multi, drum, effect, block and bank dumps of the Kawai K4/K4r and the" +
                        " single and multi dumps of the Kawai K5000 series, and prints the patch names" +
                        " together with any checksum mismatches."
        },
        exitCodeListHeading = "%nExit Codes:%n",
        exitCodeList = {
                "0:Every file decoded",
                "1:At least one file could not be read or decoded",
                "2:Invalid command line arguments"
        }
)
public class KSynth implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(KSynth.class);

    @Parameters(arity = "1..*", paramLabel = "FILE",
            description = "One or more .syx files, each holding a single exclusive message.")
    List<File> files;

    @Option(names = "--checksum-policy", defaultValue = "WARN",
            description = {
                    "What to do with a block whose checksum does not match.",
                    "Valid values: ${COMPLETION-CANDIDATES}",
                    "Default: ${DEFAULT-VALUE}"
            })
    ChecksumPolicy checksumPolicy;

    @Option(names = "--dialect",
            description = {
                    "Instrument family of the input. Detected from the message when omitted.",
                    "Valid values: ${COMPLETION-CANDIDATES}"
            })
    Dialect dialect;

    @Spec
    CommandSpec spec;

    @Option(names = {"-v", "--verbose"}, description = "Enable verbose output")
    private boolean verbose;

    private final InspectorFactory inspectors = new InspectorFactory();

    public static void main(String[] args) {
        CommandLine cmd = new CommandLine(new KSynth());
        cmd.setCaseInsensitiveEnumValuesAllowed(true);
        int exitCode = cmd.execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() {
        if (verbose) {
            ch.qos.logback.classic.Logger root =
                    (ch.qos.logback.classic.Logger) LoggerFactory.getLogger(Logger.ROOT_LOGGER_NAME);
            root.setLevel(ch.qos.logback.classic.Level.DEBUG);
        }

        for (File file : files) {
            if (!file.isFile()) {
                throw new ParameterException(spec.commandLine(),
                        "Input file does not exist or is not a regular file: " + file.getAbsolutePath());
            }
        }

        final AtomicInteger mismatchCount = new AtomicInteger(0);
        DecodeObserver observer = new DecodeObserver() {
            @Override
            public void onBlockDecoded(String block, int offset) {
                log.trace("Decoded {} at offset {}", block, offset);
            }

            @Override
            public void onChecksumMismatch(ChecksumMismatch mismatch) {
                mismatchCount.incrementAndGet();
            }
        };
        SysexDecoder decoder = new SysexDecoder(checksumPolicy, observer);
        PrintWriter out = spec.commandLine().getOut();

        int failures = 0;
        for (File file : files) {
            try {
                MDC.put("syx", file.getName());
                Inspection inspection = inspect(file, decoder);
                out.println(file.getName() + ":");
                inspection.print(out);
            } catch (IOException e) {
                failures++;
                log.error("FAILED: cannot read {} - {}", file, e.getMessage());
            } catch (SysexParseException e) {
                failures++;
                log.error("FAILED: {} [{}] - {}", file.getName(), e.kind(), e.getMessage());
            } finally {
                MDC.clear();
            }
        }

        log.info("Inspected {} file(s): {} failed, {} checksum mismatch(es)", files.size(), failures,
                mismatchCount.get());
        return failures == 0 ? 0 : 1;
    }

    private Inspection inspect(File file, SysexDecoder decoder) throws IOException {
        byte[] message = SysexFrame.unwrap(Files.readAllBytes(file.toPath()));
        Dialect resolved = dialect != null ? dialect : Dialect.detect(message).orElseThrow(() ->
                SysexParseException.unidentified("neither a K4 nor a K5000 message; use --dialect to force one"));
        log.debug("Inspecting {} as {}", file.getName(), resolved);
        return inspectors.get(resolved).inspect(message, decoder);
    }
}
