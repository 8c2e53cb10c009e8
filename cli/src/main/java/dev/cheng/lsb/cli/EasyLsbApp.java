package dev.cheng.lsb.cli;

import dev.cheng.lsb.protocol.Constants;
import dev.cheng.lsb.protocol.LsbStego;
import dev.cheng.lsb.protocol.StegoException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * CLI entry point for hiding a message in a bitmap and reading it back.
 *
 * <pre>
 * EasyLSB &lt;-e or --encode&gt; &lt;message&gt; &lt;image filename&gt; &lt;output filename&gt;
 * EasyLSB &lt;-d or --decode&gt; &lt;image filename&gt;
 * EasyLSB &lt;-c or --capacity&gt; &lt;image filename&gt;
 * EasyLSB &lt;-h or --help&gt;
 * </pre>
 */
public final class EasyLsbApp {
    private static final Logger log = LoggerFactory.getLogger(EasyLsbApp.class);
    static final String GET_HELP = "Run EasyLSB <-h or --help> for information.";
    static final String USAGE = String.join(System.lineSeparator(),
            "Usage:",
            "EasyLSB <-e or --encode> <message> <image filename> <output filename>",
            "EasyLSB <-d or --decode> <image filename>",
            "EasyLSB <-c or --capacity> <image filename>",
            "EasyLSB <-h or --help>");

    private EasyLsbApp() {
    }

    public static void main(String[] args) {
        System.exit(run(args, new LsbStego(), System.out, System.err));
    }

    static int run(String[] args, LsbStego stego, PrintStream out, PrintStream err) {
        if (args.length != 4 && args.length != 2 && args.length != 1) {
            err.println("Incorrect number of arguments!");
            err.println(GET_HELP);
            return 1;
        }

        Mode mode = Mode.fromFlag(args[0]);
        if (mode == null) {
            err.println("Incorrect mode!");
            err.println(GET_HELP);
            return 1;
        }
        if (args.length != mode.argCount) {
            err.println("Incorrect number of arguments for " + mode.description + "!");
            err.println(GET_HELP);
            return 1;
        }

        if (mode == Mode.HELP) {
            out.println(USAGE);
            return 0;
        }

        Path input = Paths.get(mode == Mode.ENCODE ? args[2] : args[1]);
        if (!Files.isRegularFile(input)) {
            err.println("Input image does not exist: " + input);
            return 1;
        }

        try {
            switch (mode) {
                case ENCODE:
                    Path output = Paths.get(args[3]);
                    byte[] message = args[1].getBytes(Constants.MESSAGE_CHARSET);
                    stego.encode(message, input, output);
                    out.printf("Encoded %d bytes from %s into %s%n", message.length, input, output);
                    break;
                case DECODE:
                    out.println(stego.decodeText(input));
                    break;
                case CAPACITY:
                    out.printf("%s can hold up to %d bytes%n", input, stego.capacity(input));
                    break;
                default:
                    throw new IllegalStateException("Unhandled mode: " + mode);
            }
        } catch (IOException | StegoException e) {
            log.debug("{} of {} failed", mode, input, e);
            err.println(mode.failure + " failed: " + e.getMessage());
            return 1;
        }
        return 0;
    }

    enum Mode {
        ENCODE("-e", "--encode", 4, "encoding", "Encoding"),
        DECODE("-d", "--decode", 2, "decoding", "Decoding"),
        CAPACITY("-c", "--capacity", 2, "capacity", "Capacity check"),
        HELP("-h", "--help", 1, "help", "Help");

        private final String shortFlag;
        private final String longFlag;
        private final int argCount;
        private final String description;
        private final String failure;

        Mode(String shortFlag, String longFlag, int argCount, String description, String failure) {
            this.shortFlag = shortFlag;
            this.longFlag = longFlag;
            this.argCount = argCount;
            this.description = description;
            this.failure = failure;
        }

        static Mode fromFlag(String flag) {
            for (Mode mode : values()) {
                if (mode.shortFlag.equals(flag) || mode.longFlag.equals(flag)) {
                    return mode;
                }
            }
            return null;
        }
    }
}
