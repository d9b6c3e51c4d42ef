package com.registration.cli;

import com.registration.exception.RegistrationException;
import com.registration.imageRegistration.ImageRegistration;
import com.registration.imageRegistration.LoggingRegistrationListener;
import com.registration.imageRegistration.ManualAdjustment;
import com.registration.imageRegistration.RegistrationResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.PrintStream;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Command line front end.
 * <pre>
 *   register &lt;source-path&gt; &lt;target-path&gt; &lt;output-path&gt;
 *   adjust   &lt;input-path&gt; &lt;output-path&gt; &lt;dx&gt; &lt;dy&gt;
 * </pre>
 * Exit code 0 on success, 1 on any failure with a one-line diagnostic on stderr.
 */
@Slf4j
@Component
public class RegistrationCommand {
    public static final String REGISTER = "register";
    public static final String ADJUST = "adjust";
    static final String USAGE = "Usage:\n"
            + "  register <source-path> <target-path> <output-path>\n"
            + "  adjust <input-path> <output-path> <dx> <dy>";

    private final ImageRegistration registration;
    private final ManualAdjustment adjustment;
    private final PrintStream out;
    private final PrintStream err;

    @Autowired
    public RegistrationCommand(ImageRegistration registration, ManualAdjustment adjustment) {
        this(registration, adjustment, System.out, System.err);
    }

    RegistrationCommand(ImageRegistration registration, ManualAdjustment adjustment, PrintStream out, PrintStream err) {
        this.registration = registration;
        this.adjustment = adjustment;
        this.out = out;
        this.err = err;
    }

    public static boolean isCommand(String[] args) {
        return args.length > 0 && (REGISTER.equals(args[0]) || ADJUST.equals(args[0]));
    }

    public int execute(String... args) {
        if (args.length == 0) {
            return usage("missing command");
        }
        try {
            switch (args[0]) {
                case REGISTER:
                    if (args.length != 4) return usage("register takes 3 arguments");
                    return register(Paths.get(args[1]), Paths.get(args[2]), Paths.get(args[3]));
                case ADJUST:
                    if (args.length != 5) return usage("adjust takes 4 arguments");
                    double dx, dy;
                    try {
                        dx = Double.parseDouble(args[3]);
                        dy = Double.parseDouble(args[4]);
                    } catch (NumberFormatException e) {
                        return usage("dx and dy must be numbers");
                    }
                    return adjust(Paths.get(args[1]), Paths.get(args[2]), dx, dy);
                default:
                    return usage("unknown command '" + args[0] + "'");
            }
        } catch (RegistrationException e) {
            log.debug("{} failed", args[0], e);
            err.println("Error: " + e.getMessage());
            return 1;
        } catch (RuntimeException e) {
            log.error("Unexpected failure", e);
            err.println("Error: " + e);
            return 1;
        }
    }

    private int register(Path source, Path target, Path output) throws RegistrationException {
        RegistrationResult result = registration.registerFiles(source, target, output,
                new LoggingRegistrationListener(source.getFileName().toString()));
        out.printf("Registered %s onto %s -> %s (%d matches, %d inliers)%n",
                source, target, output, result.getMatchCount(), result.getInliers().size());
        return 0;
    }

    private int adjust(Path input, Path output, double dx, double dy) throws RegistrationException {
        adjustment.apply(input, output, dx, dy);
        out.printf("Adjusted %s by (%s, %s) px -> %s%n", input, dx, dy, output);
        return 0;
    }

    private int usage(String problem) {
        err.println("Error: " + problem);
        err.println(USAGE);
        return 1;
    }
}
