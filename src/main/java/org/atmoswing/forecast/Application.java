package org.atmoswing.forecast;

import org.atmoswing.forecast.application.warmup.WarmupApplication;
import io.quarkus.runtime.Quarkus;
import io.quarkus.runtime.annotations.QuarkusMain;

import java.util.Arrays;

/**
 * Entry point. {@code warmup ...} runs a single warm cache sweep instead of the HTTP service.
 */
@QuarkusMain
public class Application {

    static final String WARMUP_COMMAND = "warmup";

    public static void main(String[] args) {
        if (args.length > 0 && WARMUP_COMMAND.equals(args[0])) {
            if (System.getProperty("quarkus.profile") == null) {
                System.setProperty("quarkus.profile", WARMUP_COMMAND);
            }
            Quarkus.run(WarmupApplication.class, Arrays.copyOfRange(args, 1, args.length));
            return;
        }
        Quarkus.run(args);
    }
}
