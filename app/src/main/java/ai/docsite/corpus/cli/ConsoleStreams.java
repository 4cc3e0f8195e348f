package ai.docsite.corpus.cli;

import java.io.OutputStreamWriter;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.atomic.AtomicReference;

/**
 * UTF-8 writers over the process's standard output and error, created once on first use.
 * Report text is written in UTF-8 whatever the platform default encoding is.
 */
public final class ConsoleStreams {

    private static final AtomicReference<ConsoleStreams> INSTANCE = new AtomicReference<>();

    private final PrintWriter out;
    private final PrintWriter err;

    private ConsoleStreams(PrintWriter out, PrintWriter err) {
        this.out = out;
        this.err = err;
    }

    /**
     * Idempotent: every call returns the same pair of writers.
     */
    public static ConsoleStreams utf8() {
        ConsoleStreams existing = INSTANCE.get();
        if (existing != null) {
            return existing;
        }
        ConsoleStreams created = new ConsoleStreams(
                new PrintWriter(new OutputStreamWriter(System.out, StandardCharsets.UTF_8), true),
                new PrintWriter(new OutputStreamWriter(System.err, StandardCharsets.UTF_8), true));
        return INSTANCE.compareAndSet(null, created) ? created : INSTANCE.get();
    }

    public PrintWriter out() {
        return out;
    }

    public PrintWriter err() {
        return err;
    }
}
