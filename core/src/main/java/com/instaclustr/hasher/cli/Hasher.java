package com.instaclustr.hasher.cli;

import java.io.PrintWriter;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.inject.Guice;
import com.google.inject.Inject;
import com.google.inject.Injector;
import com.google.inject.Module;
import com.google.inject.Stage;
import com.instaclustr.hasher.impl.DigestComparison;
import com.instaclustr.hasher.impl.DigestComparison.Outcome;
import com.instaclustr.hasher.impl.FileEvent;
import com.instaclustr.hasher.impl.FileState;
import com.instaclustr.hasher.impl.HashingProgress;
import com.instaclustr.hasher.impl.hash.HashSpec;
import com.instaclustr.hasher.impl.hash.HashingModule;
import com.instaclustr.hasher.impl.scheduler.EventStream;
import com.instaclustr.hasher.impl.scheduler.HashingScheduler;
import com.instaclustr.hasher.jackson.JacksonModule;
import com.instaclustr.hasher.threading.ExecutorsModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.IVersionProvider;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParameterException;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import static java.lang.String.format;

@Command(name = "hasher",
    description = "Computes SHA-256 digests of files, hashing several files concurrently and reporting progress of each.",
    sortOptions = false,
    usageHelpWidth = 128,
    versionProvider = Hasher.class,
    mixinStandardHelpOptions = true
)
public class Hasher extends CLIApplication implements Runnable, IVersionProvider {

    private static final Logger logger = LoggerFactory.getLogger(Hasher.class);

    @Spec
    private CommandSpec spec;

    @Mixin
    private HashSpec hashSpec;

    @Parameters(arity = "1..*", paramLabel = "FILE", description = "Files to hash.")
    private List<Path> files = new ArrayList<>();

    @Option(names = {"--json"}, description = "Print every event as a line of JSON.")
    private boolean json;

    @Option(names = {"--no-progress"}, description = "Print only digests, no progress.")
    private boolean noProgress;

    @Inject
    private HashingScheduler scheduler;

    @Inject
    private ObjectMapper objectMapper;

    public static void main(String[] args) {
        System.exit(execute(new Hasher(), args));
    }

    static void init(final Runnable command, final HashSpec hashSpec) {
        final List<Module> modules = new ArrayList<>();

        modules.add(new JacksonModule());
        modules.add(new ExecutorsModule());
        modules.add(new HashingModule(hashSpec));

        final Injector injector = Guice.createInjector(
            Stage.PRODUCTION, // production binds singletons as eager by default
            modules
        );

        injector.injectMembers(command);
    }

    @Override
    public String title() {
        return HashingProgress.TITLE;
    }

    @Override
    public String[] getVersion() {
        final String version = Hasher.class.getPackage().getImplementationVersion();
        return new String[]{title() + " " + (version == null ? "development" : version)};
    }

    @Override
    public void run() {
        try {
            hashSpec.validate();
        } catch (final IllegalArgumentException ex) {
            throw new ParameterException(spec.commandLine(), ex.getMessage(), ex);
        }

        init(this, hashSpec);

        final PrintWriter out = spec.commandLine().getOut();
        final Thread closeOnExit = new Thread(() -> scheduler.events().close(), "hasher-shutdown");

        scheduler.startAsync().awaitRunning();
        Runtime.getRuntime().addShutdownHook(closeOnExit);

        try {
            final Map<Path, FileState> states = new LinkedHashMap<>();
            final List<Path> notHashed = new ArrayList<>();

            for (final Path file : files) {
                final Path identity = file.toAbsolutePath().normalize();

                if (states.containsKey(identity)) {
                    continue;
                }

                if (scheduler.begin(identity)) {
                    states.put(identity, FileState.pending());
                } else {
                    spec.commandLine().getErr().println(format("%s is not a regular file, skipping.", file));
                    notHashed.add(file);
                }
            }

            consume(scheduler.events(), states, out);

            report(states, out);

            states.forEach((path, state) -> {
                if (!(state instanceof FileState.Completed)) {
                    notHashed.add(path);
                }
            });

            if (!notHashed.isEmpty()) {
                throw new IllegalStateException(format("%s of %s files were not hashed: %s", notHashed.size(), files.size(), notHashed));
            }
        } finally {
            scheduler.stopAsync().awaitTerminated();
            removeShutdownHook(closeOnExit);
        }
    }

    private void consume(final EventStream events, final Map<Path, FileState> states, final PrintWriter out) {
        final Set<Path> stopped = new HashSet<>();

        while (states.entrySet().stream().anyMatch(entry -> !entry.getValue().isTerminal() && !stopped.contains(entry.getKey()))) {
            // a pipeline which exited has sent all its events already, they are delivered before the stream runs dry
            final Set<Path> exited = states.keySet()
                .stream()
                .filter(path -> !scheduler.isHashing(path))
                .collect(Collectors.toSet());

            final FileEvent event;

            try {
                event = events.poll(200, TimeUnit.MILLISECONDS);
            } catch (final InterruptedException ex) {
                Thread.currentThread().interrupt();
                throw new IllegalStateException("Interrupted while waiting for hashing to finish", ex);
            }

            if (event == null) {
                if (events.isClosed()) {
                    logger.info("Event stream was closed, not waiting for remaining files.");
                    return;
                }

                for (final Path path : exited) {
                    if (!states.get(path).isTerminal() && stopped.add(path)) {
                        spec.commandLine().getErr().println(format("Hashing of %s stopped without a digest.", path));
                    }
                }
                continue;
            }

            states.put(event.getIdentity(), event.getState());
            print(event, states, out);
        }
    }

    private void print(final FileEvent event, final Map<Path, FileState> states, final PrintWriter out) {
        if (json) {
            try {
                out.println(objectMapper.writeValueAsString(event));
            } catch (final JsonProcessingException ex) {
                throw new UncheckedIOException(ex);
            }
        } else if (event.getState() instanceof FileState.InProgress && !noProgress) {
            out.println(format(Locale.ROOT,
                               "[%6.2f%%] %s (%s)",
                               ((FileState.InProgress) event.getState()).getPercent(),
                               event.getIdentity(),
                               HashingProgress.title(states)));
        } else if (event.getState() instanceof FileState.Failed) {
            final FileState.Failed failed = (FileState.Failed) event.getState();
            spec.commandLine().getErr().println(format("%s failed (%s): %s", event.getIdentity(), failed.getKind(), failed.getMessage()));
        }
        out.flush();
    }

    private void report(final Map<Path, FileState> states, final PrintWriter out) {
        if (json) {
            return;
        }

        states.forEach((path, state) -> {
            if (state instanceof FileState.Completed) {
                out.println(format("%s  %s", ((FileState.Completed) state).getDigest(), path));
            }
        });

        if (states.size() > 1) {
            final Path reference = states.keySet().iterator().next();
            final Map<Path, Outcome> outcomes = DigestComparison.against(reference, states);

            out.println(format("Compared with %s:", reference));
            outcomes.forEach((path, outcome) -> {
                if (!path.equals(reference)) {
                    out.println(format("%s  %s", outcome, path));
                }
            });
        }

        out.flush();
    }

    private static void removeShutdownHook(final Thread hook) {
        try {
            Runtime.getRuntime().removeShutdownHook(hook);
        } catch (final IllegalStateException ex) {
            logger.debug("JVM is already shutting down, shutdown hook stays registered.", ex);
        }
    }
}
