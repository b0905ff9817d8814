package com.phillippitts.interviewcopilot.client;

import com.phillippitts.interviewcopilot.client.session.LiveSessionCoordinator;
import com.phillippitts.interviewcopilot.client.session.SessionConfig;
import com.phillippitts.interviewcopilot.client.session.SessionStateMachine;
import com.phillippitts.interviewcopilot.config.properties.ClientProperties;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.boot.CommandLineRunner;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.Locale;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Headless console front end for a live session.
 *
 * <p>Starts the session on application startup, then reads commands from standard input until
 * {@code quit} or end of input:
 * <pre>
 *   ask &lt;question&gt;   request an answer for explicit question text
 *   finalize         force a question boundary now
 *   clear            clear transcript, context and answers on the server
 *   reload           re-read the profile file and resend it as context
 *   pause | resume   suspend or continue microphone streaming
 *   status           print the current session state
 *   quit             stop the session
 * </pre>
 */
public class ClientRunner implements CommandLineRunner {

    private static final Logger LOG = LogManager.getLogger(ClientRunner.class);

    private static final long STOP_TIMEOUT_SECONDS = 5;

    private final LiveSessionCoordinator coordinator;
    private final ClientProperties props;
    private final InputStream input;

    public ClientRunner(LiveSessionCoordinator coordinator, ClientProperties props) {
        this(coordinator, props, System.in);
    }

    // Package-private for tests
    ClientRunner(LiveSessionCoordinator coordinator, ClientProperties props, InputStream input) {
        this.coordinator = coordinator;
        this.props = props;
        this.input = input;
    }

    @Override
    public void run(String... args) throws IOException {
        coordinator.onChange(ClientRunner::render);
        try {
            coordinator.start(SessionConfig.from(props)).join();
        } catch (CompletionException e) {
            // Logged by the coordinator; a missing microphone still allows manual questions
            LOG.warn("Session started with errors: {}", e.getCause() == null ? e : e.getCause().getMessage());
        }

        BufferedReader reader = new BufferedReader(new InputStreamReader(input, StandardCharsets.UTF_8));
        String line;
        while ((line = reader.readLine()) != null) {
            if (!execute(line.trim())) {
                break;
            }
        }
        stop();
    }

    /**
     * Runs one console command.
     *
     * @return false when the session should end
     */
    boolean execute(String line) {
        if (line.isEmpty()) {
            return true;
        }
        int space = line.indexOf(' ');
        String command = (space < 0 ? line : line.substring(0, space)).toLowerCase(Locale.ROOT);
        String argument = space < 0 ? "" : line.substring(space + 1).trim();
        switch (command) {
            case "ask":
                if (argument.isEmpty()) {
                    LOG.info("Usage: ask <question>");
                } else {
                    coordinator.requestAnswer(argument);
                }
                return true;
            case "finalize":
                coordinator.finalizeNow();
                return true;
            case "clear":
                coordinator.clear();
                return true;
            case "reload":
                coordinator.refreshContext();
                return true;
            case "pause":
                coordinator.pause();
                return true;
            case "resume":
                coordinator.resume();
                return true;
            case "status":
                render(coordinator.snapshot());
                return true;
            case "quit":
            case "exit":
                return false;
            default:
                LOG.info("Unknown command '{}'", command);
                return true;
        }
    }

    private void stop() {
        try {
            coordinator.stop().get(STOP_TIMEOUT_SECONDS, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (TimeoutException | ExecutionException e) {
            LOG.warn("Session did not stop cleanly: {}", e.toString());
        }
    }

    private static void render(SessionStateMachine.Snapshot s) {
        LOG.info("[{}/{}] {}{}{}", s.connection(), s.processing(),
                s.accumulatedText().isEmpty() ? "" : "\"" + s.accumulatedText() + "\"",
                s.partialAnswer().isEmpty() ? "" : " answering (" + s.partialAnswer().length() + " chars)",
                s.lastError().map(e -> " (last error " + e.code() + ": " + e.message() + ")").orElse(""));
    }
}
