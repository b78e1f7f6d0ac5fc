package com.instaharvest.scraper;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Locale;
import java.util.Set;

/**
 * Command-line entry point: signs in and prints a profile's followers and/or following as JSON.
 * <p>
 * Usage: {@code Main <profile> [followers|following|both]}. Credentials come from
 * {@code HARVEST_USERNAME} and {@code HARVEST_PASSWORD} (environment or system property);
 * {@code HARVEST_MAX_DURATION_SECONDS} bounds each extraction.
 */
public class Main {
    private static final Logger logger = LoggerFactory.getLogger(Main.class);

    private static final String USAGE = "Usage: Main <profile> [followers|following|both]";
    private static final Set<String> LIST_SELECTIONS = Set.of("followers", "following", "both");

    /**
     * Main application entry point.
     * @param args target profile and optional list selection
     */
    public static void main(String[] args) {
        int status = execute(args);
        if (status != 0) {
            System.exit(status);
        }
    }

    /**
     * Runs the CLI without exiting the JVM.
     * @return process exit status: 0 on success, 1 on failure, 2 on bad usage or missing credentials
     */
    static int execute(String[] args) {
        String profile = args != null && args.length > 0 ? args[0].trim() : DriverUtils.envOrProp("HARVEST_TARGET_PROFILE", "");
        String mode;
        try {
            mode = listSelection(args);
        } catch (IllegalArgumentException e) {
            System.err.println(e.getMessage());
            System.err.println(USAGE);
            return 2;
        }
        if (profile.isBlank()) {
            System.err.println(USAGE);
            return 2;
        }
        String username = DriverUtils.envOrProp("HARVEST_USERNAME", null);
        String password = DriverUtils.envOrProp("HARVEST_PASSWORD", null);
        if (username == null || password == null) {
            System.err.println("HARVEST_USERNAME and HARVEST_PASSWORD must be set.");
            return 2;
        }
        int maxSeconds = DriverUtils.intSetting("HARVEST_MAX_DURATION_SECONDS", 0);
        Duration maxDuration = maxSeconds > 0 ? Duration.ofSeconds(maxSeconds) : null;

        try (HarvestSession session = HarvestSession.open(new Credentials(username, password), SessionOptions.fromEnvironment())) {
            ObjectNode output = run(session, profile, mode, maxDuration);
            ObjectMapper mapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);
            System.out.println(mapper.writeValueAsString(output));
            return 0;
        } catch (LoginException e) {
            logger.error("Login failed ({}): {}", e.failure(), e.getMessage());
        } catch (ConfigurationException e) {
            logger.error("Invalid configuration: {}", e.getMessage());
        } catch (Exception e) {
            logger.error("Fatal error: {}", e.getMessage(), e);
        }
        return 1;
    }

    /**
     * Reads the optional list selection argument, defaulting to {@code both}.
     * @throws IllegalArgumentException if it is not followers, following or both
     */
    static String listSelection(String[] args) {
        if (args == null || args.length < 2 || args[1].isBlank()) {
            return "both";
        }
        String mode = args[1].trim().toLowerCase(Locale.ROOT);
        if (!LIST_SELECTIONS.contains(mode)) {
            throw new IllegalArgumentException("Unknown list selection '" + args[1].trim() + "'; expected followers, following or both");
        }
        return mode;
    }

    static ObjectNode run(HarvestSession session, String profile, String mode, Duration maxDuration) {
        if (!LIST_SELECTIONS.contains(mode)) {
            throw new IllegalArgumentException("Unknown list selection '" + mode + "'; expected followers, following or both");
        }
        ObjectMapper mapper = new ObjectMapper();
        ObjectNode output = mapper.createObjectNode();
        output.put("profile", profile);
        if (mode.equals("followers") || mode.equals("both")) {
            output.set("followers", toJson(mapper, session.extract(new ExtractionRequest(profile, ListKind.FOLLOWERS, maxDuration, null))));
        }
        if (mode.equals("following") || mode.equals("both")) {
            output.set("following", toJson(mapper, session.extract(new ExtractionRequest(profile, ListKind.FOLLOWING, maxDuration, null))));
        }
        return output;
    }

    private static ObjectNode toJson(ObjectMapper mapper, ExtractionResult result) {
        ObjectNode node = mapper.createObjectNode();
        if (result.expectedCount() != null) {
            node.put("expected", result.expectedCount());
        } else {
            node.putNull("expected");
        }
        node.put("collected", result.handles().size());
        node.put("stopReason", result.stopReason().name());
        node.put("elapsedMs", result.elapsed().toMillis());
        ArrayNode handles = node.putArray("handles");
        result.handles().forEach(handles::add);
        return node;
    }
}
