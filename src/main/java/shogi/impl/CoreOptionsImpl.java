package shogi.impl;

import static shogi.constants.CoreConstants.*;

import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.io.UncheckedIOException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Properties;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import shogi.contracts.CoreOptions;

/**
 * Option registry of the core. Each option has a USI type ({@code check} or {@code spin}), a
 * default, optional bounds and a setter; values arrive as strings.
 *
 * <p>Not thread-safe. Readers pick the current value up on every call.
 */
public class CoreOptionsImpl implements CoreOptions {
    private static final Logger LOG = LoggerFactory.getLogger(CoreOptionsImpl.class);

    public static final String CHECK_PIECE_MOVEMENT = "CheckPieceMovement";
    public static final String ALLOW_GAME_END_TOKENS = "AllowGameEndTokens";
    public static final String VERIFY_MATERIAL = "VerifyMaterial";
    public static final String MAX_REPLAY_PLIES = "MaxReplayPlies";

    private record Option(String type, String defaultValue, String min, String max, Consumer<String> onSet) {
        void print(String name, PrintStream out) {
            StringBuilder sb = new StringBuilder("option name ").append(name).append(" type ").append(type);
            if (defaultValue != null) sb.append(" default ").append(defaultValue);
            if (min != null) sb.append(" min ").append(min);
            if (max != null) sb.append(" max ").append(max);
            out.println(sb);
        }
    }

    private final Map<String, Option> options = new LinkedHashMap<>();

    private boolean checkPieceMovement = DEFAULT_CHECK_PIECE_MOVEMENT;
    private boolean allowGameEndTokens = DEFAULT_ALLOW_GAME_END_TOKENS;
    private boolean verifyMaterial = DEFAULT_VERIFY_MATERIAL;
    private int maxReplayPlies = DEFAULT_MAX_REPLAY_PLIES;

    public CoreOptionsImpl() {
        initializeOptions();
    }

    /**
     * Defaults, overridden by {@value shogi.constants.CoreConstants#OPTIONS_RESOURCE} when that
     * resource is on the classpath.
     */
    public static CoreOptionsImpl fromClasspath() {
        CoreOptionsImpl opts = new CoreOptionsImpl();
        try (InputStream is = CoreOptionsImpl.class.getResourceAsStream(OPTIONS_RESOURCE)) {
            if (is == null) {
                LOG.debug("{} not found, using defaults", OPTIONS_RESOURCE);
                return opts;
            }
            Properties props = new Properties();
            props.load(is);
            opts.load(props);
        } catch (IOException e) {
            throw new UncheckedIOException("cannot read " + OPTIONS_RESOURCE, e);
        }
        return opts;
    }

    private void initializeOptions() {
        options.put(CHECK_PIECE_MOVEMENT, new Option("check", Boolean.toString(DEFAULT_CHECK_PIECE_MOVEMENT),
                null, null, v -> checkPieceMovement = parseCheck(v)));
        options.put(ALLOW_GAME_END_TOKENS, new Option("check", Boolean.toString(DEFAULT_ALLOW_GAME_END_TOKENS),
                null, null, v -> allowGameEndTokens = parseCheck(v)));
        options.put(VERIFY_MATERIAL, new Option("check", Boolean.toString(DEFAULT_VERIFY_MATERIAL),
                null, null, v -> verifyMaterial = parseCheck(v)));
        options.put(MAX_REPLAY_PLIES, new Option("spin", Integer.toString(DEFAULT_MAX_REPLAY_PLIES),
                Integer.toString(MIN_MAX_REPLAY_PLIES), Integer.toString(MAX_MAX_REPLAY_PLIES),
                v -> maxReplayPlies = parseSpin(v, MIN_MAX_REPLAY_PLIES, MAX_MAX_REPLAY_PLIES)));
    }

    private static boolean parseCheck(String v) {
        if ("true".equalsIgnoreCase(v)) return true;
        if ("false".equalsIgnoreCase(v)) return false;
        throw new IllegalArgumentException("expected true or false, got '" + v + "'");
    }

    private static int parseSpin(String v, int min, int max) {
        int n = Integer.parseInt(v);
        if (n < min || n > max) {
            throw new IllegalArgumentException(n + " outside [" + min + ", " + max + "]");
        }
        return n;
    }

    @Override
    public void setOption(String line) {
        String[] parts = line.trim().split(" value ", 2);
        String namePart = parts[0].replaceFirst("^setoption\\s+name\\s+", "").trim();
        String valuePart = parts.length > 1 ? parts[1].trim() : "";
        setOption(namePart, valuePart);
    }

    @Override
    public void setOption(String name, String value) {
        Option option = options.get(name);
        if (option == null) {
            LOG.warn("Unknown option: {}", name);
            return;
        }
        try {
            option.onSet.accept(value.trim());
            LOG.debug("option {} = {}", name, value);
        } catch (IllegalArgumentException e) {
            LOG.warn("Ignoring option {}: {}", name, e.getMessage());
        }
    }

    @Override
    public void load(Properties props) {
        for (String name : props.stringPropertyNames()) {
            setOption(name, props.getProperty(name));
        }
    }

    @Override
    public void printOptions(PrintStream out) {
        for (Map.Entry<String, Option> entry : options.entrySet()) {
            entry.getValue().print(entry.getKey(), out);
        }
    }

    @Override
    public boolean checkPieceMovement() {
        return checkPieceMovement;
    }

    @Override
    public boolean allowGameEndTokens() {
        return allowGameEndTokens;
    }

    @Override
    public boolean verifyMaterial() {
        return verifyMaterial;
    }

    @Override
    public int maxReplayPlies() {
        return maxReplayPlies;
    }
}
