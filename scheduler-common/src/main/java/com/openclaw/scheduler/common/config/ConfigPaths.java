package com.openclaw.scheduler.common.config;

import java.nio.file.Path;
import java.util.Map;

/**
 * Configuration paths: state directory, config file, per-agent session stores.
 */
public final class ConfigPaths {

    private ConfigPaths() {
    }

    private static final String STATE_DIRNAME = ".openclaw";
    private static final String CONFIG_FILENAME = "openclaw.json";
    public static final String DEFAULT_AGENT_ID = "main";

    // =========================================================================
    // State directory
    // =========================================================================

    /**
     * State directory for mutable data (cron store, sessions, run logs).
     * Can be overridden via OPENCLAW_STATE_DIR.
     * Default: ~/.openclaw
     */
    public static Path resolveStateDir() {
        return resolveStateDir(System.getenv());
    }

    public static Path resolveStateDir(Map<String, String> env) {
        String override = envTrimmed(env, "OPENCLAW_STATE_DIR");
        if (override != null) {
            return resolveUserPath(override, env);
        }
        return Path.of(homeDir(env), STATE_DIRNAME);
    }

    // =========================================================================
    // Config file path
    // =========================================================================

    public static Path resolveConfigPath() {
        return resolveConfigPath(System.getenv());
    }

    public static Path resolveConfigPath(Map<String, String> env) {
        String override = envTrimmed(env, "OPENCLAW_CONFIG_PATH");
        if (override != null) {
            return resolveUserPath(override, env);
        }
        return resolveStateDir(env).resolve(CONFIG_FILENAME);
    }

    // =========================================================================
    // Session stores
    // =========================================================================

    /**
     * Resolve the session store file for an agent. The template may contain
     * "{agentId}"; without a template the per-agent default under the state
     * directory is used.
     */
    public static Path resolveSessionStorePath(String template, String agentId, Map<String, String> env) {
        String id = normalizeAgentId(agentId);
        if (template != null && !template.isBlank()) {
            return resolveUserPath(template.replace("{agentId}", id), env);
        }
        return resolveStateDir(env).resolve("agents").resolve(id).resolve("sessions").resolve("sessions.json");
    }

    public static String normalizeAgentId(String agentId) {
        if (agentId == null || agentId.isBlank()) {
            return DEFAULT_AGENT_ID;
        }
        return agentId.trim().toLowerCase();
    }

    // =========================================================================
    // User paths
    // =========================================================================

    public static Path resolveUserPath(String input) {
        return resolveUserPath(input, System.getenv());
    }

    /**
     * Expand a leading "~" (to OPENCLAW_HOME when set, else the user's home)
     * and normalize to an absolute path.
     */
    public static Path resolveUserPath(String input, Map<String, String> env) {
        if (input == null)
            return Path.of("");
        String trimmed = input.trim();
        if (trimmed.isEmpty())
            return Path.of("");
        if (trimmed.startsWith("~")) {
            String rest = trimmed.substring(1);
            while (rest.startsWith("/") || rest.startsWith("\\")) {
                rest = rest.substring(1);
            }
            Path home = Path.of(homeDir(env));
            return (rest.isEmpty() ? home : home.resolve(rest)).toAbsolutePath().normalize();
        }
        return Path.of(trimmed).toAbsolutePath().normalize();
    }

    private static String homeDir(Map<String, String> env) {
        String override = envTrimmed(env, "OPENCLAW_HOME");
        return override != null ? override : System.getProperty("user.home");
    }

    private static String envTrimmed(Map<String, String> env, String key) {
        String val = env.get(key);
        return val != null && !val.trim().isEmpty() ? val.trim() : null;
    }
}
