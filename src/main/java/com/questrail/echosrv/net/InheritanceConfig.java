package com.questrail.echosrv.net;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalInt;
import java.util.Set;

/**
 * InheritanceConfig
 * =============================================================================
 * Descriptors handed to this process by a socket-activating parent (systemd and
 * compatible process managers).
 *
 * <h2>Environment contract</h2>
 * <ul>
 *   <li>{@code LISTEN_FDS}: number of inherited descriptors, numbered from 3.</li>
 *   <li>{@code LISTEN_PID}: pid the descriptors are meant for. When present, numeric
 *       and different from our pid, the descriptors are not ours and are ignored.</li>
 *   <li>{@code LISTEN_FDNAMES}: colon-separated service names, positionally matched
 *       to descriptors. Missing or empty entries become {@code fd_<index>}.</li>
 * </ul>
 *
 * <p>Instances are immutable and safe to share.</p>
 */
public final class InheritanceConfig
{
    public static final String LISTEN_FDS = "LISTEN_FDS";
    public static final String LISTEN_PID = "LISTEN_PID";
    public static final String LISTEN_FDNAMES = "LISTEN_FDNAMES";

    /** First inherited descriptor number. */
    public static final int LISTEN_FDS_START = 3;

    private static final InheritanceConfig DISABLED = new InheritanceConfig(Map.of(), false);

    private final Map<String, Integer> descriptors;
    private final boolean enabled;

    private InheritanceConfig(Map<String, Integer> descriptors, boolean enabled) {
        this.descriptors = descriptors;
        this.enabled = enabled;
    }

    public static InheritanceConfig disabled() {
        return DISABLED;
    }

    /**
     * Explicit name to descriptor table, for process managers that do not use the
     * {@code LISTEN_*} variables.
     */
    public static InheritanceConfig of(Map<String, Integer> descriptors) {
        Objects.requireNonNull(descriptors, "descriptors");
        descriptors.forEach((name, fd) -> {
            Objects.requireNonNull(name, "service name");
            if (fd == null || fd < 0) {
                throw new IllegalArgumentException("invalid descriptor for service '" + name + "': " + fd);
            }
        });
        return new InheritanceConfig(Collections.unmodifiableMap(new LinkedHashMap<>(descriptors)), true);
    }

    /** Reads the current process environment. */
    public static InheritanceConfig fromEnvironment() {
        return fromEnvironment(System.getenv(), ProcessHandle.current().pid());
    }

    public static InheritanceConfig fromEnvironment(Map<String, String> env, long currentPid) {
        Objects.requireNonNull(env, "env");

        int count = parseCount(env.get(LISTEN_FDS));
        if (count == 0) {
            return DISABLED;
        }

        String pid = env.get(LISTEN_PID);
        if (pid != null) {
            try {
                if (Long.parseLong(pid.trim()) != currentPid) {
                    return DISABLED;
                }
            } catch (NumberFormatException ignored) {
                // Unparsable pid: treated as absent.
            }
        }

        String[] names = parseNames(env.get(LISTEN_FDNAMES));
        Map<String, Integer> fds = new LinkedHashMap<>();
        for (int i = 0; i < count; i++) {
            String name = i < names.length && !names[i].isEmpty() ? names[i] : "fd_" + i;
            fds.put(name, LISTEN_FDS_START + i);
        }
        return new InheritanceConfig(Collections.unmodifiableMap(fds), true);
    }

    private static int parseCount(String raw) {
        if (raw == null) {
            return 0;
        }
        try {
            int n = Integer.parseInt(raw.trim());
            return Math.max(n, 0);
        } catch (NumberFormatException e) {
            return 0;
        }
    }

    private static String[] parseNames(String raw) {
        if (raw == null || raw.isEmpty()) {
            return new String[0];
        }
        return raw.split(":", -1);
    }

    public boolean enabled() {
        return enabled;
    }

    public OptionalInt descriptorFor(String serviceName) {
        Integer fd = enabled ? descriptors.get(serviceName) : null;
        return fd == null ? OptionalInt.empty() : OptionalInt.of(fd);
    }

    public boolean hasInheritedDescriptors() {
        return enabled && !descriptors.isEmpty();
    }

    public Set<String> serviceNames() {
        return descriptors.keySet();
    }

    public Map<String, Integer> descriptors() {
        return descriptors;
    }

    @Override
    public String toString() {
        return "InheritanceConfig{enabled=" + enabled + ", descriptors=" + descriptors + "}";
    }
}
