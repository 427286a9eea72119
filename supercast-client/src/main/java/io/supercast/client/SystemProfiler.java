package io.supercast.client;

import io.supercast.core.Supercast;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.net.InetAddress;
import java.net.UnknownHostException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Describes the runtime for the {@code X-Supercast-Client-User-Agent} header.
 */
public final class SystemProfiler {

    private static final Logger log = LoggerFactory.getLogger(SystemProfiler.class);
    private static final Path PROC_VERSION = Path.of("/proc/version");

    private final String uname;

    public SystemProfiler() {
        this(uname(PROC_VERSION));
    }

    SystemProfiler(String uname) {
        this.uname = uname;
    }

    /**
     * Kernel description: the first line of {@code procVersion} when readable, otherwise the
     * OS name and version reported by the JVM.
     */
    static String uname(Path procVersion) {
        if (Files.isReadable(procVersion)) {
            try (BufferedReader reader = Files.newBufferedReader(procVersion, StandardCharsets.UTF_8)) {
                String line = reader.readLine();
                if (line != null && !line.isBlank()) {
                    return line.strip();
                }
            } catch (IOException e) {
                log.debug("Could not read {}: {}", procVersion, e.toString());
            }
        }
        return System.getProperty("os.name") + " " + System.getProperty("os.version");
    }

    static String hostname() {
        try {
            return InetAddress.getLocalHost().getHostName();
        } catch (UnknownHostException e) {
            return "unknown";
        }
    }

    /**
     * Builds the user-agent map; entries whose value is unknown are left out.
     */
    public Map<String, String> userAgent() {
        Map<String, String> ua = new LinkedHashMap<>();
        ua.put("bindings_version", Supercast.VERSION);
        ua.put("lang", "java");
        ua.put("lang_version", System.getProperty("java.version") + " (" + System.getProperty("java.vendor") + ")");
        ua.put("platform", System.getProperty("os.name") + " " + System.getProperty("os.arch"));
        ua.put("engine", System.getProperty("java.vm.name"));
        ua.put("publisher", "supercast");
        ua.put("uname", uname);
        ua.put("hostname", hostname());
        ua.values().removeIf(v -> v == null);
        return ua;
    }
}
