package app;

/**
 * Runtime settings. The first program argument overrides the port; everything
 * else comes from system properties ({@code -Dcoach.port=3001}).
 */
public final class CoachConfig {

    public static final String DEFAULT_HOST = "127.0.0.1";
    public static final int DEFAULT_PORT = 3000;
    public static final long DEFAULT_RENDER_INTERVAL_MS = 1000L;
    public static final int DEFAULT_MAX_BODY_BYTES = 10 * 1024 * 1024;

    private final String host;
    private final int port;
    private final long renderIntervalMs;
    private final int maxBodyBytes;
    private final boolean render;

    public CoachConfig(String host, int port, long renderIntervalMs, int maxBodyBytes, boolean render) {
        if (port < 0 || port > 65535) throw new IllegalArgumentException("port out of range: " + port);
        if (renderIntervalMs <= 0) throw new IllegalArgumentException("render interval must be positive");
        if (maxBodyBytes <= 0) throw new IllegalArgumentException("max body size must be positive");
        this.host = (host == null || host.isBlank()) ? DEFAULT_HOST : host;
        this.port = port;
        this.renderIntervalMs = renderIntervalMs;
        this.maxBodyBytes = maxBodyBytes;
        this.render = render;
    }

    public static CoachConfig defaults() {
        return new CoachConfig(DEFAULT_HOST, DEFAULT_PORT, DEFAULT_RENDER_INTERVAL_MS, DEFAULT_MAX_BODY_BYTES, true);
    }

    public static CoachConfig fromArgs(String[] args) {
        int port = args != null && args.length > 0
                ? parseInt("port argument", args[0])
                : parseInt("coach.port", System.getProperty("coach.port", String.valueOf(DEFAULT_PORT)));
        return new CoachConfig(
                System.getProperty("coach.host", DEFAULT_HOST),
                port,
                parseLong("coach.renderIntervalMs",
                        System.getProperty("coach.renderIntervalMs", String.valueOf(DEFAULT_RENDER_INTERVAL_MS))),
                parseInt("coach.maxBodyBytes",
                        System.getProperty("coach.maxBodyBytes", String.valueOf(DEFAULT_MAX_BODY_BYTES))),
                Boolean.parseBoolean(System.getProperty("coach.render", "true")));
    }

    public String host() { return host; }
    public int port() { return port; }
    public long renderIntervalMs() { return renderIntervalMs; }
    public int maxBodyBytes() { return maxBodyBytes; }
    public boolean render() { return render; }

    /** Same settings on another port; port 0 binds an ephemeral one. */
    public CoachConfig withPort(int port) {
        return new CoachConfig(host, port, renderIntervalMs, maxBodyBytes, render);
    }

    public CoachConfig withRender(boolean render) {
        return new CoachConfig(host, port, renderIntervalMs, maxBodyBytes, render);
    }

    private static int parseInt(String name, String value) {
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("invalid " + name + ": " + value, e);
        }
    }

    private static long parseLong(String name, String value) {
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("invalid " + name + ": " + value, e);
        }
    }

    @Override
    public String toString() {
        return "host=" + host + " port=" + port + " renderIntervalMs=" + renderIntervalMs
                + " maxBodyBytes=" + maxBodyBytes + " render=" + render;
    }
}
