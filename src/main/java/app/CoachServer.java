package app;

import api.impl.HttpResponseImpl;
import api.impl.HttpResponseWriter;
import api.impl.MinimalHttpRequest;
import api.impl.handlers.HandlerFactory;
import api.interfaces.IHandlerFactory;
import api.interfaces.IHttpHandler;
import api.interfaces.IHttpServer;
import domain.interfaces.ICoachService;
import infrastructure.impl.CoachServiceImpl;
import org.gsicoach.insight.InsightReport;
import org.gsicoach.util.GameTime;

import java.io.BufferedInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.io.PrintStream;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.net.Socket;
import java.net.SocketException;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Receives game state over plain HTTP and prints coaching advice.
 * <p>
 * One accept thread hands each connection to a worker; a separate daemon thread
 * polls the coach on a fixed cadence and prints the advisory whenever the game
 * clock moved.
 */
public class CoachServer implements IHttpServer {

    private final CoachConfig config;
    private final ICoachService service;
    private final IHandlerFactory factory;
    private final PrintStream console;

    private volatile boolean running;
    private ServerSocket server;
    private Thread acceptor;
    private Thread renderer;
    private ExecutorService workers;

    public CoachServer(CoachConfig config, ICoachService service) {
        this(config, service, new HandlerFactory(service), System.out);
    }

    public CoachServer(CoachConfig config, ICoachService service, IHandlerFactory factory, PrintStream console) {
        this.config = config;
        this.service = service;
        this.factory = factory;
        this.console = console;
    }

    public static void main(String[] args) throws Exception {
        CoachConfig config = CoachConfig.fromArgs(args);
        CoachServer server = new CoachServer(config, new CoachServiceImpl());
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            try {
                server.close();
            } catch (Exception e) {
                System.err.println("[Server] shutdown error: " + e.getMessage());
            }
        }, "coach-shutdown"));
        server.start();
        server.acceptor.join();
    }

    @Override
    public synchronized void start() throws IOException {
        if (running) throw new IllegalStateException("already started");
        server = new ServerSocket();
        server.setReuseAddress(true);
        server.bind(new InetSocketAddress(InetAddress.getByName(config.host()), config.port()));
        running = true;

        AtomicInteger n = new AtomicInteger();
        workers = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "coach-conn-" + n.incrementAndGet());
            t.setDaemon(true);
            return t;
        });

        acceptor = new Thread(this::acceptLoop, "coach-accept");
        acceptor.start();

        if (config.render()) {
            renderer = new Thread(this::renderLoop, "coach-render");
            renderer.setDaemon(true);
            renderer.start();
        }
        System.out.println("[Server] listening on " + config.host() + ":" + server.getLocalPort()
                + " (" + config + ")");
    }

    @Override
    public int port() {
        ServerSocket s = server;
        return s == null ? config.port() : s.getLocalPort();
    }

    @Override
    public synchronized void close() throws Exception {
        if (!running) return;
        running = false;
        server.close();
        if (renderer != null) renderer.interrupt();
        workers.shutdown();
        if (!workers.awaitTermination(2, TimeUnit.SECONDS)) {
            workers.shutdownNow();
        }
        System.out.println("[Server] stopped");
    }

    private void acceptLoop() {
        while (running) {
            try {
                Socket client = server.accept();
                workers.execute(() -> serve(client));
            } catch (SocketException se) {
                if (running) System.err.println("[Server] accept failed: " + se.getMessage());
            } catch (IOException e) {
                System.err.println("[Server] accept error: " + e.getMessage());
            }
        }
    }

    void serve(Socket socket) {
        try (Socket client = socket;
             InputStream rawIn = client.getInputStream();
             BufferedInputStream bin = new BufferedInputStream(rawIn);
             OutputStream out = client.getOutputStream()) {

            String start = readLineAscii(bin); // e.g., "POST / HTTP/1.1"
            if (start == null || start.isEmpty()) {
                HttpResponseWriter.writePlain(out, 400, "Bad Request", "empty request line");
                return;
            }
            String[] p = start.split(" ", 3);
            String method = p.length > 0 ? p[0] : "";
            String target = p.length > 1 ? p[1] : "/";
            String ver    = p.length > 2 ? p[2] : "HTTP/1.1";

            Map<String, String> headers = new LinkedHashMap<>();
            String line;
            while ((line = readLineAscii(bin)) != null && !line.isEmpty()) {
                int idx = line.indexOf(':');
                if (idx > 0) {
                    headers.put(line.substring(0, idx).trim().toLowerCase(Locale.ROOT),
                            line.substring(idx + 1).trim());
                }
            }

            long len;
            try {
                len = Long.parseLong(headers.getOrDefault("content-length", "0"));
            } catch (NumberFormatException e) {
                HttpResponseWriter.writePlain(out, 400, "Bad Request", "invalid content-length");
                return;
            }
            if (len < 0) {
                HttpResponseWriter.writePlain(out, 400, "Bad Request", "invalid content-length");
                return;
            }
            if (len > config.maxBodyBytes()) {
                System.err.println("[Ingest] payload too large: " + len + " bytes");
                HttpResponseWriter.writePlain(out, 413, "Payload Too Large",
                        "limit is " + config.maxBodyBytes() + " bytes");
                return;
            }

            String expect = headers.get("expect");
            if (expect != null && expect.equalsIgnoreCase("100-continue")) {
                OutputStreamWriter w100 = new OutputStreamWriter(out, StandardCharsets.US_ASCII);
                w100.write("HTTP/1.1 100 Continue\r\n\r\n");
                w100.flush();
            }

            byte[] body = new byte[(int) len];
            int total = 0;
            while (total < len) {
                int r = bin.read(body, total, (int) len - total);
                if (r < 0) break;
                total += r;
            }
            if (total < len) {
                HttpResponseWriter.writePlain(out, 400, "Bad Request", "truncated body");
                return;
            }

            MinimalHttpRequest req = new MinimalHttpRequest(method, target, ver, headers, body);
            HttpResponseImpl res = new HttpResponseImpl();
            IHttpHandler handler = factory.route(req);
            try {
                handler.handle(req, res);
            } catch (RuntimeException e) {
                System.err.println("[Server] handler failed for " + method + " " + target + ": " + e);
                res.json(500, "Internal Server Error",
                        "{\"error\":\"" + String.valueOf(e.getMessage()).replace("\"", "'") + "\"}");
            }
            HttpResponseWriter.write(out, res);

        } catch (SocketException se) {
            String msg = String.valueOf(se.getMessage()).toLowerCase(Locale.ROOT);
            if (!(msg.contains("connection reset") || msg.contains("broken pipe")
                    || msg.contains("socket closed"))) {
                System.err.println("[Server] socket error: " + se.getMessage());
            }
        } catch (IOException e) {
            System.err.println("[Server] error: " + e.getMessage());
        }
    }

    private void renderLoop() {
        int renderedClock = Integer.MIN_VALUE;
        long renderedCount = -1;
        while (running) {
            try {
                Thread.sleep(config.renderIntervalMs());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            }
            try {
                long count = service.ingestedCount();
                Optional<InsightReport> report = service.report();
                if (report.isEmpty()) continue;
                int clock = report.get().gameClock();
                if (clock == renderedClock && count == renderedCount) continue;

                console.print(renderFrame(clock, report.get().lines()));
                console.flush();
                renderedClock = clock;
                renderedCount = count;
            } catch (RuntimeException e) {
                System.err.println("[Render] frame failed: " + e.getMessage());
            }
        }
    }

    /** Text block printed for one advisory frame. */
    static String renderFrame(int gameClock, List<String> lines) {
        StringBuilder sb = new StringBuilder();
        sb.append("[Render] ===== Game time ").append(GameTime.format(gameClock)).append(" =====\n");
        if (lines.isEmpty()) {
            sb.append("No insights yet\n");
        }
        for (String l : lines) {
            sb.append(l).append('\n');
        }
        return sb.toString();
    }

    /** Reads one header line; accepts CRLF or a bare LF terminator. */
    private static String readLineAscii(BufferedInputStream in) throws IOException {
        ByteArrayOutputStream buf = new ByteArrayOutputStream(128);
        int b;
        while ((b = in.read()) != -1) {
            if (b == '\n') {
                byte[] bytes = buf.toByteArray();
                int len = bytes.length;
                if (len > 0 && bytes[len - 1] == '\r') len--;
                return new String(bytes, 0, len, StandardCharsets.US_ASCII);
            }
            buf.write(b);
        }
        return (buf.size() == 0) ? null : new String(buf.toByteArray(), StandardCharsets.US_ASCII);
    }
}
