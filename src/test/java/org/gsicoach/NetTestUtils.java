package org.gsicoach;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.nio.charset.StandardCharsets;

public final class NetTestUtils {
    private NetTestUtils() {}

    /** Polls until the TCP port is open or times out. */
    public static void waitForPortOpen(String host, int port, long timeoutMs) throws IOException {
        long end = System.currentTimeMillis() + Math.max(0L, timeoutMs);
        IOException last = null;
        while (System.currentTimeMillis() < end) {
            try (Socket s = new Socket()) {
                s.connect(new InetSocketAddress(host, port), 200);
                return; // success
            } catch (IOException e) {
                last = e;
                try { Thread.sleep(50); } catch (InterruptedException ignored) {}
            }
        }
        if (last != null) throw last;
    }

    /** Writes a raw request and returns the whole response text. */
    public static String sendRaw(int port, String head, byte[] body) throws IOException {
        try (Socket s = new Socket("127.0.0.1", port)) {
            s.setSoTimeout(5000);
            OutputStream out = s.getOutputStream();
            InputStream in = s.getInputStream();
            out.write(head.getBytes(StandardCharsets.US_ASCII));
            if (body != null && body.length > 0) out.write(body);
            out.flush();
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        }
    }

    public static String post(int port, String path, String json) throws IOException {
        byte[] body = json.getBytes(StandardCharsets.UTF_8);
        String head = "POST " + path + " HTTP/1.1\r\n"
                + "Host: 127.0.0.1:" + port + "\r\n"
                + "Content-Type: application/json\r\n"
                + "Content-Length: " + body.length + "\r\n\r\n";
        return sendRaw(port, head, body);
    }

    public static String get(int port, String path) throws IOException {
        return sendRaw(port, "GET " + path + " HTTP/1.1\r\nHost: 127.0.0.1:" + port + "\r\n\r\n", null);
    }
}
