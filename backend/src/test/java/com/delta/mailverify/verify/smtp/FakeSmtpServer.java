package com.delta.mailverify.verify.smtp;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStream;
import java.net.InetAddress;
import java.net.ServerSocket;
import java.net.Socket;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Scripted single-connection SMTP server bound to loopback.
 */
final class FakeSmtpServer implements AutoCloseable {
    private final ServerSocket serverSocket;
    private final List<String> commands = new CopyOnWriteArrayList<>();
    private final Thread thread;
    private volatile String banner = "220 mx.test ESMTP";
    private volatile String ehloReply = "250-mx.test\r\n250 SIZE 10240000";
    private volatile String mailReply = "250 2.1.0 Ok";
    private volatile String rcptReply = "250 2.1.5 Ok";
    private volatile boolean silentOnRcpt;

    FakeSmtpServer() throws IOException {
        this.serverSocket = new ServerSocket(0, 5, InetAddress.getLoopbackAddress());
        this.thread = new Thread(this::serve, "fake-smtp");
        this.thread.setDaemon(true);
    }

    FakeSmtpServer banner(String reply) {
        this.banner = reply;
        return this;
    }

    FakeSmtpServer ehlo(String reply) {
        this.ehloReply = reply;
        return this;
    }

    FakeSmtpServer mailFrom(String reply) {
        this.mailReply = reply;
        return this;
    }

    FakeSmtpServer rcpt(String reply) {
        this.rcptReply = reply;
        return this;
    }

    FakeSmtpServer silentOnRcpt() {
        this.silentOnRcpt = true;
        return this;
    }

    FakeSmtpServer start() {
        thread.start();
        return this;
    }

    int port() {
        return serverSocket.getLocalPort();
    }

    List<String> commands() {
        return List.copyOf(commands);
    }

    private void serve() {
        try (Socket socket = serverSocket.accept()) {
            BufferedReader reader = new BufferedReader(
                new InputStreamReader(socket.getInputStream(), StandardCharsets.ISO_8859_1)
            );
            OutputStream out = socket.getOutputStream();
            write(out, banner);
            if (!banner.startsWith("2")) {
                return;
            }
            String line;
            while ((line = reader.readLine()) != null) {
                commands.add(line);
                String verb = line.toUpperCase(Locale.ROOT);
                if (verb.startsWith("EHLO")) {
                    write(out, ehloReply);
                } else if (verb.startsWith("HELO")) {
                    write(out, "250 mx.test");
                } else if (verb.startsWith("MAIL FROM")) {
                    write(out, mailReply);
                } else if (verb.startsWith("RCPT TO")) {
                    if (silentOnRcpt) {
                        Thread.sleep(3000);
                        return;
                    }
                    write(out, rcptReply);
                } else if (verb.startsWith("QUIT")) {
                    write(out, "221 Bye");
                    return;
                } else {
                    write(out, "502 Command not implemented");
                }
            }
        } catch (IOException | InterruptedException e) {
            // client went away
        }
    }

    private static void write(OutputStream out, String reply) throws IOException {
        out.write((reply + "\r\n").getBytes(StandardCharsets.ISO_8859_1));
        out.flush();
    }

    @Override
    public void close() throws IOException {
        serverSocket.close();
        thread.interrupt();
    }
}
