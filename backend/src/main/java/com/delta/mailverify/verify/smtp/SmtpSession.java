package com.delta.mailverify.verify.smtp;

import javax.net.ssl.SSLSocket;
import javax.net.ssl.SSLSocketFactory;
import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.EOFException;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStreamWriter;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.nio.charset.StandardCharsets;

/**
 * Minimal line-oriented SMTP client. Only what a RCPT probe needs.
 */
class SmtpSession implements AutoCloseable {
    private Socket socket;
    private BufferedReader reader;
    private BufferedWriter writer;

    private SmtpSession(Socket socket) throws IOException {
        bind(socket);
    }

    static SmtpSession open(String host, int port, int connectTimeoutMs, int commandTimeoutMs) throws IOException {
        Socket socket = new Socket();
        try {
            socket.connect(new InetSocketAddress(host, port), connectTimeoutMs);
            socket.setSoTimeout(commandTimeoutMs);
            return new SmtpSession(socket);
        } catch (IOException e) {
            socket.close();
            throw e;
        }
    }

    SmtpReply readReply() throws IOException {
        StringBuilder message = new StringBuilder();
        int code = -1;
        String line;
        while (true) {
            line = reader.readLine();
            if (line == null) {
                throw new EOFException("server closed connection");
            }
            if (line.length() >= 3) {
                code = parseCode(line);
            }
            if (message.length() > 0) {
                message.append('\n');
            }
            message.append(line.length() > 4 ? line.substring(4) : "");
            if (line.length() < 4 || line.charAt(3) != '-') {
                break;
            }
        }
        return new SmtpReply(code, message.toString().trim());
    }

    SmtpReply command(String command) throws IOException {
        writer.write(command);
        writer.write("\r\n");
        writer.flush();
        return readReply();
    }

    void upgradeToTls(String host) throws IOException {
        SSLSocketFactory factory = (SSLSocketFactory) SSLSocketFactory.getDefault();
        SSLSocket tls = (SSLSocket) factory.createSocket(socket, host, socket.getPort(), true);
        tls.setSoTimeout(socket.getSoTimeout());
        tls.startHandshake();
        bind(tls);
    }

    void quietQuit() {
        try {
            writer.write("QUIT\r\n");
            writer.flush();
            reader.readLine();
        } catch (IOException ignored) {
            // connection already gone; close() below still runs
        }
    }

    @Override
    public void close() throws IOException {
        socket.close();
    }

    private void bind(Socket target) throws IOException {
        this.socket = target;
        this.reader = new BufferedReader(new InputStreamReader(target.getInputStream(), StandardCharsets.ISO_8859_1));
        this.writer = new BufferedWriter(new OutputStreamWriter(target.getOutputStream(), StandardCharsets.ISO_8859_1));
    }

    private static int parseCode(String line) {
        try {
            return Integer.parseInt(line.substring(0, 3));
        } catch (NumberFormatException e) {
            return -1;
        }
    }
}
