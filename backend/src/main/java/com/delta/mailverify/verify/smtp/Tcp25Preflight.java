package com.delta.mailverify.verify.smtp;

import com.delta.mailverify.config.VerifierProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.Inet4Address;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.net.UnknownHostException;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Quick TCP connect to port 25 so networks that block outbound SMTP are detected before a full
 * probe. Results are cached per MX host.
 */
@Component
public class Tcp25Preflight {
    private static final Logger log = LoggerFactory.getLogger(Tcp25Preflight.class);

    private final VerifierProperties properties;
    private final Map<String, CachedCheck> cache = new ConcurrentHashMap<>();

    public Tcp25Preflight(VerifierProperties properties) {
        this.properties = properties;
    }

    public boolean isReachable(String mxHost) {
        if (!properties.getPreflight().isEnabled() || mxHost == null || mxHost.isBlank()) {
            return true;
        }
        String key = mxHost.trim().toLowerCase(Locale.ROOT);
        Instant now = Instant.now();
        CachedCheck cached = cache.get(key);
        if (cached != null && cached.expiresAt().isAfter(now)) {
            return cached.reachable();
        }
        boolean reachable = check(key);
        Duration ttl = Duration.ofSeconds(properties.getPreflight().getCacheTtlSeconds());
        cache.put(key, new CachedCheck(reachable, now.plus(ttl)));
        if (!reachable) {
            log.info("TCP/25 preflight failed for {}", key);
        }
        return reachable;
    }

    public void evict(String mxHost) {
        if (mxHost != null) {
            cache.remove(mxHost.trim().toLowerCase(Locale.ROOT));
        }
    }

    private boolean check(String host) {
        List<InetAddress> addresses;
        try {
            addresses = orderedAddresses(host);
        } catch (UnknownHostException e) {
            log.debug("TCP/25 preflight could not resolve {}", host);
            return false;
        }
        int port = properties.getSmtp().getPort();
        int timeoutMs = properties.getPreflight().getTimeoutMs();
        int limit = Math.min(addresses.size(), properties.getPreflight().getMaxAddresses());
        for (int i = 0; i < limit; i++) {
            InetAddress address = addresses.get(i);
            try (Socket socket = new Socket()) {
                socket.connect(new InetSocketAddress(address, port), timeoutMs);
                return true;
            } catch (IOException e) {
                log.debug("TCP/25 connect to {} ({}) failed: {}", host, address.getHostAddress(), e.getMessage());
            }
        }
        return false;
    }

    private List<InetAddress> orderedAddresses(String host) throws UnknownHostException {
        List<InetAddress> addresses = new ArrayList<>(Arrays.asList(InetAddress.getAllByName(host)));
        addresses.sort(Comparator.comparingInt(address -> address instanceof Inet4Address ? 0 : 1));
        return addresses;
    }

    private record CachedCheck(boolean reachable, Instant expiresAt) {}
}
