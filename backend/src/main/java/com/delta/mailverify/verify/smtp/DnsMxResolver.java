package com.delta.mailverify.verify.smtp;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import javax.naming.Context;
import javax.naming.NamingException;
import javax.naming.directory.Attribute;
import javax.naming.directory.Attributes;
import javax.naming.directory.DirContext;
import javax.naming.directory.InitialDirContext;
import java.util.Hashtable;
import java.util.Locale;

@Component
public class DnsMxResolver implements MxResolver {
    private static final Logger log = LoggerFactory.getLogger(DnsMxResolver.class);

    @Override
    public String resolve(String domain) {
        String normalized = EmailAddress.normalizeDomain(domain);
        if (normalized == null) {
            return domain;
        }
        try {
            String best = lookupLowestPreference(normalized);
            return best == null ? normalized : best;
        } catch (NamingException e) {
            log.debug("MX lookup failed for {}: {}", normalized, e.getMessage());
            return normalized;
        }
    }

    private String lookupLowestPreference(String domain) throws NamingException {
        Hashtable<String, String> env = new Hashtable<>();
        env.put(Context.INITIAL_CONTEXT_FACTORY, "com.sun.jndi.dns.DnsContextFactory");
        env.put("com.sun.jndi.dns.timeout.initial", "2000");
        env.put("com.sun.jndi.dns.timeout.retries", "1");
        DirContext ctx = new InitialDirContext(env);
        try {
            Attributes attrs = ctx.getAttributes(domain, new String[] {"MX"});
            Attribute attr = attrs.get("MX");
            if (attr == null || attr.size() == 0) {
                return null;
            }
            String best = null;
            int bestPreference = Integer.MAX_VALUE;
            for (int i = 0; i < attr.size(); i++) {
                String record = String.valueOf(attr.get(i));
                String[] parts = record.trim().split("\\s+");
                if (parts.length < 2) {
                    continue;
                }
                int preference = parsePreference(parts[0]);
                String host = stripTrailingDot(parts[1]);
                if (host.isEmpty()) {
                    continue;
                }
                if (preference < bestPreference) {
                    bestPreference = preference;
                    best = host;
                }
            }
            return best;
        } finally {
            ctx.close();
        }
    }

    static int parsePreference(String raw) {
        try {
            return Integer.parseInt(raw);
        } catch (NumberFormatException e) {
            return Integer.MAX_VALUE;
        }
    }

    static String stripTrailingDot(String host) {
        String lower = host.toLowerCase(Locale.ROOT);
        return lower.endsWith(".") ? lower.substring(0, lower.length() - 1) : lower;
    }
}
