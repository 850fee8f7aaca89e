package com.delta.mailverify.verify.smtp;

import com.delta.mailverify.config.VerifierProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.EOFException;
import java.io.IOException;
import java.net.SocketException;
import java.net.SocketTimeoutException;
import java.util.Optional;

/**
 * Single mailbox check over SMTP: EHLO (HELO fallback), opportunistic STARTTLS, MAIL FROM, RCPT TO.
 * The final reply code decides the category; QUIT is always attempted.
 */
@Component
public class SmtpProbe {
    private static final Logger log = LoggerFactory.getLogger(SmtpProbe.class);

    private final VerifierProperties properties;

    public SmtpProbe(VerifierProperties properties) {
        this.properties = properties;
    }

    public ProbeOutcome probe(String email, String mxHost) {
        return probe(email, mxHost, properties.getSmtp().getMailFrom());
    }

    public ProbeOutcome probe(String email, String mxHost, String returnPath) {
        long startedAt = System.nanoTime();
        VerifierProperties.Smtp smtp = properties.getSmtp();
        String helo = smtp.getHeloDomain();
        Optional<EmailAddress> parsed = EmailAddress.parse(email);
        if (parsed.isEmpty()) {
            return ProbeOutcome.unknown(null, "invalid email", mxHost, helo, elapsed(startedAt), ProbeOutcome.ERROR_INVALID_EMAIL);
        }
        String host = mxHost == null || mxHost.isBlank() ? parsed.get().domain() : mxHost.trim();
        if (!smtp.isEnabled()) {
            return ProbeOutcome.unknown(null, "smtp probing disabled", host, helo, elapsed(startedAt), ProbeOutcome.ERROR_PROBING_DISABLED);
        }

        SmtpSession session = null;
        try {
            session = SmtpSession.open(host, smtp.getPort(), smtp.getConnectTimeoutMs(), smtp.getCommandTimeoutMs());
            SmtpReply banner = session.readReply();
            if (!banner.isPositive()) {
                return fromReply(banner, host, helo, startedAt);
            }

            SmtpReply hello = greet(session, helo);
            if (!hello.isPositive()) {
                return fromReply(hello, host, helo, startedAt);
            }
            if (hello.mentions("STARTTLS")) {
                SmtpReply tls = session.command("STARTTLS");
                if (tls.code() == 220) {
                    session.upgradeToTls(host);
                    hello = greet(session, helo);
                    if (!hello.isPositive()) {
                        return fromReply(hello, host, helo, startedAt);
                    }
                }
            }

            SmtpReply mailFrom = session.command("MAIL FROM:<" + (returnPath == null ? "" : returnPath) + ">");
            if (!mailFrom.isPositive()) {
                return fromReply(mailFrom, host, helo, startedAt);
            }
            SmtpReply rcpt = session.command("RCPT TO:<" + parsed.get().address() + ">");
            return fromReply(rcpt, host, helo, startedAt);
        } catch (SocketTimeoutException e) {
            return ProbeOutcome.temporaryFailure(null, e.getMessage(), host, helo, elapsed(startedAt), ProbeOutcome.ERROR_TIMEOUT);
        } catch (EOFException | SocketException e) {
            return ProbeOutcome.unknown(null, e.getMessage(), host, helo, elapsed(startedAt), ProbeOutcome.ERROR_DISCONNECTED);
        } catch (IOException e) {
            return ProbeOutcome.unknown(null, e.getMessage(), host, helo, elapsed(startedAt), ProbeOutcome.ERROR_SMTP);
        } catch (RuntimeException e) {
            log.warn("Unexpected SMTP probe failure for {} via {}", email, host, e);
            return ProbeOutcome.unknown(null, e.getMessage(), host, helo, elapsed(startedAt), ProbeOutcome.ERROR_GENERIC);
        } finally {
            if (session != null) {
                session.quietQuit();
                try {
                    session.close();
                } catch (IOException e) {
                    log.debug("Failed to close SMTP session to {}", host, e);
                }
            }
        }
    }

    private SmtpReply greet(SmtpSession session, String helo) throws IOException {
        SmtpReply ehlo = session.command("EHLO " + helo);
        if (ehlo.isPositive()) {
            return ehlo;
        }
        return session.command("HELO " + helo);
    }

    private ProbeOutcome fromReply(SmtpReply reply, String host, String helo, long startedAt) {
        long elapsed = elapsed(startedAt);
        return switch (ProbeCategory.fromReplyCode(reply.code())) {
            case ACCEPT -> ProbeOutcome.accepted(reply.code(), reply.message(), host, helo, elapsed);
            case HARD_FAIL -> ProbeOutcome.permanentFailure(reply.code(), reply.message(), host, helo, elapsed);
            case TEMP_FAIL -> ProbeOutcome.temporaryFailure(reply.code(), reply.message(), host, helo, elapsed, null);
            case UNKNOWN -> ProbeOutcome.unknown(
                reply.code() < 0 ? null : reply.code(),
                reply.message(),
                host,
                helo,
                elapsed,
                ProbeOutcome.ERROR_SMTP
            );
        };
    }

    private long elapsed(long startedAt) {
        return (System.nanoTime() - startedAt) / 1_000_000L;
    }
}
