package com.delta.mailverify.verify.smtp;

public interface MxResolver {

    /**
     * Returns the lowest-preference MX host for {@code domain}, or the domain itself when no MX
     * record can be resolved.
     */
    String resolve(String domain);
}
