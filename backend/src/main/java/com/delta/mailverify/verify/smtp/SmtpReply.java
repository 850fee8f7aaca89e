package com.delta.mailverify.verify.smtp;

import java.util.Locale;

record SmtpReply(int code, String message) {

    boolean isPositive() {
        return code >= 200 && code < 400;
    }

    boolean mentions(String keyword) {
        return message != null && message.toUpperCase(Locale.ROOT).contains(keyword.toUpperCase(Locale.ROOT));
    }
}
