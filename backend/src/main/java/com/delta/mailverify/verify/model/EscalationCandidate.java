package com.delta.mailverify.verify.model;

public record EscalationCandidate(
    long resultId,
    Long emailId,
    String email,
    String verifyStatus,
    String testSendStatus
) {
    public String localPart() {
        int at = email == null ? -1 : email.lastIndexOf('@');
        return at < 0 ? email : email.substring(0, at);
    }
}
