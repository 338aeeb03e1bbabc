package com.storefront.payment.compliance;

/**
 * Redacts shopper and credential data so it is safe to include in logs.
 */
public final class SensitiveDataMasker {

    private SensitiveDataMasker() {}

    /** Keeps the last four digits ("9876543210" -> "******3210"). */
    public static String maskPhone(String phone) {
        if (phone == null || phone.isBlank()) return null;
        String trimmed = phone.trim();
        if (trimmed.length() <= 4) return "****";
        return "*".repeat(trimmed.length() - 4) + trimmed.substring(trimmed.length() - 4);
    }

    /** Keeps the first character of the local part and the domain ("jane@x.com" -> "j***@x.com"). */
    public static String maskEmail(String email) {
        if (email == null || email.isBlank()) return null;
        int at = email.indexOf('@');
        if (at <= 0) return "***";
        return email.charAt(0) + "***" + email.substring(at);
    }

    /** Keeps a short prefix of a client id so operators can tell accounts apart. */
    public static String maskClientId(String clientId) {
        if (clientId == null || clientId.isBlank()) return null;
        return clientId.length() <= 4 ? "****" : clientId.substring(0, 4) + "****";
    }

    /** Secrets are never shown, only whether one is present. */
    public static String maskSecret(String secret) {
        if (secret == null || secret.isBlank()) return null;
        return "[REDACTED]";
    }
}
