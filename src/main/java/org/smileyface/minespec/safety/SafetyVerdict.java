package org.smileyface.minespec.safety;

import java.util.Objects;

/**
 * Outcome of {@link UrlSafetyGate#isSafe(String, boolean)}: either allowed, or denied with a reason.
 */
public final class SafetyVerdict {

    private static final SafetyVerdict ALLOW = new SafetyVerdict(null, null);

    private final DenyReason reason;
    private final String detail;

    private SafetyVerdict(DenyReason reason, String detail) {
        this.reason = reason;
        this.detail = detail;
    }

    public static SafetyVerdict allow() {
        return ALLOW;
    }

    public static SafetyVerdict deny(DenyReason reason, String detail) {
        return new SafetyVerdict(Objects.requireNonNull(reason, "reason"), detail);
    }

    public boolean isAllowed() {
        return reason == null;
    }

    /** Deny reason, or null when allowed. */
    public DenyReason getReason() {
        return reason;
    }

    public String getDetail() {
        return detail;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        SafetyVerdict that = (SafetyVerdict) o;
        return reason == that.reason && Objects.equals(detail, that.detail);
    }

    @Override
    public int hashCode() {
        return Objects.hash(reason, detail);
    }

    @Override
    public String toString() {
        return isAllowed() ? "Allow" : "Deny(" + reason + (detail != null ? ": " + detail : "") + ")";
    }
}
