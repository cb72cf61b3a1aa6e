package org.smileyface.minespec.safety;

/**
 * Why the safety gate refused a URL.
 */
public enum DenyReason {
    INVALID_URL,
    DNS_UNRESOLVED,
    PRIVATE_IP,
    CLOUD_METADATA,
    /** Policy deny from robots.txt, not a security finding. */
    ROBOTS_DISALLOWED
}
