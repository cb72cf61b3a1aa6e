package org.smileyface.minespec.safety;

import java.net.InetAddress;
import java.net.UnknownHostException;
import java.util.List;

/**
 * Resolves a host name to all of its addresses. Injected into {@link UrlSafetyGate} so tests can
 * simulate DNS answers, including ones pointing at internal networks.
 */
@FunctionalInterface
public interface HostResolver {

    /**
     * @param host host name or literal address, without brackets
     * @return every address the host resolves to (may be empty)
     * @throws UnknownHostException when the name cannot be resolved
     */
    List<InetAddress> resolve(String host) throws UnknownHostException;
}
