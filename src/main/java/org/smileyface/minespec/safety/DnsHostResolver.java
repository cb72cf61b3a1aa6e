package org.smileyface.minespec.safety;

import java.net.InetAddress;
import java.net.UnknownHostException;
import java.util.List;

/**
 * {@link HostResolver} backed by the JVM resolver.
 */
public class DnsHostResolver implements HostResolver {

    @Override
    public List<InetAddress> resolve(String host) throws UnknownHostException {
        return List.of(InetAddress.getAllByName(host));
    }
}
