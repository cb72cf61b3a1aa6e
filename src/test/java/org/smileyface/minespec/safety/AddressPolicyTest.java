package org.smileyface.minespec.safety;

import org.junit.jupiter.api.Test;

import java.net.Inet6Address;
import java.net.InetAddress;
import java.net.UnknownHostException;

import static org.assertj.core.api.Assertions.assertThat;

class AddressPolicyTest {

    // Inet6Address.getByAddress keeps the 16-byte form that InetAddress.getByName would fold to IPv4.
    private static InetAddress v6(int... bytes) throws UnknownHostException {
        byte[] raw = new byte[16];
        for (int i = 0; i < 16; i++) {
            raw[i] = (byte) bytes[i];
        }
        return Inet6Address.getByAddress(null, raw, -1);
    }

    private static InetAddress mapped(int a, int b, int c, int d) throws UnknownHostException {
        return v6(0, 0, 0, 0, 0, 0, 0, 0, 0, 0, 0xff, 0xff, a, b, c, d);
    }

    @Test
    void mappedLoopbackIsPrivate() throws Exception {
        assertThat(AddressPolicy.classify(mapped(127, 0, 0, 1))).contains(DenyReason.PRIVATE_IP);
    }

    @Test
    void mappedMetadataAddressIsCloudMetadata() throws Exception {
        assertThat(AddressPolicy.classify(mapped(169, 254, 169, 254))).contains(DenyReason.CLOUD_METADATA);
    }

    @Test
    void mappedPublicAddressIsAllowed() throws Exception {
        assertThat(AddressPolicy.classify(mapped(93, 184, 216, 34))).isEmpty();
    }

    @Test
    void compatibleFormIsUnwrappedToo() throws Exception {
        InetAddress compatible = v6(0, 0, 0, 0, 0, 0, 0, 0, 0, 0, 0, 0, 10, 0, 0, 1);
        assertThat(AddressPolicy.classify(compatible)).contains(DenyReason.PRIVATE_IP);
    }
}
