package org.smileyface.minespec.store;

/**
 * How to reach the Elasticsearch node holding the spec store, and the prefix of its index names.
 */
public final class ElasticContext {

    private final String indexPrefix;
    private final String address;
    private final int port;

    public ElasticContext(String indexPrefix, String address, int port) {
        if (address == null || address.isBlank()) {
            throw new IllegalArgumentException("address must not be null/blank");
        }
        if (port <= 0 || port > 65535) {
            throw new IllegalArgumentException("port out of range: " + port);
        }
        this.indexPrefix = (indexPrefix == null || indexPrefix.isBlank()) ? "minespec" : indexPrefix.trim().toLowerCase();
        this.address = address.trim();
        this.port = port;
    }

    public String getIndexPrefix() {
        return indexPrefix;
    }

    public String getAddress() {
        return address;
    }

    public int getPort() {
        return port;
    }

    /**
     * Index name for one kind of document: prefix + "-" + suffix.
     */
    public String indexName(String suffix) {
        return indexPrefix + "-" + suffix;
    }

    @Override
    public String toString() {
        return "ElasticContext{" +
                "indexPrefix='" + indexPrefix + '\'' +
                ", address='" + address + '\'' +
                ", port=" + port +
                '}';
    }
}
