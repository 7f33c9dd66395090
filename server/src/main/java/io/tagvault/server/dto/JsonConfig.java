// file: server/src/main/java/io/tagvault/server/dto/JsonConfig.java
package io.tagvault.server.dto;

/**
 * Shape of the optional JSON config file. Null fields keep their defaults.
 */
public class JsonConfig {
    public Integer httpPort;
    public String dataDir;
    public String remoteUrl;
    public Long syncIntervalSeconds;
    public Long remoteTimeoutSeconds;
    public Integer snapshotEvery;
}
