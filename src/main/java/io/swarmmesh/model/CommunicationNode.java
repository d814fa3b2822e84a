package io.swarmmesh.model;

import java.util.List;

public record CommunicationNode(
        String id,
        String address,
        int port,
        Capabilities capabilities,
        String version
) {
    public CommunicationNode {
        capabilities = capabilities == null ? Capabilities.standard() : capabilities;
        version = version == null || version.isBlank() ? "1.0" : version;
    }

    public static CommunicationNode of(String id, String address, int port) {
        return new CommunicationNode(id, address, port, null, null);
    }

    public record Capabilities(
            int maxConnections,
            List<String> supportedProtocols,
            boolean encryptionSupport,
            boolean compressionSupport,
            long bandwidth,
            int bufferSize
    ) {
        public Capabilities {
            supportedProtocols = supportedProtocols == null ? List.of() : List.copyOf(supportedProtocols);
        }

        public static Capabilities standard() {
            return new Capabilities(100, List.of("tcp"), true, true, 1_000_000L, 65_536);
        }
    }
}
