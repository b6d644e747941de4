package beacon.core.model.connection;

import java.util.Optional;

/**
 * Transport-level details captured at handshake time.
 *
 * @param userAgent     the User-Agent header, empty string when absent
 * @param platform      the x-platform header, if sent
 * @param device        derived device classification
 * @param remoteAddress the peer address, if known
 */
public record ClientInfo(String userAgent, Optional<String> platform, DeviceType device, Optional<String> remoteAddress) {

    public ClientInfo {
        userAgent = userAgent != null ? userAgent : "";
        platform = platform != null ? platform : Optional.empty();
        device = device != null ? device : DeviceType.WEB;
        remoteAddress = remoteAddress != null ? remoteAddress : Optional.empty();
    }

    public static ClientInfo from(String userAgent, String platform, String remoteAddress) {
        return new ClientInfo(
                userAgent,
                Optional.ofNullable(platform),
                DeviceType.classify(userAgent, platform),
                Optional.ofNullable(remoteAddress));
    }

    public static ClientInfo unknown() {
        return new ClientInfo("", Optional.empty(), DeviceType.WEB, Optional.empty());
    }
}
