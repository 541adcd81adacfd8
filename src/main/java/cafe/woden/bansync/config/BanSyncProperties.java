package cafe.woden.bansync.config;

import java.time.ZoneId;
import java.util.IllegalFormatException;
import org.springframework.boot.context.properties.ConfigurationProperties;

/** Ban sync runtime configuration. */
@ConfigurationProperties(prefix = "bansync")
public record BanSyncProperties(
    /** Directory holding the registry and ban log documents. */
    String dataDir,

    /** Document name of the network registry. Default: {@code sync_networks.json}. */
    String networksDocument,

    /** Document name of the ban log. Default: {@code ban_log.json}. */
    String banLogDocument,

    /** Prefix that marks a chat line as a command. Default: {@code !}. */
    String commandPrefix,

    /** Reason recorded when a ban is issued without one. */
    String defaultReason,

    /** Prepended to the reason of the ban applied on the originating server. */
    String localReasonPrefix,

    /**
     * Format of the prefix prepended to the reason of every fanned-out ban.
     *
     * <p>{@code %s} is replaced with the originating server's display name. Rejected at startup
     * when it does not accept a single string argument.
     */
    String remoteReasonFormat,

    /** Number of entries {@code ban_history} shows when no limit is given. */
    Integer historyDefaultLimit,

    /** Upper bound for the {@code ban_history} limit. */
    Integer historyMaxLimit,

    /** Maximum number of remote actuator calls in flight during one fan-out. */
    Integer fanoutParallelism,

    /**
     * Zone used to render history timestamps and to read offset-less timestamps from older
     * documents. Blank means the system default zone.
     */
    String displayZone) {

  public BanSyncProperties {
    if (dataDir == null || dataDir.isBlank()) {
      dataDir = System.getProperty("user.home") + "/.config/ban-sync";
    }
    if (networksDocument == null || networksDocument.isBlank()) {
      networksDocument = "sync_networks.json";
    }
    if (banLogDocument == null || banLogDocument.isBlank()) banLogDocument = "ban_log.json";
    if (commandPrefix == null || commandPrefix.isBlank()) commandPrefix = "!";
    if (defaultReason == null || defaultReason.isBlank()) defaultReason = "No reason provided";
    if (localReasonPrefix == null) localReasonPrefix = "[Ban Sync] ";
    if (remoteReasonFormat == null || remoteReasonFormat.isBlank()) {
      remoteReasonFormat = "[Ban Sync from %s] ";
    }
    try {
      String.format(remoteReasonFormat, "");
    } catch (IllegalFormatException e) {
      throw new IllegalArgumentException(
          "bansync.remote-reason-format is not a valid format for one string argument: '"
              + remoteReasonFormat
              + "'",
          e);
    }
    if (historyDefaultLimit == null || historyDefaultLimit <= 0) historyDefaultLimit = 5;
    if (historyMaxLimit == null || historyMaxLimit <= 0) historyMaxLimit = 25;
    if (historyDefaultLimit > historyMaxLimit) historyDefaultLimit = historyMaxLimit;
    if (fanoutParallelism == null || fanoutParallelism <= 0) fanoutParallelism = 4;
    if (displayZone == null) displayZone = "";
  }

  /** Defaults for every setting. */
  public static BanSyncProperties defaults() {
    return new BanSyncProperties(null, null, null, null, null, null, null, null, null, null, null);
  }

  public ZoneId zone() {
    return displayZone.isBlank() ? ZoneId.systemDefault() : ZoneId.of(displayZone.trim());
  }

  public String remoteReasonPrefix(String originServerName) {
    return String.format(remoteReasonFormat, originServerName);
  }
}
