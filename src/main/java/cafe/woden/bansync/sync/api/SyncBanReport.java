package cafe.woden.bansync.sync.api;

import java.util.List;

/**
 * Aggregate result of a propagated ban.
 *
 * @param totalSuccessCount the local ban plus every remote server that accepted the ban
 * @param networksAffected number of networks the origin belonged to
 * @param remoteTargets number of distinct remote servers attempted
 */
public record SyncBanReport(
    String userId,
    String userDisplayName,
    int totalSuccessCount,
    int networksAffected,
    List<String> networkNames,
    int remoteTargets) {

  public SyncBanReport {
    networkNames = networkNames == null ? List.of() : List.copyOf(networkNames);
  }
}
