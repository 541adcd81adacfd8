package cafe.woden.bansync.sync.api;

/** Answers whether a caller may run ban sync commands on a server. */
@FunctionalInterface
public interface PrivilegeOraclePort {

  boolean isPrivileged(String actorId, String serverId);
}
