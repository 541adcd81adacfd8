package cafe.woden.bansync.app.api;

/**
 * Inbound notification for bans applied on a server outside ban sync (for example by a moderator
 * using the platform directly).
 *
 * <p>Such bans are not propagated.
 */
public interface ExternalBanEventPort {

  void onExternalBan(String serverId, String userId);
}
