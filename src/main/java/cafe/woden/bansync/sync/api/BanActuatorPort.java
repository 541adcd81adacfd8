package cafe.woden.bansync.sync.api;

import io.reactivex.rxjava3.core.Completable;
import io.reactivex.rxjava3.core.Single;

/**
 * Performs bans and identity lookups on the chat platform.
 *
 * <p>All operations are explicitly scoped to a server id. Implementations own the timeout of each
 * call: a returned source must terminate in bounded time.
 */
public interface BanActuatorPort {

  /**
   * Ban {@code userId} on {@code serverId}.
   *
   * <p>Failures are signalled as {@link BanActuatorException}; any other error is treated as
   * {@link BanActuatorException.Kind#OTHER}.
   */
  Completable banUser(String serverId, String userId, String reason);

  /** Resolve a printable name for {@code userId}; errors when the user cannot be found. */
  Single<String> resolveUserDisplayName(String userId);
}
