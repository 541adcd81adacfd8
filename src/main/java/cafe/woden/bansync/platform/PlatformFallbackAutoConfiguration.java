package cafe.woden.bansync.platform;

import cafe.woden.bansync.sync.api.BanActuatorException;
import cafe.woden.bansync.sync.api.BanActuatorPort;
import cafe.woden.bansync.sync.api.PrivilegeOraclePort;
import io.reactivex.rxjava3.core.Completable;
import io.reactivex.rxjava3.core.Single;
import java.util.NoSuchElementException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;

/**
 * Hard fallback for the chat platform ports.
 *
 * <p>Runs after user configuration, so a real adapter bean always wins. Without one the service
 * still starts: every caller is unprivileged and every ban attempt fails as unreachable.
 */
@AutoConfiguration
public class PlatformFallbackAutoConfiguration {

  private static final Logger log =
      LoggerFactory.getLogger(PlatformFallbackAutoConfiguration.class);

  static final String NO_ADAPTER = "No chat platform adapter configured";

  @Bean
  @ConditionalOnMissingBean(PrivilegeOraclePort.class)
  public PrivilegeOraclePort denyAllPrivilegeOracle() {
    log.warn("[bansync] {}; all commands will be denied", NO_ADAPTER);
    return (actorId, serverId) -> false;
  }

  @Bean
  @ConditionalOnMissingBean(BanActuatorPort.class)
  public BanActuatorPort unreachableBanActuator() {
    log.warn("[bansync] {}; bans cannot be applied", NO_ADAPTER);
    return new UnreachableBanActuator();
  }

  static final class UnreachableBanActuator implements BanActuatorPort {

    @Override
    public Completable banUser(String serverId, String userId, String reason) {
      return Completable.error(
          new BanActuatorException(BanActuatorException.Kind.UNREACHABLE, NO_ADAPTER));
    }

    @Override
    public Single<String> resolveUserDisplayName(String userId) {
      return Single.error(new NoSuchElementException(NO_ADAPTER));
    }
  }
}
