package cafe.woden.bansync.app;

import cafe.woden.bansync.app.api.ExternalBanEventPort;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/** Records externally issued bans in the operational log. */
@Component
public class ExternalBanEventLogger implements ExternalBanEventPort {

  private static final Logger log = LoggerFactory.getLogger(ExternalBanEventLogger.class);

  @Override
  public void onExternalBan(String serverId, String userId) {
    log.info("[bansync] {} was banned on {} outside ban sync; not propagated", userId, serverId);
  }
}
