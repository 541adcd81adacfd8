package cafe.woden.bansync.app.api;

import java.util.Objects;

/** Who is issuing a command, and from which server. Names are for display and audit only. */
public record CallerContext(String serverId, String serverName, String actorId, String actorName) {

  public CallerContext {
    serverId = Objects.toString(serverId, "").trim();
    serverName = Objects.toString(serverName, "");
    actorId = Objects.toString(actorId, "").trim();
    actorName = Objects.toString(actorName, "");
  }
}
