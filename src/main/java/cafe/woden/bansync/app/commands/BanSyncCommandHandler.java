package cafe.woden.bansync.app.commands;

import cafe.woden.bansync.app.BanSyncService;
import cafe.woden.bansync.app.api.CallerContext;
import cafe.woden.bansync.app.api.FailureKind;
import cafe.woden.bansync.app.api.LeaveOutcome;
import cafe.woden.bansync.app.api.OperationResult;
import cafe.woden.bansync.banlog.api.BanRecord;
import cafe.woden.bansync.config.BanSyncProperties;
import cafe.woden.bansync.sync.api.BanActuatorException;
import cafe.woden.bansync.sync.api.SyncBanOutcome;
import cafe.woden.bansync.sync.api.SyncBanReport;
import cafe.woden.bansync.util.IsoTimestamps;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Executes chat commands against {@link BanSyncService} and renders the replies.
 *
 * <p>Returns {@link Optional#empty()} for lines that are not commands and for unknown commands, so
 * the chat adapter stays silent for them.
 */
@Component
public class BanSyncCommandHandler {

  private static final Logger log = LoggerFactory.getLogger(BanSyncCommandHandler.class);

  private final CommandParser parser;
  private final BanSyncService service;
  private final int historyDefaultLimit;
  private final int historyMaxLimit;
  private final ZoneId displayZone;

  public BanSyncCommandHandler(
      CommandParser parser, BanSyncService service, BanSyncProperties props) {
    this.parser = Objects.requireNonNull(parser, "parser");
    this.service = Objects.requireNonNull(service, "service");
    this.historyDefaultLimit = props.historyDefaultLimit();
    this.historyMaxLimit = props.historyMaxLimit();
    this.displayZone = props.zone();
  }

  public Optional<CommandReply> handle(CallerContext caller, String rawLine) {
    ParsedCommand cmd = parser.parse(rawLine);

    if (cmd instanceof ParsedCommand.NotACommand) return Optional.empty();
    if (cmd instanceof ParsedCommand.Unknown u) {
      log.debug("[bansync] Ignoring unknown command '{}'", u.command());
      return Optional.empty();
    }
    if (cmd instanceof ParsedCommand.Usage u) {
      return Optional.of(CommandReply.of("Missing Argument", "Usage: " + u.usage()));
    }
    if (cmd instanceof ParsedCommand.Help) return Optional.of(help());

    if (cmd instanceof ParsedCommand.CreateNetwork c) {
      return Optional.of(
          render(
              service.createNetwork(caller, c.networkName()),
              name ->
                  CommandReply.of(
                      "Network Created",
                      "✅ Ban sync network '" + name + "' created successfully!")));
    }
    if (cmd instanceof ParsedCommand.JoinNetwork j) {
      return Optional.of(
          render(
              service.joinNetwork(caller, j.networkName()),
              name ->
                  CommandReply.of(
                      "Network Joined",
                      "✅ Joined ban sync network '" + name + "' successfully!")));
    }
    if (cmd instanceof ParsedCommand.LeaveNetwork l) {
      String name = l.networkName();
      return Optional.of(
          render(
              service.leaveNetwork(caller, name),
              outcome ->
                  outcome == LeaveOutcome.DELETED
                      ? CommandReply.of(
                          "Network Deleted",
                          "Network '" + name + "' has been deleted as it has no more servers.")
                      : CommandReply.of(
                          "Left Network", "Left ban sync network '" + name + "' successfully.")));
    }
    if (cmd instanceof ParsedCommand.ListNetworks) {
      return Optional.of(render(service.listNetworksFor(caller), this::networkList));
    }
    if (cmd instanceof ParsedCommand.BanHistory h) {
      int limit = h.limit() == null ? historyDefaultLimit : Math.min(h.limit(), historyMaxLimit);
      return Optional.of(render(service.recentBans(caller, limit), this::history));
    }
    if (cmd instanceof ParsedCommand.SyncBan s) {
      return Optional.of(syncBanReply(service.syncBan(caller, s.userId(), s.reason())));
    }
    return Optional.empty();
  }

  private <T> CommandReply render(
      OperationResult<T> result, Function<T, CommandReply> onOk) {
    if (result instanceof OperationResult.Ok<T> ok) {
      return onOk.apply(ok.value());
    }
    OperationResult.Failed<T> failed = (OperationResult.Failed<T>) result;
    return CommandReply.of(failureTitle(failed.kind()), failureText(failed));
  }

  private CommandReply networkList(List<String> names) {
    if (names.isEmpty()) {
      return CommandReply.of("No Networks", "This server is not part of any ban sync networks.");
    }
    StringBuilder sb = new StringBuilder("This server is part of the following ban sync networks:");
    for (String n : names) sb.append("\n- ").append(n);
    return CommandReply.of("Server Networks", sb.toString());
  }

  private CommandReply history(List<BanRecord> records) {
    if (records.isEmpty()) return CommandReply.of("No History", "No ban sync history found.");
    List<CommandReply.Field> fields = new ArrayList<>();
    for (BanRecord r : records) {
      String value =
          "**Reason:** "
              + r.reason()
              + "\n**Initiated by:** "
              + r.initiatorActorName()
              + " in "
              + r.initiatorServerName()
              + "\n**Time:** "
              + IsoTimestamps.display(r.timestamp(), displayZone)
              + "\n**Networks:** "
              + String.join(", ", r.networks());
      fields.add(new CommandReply.Field(r.userDisplayName() + " (ID: " + r.userId() + ")", value));
    }
    return new CommandReply("Recent Ban Sync Activity", "", fields);
  }

  private CommandReply syncBanReply(SyncBanOutcome outcome) {
    if (outcome instanceof SyncBanOutcome.Synced s) {
      SyncBanReport r = s.report();
      return CommandReply.of(
          "Ban Synced",
          "✅ Banned "
              + r.userDisplayName()
              + " from this server.\n✅ Ban synced across "
              + r.totalSuccessCount()
              + " servers in "
              + r.networksAffected()
              + " networks.");
    }
    if (outcome instanceof SyncBanOutcome.PermissionDenied) {
      return CommandReply.of(
          "Permission Denied", "You need administrator permissions to use this command.");
    }
    if (outcome instanceof SyncBanOutcome.NoNetworks) {
      return CommandReply.of("No Networks", "This server is not part of any ban sync networks.");
    }
    if (outcome instanceof SyncBanOutcome.InvalidRequest i) {
      return CommandReply.of("Missing Argument", i.message());
    }
    if (outcome instanceof SyncBanOutcome.LocalBanFailed f) {
      if (f.kind() == BanActuatorException.Kind.FORBIDDEN) {
        return CommandReply.of(
            "Permission Error", "I don't have permission to ban users in this server.");
      }
      return CommandReply.of("Ban Failed", "Failed to ban user: " + f.message());
    }
    if (outcome instanceof SyncBanOutcome.AuditFailed a) {
      SyncBanReport r = a.report();
      return CommandReply.of(
          "Ban Synced (Not Recorded)",
          "Ban synced across "
              + r.totalSuccessCount()
              + " servers in "
              + r.networksAffected()
              + " networks, but it could not be saved to the ban history: "
              + a.message());
    }
    SyncBanOutcome.RegistryUnavailable u = (SyncBanOutcome.RegistryUnavailable) outcome;
    return CommandReply.of("Storage Error", "Could not read the network registry: " + u.message());
  }

  private CommandReply help() {
    String p = parser.prefix();
    List<CommandReply.Field> fields =
        List.of(
            new CommandReply.Field(
                p + "create_network <network_name>", "Create a new ban sync network"),
            new CommandReply.Field(
                p + "join_network <network_name>", "Join an existing ban sync network"),
            new CommandReply.Field(p + "leave_network <network_name>", "Leave a ban sync network"),
            new CommandReply.Field(p + "list_networks", "List all networks this server is part of"),
            new CommandReply.Field(
                p + "syncban <user_id> [reason]",
                "Ban a user and sync the ban across all networks"),
            new CommandReply.Field(
                p + "ban_history [limit]",
                "Show recent ban sync activity (default: "
                    + historyDefaultLimit
                    + " most recent)"));
    return new CommandReply(
        "Ban Sync Bot Help", "Commands for managing ban synchronization across servers", fields);
  }

  private static String failureTitle(FailureKind kind) {
    switch (kind) {
      case PERMISSION_DENIED:
        return "Permission Denied";
      case NOT_FOUND:
        return "Network Not Found";
      case ALREADY_EXISTS:
        return "Network Already Exists";
      case ALREADY_MEMBER:
        return "Already Joined";
      case NOT_MEMBER:
        return "Not In Network";
      case PERSISTENCE_FAILURE:
        return "Storage Error";
      default:
        return "Invalid Command";
    }
  }

  private static String failureText(OperationResult.Failed<?> failed) {
    if (failed.kind() == FailureKind.PERSISTENCE_FAILURE) {
      return "Could not access ban sync data: " + failed.message();
    }
    return failed.message();
  }
}
