package cafe.woden.bansync.app.commands;

public sealed interface ParsedCommand
    permits ParsedCommand.CreateNetwork,
        ParsedCommand.JoinNetwork,
        ParsedCommand.LeaveNetwork,
        ParsedCommand.ListNetworks,
        ParsedCommand.SyncBan,
        ParsedCommand.BanHistory,
        ParsedCommand.Help,
        ParsedCommand.Usage,
        ParsedCommand.Unknown,
        ParsedCommand.NotACommand {

  /** create_network &lt;network_name&gt; */
  record CreateNetwork(String networkName) implements ParsedCommand {}

  /** join_network &lt;network_name&gt; */
  record JoinNetwork(String networkName) implements ParsedCommand {}

  /** leave_network &lt;network_name&gt; */
  record LeaveNetwork(String networkName) implements ParsedCommand {}

  /** list_networks */
  record ListNetworks() implements ParsedCommand {}

  /** syncban &lt;user_id&gt; [reason...]; {@code reason} is empty when omitted. */
  record SyncBan(String userId, String reason) implements ParsedCommand {}

  /** ban_history [limit]; {@code limit} is null when omitted. */
  record BanHistory(Integer limit) implements ParsedCommand {}

  /** synchelp */
  record Help() implements ParsedCommand {}

  /** A known command with missing or malformed arguments. */
  record Usage(String command, String usage) implements ParsedCommand {}

  record Unknown(String command) implements ParsedCommand {}

  /** The line does not start with the command prefix. */
  record NotACommand() implements ParsedCommand {}
}
