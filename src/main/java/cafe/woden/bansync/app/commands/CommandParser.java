package cafe.woden.bansync.app.commands;

import cafe.woden.bansync.config.BanSyncProperties;
import java.util.Locale;
import java.util.Objects;
import java.util.function.Function;
import org.springframework.stereotype.Component;

/**
 * Parses a chat line into a {@link ParsedCommand}.
 *
 * <p>Command names are matched case-insensitively. Arguments are whitespace separated; for {@code
 * syncban} everything after the user id is the reason. Extra arguments to single-argument commands
 * are ignored.
 */
@Component
public class CommandParser {

  private final String prefix;

  public CommandParser(BanSyncProperties props) {
    this.prefix = props.commandPrefix();
  }

  public String prefix() {
    return prefix;
  }

  public ParsedCommand parse(String raw) {
    String line = raw == null ? "" : raw.trim();
    if (!line.startsWith(prefix) || line.length() == prefix.length()) {
      return new ParsedCommand.NotACommand();
    }

    String body = line.substring(prefix.length()).trim();
    String name = firstToken(body).toLowerCase(Locale.ROOT);
    String rest = afterFirstToken(body);
    if (name.isEmpty()) return new ParsedCommand.NotACommand();

    switch (name) {
      case "create_network":
        return withNetworkName(name, rest, ParsedCommand.CreateNetwork::new);
      case "join_network":
        return withNetworkName(name, rest, ParsedCommand.JoinNetwork::new);
      case "leave_network":
        return withNetworkName(name, rest, ParsedCommand.LeaveNetwork::new);
      case "list_networks":
        return new ParsedCommand.ListNetworks();
      case "syncban":
        {
          String userId = firstToken(rest);
          if (userId.isEmpty()) {
            return new ParsedCommand.Usage(name, prefix + "syncban <user_id> [reason]");
          }
          return new ParsedCommand.SyncBan(userId, afterFirstToken(rest));
        }
      case "ban_history":
        {
          String limit = firstToken(rest);
          if (limit.isEmpty()) return new ParsedCommand.BanHistory(null);
          int n = parsePositiveInt(limit);
          if (n <= 0) return new ParsedCommand.Usage(name, prefix + "ban_history [limit]");
          return new ParsedCommand.BanHistory(n);
        }
      case "synchelp":
        return new ParsedCommand.Help();
      default:
        return new ParsedCommand.Unknown(name);
    }
  }

  private ParsedCommand withNetworkName(
      String name, String rest, Function<String, ParsedCommand> ctor) {
    String networkName = firstToken(rest);
    if (networkName.isEmpty()) {
      return new ParsedCommand.Usage(name, prefix + name + " <network_name>");
    }
    return ctor.apply(networkName);
  }

  /** Returns the parsed value, or -1 if {@code token} is not a positive integer. */
  private static int parsePositiveInt(String token) {
    try {
      int n = Integer.parseInt(token);
      return n > 0 ? n : -1;
    } catch (NumberFormatException e) {
      return -1;
    }
  }

  private static String firstToken(String s) {
    String t = Objects.toString(s, "").trim();
    if (t.isEmpty()) return "";
    int sp = indexOfWhitespace(t);
    return sp < 0 ? t : t.substring(0, sp);
  }

  private static String afterFirstToken(String s) {
    String t = Objects.toString(s, "").trim();
    int sp = indexOfWhitespace(t);
    return sp < 0 ? "" : t.substring(sp + 1).trim();
  }

  private static int indexOfWhitespace(String s) {
    for (int i = 0; i < s.length(); i++) {
      if (Character.isWhitespace(s.charAt(i))) return i;
    }
    return -1;
  }
}
