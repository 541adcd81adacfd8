package cafe.woden.bansync.app.commands;

import java.util.List;
import java.util.Objects;

/** A titled reply with optional named fields, rendered by the chat adapter. */
public record CommandReply(String title, String description, List<Field> fields) {

  public record Field(String name, String value) {}

  public CommandReply {
    title = Objects.toString(title, "");
    description = Objects.toString(description, "");
    fields = fields == null ? List.of() : List.copyOf(fields);
  }

  public static CommandReply of(String title, String description) {
    return new CommandReply(title, description, List.of());
  }
}
