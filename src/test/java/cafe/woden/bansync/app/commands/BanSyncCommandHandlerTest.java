package cafe.woden.bansync.app.commands;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

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
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.Test;

class BanSyncCommandHandlerTest {

  private static final CallerContext CALLER = new CallerContext("111", "Guild A", "7", "mod");

  private final BanSyncProperties props =
      new BanSyncProperties(null, null, null, null, null, null, null, null, null, null, "UTC");
  private final BanSyncService service = mock(BanSyncService.class);
  private final BanSyncCommandHandler handler =
      new BanSyncCommandHandler(new CommandParser(props), service, props);

  @Test
  void nonCommandsAndUnknownCommandsStaySilent() {
    assertThat(handler.handle(CALLER, "just chatting")).isEmpty();
    assertThat(handler.handle(CALLER, "!ping")).isEmpty();
    verifyNoInteractions(service);
  }

  @Test
  void createRepliesWithSuccessOrFailureTitle() {
    when(service.createNetwork(CALLER, "alliance")).thenReturn(OperationResult.ok("alliance"));
    when(service.createNetwork(CALLER, "taken"))
        .thenReturn(
            OperationResult.failed(FailureKind.ALREADY_EXISTS, "Network 'taken' already exists."));

    CommandReply created = handler.handle(CALLER, "!create_network alliance").orElseThrow();
    CommandReply taken = handler.handle(CALLER, "!create_network taken").orElseThrow();

    assertThat(created.title()).isEqualTo("Network Created");
    assertThat(created.description())
        .isEqualTo("✅ Ban sync network 'alliance' created successfully!");
    assertThat(taken.title()).isEqualTo("Network Already Exists");
    assertThat(taken.description()).isEqualTo("Network 'taken' already exists.");
  }

  @Test
  void permissionDeniedUsesSharedReply() {
    when(service.joinNetwork(CALLER, "alliance"))
        .thenReturn(
            OperationResult.failed(
                FailureKind.PERMISSION_DENIED,
                "You need administrator permissions to use this command."));

    CommandReply reply = handler.handle(CALLER, "!join_network alliance").orElseThrow();

    assertThat(reply.title()).isEqualTo("Permission Denied");
    assertThat(reply.description())
        .isEqualTo("You need administrator permissions to use this command.");
  }

  @Test
  void leaveRepliesDifferWhenNetworkIsDeleted() {
    when(service.leaveNetwork(CALLER, "a")).thenReturn(OperationResult.ok(LeaveOutcome.LEFT));
    when(service.leaveNetwork(CALLER, "b")).thenReturn(OperationResult.ok(LeaveOutcome.DELETED));

    assertThat(handler.handle(CALLER, "!leave_network a").orElseThrow().title())
        .isEqualTo("Left Network");
    CommandReply deleted = handler.handle(CALLER, "!leave_network b").orElseThrow();
    assertThat(deleted.title()).isEqualTo("Network Deleted");
    assertThat(deleted.description())
        .isEqualTo("Network 'b' has been deleted as it has no more servers.");
  }

  @Test
  void listNetworksRendersBulletsOrEmptyState() {
    when(service.listNetworksFor(CALLER))
        .thenReturn(OperationResult.ok(List.of("a", "b")))
        .thenReturn(OperationResult.ok(List.of()));

    CommandReply some = handler.handle(CALLER, "!list_networks").orElseThrow();
    CommandReply none = handler.handle(CALLER, "!list_networks").orElseThrow();

    assertThat(some.description())
        .isEqualTo("This server is part of the following ban sync networks:\n- a\n- b");
    assertThat(none.title()).isEqualTo("No Networks");
  }

  @Test
  void syncbanSuccessReportsCounts() {
    SyncBanReport report = new SyncBanReport("42", "Spammer", 3, 2, List.of("a", "b"), 3);
    when(service.syncBan(CALLER, "42", "spam bot"))
        .thenReturn(new SyncBanOutcome.Synced(report));

    CommandReply reply = handler.handle(CALLER, "!syncban 42 spam bot").orElseThrow();

    assertThat(reply.title()).isEqualTo("Ban Synced");
    assertThat(reply.description())
        .isEqualTo(
            "✅ Banned Spammer from this server.\n✅ Ban synced across 3 servers in 2 networks.");
  }

  @Test
  void syncbanFailuresMapToReplies() {
    when(service.syncBan(eq(CALLER), eq("1"), anyString()))
        .thenReturn(
            new SyncBanOutcome.LocalBanFailed(BanActuatorException.Kind.FORBIDDEN, "Missing"));
    when(service.syncBan(eq(CALLER), eq("2"), anyString()))
        .thenReturn(new SyncBanOutcome.LocalBanFailed(BanActuatorException.Kind.OTHER, "boom"));
    when(service.syncBan(eq(CALLER), eq("3"), anyString()))
        .thenReturn(new SyncBanOutcome.NoNetworks());

    assertThat(handler.handle(CALLER, "!syncban 1").orElseThrow().title())
        .isEqualTo("Permission Error");
    assertThat(handler.handle(CALLER, "!syncban 2").orElseThrow().description())
        .isEqualTo("Failed to ban user: boom");
    assertThat(handler.handle(CALLER, "!syncban 3").orElseThrow().description())
        .isEqualTo("This server is not part of any ban sync networks.");
  }

  @Test
  void syncbanWithoutUserShowsUsage() {
    CommandReply reply = handler.handle(CALLER, "!syncban").orElseThrow();

    assertThat(reply.description()).isEqualTo("Usage: !syncban <user_id> [reason]");
    verifyNoInteractions(service);
  }

  @Test
  void historyDefaultsToFiveAndClampsToMaximum() {
    when(service.recentBans(any(), anyInt())).thenReturn(OperationResult.ok(List.of()));

    CommandReply empty = handler.handle(CALLER, "!ban_history").orElseThrow();
    handler.handle(CALLER, "!ban_history 500");

    assertThat(empty.description()).isEqualTo("No ban sync history found.");
    verify(service).recentBans(CALLER, 5);
    verify(service).recentBans(CALLER, 25);
  }

  @Test
  void historyEntriesRenderOneFieldPerBan() {
    BanRecord record =
        new BanRecord(
            "42",
            "Spammer#0001",
            "raiding",
            "111",
            "Guild A",
            "7",
            "mod",
            Instant.parse("2024-06-01T10:15:30.250Z"),
            List.of("a", "b"));
    when(service.recentBans(CALLER, 2)).thenReturn(OperationResult.ok(List.of(record)));

    CommandReply reply = handler.handle(CALLER, "!ban_history 2").orElseThrow();

    assertThat(reply.title()).isEqualTo("Recent Ban Sync Activity");
    assertThat(reply.fields()).hasSize(1);
    CommandReply.Field field = reply.fields().get(0);
    assertThat(field.name()).isEqualTo("Spammer#0001 (ID: 42)");
    assertThat(field.value())
        .isEqualTo(
            "**Reason:** raiding\n"
                + "**Initiated by:** mod in Guild A\n"
                + "**Time:** 2024-06-01 10:15:30\n"
                + "**Networks:** a, b");
  }

  @Test
  void helpListsEveryCommandWithPrefix() {
    CommandReply help = handler.handle(CALLER, "!synchelp").orElseThrow();

    assertThat(help.fields())
        .extracting(CommandReply.Field::name)
        .containsExactly(
            "!create_network <network_name>",
            "!join_network <network_name>",
            "!leave_network <network_name>",
            "!list_networks",
            "!syncban <user_id> [reason]",
            "!ban_history [limit]");
  }
}
