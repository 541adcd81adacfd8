package cafe.woden.bansync.app;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import cafe.woden.bansync.app.api.CallerContext;
import cafe.woden.bansync.app.api.FailureKind;
import cafe.woden.bansync.app.api.LeaveOutcome;
import cafe.woden.bansync.app.api.OperationResult;
import cafe.woden.bansync.banlog.api.BanLogQueryPort;
import cafe.woden.bansync.banlog.api.BanRecord;
import cafe.woden.bansync.network.api.NetworkCreateResult;
import cafe.woden.bansync.network.api.NetworkJoinResult;
import cafe.woden.bansync.network.api.NetworkLeaveResult;
import cafe.woden.bansync.network.api.NetworkRegistryCommandPort;
import cafe.woden.bansync.network.api.NetworkRegistryQueryPort;
import cafe.woden.bansync.store.api.DocumentStoreException;
import cafe.woden.bansync.sync.api.PrivilegeOraclePort;
import cafe.woden.bansync.sync.api.SyncBanOutcome;
import cafe.woden.bansync.sync.api.SyncBanPort;
import cafe.woden.bansync.sync.api.SyncBanRequest;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

class BanSyncServiceTest {

  private static final CallerContext ADMIN = new CallerContext("111", "Guild A", "7", "mod");
  private static final CallerContext MEMBER = new CallerContext("111", "Guild A", "8", "user");

  private final NetworkRegistryCommandPort commands = mock(NetworkRegistryCommandPort.class);
  private final NetworkRegistryQueryPort queries = mock(NetworkRegistryQueryPort.class);
  private final BanLogQueryPort banLog = mock(BanLogQueryPort.class);
  private final SyncBanPort syncBan = mock(SyncBanPort.class);
  private final PrivilegeOraclePort privileges = mock(PrivilegeOraclePort.class);

  private BanSyncService service;

  @BeforeEach
  void setUp() {
    service = new BanSyncService(commands, queries, banLog, syncBan, privileges);
    when(privileges.isPrivileged("7", "111")).thenReturn(true);
  }

  @Test
  void unprivilegedCallerIsDeniedForEveryOperation() {
    assertDenied(service.createNetwork(MEMBER, "alliance"));
    assertDenied(service.joinNetwork(MEMBER, "alliance"));
    assertDenied(service.leaveNetwork(MEMBER, "alliance"));
    assertDenied(service.listNetworksFor(MEMBER));
    assertDenied(service.recentBans(MEMBER, 5));

    verifyNoInteractions(commands, queries, banLog);
  }

  @Test
  void createMapsRegistryResults() {
    when(commands.create("alliance", "111")).thenReturn(NetworkCreateResult.CREATED);
    when(commands.create("taken", "111")).thenReturn(NetworkCreateResult.ALREADY_EXISTS);

    assertThat(service.createNetwork(ADMIN, "alliance")).isEqualTo(OperationResult.ok("alliance"));
    OperationResult<String> taken = service.createNetwork(ADMIN, "taken");
    assertThat(taken)
        .isEqualTo(
            OperationResult.failed(FailureKind.ALREADY_EXISTS, "Network 'taken' already exists."));
  }

  @Test
  void joinMapsRegistryResults() {
    when(commands.join("alliance", "111")).thenReturn(NetworkJoinResult.JOINED);
    when(commands.join("missing", "111")).thenReturn(NetworkJoinResult.NOT_FOUND);
    when(commands.join("mine", "111")).thenReturn(NetworkJoinResult.ALREADY_MEMBER);

    assertThat(service.joinNetwork(ADMIN, "alliance").isOk()).isTrue();
    assertThat(failureKind(service.joinNetwork(ADMIN, "missing"))).isEqualTo(FailureKind.NOT_FOUND);
    assertThat(service.joinNetwork(ADMIN, "mine"))
        .isEqualTo(
            OperationResult.failed(
                FailureKind.ALREADY_MEMBER,
                "This server is already part of the 'mine' network."));
  }

  @Test
  void leaveDistinguishesDeletion() {
    when(commands.leave("a", "111")).thenReturn(NetworkLeaveResult.LEFT);
    when(commands.leave("b", "111")).thenReturn(NetworkLeaveResult.DELETED);
    when(commands.leave("c", "111")).thenReturn(NetworkLeaveResult.NOT_MEMBER);
    when(commands.leave("d", "111")).thenReturn(NetworkLeaveResult.NOT_FOUND);

    assertThat(service.leaveNetwork(ADMIN, "a")).isEqualTo(OperationResult.ok(LeaveOutcome.LEFT));
    assertThat(service.leaveNetwork(ADMIN, "b"))
        .isEqualTo(OperationResult.ok(LeaveOutcome.DELETED));
    assertThat(failureKind(service.leaveNetwork(ADMIN, "c"))).isEqualTo(FailureKind.NOT_MEMBER);
    assertThat(failureKind(service.leaveNetwork(ADMIN, "d"))).isEqualTo(FailureKind.NOT_FOUND);
  }

  @Test
  void blankNetworkNameIsInvalidAndNeverReachesRegistry() {
    assertThat(failureKind(service.createNetwork(ADMIN, "  ")))
        .isEqualTo(FailureKind.INVALID_ARGUMENT);
    assertThat(failureKind(service.joinNetwork(ADMIN, null)))
        .isEqualTo(FailureKind.INVALID_ARGUMENT);
    verifyNoInteractions(commands);
  }

  @Test
  void storageFailureBecomesPersistenceFailure() {
    when(commands.create(anyString(), anyString()))
        .thenThrow(new DocumentStoreException("sync_networks.json", "disk full"));
    when(banLog.recent(anyInt())).thenThrow(new DocumentStoreException("ban_log.json", "gone"));

    assertThat(service.createNetwork(ADMIN, "alliance"))
        .isEqualTo(OperationResult.failed(FailureKind.PERSISTENCE_FAILURE, "disk full"));
    assertThat(failureKind(service.recentBans(ADMIN, 5)))
        .isEqualTo(FailureKind.PERSISTENCE_FAILURE);
  }

  @Test
  void privilegeOracleErrorIsTreatedAsDenied() {
    when(privileges.isPrivileged("7", "111")).thenThrow(new IllegalStateException("offline"));

    assertDenied(service.listNetworksFor(ADMIN));
  }

  @Test
  void listAndHistoryDelegate() {
    BanRecord record =
        new BanRecord("42", "x", "r", "111", "A", "7", "mod", Instant.EPOCH, List.of("a"));
    when(queries.networksContaining("111")).thenReturn(List.of("a", "b"));
    when(banLog.recent(3)).thenReturn(List.of(record));

    assertThat(service.listNetworksFor(ADMIN)).isEqualTo(OperationResult.ok(List.of("a", "b")));
    assertThat(service.recentBans(ADMIN, 3)).isEqualTo(OperationResult.ok(List.of(record)));
    assertThat(failureKind(service.recentBans(ADMIN, -1))).isEqualTo(FailureKind.INVALID_ARGUMENT);
  }

  @Test
  void syncBanBuildsRequestFromCaller() {
    SyncBanOutcome expected = new SyncBanOutcome.NoNetworks();
    when(syncBan.syncBan(any(SyncBanRequest.class))).thenReturn(expected);

    assertThat(service.syncBan(ADMIN, " 42 ", "spam")).isSameAs(expected);

    ArgumentCaptor<SyncBanRequest> captor = ArgumentCaptor.forClass(SyncBanRequest.class);
    verify(syncBan).syncBan(captor.capture());
    assertThat(captor.getValue())
        .isEqualTo(new SyncBanRequest("111", "Guild A", "7", "mod", "42", "spam"));
  }

  @Test
  void syncBanWithoutUserIsInvalid() {
    assertThat(service.syncBan(ADMIN, " ", "spam"))
        .isInstanceOf(SyncBanOutcome.InvalidRequest.class);
    assertThat(service.syncBan(new CallerContext("", "", "7", ""), "42", "spam"))
        .isInstanceOf(SyncBanOutcome.InvalidRequest.class);
    verify(syncBan, never()).syncBan(any());
  }

  private static void assertDenied(OperationResult<?> result) {
    assertThat(failureKind(result)).isEqualTo(FailureKind.PERMISSION_DENIED);
  }

  private static FailureKind failureKind(OperationResult<?> result) {
    assertThat(result).isInstanceOf(OperationResult.Failed.class);
    return ((OperationResult.Failed<?>) result).kind();
  }
}
