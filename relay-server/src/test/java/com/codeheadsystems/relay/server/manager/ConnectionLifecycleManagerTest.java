package com.codeheadsystems.relay.server.manager;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.codeheadsystems.relay.model.IdentityClaims;
import com.codeheadsystems.relay.model.RelayErrorKind;
import com.codeheadsystems.relay.server.auth.AuthenticationFailedException;
import com.codeheadsystems.relay.server.auth.IdentityVerifier;
import com.codeheadsystems.relay.server.exceptions.RelayException;
import com.codeheadsystems.relay.server.presence.ConnectionHandle;
import com.codeheadsystems.relay.server.presence.ConnectionState;
import com.codeheadsystems.relay.server.presence.InMemoryPresenceDirectory;
import com.codeheadsystems.relay.server.presence.PresenceDirectory;
import com.codeheadsystems.relay.server.presence.RecordingEventSink;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class ConnectionLifecycleManagerTest {

  private static final IdentityClaims ALICE = new IdentityClaims("1", "a@x.com", "user");
  private static final IdentityClaims ALICE_OTHER_EMAIL = new IdentityClaims("1", "alice@x.com", "user");

  @Mock private IdentityVerifier verifier;

  private PresenceDirectory directory;

  @BeforeEach
  void setUp() {
    directory = new InMemoryPresenceDirectory();
  }

  private ConnectionLifecycleManager manager(DuplicateSessionPolicy policy) {
    return new ConnectionLifecycleManager(verifier, directory, policy);
  }

  @Test
  void onConnect_doesNotTouchDirectory() {
    ConnectionHandle handle = manager(DuplicateSessionPolicy.REPLACE).onConnect(new RecordingEventSink());

    assertThat(handle.state()).isEqualTo(ConnectionState.CONNECTED);
    assertThat(directory.size()).isZero();
  }

  @Test
  void onAuthenticate_success_bindsEmail() throws Exception {
    when(verifier.verify("good")).thenReturn(ALICE);
    ConnectionLifecycleManager manager = manager(DuplicateSessionPolicy.REPLACE);
    ConnectionHandle handle = manager.onConnect(new RecordingEventSink());

    assertThat(manager.onAuthenticate(handle, "good")).isEqualTo(ALICE);
    assertThat(handle.state()).isEqualTo(ConnectionState.AUTHENTICATED);
    assertThat(directory.lookup("a@x.com")).containsSame(handle);
  }

  @Test
  void onAuthenticate_failure_leavesStateUntouched() throws Exception {
    when(verifier.verify(anyString())).thenThrow(new AuthenticationFailedException("bad"));
    ConnectionLifecycleManager manager = manager(DuplicateSessionPolicy.REPLACE);
    ConnectionHandle handle = manager.onConnect(new RecordingEventSink());

    assertThatThrownBy(() -> manager.onAuthenticate(handle, "bad"))
        .isInstanceOf(RelayException.class)
        .hasMessage("Invalid or expired token")
        .extracting(e -> ((RelayException) e).kind())
        .isEqualTo(RelayErrorKind.AUTH_FAILURE);
    assertThat(handle.state()).isEqualTo(ConnectionState.CONNECTED);
    assertThat(directory.size()).isZero();
  }

  @Test
  void replacePolicy_lastBindWins() throws Exception {
    when(verifier.verify("good")).thenReturn(ALICE);
    ConnectionLifecycleManager manager = manager(DuplicateSessionPolicy.REPLACE);
    RecordingEventSink firstSink = new RecordingEventSink();
    ConnectionHandle first = manager.onConnect(firstSink);
    ConnectionHandle second = manager.onConnect(new RecordingEventSink());

    manager.onAuthenticate(first, "good");
    manager.onAuthenticate(second, "good");

    assertThat(directory.lookup("a@x.com")).containsSame(second);
    assertThat(firstSink.closeReason()).isNull();
  }

  @Test
  void evictPolicy_closesOlderConnection() throws Exception {
    when(verifier.verify("good")).thenReturn(ALICE);
    ConnectionLifecycleManager manager = manager(DuplicateSessionPolicy.EVICT);
    RecordingEventSink firstSink = new RecordingEventSink();
    ConnectionHandle first = manager.onConnect(firstSink);
    ConnectionHandle second = manager.onConnect(new RecordingEventSink());

    manager.onAuthenticate(first, "good");
    manager.onAuthenticate(second, "good");

    assertThat(directory.lookup("a@x.com")).containsSame(second);
    assertThat(firstSink.closeReason()).isEqualTo(ConnectionLifecycleManager.EVICTED);

    // The transport reports the eviction back; the newer entry must survive.
    manager.onDisconnect(first);
    assertThat(directory.lookup("a@x.com")).containsSame(second);
  }

  @Test
  void rejectPolicy_refusesSecondSession() throws Exception {
    when(verifier.verify("good")).thenReturn(ALICE);
    ConnectionLifecycleManager manager = manager(DuplicateSessionPolicy.REJECT);
    ConnectionHandle first = manager.onConnect(new RecordingEventSink());
    ConnectionHandle second = manager.onConnect(new RecordingEventSink());
    manager.onAuthenticate(first, "good");

    assertThatThrownBy(() -> manager.onAuthenticate(second, "good"))
        .isInstanceOf(RelayException.class)
        .hasMessage(ConnectionLifecycleManager.ALREADY_CONNECTED);
    assertThat(second.state()).isEqualTo(ConnectionState.CONNECTED);
    assertThat(directory.lookup("a@x.com")).containsSame(first);
  }

  @Test
  void rejectPolicy_allowsReauthenticationOfSameHandle() throws Exception {
    when(verifier.verify("good")).thenReturn(ALICE);
    ConnectionLifecycleManager manager = manager(DuplicateSessionPolicy.REJECT);
    ConnectionHandle handle = manager.onConnect(new RecordingEventSink());

    manager.onAuthenticate(handle, "good");
    manager.onAuthenticate(handle, "good");

    assertThat(directory.lookup("a@x.com")).containsSame(handle);
  }

  @Test
  void reauthenticateAsDifferentEmail_removesOldEntry() throws Exception {
    when(verifier.verify("first")).thenReturn(ALICE);
    when(verifier.verify("second")).thenReturn(ALICE_OTHER_EMAIL);
    ConnectionLifecycleManager manager = manager(DuplicateSessionPolicy.REPLACE);
    ConnectionHandle handle = manager.onConnect(new RecordingEventSink());

    manager.onAuthenticate(handle, "first");
    manager.onAuthenticate(handle, "second");

    assertThat(directory.lookup("a@x.com")).isEmpty();
    assertThat(directory.lookup("alice@x.com")).containsSame(handle);
  }

  @Test
  void onAuthenticate_closedHandle_isRefusedAndNotBound() throws Exception {
    when(verifier.verify("good")).thenReturn(ALICE);
    ConnectionLifecycleManager manager = manager(DuplicateSessionPolicy.REPLACE);
    ConnectionHandle handle = manager.onConnect(new RecordingEventSink());
    manager.onDisconnect(handle);

    assertThatThrownBy(() -> manager.onAuthenticate(handle, "good"))
        .isInstanceOf(RelayException.class);
    assertThat(directory.size()).isZero();
  }

  @Test
  void rejectPolicy_closeDuringBind_leavesNoEntryForClosedHandle() throws Exception {
    IdentityClaims bob = new IdentityClaims("2", "b@x.com", "user");
    when(verifier.verify("alice")).thenReturn(ALICE);
    when(verifier.verify("bob")).thenReturn(bob);
    ClosingDirectory closing = new ClosingDirectory(directory);
    ConnectionLifecycleManager manager =
        new ConnectionLifecycleManager(verifier, closing, DuplicateSessionPolicy.REJECT);
    closing.manager = manager;
    ConnectionHandle bobOwner = manager.onConnect(new RecordingEventSink());
    ConnectionHandle handle = manager.onConnect(new RecordingEventSink());
    manager.onAuthenticate(bobOwner, "bob");
    manager.onAuthenticate(handle, "alice");

    closing.closeOnBind = handle;
    assertThatThrownBy(() -> manager.onAuthenticate(handle, "bob"))
        .isInstanceOf(RelayException.class)
        .hasMessage(ConnectionLifecycleManager.ALREADY_CONNECTED);

    assertThat(handle.isClosed()).isTrue();
    assertThat(directory.lookup("a@x.com")).isEmpty();
    assertThat(directory.lookup("b@x.com")).containsSame(bobOwner);
    assertThat(manager.onlineCount()).isEqualTo(1);
  }

  @Test
  void replacePolicy_closeDuringBind_unbindsBothKeys() throws Exception {
    when(verifier.verify("first")).thenReturn(ALICE);
    when(verifier.verify("second")).thenReturn(ALICE_OTHER_EMAIL);
    ClosingDirectory closing = new ClosingDirectory(directory);
    ConnectionLifecycleManager manager =
        new ConnectionLifecycleManager(verifier, closing, DuplicateSessionPolicy.REPLACE);
    closing.manager = manager;
    ConnectionHandle handle = manager.onConnect(new RecordingEventSink());
    manager.onAuthenticate(handle, "first");

    closing.closeOnBind = handle;
    assertThatThrownBy(() -> manager.onAuthenticate(handle, "second"))
        .isInstanceOf(RelayException.class)
        .hasMessage(ConnectionLifecycleManager.CONNECTION_CLOSED);

    assertThat(directory.lookup("a@x.com")).isEmpty();
    assertThat(directory.lookup("alice@x.com")).isEmpty();
    assertThat(manager.onlineCount()).isZero();
  }

  @Test
  void reauthenticate_keepsPreviousIdentityUntilBindAccepted() throws Exception {
    when(verifier.verify("first")).thenReturn(ALICE);
    when(verifier.verify("second")).thenReturn(ALICE_OTHER_EMAIL);
    ClosingDirectory observing = new ClosingDirectory(directory);
    ConnectionLifecycleManager manager =
        new ConnectionLifecycleManager(verifier, observing, DuplicateSessionPolicy.REPLACE);
    ConnectionHandle handle = manager.onConnect(new RecordingEventSink());
    manager.onAuthenticate(handle, "first");

    observing.observe = handle;
    manager.onAuthenticate(handle, "second");

    assertThat(observing.identityDuringBind).isEqualTo(ALICE);
    assertThat(handle.identity()).contains(ALICE_OTHER_EMAIL);
  }

  @Test
  void onDisconnect_isIdempotentAndNeverRemovesNewerHandle() throws Exception {
    when(verifier.verify("good")).thenReturn(ALICE);
    ConnectionLifecycleManager manager = manager(DuplicateSessionPolicy.REPLACE);
    ConnectionHandle older = manager.onConnect(new RecordingEventSink());
    ConnectionHandle newer = manager.onConnect(new RecordingEventSink());
    manager.onAuthenticate(older, "good");
    manager.onAuthenticate(newer, "good");

    manager.onDisconnect(older);
    manager.onDisconnect(older);

    assertThat(older.state()).isEqualTo(ConnectionState.CLOSED);
    assertThat(directory.lookup("a@x.com")).containsSame(newer);

    manager.onDisconnect(newer);
    assertThat(directory.lookup("a@x.com")).isEmpty();
    assertThat(manager.onlineCount()).isZero();
  }

  @Test
  void onDisconnect_unauthenticatedHandle_doesNothing() {
    ConnectionLifecycleManager manager = manager(DuplicateSessionPolicy.REPLACE);
    ConnectionHandle handle = manager.onConnect(new RecordingEventSink());

    manager.onDisconnect(handle);

    assertThat(handle.isClosed()).isTrue();
    verifyNoInteractions(verifier);
  }

  /**
   * Delegating directory that can close a handle, or record its identity, while a bind for it
   * is in progress.
   */
  private static class ClosingDirectory implements PresenceDirectory {

    private final PresenceDirectory delegate;
    private ConnectionLifecycleManager manager;
    private ConnectionHandle closeOnBind;
    private ConnectionHandle observe;
    private IdentityClaims identityDuringBind;

    ClosingDirectory(PresenceDirectory delegate) {
      this.delegate = delegate;
    }

    private void duringBind(ConnectionHandle handle) {
      if (handle == observe) {
        identityDuringBind = handle.identity().orElse(null);
      }
      if (handle == closeOnBind) {
        manager.onDisconnect(handle);
      }
    }

    @Override
    public Optional<ConnectionHandle> bind(String key, ConnectionHandle handle) {
      duringBind(handle);
      return delegate.bind(key, handle);
    }

    @Override
    public Optional<ConnectionHandle> bindIfAbsent(String key, ConnectionHandle handle) {
      duringBind(handle);
      return delegate.bindIfAbsent(key, handle);
    }

    @Override
    public boolean replace(String key, ConnectionHandle expected, ConnectionHandle handle) {
      return delegate.replace(key, expected, handle);
    }

    @Override
    public Optional<ConnectionHandle> lookup(String key) {
      return delegate.lookup(key);
    }

    @Override
    public boolean unbind(String key, ConnectionHandle expected) {
      return delegate.unbind(key, expected);
    }

    @Override
    public int size() {
      return delegate.size();
    }
  }
}
