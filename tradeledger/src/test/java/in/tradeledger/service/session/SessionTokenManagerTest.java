package in.tradeledger.service.session;

import in.tradeledger.domain.broker.BrokerAccount;
import in.tradeledger.domain.common.ConfigException;
import in.tradeledger.infrastructure.broker.BrokerAuthenticationException;
import in.tradeledger.infrastructure.broker.BrokerGateway;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Unit tests for SessionTokenManager.
 *
 * Tests:
 * - Missing credentials fail before any remote call
 * - Successful login replaces the token
 * - Failed refresh keeps the previous token
 * - Account resolution by case-insensitive prefix and canTrade
 */
@ExtendWith(MockitoExtension.class)
class SessionTokenManagerTest {

    private static final Instant NOW = Instant.parse("2024-03-15T10:00:00Z");

    @Mock
    private BrokerGateway gateway;

    private BrokerSession session;
    private SessionTokenManager manager;

    @BeforeEach
    void setUp() {
        session = new BrokerSession();
        manager = newManager("trader", "key-123");
    }

    @AfterEach
    void tearDown() {
        manager.shutdown();
    }

    private SessionTokenManager newManager(String username, String apiKey) {
        return new SessionTokenManager(gateway, session, username, apiKey,
            Duration.ofHours(24), Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    void testMissingApiKeyFailsWithoutRemoteCall() {
        SessionTokenManager noKey = newManager("trader", null);
        try {
            ConfigException ex = assertThrows(ConfigException.class, noKey::authenticate);

            assertEquals("TOPSTEP_API_KEY", ex.getSetting());
            verify(gateway, never()).login(any(), any());
            assertTrue(noKey.currentToken().isEmpty());
        } finally {
            noKey.shutdown();
        }
    }

    @Test
    void testMissingUsernameFailsWithoutRemoteCall() {
        ConfigException ex = assertThrows(ConfigException.class, () -> manager.authenticate("  ", "key"));

        assertEquals("TOPSTEP_USERNAME", ex.getSetting());
        verify(gateway, never()).login(any(), any());
    }

    @Test
    void testAuthenticateStoresToken() {
        when(gateway.login("trader", "key-123")).thenReturn("tok-1");

        String token = manager.authenticate();

        assertEquals("tok-1", token);
        assertEquals(Optional.of("tok-1"), manager.currentToken());
        assertEquals(NOW, session.snapshot().tokenAcquiredAt());
    }

    @Test
    void testAuthenticationFailurePropagatesAndKeepsNoToken() {
        when(gateway.login(any(), any()))
            .thenThrow(new BrokerAuthenticationException("topstep", "trader", "Login rejected"));

        assertThrows(BrokerAuthenticationException.class, manager::authenticate);
        assertTrue(manager.currentToken().isEmpty());
    }

    @Test
    void testScheduledRefreshFailureKeepsPreviousToken() {
        when(gateway.login("trader", "key-123"))
            .thenReturn("tok-1")
            .thenThrow(new BrokerAuthenticationException("topstep", "trader", "HTTP 503"));

        manager.authenticate();
        assertDoesNotThrow(() -> manager.refreshOnSchedule());

        assertEquals(Optional.of("tok-1"), manager.currentToken());
    }

    @Test
    void testScheduledRefreshReplacesToken() {
        when(gateway.login("trader", "key-123")).thenReturn("tok-1", "tok-2");

        manager.authenticate();
        manager.refreshOnSchedule();

        assertEquals(Optional.of("tok-2"), manager.currentToken());
    }

    @Test
    void testRefreshKeepsResolvedAccount() {
        when(gateway.login("trader", "key-123")).thenReturn("tok-1", "tok-2");
        manager.authenticate();
        session.bindAccount(7L, "PRAC-1");

        manager.refreshOnSchedule();

        assertEquals(Optional.of(7L), session.accountId());
        assertEquals("tok-2", session.snapshot().token());
    }

    @Test
    void testResolveAccountByPrefixIgnoringCase() {
        session.replaceToken("tok-1", NOW);
        when(gateway.searchAccounts("tok-1")).thenReturn(List.of(
            new BrokerAccount(1L, "EXPRESS-V2-1", true),
            new BrokerAccount(2L, "PRAC-V2-LOCKED", false),
            new BrokerAccount(3L, "PRAC-V2-ACTIVE", true),
            new BrokerAccount(4L, "PRAC-V2-OTHER", true)
        ));

        Optional<BrokerAccount> account = manager.resolveAccount("prac");

        assertTrue(account.isPresent());
        assertEquals(3L, account.get().id());
        assertEquals(Optional.of(3L), session.accountId());
        assertEquals("PRAC-V2-ACTIVE", session.snapshot().accountName());
    }

    @Test
    void testResolveAccountNoMatchLeavesAccountUnset() {
        session.replaceToken("tok-1", NOW);
        when(gateway.searchAccounts("tok-1")).thenReturn(List.of(
            new BrokerAccount(1L, "EXPRESS-V2-1", true)
        ));

        Optional<BrokerAccount> account = manager.resolveAccount("PRAC");

        assertTrue(account.isEmpty());
        assertTrue(session.accountId().isEmpty());
    }

    @Test
    void testResolveAccountRequiresPrefix() {
        session.replaceToken("tok-1", NOW);

        ConfigException ex = assertThrows(ConfigException.class, () -> manager.resolveAccount(null));

        assertEquals("ACCOUNT_NAME", ex.getSetting());
        verify(gateway, never()).searchAccounts(any());
    }

    @Test
    void testStartArmsRefresh() {
        manager.start();
        manager.start();   // second call ignored

        assertTrue(manager.isRunning());
        manager.shutdown();
        assertFalse(manager.isRunning());
    }
}
