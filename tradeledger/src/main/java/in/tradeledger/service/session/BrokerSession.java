package in.tradeledger.service.session;

import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Current broker session: bearer token and the resolved trading account.
 *
 * State is an immutable snapshot swapped atomically, so readers never see a
 * token from one login paired with an account from another and never block.
 * Nothing is persisted; a restart re-authenticates.
 */
public final class BrokerSession {

    private final AtomicReference<SessionState> state = new AtomicReference<>(SessionState.EMPTY);

    public SessionState snapshot() {
        return state.get();
    }

    public Optional<String> token() {
        return Optional.ofNullable(state.get().token());
    }

    public Optional<Long> accountId() {
        return Optional.ofNullable(state.get().accountId());
    }

    /**
     * Replace the token, keeping the resolved account.
     */
    public void replaceToken(String token, Instant acquiredAt) {
        state.updateAndGet(s -> new SessionState(token, acquiredAt, s.accountId(), s.accountName()));
    }

    /**
     * Bind the session to an account, keeping the token.
     */
    public void bindAccount(long accountId, String accountName) {
        state.updateAndGet(s -> new SessionState(s.token(), s.tokenAcquiredAt(), accountId, accountName));
    }

    public void clear() {
        state.set(SessionState.EMPTY);
    }

    /**
     * Session snapshot. Any field may be null until the matching startup step succeeds.
     */
    public record SessionState(
        String token,
        Instant tokenAcquiredAt,
        Long accountId,
        String accountName
    ) {
        static final SessionState EMPTY = new SessionState(null, null, null, null);

        public boolean hasToken() {
            return token != null;
        }

        public boolean hasAccount() {
            return accountId != null;
        }
    }
}
