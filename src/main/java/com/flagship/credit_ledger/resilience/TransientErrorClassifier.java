package com.flagship.credit_ledger.resilience;

import com.flagship.credit_ledger.exception.LedgerException;
import org.springframework.dao.ConcurrencyFailureException;
import org.springframework.dao.QueryTimeoutException;
import org.springframework.dao.RecoverableDataAccessException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.data.redis.RedisConnectionFailureException;
import org.springframework.stereotype.Component;

import java.net.ConnectException;
import java.net.SocketTimeoutException;
import java.sql.SQLRecoverableException;
import java.sql.SQLTransientException;
import java.util.List;
import java.util.Locale;

/**
 * Decides whether a failed store call is worth retrying.
 *
 * Transient: timeouts, dropped or refused connections, and anything whose
 * message carries one of those markers, found anywhere in the cause chain.
 * Never transient: ledger errors (they are business outcomes) and
 * concurrency failures (the caller must re-read before trying again).
 */
@Component
public class TransientErrorClassifier {

    private static final int MAX_CAUSE_DEPTH = 16;

    private static final List<String> TRANSIENT_MARKERS = List.of(
        "connection reset",
        "connection refused",
        "broken pipe",
        "timed out",
        "timeout",
        "network"
    );

    public boolean isTransient(Throwable error) {
        if (error == null || isNeverRetried(error)) {
            return false;
        }

        Throwable current = error;
        for (int depth = 0; current != null && depth < MAX_CAUSE_DEPTH; depth++) {
            if (isNeverRetried(current)) {
                return false;
            }
            if (isTransientType(current) || hasTransientMarker(current.getMessage())) {
                return true;
            }
            if (current.getCause() == current) {
                break;
            }
            current = current.getCause();
        }
        return false;
    }

    private boolean isNeverRetried(Throwable error) {
        return error instanceof LedgerException
            || error instanceof ConcurrencyFailureException;
    }

    private boolean isTransientType(Throwable error) {
        return error instanceof QueryTimeoutException
            || error instanceof TransientDataAccessException
            || error instanceof RecoverableDataAccessException
            || error instanceof RedisConnectionFailureException
            || error instanceof SQLTransientException
            || error instanceof SQLRecoverableException
            || error instanceof SocketTimeoutException
            || error instanceof ConnectException;
    }

    private boolean hasTransientMarker(String message) {
        if (message == null) {
            return false;
        }
        String normalized = message.toLowerCase(Locale.ROOT);
        return TRANSIENT_MARKERS.stream().anyMatch(normalized::contains);
    }
}
