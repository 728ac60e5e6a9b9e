package com.agentrelay;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Process-wide cancellation state: a global "cancel everything" flag, the set of task keys
 * with a pending cancellation, and the live token of each running unit of work.
 *
 * <p>All state changes happen under one lock that is never held while a token is signalled,
 * so token callbacks (which escalate into agent and browser collaborators) cannot deadlock
 * against a concurrent checkpoint.</p>
 */
public class CancellationCoordinator {

    private final Object lock = new Object();
    private final Set<String> pendingKeys = new HashSet<>();
    private final Map<String, CancellationToken> liveTokens = new HashMap<>();
    private boolean cancelAll;

    private final AppLogger logger = AppLogger.get();

    /**
     * Create the token for a newly admitted unit of work. A stale pending entry left by an
     * earlier task with the same key is discarded. While the global flag is still set the
     * returned token is already cancelled.
     */
    public CancellationToken register(String taskKey) {
        CancellationToken token = new CancellationToken(taskKey);
        boolean cancelNow;
        synchronized (lock) {
            pendingKeys.remove(taskKey);
            liveTokens.put(taskKey, token);
            cancelNow = cancelAll;
        }
        if (cancelNow) {
            token.cancel();
        }
        return token;
    }

    /**
     * Request cancellation of one task.
     *
     * @return true if a live token was found and signalled
     */
    public boolean requestCancel(String taskKey) {
        CancellationToken token;
        synchronized (lock) {
            pendingKeys.add(taskKey);
            token = liveTokens.get(taskKey);
        }
        if (token == null) {
            return false;
        }
        token.cancel();
        log("Cancellation requested for task " + taskKey);
        return true;
    }

    /**
     * Raise the global flag and signal every live token.
     *
     * @return number of live tokens signalled
     */
    public int requestCancelAll() {
        List<CancellationToken> tokens;
        synchronized (lock) {
            cancelAll = true;
            tokens = new ArrayList<>(liveTokens.values());
        }
        for (CancellationToken token : tokens) {
            token.cancel();
        }
        log("Cancellation requested for all tasks (" + tokens.size() + " live)");
        return tokens.size();
    }

    public boolean isCancelRequested(String taskKey) {
        CancellationToken token;
        synchronized (lock) {
            if (cancelAll || pendingKeys.contains(taskKey)) {
                return true;
            }
            token = liveTokens.get(taskKey);
        }
        return token != null && token.isCancelled();
    }

    public boolean isCancelAllRequested() {
        synchronized (lock) {
            return cancelAll;
        }
    }

    /**
     * Throws {@link TaskCancelledException} when the task must stop. Called from the agent's
     * progress callbacks and before and after every collaborator call.
     */
    public void checkpoint(String taskKey) {
        if (isCancelRequested(taskKey)) {
            throw new TaskCancelledException(taskKey);
        }
    }

    /**
     * Clear the state left by a finished unit of work. The per-key entry is only removed when
     * {@code token} is still the key's current token, and the global flag only when no other
     * task is live.
     */
    public void taskFinished(String taskKey, CancellationToken token, boolean otherLiveTasks) {
        boolean clearedGlobal = false;
        synchronized (lock) {
            if (liveTokens.get(taskKey) == token) {
                liveTokens.remove(taskKey);
                pendingKeys.remove(taskKey);
            }
            if (cancelAll && !otherLiveTasks) {
                cancelAll = false;
                clearedGlobal = true;
            }
        }
        if (clearedGlobal) {
            log("Global cancellation cleared; no live tasks remain");
        }
    }

    /**
     * Clear the global flag if nothing is left for it to catch.
     */
    public void clearCancelAllIfIdle(boolean anyLiveTasks) {
        if (anyLiveTasks) {
            return;
        }
        synchronized (lock) {
            cancelAll = false;
        }
    }

    public boolean hasPendingEntry(String taskKey) {
        synchronized (lock) {
            return pendingKeys.contains(taskKey);
        }
    }

    private void log(String message) {
        if (logger != null) {
            logger.info("[Cancellation] " + message);
        }
    }
}
