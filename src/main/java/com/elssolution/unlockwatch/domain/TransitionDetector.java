package com.elssolution.unlockwatch.domain;

import com.elssolution.unlockwatch.integration.status.ProbeResult;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Decides whether a fresh probe is a "locked → unlocked" transition.
 *
 * Detection is monotonic: once an account is marked unlocked it never fires again
 * until the cache entry is reset, and a later "locked" probe is not treated as a
 * transition. The cache itself is only written by the caller, after delivery.
 */
@Component
public class TransitionDetector {

    public NotificationDecision detectAndConsume(Map<String, Boolean> accountState,
                                                 String account,
                                                 ProbeResult probe) {
        if (probe == null || !probe.unlocked()) {
            return NotificationDecision.of(NotificationDecision.Reason.NOT_UNLOCKED);
        }
        if (Boolean.TRUE.equals(accountState.get(account))) {
            return NotificationDecision.of(NotificationDecision.Reason.ALREADY_NOTIFIED);
        }
        return NotificationDecision.of(NotificationDecision.Reason.NEWLY_UNLOCKED);
    }
}
