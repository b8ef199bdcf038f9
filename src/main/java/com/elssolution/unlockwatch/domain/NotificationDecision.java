package com.elssolution.unlockwatch.domain;

/** Whether a probe result is worth a notification, and why. */
public record NotificationDecision(boolean fire, Reason reason) {

    public enum Reason {
        /** unlocked now, not notified before */
        NEWLY_UNLOCKED,
        /** unlocked, but the cache says we already told the chat */
        ALREADY_NOTIFIED,
        /** probe did not report unlocked; cache untouched */
        NOT_UNLOCKED
    }

    public static NotificationDecision of(Reason reason) {
        return new NotificationDecision(reason == Reason.NEWLY_UNLOCKED, reason);
    }
}
