package com.cryptobot.core.bot;

/**
 * Lifecycle: STOPPED -> RUNNING -> STOPPING -> STOPPED.
 */
public enum BotState {
    STOPPED,
    RUNNING,
    STOPPING
}
