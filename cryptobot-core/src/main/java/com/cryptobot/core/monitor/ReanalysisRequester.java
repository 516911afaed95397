package com.cryptobot.core.monitor;

/**
 * Lets the monitor ask for a fresh analysis of a symbol it would otherwise skip.
 */
@FunctionalInterface
public interface ReanalysisRequester {

    ReanalysisRequester NONE = symbol -> { };

    void requestReanalysis(String symbol);
}
