package com.cryptobot.core.signal;

import com.cryptobot.core.model.SourceSignal;

import java.util.Optional;

/**
 * A pluggable recommender (indicator model, LLM, ...). Called from a worker thread with a time bound.
 */
public interface SignalSource {

    String id();

    /**
     * @return the recommendation, or empty to abstain for this cycle
     */
    Optional<SourceSignal> analyze(String symbol);
}
