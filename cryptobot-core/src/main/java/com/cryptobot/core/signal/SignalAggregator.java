package com.cryptobot.core.signal;

import com.cryptobot.core.model.AnalysisResult;
import com.cryptobot.core.model.SourceSignal;
import com.cryptobot.core.model.TradeAction;

import java.time.Instant;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Merges per-source recommendations into one {@link AnalysisResult}. Stateless.
 * <p>
 * Only sources that answered take part; an absent source is neither a zero nor a HOLD.
 * <ul>
 *   <li>combined confidence: weighted mean of the responders' confidences (weights default to 1)</li>
 *   <li>final action: the action with the largest sum of weight x confidence; a tie at the top is HOLD</li>
 * </ul>
 */
public final class SignalAggregator {
    private static final double TIE_EPSILON = 1e-9;

    public AnalysisResult aggregate(String symbol, List<SourceSignal> signals, Instant timestamp) {
        return aggregate(symbol, signals, Map.of(), timestamp);
    }

    public AnalysisResult aggregate(String symbol, List<SourceSignal> signals,
                                    Map<String, Double> weights, Instant timestamp) {
        double weightSum = 0.0;
        double weightedConfidence = 0.0;
        Map<TradeAction, Double> votes = new EnumMap<>(TradeAction.class);

        for (SourceSignal signal : signals) {
            double weight = weights.getOrDefault(signal.sourceId(), 1.0);
            if (!(weight > 0) || !Double.isFinite(weight)) {
                continue;
            }
            weightSum += weight;
            weightedConfidence += weight * signal.confidence();
            votes.merge(signal.action(), weight * signal.confidence(), Double::sum);
        }

        double combined = weightSum > 0 ? clamp(weightedConfidence / weightSum) : 0.0;
        return new AnalysisResult(symbol, signals, combined, winner(votes), timestamp);
    }

    private static TradeAction winner(Map<TradeAction, Double> votes) {
        TradeAction best = TradeAction.HOLD;
        double bestScore = 0.0;
        boolean tied = false;
        for (var entry : votes.entrySet()) {
            double score = entry.getValue();
            if (score > bestScore + TIE_EPSILON) {
                best = entry.getKey();
                bestScore = score;
                tied = false;
            } else if (Math.abs(score - bestScore) <= TIE_EPSILON && bestScore > 0) {
                tied = true;
            }
        }
        return tied || bestScore <= 0 ? TradeAction.HOLD : best;
    }

    private static double clamp(double value) {
        return Math.max(0.0, Math.min(1.0, value));
    }
}
