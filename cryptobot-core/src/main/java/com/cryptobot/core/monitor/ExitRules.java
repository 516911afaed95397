package com.cryptobot.core.monitor;

import com.cryptobot.core.config.BotConfig;
import com.cryptobot.core.model.CloseReason;
import com.cryptobot.core.model.Position;

/**
 * Exit rules for one position at one price, in priority order:
 * <ol>
 *   <li>stop loss: PnL at or below {@code -stop_loss_percent} of the entry notional</li>
 *   <li>trailing stop: arms at {@code trailing_trigger_usd}, closes on a retracement of
 *       {@code trailing_distance_usd} from the best PnL seen since arming</li>
 *   <li>profit target: PnL inside {@code [profit_target_min, profit_target_max]}
 *       (or at least the minimum when no maximum is set), checked after the trailing stop has held</li>
 * </ol>
 */
public final class ExitRules {

    private ExitRules() {
    }

    public static ExitEvaluation evaluate(Position position, double price, BotConfig config) {
        double pnl = position.unrealizedPnl(price);
        boolean lossWatch = config.lossCheckIntervalPercent() > 0
            && -position.pnlPercent(price) >= config.lossCheckIntervalPercent();

        if (config.stopLossPercent() > 0) {
            double maxLoss = position.notional() * config.stopLossPercent() / 100.0;
            if (pnl <= -maxLoss) {
                return new ExitEvaluation(position, pnl, CloseReason.STOP_LOSS, lossWatch);
            }
        }

        Position updated = position;
        if (config.trailingEnabled() && (position.trailingArmed() || pnl >= config.trailingTriggerUsd())) {
            updated = position.withTrailingPeak(pnl);
            if (position.trailingArmed() && updated.trailingPeakPnl() - pnl >= config.trailingDistanceUsd()) {
                return new ExitEvaluation(updated, pnl, CloseReason.TRAILING_STOP, lossWatch);
            }
        }

        if (config.hasProfitTarget()) {
            boolean inBand = config.profitTargetMax() > 0
                ? pnl >= config.profitTargetMin() && pnl <= config.profitTargetMax()
                : pnl >= config.profitTargetMin();
            if (inBand) {
                return new ExitEvaluation(updated, pnl, CloseReason.PROFIT_TARGET, lossWatch);
            }
        }

        return new ExitEvaluation(updated, pnl, null, lossWatch);
    }
}
