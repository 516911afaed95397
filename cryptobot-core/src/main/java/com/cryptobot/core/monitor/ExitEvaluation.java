package com.cryptobot.core.monitor;

import com.cryptobot.core.model.CloseReason;
import com.cryptobot.core.model.Position;

import java.util.Optional;

/**
 * @param position  the position with trailing state advanced to this price
 * @param exit      why it should close now, or null to keep holding
 * @param lossWatch drawdown has reached {@code loss_check_interval_percent}
 */
public record ExitEvaluation(Position position, double unrealizedPnl, CloseReason exit, boolean lossWatch) {

    public Optional<CloseReason> exitReason() {
        return Optional.ofNullable(exit);
    }
}
