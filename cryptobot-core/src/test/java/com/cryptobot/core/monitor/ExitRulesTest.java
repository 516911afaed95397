package com.cryptobot.core.monitor;

import com.cryptobot.core.config.BotConfig;
import com.cryptobot.core.model.CloseReason;
import com.cryptobot.core.model.Direction;
import com.cryptobot.core.model.Position;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.time.Instant;

import static com.cryptobot.core.TestConfigs.config;
import static org.assertj.core.api.Assertions.*;

@DisplayName("ExitRules Tests")
class ExitRulesTest {

    private static final BotConfig NO_TARGET = config("{\"profit_target_min\": 0.0}");
    private static final BotConfig DISTANT_TARGET = config("{\"profit_target_min\": 5.0}");

    private static Position longBtc() {
        return Position.open("BTCUSDT", Direction.LONG, 45000.0, 1.0, Instant.EPOCH, "open-1");
    }

    @Nested
    @DisplayName("Trailing stop")
    class Trailing {

        @Test
        @DisplayName("Should arm at the trigger and close on a retracement of the distance")
        void armsThenCloses() {
            ExitEvaluation armed = ExitRules.evaluate(longBtc(), 45002.0, DISTANT_TARGET);

            assertThat(armed.exitReason()).isEmpty();
            assertThat(armed.position().trailingArmed()).isTrue();
            assertThat(armed.position().trailingPeakPnl()).isCloseTo(2.0, within(1e-9));

            ExitEvaluation retraced = ExitRules.evaluate(armed.position(), 45001.4, DISTANT_TARGET);

            assertThat(retraced.exitReason()).contains(CloseReason.TRAILING_STOP);
            assertThat(retraced.unrealizedPnl()).isCloseTo(1.4, within(1e-6));
        }

        @Test
        @DisplayName("Should raise the peak but hold while the retracement is smaller than the distance")
        void holdsOnSmallPullback() {
            Position armed = ExitRules.evaluate(longBtc(), 45002.0, DISTANT_TARGET).position();
            Position higher = ExitRules.evaluate(armed, 45003.0, DISTANT_TARGET).position();

            ExitEvaluation pullback = ExitRules.evaluate(higher, 45002.7, DISTANT_TARGET);

            assertThat(higher.trailingPeakPnl()).isCloseTo(3.0, within(1e-9));
            assertThat(pullback.exitReason()).isEmpty();
            assertThat(pullback.position().trailingPeakPnl()).isCloseTo(3.0, within(1e-9));
        }

        @Test
        @DisplayName("Should stay disarmed below the trigger")
        void belowTrigger() {
            ExitEvaluation evaluation = ExitRules.evaluate(longBtc(), 45000.5, NO_TARGET);

            assertThat(evaluation.exitReason()).isEmpty();
            assertThat(evaluation.position().trailingArmed()).isFalse();
        }

        @Test
        @DisplayName("Should do nothing when trailing is disabled")
        void disabled() {
            BotConfig cfg = config("{\"trailing_enabled\": false, \"profit_target_min\": 0.0}");

            ExitEvaluation evaluation = ExitRules.evaluate(longBtc(), 45010.0, cfg);

            assertThat(evaluation.position().trailingArmed()).isFalse();
            assertThat(evaluation.exitReason()).isEmpty();
        }
    }

    @Nested
    @DisplayName("Stop loss")
    class StopLoss {

        @Test
        @DisplayName("Should close a long at two percent of the entry notional")
        void longStop() {
            assertThat(ExitRules.evaluate(longBtc(), 44101.0, BotConfig.defaults()).exitReason()).isEmpty();
            assertThat(ExitRules.evaluate(longBtc(), 44100.0, BotConfig.defaults()).exitReason())
                .contains(CloseReason.STOP_LOSS);
        }

        @Test
        @DisplayName("Should close a short when the price rises")
        void shortStop() {
            Position shortEth = Position.open("ETHUSDT", Direction.SHORT, 2000.0, 2.0, Instant.EPOCH, "open-2");

            ExitEvaluation evaluation = ExitRules.evaluate(shortEth, 2050.0, BotConfig.defaults());

            assertThat(evaluation.unrealizedPnl()).isEqualTo(-100.0);
            assertThat(evaluation.exitReason()).contains(CloseReason.STOP_LOSS);
        }

        @Test
        @DisplayName("Should take priority over an armed trailing stop")
        void priority() {
            Position armed = ExitRules.evaluate(longBtc(), 45002.0, BotConfig.defaults()).position();

            assertThat(ExitRules.evaluate(armed, 44000.0, BotConfig.defaults()).exitReason())
                .contains(CloseReason.STOP_LOSS);
        }
    }

    @Nested
    @DisplayName("Profit target")
    class ProfitTarget {

        @ParameterizedTest(name = "pnl at price {0} -> exit {1}")
        @CsvSource({
            "45004.0, false",
            "45005.0, true",
            "45008.0, true",
            "45010.0, true",
            "45011.0, false"
        })
        @DisplayName("Should close only inside the target band")
        void band(double price, boolean exits) {
            BotConfig cfg = config("{\"trailing_enabled\": false, \"profit_target_min\": 5.0, \"profit_target_max\": 10.0}");

            ExitEvaluation evaluation = ExitRules.evaluate(longBtc(), price, cfg);

            assertThat(evaluation.exitReason().isPresent()).isEqualTo(exits);
            evaluation.exitReason().ifPresent(reason -> assertThat(reason).isEqualTo(CloseReason.PROFIT_TARGET));
        }

        @Test
        @DisplayName("Should treat a zero maximum as no upper bound")
        void openEnded() {
            BotConfig cfg = config("{\"trailing_enabled\": false, \"profit_target_min\": 5.0}");

            assertThat(ExitRules.evaluate(longBtc(), 45500.0, cfg).exitReason()).contains(CloseReason.PROFIT_TARGET);
        }

        @Test
        @DisplayName("Should still close inside the band after trailing has armed")
        void appliesWhileTrailing() {
            BotConfig cfg = config("{\"profit_target_min\": 5.0, \"profit_target_max\": 10.0}");
            Position armed = ExitRules.evaluate(longBtc(), 45002.0, cfg).position();

            ExitEvaluation evaluation = ExitRules.evaluate(armed, 45006.0, cfg);

            assertThat(armed.trailingArmed()).isTrue();
            assertThat(evaluation.exitReason()).contains(CloseReason.PROFIT_TARGET);
            assertThat(evaluation.position().trailingPeakPnl()).isCloseTo(6.0, within(1e-9));
        }

        @Test
        @DisplayName("Should fire at the default target where trailing arms")
        void defaultTargetFires() {
            ExitEvaluation evaluation = ExitRules.evaluate(longBtc(), 45001.0, BotConfig.defaults());

            assertThat(evaluation.position().trailingArmed()).isTrue();
            assertThat(evaluation.exitReason()).contains(CloseReason.PROFIT_TARGET);
        }
    }

    @Test
    @DisplayName("Should flag loss watch once the drawdown reaches the loss check percent")
    void lossWatch() {
        assertThat(ExitRules.evaluate(longBtc(), 44600.0, BotConfig.defaults()).lossWatch()).isFalse();
        assertThat(ExitRules.evaluate(longBtc(), 44500.0, BotConfig.defaults()).lossWatch()).isTrue();
    }
}
