package com.cryptobot.core.exchange;

import com.cryptobot.core.model.Direction;

public enum OrderSide {
    BUY,
    SELL;

    public static OrderSide opening(Direction direction) {
        return direction == Direction.LONG ? BUY : SELL;
    }

    public static OrderSide closing(Direction direction) {
        return direction == Direction.LONG ? SELL : BUY;
    }
}
