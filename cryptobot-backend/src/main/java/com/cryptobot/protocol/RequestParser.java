package com.cryptobot.protocol;

import com.cryptobot.core.bot.ManualTrade;
import com.cryptobot.core.model.Direction;
import com.cryptobot.core.model.TradeAction;
import com.cryptobot.core.model.TradingMode;
import com.cryptobot.core.model.WalletType;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.Locale;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * Decodes client frames. The request type is read from {@code type}, or {@code action} for older clients.
 * Payload fields may sit at the top level of the frame or inside a {@code data} object.
 */
public final class RequestParser {
    static final int DEFAULT_LIMIT = 50;

    private final ObjectMapper mapper;
    private final Supplier<String> tradeIds;

    public RequestParser(ObjectMapper mapper, Supplier<String> tradeIds) {
        this.mapper = mapper;
        this.tradeIds = tradeIds;
    }

    public RequestParser(ObjectMapper mapper) {
        this(mapper, () -> UUID.randomUUID().toString());
    }

    public BotRequest parse(String frame) {
        JsonNode root;
        try {
            root = mapper.readTree(frame);
        } catch (JsonProcessingException e) {
            throw new ProtocolException("Malformed JSON: " + e.getOriginalMessage(), e);
        }
        if (root == null || !root.isObject()) {
            throw new ProtocolException("Request must be a JSON object");
        }
        return parse(root);
    }

    public BotRequest parse(JsonNode root) {
        String type = text(root, "type");
        if (type == null) {
            type = text(root, "action");
        }
        if (type == null || type.isBlank()) {
            throw new ProtocolException("Request type is missing");
        }

        return switch (type) {
            case "ping" -> new BotRequest.Ping();
            case "start_bot" -> new BotRequest.StartBot(configPayload(root));
            case "stop_bot" -> new BotRequest.StopBot();
            case "get_bot_status" -> new BotRequest.GetBotStatus();
            case "update_bot_config" -> new BotRequest.UpdateBotConfig(configPayload(root));
            case "get_positions" -> new BotRequest.GetPositions();
            case "get_trade_history" -> new BotRequest.GetTradeHistory(limit(root));
            case "get_ai_analysis" -> new BotRequest.GetAiAnalysis(symbol(root, "symbol"));
            case "get_analysis_logs" -> new BotRequest.GetAnalysisLogs(limit(root));
            case "execute_trade" -> new BotRequest.ExecuteTrade(manualTrade(root));
            case "close_position" -> new BotRequest.ClosePosition(symbol(root, "symbol"));
            case "approve_trade" -> new BotRequest.ApproveTrade(required(root, "trade_id"));
            case "reject_trade" -> new BotRequest.RejectTrade(required(root, "trade_id"));
            case "get_pending_trades" -> new BotRequest.GetPendingTrades();
            case "set_trading_mode" -> new BotRequest.SetTradingMode(
                parseEnum(TradingMode.class, required(root, "mode"), "mode"));
            case "get_trading_balance" -> new BotRequest.GetTradingBalance(
                optional(root, "asset", "USDT").toUpperCase(Locale.ROOT), walletType(root));
            case "get_all_trading_balances" -> new BotRequest.GetAllTradingBalances();
            case "get_categorized_balances" -> new BotRequest.GetCategorizedBalances();
            case "get_portfolio_summary" -> new BotRequest.GetPortfolioSummary();
            default -> new BotRequest.Unknown(type);
        };
    }

    private ManualTrade manualTrade(JsonNode root) {
        JsonNode trade = field(root, "trade_data");
        if (trade == null || trade.isNull()) {
            trade = root.path("data").isObject() ? root.get("data") : root;
        }
        if (!trade.isObject()) {
            throw new ProtocolException("trade_data must be a JSON object");
        }

        String symbol = symbol(trade, "symbol");
        Direction direction = direction(trade);
        String tradeId = text(trade, "trade_id");
        return new ManualTrade(
            tradeId == null || tradeId.isBlank() ? tradeIds.get() : tradeId,
            symbol,
            direction,
            positiveOrNull(trade, "quantity"),
            positiveOrNull(trade, "amount_usdt"),
            positiveOrNull(trade, "price"));
    }

    private Direction direction(JsonNode trade) {
        String direction = text(trade, "direction");
        if (direction != null) {
            return parseEnum(Direction.class, direction, "direction");
        }
        String side = text(trade, "side");
        if (side == null) {
            throw new ProtocolException("Missing required field: side");
        }
        TradeAction action = parseEnum(TradeAction.class, side, "side");
        if (action == TradeAction.HOLD) {
            throw new ProtocolException("side must be BUY or SELL");
        }
        return Direction.fromAction(action);
    }

    private static JsonNode configPayload(JsonNode root) {
        JsonNode config = field(root, "config");
        if (config != null && !config.isNull()) {
            return config;
        }
        JsonNode data = root.get("data");
        return data != null && data.isObject() ? data : null;
    }

    private static WalletType walletType(JsonNode root) {
        String value = text(root, "wallet_type");
        if (value == null) {
            value = text(root, "walletType");
        }
        return value == null || value.isBlank() ? null : parseEnum(WalletType.class, value, "wallet_type");
    }

    private static int limit(JsonNode root) {
        JsonNode limit = field(root, "limit");
        if (limit == null || limit.isNull()) {
            return DEFAULT_LIMIT;
        }
        if (!limit.canConvertToInt() || limit.asInt() <= 0) {
            throw new ProtocolException("limit must be a positive integer");
        }
        return limit.asInt();
    }

    private static Double positiveOrNull(JsonNode node, String name) {
        JsonNode value = node.get(name);
        if (value == null || value.isNull()) {
            return null;
        }
        double parsed;
        if (value.isNumber()) {
            parsed = value.asDouble();
        } else {
            try {
                parsed = Double.parseDouble(value.asText().trim());
            } catch (NumberFormatException e) {
                throw new ProtocolException(name + " must be a number", e);
            }
        }
        if (!(parsed > 0) || !Double.isFinite(parsed)) {
            throw new ProtocolException(name + " must be positive");
        }
        return parsed;
    }

    private static String symbol(JsonNode root, String name) {
        return required(root, name).toUpperCase(Locale.ROOT);
    }

    private static String required(JsonNode root, String name) {
        String value = text(root, name);
        if (value == null || value.isBlank()) {
            throw new ProtocolException("Missing required field: " + name);
        }
        return value.trim();
    }

    private static String optional(JsonNode root, String name, String defaultValue) {
        String value = text(root, name);
        return value == null || value.isBlank() ? defaultValue : value.trim();
    }

    private static String text(JsonNode root, String name) {
        JsonNode node = field(root, name);
        return node == null || node.isNull() ? null : node.asText();
    }

    private static JsonNode field(JsonNode root, String name) {
        JsonNode node = root.get(name);
        if (node == null) {
            JsonNode data = root.get("data");
            if (data != null && data.isObject()) {
                node = data.get(name);
            }
        }
        return node;
    }

    private static <E extends Enum<E>> E parseEnum(Class<E> type, String value, String name) {
        try {
            return Enum.valueOf(type, value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new ProtocolException("Invalid " + name + ": " + value, e);
        }
    }
}
