package com.cryptobot.core.config;

import com.cryptobot.core.error.ConfigException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds {@link BotConfig} snapshots from partial JSON. Fields absent from the request keep the base value.
 */
public final class BotConfigParser {
    private static final Logger logger = LoggerFactory.getLogger(BotConfigParser.class);

    private final ObjectMapper mapper;

    public BotConfigParser(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public BotConfigParser() {
        this(new ObjectMapper());
    }

    /**
     * Overlay {@code overrides} onto {@code base} and validate the result.
     *
     * @throws ConfigException when a field has the wrong type or fails validation
     */
    public BotConfig parse(JsonNode overrides, BotConfig base) {
        ObjectNode merged = toJson(base);
        if (overrides != null && !overrides.isNull()) {
            if (!overrides.isObject()) {
                throw new ConfigException("Bot configuration must be a JSON object");
            }
            merged.setAll((ObjectNode) overrides);
        }
        try {
            BotConfig config = mapper.treeToValue(merged, BotConfig.class);
            return config.validate();
        } catch (JsonProcessingException e) {
            logger.warn("Rejected bot configuration: {}", e.getOriginalMessage());
            throw new ConfigException("Bot configuration could not be read: " + e.getOriginalMessage(), e);
        } catch (IllegalArgumentException e) {
            logger.warn("Rejected bot configuration: {}", e.getMessage());
            throw new ConfigException("Bot configuration could not be read: " + e.getMessage(), e);
        }
    }

    public ObjectNode toJson(BotConfig config) {
        return mapper.valueToTree(config);
    }
}
