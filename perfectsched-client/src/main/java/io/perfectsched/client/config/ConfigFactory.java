package io.perfectsched.client.config;

import java.io.IOException;
import javax.inject.Inject;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

public class ConfigFactory
{
    final ObjectMapper objectMapper;

    @Inject
    public ConfigFactory(ObjectMapper objectMapper)
    {
        this.objectMapper = objectMapper;
    }

    public Config create()
    {
        return new Config(objectMapper);
    }

    public Config fromJsonString(String json)
    {
        JsonNode node;
        try {
            node = objectMapper.readTree(json);
        }
        catch (IOException ex) {
            throw new ConfigException(ex);
        }
        if (node == null || !node.isObject()) {
            throw new ConfigException("Expected a JSON object but got " + (node == null ? "empty text" : node.getNodeType()));
        }
        return new Config(objectMapper, node);
    }

    public String toJsonString(Config config)
    {
        try {
            return objectMapper.writeValueAsString(config.getInternalObjectNode());
        }
        catch (IOException ex) {
            throw new ConfigException(ex);
        }
    }
}
