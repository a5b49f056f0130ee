package io.hookcron.core.database;

import java.io.IOException;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Types;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.inject.Inject;
import io.hookcron.client.config.Config;
import io.hookcron.client.config.ConfigFactory;
import org.jdbi.v3.core.argument.AbstractArgumentFactory;
import org.jdbi.v3.core.argument.Argument;
import org.jdbi.v3.core.config.ConfigRegistry;

/**
 * Reads and writes {@link Config} columns such as {@code schedules.recurrence_config}.
 * An empty config is stored as NULL and NULL is read back as an empty config.
 */
class ConfigMapper
{
    private final ObjectMapper jsonTreeMapper = new ObjectMapper();
    private final ConfigFactory cf;

    @Inject
    public ConfigMapper(ConfigFactory cf)
    {
        this.cf = cf;
    }

    public AbstractArgumentFactory<Config> getArgumentFactory()
    {
        return new AbstractArgumentFactory<Config>(Types.VARCHAR)
        {
            @Override
            protected Argument build(Config value, ConfigRegistry registry)
            {
                String text = toBinding(value);
                return (position, statement, ctx) -> {
                    if (text == null) {
                        statement.setNull(position, Types.VARCHAR);
                    }
                    else {
                        statement.setString(position, text);
                    }
                };
            }
        };
    }

    public Config fromResultSetOrEmpty(ResultSet rs, String column)
            throws SQLException
    {
        String text = rs.getString(column);
        if (text == null) {
            return cf.create();
        }
        JsonNode node;
        try {
            node = jsonTreeMapper.readTree(text);
        }
        catch (IOException ex) {
            throw new DatabaseException("Column " + column + " is not valid JSON", ex);
        }
        if (!node.isObject()) {
            throw new DatabaseException("Column " + column + " must be a JSON object: " + text);
        }
        return cf.create(node);
    }

    String toBinding(Config config)
    {
        if (config == null || config.isEmpty()) {
            return null;
        }
        try {
            return jsonTreeMapper.writeValueAsString(config.getInternalObjectNode());
        }
        catch (IOException ex) {
            throw new DatabaseException("Failed to serialize config", ex);
        }
    }
}
