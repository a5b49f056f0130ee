package io.hookcron.client.config;

import java.util.List;
import java.util.Map;
import java.util.Iterator;
import com.google.common.base.Optional;
import com.google.common.base.Throwables;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.fasterxml.jackson.annotation.JacksonInject;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.RuntimeJsonMappingException;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import static java.util.Locale.ENGLISH;

/**
 * A mutable tree of configuration values backed by a Jackson {@link ObjectNode}.
 *
 * System configuration (flat keys such as {@code schedule.poll_interval}) and the
 * per-schedule recurrence configuration (nested JSON stored in the database) are both
 * represented by this class.
 */
public class Config
{
    protected final ObjectMapper mapper;
    protected final ObjectNode object;

    Config(ObjectMapper mapper)
    {
        this(mapper, new ObjectNode(JsonNodeFactory.instance));
    }

    Config(ObjectMapper mapper, JsonNode object)
    {
        this.mapper = mapper;
        this.object = (ObjectNode) object;
    }

    protected Config(Config config)
    {
        this.mapper = config.mapper;
        this.object = config.object.deepCopy();
    }

    @JsonCreator
    public static Config deserializeFromJackson(@JacksonInject ObjectMapper mapper, JsonNode object)
    {
        if (!object.isObject()) {
            throw new RuntimeJsonMappingException("Expected object but got " + object);
        }
        return new Config(mapper, (ObjectNode) object);
    }

    @JsonValue
    public ObjectNode getInternalObjectNode()
    {
        return object;
    }

    public Config set(String key, Object v)
    {
        if (v == null) {
            remove(key);
        }
        else {
            object.set(key, writeObject(v));
        }
        return this;
    }

    public Config setOptional(String key, Optional<?> v)
    {
        if (v.isPresent()) {
            set(key, v.get());
        }
        return this;
    }

    public Config setNested(String key, Config v)
    {
        object.set(key, v.object);
        return this;
    }

    public Config remove(String key)
    {
        object.remove(key);
        return this;
    }

    public Config deepCopy()
    {
        return new Config(this);
    }

    public Config merge(Config other)
    {
        mergeJsonObject(object, other.deepCopy().object);
        return this;
    }

    private static void mergeJsonObject(ObjectNode src, ObjectNode other)
    {
        Iterator<Map.Entry<String, JsonNode>> ite = other.fields();
        while (ite.hasNext()) {
            Map.Entry<String, JsonNode> pair = ite.next();
            JsonNode s = src.get(pair.getKey());
            JsonNode v = pair.getValue();
            if (v.isObject() && s != null && s.isObject()) {
                mergeJsonObject((ObjectNode) s, (ObjectNode) v);
            }
            else {
                src.set(pair.getKey(), v);
            }
        }
    }

    private JsonNode writeObject(Object obj)
    {
        try {
            return mapper.readTree(mapper.writeValueAsString(obj));
        }
        catch (Exception ex) {
            Throwables.throwIfUnchecked(ex);
            throw new ConfigException(ex);
        }
    }

    public ConfigFactory getFactory()
    {
        return new ConfigFactory(mapper);
    }

    public List<String> getKeys()
    {
        return ImmutableList.copyOf(object.fieldNames());
    }

    public boolean isEmpty()
    {
        return !object.fieldNames().hasNext();
    }

    public boolean has(String key)
    {
        return object.has(key);
    }

    /**
     * Returns all values as strings. Used for settings passed through to a driver as they are.
     */
    public Map<String, String> getAsStringMap()
    {
        ImmutableMap.Builder<String, String> map = ImmutableMap.builder();
        for (String key : getKeys()) {
            map.put(key, get(key, String.class));
        }
        return map.build();
    }

    public <E> E convert(Class<E> type)
    {
        return readObject(mapper.getTypeFactory().constructType(type), object, null);
    }

    public <E> E get(String key, Class<E> type)
    {
        return readObject(mapper.getTypeFactory().constructType(type), getRequiredNode(key), key);
    }

    public <E> E get(String key, Class<E> type, E defaultValue)
    {
        JsonNode value = object.get(key);
        if (value == null || value.isNull()) {
            return defaultValue;
        }
        return readObject(mapper.getTypeFactory().constructType(type), value, key);
    }

    public <E> Optional<E> getOptional(String key, Class<E> type)
    {
        JsonNode value = object.get(key);
        if (value == null || value.isNull()) {
            return Optional.absent();
        }
        return Optional.of(readObject(mapper.getTypeFactory().constructType(type), value, key));
    }

    public <E> List<E> getListOrEmpty(String key, Class<E> elementType)
    {
        JsonNode value = object.get(key);
        if (value == null || value.isNull()) {
            return ImmutableList.of();
        }
        return readObject(mapper.getTypeFactory().constructCollectionType(List.class, elementType), value, key);
    }

    public Config getNested(String key)
    {
        JsonNode value = getRequiredNode(key);
        if (!value.isObject()) {
            throw ConfigException.invalidParameter(key, "must be an object");
        }
        return new Config(mapper, value);
    }

    public Config getNestedOrGetEmpty(String key)
    {
        JsonNode value = object.get(key);
        if (value == null || value.isNull()) {
            return new Config(mapper);
        }
        else if (!value.isObject()) {
            throw ConfigException.invalidParameter(key, "must be an object");
        }
        return new Config(mapper, value);
    }

    /**
     * Returns a new Config that contains the keys starting with the prefix, with the prefix removed.
     * {@code extractPrefixed("delivery.")} turns {@code delivery.timeout} into {@code timeout}.
     */
    public Config extractPrefixed(String prefix)
    {
        Config extracted = new Config(mapper);
        Iterator<Map.Entry<String, JsonNode>> ite = object.fields();
        while (ite.hasNext()) {
            Map.Entry<String, JsonNode> pair = ite.next();
            if (pair.getKey().startsWith(prefix)) {
                extracted.object.set(pair.getKey().substring(prefix.length()), pair.getValue().deepCopy());
            }
        }
        return extracted;
    }

    private JsonNode getRequiredNode(String key)
    {
        JsonNode value = object.get(key);
        if (value == null) {
            throw ConfigException.invalidParameter(key, "is required but not set");
        }
        else if (value.isNull()) {
            throw ConfigException.invalidParameter(key, "is required but null");
        }
        return value;
    }

    @SuppressWarnings("unchecked")
    private <E> E readObject(JavaType type, JsonNode value, String key)
    {
        try {
            return (E) mapper.readValue(value.traverse(), type);
        }
        catch (Exception ex) {
            Throwables.throwIfInstanceOf(ex, ConfigException.class);
            String message = String.format(ENGLISH, "Expected %s for key '%s' but got %s (%s)",
                    typeNameOf(type), key, jsonSample(value), value.getNodeType().toString().toLowerCase(ENGLISH));
            throw new ConfigException(message, ex);
        }
    }

    private static String typeNameOf(JavaType type)
    {
        Class<?> raw = type.getRawClass();
        if (raw.equals(String.class)) {
            return "string type";
        }
        else if (raw.equals(int.class) || raw.equals(Integer.class)) {
            return "integer (int) type";
        }
        else if (raw.equals(long.class) || raw.equals(Long.class)) {
            return "integer (long) type";
        }
        else if (raw.equals(boolean.class) || raw.equals(Boolean.class)) {
            return "'true' or 'false'";
        }
        else if (List.class.isAssignableFrom(raw)) {
            return "array type";
        }
        else if (Map.class.isAssignableFrom(raw)) {
            return "object type";
        }
        return type.toString();
    }

    private static String jsonSample(JsonNode value)
    {
        String json = value.toString();
        if (json.length() < 100) {
            return json;
        }
        return json.substring(0, 97) + "...";
    }

    @Override
    public String toString()
    {
        return object.toString();
    }

    @Override
    public boolean equals(Object other)
    {
        if (!(other instanceof Config)) {
            return false;
        }
        return object.equals(((Config) other).object);
    }

    @Override
    public int hashCode()
    {
        return object.hashCode();
    }
}
