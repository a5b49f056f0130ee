package io.hookcron.core.database.migrate;

import java.util.List;
import java.util.ArrayList;

public class CreateTableBuilder
{
    private final boolean postgres;
    private final String name;
    private final List<String> columns = new ArrayList<>();

    CreateTableBuilder(boolean postgres, String name)
    {
        this.postgres = postgres;
        this.name = name;
    }

    public CreateTableBuilder add(String column, String typeAndOptions)
    {
        columns.add(column + " " + typeAndOptions);
        return this;
    }

    public CreateTableBuilder addLongId(String column)
    {
        if (postgres) {
            return add(column, "bigserial primary key");
        }
        else {
            return add(column, "bigint generated by default as identity primary key");
        }
    }

    public CreateTableBuilder addUuidStringId(String column)
    {
        return add(column, "varchar(36) primary key");
    }

    public CreateTableBuilder addInt(String column, String options)
    {
        return add(column, "int " + options);
    }

    public CreateTableBuilder addLong(String column, String options)
    {
        return add(column, "bigint " + options);
    }

    public CreateTableBuilder addBoolean(String column, String options)
    {
        return add(column, "boolean " + options);
    }

    public CreateTableBuilder addString(String column, String options)
    {
        if (postgres) {
            return add(column, "text " + options);
        }
        else {
            return add(column, "varchar(255) " + options);
        }
    }

    public CreateTableBuilder addLongText(String column, String options)
    {
        if (postgres) {
            return add(column, "text " + options);
        }
        else {
            return add(column, "clob " + options);
        }
    }

    public CreateTableBuilder addTimestamp(String column, String options)
    {
        if (postgres) {
            return add(column, "timestamp with time zone " + options);
        }
        else {
            return add(column, "timestamp " + options);
        }
    }

    public String build()
    {
        StringBuilder sb = new StringBuilder();
        sb.append("CREATE TABLE " + name + " (\n");
        for (int i = 0; i < columns.size(); i++) {
            sb.append("  ");
            sb.append(columns.get(i));
            if (i + 1 < columns.size()) {
                sb.append(",\n");
            }
            else {
                sb.append("\n");
            }
        }
        sb.append(")");
        return sb.toString();
    }
}
