package io.perfectsched.core.database.migrate;

import java.util.ArrayList;
import java.util.List;

public class CreateTableBuilder
{
    private final boolean postgres;
    private final String name;
    private final List<String> columns = new ArrayList<>();
    private boolean ifNotExists = false;

    CreateTableBuilder(boolean postgres, String name)
    {
        this.postgres = postgres;
        this.name = name;
    }

    // tables created by other tools are kept as is
    public CreateTableBuilder ifNotExists()
    {
        this.ifNotExists = true;
        return this;
    }

    public CreateTableBuilder add(String column, String typeAndOptions)
    {
        columns.add(column + " " + typeAndOptions);
        return this;
    }

    public CreateTableBuilder addInt(String column, String options)
    {
        return add(column, "int " + options);
    }

    public CreateTableBuilder addLong(String column, String options)
    {
        return add(column, "bigint " + options);
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
        return add(column, "text " + options);
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
        sb.append(ifNotExists ? "CREATE TABLE IF NOT EXISTS " : "CREATE TABLE ");
        sb.append(name + " (\n");
        for (int i=0; i < columns.size(); i++) {
            sb.append("  ");
            sb.append(columns.get(i));
            if (i + 1 < columns.size()) {
                sb.append(",\n");
            } else {
                sb.append("\n");
            }
        }
        sb.append(")");
        return sb.toString();
    }
}
