package io.perfectsched.core.schedule;

import java.time.Instant;

import com.google.common.base.Optional;
import com.google.inject.Inject;
import io.perfectsched.client.config.Config;
import io.perfectsched.client.config.ConfigException;
import io.perfectsched.client.config.ConfigFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Converts between stored rows and {@link ScheduleAttributes}.
 *
 * The data column holds a JSON object made of the user payload and its
 * {@code type}. A malformed data column is read as an empty payload.
 */
public class ScheduleAttributeCodec
{
    private static final Logger logger = LoggerFactory.getLogger(ScheduleAttributeCodec.class);

    public static final String DEFAULT_TIMEZONE = "UTC";

    static final String TYPE_KEY = "type";

    private final ConfigFactory cf;

    @Inject
    public ScheduleAttributeCodec(ConfigFactory cf)
    {
        this.cf = cf;
    }

    public ScheduleAttributes decode(ScheduleRow row)
    {
        Config data = decodeData(row.getId(), row.getData());
        String type = readType(row.getId(), data);
        data.remove(TYPE_KEY);

        return ScheduleAttributes.builder()
            .timezone(timezoneOf(row))
            .delay(row.getDelay())
            .cron(row.getCron())
            .data(data)
            .nextTime(Instant.ofEpochSecond(row.getNextTime()))
            .nextRunTime(Instant.ofEpochSecond(row.getTimeout()))
            .type(type)
            .build();
    }

    public TaskToken toToken(ScheduleRow row)
    {
        return TaskToken.builder()
            .rowId(row.getId())
            .scheduledTime(row.getNextTime())
            .cron(row.getCron())
            .delay(row.getDelay())
            .timezone(timezoneOf(row))
            .build();
    }

    // null and blank columns mean the default
    private static String timezoneOf(ScheduleRow row)
    {
        String timezone = row.getTimezone().or("").trim();
        return timezone.isEmpty() ? DEFAULT_TIMEZONE : timezone;
    }

    /**
     * Serializes a copy of the payload with the type set. The given payload is not modified.
     */
    public String encodeData(Config data, String type)
    {
        Config copy = data.deepCopy().set(TYPE_KEY, type);
        return cf.toJsonString(copy);
    }

    private Config decodeData(String id, Optional<String> json)
    {
        if (!json.isPresent()) {
            return cf.create();
        }
        try {
            return cf.fromJsonString(json.get());
        }
        catch (ConfigException ex) {
            logger.debug("Ignoring malformed data of schedule {}: {}", id, ex.getMessage());
            return cf.create();
        }
    }

    private String readType(String id, Config data)
    {
        try {
            return data.get(TYPE_KEY, String.class, "");
        }
        catch (ConfigException ex) {
            logger.debug("Ignoring invalid type of schedule {}: {}", id, ex.getMessage());
            return "";
        }
    }
}
