package io.perfectsched.standards.cron;

import java.util.Date;
import java.util.Locale;
import java.util.Map;
import java.util.TimeZone;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;

import com.google.common.base.Optional;
import com.google.common.collect.ImmutableMap;
import io.perfectsched.client.config.ConfigException;
import io.perfectsched.spi.CronEvaluator;
import it.sauronsoftware.cron4j.InvalidPatternException;
import it.sauronsoftware.cron4j.Predictor;
import it.sauronsoftware.cron4j.SchedulingPattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class Cron4jEvaluator
        implements CronEvaluator
{
    private static final Logger logger = LoggerFactory.getLogger(Cron4jEvaluator.class);

    private static final Map<String, String> ALIASES = ImmutableMap.<String, String>builder()
        .put("@yearly", "0 0 1 1 *")
        .put("@annually", "0 0 1 1 *")
        .put("@monthly", "0 0 1 * *")
        .put("@weekly", "0 0 * * 0")
        .put("@daily", "0 0 * * *")
        .put("@midnight", "0 0 * * *")
        .put("@hourly", "0 * * * *")
        .build();

    @Override
    public Instant nextOccurrence(Optional<String> cron, Instant afterTime, ZoneId timeZone)
    {
        if (!cron.isPresent()) {
            // one-shot schedule
            logger.debug("Schedule has no cron expression. Next occurrence is the end of schedule");
            return SCHEDULE_END;
        }

        SchedulingPattern pattern = compile(cron.get(), timeZone);
        Predictor predictor = new Predictor(pattern, Date.from(afterTime));
        predictor.setTimeZone(TimeZone.getTimeZone(timeZone));
        return Instant.ofEpochSecond(predictor.nextMatchingTime() / 1000);
    }

    @Override
    public void validate(String cron)
    {
        compile(cron, ZoneOffset.UTC);
    }

    static String expand(String cron)
    {
        String trimmed = cron.trim();
        String alias = ALIASES.get(trimmed.toLowerCase(Locale.ENGLISH));
        return alias != null ? alias : trimmed;
    }

    private static SchedulingPattern compile(String cron, ZoneId timeZone)
    {
        try {
            return new SchedulingPattern(expand(cron)) {
                // workaround for a bug of cron4j:
                // https://gist.github.com/frsyuki/618c4e6c1f5f876e4ee74b9da2fd37c0
                @Override
                public boolean match(long millis)
                {
                    return match(TimeZone.getTimeZone(timeZone), millis);
                }
            };
        }
        catch (InvalidPatternException ex) {
            throw new ConfigException("Invalid cron expression: " + cron, ex);
        }
    }
}
