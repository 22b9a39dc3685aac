package io.perfectsched.standards;

import com.google.inject.Binder;
import com.google.inject.Module;
import com.google.inject.Scopes;
import io.perfectsched.spi.CronEvaluator;
import io.perfectsched.standards.cron.Cron4jEvaluator;

public class StandardsModule
    implements Module
{
    @Override
    public void configure(Binder binder)
    {
        binder.bind(CronEvaluator.class).to(Cron4jEvaluator.class).in(Scopes.SINGLETON);
    }
}
