package io.perfectsched.core.schedule;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import io.perfectsched.core.schedule.InMemoryScheduleTable.AtomicCounter;
import io.perfectsched.core.session.SessionGuard;
import org.junit.Before;
import org.junit.Test;

import static io.perfectsched.core.schedule.ScheduleTestHelper.configFactory;
import static io.perfectsched.core.schedule.ScheduleTestHelper.row;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.empty;
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.is;

public class LeaseAcquirerTest
{
    private InMemoryScheduleTable table;
    private SessionGuard guard;
    private ScheduleAttributeCodec codec;

    @Before
    public void setUp()
    {
        table = new InMemoryScheduleTable();
        guard = new SessionGuard(table.sessionFactory(new AtomicCounter()), 1, 0);
        codec = new ScheduleAttributeCodec(configFactory());
    }

    private LeaseAcquirer acquirer(int batchSize)
    {
        return new LeaseAcquirer(guard, codec, Clock.fixed(Instant.ofEpochSecond(100), ZoneOffset.UTC), batchSize);
    }

    @Test
    public void nothingIsDue()
    {
        table.put(row("a", 101, 101));
        assertThat(acquirer(4).acquire(60, 1, Instant.ofEpochSecond(100)), is(empty()));
        assertThat(table.get("a").getTimeout(), is(101L));
    }

    @Test
    public void claimOldestDueRow()
    {
        table.put(row("a", 50, 50));
        table.put(ScheduleRow.builder()
                .id("b").timeout(10).nextTime(5).delay(5)
                .cron("0 * * * *").timezone("Asia/Tokyo").data("{\"type\":\"mail\",\"to\":\"x\"}")
                .build());
        table.put(row("c", 100, 100));

        List<Task> tasks = acquirer(4).acquire(60, 1, Instant.ofEpochSecond(100));

        assertThat(tasks, hasSize(1));
        Task task = tasks.get(0);
        assertThat(task.getKey(), is("b"));
        assertThat(task.getScheduledTime(), is(Instant.ofEpochSecond(5)));
        assertThat(task.getAttributes().getType(), is("mail"));
        assertThat(task.getAttributes().getNextRunTime(), is(Instant.ofEpochSecond(10)));
        assertThat(task.getToken(), is(TaskToken.builder()
                    .rowId("b")
                    .scheduledTime(5)
                    .cron("0 * * * *")
                    .delay(5)
                    .timezone("Asia/Tokyo")
                    .build()));

        assertThat(table.get("b").getTimeout(), is(160L));
        assertThat(table.get("b").getNextTime(), is(5L));
        assertThat(table.get("a").getTimeout(), is(50L));
    }

    @Test
    public void timeoutEqualToNowIsDue()
    {
        table.put(row("a", 100, 100));
        List<Task> tasks = acquirer(4).acquire(60, 1, Instant.ofEpochSecond(100));
        assertThat(tasks, hasSize(1));
        assertThat(tasks.get(0).getToken().getTimezone(), is("UTC"));
    }

    @Test
    public void claimAtMostOneTask()
    {
        table.put(row("a", 10, 10));
        table.put(row("b", 20, 20));
        assertThat(acquirer(4).acquire(60, 10, Instant.ofEpochSecond(100)), hasSize(1));
        assertThat(table.get("b").getTimeout(), is(20L));
    }

    @Test
    public void drainMoreRowsThanBatchSize()
    {
        for (int i = 0; i < 10; i++) {
            table.put(row("s" + i, i, i));
        }
        LeaseAcquirer acquirer = acquirer(4);

        Set<String> claimed = new HashSet<>();
        for (int i = 0; i < 10; i++) {
            List<Task> tasks = acquirer.acquire(60, 1, Instant.ofEpochSecond(100));
            assertThat(tasks, hasSize(1));
            assertThat(claimed.add(tasks.get(0).getKey()), is(true));
        }
        assertThat(claimed, hasSize(10));
        assertThat(acquirer.acquire(60, 1, Instant.ofEpochSecond(100)), is(empty()));
    }

    @Test
    public void skipRowClaimedByAnotherProcess()
    {
        table.put(row("a", 10, 10));
        table.put(row("b", 20, 20));
        table.setBeforeConditionalUpdate((id) -> {
            if (id.equals("a")) {
                // another process claims a first
                table.put(row("a", 1000, 10));
            }
        });

        List<Task> tasks = acquirer(4).acquire(60, 1, Instant.ofEpochSecond(100));

        assertThat(tasks, hasSize(1));
        assertThat(tasks.get(0).getKey(), is("b"));
        assertThat(table.get("a").getTimeout(), is(1000L));
        assertThat(table.getFindDueCount(), is(1));
    }

    @Test
    public void rescanWhenWholeBatchIsLost()
    {
        table.put(row("a", 10, 10));
        table.put(row("b", 20, 20));
        table.put(row("c", 30, 30));
        table.setBeforeConditionalUpdate((id) -> {
            if (!id.equals("c")) {
                table.put(row(id, 1000, table.get(id).getNextTime()));
            }
        });

        List<Task> tasks = acquirer(2).acquire(60, 1, Instant.ofEpochSecond(100));

        assertThat(tasks, hasSize(1));
        assertThat(tasks.get(0).getKey(), is("c"));
        assertThat(table.getFindDueCount(), is(2));
    }

    @Test
    public void noRescanWhenPartialBatchIsLost()
    {
        table.put(row("a", 10, 10));
        table.setBeforeConditionalUpdate((id) -> table.put(row(id, 1000, 10)));

        assertThat(acquirer(2).acquire(60, 1, Instant.ofEpochSecond(100)), is(empty()));
        assertThat(table.getFindDueCount(), is(1));
    }

    @Test
    public void useClockWithoutExplicitTime()
    {
        table.put(row("a", 100, 100));
        table.put(row("b", 101, 101));
        List<Task> tasks = acquirer(4).acquire(30, 1);
        assertThat(tasks, hasSize(1));
        assertThat(table.get("a").getTimeout(), is(130L));
        assertThat(acquirer(4).acquire(30, 1), is(empty()));
    }

    @Test(expected = IllegalArgumentException.class)
    public void rejectNonPositiveMaxAcquire()
    {
        acquirer(4).acquire(60, 0, Instant.ofEpochSecond(100));
    }

    @Test
    public void claimInOrderOfTimeout()
    {
        table.put(row("late", 30, 30));
        table.put(row("early", 10, 10));
        LeaseAcquirer acquirer = acquirer(4);
        String first = acquirer.acquire(60, 1, Instant.ofEpochSecond(100)).get(0).getKey();
        String second = acquirer.acquire(60, 1, Instant.ofEpochSecond(100)).get(0).getKey();
        assertThat(Arrays.asList(first, second), contains("early", "late"));
    }
}
