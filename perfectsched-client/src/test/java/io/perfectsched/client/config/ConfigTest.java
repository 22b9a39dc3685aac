package io.perfectsched.client.config;

import com.google.common.base.Optional;
import com.fasterxml.jackson.databind.JsonNode;
import io.perfectsched.client.ObjectMappers;
import org.junit.Before;
import org.junit.Test;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.is;
import static org.junit.Assert.fail;

public class ConfigTest
{
    private ConfigFactory cf;
    private Config config;

    @Before
    public void setUp()
    {
        cf = new ConfigFactory(ObjectMappers.objectMapper());
        config = cf.create();
    }

    @Test
    public void testSetGetPrimitives()
    {
        config.set("int", 1);
        config.set("str", "s");
        config.set("bool", true);

        assertThat(config.get("int", int.class), is(1));
        assertThat(config.get("int", long.class), is(1L));
        assertThat(config.get("str", String.class), is("s"));
        assertThat(config.get("bool", boolean.class), is(true));
        assertThat(config.get("int", String.class), is("1"));
    }

    @Test
    public void testDefaultsAndOptional()
    {
        config.set("k", "v");
        assertThat(config.get("missing", int.class, 10), is(10));
        assertThat(config.getOptional("missing", String.class), is(Optional.absent()));
        assertThat(config.getOptional("k", String.class), is(Optional.of("v")));
    }

    @Test
    public void testRequiredKey()
    {
        try {
            config.get("url", String.class);
            fail();
        }
        catch (ConfigException ex) {
            assertThat(ex.getMessage(), containsString("'url' is required"));
        }
    }

    @Test
    public void testInvalidType()
    {
        config.set("retry", "many");
        try {
            config.get("retry", int.class);
            fail();
        }
        catch (ConfigException ex) {
            assertThat(ex.getMessage(), containsString("Expected integer (int) type for key 'retry'"));
        }
    }

    @Test
    public void testJsonRoundTrip()
    {
        config.set("a", 1).set("nested", cf.create().set("b", "c"));
        Config parsed = cf.fromJsonString(cf.toJsonString(config));
        assertThat(parsed, is(config));
        assertThat(parsed.getKeys(), contains("a", "nested"));
        assertThat(parsed.get("nested", JsonNode.class).get("b").asText(), is("c"));
    }

    @Test
    public void testDeepCopyIsIndependent()
    {
        config.set("a", 1);
        Config copy = config.deepCopy().set("a", 2).remove("missing");
        assertThat(config.get("a", int.class), is(1));
        assertThat(copy.get("a", int.class), is(2));
    }

    @Test
    public void testFromJsonStringRejectsNonObject()
    {
        try {
            cf.fromJsonString("[1, 2]");
            fail();
        }
        catch (ConfigException ex) {
            assertThat(ex.getMessage(), containsString("Expected a JSON object"));
        }
        try {
            cf.fromJsonString("{broken");
            fail();
        }
        catch (ConfigException ex) {
        }
    }
}
