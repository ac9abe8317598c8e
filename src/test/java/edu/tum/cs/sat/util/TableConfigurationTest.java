package edu.tum.cs.sat.util;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;

import java.util.Properties;

import org.junit.Test;

import edu.tum.cs.sat.SummedAreaTable;

public class TableConfigurationTest {

	@Test
	public void testDefaults() {
		TableConfiguration config = new TableConfiguration(SummedAreaTable.class, new Properties());
		assertTrue(config.isValidatingCoordinates());
		assertTrue(config.isCheckingOverflow());
		assertEquals("x", config.getLocalProperty("missing", "x"));
	}

	@Test
	public void testClasspathResource() {
		TableConfiguration config = SummedAreaTable.getDefaultConfiguration();
		assertEquals("true", config.getLocalProperty(TableConfiguration.PROP_VALIDATE_COORDINATES, null).trim());
		assertTrue(config.isValidatingCoordinates());
		assertTrue(config.isCheckingOverflow());
		assertSame(config, SummedAreaTable.getDefaultConfiguration());
	}

	@Test
	public void testLocalProperties() {
		Properties props = new Properties();
		props.setProperty("SummedAreaTable." + TableConfiguration.PROP_CHECK_OVERFLOW, "false");
		props.setProperty(TableConfiguration.PROP_VALIDATE_COORDINATES, "false");
		TableConfiguration config = new TableConfiguration(SummedAreaTable.class, props);
		assertFalse(config.isCheckingOverflow());
		// unqualified keys do not apply
		assertTrue(config.isValidatingCoordinates());
		assertFalse(config.getBooleanProperty(TableConfiguration.PROP_VALIDATE_COORDINATES, null));
	}

	@Test(expected = RuntimeException.class)
	public void testMissingRequiredProperty() {
		new TableConfiguration(SummedAreaTable.class, new Properties()).getLocalBooleanProperty("missing", null);
	}

}
