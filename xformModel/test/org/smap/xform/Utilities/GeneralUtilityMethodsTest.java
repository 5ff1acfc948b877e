package org.smap.xform.Utilities;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import java.util.Arrays;

import org.junit.Test;

public class GeneralUtilityMethodsTest {

	@Test
	public void testIsReference() {
		assertTrue(GeneralUtilityMethods.isReference("${age}"));
		assertTrue(GeneralUtilityMethods.isReference("${age} > 18"));
		assertTrue(GeneralUtilityMethods.isReference("${last-saved#age}"));
		assertFalse(GeneralUtilityMethods.isReference("colors"));
		assertFalse(GeneralUtilityMethods.isReference("$age"));
		assertFalse(GeneralUtilityMethods.isReference(null));
	}

	@Test
	public void testGetXlsNames() {
		assertEquals(Arrays.asList("a", "b"), GeneralUtilityMethods.getXlsNames("${a} + ${last-saved#b}"));
		assertTrue(GeneralUtilityMethods.getXlsNames("1 + 2").isEmpty());
		assertTrue(GeneralUtilityMethods.getXlsNames(null).isEmpty());
	}

	@Test
	public void testGetNameFromXlsName() {
		assertEquals("age", GeneralUtilityMethods.getNameFromXlsName("${age}"));
		assertEquals("age", GeneralUtilityMethods.getNameFromXlsName(" age "));
	}

	@Test
	public void testSplitExtension() {
		assertArrayEquals(new String[] {"fruits", ".csv"}, GeneralUtilityMethods.splitExtension("fruits.csv"));
		assertArrayEquals(new String[] {"colors", ""}, GeneralUtilityMethods.splitExtension("colors"));
		assertArrayEquals(new String[] {"media/stores", ".geojson"}, GeneralUtilityMethods.splitExtension("media/stores.geojson"));
		assertArrayEquals(new String[] {"my.dir/colors", ""}, GeneralUtilityMethods.splitExtension("my.dir/colors"));
		assertArrayEquals(new String[] {".hidden", ""}, GeneralUtilityMethods.splitExtension(".hidden"));
	}

	@Test
	public void testDefaultIsDynamic() {
		assertFalse(GeneralUtilityMethods.defaultIsDynamic("42", "int"));
		assertFalse(GeneralUtilityMethods.defaultIsDynamic("hello", "string"));
		assertFalse(GeneralUtilityMethods.defaultIsDynamic("2020-01-01", "date"));
		assertFalse(GeneralUtilityMethods.defaultIsDynamic("", "string"));
		assertFalse(GeneralUtilityMethods.defaultIsDynamic(null, "string"));

		assertTrue(GeneralUtilityMethods.defaultIsDynamic("${age} + 1", "int"));
		assertTrue(GeneralUtilityMethods.defaultIsDynamic("today()", "date"));
		assertTrue(GeneralUtilityMethods.defaultIsDynamic("5 * 3", "int"));
		assertTrue(GeneralUtilityMethods.defaultIsDynamic("/data/age", "int"));
	}
}
