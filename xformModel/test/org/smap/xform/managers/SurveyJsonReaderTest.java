package org.smap.xform.managers;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.util.ResourceBundle;

import org.junit.Before;
import org.junit.Test;
import org.smap.xform.Utilities.ApplicationException;
import org.smap.xform.Utilities.Localisation;
import org.smap.xform.Utilities.UnknownTypeException;
import org.smap.xform.model.Option;
import org.smap.xform.model.Question;
import org.smap.xform.model.QuestionVariant;
import org.smap.xform.model.Section;
import org.smap.xform.model.Survey;
import org.smap.xform.model.Tag;

public class SurveyJsonReaderTest {

	private ResourceBundle localisation;
	private SurveyJsonReader reader;

	@Before
	public void setUp() {
		localisation = Localisation.getDefaultBundle();
		reader = new SurveyJsonReader(localisation);
	}

	private Survey readResource(String name) throws Exception {
		try (Reader r = new InputStreamReader(getClass().getResourceAsStream(name), StandardCharsets.UTF_8)) {
			return reader.read(r);
		}
	}

	@Test
	public void testReadSurveyTree() throws Exception {
		Survey survey = readResource("/surveys/household.json");

		assertEquals("data", survey.name);
		assertEquals("household", survey.id_string);
		assertEquals(5, survey.getChildren().size());

		Question name = (Question) survey.getChildren().get(0);
		assertEquals(QuestionVariant.INPUT, name.variant);
		assertEquals("input", name.control.get("tag"));
		assertEquals("string", name.getBindType());
		assertEquals("Name", name.label.text);
		assertEquals("multiline", name.control.get("appearance"));

		Question fruit = (Question) survey.getChildren().get(1);
		assertEquals(QuestionVariant.SELECT_ONE, fruit.variant);
		assertEquals("string", fruit.getBindType());
		assertTrue(fruit.label.isMultiLanguage());
		assertEquals("Fruit", fruit.label.translations.get("English"));
		assertEquals(2, fruit.getOptions().size());
		Option pear = fruit.getOptions().get(1);
		assertEquals("pear", pear.name);
		assertEquals("Pear", pear.label.text);
		assertEquals("/data/fruit/pear", pear.getXPath());

		Section people = (Section) survey.getChildren().get(2);
		assertTrue(people.isRepeat());
		Question age = (Question) people.getChildren().get(0);
		assertEquals("/data/people/age", age.getXPath());
		assertEquals("int", age.getBindType());
		assertEquals(people, age.getRepeat());

		Question building = (Question) survey.getChildren().get(3);
		assertEquals(QuestionVariant.OSM_UPLOAD, building.variant);
		assertEquals("osm/*", building.control.get("mediatype"));
		assertEquals(1, building.getTags().size());
		Tag height = building.getTags().get(0);
		assertEquals("height", height.name);
		assertEquals(2, height.getOptions().size());

		Question city = (Question) survey.getChildren().get(4);
		assertEquals("cities", city.itemset);
		assertEquals("state = ${state}", city.choice_filter);
		assertEquals("true", city.parameters.get("randomize"));
		assertEquals("7", city.parameters.get("seed"));
		assertTrue(city.itemsetMultiLanguage);
		assertFalse(city.itemsetHasMedia);
		assertTrue(city.getOptions().isEmpty());
	}

	@Test
	public void testSelectOneBindTypeIsString() throws Exception {
		Survey survey = reader.read("{\"type\": \"survey\", \"name\": \"data\", \"children\": ["
				+ "{\"type\": \"select one\", \"name\": \"s\", \"label\": \"S\", \"bind\": {\"type\": \"int\", \"required\": \"true()\"},"
				+ " \"choices\": [{\"name\": \"a\", \"label\": \"A\"}]}]}");
		Question s = (Question) survey.getChildren().get(0);
		assertEquals("string", s.getBindType());
		assertEquals("true()", s.bind.get("required"));
	}

	@Test
	public void testItemsetThatIsNotAString() throws Exception {
		Survey survey = reader.read("{\"type\": \"survey\", \"name\": \"data\", \"children\": ["
				+ "{\"type\": \"select all that apply\", \"name\": \"s\", \"label\": \"S\", \"itemset\": {\"list\": \"x\"},"
				+ " \"children\": [{\"name\": \"a\", \"label\": \"A\"}]}]}");
		Question s = (Question) survey.getChildren().get(0);
		assertNull(s.itemset);
		assertEquals(1, s.getOptions().size());
	}

	@Test
	public void testUnknownType() throws Exception {
		try {
			reader.read("{\"type\": \"survey\", \"name\": \"data\", \"children\": [{\"type\": \"texty\", \"name\": \"x\"}]}");
			fail("Expected an unknown type error");
		} catch (UnknownTypeException e) {
			assertEquals("Unknown question type 'texty'.", e.getMessage());
			assertEquals("texty", e.getType());
		}
	}

	@Test(expected = ApplicationException.class)
	public void testInvalidJson() throws Exception {
		reader.read("{\"type\": \"survey\", ");
	}

	@Test(expected = ApplicationException.class)
	public void testSurveyMustBeAnObject() throws Exception {
		reader.read("[1, 2]");
	}
}
