package org.smap.xform.compiler.builders;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;
import static org.smap.xform.compiler.SurveyFixtures.child;
import static org.smap.xform.compiler.SurveyFixtures.childCount;
import static org.smap.xform.compiler.SurveyFixtures.question;

import org.junit.Before;
import org.junit.Test;
import org.smap.xform.Utilities.ApplicationException;
import org.smap.xform.compiler.ItemsetNodesetCompiler;
import org.smap.xform.compiler.SurveyFixtures;
import org.smap.xform.model.Label;
import org.smap.xform.model.Option;
import org.smap.xform.model.Question;
import org.smap.xform.model.QuestionVariant;
import org.smap.xform.model.Survey;
import org.smap.xform.model.Tag;
import org.w3c.dom.Document;
import org.w3c.dom.Element;

public class ControlBuildersTest {

	private Document doc;
	private Survey survey;

	@Before
	public void setUp() throws Exception {
		doc = SurveyFixtures.newDocument();
		survey = new Survey("data");
	}

	@Test
	public void testDefaultRegistryIsComplete() {
		ControlBuilderRegistry registry = ControlBuilderRegistry.createDefault();
		assertTrue(registry.isComplete());
		assertTrue(registry.getBuilder(QuestionVariant.SELECT_ONE) instanceof MultipleChoiceControlBuilder);
		assertTrue(registry.getBuilder(QuestionVariant.OSM_UPLOAD) instanceof OsmUploadControlBuilder);

		ControlBuilderRegistry partial = new ControlBuilderRegistry();
		partial.register(new InputControlBuilder());
		assertFalse(partial.isComplete());
		assertNull(partial.getBuilder(QuestionVariant.RANGE));
	}

	@Test
	public void testInput() throws Exception {
		Question q = question(survey, "name", "text", "Name");
		q.hint = new Label("Family name");
		q.control.put("appearance", "multiline");

		Element e = new InputControlBuilder().build(doc, q, SurveyFixtures.template(survey));
		assertEquals("input", e.getTagName());
		assertEquals("/data/name", e.getAttribute("ref"));
		assertEquals("multiline", e.getAttribute("appearance"));
		assertFalse(e.hasAttribute("tag"));
		assertEquals(2, childCount(e));
		assertEquals("label", child(e, 0).getTagName());
		assertEquals("hint", child(e, 1).getTagName());

		// The question is not changed by building its control
		assertEquals("input", q.control.get("tag"));
		assertFalse(q.control.containsKey("ref"));
	}

	@Test
	public void testControlAttributesAreResolved() throws Exception {
		question(survey, "mode", "text", "Mode");
		Question q = question(survey, "name", "text", "Name");
		q.control.put("appearance", "${mode}");

		Element e = new InputControlBuilder().build(doc, q, SurveyFixtures.template(survey));
		assertEquals(" /data/mode ", e.getAttribute("appearance"));
	}

	@Test
	public void testExternalSelectQuery() throws Exception {
		question(survey, "state", "text", "State");
		Question q = question(survey, "city", "select one external", "City");
		q.query = "cities";
		q.choice_filter = "state=${state}";

		Element e = new InputControlBuilder().build(doc, q, SurveyFixtures.template(survey));
		assertEquals("input", e.getTagName());
		assertEquals("instance('cities')/root/item[state= /data/state ]", e.getAttribute("query"));
	}

	@Test
	public void testUpload() throws Exception {
		Question q = question(survey, "pic", "image", "Picture");

		Element e = new UploadControlBuilder().build(doc, q, SurveyFixtures.template(survey));
		assertEquals("upload", e.getTagName());
		assertEquals("image/*", e.getAttribute("mediatype"));
		assertEquals("/data/pic", e.getAttribute("ref"));
	}

	@Test
	public void testUploadWithoutMediatype() throws Exception {
		Question q = question(survey, "pic", "image", "Picture");
		q.control.remove("mediatype");

		try {
			new UploadControlBuilder().build(doc, q, SurveyFixtures.template(survey));
			fail("Expected a missing mediatype error");
		} catch (ApplicationException e) {
			assertEquals("The upload question 'pic' does not have a mediatype.", e.getMessage());
		}
	}

	@Test
	public void testOsmUpload() throws Exception {
		Question q = question(survey, "building", "osm", "Building");
		Tag height = new Tag("height", "Height");
		height.addChild(new Option("low", "Low"));
		height.addChild(new Option("high", "High"));
		q.addChild(height);

		Element e = new OsmUploadControlBuilder().build(doc, q, SurveyFixtures.template(survey));
		assertEquals("upload", e.getTagName());
		assertEquals("osm/*", e.getAttribute("mediatype"));
		assertEquals(2, childCount(e));
		Element tag = child(e, 1);
		assertEquals("tag", tag.getTagName());
		assertEquals("height", tag.getAttribute("key"));
		assertEquals(3, childCount(tag));
	}

	@Test
	public void testRange() throws Exception {
		Question q = question(survey, "score", "range", "Score");
		q.parameters.put("start", "1");
		q.parameters.put("end", "10");
		q.parameters.put("step", "1");

		Element e = new RangeControlBuilder().build(doc, q, SurveyFixtures.template(survey));
		assertEquals("range", e.getTagName());
		assertEquals("1", e.getAttribute("start"));
		assertEquals("10", e.getAttribute("end"));
		assertEquals("1", e.getAttribute("step"));
		assertEquals("/data/score", e.getAttribute("ref"));
	}

	@Test
	public void testTrigger() throws Exception {
		Question q = question(survey, "ok", "acknowledge", "Confirm");

		Element e = new TriggerControlBuilder().build(doc, q, SurveyFixtures.template(survey));
		assertEquals("trigger", e.getTagName());
		assertEquals("/data/ok", e.getAttribute("ref"));
		assertEquals("Confirm", child(e, 0).getTextContent());
	}

	@Test
	public void testSelectWithAppearance() throws Exception {
		Question q = question(survey, "fruit", "select one", "Fruit");
		q.control.put("appearance", "minimal");
		q.itemset = "fruits.csv";

		Element e = new MultipleChoiceControlBuilder(new ItemsetNodesetCompiler())
				.build(doc, q, SurveyFixtures.template(survey));
		assertEquals("select1", e.getTagName());
		assertEquals("minimal", e.getAttribute("appearance"));
		Element itemset = child(e, 1);
		assertEquals("instance('fruits')/root/item", itemset.getAttribute("nodeset"));
		assertEquals("value", child(itemset, 0).getAttribute("ref"));
		assertEquals("label", child(itemset, 1).getAttribute("ref"));
	}

	@Test
	public void testNoControl() throws Exception {
		Question q = question(survey, "start", "start");
		assertNull(new NoControlBuilder().build(doc, q, SurveyFixtures.template(survey)));
	}
}
