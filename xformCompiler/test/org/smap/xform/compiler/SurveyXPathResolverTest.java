package org.smap.xform.compiler;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.fail;
import static org.smap.xform.compiler.SurveyFixtures.question;

import org.junit.Before;
import org.junit.Test;
import org.smap.xform.Utilities.ApplicationException;
import org.smap.xform.model.Question;
import org.smap.xform.model.Section;
import org.smap.xform.model.Survey;

public class SurveyXPathResolverTest {

	private Survey survey;
	private Question q1;
	private Question q2;
	private Question sibling;
	private Question q3;
	private Question q4;
	private SurveyTemplate template;

	/*
	 * data
	 *   q1
	 *   rep (repeat)
	 *     q2, sibling
	 *     grp (group)
	 *       q3
	 *     inner (repeat)
	 *       q4
	 */
	@Before
	public void setUp() throws Exception {
		survey = new Survey("data");
		q1 = question(survey, "q1", "text", "Q1");
		Section rep = new Section("rep", "repeat");
		survey.addChild(rep);
		q2 = question(rep, "q2", "text", "Q2");
		sibling = question(rep, "sibling", "text", "Sibling");
		Section grp = new Section("grp", "group");
		rep.addChild(grp);
		q3 = question(grp, "q3", "text", "Q3");
		Section inner = new Section("inner", "repeat");
		rep.addChild(inner);
		q4 = question(inner, "q4", "text", "Q4");

		template = SurveyFixtures.template(survey);
	}

	@Test
	public void testAbsolutePath() throws Exception {
		assertEquals(" /data/q1  + 1", template.insertXPaths("${q1} + 1", q2));
		assertEquals("concat( /data/rep/q2 , 'x')", template.insertXPaths("concat(${q2}, 'x')", q1));
	}

	@Test
	public void testNoReferences() throws Exception {
		assertEquals("today()", template.insertXPaths("today()", q1));
		assertNull(template.insertXPaths(null, q1));
	}

	@Test
	public void testMissingElement() throws Exception {
		try {
			template.insertXPaths("${nope} = 1", q1);
			fail("Expected a missing element error");
		} catch (ApplicationException e) {
			assertEquals("There has been a problem trying to replace ${nope} with the XPath to the survey element"
					+ " named 'nope'. There is no survey element with this name.", e.getMessage());
		}
	}

	@Test
	public void testDuplicateName() throws Exception {
		Section other = new Section("other", "group");
		survey.addChild(other);
		question(other, "q1", "integer", "Again");
		template = SurveyFixtures.template(survey);

		try {
			template.insertXPaths("${q1}", q2);
			fail("Expected a duplicate name error");
		} catch (ApplicationException e) {
			assertEquals("There has been a problem trying to replace ${q1} with the XPath to the survey element"
					+ " named 'q1'. There are multiple survey elements with this name.", e.getMessage());
		}
	}

	@Test
	public void testLastSaved() throws Exception {
		assertEquals(" instance('__last-saved')/data/q1 ", template.insertXPaths("${last-saved#q1}", q1));
		assertEquals(" instance('__last-saved')/data/rep/q2 ", template.insertXPaths("${last-saved#q2}", sibling));
	}

	@Test
	public void testRelativePathInRepeat() throws Exception {
		assertEquals(" ../q2 ", template.insertXPaths("${q2}", sibling));
		assertEquals(" ../../q2 ", template.insertXPaths("${q2}", q3));
		assertEquals(" ../../q2 ", template.insertXPaths("${q2}", q4));
	}

	@Test
	public void testRelativePathInPredicate() throws Exception {
		assertEquals(" current()/../q2 ", template.insertXPaths("${q2}", sibling, true));
		assertEquals(" ../q2 ", template.insertXPaths("${q2}", sibling, true, true));
	}

	@Test
	public void testReferenceParentIsAbsolute() throws Exception {
		assertEquals(" /data/rep/q2 ", template.insertXPaths("${q2}", sibling, false, false, true));
	}

	@Test
	public void testDifferentRepeatsAreAbsolute() throws Exception {
		Section second = new Section("second", "repeat");
		survey.addChild(second);
		Question q5 = question(second, "q5", "text", "Q5");
		template = SurveyFixtures.template(survey);

		assertEquals(" /data/rep/q2 ", template.insertXPaths("${q2}", q5));
	}

	@Test
	public void testSurveyContextIsAbsolute() throws Exception {
		assertEquals(" /data/rep/q2 ", template.insertXPaths("${q2}", survey));
	}
}
