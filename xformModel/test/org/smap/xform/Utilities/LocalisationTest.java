package org.smap.xform.Utilities;

import static org.junit.Assert.assertEquals;

import java.util.Locale;
import java.util.ResourceBundle;

import org.junit.Test;

public class LocalisationTest {

	@Test
	public void testParametersAreReplaced() {
		ResourceBundle localisation = Localisation.getBundle(Locale.ENGLISH);
		assertEquals("The question ${a} is not user-visible so it can't be used as a calculation trigger for question ${b}.",
				Localisation.getMessage(localisation, "xf_hidden_trigger", "a", "b"));
		assertEquals("Unknown question type 'texty'.",
				Localisation.getMessage(localisation, "xf_unknown_type", "texty", null));
	}

	@Test
	public void testMissingLocaleFallsBackToDefaultMessages() {
		ResourceBundle localisation = Localisation.getBundle(Locale.JAPANESE);
		assertEquals("Unknown question type 'x'.", Localisation.getMessage(localisation, "xf_unknown_type", "x", null));
	}

	@Test
	public void testParameterContainingPlaceholder() {
		ResourceBundle localisation = Localisation.getBundle(Locale.ENGLISH);
		assertEquals("The question ${rate_%s2} is not user-visible so it can't be used as a calculation trigger for question ${total}.",
				Localisation.getMessage(localisation, "xf_hidden_trigger", "rate_%s2", "total"));
	}
}
