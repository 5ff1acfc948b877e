/*****************************************************************************

This file is part of SMAP.

SMAP is free software: you can redistribute it and/or modify
it under the terms of the GNU General Public License as published by
the Free Software Foundation, either version 3 of the License, or
(at your option) any later version.

SMAP is distributed in the hope that it will be useful,
but WITHOUT ANY WARRANTY; without even the implied warranty of
MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
GNU General Public License for more details.

You should have received a copy of the GNU General Public License
along with SMAP.  If not, see <http://www.gnu.org/licenses/>.

 ******************************************************************************/

package org.smap.xform.compiler;

import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.ResourceBundle;
import java.util.logging.Logger;

import org.smap.xform.Utilities.ApplicationException;
import org.smap.xform.model.Option;
import org.smap.xform.model.SetValue;
import org.smap.xform.model.Survey;
import org.smap.xform.model.SurveyNode;
import org.smap.xform.model.Tag;

/*
 * A survey prepared for compilation
 * The element index, question paths and triggers are built once from the survey and are then only read
 */
public class SurveyTemplate {

	private static Logger log =
			 Logger.getLogger(SurveyTemplate.class.getName());

	private Survey survey;
	private HashMap<String, SurveyNode> elements = new HashMap<> ();
	private HashSet<String> duplicateNames = new HashSet<> ();
	private TriggerIndex triggers;
	private XPathResolver resolver;

	private ResourceBundle localisation;

	public SurveyTemplate(ResourceBundle l) {
		localisation = l;
	}

	/*
	 * Index the elements of a survey
	 */
	public void load(Survey s) {
		survey = s;
		elements.clear();
		duplicateNames.clear();

		for(SurveyNode n : s.getDescendants()) {
			if(n == s || n instanceof Option || n instanceof Tag) {
				continue;
			}
			if(elements.containsKey(n.name)) {
				log.info("Duplicate survey element name: " + n.name);
				duplicateNames.add(n.name);
			} else {
				elements.put(n.name, n);
			}
		}

		triggers = TriggerIndex.build(s);
		if(resolver == null) {
			resolver = new SurveyXPathResolver(this, localisation);
		}
	}

	public Survey getSurvey() {
		return survey;
	}

	public ResourceBundle getLocalisation() {
		return localisation;
	}

	/*
	 * Get a survey element by name, null if there is no element with the name
	 */
	public SurveyNode getElement(String name) {
		return elements.get(name);
	}

	public boolean isDuplicateName(String name) {
		return duplicateNames.contains(name);
	}

	public void setResolver(XPathResolver resolver) {
		this.resolver = resolver;
	}

	public List<SetValue> getTriggerValuesForQuestionName(String name, String kind) {
		return triggers.getTriggerValuesForQuestionName(name, kind);
	}

	public String insertXPaths(String expression, SurveyNode context) throws ApplicationException {
		return resolver.insertXPaths(expression, context, false, false, false);
	}

	public String insertXPaths(String expression, SurveyNode context, boolean predicate) throws ApplicationException {
		return resolver.insertXPaths(expression, context, predicate, false, false);
	}

	public String insertXPaths(String expression, SurveyNode context, boolean predicate,
			boolean previousQuestion) throws ApplicationException {
		return resolver.insertXPaths(expression, context, predicate, previousQuestion, false);
	}

	public String insertXPaths(String expression, SurveyNode context, boolean predicate,
			boolean previousQuestion, boolean referenceParent) throws ApplicationException {
		return resolver.insertXPaths(expression, context, predicate, previousQuestion, referenceParent);
	}
}
