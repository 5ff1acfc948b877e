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

package org.smap.xform.model;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.ResourceBundle;

import org.apache.commons.lang3.StringUtils;
import org.smap.xform.Utilities.ApplicationException;
import org.smap.xform.Utilities.Localisation;
import org.smap.xform.Utilities.UnknownTypeException;
import org.smap.xform.constants.XFormQuestionTypes;

/*
 * A question in a survey
 * The variant determines the control that the question is compiled into
 */
public class Question extends SurveyNode {

	public QuestionVariant variant = QuestionVariant.INPUT;
	public LinkedHashMap<String, String> parameters = new LinkedHashMap<> ();
	public String itemset;				// Choice list, external file or ${question} of a previous answer
	public String choice_filter;
	public String query;				// Secondary instance of a "select one external" question
	public String trigger;				// ${name} of the question whose change sets this question's value

	// Set when the survey definition is read, from the choice list used by the itemset
	public boolean itemsetMultiLanguage;
	public boolean itemsetHasMedia;
	public boolean itemsetDynLabel;

	public Question() {
	}

	public Question(String name, String type) {
		super(name, type);
	}

	/*
	 * Create a question with the control and bind defaults of its type
	 */
	public static Question create(String name, String type, ResourceBundle localisation) throws UnknownTypeException {
		QuestionTypeDefinition def = QuestionTypeDictionary.get(type);
		if(def == null) {
			throw new UnknownTypeException(Localisation.getMessage(localisation, "xf_unknown_type", type, null), type);
		}
		Question q = new Question(name, type);
		q.variant = def.getVariant();
		q.control.putAll(def.getControl());
		q.bind.putAll(def.getBind());
		return q;
	}

	public String getBindType() {
		return bind.get("type");
	}

	public String getCalculation() {
		return bind.get("calculate");
	}

	public boolean hasTrigger() {
		return StringUtils.isNotBlank(trigger);
	}

	/*
	 * A calculation, or a question that is set by a calculation or trigger but has no text, is not shown
	 */
	public boolean isHidden() {
		if(XFormQuestionTypes.CALCULATE.equals(type)) {
			return true;
		}
		return (StringUtils.isNotEmpty(getCalculation()) || hasTrigger()) && !(hasLabel() || hasHint());
	}

	public List<Option> getOptions() {
		ArrayList<Option> options = new ArrayList<> ();
		for(SurveyNode n : getChildren()) {
			if(n instanceof Option) {
				options.add((Option) n);
			}
		}
		return options;
	}

	public List<Tag> getTags() {
		ArrayList<Tag> tags = new ArrayList<> ();
		for(SurveyNode n : getChildren()) {
			if(n instanceof Tag) {
				tags.add((Tag) n);
			}
		}
		return tags;
	}

	@Override
	public void validate(ResourceBundle localisation) throws ApplicationException {

		// Make sure that the type of this question exists in the question type dictionary
		if(!QuestionTypeDictionary.contains(type)) {
			throw new UnknownTypeException(Localisation.getMessage(localisation, "xf_unknown_type", type, null), type);
		}

		super.validate(localisation);
	}
}
