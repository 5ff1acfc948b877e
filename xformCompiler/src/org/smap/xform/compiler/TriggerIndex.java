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

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;

import org.apache.commons.lang3.StringUtils;
import org.smap.xform.Utilities.GeneralUtilityMethods;
import org.smap.xform.constants.XFormQuestionTypes;
import org.smap.xform.model.Question;
import org.smap.xform.model.SetValue;
import org.smap.xform.model.Survey;
import org.smap.xform.model.SurveyNode;

/*
 * The questions whose values are set when another question changes
 *   kind of trigger -> name of the triggering question -> questions to be set, in survey order
 */
public class TriggerIndex {

	private HashMap<String, HashMap<String, ArrayList<SetValue>>> triggers = new HashMap<> ();

	/*
	 * Build the index from the trigger of each question in the survey
	 */
	public static TriggerIndex build(Survey survey) {
		TriggerIndex index = new TriggerIndex();
		for(SurveyNode n : survey.getDescendants()) {
			if(n instanceof Question) {
				Question q = (Question) n;
				if(q.hasTrigger()) {
					String kind = XFormQuestionTypes.BACKGROUND_GEOPOINT.equals(q.type) ? SetValue.SETGEOPOINT : SetValue.SETVALUE;
					String value = StringUtils.isBlank(q.getCalculation()) ? null : q.getCalculation();
					for(String triggerQuestion : GeneralUtilityMethods.getXlsNames(q.trigger)) {
						index.add(kind, triggerQuestion, new SetValue(SetValue.TRIGGER, value, q.name));
					}
				}
			}
		}
		return index;
	}

	public void add(String kind, String triggerQuestion, SetValue target) {
		HashMap<String, ArrayList<SetValue>> kindTriggers = triggers.get(kind);
		if(kindTriggers == null) {
			kindTriggers = new HashMap<> ();
			triggers.put(kind, kindTriggers);
		}
		ArrayList<SetValue> targets = kindTriggers.get(triggerQuestion);
		if(targets == null) {
			targets = new ArrayList<SetValue> ();
			kindTriggers.put(triggerQuestion, targets);
		}
		targets.add(target);
	}

	/*
	 * Get the questions set when the named question changes, empty if there are none
	 */
	public List<SetValue> getTriggerValuesForQuestionName(String name, String kind) {
		HashMap<String, ArrayList<SetValue>> kindTriggers = triggers.get(kind);
		if(kindTriggers != null) {
			ArrayList<SetValue> targets = kindTriggers.get(name);
			if(targets != null) {
				return Collections.unmodifiableList(targets);
			}
		}
		return Collections.emptyList();
	}
}
