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

import java.util.List;

import org.smap.xform.Utilities.ApplicationException;
import org.smap.xform.model.Question;
import org.smap.xform.model.SetValue;
import org.w3c.dom.Document;
import org.w3c.dom.Element;

/*
 * Add the actions that are triggered by a change to a question inside the question's control
 */
public class ActionNester {

	/**
	 * @param doc The document being built
	 * @param questionElement The control of the triggering question
	 * @param q The triggering question
	 * @param tag The action element, setvalue or odk:setgeopoint
	 * @param targets The questions to be set, in the order the actions are added
	 * @param template The survey
	 */
	public void nestActions(Document doc, Element questionElement, Question q, String tag,
			List<SetValue> targets, SurveyTemplate template) throws ApplicationException {

		for(SetValue sv : targets) {
			Element actionElement = doc.createElement(tag);

			// The reference is to the question being set, not the question that triggers it
			String reference = template.insertXPaths("${" + sv.ref + "}", template.getSurvey()).trim();
			actionElement.setAttribute("ref", reference);
			actionElement.setAttribute("event", sv.event);

			if(sv.value != null && sv.value.length() > 0) {
				actionElement.setAttribute("value", template.insertXPaths(sv.value, q));
			}
			questionElement.appendChild(actionElement);
		}
	}
}
