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
import java.util.ResourceBundle;

import org.smap.xform.Utilities.ApplicationException;
import org.smap.xform.Utilities.HiddenTriggerTargetException;
import org.smap.xform.Utilities.Localisation;
import org.smap.xform.Utilities.UnimplementedOperationException;
import org.smap.xform.compiler.builders.ControlBuilderRegistry;
import org.smap.xform.compiler.builders.IControlBuilder;
import org.smap.xform.model.Question;
import org.smap.xform.model.SetValue;
import org.smap.xform.model.SurveyNode;
import org.w3c.dom.Document;
import org.w3c.dom.Element;

/*
 * Compile a question into the control that is placed in the body of the XForm
 */
public class QuestionControlCompiler {

	private ControlBuilderRegistry registry;
	private ActionNester actionNester;
	private ResourceBundle localisation;

	public QuestionControlCompiler(ResourceBundle l) {
		this(ControlBuilderRegistry.createDefault(), new ActionNester(), l);
	}

	public QuestionControlCompiler(ControlBuilderRegistry registry, ActionNester actionNester, ResourceBundle l) {
		this.registry = registry;
		this.actionNester = actionNester;
		localisation = l;
	}

	/*
	 * Get the control of a question or null if the question is not shown
	 */
	public Element xmlControl(Document doc, SurveyNode node, SurveyTemplate template) throws ApplicationException {

		if(!(node instanceof Question)) {
			throw new UnimplementedOperationException(
					Localisation.getMessage(localisation, "xf_no_control", node.name, node.type));
		}
		Question q = (Question) node;

		if(q.isHidden()) {
			// A question that is not shown cannot have a change event
			List<SetValue> setValues = template.getTriggerValuesForQuestionName(q.name, SetValue.SETVALUE);
			if(setValues.size() > 0) {
				SetValue sv = setValues.get(0);
				throw new HiddenTriggerTargetException(
						Localisation.getMessage(localisation, "xf_hidden_trigger", q.name, sv.ref),
						q.name, sv.ref);
			}
			return null;
		}

		IControlBuilder builder = registry.getBuilder(q.variant);
		if(builder == null) {
			throw new ApplicationException(Localisation.getMessage(localisation, "xf_no_builder", q.name, q.type));
		}
		Element questionElement = builder.build(doc, q, template);

		if(questionElement != null) {
			List<SetValue> setValues = template.getTriggerValuesForQuestionName(q.name, SetValue.SETVALUE);
			List<SetValue> setGeopoints = template.getTriggerValuesForQuestionName(q.name, SetValue.SETGEOPOINT);

			if(setValues.size() > 0) {
				actionNester.nestActions(doc, questionElement, q, SetValue.SETVALUE_TAG, setValues, template);
			}
			if(setGeopoints.size() > 0) {
				actionNester.nestActions(doc, questionElement, q, SetValue.SETGEOPOINT_TAG, setGeopoints, template);
			}
		}

		return questionElement;
	}
}
