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

package org.smap.xform.compiler.builders;

import org.smap.xform.Utilities.ApplicationException;
import org.smap.xform.Utilities.InvalidBindTypeException;
import org.smap.xform.Utilities.Localisation;
import org.smap.xform.compiler.ItemsetNodesetCompiler;
import org.smap.xform.compiler.SurveyTemplate;
import org.smap.xform.constants.XFormQuestionTypes;
import org.smap.xform.model.Question;
import org.smap.xform.model.QuestionVariant;
import org.w3c.dom.Document;
import org.w3c.dom.Element;

/**
 * Select one, select multiple and rank controls
 * The choices are either listed as items or identified by an itemset
 */
public class MultipleChoiceControlBuilder extends AbstractControlBuilder {

	private ItemsetNodesetCompiler itemsetCompiler;

	public MultipleChoiceControlBuilder(ItemsetNodesetCompiler itemsetCompiler) {
		this.itemsetCompiler = itemsetCompiler;
	}

	@Override
	public QuestionVariant [] getVariants() {
		return new QuestionVariant[] { QuestionVariant.MULTIPLE_CHOICE, QuestionVariant.SELECT_ONE };
	}

	@Override
	public Element build(Document doc, Question q, SurveyTemplate template) throws ApplicationException {

		String bindType = q.getBindType();
		if(!XFormQuestionTypes.BIND_STRING.equals(bindType) && !XFormQuestionTypes.BIND_RANK.equals(bindType)) {
			throw new InvalidBindTypeException(
					Localisation.getMessage(template.getLocalisation(), "xf_bind_type", q.name, String.valueOf(bindType)),
					q.name, bindType);
		}

		String defaultTag = q.variant == QuestionVariant.SELECT_ONE ? "select1" : "select";
		Element questionElement = createControl(doc, getControlTag(q, defaultTag), getControlAttributes(q, template));
		addLabelAndHint(doc, questionElement, q);

		itemsetCompiler.appendChoices(doc, questionElement, q, template);

		return questionElement;
	}
}
