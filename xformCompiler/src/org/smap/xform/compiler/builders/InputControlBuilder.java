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
import org.smap.xform.compiler.SurveyTemplate;
import org.smap.xform.model.Question;
import org.smap.xform.model.QuestionVariant;
import org.w3c.dom.Document;
import org.w3c.dom.Element;

/**
 * Input control, used for text, numbers, dates, locations, barcodes and notes
 * A "select one external" question is also an input, its choices are identified by the query attribute
 */
public class InputControlBuilder extends AbstractControlBuilder {

	@Override
	public QuestionVariant [] getVariants() {
		return new QuestionVariant[] { QuestionVariant.INPUT };
	}

	@Override
	public Element build(Document doc, Question q, SurveyTemplate template) throws ApplicationException {

		Element questionElement = createControl(doc, getControlTag(q, "input"), getControlAttributes(q, template));
		addLabelAndHint(doc, questionElement, q);

		if(q.query != null && q.query.length() > 0) {
			String query = "instance('" + q.query + "')/root/item";
			String choiceFilter = template.insertXPaths(q.choice_filter, q, true);
			if(choiceFilter != null && choiceFilter.length() > 0) {
				query += "[" + choiceFilter + "]";
			}
			questionElement.setAttribute("query", query);
		}
		return questionElement;
	}
}
