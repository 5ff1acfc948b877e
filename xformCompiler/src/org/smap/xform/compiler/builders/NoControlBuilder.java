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

import org.smap.xform.compiler.SurveyTemplate;
import org.smap.xform.model.Question;
import org.smap.xform.model.QuestionVariant;
import org.w3c.dom.Document;
import org.w3c.dom.Element;

/**
 * Calculations, hidden values and preloaded meta data only appear in the instance and bind
 */
public class NoControlBuilder implements IControlBuilder {

	@Override
	public QuestionVariant [] getVariants() {
		return new QuestionVariant[] { QuestionVariant.NONE };
	}

	@Override
	public Element build(Document doc, Question q, SurveyTemplate template) {
		return null;
	}
}
