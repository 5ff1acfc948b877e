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
 * Interface for the builders of question controls
 */
public interface IControlBuilder {

	/**
	 * Get the question variants this builder creates controls for
	 * @return The variants
	 */
	QuestionVariant [] getVariants();

	/**
	 * Build the control of a question
	 * @param doc The document the control will be added to
	 * @param q The question
	 * @param template The survey the question is in
	 * @return The control element, or null if the question has no control
	 * @throws ApplicationException if the question cannot be compiled
	 */
	Element build(Document doc, Question q, SurveyTemplate template) throws ApplicationException;
}
