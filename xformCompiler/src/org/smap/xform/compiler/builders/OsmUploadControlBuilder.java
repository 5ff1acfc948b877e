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
import org.smap.xform.model.Tag;
import org.w3c.dom.Document;
import org.w3c.dom.Element;

/**
 * Upload of an OSM file, the tags to be collected for the OSM features are listed in the control
 */
public class OsmUploadControlBuilder extends UploadControlBuilder {

	@Override
	public QuestionVariant [] getVariants() {
		return new QuestionVariant[] { QuestionVariant.OSM_UPLOAD };
	}

	@Override
	public Element build(Document doc, Question q, SurveyTemplate template) throws ApplicationException {
		Element questionElement = super.build(doc, q, template);
		for(Tag osmTag : q.getTags()) {
			questionElement.appendChild(osmTag.xml(doc));
		}
		return questionElement;
	}
}
