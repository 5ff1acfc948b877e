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

import java.util.LinkedHashMap;

import org.smap.xform.Utilities.ApplicationException;
import org.smap.xform.Utilities.Localisation;
import org.smap.xform.compiler.SurveyTemplate;
import org.smap.xform.model.Question;
import org.smap.xform.model.QuestionVariant;
import org.w3c.dom.Document;
import org.w3c.dom.Element;

/**
 * Upload control for images, audio, video and files
 */
public class UploadControlBuilder extends AbstractControlBuilder {

	@Override
	public QuestionVariant [] getVariants() {
		return new QuestionVariant[] { QuestionVariant.UPLOAD };
	}

	@Override
	public Element build(Document doc, Question q, SurveyTemplate template) throws ApplicationException {
		Element questionElement = createControl(doc, "upload", getUploadAttributes(q, template));
		addLabelAndHint(doc, questionElement, q);
		return questionElement;
	}

	/*
	 * The media type is not resolved, it is always a literal such as image/*
	 */
	protected LinkedHashMap<String, String> getUploadAttributes(Question q, SurveyTemplate template) throws ApplicationException {
		String mediatype = q.control.get("mediatype");
		if(mediatype == null || mediatype.trim().length() == 0) {
			throw new ApplicationException(Localisation.getMessage(template.getLocalisation(), "xf_no_media", q.name, null));
		}
		LinkedHashMap<String, String> attributes = getControlAttributes(q, template);
		attributes.put("mediatype", mediatype);
		return attributes;
	}
}
