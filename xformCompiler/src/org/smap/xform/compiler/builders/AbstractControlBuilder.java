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
import java.util.Map;

import org.smap.xform.Utilities.ApplicationException;
import org.smap.xform.compiler.SurveyTemplate;
import org.smap.xform.model.Question;
import org.w3c.dom.Document;
import org.w3c.dom.Element;

/*
 * Steps shared by the control builders
 */
public abstract class AbstractControlBuilder implements IControlBuilder {

	/*
	 * Get the control attributes with references resolved and the ref of the question added
	 * The question's own control map is not changed
	 */
	protected LinkedHashMap<String, String> getControlAttributes(Question q, SurveyTemplate template) throws ApplicationException {
		LinkedHashMap<String, String> attributes = new LinkedHashMap<> ();
		for(Map.Entry<String, String> entry : q.control.entrySet()) {
			if(entry.getKey().equals("tag")) {
				continue;
			}
			attributes.put(entry.getKey(), template.insertXPaths(entry.getValue(), q));
		}
		attributes.put("ref", q.getXPath());
		return attributes;
	}

	/*
	 * The name of the control element is held in the "tag" entry of the control
	 */
	protected String getControlTag(Question q, String defaultTag) {
		String tag = q.control.get("tag");
		return tag == null ? defaultTag : tag;
	}

	protected Element createControl(Document doc, String tag, Map<String, String> attributes) {
		Element questionElement = doc.createElement(tag);
		for(Map.Entry<String, String> entry : attributes.entrySet()) {
			if(entry.getValue() != null) {
				questionElement.setAttribute(entry.getKey(), entry.getValue());
			}
		}
		return questionElement;
	}

	protected void addLabelAndHint(Document doc, Element questionElement, Question q) {
		for(Element e : q.xmlLabelAndHint(doc)) {
			questionElement.appendChild(e);
		}
	}
}
