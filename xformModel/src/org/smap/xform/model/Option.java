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

package org.smap.xform.model;

import java.util.ResourceBundle;

import org.smap.xform.constants.XFormQuestionTypes;
import org.w3c.dom.Document;
import org.w3c.dom.Element;

/*
 * A choice of a select question or an OSM tag
 * The name is the value that is stored when the choice is selected
 */
public class Option extends SurveyNode {

	public Option() {
		type = XFormQuestionTypes.CHOICE;
	}

	public Option(String name, String label) {
		super(name, XFormQuestionTypes.CHOICE);
		this.label = new Label(label);
	}

	public Element xmlValue(Document doc) {
		Element value = doc.createElement("value");
		value.setTextContent(name);
		return value;
	}

	public Element xml(Document doc) {
		Element item = doc.createElement("item");
		item.appendChild(xmlLabel(doc));
		item.appendChild(xmlValue(doc));
		return item;
	}

	@Override
	public void validate(ResourceBundle localisation) {
		// Choices are checked when the choice list is loaded
	}
}
