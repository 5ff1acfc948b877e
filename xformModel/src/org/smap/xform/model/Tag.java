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

import java.util.ArrayList;
import java.util.List;
import java.util.ResourceBundle;

import org.smap.xform.constants.XFormQuestionTypes;
import org.w3c.dom.Document;
import org.w3c.dom.Element;

/*
 * An OSM tag, the name is the OSM key and the options are its allowed values
 */
public class Tag extends SurveyNode {

	public Tag() {
		type = XFormQuestionTypes.OSM_TAG;
	}

	public Tag(String name, String label) {
		super(name, XFormQuestionTypes.OSM_TAG);
		this.label = new Label(label);
	}

	public List<Option> getOptions() {
		ArrayList<Option> options = new ArrayList<> ();
		for(SurveyNode n : getChildren()) {
			if(n instanceof Option) {
				options.add((Option) n);
			}
		}
		return options;
	}

	public Element xml(Document doc) {
		Element tag = doc.createElement("tag");
		tag.setAttribute("key", name);
		tag.appendChild(xmlLabel(doc));
		for(Option o : getOptions()) {
			tag.appendChild(o.xml(doc));
		}
		return tag;
	}

	@Override
	public void validate(ResourceBundle localisation) {
		// Tags are checked when the OSM question is loaded
	}
}
