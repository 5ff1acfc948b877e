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
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.ResourceBundle;

import org.smap.xform.Utilities.ApplicationException;
import org.w3c.dom.Document;
import org.w3c.dom.Element;

/*
 * An element of a survey definition
 * Nodes are populated when the survey definition is read and are then only read by the compiler
 */
public abstract class SurveyNode {

	public String name;
	public String type;
	public Label label = new Label();
	public Label hint = new Label();
	public LinkedHashMap<String, String> bind = new LinkedHashMap<> ();
	public LinkedHashMap<String, String> control = new LinkedHashMap<> ();
	public LinkedHashMap<String, String> instance = new LinkedHashMap<> ();	// Attributes of the instance element
	public String defaultValue;

	private SurveyNode parent;
	private ArrayList<SurveyNode> children = new ArrayList<> ();

	public SurveyNode() {
	}

	public SurveyNode(String name, String type) {
		this.name = name;
		this.type = type;
	}

	public void addChild(SurveyNode child) {
		child.parent = this;
		children.add(child);
	}

	public List<SurveyNode> getChildren() {
		return Collections.unmodifiableList(children);
	}

	public SurveyNode getParent() {
		return parent;
	}

	/*
	 * Get the absolute path of this node in the instance
	 */
	public String getXPath() {
		if(parent == null) {
			return "/" + name;
		}
		return parent.getXPath() + "/" + name;
	}

	/*
	 * Get this node and all of its descendants, parents before their children
	 */
	public List<SurveyNode> getDescendants() {
		ArrayList<SurveyNode> nodes = new ArrayList<> ();
		addDescendants(nodes);
		return nodes;
	}

	private void addDescendants(List<SurveyNode> nodes) {
		nodes.add(this);
		for(SurveyNode child : children) {
			child.addDescendants(nodes);
		}
	}

	/*
	 * Get the closest enclosing repeat or null if this node is not in a repeat
	 */
	public Section getRepeat() {
		SurveyNode p = parent;
		while(p != null) {
			if(p instanceof Section && ((Section) p).isRepeat()) {
				return (Section) p;
			}
			p = p.parent;
		}
		return null;
	}

	public int getDepth() {
		int depth = 0;
		for(SurveyNode p = parent; p != null; p = p.parent) {
			depth++;
		}
		return depth;
	}

	public boolean hasLabel() {
		return label != null && !label.isEmpty();
	}

	public boolean hasHint() {
		return hint != null && !hint.isEmpty();
	}

	/*
	 * Identifier of this node's text in the itext translations
	 */
	public String getItextId(String displayElement) {
		return getXPath() + ":" + displayElement;
	}

	public Element xmlLabel(Document doc) {
		return xmlText(doc, "label", label);
	}

	public Element xmlHint(Document doc) {
		return xmlText(doc, "hint", hint);
	}

	/*
	 * Get the label and hint elements that are present
	 */
	public List<Element> xmlLabelAndHint(Document doc) {
		ArrayList<Element> elements = new ArrayList<> ();
		if(hasLabel()) {
			elements.add(xmlLabel(doc));
		}
		if(hasHint()) {
			elements.add(xmlHint(doc));
		}
		return elements;
	}

	private Element xmlText(Document doc, String elementName, Label l) {
		Element e = doc.createElement(elementName);
		if(l != null) {
			if(l.isMultiLanguage()) {
				e.setAttribute("ref", "jr:itext('" + getItextId(elementName) + "')");
			} else if(l.text != null) {
				e.setTextContent(l.text);
			}
		}
		return e;
	}

	/*
	 * Check the node and its children
	 */
	public void validate(ResourceBundle localisation) throws ApplicationException {
		for(SurveyNode child : children) {
			child.validate(localisation);
		}
	}
}
