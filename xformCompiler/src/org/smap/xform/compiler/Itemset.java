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

package org.smap.xform.compiler;

import org.w3c.dom.Document;
import org.w3c.dom.Element;

/*
 * The source of the choices of a select question
 * An inline itemset has no nodeset, its choices are written as items of the select
 */
public class Itemset {

	public String nodeset;
	public String valueRef;
	public String labelRef;
	public boolean inline;

	public static Itemset inlineChoices() {
		Itemset itemset = new Itemset();
		itemset.inline = true;
		return itemset;
	}

	public Itemset() {
	}

	public Itemset(String nodeset, String valueRef, String labelRef) {
		this.nodeset = nodeset;
		this.valueRef = valueRef;
		this.labelRef = labelRef;
	}

	/*
	 * <itemset nodeset="..."><value ref="..."/><label ref="..."/></itemset>
	 */
	public Element toElement(Document doc) {
		Element isElement = doc.createElement("itemset");
		isElement.setAttribute("nodeset", nodeset);

		Element vElement = doc.createElement("value");
		vElement.setAttribute("ref", valueRef);
		Element lElement = doc.createElement("label");
		lElement.setAttribute("ref", labelRef);

		isElement.appendChild(vElement);
		isElement.appendChild(lElement);
		return isElement;
	}
}
