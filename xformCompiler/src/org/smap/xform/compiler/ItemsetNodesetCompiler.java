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

import java.util.Map;

import org.apache.commons.lang3.StringUtils;
import org.smap.xform.Utilities.ApplicationException;
import org.smap.xform.Utilities.GeneralUtilityMethods;
import org.smap.xform.constants.ItemsetConstants;
import org.smap.xform.model.Option;
import org.smap.xform.model.Question;
import org.smap.xform.model.SurveyNode;
import org.smap.xform.model.Tag;
import org.w3c.dom.Document;
import org.w3c.dom.Element;

/*
 * Work out where the choices of a select question come from
 *
 * The nodeset takes one of the forms
 *   instance('<id>')/root/item[<filter>]
 *   <path of a repeat>[<filter>]
 * optionally wrapped in randomize(<nodeset>[, <seed>])
 */
public class ItemsetNodesetCompiler {

	public Itemset compile(Question q, SurveyTemplate template) throws ApplicationException {

		if(StringUtils.isEmpty(q.itemset)) {
			return Itemset.inlineChoices();
		}

		String [] parts = GeneralUtilityMethods.splitExtension(q.itemset);
		String itemset = parts[0];
		String fileExtension = parts[1];
		boolean geojson = fileExtension.equals(ItemsetConstants.GEOJSON_EXTENSION);

		Map<String, String> params = q.parameters;
		String valueRef = params.get(ItemsetConstants.PARAM_VALUE);
		if(valueRef == null) {
			valueRef = geojson ? ItemsetConstants.ITEMSET_REF_VALUE_GEOJSON : ItemsetConstants.ITEMSET_REF_VALUE;
		}
		String labelRef = params.get(ItemsetConstants.PARAM_LABEL);
		if(labelRef == null) {
			labelRef = geojson ? ItemsetConstants.ITEMSET_REF_LABEL_GEOJSON : ItemsetConstants.ITEMSET_REF_LABEL;
		}

		boolean isPreviousQuestion = GeneralUtilityMethods.isReference(q.itemset);

		// An attached file is named after the file without its extension and its labels are used as they are
		if(!ItemsetConstants.EXTERNAL_INSTANCE_EXTENSIONS.contains(fileExtension)) {
			itemset = q.itemset;
			if(q.itemsetMultiLanguage || q.itemsetHasMedia || q.itemsetDynLabel) {
				labelRef = ItemsetConstants.ITEXT_LABEL_REF;
			}
		}

		String choiceFilter = template.insertXPaths(q.choice_filter, q, true, isPreviousQuestion);

		String nodeset;
		if(isPreviousQuestion) {
			String [] path = template.insertXPaths(q.itemset, q, false, false, true).trim().split("/");
			String name = path[path.length - 1];
			nodeset = join(path, path.length - 1);
			valueRef = name;
			labelRef = name;
			if(choiceFilter != null && choiceFilter.length() > 0) {
				choiceFilter = choiceFilter.replace("current()/" + nodeset, ".").replace(nodeset, ".");
			} else {
				// Repeat instances where the linked question has not been answered would be blank choices
				choiceFilter = "./" + name + " != ''";
			}
		} else {
			nodeset = "instance('" + itemset + "')/root/item";
		}

		if(choiceFilter != null && choiceFilter.length() > 0) {
			nodeset += "[" + choiceFilter + "]";
		}

		nodeset = addRandomize(nodeset, q, template);

		return new Itemset(nodeset, valueRef, labelRef);
	}

	/*
	 * Add the choices of the question to its control element
	 */
	public void appendChoices(Document doc, Element selectElement, Question q, SurveyTemplate template) throws ApplicationException {

		Itemset itemset = compile(q, template);
		if(itemset.inline) {
			for(SurveyNode child : q.getChildren()) {
				if(child instanceof Option) {
					selectElement.appendChild(((Option) child).xml(doc));
				} else if(child instanceof Tag) {
					selectElement.appendChild(((Tag) child).xml(doc));
				}
			}
		} else {
			selectElement.appendChild(itemset.toElement(doc));
		}
	}

	private String addRandomize(String nodeset, Question q, SurveyTemplate template) throws ApplicationException {

		String randomize = q.parameters.get(ItemsetConstants.PARAM_RANDOMIZE);
		if(randomize == null || !randomize.equals("true")) {
			return nodeset;
		}

		StringBuffer out = new StringBuffer("randomize(").append(nodeset);
		String seed = q.parameters.get(ItemsetConstants.PARAM_SEED);
		if(seed != null) {
			if(GeneralUtilityMethods.isReference(seed)) {
				seed = template.insertXPaths(seed, q).trim();
			}
			out.append(", ").append(seed);
		}
		out.append(")");
		return out.toString();
	}

	private String join(String [] path, int length) {
		StringBuffer out = new StringBuffer("");
		for(int i = 0; i < length; i++) {
			if(i > 0) {
				out.append('/');
			}
			out.append(path[i]);
		}
		return out.toString();
	}
}
