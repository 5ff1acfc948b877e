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

import java.util.ResourceBundle;
import java.util.regex.Matcher;

import org.smap.xform.Utilities.ApplicationException;
import org.smap.xform.Utilities.GeneralUtilityMethods;
import org.smap.xform.Utilities.Localisation;
import org.smap.xform.constants.ItemsetConstants;
import org.smap.xform.model.Section;
import org.smap.xform.model.SurveyNode;

/*
 * Replace ${name} references with the path of the named survey element
 *
 * Each path is padded with a space on either side so that it cannot run into the surrounding expression
 * A reference to an element in the same repeat as the referring element is relative, for example
 *   context:     /data/rep/grp/q1
 *   reference:   /data/rep/q2
 *   relative:    ../../q2   or  current()/../../q2 inside a predicate
 */
public class SurveyXPathResolver implements XPathResolver {

	private SurveyTemplate template;
	private ResourceBundle localisation;

	public SurveyXPathResolver(SurveyTemplate template, ResourceBundle l) {
		this.template = template;
		localisation = l;
	}

	@Override
	public String insertXPaths(String expression, SurveyNode context, boolean predicate,
			boolean previousQuestion, boolean referenceParent) throws ApplicationException {

		if(expression == null) {
			return null;
		}

		StringBuffer output = new StringBuffer("");
		Matcher matcher = GeneralUtilityMethods.REFERENCE_PATTERN.matcher(expression);
		int start = 0;
		while (matcher.find()) {

			boolean lastSaved = matcher.group(1) != null;
			String qname = matcher.group(2);

			// Add any text before the match
			output.append(expression.substring(start, matcher.start()));

			if(template.isDuplicateName(qname)) {
				throw new ApplicationException(Localisation.getMessage(localisation, "xf_ref_dup", qname, null));
			}
			SurveyNode target = template.getElement(qname);
			if(target == null) {
				throw new ApplicationException(Localisation.getMessage(localisation, "xf_ref_nf", qname, null));
			}

			String path = null;
			if(lastSaved) {
				path = " instance('" + ItemsetConstants.LAST_SAVED_INSTANCE + "')" + target.getXPath() + " ";
			} else {
				if(!referenceParent) {
					path = getRelativePath(context, target, predicate && !previousQuestion);
				}
				if(path == null) {
					path = " " + target.getXPath() + " ";
				}
			}
			output.append(path);

			start = matcher.end();
		}

		// Get the remainder of the string
		if(start < expression.length()) {
			output.append(expression.substring(start));
		}

		return output.toString();
	}

	/*
	 * Get the path from the context to the target if they are in the same repeat, otherwise null
	 */
	private String getRelativePath(SurveyNode context, SurveyNode target, boolean useCurrent) {

		if(context == null || context.getRepeat() == null || target.getRepeat() == null) {
			return null;
		}

		// Find the closest ancestor of the context that also contains the target
		SurveyNode common = context.getParent();
		while(common != null && !isAncestor(common, target)) {
			common = common.getParent();
		}
		if(common == null) {
			return null;
		}
		if(!(common instanceof Section && ((Section) common).isRepeat()) && common.getRepeat() == null) {
			return null;		// The shared ancestor is not inside a repeat
		}

		int steps = context.getDepth() - common.getDepth();
		if(steps == 0) {
			return null;
		}

		StringBuffer path = new StringBuffer(useCurrent ? " current()/" : " ");
		for(int i = 0; i < steps; i++) {
			if(i > 0) {
				path.append('/');
			}
			path.append("..");
		}
		path.append(target.getXPath().substring(common.getXPath().length()));
		path.append(' ');
		return path.toString();
	}

	private boolean isAncestor(SurveyNode ancestor, SurveyNode node) {
		for(SurveyNode p = node.getParent(); p != null; p = p.getParent()) {
			if(p == ancestor) {
				return true;
			}
		}
		return false;
	}
}
