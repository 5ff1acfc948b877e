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

import org.smap.xform.Utilities.ApplicationException;
import org.smap.xform.model.SurveyNode;

/*
 * Replaces references to survey elements, ${name}, with their XPath
 */
public interface XPathResolver {

	/**
	 * Resolve the references in an expression
	 * @param expression The expression, may be null
	 * @param context The survey element that the expression belongs to
	 * @param predicate True if the expression will be used inside an XPath predicate
	 * @param previousQuestion True if the expression filters choices taken from a previous question
	 * @param referenceParent True if the path is needed from the survey root rather than relative to the context
	 * @return The expression with each reference replaced by its path, null if the expression was null
	 * @throws ApplicationException if a reference does not identify a single survey element
	 */
	String insertXPaths(String expression, SurveyNode context, boolean predicate,
			boolean previousQuestion, boolean referenceParent) throws ApplicationException;
}
