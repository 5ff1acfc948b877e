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

package org.smap.xform.Utilities;

import java.util.Locale;
import java.util.ResourceBundle;

import org.apache.commons.lang3.StringUtils;

/*
 * Access to the localised messages used in errors reported to survey authors
 */
public class Localisation {

	public static final String BUNDLE = "org.smap.xform.resources.XFormResources";

	public static ResourceBundle getBundle(Locale locale) {
		if(locale == null) {
			locale = Locale.ENGLISH;
		}
		return ResourceBundle.getBundle(BUNDLE, locale);
	}

	public static ResourceBundle getDefaultBundle() {
		return getBundle(Locale.ENGLISH);
	}

	/*
	 * Get a message and substitute the %s1 and %s2 parameters
	 */
	public static String getMessage(ResourceBundle localisation, String code, String param1, String param2) {
		// The text of a parameter is never searched for the other placeholder
		return StringUtils.replaceEach(localisation.getString(code),
				new String[] {"%s1", "%s2"}, new String[] {param1, param2});
	}
}
