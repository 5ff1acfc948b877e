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

/*
 * An action that sets the value of one question when another question changes
 */
public class SetValue {

	public static final String TRIGGER = "xforms-value-changed";

	// Kinds of trigger
	public static final String SETVALUE = "setvalue";
	public static final String SETGEOPOINT = "setgeopoint";

	// Elements used for each kind of trigger
	public static final String SETVALUE_TAG = "setvalue";
	public static final String SETGEOPOINT_TAG = "odk:setgeopoint";

	public String event;
	public String value;		// Expression, may be null
	public String ref;			// Name of the question whose value is set

	public SetValue(String e, String v, String r) {
		event = e;
		value = v;
		ref = r;
	}
}
