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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/*
 * The defaults for a question type
 *   variant - the kind of control the question compiles into
 *   control - attributes of the control, "tag" is the name of the control element
 *   bind - attributes of the bind, "type" is the data type
 */
public class QuestionTypeDefinition {

	private String name;
	private QuestionVariant variant;
	private LinkedHashMap<String, String> control = new LinkedHashMap<> ();
	private LinkedHashMap<String, String> bind = new LinkedHashMap<> ();

	public QuestionTypeDefinition(String name, QuestionVariant variant) {
		this.name = name;
		this.variant = variant;
	}

	public QuestionTypeDefinition control(String key, String value) {
		control.put(key, value);
		return this;
	}

	public QuestionTypeDefinition bind(String key, String value) {
		bind.put(key, value);
		return this;
	}

	public String getName() {
		return name;
	}

	public QuestionVariant getVariant() {
		return variant;
	}

	public Map<String, String> getControl() {
		return Collections.unmodifiableMap(control);
	}

	public Map<String, String> getBind() {
		return Collections.unmodifiableMap(bind);
	}
}
