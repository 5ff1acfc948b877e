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

import java.util.ArrayList;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.apache.commons.lang3.StringUtils;

public class GeneralUtilityMethods {

	/*
	 * A reference to another survey element, ${name} or ${last-saved#name}
	 */
	public static final Pattern REFERENCE_PATTERN = Pattern.compile("\\$\\{(last-saved#)?(.*?)\\}");

	private static final Pattern FUNCTION_PATTERN = Pattern.compile("[A-Za-z_][A-Za-z0-9_\\-:]*\\s*\\(");
	private static final Pattern MATH_PATTERN = Pattern.compile("\\s(\\+|\\*|div|mod|-)\\s");
	private static final Pattern PATH_PATTERN = Pattern.compile("(^|\\s)(\\.\\.?)?/[A-Za-z_]");

	/*
	 * Return true if the text contains a reference to another survey element
	 */
	public static boolean isReference(String input) {
		if(input == null) {
			return false;
		}
		return REFERENCE_PATTERN.matcher(input).find();
	}

	/*
	 * Get an array of question names from a string that contains xls names ${name}
	 */
	public static ArrayList<String> getXlsNames(String input) {

		ArrayList<String> output = new ArrayList<> ();

		if(input != null) {
			Matcher matcher = REFERENCE_PATTERN.matcher(input);
			while (matcher.find()) {
				output.add(matcher.group(2));
			}
		}

		return output;
	}

	/*
	 * Get the question name from an xls name ${name}
	 * If the input is not a reference it is returned trimmed
	 */
	public static String getNameFromXlsName(String input) {
		if(input == null) {
			return null;
		}
		Matcher matcher = REFERENCE_PATTERN.matcher(input);
		if(matcher.find()) {
			return matcher.group(2);
		}
		return input.trim();
	}

	/*
	 * Split a file name into its base and its extension
	 * The extension includes the leading dot and is empty if there is none, for example
	 *   fruits.csv    -> fruits, .csv
	 *   fruits        -> fruits, ""
	 *   .hidden       -> .hidden, ""
	 */
	public static String [] splitExtension(String filename) {
		String [] out = new String[] {filename, ""};
		if(filename != null) {
			int slash = filename.lastIndexOf('/');
			int dot = filename.lastIndexOf('.');
			if(dot > slash) {
				// Leading dots of the file name are not an extension
				int nameStart = slash + 1;
				while(nameStart < filename.length() && filename.charAt(nameStart) == '.') {
					nameStart++;
				}
				if(dot > nameStart) {
					out[0] = filename.substring(0, dot);
					out[1] = filename.substring(dot);
				}
			}
		}
		return out;
	}

	/*
	 * Return true if a default value is an expression to be evaluated by the client
	 * rather than a literal value to be placed in the instance
	 */
	public static boolean defaultIsDynamic(String defaultValue, String questionType) {

		if(StringUtils.isBlank(defaultValue)) {
			return false;
		}

		if(isReference(defaultValue)) {
			return true;
		}
		if(FUNCTION_PATTERN.matcher(defaultValue).find()) {
			return true;
		}
		if(PATH_PATTERN.matcher(defaultValue).find()) {
			return true;
		}

		// Dates and times contain dashes that are not subtraction
		boolean isDateType = questionType != null
				&& (questionType.equals("date") || questionType.equals("time") || questionType.equals("dateTime"));
		Matcher math = MATH_PATTERN.matcher(defaultValue);
		while(math.find()) {
			if(isDateType && math.group(1).equals("-")) {
				continue;
			}
			return true;
		}

		return false;
	}
}
