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

package org.smap.xform.constants;

/*
 * Question types that can be used in a survey definition
 */
public class XFormQuestionTypes {

	public static final String TEXT = "text";
	public static final String STRING = "string";
	public static final String INTEGER = "integer";
	public static final String INT = "int";
	public static final String DECIMAL = "decimal";
	public static final String DATE = "date";
	public static final String TIME = "time";
	public static final String DATETIME = "dateTime";
	public static final String GEOPOINT = "geopoint";
	public static final String GEOTRACE = "geotrace";
	public static final String GEOSHAPE = "geoshape";
	public static final String BARCODE = "barcode";
	public static final String NOTE = "note";
	public static final String SELECT_ONE = "select one";
	public static final String SELECT_MULTIPLE = "select all that apply";
	public static final String SELECT_ONE_EXTERNAL = "select one external";
	public static final String RANK = "rank";
	public static final String RANGE = "range";
	public static final String TRIGGER = "trigger";
	public static final String ACKNOWLEDGE = "acknowledge";
	public static final String IMAGE = "image";
	public static final String PHOTO = "photo";
	public static final String AUDIO = "audio";
	public static final String VIDEO = "video";
	public static final String FILE = "file";
	public static final String OSM = "osm";
	public static final String CALCULATE = "calculate";
	public static final String HIDDEN = "hidden";
	public static final String BACKGROUND_GEOPOINT = "background-geopoint";
	public static final String START = "start";
	public static final String END = "end";
	public static final String TODAY = "today";
	public static final String DEVICEID = "deviceid";
	public static final String USERNAME = "username";

	// Section types
	public static final String SURVEY = "survey";
	public static final String GROUP = "group";
	public static final String REPEAT = "repeat";

	// Elements that belong to a question
	public static final String CHOICE = "choice";
	public static final String OSM_TAG = "tag";

	// Bind types that are allowed for select questions
	public static final String BIND_STRING = "string";
	public static final String BIND_RANK = "odk:rank";
}
