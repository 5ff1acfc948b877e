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

import java.util.LinkedHashMap;

import org.smap.xform.constants.XFormQuestionTypes;

/*
 * The question types that are recognised when compiling a survey
 */
public class QuestionTypeDictionary {

	private static final LinkedHashMap<String, QuestionTypeDefinition> types = new LinkedHashMap<> ();

	static {
		// Inputs
		input(XFormQuestionTypes.TEXT, "string");
		input(XFormQuestionTypes.STRING, "string");
		input(XFormQuestionTypes.INTEGER, "int");
		input(XFormQuestionTypes.INT, "int");
		input(XFormQuestionTypes.DECIMAL, "decimal");
		input(XFormQuestionTypes.DATE, "date");
		input(XFormQuestionTypes.TIME, "time");
		input(XFormQuestionTypes.DATETIME, "dateTime");
		input(XFormQuestionTypes.GEOPOINT, "geopoint");
		input(XFormQuestionTypes.GEOTRACE, "geotrace");
		input(XFormQuestionTypes.GEOSHAPE, "geoshape");
		input(XFormQuestionTypes.BARCODE, "barcode");
		input(XFormQuestionTypes.SELECT_ONE_EXTERNAL, "string");
		input(XFormQuestionTypes.NOTE, "string").bind("readonly", "true()");

		// Selects
		add(new QuestionTypeDefinition(XFormQuestionTypes.SELECT_ONE, QuestionVariant.SELECT_ONE)
				.control("tag", "select1")
				.bind("type", XFormQuestionTypes.BIND_STRING));
		add(new QuestionTypeDefinition(XFormQuestionTypes.SELECT_MULTIPLE, QuestionVariant.MULTIPLE_CHOICE)
				.control("tag", "select")
				.bind("type", XFormQuestionTypes.BIND_STRING));
		add(new QuestionTypeDefinition(XFormQuestionTypes.RANK, QuestionVariant.MULTIPLE_CHOICE)
				.control("tag", "odk:rank")
				.bind("type", XFormQuestionTypes.BIND_RANK));

		add(new QuestionTypeDefinition(XFormQuestionTypes.RANGE, QuestionVariant.RANGE)
				.control("tag", "range")
				.bind("type", "int"));

		// Triggers
		add(new QuestionTypeDefinition(XFormQuestionTypes.TRIGGER, QuestionVariant.TRIGGER)
				.control("tag", "trigger")
				.bind("type", "string"));
		add(new QuestionTypeDefinition(XFormQuestionTypes.ACKNOWLEDGE, QuestionVariant.TRIGGER)
				.control("tag", "trigger")
				.bind("type", "string"));

		// Uploads
		upload(XFormQuestionTypes.IMAGE, "image/*");
		upload(XFormQuestionTypes.PHOTO, "image/*");
		upload(XFormQuestionTypes.AUDIO, "audio/*");
		upload(XFormQuestionTypes.VIDEO, "video/*");
		upload(XFormQuestionTypes.FILE, "application/*");
		add(new QuestionTypeDefinition(XFormQuestionTypes.OSM, QuestionVariant.OSM_UPLOAD)
				.control("tag", "upload")
				.control("mediatype", "osm/*")
				.bind("type", "binary"));

		// No control
		add(new QuestionTypeDefinition(XFormQuestionTypes.CALCULATE, QuestionVariant.NONE)
				.bind("type", "string"));
		add(new QuestionTypeDefinition(XFormQuestionTypes.HIDDEN, QuestionVariant.NONE)
				.bind("type", "string"));
		add(new QuestionTypeDefinition(XFormQuestionTypes.BACKGROUND_GEOPOINT, QuestionVariant.NONE)
				.bind("type", "geopoint"));
		preload(XFormQuestionTypes.START, "dateTime", "timestamp", "start");
		preload(XFormQuestionTypes.END, "dateTime", "timestamp", "end");
		preload(XFormQuestionTypes.TODAY, "date", "date", "today");
		preload(XFormQuestionTypes.DEVICEID, "string", "property", "deviceid");
		preload(XFormQuestionTypes.USERNAME, "string", "property", "username");
	}

	private static QuestionTypeDefinition add(QuestionTypeDefinition def) {
		types.put(def.getName(), def);
		return def;
	}

	private static QuestionTypeDefinition input(String name, String bindType) {
		return add(new QuestionTypeDefinition(name, QuestionVariant.INPUT)
				.control("tag", "input")
				.bind("type", bindType));
	}

	private static QuestionTypeDefinition upload(String name, String mediatype) {
		return add(new QuestionTypeDefinition(name, QuestionVariant.UPLOAD)
				.control("tag", "upload")
				.control("mediatype", mediatype)
				.bind("type", "binary"));
	}

	private static QuestionTypeDefinition preload(String name, String bindType, String preload, String params) {
		return add(new QuestionTypeDefinition(name, QuestionVariant.NONE)
				.bind("type", bindType)
				.bind("jr:preload", preload)
				.bind("jr:preloadParams", params));
	}

	public static boolean contains(String type) {
		return type != null && types.containsKey(type);
	}

	/*
	 * Get the definition of a type or null if the type is not recognised
	 */
	public static QuestionTypeDefinition get(String type) {
		if(type == null) {
			return null;
		}
		return types.get(type);
	}
}
