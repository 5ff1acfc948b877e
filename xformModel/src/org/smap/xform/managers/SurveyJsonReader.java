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

package org.smap.xform.managers;

import java.io.Reader;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.ResourceBundle;
import java.util.logging.Logger;

import org.smap.xform.Utilities.ApplicationException;
import org.smap.xform.Utilities.Localisation;
import org.smap.xform.constants.XFormQuestionTypes;
import org.smap.xform.model.Label;
import org.smap.xform.model.Option;
import org.smap.xform.model.Question;
import org.smap.xform.model.QuestionVariant;
import org.smap.xform.model.Section;
import org.smap.xform.model.Survey;
import org.smap.xform.model.SurveyNode;
import org.smap.xform.model.Tag;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;

/*
 * Read a survey definition from its JSON representation
 *
 * {"type": "survey", "name": "data", "children": [
 *     {"type": "select one", "name": "fruit", "label": {"English": "Fruit", "French": "Fruit"},
 *      "choices": [{"name": "apple", "label": "Apple"}]},
 *     {"type": "group", "name": "g1", "label": "Group", "children": [ ... ]}
 * ]}
 */
public class SurveyJsonReader {

	private static Logger log = Logger.getLogger(SurveyJsonReader.class.getName());

	private ResourceBundle localisation;

	public SurveyJsonReader(ResourceBundle l) {
		localisation = l;
	}

	public Survey read(Reader reader) throws ApplicationException {
		try {
			return readSurvey(JsonParser.parseReader(reader));
		} catch (JsonParseException | IllegalStateException e) {
			throw new ApplicationException(Localisation.getMessage(localisation, "xf_json", e.getMessage(), null), e);
		}
	}

	public Survey read(String json) throws ApplicationException {
		try {
			return readSurvey(JsonParser.parseString(json));
		} catch (JsonParseException | IllegalStateException e) {
			throw new ApplicationException(Localisation.getMessage(localisation, "xf_json", e.getMessage(), null), e);
		}
	}

	private Survey readSurvey(JsonElement root) throws ApplicationException {
		JsonObject obj = root.getAsJsonObject();

		Survey survey = new Survey(getString(obj, "name"));
		survey.id_string = getString(obj, "id_string");
		readChildren(obj, survey, "children");

		survey.validate(localisation);
		return survey;
	}

	private void readChildren(JsonObject obj, SurveyNode parent, String key) throws ApplicationException {
		JsonArray children = getArray(obj, key);
		if(children != null) {
			for(JsonElement child : children) {
				parent.addChild(readNode(child.getAsJsonObject()));
			}
		}
	}

	private SurveyNode readNode(JsonObject obj) throws ApplicationException {

		String type = getString(obj, "type");
		String name = getString(obj, "name");

		SurveyNode node;
		if(XFormQuestionTypes.GROUP.equals(type) || XFormQuestionTypes.REPEAT.equals(type)) {
			node = new Section(name, type);
			readChildren(obj, node, "children");
		} else {
			node = readQuestion(obj, name, type);
		}

		node.label = getLabel(obj, "label");
		node.hint = getLabel(obj, "hint");
		node.defaultValue = getString(obj, "default");
		node.instance.putAll(getMap(obj, "instance"));

		return node;
	}

	private Question readQuestion(JsonObject obj, String name, String type) throws ApplicationException {

		Question q = Question.create(name, type, localisation);

		// Authored values override the defaults of the type
		q.control.putAll(getMap(obj, "control"));
		q.bind.putAll(getMap(obj, "bind"));
		if(q.variant == QuestionVariant.SELECT_ONE) {
			q.bind.put("type", XFormQuestionTypes.BIND_STRING);
		}

		q.parameters.putAll(getMap(obj, "parameters"));
		q.itemset = getString(obj, "itemset");
		q.choice_filter = getString(obj, "choice_filter");
		q.query = getString(obj, "query");
		q.trigger = getString(obj, "trigger");
		q.itemsetMultiLanguage = getBoolean(obj, "_itemset_multi_language");
		q.itemsetHasMedia = getBoolean(obj, "_itemset_has_media");
		q.itemsetDynLabel = getBoolean(obj, "_itemset_dyn_label");

		if(q.variant == QuestionVariant.OSM_UPLOAD) {
			readTags(obj, q, "tags");
			readTags(obj, q, "children");
		} else if(q.variant.isMultipleChoice()) {
			readOptions(obj, q, "choices");
			readOptions(obj, q, "children");
		} else if(obj.has("children") || obj.has("choices")) {
			log.info("Ignoring choices of question " + name + " of type " + type);
		}

		return q;
	}

	private void readOptions(JsonObject obj, SurveyNode parent, String key) {
		JsonArray options = getArray(obj, key);
		if(options != null) {
			for(JsonElement e : options) {
				JsonObject o = e.getAsJsonObject();
				Option option = new Option();
				option.name = getString(o, "name");
				option.label = getLabel(o, "label");
				parent.addChild(option);
			}
		}
	}

	private void readTags(JsonObject obj, Question q, String key) {
		JsonArray tags = getArray(obj, key);
		if(tags != null) {
			for(JsonElement e : tags) {
				JsonObject t = e.getAsJsonObject();
				Tag tag = new Tag();
				tag.name = getString(t, "name");
				tag.label = getLabel(t, "label");
				readOptions(t, tag, "choices");
				readOptions(t, tag, "children");
				q.addChild(tag);
			}
		}
	}

	/*
	 * A label is either a string or an object of language -> text
	 */
	private Label getLabel(JsonObject obj, String key) {
		Label l = new Label();
		JsonElement e = obj.get(key);
		if(e != null && !e.isJsonNull()) {
			if(e.isJsonObject()) {
				for(Map.Entry<String, JsonElement> entry : e.getAsJsonObject().entrySet()) {
					l.translations.put(entry.getKey(), entry.getValue().getAsString());
				}
			} else {
				l.text = e.getAsString();
			}
		}
		return l;
	}

	private LinkedHashMap<String, String> getMap(JsonObject obj, String key) {
		LinkedHashMap<String, String> map = new LinkedHashMap<> ();
		JsonElement e = obj.get(key);
		if(e != null && e.isJsonObject()) {
			for(Map.Entry<String, JsonElement> entry : e.getAsJsonObject().entrySet()) {
				if(!entry.getValue().isJsonNull()) {
					map.put(entry.getKey(), entry.getValue().getAsString());
				}
			}
		}
		return map;
	}

	private String getString(JsonObject obj, String key) {
		JsonElement e = obj.get(key);
		if(e == null || e.isJsonNull() || !e.isJsonPrimitive()) {
			return null;
		}
		return e.getAsString();
	}

	private boolean getBoolean(JsonObject obj, String key) {
		JsonElement e = obj.get(key);
		return e != null && e.isJsonPrimitive() && e.getAsBoolean();
	}

	private JsonArray getArray(JsonObject obj, String key) {
		JsonElement e = obj.get(key);
		if(e != null && e.isJsonArray()) {
			return e.getAsJsonArray();
		}
		return null;
	}
}
