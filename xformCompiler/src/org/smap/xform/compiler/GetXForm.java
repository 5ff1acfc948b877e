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

import java.io.StringWriter;
import java.io.Writer;
import java.util.Map;
import java.util.ResourceBundle;
import java.util.logging.Level;
import java.util.logging.Logger;

import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import javax.xml.transform.OutputKeys;
import javax.xml.transform.Result;
import javax.xml.transform.Transformer;
import javax.xml.transform.TransformerException;
import javax.xml.transform.TransformerFactory;
import javax.xml.transform.dom.DOMSource;
import javax.xml.transform.stream.StreamResult;

import org.smap.xform.Utilities.ApplicationException;
import org.smap.xform.Utilities.GeneralUtilityMethods;
import org.smap.xform.model.Question;
import org.smap.xform.model.Section;
import org.smap.xform.model.Survey;
import org.smap.xform.model.SurveyNode;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.Node;

/*
 * Return the body and primary instance of an XForm built from a survey definition
 *
 * The whole survey is compiled or, on the first error, nothing is returned
 */
public class GetXForm {

	private static Logger log = Logger.getLogger(GetXForm.class.getName());

	private ResourceBundle localisation;
	private QuestionControlCompiler controlCompiler;

	public GetXForm(ResourceBundle l) {
		this(l, new QuestionControlCompiler(l));
	}

	public GetXForm(ResourceBundle l, QuestionControlCompiler controlCompiler) {
		localisation = l;
		this.controlCompiler = controlCompiler;
	}

	/*
	 * Get the body of the XForm as a string
	 */
	public String get(Survey survey, boolean indent) throws ApplicationException {
		SurveyTemplate template = new SurveyTemplate(localisation);
		template.load(survey);
		return get(template, indent);
	}

	public String get(SurveyTemplate template, boolean indent) throws ApplicationException {
		try {
			Document outputXML = newDocument();
			Element body = outputXML.createElement("h:body");
			outputXML.appendChild(body);
			populateBody(outputXML, body, template);
			return toXml(outputXML, indent);
		} catch (ParserConfigurationException | TransformerException e) {
			log.log(Level.SEVERE, "Error: Failed to write the XForm for " + template.getSurvey().name, e);
			throw new ApplicationException(e.getMessage(), e);
		}
	}

	/*
	 * Get the primary instance as a string
	 */
	public String getInstance(SurveyTemplate template, boolean indent) throws ApplicationException {
		try {
			Document outputXML = newDocument();
			outputXML.appendChild(populateInstance(outputXML, template));
			return toXml(outputXML, indent);
		} catch (ParserConfigurationException | TransformerException e) {
			log.log(Level.SEVERE, "Error: Failed to write the instance for " + template.getSurvey().name, e);
			throw new ApplicationException(e.getMessage(), e);
		}
	}

	/*
	 * Add the controls of every question in the survey to the body
	 */
	public void populateBody(Document outputXML, Element parent, SurveyTemplate template) throws ApplicationException {
		Survey survey = template.getSurvey();
		survey.validate(localisation);
		populateSection(outputXML, parent, survey, template);
	}

	private void populateSection(Document outputXML, Element currentParent, SurveyNode section,
			SurveyTemplate template) throws ApplicationException {

		for(SurveyNode child : section.getChildren()) {
			if(child instanceof Section) {
				Section s = (Section) child;
				Element groupElement = outputXML.createElement("group");
				groupElement.setAttribute("ref", s.getXPath());
				for(Map.Entry<String, String> entry : s.control.entrySet()) {
					groupElement.setAttribute(entry.getKey(), template.insertXPaths(entry.getValue(), s));
				}
				if(s.hasLabel()) {
					groupElement.appendChild(s.xmlLabel(outputXML));
				}

				if(s.isRepeat()) {
					// The repeat is wrapped in a group that holds its label
					groupElement.removeAttribute("appearance");
					Element repeatElement = outputXML.createElement("repeat");
					repeatElement.setAttribute("nodeset", s.getXPath());
					String appearance = s.control.get("appearance");
					if(appearance != null) {
						repeatElement.setAttribute("appearance", appearance);
					}
					populateSection(outputXML, repeatElement, s, template);
					groupElement.appendChild(repeatElement);
				} else {
					populateSection(outputXML, groupElement, s, template);
				}
				currentParent.appendChild(groupElement);

			} else if(child instanceof Question) {
				Element questionElement = controlCompiler.xmlControl(outputXML, child, template);
				if(questionElement != null) {
					currentParent.appendChild(questionElement);
				}
			} else {
				log.info("Skipping " + child.name + " it is not a question or section");
			}
		}
	}

	/*
	 * Create the primary instance, <survey name><question name>default</question name>...</survey name>
	 */
	public Element populateInstance(Document outputXML, SurveyTemplate template) throws ApplicationException {
		Survey survey = template.getSurvey();
		Element root = outputXML.createElement(survey.name);
		if(survey.id_string != null) {
			root.setAttribute("id", survey.id_string);
		}
		populateInstanceSection(outputXML, root, survey, template);
		return root;
	}

	private void populateInstanceSection(Document outputXML, Element currentParent, SurveyNode section,
			SurveyTemplate template) throws ApplicationException {

		for(SurveyNode child : section.getChildren()) {
			if(child instanceof Section) {
				Element sectionElement = outputXML.createElement(child.name);
				if(((Section) child).isRepeat()) {
					sectionElement.setAttribute("jr:template", "");
				}
				populateInstanceSection(outputXML, sectionElement, child, template);
				currentParent.appendChild(sectionElement);
			} else if(child instanceof Question) {
				currentParent.appendChild(xmlInstance(outputXML, (Question) child, template));
			}
		}
	}

	/*
	 * The instance element of a question holds its default value unless the default has to be calculated
	 */
	public Element xmlInstance(Document outputXML, Question q, SurveyTemplate template) throws ApplicationException {
		Element questionElement = outputXML.createElement(q.name);
		for(Map.Entry<String, String> entry : q.instance.entrySet()) {
			questionElement.setAttribute(entry.getKey(), template.insertXPaths(entry.getValue(), q));
		}
		if(q.defaultValue != null && q.defaultValue.length() > 0
				&& !GeneralUtilityMethods.defaultIsDynamic(q.defaultValue, q.getBindType())) {
			questionElement.setTextContent(q.defaultValue);
		}
		return questionElement;
	}

	private Document newDocument() throws ParserConfigurationException {
		DocumentBuilderFactory dbf = DocumentBuilderFactory.newInstance();
		DocumentBuilder b = dbf.newDocumentBuilder();
		return b.newDocument();
	}

	/*
	 * Write a document or element to a string
	 */
	public static String toXml(Node node, boolean indent) throws TransformerException {
		Writer outWriter = new StringWriter();
		Result outStream = new StreamResult(outWriter);

		Transformer transformer = TransformerFactory.newInstance().newTransformer();
		transformer.setOutputProperty(OutputKeys.INDENT, indent ? "yes" : "no");
		transformer.setOutputProperty(OutputKeys.OMIT_XML_DECLARATION, "yes");
		transformer.setOutputProperty(OutputKeys.ENCODING, "UTF-8");
		transformer.setOutputProperty(OutputKeys.METHOD, "xml");

		transformer.transform(new DOMSource(node), outStream);
		return outWriter.toString();
	}
}
